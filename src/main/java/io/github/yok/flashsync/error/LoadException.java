package io.github.yok.flashsync.error;

/**
 * A bulk load could not be submitted, could not be awaited, or reported a failure.
 *
 * @author Yasuharu.Okawauchi
 */
public class LoadException extends SyncException {

    private static final long serialVersionUID = 1L;

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
