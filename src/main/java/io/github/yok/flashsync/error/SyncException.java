package io.github.yok.flashsync.error;

/**
 * Base class of the errors raised while synchronizing a table.
 *
 * @author Yasuharu.Okawauchi
 */
public class SyncException extends Exception {

    private static final long serialVersionUID = 1L;

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
