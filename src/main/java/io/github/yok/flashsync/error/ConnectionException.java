package io.github.yok.flashsync.error;

/**
 * A source or destination handle could not be opened or used.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConnectionException extends SyncException {

    private static final long serialVersionUID = 1L;

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
