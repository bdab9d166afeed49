package io.github.yok.flashsync.error;

/**
 * The destination table could not be brought to the inferred schema.
 *
 * @author Yasuharu.Okawauchi
 */
public class ReconciliationException extends SyncException {

    private static final long serialVersionUID = 1L;

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
