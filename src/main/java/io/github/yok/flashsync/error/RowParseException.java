package io.github.yok.flashsync.error;

/**
 * A single row could not be read from the driver. Recovered by skipping the row.
 *
 * @author Yasuharu.Okawauchi
 */
public class RowParseException extends SyncException {

    private static final long serialVersionUID = 1L;

    public RowParseException(String message) {
        super(message);
    }

    public RowParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
