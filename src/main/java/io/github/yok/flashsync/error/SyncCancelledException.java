package io.github.yok.flashsync.error;

/**
 * Thrown by a task that observed the cancellation of its run.
 *
 * <p>
 * The cause is the error that cancelled the run (a sibling task failure or a
 * {@link SyncTimeoutException}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SyncCancelledException extends SyncException {

    private static final long serialVersionUID = 1L;

    public SyncCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
