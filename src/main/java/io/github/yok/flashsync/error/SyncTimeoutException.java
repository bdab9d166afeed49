package io.github.yok.flashsync.error;

import java.time.Duration;

/**
 * The run did not finish within its configured timeout.
 *
 * @author Yasuharu.Okawauchi
 */
public class SyncTimeoutException extends SyncException {

    private static final long serialVersionUID = 1L;

    public SyncTimeoutException(Duration timeout) {
        super("Sync run exceeded its timeout of " + timeout);
    }
}
