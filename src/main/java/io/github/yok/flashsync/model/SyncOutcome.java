package io.github.yok.flashsync.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Result of one sync task.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class SyncOutcome {

    /**
     * Terminal state of a task.
     */
    public enum Status {
        SUCCEEDED,
        FAILED,
        // Stopped because the run was cancelled by another task or by the run timeout
        CANCELLED
    }

    @NonNull
    SyncTask task;

    @NonNull
    Status status;

    long rowsExtracted;

    long rowsSkipped;

    // false when nothing was extracted or the task did not get that far
    boolean loaded;

    Throwable error;

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    /**
     * Creates a failed or cancelled outcome.
     *
     * @param task task
     * @param status {@link Status#FAILED} or {@link Status#CANCELLED}
     * @param error terminal error
     * @return outcome
     */
    public static SyncOutcome terminated(SyncTask task, Status status, Throwable error) {
        return SyncOutcome.builder().task(task).status(status).error(error).build();
    }
}
