package io.github.yok.flashsync.destination;

import java.util.Optional;

/**
 * A submitted bulk load.
 *
 * @author Yasuharu.Okawauchi
 */
public interface LoadJob {

    /**
     * Returns the destination-assigned job id.
     *
     * @return job id
     */
    String getId();

    /**
     * Checks whether the job has reached a terminal state.
     *
     * @return {@code true} once the job is done (successfully or not)
     * @throws DestinationException if the status cannot be fetched
     */
    boolean isDone() throws DestinationException;

    /**
     * Returns the failure reported by a finished job.
     *
     * @return error description, or empty if the job succeeded
     * @throws DestinationException if the status cannot be fetched
     */
    Optional<String> failure() throws DestinationException;

    /**
     * Requests cancellation. Best effort; the job may still complete.
     */
    void cancel();
}
