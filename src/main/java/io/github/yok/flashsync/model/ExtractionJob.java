package io.github.yok.flashsync.model;

import lombok.NonNull;
import lombok.Value;

/**
 * What one extract-and-load cycle reads and where it writes.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ExtractionJob {

    @NonNull
    String name;

    @NonNull
    String query;

    // Destination table; same name as the source table
    @NonNull
    String destinationTable;

    /**
     * Builds the job for a sync task.
     *
     * @param task task
     * @return job reading the full source table into the table of the same name
     */
    public static ExtractionJob forTask(SyncTask task) {
        return new ExtractionJob(task.getTableName(), task.sourceQuery(), task.getTableName());
    }
}
