package io.github.yok.flashsync.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One (source, table) pair processed by exactly one worker during a run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SyncTask {

    @NonNull
    SourceDatabase source;

    @NonNull
    String tableName;

    /**
     * Query that reads the whole table.
     *
     * @return {@code SELECT * FROM <database>.<table>}
     */
    public String sourceQuery() {
        return "SELECT * FROM " + source.getDatabaseName() + "." + tableName;
    }

    /**
     * Query bounded to a single row, used to read column metadata.
     *
     * @return {@link #sourceQuery()} with {@code LIMIT 1}
     */
    public String sampleQuery() {
        return sourceQuery() + " LIMIT 1";
    }

    /**
     * Returns a short label for logs.
     *
     * @return {@code source.table}
     */
    public String label() {
        return source.getName() + "." + tableName;
    }
}
