package io.github.yok.flashsync.destination;

import io.github.yok.flashsync.model.DestinationTableSpec;
import java.util.Optional;

/**
 * Handle to the destination dataset.
 *
 * <p>
 * One client is shared by all workers of a run; implementations must be safe for concurrent
 * use.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DestinationClient extends AutoCloseable {

    /**
     * Returns the dataset this client writes to.
     *
     * @return dataset identifier
     */
    String getDataset();

    /**
     * Reads the current state of a table.
     *
     * @param tableName table name
     * @return state, or empty if the table does not exist
     * @throws DestinationException if the lookup fails for another reason
     */
    Optional<TableState> describeTable(String tableName) throws DestinationException;

    /**
     * Creates a table with the given schema.
     *
     * @param spec table name and schema
     * @throws DestinationException if the table cannot be created
     */
    void createTable(DestinationTableSpec spec) throws DestinationException;

    /**
     * Replaces the schema of an existing table in place.
     *
     * @param spec table name and new schema
     * @throws SchemaUpdateException if the destination refuses the update
     */
    void updateSchema(DestinationTableSpec spec) throws SchemaUpdateException;

    /**
     * Deletes a table and all of its rows.
     *
     * @param tableName table name
     * @throws DestinationException if the table cannot be deleted
     */
    void deleteTable(String tableName) throws DestinationException;

    /**
     * Submits a bulk load that replaces the entire contents of the table with the given
     * newline-delimited JSON payload.
     *
     * @param tableName table name
     * @param payload JSON-lines data, one object per line
     * @return submitted job
     * @throws DestinationException if the load cannot be submitted
     */
    LoadJob submitTruncatingLoad(String tableName, byte[] payload) throws DestinationException;

    @Override
    void close();
}
