package io.github.yok.flashsync.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A worker's own pooled handle to a source database.
 *
 * <p>
 * Handles are never shared between workers. Closing the handle closes its pool.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface SourceHandle extends AutoCloseable {

    /**
     * Borrows a connection from the pool.
     *
     * @return connection; the caller closes it
     * @throws SQLException if no connection can be obtained
     */
    Connection getConnection() throws SQLException;

    @Override
    void close();
}
