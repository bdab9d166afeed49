package io.github.yok.flashsync.db;

import io.github.yok.flashsync.error.ConnectionException;
import io.github.yok.flashsync.model.SourceDatabase;

/**
 * Opens pooled handles to source databases.
 *
 * @author Yasuharu.Okawauchi
 */
public interface SourceConnectionFactory {

    /**
     * Opens a new, independent handle for one worker.
     *
     * @param source source database
     * @param poolName name of the pool, used in driver/pool logs
     * @return handle
     * @throws ConnectionException if the pool cannot be created
     */
    SourceHandle open(SourceDatabase source, String poolName) throws ConnectionException;
}
