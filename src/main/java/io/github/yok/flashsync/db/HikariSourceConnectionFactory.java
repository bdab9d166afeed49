package io.github.yok.flashsync.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.flashsync.config.PoolConfig;
import io.github.yok.flashsync.error.ConnectionException;
import io.github.yok.flashsync.model.SourceDatabase;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link SourceConnectionFactory} backed by one HikariCP pool per handle.
 *
 * <p>
 * Pool limits come from {@link PoolConfig}: {@code max-open} becomes the maximum pool size and
 * {@code max-lifetime} the connection max lifetime (0 = unlimited). HikariCP has no idle cap, only
 * an idle floor that is filled eagerly, so {@code max-idle} only decides whether one connection is
 * kept warm ({@code max-idle > 0}) or none. Connections beyond that are opened on demand and
 * retired once idle.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HikariSourceConnectionFactory implements SourceConnectionFactory {

    private static final int WARM_CONNECTIONS = 1;

    private final PoolConfig poolConfig;

    @Override
    public SourceHandle open(SourceDatabase source, String poolName) throws ConnectionException {
        HikariConfig config = buildConfig(source, poolName);
        try {
            HikariDataSource dataSource = new HikariDataSource(config);
            log.debug("[{}] Opened connection pool {}", source.getName(), poolName);
            return new HikariSourceHandle(dataSource);
        } catch (RuntimeException e) {
            throw new ConnectionException(
                    "Failed to open connection pool for source " + source.getName(), e);
        }
    }

    HikariConfig buildConfig(SourceDatabase source, String poolName) {
        int maxOpen = poolConfig.maxOpenConnections();
        HikariConfig config = new HikariConfig();
        config.setPoolName(poolName);
        config.setJdbcUrl(source.getUrl());
        config.setUsername(source.getUser());
        config.setPassword(source.getPassword());
        config.setMaximumPoolSize(maxOpen);
        // a worker borrows a single connection; never pre-open more than that
        config.setMinimumIdle(Math.min(poolConfig.maxIdleConnections(), WARM_CONNECTIONS));
        Duration lifetime = poolConfig.maxLifetimeDuration();
        config.setMaxLifetime(lifetime.isZero() ? 0L : lifetime.toMillis());
        config.setReadOnly(true);
        // first connection attempt happens in getConnection(), not here
        config.setInitializationFailTimeout(-1);
        return config;
    }

    private static final class HikariSourceHandle implements SourceHandle {

        private final HikariDataSource dataSource;

        private HikariSourceHandle(HikariDataSource dataSource) {
            this.dataSource = dataSource;
        }

        @Override
        public Connection getConnection() throws SQLException {
            return dataSource.getConnection();
        }

        @Override
        public void close() {
            dataSource.close();
        }
    }
}
