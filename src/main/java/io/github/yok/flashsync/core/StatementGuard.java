package io.github.yok.flashsync.core;

import java.sql.SQLException;
import java.sql.Statement;
import lombok.extern.slf4j.Slf4j;

/**
 * Ties a JDBC statement to a {@link RunContext}: the query timeout is bounded by the time left in
 * the run, and cancelling the run calls {@link Statement#cancel()}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
final class StatementGuard implements AutoCloseable {

    private final RunContext.Registration registration;

    private StatementGuard(RunContext.Registration registration) {
        this.registration = registration;
    }

    static StatementGuard bind(Statement statement, RunContext context) throws SQLException {
        long seconds = context.remaining().getSeconds();
        // 0 means "no limit" to JDBC
        statement.setQueryTimeout((int) Math.max(1L, Math.min(seconds, Integer.MAX_VALUE)));
        return new StatementGuard(context.onCancel(() -> {
            try {
                statement.cancel();
            } catch (SQLException e) {
                log.warn("Failed to cancel running statement: {}", e.getMessage());
            }
        }));
    }

    @Override
    public void close() {
        registration.close();
    }
}
