package io.github.yok.flashsync.core;

import io.github.yok.flashsync.db.SourceConnectionFactory;
import io.github.yok.flashsync.db.SourceHandle;
import io.github.yok.flashsync.error.ConnectionException;
import io.github.yok.flashsync.error.SyncException;
import io.github.yok.flashsync.model.DestinationTableSpec;
import io.github.yok.flashsync.model.ExtractionJob;
import io.github.yok.flashsync.model.InferredSchema;
import io.github.yok.flashsync.model.SyncOutcome;
import io.github.yok.flashsync.model.SyncTask;
import java.sql.Connection;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Syncs one source table: infer, reconcile, extract and load.
 *
 * <p>
 * Every call opens its own connection pool and closes it before returning, so concurrent calls
 * share nothing on the source side.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class TableSyncWorker {

    static final String MDC_SOURCE = "source";
    static final String MDC_TABLE = "table";

    private final SourceConnectionFactory connectionFactory;
    private final SchemaInferencer schemaInferencer;
    private final TableReconciler tableReconciler;
    private final ExtractLoadExecutor executor;

    /**
     * Runs the task to completion.
     *
     * @param context run scope
     * @param task source and table
     * @return successful outcome
     * @throws SyncException if any step fails or the run is cancelled
     */
    public SyncOutcome sync(RunContext context, SyncTask task) throws SyncException {
        MDC.put(MDC_SOURCE, task.getSource().getName());
        MDC.put(MDC_TABLE, task.getTableName());
        try {
            context.checkCancelled("opening source " + task.getSource().getName());
            log.info("Sync started: {}", task.label());
            try (SourceHandle handle =
                    connectionFactory.open(task.getSource(), "sync-" + task.getTableName());
                    Connection connection = connect(handle, task)) {
                InferredSchema schema =
                        schemaInferencer.infer(connection, task.sampleQuery(), context);
                log.info("Inferred schema with {} columns: {}", schema.size(),
                        schema.columnNames());

                context.checkCancelled("reconciliation");
                TableReconciler.Action action = tableReconciler
                        .reconcile(new DestinationTableSpec(task.getTableName(), schema));
                log.info("Reconciliation result: {}", action);

                SyncOutcome outcome =
                        executor.execute(context, task, connection, ExtractionJob.forTask(task));
                log.info("Sync finished: {} (rows={}, skipped={})", task.label(),
                        outcome.getRowsExtracted(), outcome.getRowsSkipped());
                return outcome;
            } catch (SQLException e) {
                // only Connection.close() can get here
                throw new ConnectionException(
                        "Failed to release connection to source " + task.getSource().getName(), e);
            }
        } finally {
            MDC.remove(MDC_TABLE);
            MDC.remove(MDC_SOURCE);
        }
    }

    private static Connection connect(SourceHandle handle, SyncTask task)
            throws ConnectionException {
        try {
            return handle.getConnection();
        } catch (SQLException e) {
            throw new ConnectionException(
                    "Failed to connect to source " + task.getSource().getName(), e);
        }
    }
}
