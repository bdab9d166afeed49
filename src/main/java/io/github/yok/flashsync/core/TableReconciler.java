package io.github.yok.flashsync.core;

import io.github.yok.flashsync.destination.DestinationClient;
import io.github.yok.flashsync.destination.DestinationException;
import io.github.yok.flashsync.destination.SchemaUpdateException;
import io.github.yok.flashsync.destination.TableState;
import io.github.yok.flashsync.error.ReconciliationException;
import io.github.yok.flashsync.model.DestinationTableSpec;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Brings a destination table to the inferred schema.
 *
 * <ul>
 * <li>Table absent: create it.</li>
 * <li>Schema equal as an unordered (name, type) set: nothing to do.</li>
 * <li>Schema differs: update in place. When the destination refuses the update as a breaking
 * change (critical), the table is deleted and recreated. Its rows are lost, which the following
 * truncating load would replace anyway.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class TableReconciler {

    /**
     * Marks log events for operations that destroy destination data.
     */
    public static final Marker DESTRUCTIVE = MarkerFactory.getMarker("DESTRUCTIVE");

    /**
     * What {@link #reconcile(DestinationTableSpec)} did.
     */
    public enum Action {
        CREATED,
        UNCHANGED,
        UPDATED,
        RECREATED
    }

    private final DestinationClient destination;

    /**
     * Reconciles one table.
     *
     * @param spec table name and inferred schema
     * @return action taken
     * @throws ReconciliationException if the table cannot be brought to the schema
     */
    public Action reconcile(DestinationTableSpec spec) throws ReconciliationException {
        String table = spec.getTableName();
        Optional<TableState> current;
        try {
            current = destination.describeTable(table);
        } catch (DestinationException e) {
            throw new ReconciliationException("Failed to inspect destination table " + table, e);
        }

        if (!current.isPresent()) {
            create(spec, "Failed to create destination table " + table);
            log.info("Table[{}] created with {} columns", table, spec.getSchema().size());
            return Action.CREATED;
        }

        SchemaComparison comparison =
                SchemaComparator.compare(spec.getSchema(), current.get().getSchema());
        if (comparison.isEqual()) {
            log.debug("Table[{}] schema unchanged", table);
            return Action.UNCHANGED;
        }
        log.info("Table[{}] schema differs: {}", table, comparison.getDifferences());

        try {
            destination.updateSchema(spec);
            log.info("Table[{}] schema updated in place", table);
            return Action.UPDATED;
        } catch (SchemaUpdateException e) {
            if (!e.isCritical()) {
                throw new ReconciliationException("Failed to update schema of table " + table, e);
            }
            log.error("Table[{}] schema update refused as a breaking change: {}", table,
                    e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        }

        log.warn(DESTRUCTIVE, "Table[{}] will be deleted and recreated; existing rows are lost",
                table);
        try {
            destination.deleteTable(table);
        } catch (DestinationException e) {
            throw new ReconciliationException("Failed to delete destination table " + table, e);
        }
        create(spec, "Failed to recreate destination table " + table);
        log.info("Table[{}] recreated with {} columns", table, spec.getSchema().size());
        return Action.RECREATED;
    }

    private void create(DestinationTableSpec spec, String failureMessage)
            throws ReconciliationException {
        try {
            destination.createTable(spec);
        } catch (DestinationException e) {
            throw new ReconciliationException(failureMessage, e);
        }
    }
}
