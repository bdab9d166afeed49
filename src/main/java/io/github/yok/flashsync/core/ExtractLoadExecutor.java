package io.github.yok.flashsync.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.flashsync.destination.DestinationClient;
import io.github.yok.flashsync.destination.DestinationException;
import io.github.yok.flashsync.destination.LoadJob;
import io.github.yok.flashsync.error.ExtractionException;
import io.github.yok.flashsync.error.LoadException;
import io.github.yok.flashsync.error.RowParseException;
import io.github.yok.flashsync.error.SyncCancelledException;
import io.github.yok.flashsync.error.SyncException;
import io.github.yok.flashsync.model.ExtractionJob;
import io.github.yok.flashsync.model.SyncOutcome;
import io.github.yok.flashsync.model.SyncRecord;
import io.github.yok.flashsync.model.SyncTask;
import io.github.yok.flashsync.parser.RowParser;
import java.io.ByteArrayOutputStream;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Extracts the full result of a query into an in-memory JSON-lines buffer and replaces the
 * destination table with it.
 *
 * <p>
 * A row that fails to parse is skipped and counted. Any other failure (query, cursor, encoding,
 * load) ends the task. When no row was extracted nothing is loaded and the destination table is
 * left untouched.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ExtractLoadExecutor {

    private final DestinationClient destination;
    private final RowParser rowParser;
    private final ObjectMapper objectMapper;
    private final Duration pollInterval;

    public ExtractLoadExecutor(DestinationClient destination, RowParser rowParser,
            ObjectMapper objectMapper, Duration pollInterval) {
        this.destination = destination;
        this.rowParser = rowParser;
        this.objectMapper = objectMapper;
        this.pollInterval = pollInterval;
    }

    /**
     * Runs one extract-and-load cycle.
     *
     * @param context run scope
     * @param task task being synced
     * @param connection source connection
     * @param job query and destination table
     * @return successful outcome with row counts
     * @throws SyncException on a fatal extraction or load failure, or on cancellation
     */
    public SyncOutcome execute(RunContext context, SyncTask task, Connection connection,
            ExtractionJob job) throws SyncException {
        context.checkCancelled("extraction");
        log.info("Executing query for job {}", job.getName());

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        long extracted = 0;
        long skipped = 0;
        try (Statement statement = connection.createStatement();
                StatementGuard guard = StatementGuard.bind(statement, context)) {
            // Connector/J streams rows one at a time with this fetch size
            statement.setFetchSize(Integer.MIN_VALUE);
            ResultSet rs;
            try {
                rs = statement.executeQuery(job.getQuery());
            } catch (SQLException e) {
                context.checkCancelled("extraction");
                throw new ExtractionException("Failed to query source: " + job.getQuery(), e);
            }
            try (ResultSet rows = rs) {
                List<String> columns = columnLabels(rows.getMetaData());
                long rowNumber = 0;
                while (nextRow(rows, context)) {
                    rowNumber++;
                    SyncRecord record;
                    try {
                        record = rowParser.parse(rows, columns);
                    } catch (RowParseException e) {
                        log.error("Failed to parse row {}: {}", rowNumber, e.getMessage(), e);
                        skipped++;
                        continue;
                    }
                    append(buffer, record, rowNumber);
                    extracted++;
                }
            }
        } catch (SQLException e) {
            context.checkCancelled("extraction");
            throw new ExtractionException("Failed to read rows of " + job.getQuery(), e);
        }

        log.info("Extraction complete: rows_extracted={}, rows_skipped={}", extracted, skipped);
        if (skipped > 0) {
            log.warn("{} row(s) were skipped during parsing", skipped);
        }
        if (extracted == 0) {
            log.info("No rows to load; table {} left unchanged", job.getDestinationTable());
            return SyncOutcome.builder().task(task).status(SyncOutcome.Status.SUCCEEDED)
                    .rowsExtracted(0).rowsSkipped(skipped).loaded(false).build();
        }

        load(context, job.getDestinationTable(), buffer.toByteArray());
        return SyncOutcome.builder().task(task).status(SyncOutcome.Status.SUCCEEDED)
                .rowsExtracted(extracted).rowsSkipped(skipped).loaded(true).build();
    }

    void load(RunContext context, String table, byte[] payload)
            throws LoadException, SyncCancelledException {
        context.checkCancelled("load");
        LoadJob loadJob;
        try {
            loadJob = destination.submitTruncatingLoad(table, payload);
        } catch (DestinationException e) {
            throw new LoadException("Failed to create load job for table " + table, e);
        }
        log.info("Load job {} started for table {}", loadJob.getId(), table);

        try {
            while (!loadJob.isDone()) {
                if (context.await(pollInterval)) {
                    loadJob.cancel();
                    context.checkCancelled("load job " + loadJob.getId() + " completed");
                }
            }
        } catch (DestinationException e) {
            throw new LoadException("Failed to wait for load job " + loadJob.getId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loadJob.cancel();
            throw new LoadException("Interrupted while waiting for load job " + loadJob.getId(),
                    e);
        }

        Optional<String> failure;
        try {
            failure = loadJob.failure();
        } catch (DestinationException e) {
            throw new LoadException("Failed to read result of load job " + loadJob.getId(), e);
        }
        if (failure.isPresent()) {
            throw new LoadException(
                    "Load job " + loadJob.getId() + " for table " + table + " failed: "
                            + failure.get());
        }
        log.info("Load job {} completed for table {}", loadJob.getId(), table);
    }

    private void append(ByteArrayOutputStream buffer, SyncRecord record, long rowNumber)
            throws ExtractionException {
        try {
            buffer.writeBytes(objectMapper.writeValueAsBytes(record.toSaveable()));
            buffer.write('\n');
        } catch (JsonProcessingException e) {
            log.error("Failed to encode row {}: {}", rowNumber, e.getMessage());
            throw new ExtractionException("Failed to encode row " + rowNumber, e);
        }
    }

    private static boolean nextRow(ResultSet rows, RunContext context)
            throws SQLException, SyncCancelledException {
        context.checkCancelled("reading the next row");
        return rows.next();
    }

    private static List<String> columnLabels(ResultSetMetaData meta) throws SQLException {
        int count = meta.getColumnCount();
        List<String> labels = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            labels.add(meta.getColumnLabel(i));
        }
        return labels;
    }
}
