package io.github.yok.flashsync.destination.bigquery;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.FormatOptions;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableDataWriteChannel;
import com.google.cloud.bigquery.TableDefinition;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import com.google.cloud.bigquery.WriteChannelConfiguration;
import io.github.yok.flashsync.destination.DestinationClient;
import io.github.yok.flashsync.destination.DestinationException;
import io.github.yok.flashsync.destination.LoadJob;
import io.github.yok.flashsync.destination.SchemaUpdateException;
import io.github.yok.flashsync.destination.TableState;
import io.github.yok.flashsync.model.DestinationTableSpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link DestinationClient} backed by the BigQuery API.
 *
 * <p>
 * Tables live in a single dataset. Loads are newline-delimited JSON submitted through a
 * resumable upload with {@code WRITE_TRUNCATE}, so every successful load replaces the whole
 * table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BigQueryDestinationClient implements DestinationClient {

    private final BigQuery bigQuery;
    private final String projectId;
    private final String datasetId;
    // Job location; null lets BigQuery pick the dataset's location
    private final String location;

    public BigQueryDestinationClient(BigQuery bigQuery, String projectId, String datasetId,
            String location) {
        this.bigQuery = bigQuery;
        this.projectId = projectId;
        this.datasetId = datasetId;
        this.location = StringUtils.trimToNull(location);
    }

    @Override
    public String getDataset() {
        return projectId + "." + datasetId;
    }

    @Override
    public Optional<TableState> describeTable(String tableName) throws DestinationException {
        Table table;
        try {
            table = bigQuery.getTable(tableId(tableName));
        } catch (BigQueryException e) {
            throw new DestinationException("Failed to read metadata of table " + qualify(tableName),
                    e);
        }
        if (table == null) {
            return Optional.empty();
        }
        TableDefinition definition = table.getDefinition();
        return Optional.of(new TableState(tableName, BigQuerySchemaConverter
                .fromBigQuery(definition == null ? null : definition.getSchema())));
    }

    @Override
    public void createTable(DestinationTableSpec spec) throws DestinationException {
        try {
            bigQuery.create(tableInfo(spec));
            log.info("Created table {}", qualify(spec.getTableName()));
        } catch (BigQueryException e) {
            throw new DestinationException("Failed to create table " + qualify(spec.getTableName()),
                    e);
        }
    }

    @Override
    public void updateSchema(DestinationTableSpec spec) throws SchemaUpdateException {
        try {
            bigQuery.update(tableInfo(spec));
            log.info("Updated schema of table {}", qualify(spec.getTableName()));
        } catch (BigQueryException e) {
            throw new SchemaUpdateException(
                    "Failed to update schema of table " + qualify(spec.getTableName()), e,
                    UpdateFailureClassifier.isCritical(e));
        }
    }

    @Override
    public void deleteTable(String tableName) throws DestinationException {
        boolean deleted;
        try {
            deleted = bigQuery.delete(tableId(tableName));
        } catch (BigQueryException e) {
            throw new DestinationException("Failed to delete table " + qualify(tableName), e);
        }
        if (!deleted) {
            log.warn("Table {} was already gone when deleting", qualify(tableName));
        }
    }

    @Override
    public LoadJob submitTruncatingLoad(String tableName, byte[] payload)
            throws DestinationException {
        WriteChannelConfiguration configuration =
                WriteChannelConfiguration.newBuilder(tableId(tableName))
                        .setFormatOptions(FormatOptions.json())
                        .setWriteDisposition(JobInfo.WriteDisposition.WRITE_TRUNCATE).build();
        JobId jobId = JobId.newBuilder().setRandomJob().setProject(projectId)
                .setLocation(location).build();
        TableDataWriteChannel writer;
        try {
            writer = bigQuery.writer(jobId, configuration);
        } catch (BigQueryException e) {
            throw new DestinationException("Failed to open load into " + qualify(tableName), e);
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(payload);
            while (buffer.hasRemaining()) {
                writer.write(buffer);
            }
            writer.close();
        } catch (IOException | BigQueryException e) {
            throw new DestinationException("Failed to upload load data for " + qualify(tableName),
                    e);
        }
        Job job = writer.getJob();
        if (job == null) {
            throw new DestinationException("No load job was created for " + qualify(tableName));
        }
        log.info("Submitted load job {} into {} ({} bytes)", job.getJobId().getJob(),
                qualify(tableName), payload.length);
        return new BigQueryLoadJob(job);
    }

    @Override
    public void close() {
        // the BigQuery service object holds no resources that need releasing
    }

    private TableId tableId(String tableName) {
        return TableId.of(projectId, datasetId, tableName);
    }

    private TableInfo tableInfo(DestinationTableSpec spec) {
        return TableInfo.of(tableId(spec.getTableName()),
                StandardTableDefinition.of(BigQuerySchemaConverter.toBigQuery(spec.getSchema())));
    }

    private String qualify(String tableName) {
        return getDataset() + "." + tableName;
    }
}
