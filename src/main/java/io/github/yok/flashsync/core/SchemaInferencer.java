package io.github.yok.flashsync.core;

import io.github.yok.flashsync.db.MySqlTypeMapper;
import io.github.yok.flashsync.error.SchemaInferenceException;
import io.github.yok.flashsync.error.SyncCancelledException;
import io.github.yok.flashsync.model.InferredSchema;
import io.github.yok.flashsync.model.SchemaField;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives a table schema from the column metadata of a live query.
 *
 * <p>
 * Column names are the result-set labels. A column is required only when the driver reports it
 * as {@link ResultSetMetaData#columnNoNulls}; nullable and unknown nullability both yield a
 * nullable field. Type names go through {@link MySqlTypeMapper}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaInferencer {

    /**
     * Runs the sample query and reads its metadata.
     *
     * @param connection source connection
     * @param sampleQuery query bounded to at most one row
     * @param context run scope
     * @return schema in result-set column order
     * @throws SchemaInferenceException if the query fails or the metadata cannot be read
     * @throws SyncCancelledException if the run is cancelled
     */
    public InferredSchema infer(Connection connection, String sampleQuery, RunContext context)
            throws SchemaInferenceException, SyncCancelledException {
        context.checkCancelled("schema inference");
        try (Statement statement = connection.createStatement();
                StatementGuard guard = StatementGuard.bind(statement, context);
                ResultSet rs = statement.executeQuery(sampleQuery)) {
            InferredSchema schema = fromMetaData(rs.getMetaData());
            log.debug("Inferred {} columns from [{}]", schema.size(), sampleQuery);
            return schema;
        } catch (SQLException e) {
            context.checkCancelled("schema inference");
            throw new SchemaInferenceException("Failed to infer schema from query: " + sampleQuery,
                    e);
        }
    }

    InferredSchema fromMetaData(ResultSetMetaData meta)
            throws SQLException, SchemaInferenceException {
        int count = meta.getColumnCount();
        List<SchemaField> fields = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            String name = meta.getColumnLabel(i);
            boolean required = meta.isNullable(i) == ResultSetMetaData.columnNoNulls;
            fields.add(new SchemaField(name,
                    MySqlTypeMapper.toSemanticType(meta.getColumnTypeName(i)), required));
        }
        try {
            return new InferredSchema(fields);
        } catch (IllegalArgumentException e) {
            throw new SchemaInferenceException(e.getMessage(), e);
        }
    }
}
