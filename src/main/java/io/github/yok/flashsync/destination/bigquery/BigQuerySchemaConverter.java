package io.github.yok.flashsync.destination.bigquery;

import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.LegacySQLTypeName;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardSQLTypeName;
import io.github.yok.flashsync.model.InferredSchema;
import io.github.yok.flashsync.model.SchemaField;
import io.github.yok.flashsync.model.SemanticType;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between {@link InferredSchema} and BigQuery {@link Schema}.
 *
 * @author Yasuharu.Okawauchi
 */
final class BigQuerySchemaConverter {

    private BigQuerySchemaConverter() {}

    static Schema toBigQuery(InferredSchema schema) {
        List<Field> fields = new ArrayList<>(schema.size());
        for (SchemaField f : schema.getFields()) {
            fields.add(Field.newBuilder(f.getName(), toLegacyType(f.getType()))
                    .setMode(f.isRequired() ? Field.Mode.REQUIRED : Field.Mode.NULLABLE)
                    .build());
        }
        return Schema.of(fields);
    }

    /**
     * Reads a table schema back.
     *
     * <p>
     * Columns of types outside the six semantic types (NUMERIC, DATETIME, RECORD, ...) get a
     * {@code null} type so that they never compare equal to an inferred field.
     * </p>
     *
     * @param schema BigQuery schema; {@code null} for a table without one
     * @return schema in the pipeline's model
     */
    static InferredSchema fromBigQuery(Schema schema) {
        List<SchemaField> fields = new ArrayList<>();
        if (schema != null) {
            for (Field f : schema.getFields()) {
                fields.add(new SchemaField(f.getName(), toSemanticType(f.getType()),
                        f.getMode() == Field.Mode.REQUIRED));
            }
        }
        return new InferredSchema(fields);
    }

    static LegacySQLTypeName toLegacyType(SemanticType type) {
        switch (type) {
            case INTEGER:
                return LegacySQLTypeName.INTEGER;
            case FLOAT:
                return LegacySQLTypeName.FLOAT;
            case DATE:
                return LegacySQLTypeName.DATE;
            case TIMESTAMP:
                return LegacySQLTypeName.TIMESTAMP;
            case BOOLEAN:
                return LegacySQLTypeName.BOOLEAN;
            default:
                return LegacySQLTypeName.STRING;
        }
    }

    static SemanticType toSemanticType(LegacySQLTypeName type) {
        if (type == null) {
            return null;
        }
        StandardSQLTypeName standard = type.getStandardType();
        if (standard == null) {
            return null;
        }
        switch (standard) {
            case STRING:
                return SemanticType.STRING;
            case INT64:
                return SemanticType.INTEGER;
            case FLOAT64:
                return SemanticType.FLOAT;
            case DATE:
                return SemanticType.DATE;
            case TIMESTAMP:
                return SemanticType.TIMESTAMP;
            case BOOL:
                return SemanticType.BOOLEAN;
            default:
                return null;
        }
    }
}
