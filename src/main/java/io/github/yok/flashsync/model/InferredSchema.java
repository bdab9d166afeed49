package io.github.yok.flashsync.model;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Ordered list of {@link SchemaField}s derived from a live query.
 *
 * <p>
 * Column names are unique within a schema. Field order is kept for table creation but is not
 * significant when two schemas are compared (see
 * {@link io.github.yok.flashsync.core.SchemaComparator}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class InferredSchema {

    private final ImmutableList<SchemaField> fields;

    /**
     * Creates a schema from the given fields.
     *
     * @param fields fields in column order
     * @throws IllegalArgumentException if two fields share a name
     */
    public InferredSchema(List<SchemaField> fields) {
        Set<String> seen = new HashSet<>();
        for (SchemaField field : fields) {
            if (!seen.add(field.getName())) {
                throw new IllegalArgumentException("Duplicate column name: " + field.getName());
            }
        }
        this.fields = ImmutableList.copyOf(fields);
    }

    /**
     * Convenience factory.
     *
     * @param fields fields in column order
     * @return schema
     */
    public static InferredSchema of(SchemaField... fields) {
        return new InferredSchema(ImmutableList.copyOf(fields));
    }

    public int size() {
        return fields.size();
    }

    /**
     * Looks up a field by its exact name.
     *
     * @param name column name
     * @return the field, or empty if the schema has no such column
     */
    public Optional<SchemaField> field(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    /**
     * Returns the column names in schema order.
     *
     * @return column names
     */
    public List<String> columnNames() {
        return fields.stream().map(SchemaField::getName).collect(ImmutableList.toImmutableList());
    }
}
