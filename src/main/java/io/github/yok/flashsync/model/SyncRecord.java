package io.github.yok.flashsync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * One parsed source row: column name to {@link FieldValue}, in column order.
 *
 * <p>
 * The key set always equals the column set of the query that produced the row. A SQL
 * {@code NULL} is stored as {@link FieldValue#ofNull()}, never as a missing key.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
@ToString
public final class SyncRecord {

    private final Map<String, FieldValue> values;

    private SyncRecord(Map<String, FieldValue> values) {
        this.values = values;
    }

    /**
     * Builds a record from parallel column/value lists.
     *
     * @param columns column names
     * @param fieldValues values, same size and order as {@code columns}
     * @return record
     * @throws IllegalArgumentException if the lists differ in size
     */
    public static SyncRecord of(List<String> columns, List<FieldValue> fieldValues) {
        if (columns.size() != fieldValues.size()) {
            throw new IllegalArgumentException("Column count " + columns.size()
                    + " does not match value count " + fieldValues.size());
        }
        Map<String, FieldValue> map = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            FieldValue v = fieldValues.get(i);
            map.put(columns.get(i), v == null ? FieldValue.ofNull() : v);
        }
        return new SyncRecord(Collections.unmodifiableMap(map));
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public FieldValue get(String column) {
        return values.get(column);
    }

    public int size() {
        return values.size();
    }

    /**
     * Converts the record into the plain map handed to the JSON encoder.
     *
     * <p>
     * NULL entries become {@code null} values (the key is kept).
     * </p>
     *
     * @return insertion-ordered map
     */
    public Map<String, Object> toSaveable() {
        Map<String, Object> result = new LinkedHashMap<>();
        values.forEach((column, v) -> result.put(column, v.getValue()));
        return result;
    }
}
