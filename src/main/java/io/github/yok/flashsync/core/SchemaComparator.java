package io.github.yok.flashsync.core;

import io.github.yok.flashsync.model.InferredSchema;
import io.github.yok.flashsync.model.SchemaField;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares two schemas as unordered sets of (name, type).
 *
 * <p>
 * Field order and the required flag are ignored: the destination may list columns in a different
 * order, and tightening or relaxing nullability does not force a schema update. A field with a
 * {@code null} type (a destination type without a semantic counterpart) never matches.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SchemaComparator {

    private SchemaComparator() {}

    public static SchemaComparison compare(InferredSchema left, InferredSchema right) {
        List<String> differences = new ArrayList<>();
        collect(left, right, differences);
        collect(right, left, differences);
        return SchemaComparison.of(differences);
    }

    public static boolean isEqual(InferredSchema left, InferredSchema right) {
        return compare(left, right).isEqual();
    }

    private static void collect(InferredSchema from, InferredSchema to, List<String> out) {
        for (SchemaField field : from.getFields()) {
            Optional<SchemaField> other = to.field(field.getName());
            String entry;
            if (!other.isPresent()) {
                entry = "missing:" + field.getName();
            } else if (field.getType() == null || !Objects.equals(field.getType(),
                    other.get().getType())) {
                entry = "type:" + field.getName();
            } else {
                continue;
            }
            if (!out.contains(entry)) {
                out.add(entry);
            }
        }
    }
}
