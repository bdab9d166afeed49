package io.github.yok.flashsync.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One column of an {@link InferredSchema}.
 *
 * <p>
 * {@code type} is {@code null} only for fields read back from a destination table whose column
 * type has no semantic counterpart. Such a field never equals an inferred one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SchemaField {

    @NonNull
    String name;

    SemanticType type;

    boolean required;

    /**
     * Creates a nullable field.
     *
     * @param name column name
     * @param type semantic type
     * @return field
     */
    public static SchemaField nullable(String name, SemanticType type) {
        return new SchemaField(name, type, false);
    }

    /**
     * Creates a required (non-null) field.
     *
     * @param name column name
     * @param type semantic type
     * @return field
     */
    public static SchemaField required(String name, SemanticType type) {
        return new SchemaField(name, type, true);
    }
}
