package io.github.yok.flashsync.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Normalized value of one column in a {@link SyncRecord}.
 *
 * <p>
 * JDBC drivers hand out values typed as {@link Object}. This class tags each value with the kind
 * the JSON encoder will see, so the record model stays statically checkable.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldValue {

    /**
     * Value kinds.
     */
    public enum Kind {
        NULL,
        STRING,
        NUMBER,
        BOOLEAN,
        // Date/time already rendered with the configured format
        TEMPORAL,
        // Any other driver value, handed to the encoder unchanged
        RAW
    }

    private static final FieldValue NULL_VALUE = new FieldValue(Kind.NULL, null);

    @NonNull
    Kind kind;

    Object value;

    public static FieldValue ofNull() {
        return NULL_VALUE;
    }

    public static FieldValue ofString(@NonNull String value) {
        return new FieldValue(Kind.STRING, value);
    }

    public static FieldValue ofNumber(@NonNull Number value) {
        return new FieldValue(Kind.NUMBER, value);
    }

    public static FieldValue ofBoolean(boolean value) {
        return new FieldValue(Kind.BOOLEAN, value);
    }

    public static FieldValue ofTemporal(@NonNull String formatted) {
        return new FieldValue(Kind.TEMPORAL, formatted);
    }

    public static FieldValue ofRaw(@NonNull Object value) {
        return new FieldValue(Kind.RAW, value);
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }
}
