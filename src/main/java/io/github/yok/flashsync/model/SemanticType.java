package io.github.yok.flashsync.model;

/**
 * Abstract column types used to compare a source schema with a destination schema.
 *
 * <p>
 * The set is closed. Source-side type names that are not recognized are mapped to
 * {@link #STRING}; they never cause an error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum SemanticType {
    STRING,
    INTEGER,
    FLOAT,
    DATE,
    TIMESTAMP,
    BOOLEAN
}
