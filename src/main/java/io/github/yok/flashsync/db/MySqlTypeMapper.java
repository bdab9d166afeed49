package io.github.yok.flashsync.db;

import com.google.common.collect.ImmutableMap;
import io.github.yok.flashsync.model.SemanticType;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps MySQL column type names, as reported by {@link java.sql.ResultSetMetaData}, to
 * {@link SemanticType}s.
 *
 * <p>
 * The mapping is total: any name outside the lookup table maps to {@link SemanticType#STRING}
 * (logged at WARN).
 * </p>
 *
 * <p>
 * MySQL stores {@code BOOLEAN} as {@code TINYINT(1)}. Connector/J reports that column as
 * {@code BOOLEAN} with {@code transformedBitIsBoolean=true} and as {@code BIT} without it, so both
 * names map to {@link SemanticType#BOOLEAN}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class MySqlTypeMapper {

    private static final Map<String, SemanticType> TYPES = ImmutableMap.<String, SemanticType>builder()
            .put("VARCHAR", SemanticType.STRING)
            .put("CHAR", SemanticType.STRING)
            .put("TEXT", SemanticType.STRING)
            .put("TINYTEXT", SemanticType.STRING)
            .put("MEDIUMTEXT", SemanticType.STRING)
            .put("LONGTEXT", SemanticType.STRING)
            .put("INT", SemanticType.INTEGER)
            .put("TINYINT", SemanticType.INTEGER)
            .put("SMALLINT", SemanticType.INTEGER)
            .put("MEDIUMINT", SemanticType.INTEGER)
            .put("BIGINT", SemanticType.INTEGER)
            .put("FLOAT", SemanticType.FLOAT)
            .put("DOUBLE", SemanticType.FLOAT)
            .put("DECIMAL", SemanticType.FLOAT)
            .put("DATE", SemanticType.DATE)
            .put("DATETIME", SemanticType.TIMESTAMP)
            .put("TIMESTAMP", SemanticType.TIMESTAMP)
            .put("BOOLEAN", SemanticType.BOOLEAN)
            .put("BOOL", SemanticType.BOOLEAN)
            .put("BIT", SemanticType.BOOLEAN)
            .build();

    private MySqlTypeMapper() {}

    /**
     * Maps a native type name.
     *
     * <p>
     * The name is matched case-insensitively after removing a parenthesized suffix
     * ({@code VARCHAR(50)}) and the {@code UNSIGNED}/{@code ZEROFILL} attributes
     * ({@code INT UNSIGNED}).
     * </p>
     *
     * @param nativeType type name from the driver; may be {@code null}
     * @return semantic type, {@link SemanticType#STRING} when unknown
     */
    public static SemanticType toSemanticType(String nativeType) {
        SemanticType type = TYPES.get(normalize(nativeType));
        if (type == null) {
            log.warn("Unknown MySQL type '{}', defaulting to STRING", nativeType);
            return SemanticType.STRING;
        }
        return type;
    }

    static String normalize(String nativeType) {
        if (nativeType == null) {
            return "";
        }
        String t = nativeType;
        int paren = t.indexOf('(');
        if (paren >= 0) {
            t = t.substring(0, paren);
        }
        t = t.toUpperCase(Locale.ROOT).trim();
        for (String attribute : new String[] {" ZEROFILL", " UNSIGNED"}) {
            if (t.endsWith(attribute)) {
                t = t.substring(0, t.length() - attribute.length()).trim();
            }
        }
        return t;
    }
}
