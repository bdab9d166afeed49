package io.github.yok.flashsync.parser;

import io.github.yok.flashsync.error.RowParseException;
import io.github.yok.flashsync.model.FieldValue;
import io.github.yok.flashsync.model.SyncRecord;
import io.github.yok.flashsync.util.TemporalValueFormatter;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link RowParser} for rows whose structure is only known at run time.
 *
 * <p>
 * Conversion rules:
 * </p>
 * <ul>
 * <li>{@code byte[]}: decoded as UTF-8 text</li>
 * <li>dates and timestamps: formatted with the injected {@link TemporalValueFormatter}</li>
 * <li>{@link String}, {@link Number}, {@link Boolean}: passed through with their kind</li>
 * <li>SQL {@code NULL}: explicit null entry</li>
 * <li>anything else: passed through unchanged</li>
 * </ul>
 *
 * <p>
 * Only reading a value from the driver can fail; conversion itself cannot.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class DynamicRowParser implements RowParser {

    private final TemporalValueFormatter temporalFormatter;

    @Override
    public SyncRecord parse(ResultSet row, List<String> columns) throws RowParseException {
        List<FieldValue> values = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            Object raw;
            try {
                raw = row.getObject(i + 1);
            } catch (SQLException e) {
                throw new RowParseException("Failed to read column " + columns.get(i)
                        + " (expected " + columns.size() + " columns)", e);
            }
            values.add(convert(raw));
        }
        log.trace("Row parsed dynamically: {} columns", columns.size());
        return SyncRecord.of(columns, values);
    }

    /**
     * Converts one driver value.
     *
     * @param raw value from {@link ResultSet#getObject(int)}
     * @return tagged value
     */
    FieldValue convert(Object raw) {
        if (raw == null) {
            return FieldValue.ofNull();
        }
        if (raw instanceof byte[]) {
            return FieldValue.ofString(new String((byte[]) raw, StandardCharsets.UTF_8));
        }
        Optional<String> temporal = temporalFormatter.format(raw);
        if (temporal.isPresent()) {
            return FieldValue.ofTemporal(temporal.get());
        }
        if (raw instanceof String) {
            return FieldValue.ofString((String) raw);
        }
        if (raw instanceof Number) {
            return FieldValue.ofNumber((Number) raw);
        }
        if (raw instanceof Boolean) {
            return FieldValue.ofBoolean((Boolean) raw);
        }
        if (raw instanceof java.sql.Time || raw instanceof java.time.LocalTime) {
            return FieldValue.ofString(raw.toString());
        }
        return FieldValue.ofRaw(raw);
    }
}
