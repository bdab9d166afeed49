package io.github.yok.flashsync.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Renders JDBC date/time values with one configured pattern.
 *
 * <p>
 * Every temporal column is formatted with the same pattern, whatever its SQL type. Values without
 * an offset are placed in the configured zone first so that patterns with an offset (such as
 * {@code yyyy-MM-dd'T'HH:mm:ssXXX}) can be applied uniformly. {@code java.sql.Time} and
 * {@link java.time.LocalTime} are not treated as temporal here.
 * </p>
 *
 * <p>
 * The class is immutable and thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TemporalValueFormatter {

    private final DateTimeFormatter formatter;
    private final ZoneId zone;
    private final String pattern;

    /**
     * Creates a formatter.
     *
     * @param pattern {@link DateTimeFormatter} pattern
     * @param zone zone for values without an offset
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public TemporalValueFormatter(String pattern, ZoneId zone) {
        this.formatter = DateTimeFormatter.ofPattern(pattern);
        this.zone = zone;
        this.pattern = pattern;
    }

    /**
     * Formats the value if it is a date or a timestamp.
     *
     * <ul>
     * <li>{@link java.sql.Date}, {@link LocalDate}: start of day in the configured zone</li>
     * <li>{@link java.util.Date} (incl. {@link java.sql.Timestamp}), {@link Instant}: the instant
     * in the configured zone</li>
     * <li>{@link LocalDateTime}: the wall-clock time in the configured zone</li>
     * <li>{@link OffsetDateTime}, {@link ZonedDateTime}: converted to the configured zone</li>
     * </ul>
     *
     * @param value driver value
     * @return formatted text, or empty if the value is not temporal
     * @throws java.time.DateTimeException if the pattern needs a field the value cannot provide
     */
    public Optional<String> format(Object value) {
        ZonedDateTime zoned = toZoned(value);
        return zoned == null ? Optional.empty() : Optional.of(formatter.format(zoned));
    }

    public String getPattern() {
        return pattern;
    }

    public ZoneId getZone() {
        return zone;
    }

    private ZonedDateTime toZoned(Object value) {
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay(zone);
        }
        if (value instanceof java.sql.Time) {
            return null;
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant().atZone(zone);
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(zone);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(zone);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).atZoneSameInstant(zone);
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).withZoneSameInstant(zone);
        }
        if (value instanceof Instant) {
            return ((Instant) value).atZone(zone);
        }
        return null;
    }
}
