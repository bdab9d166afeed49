package io.github.yok.flashsync.util;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.convert.DurationStyle;

/**
 * Parses compact duration strings such as {@code 10m}, {@code 1h30m}, {@code 45s} or
 * {@code 500ms}.
 *
 * <p>
 * Supported units are {@code h}, {@code m}, {@code s}, {@code ms}, {@code us} and {@code ns}.
 * Components may carry a decimal fraction ({@code 1.5h}). A bare {@code 0} is accepted. Negative
 * durations are rejected.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class DurationParser {

    private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|ms|h|m|s)");

    private DurationParser() {}

    /**
     * Parses the given text.
     *
     * <p>
     * The text is split into {@code <amount><unit>} components. Each component is parsed with
     * Spring Boot's {@link DurationStyle#SIMPLE}; a fractional amount scales the unit instead.
     * </p>
     *
     * @param text duration text
     * @return parsed duration, or empty if the text is blank or malformed
     */
    public static Optional<Duration> parse(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        String s = text.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(s)) {
            return Optional.of(Duration.ZERO);
        }
        Matcher m = COMPONENT.matcher(s);
        int pos = 0;
        Duration total = Duration.ZERO;
        while (m.find()) {
            if (m.start() != pos) {
                return Optional.empty();
            }
            total = total.plus(component(m.group(), m.group(1), m.group(2)));
            pos = m.end();
        }
        if (pos == 0 || pos != s.length()) {
            return Optional.empty();
        }
        return Optional.of(total);
    }

    /**
     * Parses the given text, falling back to a default when it is missing or malformed.
     *
     * @param key configuration key, used in the warning
     * @param text duration text
     * @param defaultValue value used when parsing fails
     * @return parsed duration or {@code defaultValue}
     */
    public static Duration parseOrDefault(String key, String text, Duration defaultValue) {
        Optional<Duration> parsed = parse(text);
        if (parsed.isPresent()) {
            return parsed.get();
        }
        log.warn("Invalid duration for {}: '{}', using {}", key, text, defaultValue);
        return defaultValue;
    }

    private static Duration component(String component, String amount, String unit) {
        if (amount.indexOf('.') < 0) {
            return DurationStyle.SIMPLE.parse(component);
        }
        BigDecimal unitNanos = BigDecimal.valueOf(DurationStyle.SIMPLE.parse("1" + unit).toNanos());
        return Duration.ofNanos(unitNanos.multiply(new BigDecimal(amount)).longValue());
    }
}
