package io.github.yok.flashsync.config;

import io.github.yok.flashsync.util.DurationParser;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Run-level settings ({@code sync} section).
 *
 * <p>
 * Durations are kept as text and parsed with {@link DurationParser}, so that an invalid value
 * falls back to its default with a warning instead of failing startup.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "sync")
@Data
public class SyncConfig {

    static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(10);
    static final Duration DEFAULT_LOAD_POLL_INTERVAL = Duration.ofSeconds(1);

    /**
     * Timeout of the whole multi-table run (e.g. {@code 10m}).
     */
    private String timeout = "10m";

    /**
     * Single {@link java.time.format.DateTimeFormatter} pattern applied to every date/time value.
     */
    private String dateFormat = "yyyy-MM-dd'T'HH:mm:ssXXX";

    /**
     * Zone used for date/time values that carry no offset.
     */
    private String timeZone = "UTC";

    /**
     * Interval between load-job status checks.
     */
    private String loadPollInterval = "1s";

    public Duration timeoutDuration() {
        return DurationParser.parseOrDefault("sync.timeout", timeout, DEFAULT_TIMEOUT);
    }

    public Duration loadPollIntervalDuration() {
        return DurationParser.parseOrDefault("sync.load-poll-interval", loadPollInterval,
                DEFAULT_LOAD_POLL_INTERVAL);
    }
}
