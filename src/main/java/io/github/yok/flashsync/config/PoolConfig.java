package io.github.yok.flashsync.config;

import io.github.yok.flashsync.util.DurationParser;
import java.time.Duration;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection pool tuning applied to every per-table source pool ({@code pool} section).
 *
 * <p>
 * Values are bound as text; invalid or negative counts fall back to 10 and an invalid lifetime falls back to
 * 0 (unlimited), each with a warning.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@ConfigurationProperties(prefix = "pool")
@Data
public class PoolConfig {

    static final int DEFAULT_CONNECTIONS = 10;

    private String maxOpen = "10";

    private String maxIdle = "10";

    private String maxLifetime = "1m";

    public int maxOpenConnections() {
        return toInt("pool.max-open", maxOpen, 1);
    }

    public int maxIdleConnections() {
        return toInt("pool.max-idle", maxIdle, 0);
    }

    public Duration maxLifetimeDuration() {
        return DurationParser.parseOrDefault("pool.max-lifetime", maxLifetime, Duration.ZERO);
    }

    private static int toInt(String key, String value, int min) {
        int parsed = NumberUtils.toInt(value == null ? null : value.trim(), Integer.MIN_VALUE);
        if (parsed < min) {
            log.warn("Invalid value for {}: '{}', using default {}", key, value,
                    DEFAULT_CONNECTIONS);
            return DEFAULT_CONNECTIONS;
        }
        return parsed;
    }
}
