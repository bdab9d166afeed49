package io.github.yok.flashsync.config;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Checks that every required setting is present before a run starts.
 *
 * <p>
 * All missing keys are collected and reported together rather than one at a time.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigValidator {

    private final DestinationConfig destinationConfig;
    private final SyncConfig syncConfig;
    private final ConnectionConfig connectionConfig;

    /**
     * Validates the bound configuration.
     *
     * @throws IllegalStateException listing every missing key
     */
    public void validate() {
        List<String> missing = findMissing();
        if (!missing.isEmpty()) {
            log.error("Missing required configuration values: {}", missing);
            throw new IllegalStateException("Missing required configuration values: " + missing);
        }
        log.info("Configuration loaded: project={}, dataset={}, sources={}",
                destinationConfig.getProjectId(), destinationConfig.getDatasetId(),
                connectionConfig.getDatabases().size());
    }

    /**
     * Returns the keys of required values that are blank.
     *
     * @return missing keys, empty when the configuration is complete
     */
    public List<String> findMissing() {
        List<String> missing = new ArrayList<>();
        require(missing, "destination.project-id", destinationConfig.getProjectId());
        require(missing, "destination.dataset-id", destinationConfig.getDatasetId());
        require(missing, "sync.date-format", syncConfig.getDateFormat());
        require(missing, "sync.time-zone", syncConfig.getTimeZone());
        if (connectionConfig.getDatabases() == null || connectionConfig.getDatabases().isEmpty()) {
            missing.add("source.databases");
            return missing;
        }
        for (int i = 0; i < connectionConfig.getDatabases().size(); i++) {
            ConnectionConfig.Entry entry = connectionConfig.getDatabases().get(i);
            String prefix = "source.databases[" + i + "].";
            require(missing, prefix + "name", entry.getName());
            require(missing, prefix + "database", entry.getDatabase());
            require(missing, prefix + "user", entry.getUser());
            require(missing, prefix + "password", entry.getPassword());
            if (StringUtils.isBlank(entry.getUrl())) {
                require(missing, prefix + "host", entry.getHost());
            }
        }
        return missing;
    }

    private static void require(List<String> missing, String key, String value) {
        if (StringUtils.isBlank(value)) {
            missing.add(key);
        }
    }
}
