package io.github.yok.flashsync.config;

import io.github.yok.flashsync.model.SourceDatabase;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Builds the list of {@link SourceDatabase}s for a run from {@link ConnectionConfig}.
 *
 * <p>
 * Adding a table to the sync is a change to {@code source.databases[].tables}; nothing in the
 * pipeline itself needs to know about it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceCatalog {

    private final ConnectionConfig connectionConfig;

    /**
     * Returns every configured source.
     *
     * @return sources in configuration order
     */
    public List<SourceDatabase> sources() {
        return sources(List.of());
    }

    /**
     * Returns the configured sources restricted to the given names.
     *
     * @param targetNames names to keep; empty keeps all
     * @return sources in configuration order
     * @throws IllegalArgumentException if a name does not match any configured source
     */
    public List<SourceDatabase> sources(List<String> targetNames) {
        Set<String> known = connectionConfig.getDatabases().stream()
                .map(ConnectionConfig.Entry::getName).collect(Collectors.toSet());
        List<String> unknown = targetNames.stream().filter(n -> !known.contains(n))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown source(s): " + unknown);
        }

        List<SourceDatabase> result = new ArrayList<>();
        for (ConnectionConfig.Entry entry : connectionConfig.getDatabases()) {
            if (!targetNames.isEmpty() && !targetNames.contains(entry.getName())) {
                log.info("[{}] Skipped: not in target source list", entry.getName());
                continue;
            }
            if (entry.getTables() == null || entry.getTables().isEmpty()) {
                log.warn("[{}] No tables configured", entry.getName());
            }
            result.add(toSource(entry));
        }
        return result;
    }

    /**
     * Resolves the JDBC URL of an entry.
     *
     * @param entry source entry
     * @return explicit URL, or {@code jdbc:mysql://host/database?connection-params}
     */
    String resolveUrl(ConnectionConfig.Entry entry) {
        if (StringUtils.isNotBlank(entry.getUrl())) {
            return entry.getUrl();
        }
        String url = "jdbc:mysql://" + entry.getHost() + "/" + entry.getDatabase();
        String params = connectionConfig.getConnectionParams();
        return StringUtils.isBlank(params) ? url : url + "?" + params;
    }

    private SourceDatabase toSource(ConnectionConfig.Entry entry) {
        return SourceDatabase.builder()
                .name(entry.getName())
                .url(resolveUrl(entry))
                .user(entry.getUser())
                .password(entry.getPassword())
                .databaseName(entry.getDatabase())
                .tables(entry.getTables() == null ? List.of() : entry.getTables())
                .build();
    }
}
