package io.github.yok.flashsync.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Source database settings loaded from the {@code source} section of {@code application.yml}.
 *
 * <pre>
 * source:
 *   connection-params: sslMode=REQUIRED&amp;connectTimeout=30000&amp;socketTimeout=60000&amp;
 *       transformedBitIsBoolean=true
 *   databases:
 *     - name: salesforce
 *       host: localhost
 *       database: salesforce_db
 *       user: salesforce_user
 *       password: password
 *       tables:
 *         - arr_sf_opportunity
 *         - arr_sf_account
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "source")
@Data
public class ConnectionConfig {

    /**
     * Query string appended to generated MySQL JDBC URLs.
     */
    private String connectionParams =
            "sslMode=REQUIRED&connectTimeout=30000&socketTimeout=60000&transformedBitIsBoolean=true";

    /**
     * Source databases, in the order their tables are scheduled.
     */
    private List<Entry> databases = new ArrayList<>();

    /**
     * One source database.
     */
    @Data
    public static class Entry {
        // Logical name (e.g. "finance")
        private String name;
        // host[:port]; ignored when url is set
        private String host;
        // Database (schema) name, also used to qualify table names
        private String database;
        private String user;
        @ToString.Exclude
        private String password;
        // Full JDBC URL overriding host/database/connection-params
        private String url;
        // Tables to synchronize
        private List<String> tables = new ArrayList<>();
    }
}
