package io.github.yok.flashsync.model;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * A logical source system and the tables to synchronize from it.
 *
 * <p>
 * Built once at the start of a run by {@link io.github.yok.flashsync.config.SourceCatalog}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class SourceDatabase {

    // Logical name (e.g. "salesforce")
    @NonNull
    String name;

    // JDBC URL
    @NonNull
    String url;

    String user;

    @ToString.Exclude
    String password;

    // Schema that qualifies the table names in generated queries
    @NonNull
    String databaseName;

    // Tables to synchronize, in configuration order
    @Singular
    List<String> tables;
}
