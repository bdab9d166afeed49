package io.github.yok.flashsync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.PropertySourcesPlaceholdersResolver;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

/**
 * Binds the bundled {@code application.yml} to the configuration classes.
 */
class ApplicationYamlBindingTest {

    private Binder binder;

    @BeforeEach
    void setup() throws Exception {
        List<PropertySource<?>> loaded = new YamlPropertySourceLoader().load("application",
                new ClassPathResource("application.yml"));
        MutablePropertySources sources = new MutablePropertySources();
        loaded.forEach(sources::addLast);
        binder = new Binder(ConfigurationPropertySources.from(sources),
                new PropertySourcesPlaceholdersResolver(sources));
    }

    @Test
    void bind_正常ケース_sourceセクション_2ソースと5テーブルが読み込まれること() {
        ConnectionConfig config = binder.bind("source", ConnectionConfig.class).get();

        assertEquals(2, config.getDatabases().size());
        ConnectionConfig.Entry salesforce = config.getDatabases().get(0);
        assertEquals("salesforce", salesforce.getName());
        assertEquals(Arrays.asList("arr_sf_opportunity", "arr_sf_account"),
                salesforce.getTables());
        ConnectionConfig.Entry finance = config.getDatabases().get(1);
        assertEquals("finance", finance.getName());
        assertEquals(Arrays.asList("cache_financial_acc_expense",
                "cache_financial_acc_cost_of_sales", "cache_financial_acc_income"),
                finance.getTables());
        assertEquals("sslMode=REQUIRED&connectTimeout=30000&socketTimeout=60000"
                + "&transformedBitIsBoolean=true",
                config.getConnectionParams());
    }

    @Test
    void bind_正常ケース_sync_poolセクション_値が読み込まれ解析できること() {
        SyncConfig sync = binder.bind("sync", SyncConfig.class).get();
        PoolConfig pool = binder.bind("pool", PoolConfig.class).get();

        assertFalse(sync.getDateFormat().isEmpty());
        assertFalse(sync.timeoutDuration().isNegative());
        assertFalse(pool.maxLifetimeDuration().isNegative());
    }
}
