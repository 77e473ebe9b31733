package com.omniva.dbnotifier.autoconfigure;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.util.HashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "db-notifier")
public class DbNotifierProperties {

    public enum Backend {
        IN_MEMORY,
        POSTGRES
    }

    private boolean enabled = true;
    private Backend backend = Backend.IN_MEMORY;
    private int maxRecentErrors = 100;

    @NestedConfigurationProperty
    private NamingConfig naming = new NamingConfig();

    @NestedConfigurationProperty
    private LockingConfig locking = new LockingConfig();

    @NestedConfigurationProperty
    private RegistryConfig registry = new RegistryConfig();

    @NestedConfigurationProperty
    private DataSourceConfig datasource = new DataSourceConfig();

    @Data
    public static class NamingConfig {
        private String handlerPrefix = "trg_fn_notify";
        private String triggerPrefix = "trg_notify";
        private int maxIdentifierLength = 63; // PostgreSQL NAMEDATALEN - 1
    }

    @Data
    public static class LockingConfig {
        private String suffix = "_trg_notif_lock";
    }

    @Data
    public static class RegistryConfig {
        private String tableName = "trg_notifs";
        private boolean initializeSchema = false;
    }

    @Data
    public static class DataSourceConfig {
        private String url;
        private String username;
        private String password;
        private String driverClassName = "org.postgresql.Driver";

        @NestedConfigurationProperty
        private HikariProperties hikari = new HikariProperties();

        @Data
        public static class HikariProperties {
            private int maximumPoolSize = 5;
            private int minimumIdle = 1;
            private long connectionTimeout = 30000; // 30 seconds
            private long idleTimeout = 600000; // 10 minutes
            private long maxLifetime = 1800000; // 30 minutes
            private String poolName = "DbNotifierPool";
            private boolean autoCommit = true; // transactions are demarcated by the transaction manager
            private long leakDetectionThreshold = 0;
            private Map<String, String> dataSourceProperties = getDefaultDataSourceProperties();

            private static Map<String, String> getDefaultDataSourceProperties() {
                Map<String, String> defaults = new HashMap<>();
                defaults.put("ApplicationName", "DbNotifier");
                defaults.put("reWriteBatchedInserts", "true");
                defaults.put("prepareThreshold", "5");
                return defaults;
            }
        }
    }
}
