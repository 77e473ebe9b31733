package com.omniva.dbnotifier.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.omniva.dbnotifier.config.DbNotifierConfig;
import com.omniva.dbnotifier.engine.ExclusiveSectionProvider;
import com.omniva.dbnotifier.engine.TriggerEngine;
import com.omniva.dbnotifier.engine.crankshaft.ArtifactLifecycleManager;
import com.omniva.dbnotifier.engine.fault.ErrorTracker;
import com.omniva.dbnotifier.engine.ignition.EnvironmentValidator;
import com.omniva.dbnotifier.engine.memory.InMemoryChannelHub;
import com.omniva.dbnotifier.engine.memory.InMemoryDatabase;
import com.omniva.dbnotifier.engine.memory.InMemoryExclusiveSections;
import com.omniva.dbnotifier.engine.memory.InMemoryTransactionManager;
import com.omniva.dbnotifier.engine.memory.InMemoryTriggerEngine;
import com.omniva.dbnotifier.engine.postgres.PlpgsqlHandlerEmitter;
import com.omniva.dbnotifier.engine.postgres.PostgresExclusiveSections;
import com.omniva.dbnotifier.engine.postgres.PostgresTriggerEngine;
import com.omniva.dbnotifier.messaging.model.NotificationCodec;
import com.omniva.dbnotifier.registry.InMemorySubscriptionStore;
import com.omniva.dbnotifier.registry.JdbcSubscriptionStore;
import com.omniva.dbnotifier.registry.RegistryCoordinator;
import com.omniva.dbnotifier.registry.SubscriptionCanonicalizer;
import com.omniva.dbnotifier.registry.SubscriptionRegistry;
import com.omniva.dbnotifier.registry.SubscriptionStore;
import com.omniva.dbnotifier.synthesis.ArtifactNamer;
import com.omniva.dbnotifier.synthesis.NotificationSynthesizer;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.JdbcTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Auto-configuration for the DB Notifier registry
 * Enabled by default, can be disabled with: db-notifier.enabled=false
 * <p>
 * The backend is chosen with {@code db-notifier.backend}: {@code in-memory} (default) or {@code postgres},
 * in any spelling the enum binding accepts.
 */
@AutoConfiguration
@ConditionalOnClass(SubscriptionRegistry.class)
@ConditionalOnProperty(prefix = "db-notifier", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DbNotifierProperties.class)
public class DbNotifierAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DbNotifierAutoConfiguration.class);

    // 1. Configuration

    @Bean
    @ConditionalOnMissingBean
    public DbNotifierConfig dbNotifierConfig(DbNotifierProperties properties) {
        return new DbNotifierConfigAdapter(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorTracker dbNotifierErrorTracker(DbNotifierConfig config) {
        return new ErrorTracker(config);
    }

    // 2. Synthesis (pure, backend independent)

    @Bean
    @ConditionalOnMissingBean
    public NotificationCodec notificationCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new NotificationCodec(objectMapper.getIfAvailable(NotificationCodec::defaultObjectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public ArtifactNamer artifactNamer(DbNotifierConfig config) {
        return new ArtifactNamer(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSynthesizer notificationSynthesizer(ArtifactNamer artifactNamer) {
        return new NotificationSynthesizer(artifactNamer);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionCanonicalizer subscriptionCanonicalizer() {
        return new SubscriptionCanonicalizer();
    }

    // 3. Lifecycle and coordination (depends on the backend beans below)

    @Bean
    @ConditionalOnMissingBean
    public ArtifactLifecycleManager artifactLifecycleManager(TriggerEngine triggerEngine) {
        return new ArtifactLifecycleManager(triggerEngine);
    }

    @Bean
    @ConditionalOnMissingBean
    public RegistryCoordinator registryCoordinator(DbNotifierConfig config,
                                                   SubscriptionCanonicalizer canonicalizer,
                                                   NotificationSynthesizer synthesizer,
                                                   ArtifactLifecycleManager lifecycleManager,
                                                   ExclusiveSectionProvider sectionProvider,
                                                   SubscriptionStore store) {
        return new RegistryCoordinator(config, canonicalizer, synthesizer, lifecycleManager, sectionProvider, store);
    }

    @Bean("dbNotifierTransactionTemplate")
    @ConditionalOnMissingBean(name = "dbNotifierTransactionTemplate")
    public TransactionTemplate dbNotifierTransactionTemplate(
            @Qualifier("dbNotifierTransactionManager") PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionRegistry subscriptionRegistry(
            @Qualifier("dbNotifierTransactionTemplate") TransactionTemplate transactionTemplate,
            RegistryCoordinator coordinator,
            SubscriptionStore store,
            ErrorTracker errorTracker) {
        return new SubscriptionRegistry(transactionTemplate, coordinator, store, errorTracker);
    }

    // 4. Backends

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBackend(DbNotifierProperties.Backend.IN_MEMORY)
    static class InMemoryBackendConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public InMemoryDatabase inMemoryDatabase() {
            return new InMemoryDatabase();
        }

        @Bean
        @ConditionalOnMissingBean
        public InMemoryChannelHub inMemoryChannelHub(InMemoryDatabase database) {
            return new InMemoryChannelHub(database);
        }

        @Bean("dbNotifierTransactionManager")
        @ConditionalOnMissingBean(name = "dbNotifierTransactionManager")
        public PlatformTransactionManager dbNotifierTransactionManager(InMemoryDatabase database,
                                                                       InMemoryChannelHub channelHub) {
            return new InMemoryTransactionManager(database, channelHub);
        }

        @Bean
        @ConditionalOnMissingBean
        public TriggerEngine inMemoryTriggerEngine(InMemoryDatabase database,
                                                   NotificationCodec codec,
                                                   InMemoryChannelHub channelHub) {
            return new InMemoryTriggerEngine(database, codec, channelHub);
        }

        @Bean
        @ConditionalOnMissingBean
        public ExclusiveSectionProvider inMemoryExclusiveSections(InMemoryDatabase database) {
            return new InMemoryExclusiveSections(database);
        }

        @Bean
        @ConditionalOnMissingBean
        public SubscriptionStore inMemorySubscriptionStore(InMemoryDatabase database, DbNotifierConfig config) {
            return new InMemorySubscriptionStore(database, config.getRegistryTableName());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.postgresql.Driver")
    @ConditionalOnBackend(DbNotifierProperties.Backend.POSTGRES)
    static class PostgresBackendConfiguration {

        @Bean("dbNotifierHikariConfig")
        @ConditionalOnMissingBean(name = "dbNotifierHikariConfig")
        public HikariConfig dbNotifierHikariConfig(DbNotifierProperties properties) {
            HikariConfig hikariConfig = new HikariConfig();
            DbNotifierProperties.DataSourceConfig datasource = properties.getDatasource();
            DbNotifierProperties.DataSourceConfig.HikariProperties hikariProps = datasource.getHikari();

            // Basic connection settings
            hikariConfig.setJdbcUrl(datasource.getUrl());
            hikariConfig.setUsername(datasource.getUsername());
            hikariConfig.setPassword(datasource.getPassword());
            hikariConfig.setDriverClassName(datasource.getDriverClassName());

            // Pool settings
            hikariConfig.setMaximumPoolSize(hikariProps.getMaximumPoolSize());
            hikariConfig.setMinimumIdle(hikariProps.getMinimumIdle());
            hikariConfig.setConnectionTimeout(hikariProps.getConnectionTimeout());
            hikariConfig.setIdleTimeout(hikariProps.getIdleTimeout());
            hikariConfig.setMaxLifetime(hikariProps.getMaxLifetime());
            hikariConfig.setPoolName(hikariProps.getPoolName());
            hikariConfig.setAutoCommit(hikariProps.isAutoCommit());
            hikariConfig.setLeakDetectionThreshold(hikariProps.getLeakDetectionThreshold());

            // Connection validation
            hikariConfig.setConnectionTestQuery("SELECT 1");
            hikariConfig.setValidationTimeout(5000);

            // Data source properties
            if (hikariProps.getDataSourceProperties() != null) {
                hikariProps.getDataSourceProperties().forEach(hikariConfig::addDataSourceProperty);
            }
            return hikariConfig;
        }

        @Bean("dbNotifierDataSource")
        @ConditionalOnMissingBean(name = "dbNotifierDataSource")
        public DataSource dbNotifierDataSource(@Qualifier("dbNotifierHikariConfig") HikariConfig config) {
            return new HikariDataSource(config);
        }

        @Bean("dbNotifierJdbcTemplate")
        @ConditionalOnMissingBean(name = "dbNotifierJdbcTemplate")
        public JdbcTemplate dbNotifierJdbcTemplate(@Qualifier("dbNotifierDataSource") DataSource dataSource) {
            return new JdbcTemplate(dataSource);
        }

        @Bean("dbNotifierTransactionManager")
        @ConditionalOnMissingBean(name = "dbNotifierTransactionManager")
        public PlatformTransactionManager dbNotifierTransactionManager(
                @Qualifier("dbNotifierDataSource") DataSource dataSource) {
            return new JdbcTransactionManager(dataSource);
        }

        @Bean
        @ConditionalOnMissingBean
        public PlpgsqlHandlerEmitter plpgsqlHandlerEmitter() {
            return new PlpgsqlHandlerEmitter();
        }

        @Bean
        @ConditionalOnMissingBean
        public TriggerEngine postgresTriggerEngine(@Qualifier("dbNotifierJdbcTemplate") JdbcTemplate jdbcTemplate,
                                                   PlpgsqlHandlerEmitter emitter) {
            return new PostgresTriggerEngine(jdbcTemplate, emitter);
        }

        @Bean
        @ConditionalOnMissingBean
        public ExclusiveSectionProvider postgresExclusiveSections(
                @Qualifier("dbNotifierJdbcTemplate") JdbcTemplate jdbcTemplate) {
            return new PostgresExclusiveSections(jdbcTemplate);
        }

        @Bean
        @ConditionalOnMissingBean
        public SubscriptionStore jdbcSubscriptionStore(@Qualifier("dbNotifierJdbcTemplate") JdbcTemplate jdbcTemplate,
                                                       DbNotifierProperties properties) {
            JdbcSubscriptionStore store = new JdbcSubscriptionStore(jdbcTemplate, properties.getRegistry().getTableName());
            if (properties.getRegistry().isInitializeSchema()) {
                store.initializeSchema();
            }
            return store;
        }

        @Bean
        @ConditionalOnMissingBean
        public EnvironmentValidator environmentValidator(@Qualifier("dbNotifierJdbcTemplate") JdbcTemplate jdbcTemplate,
                                                         DbNotifierConfig config,
                                                         ErrorTracker errorTracker) {
            return new EnvironmentValidator(jdbcTemplate, config, errorTracker);
        }

        @Bean
        public SmartInitializingSingleton dbNotifierEnvironmentCheck(EnvironmentValidator environmentValidator) {
            return () -> {
                if (!environmentValidator.validateEnvironment()) {
                    log.warn("DB Notifier environment is not ready; registry writes will fail until it is");
                }
            };
        }
    }

    /**
     * Adapter to convert properties to config interface
     */
    private record DbNotifierConfigAdapter(DbNotifierProperties properties) implements DbNotifierConfig {

        @Override
        public String getHandlerPrefix() {
            return properties.getNaming().getHandlerPrefix();
        }

        @Override
        public String getTriggerPrefix() {
            return properties.getNaming().getTriggerPrefix();
        }

        @Override
        public int getMaxIdentifierLength() {
            return properties.getNaming().getMaxIdentifierLength();
        }

        @Override
        public String getLockSuffix() {
            return properties.getLocking().getSuffix();
        }

        @Override
        public String getRegistryTableName() {
            return properties.getRegistry().getTableName();
        }

        @Override
        public int getMaxRecentErrors() {
            return properties.getMaxRecentErrors();
        }
    }
}
