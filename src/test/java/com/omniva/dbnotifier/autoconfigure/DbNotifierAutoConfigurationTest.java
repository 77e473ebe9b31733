package com.omniva.dbnotifier.autoconfigure;

import com.omniva.dbnotifier.config.DbNotifierConfig;
import com.omniva.dbnotifier.engine.ExclusiveSectionProvider;
import com.omniva.dbnotifier.engine.TriggerEngine;
import com.omniva.dbnotifier.engine.fault.ErrorTracker;
import com.omniva.dbnotifier.engine.memory.InMemoryChannelHub;
import com.omniva.dbnotifier.engine.memory.InMemoryDatabase;
import com.omniva.dbnotifier.engine.memory.InMemoryExclusiveSections;
import com.omniva.dbnotifier.engine.memory.InMemoryTransactionManager;
import com.omniva.dbnotifier.engine.memory.InMemoryTriggerEngine;
import com.omniva.dbnotifier.engine.postgres.PostgresTriggerEngine;
import com.omniva.dbnotifier.messaging.model.ChangeNotification;
import com.omniva.dbnotifier.messaging.model.NotificationCodec;
import com.omniva.dbnotifier.registry.InMemorySubscriptionStore;
import com.omniva.dbnotifier.registry.JdbcSubscriptionStore;
import com.omniva.dbnotifier.registry.Subscription;
import com.omniva.dbnotifier.registry.SubscriptionRegistry;
import com.omniva.dbnotifier.registry.SubscriptionRequest;
import com.omniva.dbnotifier.registry.SubscriptionStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class DbNotifierAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DbNotifierAutoConfiguration.class));

    @Test
    void inMemoryBackendIsTheDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SubscriptionRegistry.class);
            assertThat(context).hasSingleBean(InMemoryDatabase.class);
            assertThat(context).hasSingleBean(InMemoryChannelHub.class);
            assertThat(context).hasSingleBean(ErrorTracker.class);
            assertThat(context).hasSingleBean(NotificationCodec.class);
            assertThat(context.getBean(TriggerEngine.class)).isInstanceOf(InMemoryTriggerEngine.class);
            assertThat(context.getBean(ExclusiveSectionProvider.class)).isInstanceOf(InMemoryExclusiveSections.class);
            assertThat(context.getBean(SubscriptionStore.class)).isInstanceOf(InMemorySubscriptionStore.class);
            assertThat(context.getBean("dbNotifierTransactionManager", PlatformTransactionManager.class))
                    .isInstanceOf(InMemoryTransactionManager.class);
            assertThat(context).hasBean("dbNotifierTransactionTemplate");
        });
    }

    @Test
    void explicitInMemoryValueSelectsTheInMemoryBackend() {
        contextRunner.withPropertyValues("db-notifier.backend=in-memory").run(context ->
                assertThat(context.getBean(TriggerEngine.class)).isInstanceOf(InMemoryTriggerEngine.class));
    }

    @Test
    void backendValueBindsRelaxed() {
        for (String value : List.of("IN_MEMORY", "In-Memory", "inMemory")) {
            contextRunner.withPropertyValues("db-notifier.backend=" + value).run(context ->
                    assertThat(context.getBean(TriggerEngine.class)).isInstanceOf(InMemoryTriggerEngine.class));
        }
    }

    @Test
    void upperCasePostgresSelectsThePostgresBackend() {
        contextRunner.withPropertyValues("db-notifier.backend=POSTGRES")
                .withBean("dbNotifierDataSource", DataSource.class, () -> mock(DataSource.class))
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(TriggerEngine.class)).isInstanceOf(PostgresTriggerEngine.class);
                    assertThat(context.getBean(SubscriptionStore.class)).isInstanceOf(JdbcSubscriptionStore.class);
                    assertThat(context).doesNotHaveBean(InMemoryDatabase.class);
                });
    }

    @Test
    void disabledRegistersNothing() {
        contextRunner.withPropertyValues("db-notifier.enabled=false").run(context -> {
            assertThat(context).doesNotHaveBean(SubscriptionRegistry.class);
            assertThat(context).doesNotHaveBean(DbNotifierProperties.class);
            assertThat(context).doesNotHaveBean(InMemoryDatabase.class);
        });
    }

    @Test
    void propertiesBindIntoTheConfig() {
        contextRunner.withPropertyValues(
                "db-notifier.naming.handler-prefix=fn_notify",
                "db-notifier.naming.trigger-prefix=tg_notify",
                "db-notifier.naming.max-identifier-length=40",
                "db-notifier.locking.suffix=_lock",
                "db-notifier.registry.table-name=notif_registry",
                "db-notifier.max-recent-errors=7"
        ).run(context -> {
            DbNotifierConfig config = context.getBean(DbNotifierConfig.class);
            assertThat(config.getHandlerPrefix()).isEqualTo("fn_notify");
            assertThat(config.getTriggerPrefix()).isEqualTo("tg_notify");
            assertThat(config.getMaxIdentifierLength()).isEqualTo(40);
            assertThat(config.getLockSuffix()).isEqualTo("_lock");
            assertThat(config.getRegistryTableName()).isEqualTo("notif_registry");
            assertThat(config.getMaxRecentErrors()).isEqualTo(7);

            assertThat(context.getBean(InMemoryDatabase.class).tableExists("notif_registry")).isTrue();
        });
    }

    @Test
    void defaultsMatchTheRegistryConventions() {
        contextRunner.run(context -> {
            DbNotifierProperties properties = context.getBean(DbNotifierProperties.class);
            assertThat(properties.getBackend()).isEqualTo(DbNotifierProperties.Backend.IN_MEMORY);
            assertThat(properties.getNaming().getMaxIdentifierLength()).isEqualTo(63);
            assertThat(properties.getLocking().getSuffix()).isEqualTo("_trg_notif_lock");
            assertThat(properties.getRegistry().getTableName()).isEqualTo("trg_notifs");
            assertThat(properties.getRegistry().isInitializeSchema()).isFalse();
        });
    }

    @Test
    void userSuppliedBeansWin() {
        InMemoryDatabase database = new InMemoryDatabase();
        contextRunner.withBean(InMemoryDatabase.class, () -> database).run(context ->
                assertThat(context.getBean(InMemoryDatabase.class)).isSameAs(database));
    }

    @Test
    void wiredRegistryDeliversNotifications() {
        contextRunner.run(context -> {
            InMemoryDatabase database = context.getBean(InMemoryDatabase.class);
            InMemoryChannelHub hub = context.getBean(InMemoryChannelHub.class);
            NotificationCodec codec = context.getBean(NotificationCodec.class);
            TransactionTemplate transactionTemplate = context.getBean("dbNotifierTransactionTemplate", TransactionTemplate.class);
            SubscriptionRegistry registry = context.getBean(SubscriptionRegistry.class);

            database.createTableWithIdentity("test_notifs", "id", "id", "col1", "col2", "col3");
            List<ChangeNotification> received = new ArrayList<>();
            hub.listen("chan1", (channel, payload) -> received.add(codec.decode(channel, payload)));

            Subscription sub = registry.create(SubscriptionRequest.builder()
                    .tableName("test_notifs")
                    .channelName("chan1")
                    .columns(List.of("id"))
                    .events(List.of("insert"))
                    .build());
            transactionTemplate.executeWithoutResult(status ->
                    database.insert("test_notifs", Map.of("col1", 1, "col2", 1.23, "col3", "one")));

            assertThat(sub.getGeneratedArtifactName()).isEqualTo("trg_notify_chan1_for_test_notifs_events_i");
            assertThat(received).hasSize(1);
            assertThat(received.get(0).getData()).containsOnlyKeys("id");
        });
    }
}
