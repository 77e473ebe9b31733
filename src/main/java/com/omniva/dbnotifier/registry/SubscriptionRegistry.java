package com.omniva.dbnotifier.registry;

import com.omniva.dbnotifier.engine.fault.ErrorTracker;
import com.omniva.dbnotifier.engine.fault.SubscriptionNotFoundException;
import com.omniva.dbnotifier.synthesis.ArtifactNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Write path of the subscription registry. Every operation runs in one transaction: the existing
 * row is locked, the coordinator swaps the artifacts, and the finalized row is persisted.
 * Any failure rolls all of it back, is recorded in the {@link ErrorTracker} and rethrown.
 */
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final TransactionTemplate transactionTemplate;
    private final RegistryCoordinator coordinator;
    private final SubscriptionStore store;
    private final ErrorTracker errorTracker;

    public SubscriptionRegistry(TransactionTemplate transactionTemplate,
                                RegistryCoordinator coordinator,
                                SubscriptionStore store,
                                ErrorTracker errorTracker) {
        this.transactionTemplate = transactionTemplate;
        this.coordinator = coordinator;
        this.store = store;
        this.errorTracker = errorTracker;
    }

    public Subscription create(SubscriptionRequest request) {
        return inTransaction("create", describe(request), () -> {
            RegistryMutation mutation = coordinator.interceptInsert(request.toSubscription());
            coordinator.apply(mutation);
            Subscription created = store.insert(mutation.row());
            log.info("Created subscription {} ({})", created.getId(), created.getGeneratedArtifactName());
            return created;
        });
    }

    /**
     * Replace the declarative fields of a subscription. The generated names are recomputed.
     *
     * @throws SubscriptionNotFoundException if there is no row with this id
     */
    public Subscription update(long id, SubscriptionRequest request) {
        return inTransaction("update", "id " + id, () -> {
            Subscription existing = store.findForUpdate(id).orElseThrow(() -> new SubscriptionNotFoundException(id));
            Subscription proposed = request.toSubscription().toBuilder().id(id).build();

            RegistryMutation mutation = coordinator.interceptUpdate(existing, proposed);
            coordinator.apply(mutation);
            store.update(mutation.row());
            log.info("Updated subscription {}: {} -> {}", id,
                    existing.getGeneratedArtifactName(), mutation.row().getGeneratedArtifactName());
            return mutation.row();
        });
    }

    /**
     * @return the removed row
     * @throws SubscriptionNotFoundException if there is no row with this id
     */
    public Subscription delete(long id) {
        return inTransaction("delete", "id " + id, () -> {
            Subscription existing = store.findForUpdate(id).orElseThrow(() -> new SubscriptionNotFoundException(id));

            coordinator.apply(coordinator.interceptDelete(existing));
            store.delete(id);
            log.info("Deleted subscription {} ({})", id, existing.getGeneratedArtifactName());
            return existing;
        });
    }

    public Optional<Subscription> find(long id) {
        return store.find(id);
    }

    public List<Subscription> list() {
        return store.list();
    }

    /**
     * Install a notification artifact directly, without a registry row to track it
     */
    public ArtifactNames createNotificationTrigger(String tableName,
                                                   String channelName,
                                                   String notifName,
                                                   List<String> columns,
                                                   Collection<String> events) {
        String target = String.format("table %s, channel %s", tableName, channelName);
        return inTransaction("untracked install", target,
                () -> coordinator.installUntracked(tableName, channelName, notifName, columns, events));
    }

    private <T> T inTransaction(String operation, String target, Supplier<T> action) {
        try {
            return transactionTemplate.execute(status -> action.get());
        } catch (RuntimeException | Error failure) {
            errorTracker.processRegistryFailure(operation, target, failure);
            throw failure;
        }
    }

    private static String describe(SubscriptionRequest request) {
        return String.format("table %s, channel %s, name %s",
                request.getTableName(), request.getChannelName(), request.getNotifName());
    }
}
