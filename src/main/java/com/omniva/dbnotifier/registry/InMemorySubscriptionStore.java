package com.omniva.dbnotifier.registry;

import com.omniva.dbnotifier.engine.fault.DuplicateSubscriptionException;
import com.omniva.dbnotifier.engine.memory.InMemoryDatabase;
import com.omniva.dbnotifier.engine.memory.InMemoryTransaction;
import com.omniva.dbnotifier.synthesis.RowImage;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Registry rows kept in a table of the {@link InMemoryDatabase}, so they are undone together with
 * the artifacts when a transaction rolls back.
 * <p>
 * The uniqueness key is enforced the way a unique index would: a writer first locks the key,
 * waiting for any in-flight writer of the same key, then checks for an existing row.
 */
public class InMemorySubscriptionStore implements SubscriptionStore {

    static final String ID = "id";
    static final String TABLE_NAME = "table_name";
    static final String CHANNEL_NAME = "channel_name";
    static final String NOTIF_NAME = "notif_name";
    static final String COLUMNS = "columns";
    static final String EVENTS = "events";
    static final String HANDLER_NAME = "trg_fn_name";
    static final String ARTIFACT_NAME = "trg_name";

    private final InMemoryDatabase database;
    private final String registryTable;

    public InMemorySubscriptionStore(InMemoryDatabase database, String registryTable) {
        this.database = database;
        this.registryTable = registryTable;
        if (!database.tableExists(registryTable)) {
            database.createTableWithIdentity(registryTable, ID,
                    ID, TABLE_NAME, CHANNEL_NAME, NOTIF_NAME, COLUMNS, EVENTS, HANDLER_NAME, ARTIFACT_NAME);
        }
    }

    @Override
    public Subscription insert(Subscription subscription) {
        lockKey(subscription);
        requireUniqueKey(subscription, null);

        Map<String, Object> values = toValues(subscription);
        values.remove(ID);
        RowImage inserted = database.insert(registryTable, values);
        return toSubscription(inserted);
    }

    @Override
    public boolean update(Subscription subscription) {
        long id = subscription.getId();
        lockRow(id);
        lockKey(subscription);
        requireUniqueKey(subscription, id);

        Map<String, Object> values = toValues(subscription);
        values.remove(ID);
        return database.update(registryTable, byId(id), values) > 0;
    }

    @Override
    public boolean delete(long id) {
        lockRow(id);
        return database.delete(registryTable, byId(id)) > 0;
    }

    @Override
    public Optional<Subscription> find(long id) {
        return database.select(registryTable, byId(id)).stream()
                .map(InMemorySubscriptionStore::toSubscription)
                .findFirst();
    }

    @Override
    public Optional<Subscription> findForUpdate(long id) {
        lockRow(id);
        return find(id);
    }

    @Override
    public List<Subscription> findByTable(String tableName) {
        return select(row -> Objects.equals(row.get(TABLE_NAME), tableName));
    }

    @Override
    public List<Subscription> findByHandlerName(String handlerName) {
        return select(row -> Objects.equals(row.get(HANDLER_NAME), handlerName));
    }

    @Override
    public List<Subscription> list() {
        return select(row -> true);
    }

    private List<Subscription> select(Predicate<RowImage> where) {
        return database.select(registryTable, where).stream()
                .map(InMemorySubscriptionStore::toSubscription)
                .sorted(Comparator.comparing(Subscription::getId))
                .toList();
    }

    private void requireUniqueKey(Subscription subscription, Long ownId) {
        SubscriptionKey key = SubscriptionKey.of(subscription);
        for (Subscription existing : list()) {
            if (!existing.getId().equals(ownId) && SubscriptionKey.of(existing).equals(key)) {
                throw new DuplicateSubscriptionException(String.format(
                        "duplicate key value violates unique constraint on %s: (%s, %s, %s, %s) already exists as id %d",
                        registryTable, key.tableName(), key.channelName(), key.notifName(),
                        subscription.getEvents(), existing.getId()));
            }
        }
    }

    private void lockRow(long id) {
        InMemoryTransaction transaction = database.currentTransaction();
        database.getLockTable().acquire("registry-row:" + registryTable + ":" + id, transaction);
    }

    private void lockKey(Subscription subscription) {
        InMemoryTransaction transaction = database.currentTransaction();
        database.getLockTable().acquire(List.of(registryTable, SubscriptionKey.of(subscription)), transaction);
    }

    private static Predicate<RowImage> byId(long id) {
        return row -> Objects.equals(row.get(ID), id);
    }

    private static Map<String, Object> toValues(Subscription subscription) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(ID, subscription.getId());
        values.put(TABLE_NAME, subscription.getTableName());
        values.put(CHANNEL_NAME, subscription.getChannelName());
        values.put(NOTIF_NAME, subscription.getNotifName());
        values.put(COLUMNS, List.copyOf(subscription.getColumns()));
        values.put(EVENTS, List.copyOf(subscription.getEvents()));
        values.put(HANDLER_NAME, subscription.getGeneratedHandlerName());
        values.put(ARTIFACT_NAME, subscription.getGeneratedArtifactName());
        return values;
    }

    @SuppressWarnings("unchecked")
    private static Subscription toSubscription(RowImage row) {
        return Subscription.builder()
                .id((Long) row.get(ID))
                .tableName((String) row.get(TABLE_NAME))
                .channelName((String) row.get(CHANNEL_NAME))
                .notifName((String) row.get(NOTIF_NAME))
                .columns((List<String>) row.get(COLUMNS))
                .events((List<String>) row.get(EVENTS))
                .generatedHandlerName((String) row.get(HANDLER_NAME))
                .generatedArtifactName((String) row.get(ARTIFACT_NAME))
                .build();
    }
}
