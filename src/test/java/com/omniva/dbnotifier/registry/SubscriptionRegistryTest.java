package com.omniva.dbnotifier.registry;

import com.omniva.dbnotifier.InMemoryNotifierHarness;
import com.omniva.dbnotifier.InMemoryNotifierHarness.RecordingListener;
import com.omniva.dbnotifier.engine.fault.ArtifactOperationException;
import com.omniva.dbnotifier.engine.fault.DuplicateSubscriptionException;
import com.omniva.dbnotifier.engine.fault.SubscriptionNotFoundException;
import com.omniva.dbnotifier.engine.fault.SubscriptionValidationException;
import com.omniva.dbnotifier.engine.memory.InMemoryDatabase;
import com.omniva.dbnotifier.engine.memory.InstalledTrigger;
import com.omniva.dbnotifier.messaging.model.ChangeNotification;
import com.omniva.dbnotifier.messaging.model.ChangeType;
import com.omniva.dbnotifier.synthesis.ArtifactNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubscriptionRegistryTest {

    private static final List<String> ALL = List.of("__all__");
    private static final List<String> CHANGES = List.of("__changes__");
    private static final Set<String> ALL_FIELDS = Set.of("id", "col1", "col2", "col3");

    private InMemoryNotifierHarness harness;
    private InMemoryDatabase database;
    private SubscriptionRegistry registry;
    private RecordingListener chan1;
    private RecordingListener chan2;

    @BeforeEach
    void setUp() {
        harness = new InMemoryNotifierHarness();
        database = harness.getDatabase();
        registry = harness.getRegistry();

        for (String table : List.of("test_notifs", "test_notifs_2")) {
            database.createTableWithIdentity(table, "id", "id", "col1", "col2", "col3");
            insertRow(table, 1, 1.23, "one");
            insertRow(table, 2, 4.56, "two");
            insertRow(table, 3, 7.89, "three");
        }

        chan1 = harness.listen("chan1");
        chan2 = harness.listen("chan2");
    }

    // ========================================
    // END TO END
    // ========================================

    @Test
    void twoSubscriptionsOnOneTable() {
        registry.create(request("test_notifs", "chan1", null, ALL, "insert", "update", "delete"));
        registry.create(request("test_notifs", "chan2", null, List.of("id"), "insert"));

        long id = insertRow("test_notifs", 4, 10.5, "four");

        assertEquals(1, chan1.notifications().size());
        ChangeNotification all = chan1.last();
        assertEquals("test_notifs", all.getTable());
        assertEquals(ChangeType.INSERT, all.getEvent());
        assertNull(all.getName());
        assertEquals(ALL_FIELDS, all.getData().keySet());
        assertEquals(4, all.getData().get("col1"));
        assertEquals("four", all.getData().get("col3"));

        assertEquals(1, chan2.notifications().size());
        assertEquals(Set.of("id"), chan2.last().getData().keySet());
        assertEquals(id, idOf(chan2.last()));
    }

    @Test
    void createStoresCanonicalRowAndInstallsArtifact() {
        Subscription created = registry.create(request("test_notifs", "chan1", "note_chan1",
                List.of("col2", "col1", "col2"), "Update", "insert"));

        assertEquals(List.of("col1", "col2"), created.getColumns());
        assertEquals(List.of("INSERT", "UPDATE"), created.getEvents());
        assertEquals("trg_fn_notify_chan1_for_test_notifs_events_i_u_note_chan1", created.getGeneratedHandlerName());
        assertEquals("trg_notify_chan1_for_test_notifs_events_i_u_note_chan1", created.getGeneratedArtifactName());
        assertEquals(created, registry.find(created.getId()).orElseThrow());

        InstalledTrigger trigger = database.findTrigger("test_notifs", created.getGeneratedArtifactName()).orElseThrow();
        assertEquals(created.getGeneratedHandlerName(), trigger.handlerName());
        assertTrue(database.hasHandler(created.getGeneratedHandlerName()));
    }

    // ========================================
    // COLUMN POLICIES
    // ========================================

    @Test
    void allColumnsOnEveryEvent() {
        registry.create(request("test_notifs", "chan1", null, ALL, "insert", "update", "delete"));

        long id = insertRow("test_notifs", 4, 1.0, "four");
        updateRow("test_notifs", id, 44);
        deleteRow("test_notifs", id);

        List<ChangeNotification> received = chan1.notifications();
        assertEquals(3, received.size());
        for (ChangeNotification notification : received) {
            assertEquals(ALL_FIELDS, notification.getData().keySet());
        }
        assertEquals(44, received.get(1).getData().get("col1"));
        assertEquals(44, received.get(2).getData().get("col1"));
    }

    @Test
    void explicitIdOnEveryEvent() {
        registry.create(request("test_notifs", "chan1", null, List.of("id"), "insert", "update", "delete"));

        long id = insertRow("test_notifs", 4, 1.0, "four");
        updateRow("test_notifs", id, 44);
        deleteRow("test_notifs", id);

        List<ChangeNotification> received = chan1.notifications();
        assertEquals(List.of(ChangeType.INSERT, ChangeType.UPDATE, ChangeType.DELETE),
                received.stream().map(ChangeNotification::getEvent).toList());
        for (ChangeNotification notification : received) {
            assertEquals(Set.of("id"), notification.getData().keySet());
            assertEquals(id, idOf(notification));
        }
    }

    @Test
    void changesSendsChangedFieldsOnUpdateAndWholeRowOtherwise() {
        registry.create(request("test_notifs", "chan1", null, CHANGES, "insert", "update", "delete"));

        long id = insertRow("test_notifs", 4, 1.0, "four");
        updateRow("test_notifs", id, 44);
        deleteRow("test_notifs", id);

        List<ChangeNotification> received = chan1.notifications();
        assertEquals(ALL_FIELDS, received.get(0).getData().keySet());
        assertEquals(Map.of("col1", 44), received.get(1).getData());
        assertEquals(ALL_FIELDS, received.get(2).getData().keySet());
    }

    @Test
    void changesWithExtraColumn() {
        registry.create(request("test_notifs", "chan1", null, List.of("__changes__", "col1"), "update"));

        harness.inTransaction(() -> database.update("test_notifs", row -> row.get("col1").equals(2),
                Map.of("col3", "deux")));

        assertEquals(Map.of("col3", "deux", "col1", 2), chan1.last().getData());
    }

    @Test
    void changesOnUpdateThatChangesNothingCarriesEmptyData() {
        registry.create(request("test_notifs", "chan1", null, CHANGES, "update"));

        harness.inTransaction(() -> database.update("test_notifs", row -> row.get("col1").equals(1),
                Map.of("col3", "one")));

        assertEquals(1, chan1.notifications().size());
        assertTrue(chan1.last().getData().isEmpty());
    }

    @Test
    void missingExplicitColumnIsSentAsNull() {
        registry.create(request("test_notifs", "chan1", null, List.of("id", "nope"), "insert"));

        insertRow("test_notifs", 4, 1.0, "four");

        assertTrue(chan1.last().hasField("nope"));
        assertNull(chan1.last().getData().get("nope"));
    }

    // ========================================
    // EVENT FILTERING
    // ========================================

    @Test
    void insertOnlySubscriptionIgnoresUpdatesAndDeletes() {
        registry.create(request("test_notifs", "chan1", null, ALL, "insert"));

        updateRow("test_notifs", 1, 11);
        deleteRow("test_notifs", 2);

        assertTrue(chan1.notifications().isEmpty());
    }

    @Test
    void updateDeleteSubscriptionIgnoresInserts() {
        registry.create(request("test_notifs", "chan1", null, ALL, "update", "delete"));

        insertRow("test_notifs", 4, 1.0, "four");
        assertTrue(chan1.notifications().isEmpty());

        updateRow("test_notifs", 1, 11);
        deleteRow("test_notifs", 2);
        assertEquals(List.of(ChangeType.UPDATE, ChangeType.DELETE),
                chan1.notifications().stream().map(ChangeNotification::getEvent).toList());
    }

    // ========================================
    // EDITS
    // ========================================

    @Test
    void narrowingEventsTakesEffectImmediately() {
        Subscription sub = registry.create(request("test_notifs", "chan1", null, ALL, "insert", "update", "delete"));

        Subscription updated = registry.update(sub.getId(), request("test_notifs", "chan1", null, ALL, "insert"));

        updateRow("test_notifs", 1, 11);
        deleteRow("test_notifs", 2);
        assertTrue(chan1.notifications().isEmpty());

        insertRow("test_notifs", 4, 1.0, "four");
        assertEquals(1, chan1.notifications().size());

        assertTrue(database.findTrigger("test_notifs", sub.getGeneratedArtifactName()).isEmpty());
        assertFalse(database.hasHandler(sub.getGeneratedHandlerName()));
        assertEquals("trg_notify_chan1_for_test_notifs_events_i", updated.getGeneratedArtifactName());
        assertEquals(1, database.findTable("test_notifs").orElseThrow().getTriggers().size());
    }

    @Test
    void channelRenameMovesNotifications() {
        Subscription sub = registry.create(request("test_notifs", "chan1", null, ALL, "insert"));

        registry.update(sub.getId(), request("test_notifs", "chan2", null, ALL, "insert"));
        insertRow("test_notifs", 4, 1.0, "four");

        assertTrue(chan1.notifications().isEmpty());
        assertEquals(1, chan2.notifications().size());
    }

    @Test
    void tableRenameMovesTheArtifact() {
        Subscription sub = registry.create(request("test_notifs", "chan1", null, ALL, "insert"));

        Subscription moved = registry.update(sub.getId(), request("test_notifs_2", "chan1", null, ALL, "insert"));

        insertRow("test_notifs", 4, 1.0, "four");
        assertTrue(chan1.notifications().isEmpty());

        insertRow("test_notifs_2", 4, 1.0, "four");
        assertEquals(1, chan1.notifications().size());
        assertEquals("test_notifs_2", chan1.last().getTable());

        assertTrue(database.findTable("test_notifs").orElseThrow().getTriggers().isEmpty());
        assertEquals("trg_notify_chan1_for_test_notifs_2_events_i", moved.getGeneratedArtifactName());
    }

    @Test
    void notificationNameRenameChangesPayloadName() {
        Subscription sub = registry.create(request("test_notifs", "chan1", "note_chan1", ALL, "insert"));
        insertRow("test_notifs", 4, 1.0, "four");
        assertEquals("note_chan1", chan1.last().getName());

        registry.update(sub.getId(), request("test_notifs", "chan1", "renamed", ALL, "insert"));
        insertRow("test_notifs", 5, 1.0, "five");

        assertEquals(2, chan1.notifications().size());
        assertEquals("renamed", chan1.last().getName());
    }

    @Test
    void updateWithUnchangedDefinitionKeepsOneArtifact() {
        Subscription sub = registry.create(request("test_notifs", "chan1", null, ALL, "insert"));

        Subscription same = registry.update(sub.getId(), request("test_notifs", "chan1", null, ALL, "insert"));
        insertRow("test_notifs", 4, 1.0, "four");

        assertEquals(sub.getGeneratedArtifactName(), same.getGeneratedArtifactName());
        assertEquals(1, chan1.notifications().size());
    }

    // ========================================
    // DELETION
    // ========================================

    @Test
    void deleteTearsDownTheArtifact() {
        Subscription sub = registry.create(request("test_notifs", "chan1", null, ALL, "insert", "update", "delete"));

        Subscription removed = registry.delete(sub.getId());

        insertRow("test_notifs", 4, 1.0, "four");
        updateRow("test_notifs", 1, 11);
        deleteRow("test_notifs", 2);
        assertTrue(chan1.notifications().isEmpty());

        assertEquals(sub, removed);
        assertTrue(registry.find(sub.getId()).isEmpty());
        assertTrue(database.findTable("test_notifs").orElseThrow().getTriggers().isEmpty());
        assertFalse(database.hasHandler(sub.getGeneratedHandlerName()));
    }

    @Test
    void deleteToleratesDroppedTargetTable() {
        Subscription sub = registry.create(request("test_notifs_2", "chan1", null, ALL, "insert"));
        database.dropTable("test_notifs_2");

        registry.delete(sub.getId());

        assertTrue(registry.list().isEmpty());
        assertFalse(database.hasHandler(sub.getGeneratedHandlerName()));
    }

    @Test
    void missingIdIsReported() {
        SubscriptionNotFoundException e = assertThrows(SubscriptionNotFoundException.class,
                () -> registry.update(999, request("test_notifs", "chan1", null, ALL, "insert")));
        assertEquals(999, e.getSubscriptionId());

        assertThrows(SubscriptionNotFoundException.class, () -> registry.delete(999));
    }

    // ========================================
    // VALIDATION AND UNIQUENESS
    // ========================================

    @Test
    void orderingOnlyDifferencesAreDuplicates() {
        Subscription first = registry.create(request("test_notifs", "chan1", null, List.of("col1", "id"), "insert", "update"));

        assertThrows(DuplicateSubscriptionException.class,
                () -> registry.create(request("test_notifs", "chan1", null, List.of("id", "col1"), "update", "insert")));

        assertEquals(List.of(first), registry.list());
        assertTrue(database.findTrigger("test_notifs", first.getGeneratedArtifactName()).isPresent());
        assertTrue(harness.getErrorTracker().getLastError().contains("Registry create failed"));

        insertRow("test_notifs", 4, 1.0, "four");
        assertEquals(1, chan1.notifications().size());
    }

    @Test
    void unnamedSubscriptionsCollideButNamedOnesDoNot() {
        registry.create(request("test_notifs", "chan1", null, ALL, "insert"));
        assertThrows(DuplicateSubscriptionException.class,
                () -> registry.create(request("test_notifs", "chan1", null, List.of("id"), "insert")));

        registry.create(request("test_notifs", "chan1", "a", ALL, "insert"));
        registry.create(request("test_notifs", "chan1", "b", ALL, "insert"));

        assertEquals(3, registry.list().size());
    }

    @Test
    void blankAndMissingNotificationNamesAreTheSameKey() {
        Subscription first = registry.create(request("test_notifs", "chan1", "", ALL, "insert"));

        assertNull(first.getNotifName());
        assertThrows(DuplicateSubscriptionException.class,
                () -> registry.create(request("test_notifs", "chan1", null, ALL, "insert")));
        assertEquals(List.of(first), registry.list());
    }

    @Test
    void truncatedHandlerNameSharedAcrossTablesIsRejected() {
        String channel = "chan_" + "x".repeat(45);
        RecordingListener listener = harness.listen(channel);

        Subscription idOnly = registry.create(request("test_notifs", channel, null, List.of("id"), "insert"));

        assertThrows(SubscriptionValidationException.class,
                () -> registry.create(request("test_notifs_2", channel, null, ALL, "insert")));

        assertEquals(List.of(idOnly), registry.list());
        assertTrue(database.findTable("test_notifs_2").orElseThrow().getTriggers().isEmpty());

        insertRow("test_notifs", 4, 1.0, "four");
        insertRow("test_notifs_2", 4, 1.0, "four");
        assertEquals(1, listener.notifications().size());
        assertEquals(Set.of("id"), listener.last().getData().keySet());

        registry.delete(idOnly.getId());
        assertFalse(database.hasHandler(idOnly.getGeneratedHandlerName()));
    }

    @Test
    void invalidDefinitionsInstallNothing() {
        assertThrows(SubscriptionValidationException.class,
                () -> registry.create(request("test_notifs", "chan1", null, List.of("__all__", "id"), "insert")));
        assertThrows(SubscriptionValidationException.class,
                () -> registry.create(request("test_notifs", "chan1", null, ALL, "truncate")));
        assertThrows(SubscriptionValidationException.class,
                () -> registry.create(request("test_notifs", null, null, ALL, "insert")));
        assertThrows(SubscriptionValidationException.class,
                () -> registry.create(request("test_notifs", "chan1", null, List.of())));
        assertThrows(SubscriptionValidationException.class,
                () -> registry.create(request("test_notifs", "chan1", null, Arrays.asList("id", null), "insert")));

        assertTrue(registry.list().isEmpty());
        assertTrue(database.findTable("test_notifs").orElseThrow().getTriggers().isEmpty());
        assertEquals(5, harness.getErrorTracker().getRecentErrorCount());
    }

    @Test
    void failedUpdateLeavesPreviousArtifactsInPlace() {
        Subscription onInsert = registry.create(request("test_notifs", "chan1", null, ALL, "insert"));
        Subscription onUpdate = registry.create(request("test_notifs", "chan1", null, ALL, "update"));

        // Would take over the first subscription's key and artifact
        assertThrows(DuplicateSubscriptionException.class,
                () -> registry.update(onUpdate.getId(), request("test_notifs", "chan1", null, List.of("id"), "insert")));

        assertEquals(List.of(onInsert, onUpdate), registry.list());

        insertRow("test_notifs", 4, 1.0, "four");
        updateRow("test_notifs", 1, 11);
        List<ChangeNotification> received = chan1.notifications();
        assertEquals(2, received.size());
        assertEquals(ALL_FIELDS, received.get(0).getData().keySet());
        assertEquals(ChangeType.UPDATE, received.get(1).getEvent());
    }

    @Test
    void missingTargetTableAbortsCreate() {
        assertThrows(ArtifactOperationException.class,
                () -> registry.create(request("no_such_table", "chan1", null, ALL, "insert")));

        assertTrue(registry.list().isEmpty());
        assertFalse(database.hasHandler("trg_fn_notify_chan1_for_no_such_table_events_i"));
    }

    // ========================================
    // TRANSACTIONS
    // ========================================

    @Test
    void notificationsWaitForCommitAndVanishOnRollback() {
        registry.create(request("test_notifs", "chan1", null, ALL, "insert"));

        harness.inTransaction(() -> {
            database.insert("test_notifs", row(4, 1.0, "four"));
            assertTrue(chan1.notifications().isEmpty());
        });
        assertEquals(1, chan1.notifications().size());

        assertThrows(IllegalStateException.class, () -> harness.inTransaction(() -> {
            database.insert("test_notifs", row(5, 1.0, "five"));
            throw new IllegalStateException("abort");
        }));
        assertEquals(1, chan1.notifications().size());
    }

    @Test
    void notificationsFollowRowEventOrder() {
        registry.create(request("test_notifs", "chan1", null, List.of("col1"), "insert", "update"));

        harness.inTransaction(() -> {
            database.insert("test_notifs", row(10, 1.0, "ten"));
            database.update("test_notifs", row -> row.get("col1").equals(10), Map.of("col1", 11));
            database.insert("test_notifs", row(12, 1.0, "twelve"));
        });

        assertEquals(List.of(10, 11, 12),
                chan1.notifications().stream().map(n -> n.getData().get("col1")).toList());
    }

    // ========================================
    // UNTRACKED ARTIFACTS
    // ========================================

    @Test
    void createNotificationTriggerInstallsWithoutRegistryRow() {
        ArtifactNames names = registry.createNotificationTrigger(
                "test_notifs", "chan2", "direct", List.of("id"), List.of("delete"));

        assertTrue(registry.list().isEmpty());
        assertEquals("trg_notify_chan2_for_test_notifs_events_d_direct", names.artifactName());

        deleteRow("test_notifs", 3);
        assertEquals(1, chan2.notifications().size());
        assertEquals("direct", chan2.last().getName());
        assertEquals(3, idOf(chan2.last()));
    }

    @Test
    void createNotificationTriggerIsIdempotent() {
        registry.createNotificationTrigger("test_notifs", "chan2", null, ALL, List.of("insert"));
        registry.createNotificationTrigger("test_notifs", "chan2", null, ALL, List.of("insert"));

        insertRow("test_notifs", 4, 1.0, "four");

        assertEquals(1, chan2.notifications().size());
    }

    // ========================================
    // HELPERS
    // ========================================

    static SubscriptionRequest request(String table, String channel, String notifName, List<String> columns,
                                       String... events) {
        return SubscriptionRequest.builder()
                .tableName(table)
                .channelName(channel)
                .notifName(notifName)
                .columns(columns)
                .events(List.of(events))
                .build();
    }

    private long insertRow(String table, int col1, double col2, String col3) {
        return (Long) harness.callInTransaction(() -> database.insert(table, row(col1, col2, col3))).get("id");
    }

    private void updateRow(String table, long id, int col1) {
        harness.inTransaction(() -> database.update(table, row -> row.get("id").equals(id), Map.of("col1", col1)));
    }

    private void deleteRow(String table, long id) {
        harness.inTransaction(() -> database.delete(table, row -> row.get("id").equals(id)));
    }

    private static Map<String, Object> row(int col1, double col2, String col3) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("col1", col1);
        values.put("col2", col2);
        values.put("col3", col3);
        return values;
    }

    private static long idOf(ChangeNotification notification) {
        return ((Number) notification.getData().get("id")).longValue();
    }
}
