package com.omniva.dbnotifier.engine.memory;

import com.omniva.dbnotifier.engine.fault.ArtifactOperationException;
import com.omniva.dbnotifier.engine.fault.DbNotifierRuntimeException;
import com.omniva.dbnotifier.messaging.model.ChangeType;
import com.omniva.dbnotifier.synthesis.RowImage;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Embedded row store with row-level AFTER triggers.
 * <p>
 * Row writes, handler and trigger changes all happen inside the transaction bound to the
 * current thread by {@link InMemoryTransactionManager} and are undone if it rolls back.
 * Triggers fire synchronously after each affected row, in trigger-name order.
 * Table definitions themselves are not transactional.
 * <p>
 * Row writes hold the table's lock in shared mode and trigger changes hold it exclusively, both
 * until the transaction completes. A writer therefore never fires a trigger set that another
 * transaction is still changing.
 */
public class InMemoryDatabase {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDatabase.class);

    private final Map<String, InMemoryTable> tables = new ConcurrentHashMap<>();
    private final Map<String, RowEventHandler> handlers = new ConcurrentHashMap<>();
    private final AtomicLong transactionSequence = new AtomicLong();

    @Getter
    private final InMemoryLockTable lockTable = new InMemoryLockTable();

    private final Clock clock;

    public InMemoryDatabase() {
        this(Clock.systemDefaultZone());
    }

    public InMemoryDatabase(Clock clock) {
        this.clock = clock;
    }

    // ===== TRANSACTIONS =====

    InMemoryTransaction beginTransaction() {
        return new InMemoryTransaction(transactionSequence.incrementAndGet(), OffsetDateTime.now(clock));
    }

    /**
     * The transaction bound to the current thread
     *
     * @throws IllegalTransactionStateException if there is none
     */
    public InMemoryTransaction currentTransaction() {
        Object resource = TransactionSynchronizationManager.getResource(this);
        if (resource instanceof InMemoryTransaction transaction && transaction.isActive()) {
            return transaction;
        }
        throw new IllegalTransactionStateException(
                "No active in-memory transaction; run the operation through the in-memory transaction manager");
    }

    // ===== TABLE DEFINITIONS =====

    /**
     * @param identityColumn column filled from a sequence when an insert leaves it null, may be null
     */
    public void createTableWithIdentity(String tableName, String identityColumn, String... columns) {
        InMemoryTable table = new InMemoryTable(tableName, Arrays.asList(columns), identityColumn);
        if (tables.putIfAbsent(tableName, table) != null) {
            throw new DbNotifierRuntimeException("relation \"" + tableName + "\" already exists");
        }
        log.debug("Created table {} {}", tableName, table.getColumns());
    }

    /**
     * Drop the table together with its triggers
     */
    public void dropTable(String tableName) {
        if (tables.remove(tableName) == null) {
            throw new DbNotifierRuntimeException("relation \"" + tableName + "\" does not exist");
        }
    }

    public Optional<InMemoryTable> findTable(String tableName) {
        return Optional.ofNullable(tables.get(tableName));
    }

    public boolean tableExists(String tableName) {
        return tables.containsKey(tableName);
    }

    // ===== ROW WRITES =====

    public RowImage insert(String tableName, Map<String, Object> values) {
        InMemoryTransaction transaction = currentTransaction();
        InMemoryTable table = requireTable(tableName);
        lockTable.acquireShared(tableLockKey(tableName), transaction);
        RowImage inserted = table.insert(values, transaction);
        fire(table, ChangeType.INSERT, null, inserted, transaction);
        return inserted;
    }

    /**
     * @return number of updated rows
     */
    public int update(String tableName, Predicate<RowImage> where, Map<String, Object> changes) {
        InMemoryTransaction transaction = currentTransaction();
        InMemoryTable table = requireTable(tableName);
        lockTable.acquireShared(tableLockKey(tableName), transaction);
        List<InMemoryTable.RowChange> changed = table.update(where, changes, transaction);
        for (InMemoryTable.RowChange change : changed) {
            fire(table, ChangeType.UPDATE, change.oldRow(), change.newRow(), transaction);
        }
        return changed.size();
    }

    /**
     * @return number of deleted rows
     */
    public int delete(String tableName, Predicate<RowImage> where) {
        InMemoryTransaction transaction = currentTransaction();
        InMemoryTable table = requireTable(tableName);
        lockTable.acquireShared(tableLockKey(tableName), transaction);
        List<RowImage> deleted = table.delete(where, transaction);
        for (RowImage row : deleted) {
            fire(table, ChangeType.DELETE, row, null, transaction);
        }
        return deleted.size();
    }

    public List<RowImage> select(String tableName, Predicate<RowImage> where) {
        return requireTable(tableName).select(where);
    }

    private void fire(InMemoryTable table, ChangeType type, RowImage oldRow, RowImage newRow,
                      InMemoryTransaction transaction) {
        for (InstalledTrigger trigger : table.triggersFiringOn(type)) {
            RowEventHandler handler = handlers.get(trigger.handlerName());
            if (handler == null) {
                throw new ArtifactOperationException(String.format(
                        "function %s() referenced by trigger %s on %s does not exist",
                        trigger.handlerName(), trigger.triggerName(), table.getName()));
            }
            handler.handle(new RowEvent(table.getName(), type, oldRow, newRow, transaction.getStartedAt()));
        }
    }

    static String tableLockKey(String tableName) {
        return "table:" + tableName;
    }

    private InMemoryTable requireTable(String tableName) {
        InMemoryTable table = tables.get(tableName);
        if (table == null) {
            throw new DbNotifierRuntimeException("relation \"" + tableName + "\" does not exist");
        }
        return table;
    }

    // ===== HANDLERS AND TRIGGERS =====

    public void putHandler(String handlerName, RowEventHandler handler) {
        InMemoryTransaction transaction = currentTransaction();
        // Replacing a handler changes what the tables bound to it fire
        for (InMemoryTable table : tables.values()) {
            if (table.getTriggers().stream().anyMatch(trigger -> trigger.handlerName().equals(handlerName))) {
                lockTable.acquire(tableLockKey(table.getName()), transaction);
            }
        }
        RowEventHandler previous = handlers.put(handlerName, handler);
        transaction.onRollback(() -> {
            if (previous != null) {
                handlers.put(handlerName, previous);
            } else {
                handlers.remove(handlerName);
            }
        });
    }

    /**
     * @return whether a handler was dropped
     */
    public boolean removeHandler(String handlerName) {
        InMemoryTransaction transaction = currentTransaction();
        for (InMemoryTable table : tables.values()) {
            for (InstalledTrigger trigger : table.getTriggers()) {
                if (trigger.handlerName().equals(handlerName)) {
                    throw new ArtifactOperationException(String.format(
                            "cannot drop function %s() because trigger %s on table %s depends on it",
                            handlerName, trigger.triggerName(), table.getName()));
                }
            }
        }
        RowEventHandler previous = handlers.remove(handlerName);
        if (previous == null) {
            return false;
        }
        transaction.onRollback(() -> handlers.put(handlerName, previous));
        return true;
    }

    public boolean hasHandler(String handlerName) {
        return handlers.containsKey(handlerName);
    }

    public Optional<InstalledTrigger> findTrigger(String tableName, String triggerName) {
        return findTable(tableName).map(table -> table.getTrigger(triggerName));
    }

    public void addTrigger(InstalledTrigger trigger) {
        InMemoryTransaction transaction = currentTransaction();
        InMemoryTable table = tables.get(trigger.tableName());
        if (table == null) {
            throw new ArtifactOperationException("relation \"" + trigger.tableName() + "\" does not exist");
        }
        if (!handlers.containsKey(trigger.handlerName())) {
            throw new ArtifactOperationException("function " + trigger.handlerName() + "() does not exist");
        }
        lockTable.acquire(tableLockKey(trigger.tableName()), transaction);
        synchronized (table) {
            if (table.getTrigger(trigger.triggerName()) != null) {
                throw new ArtifactOperationException(String.format(
                        "trigger \"%s\" for relation \"%s\" already exists", trigger.triggerName(), trigger.tableName()));
            }
            table.putTrigger(trigger);
        }
        transaction.onRollback(() -> table.removeTrigger(trigger.triggerName()));
    }

    /**
     * @return whether a trigger was dropped; a missing table counts as a missing trigger
     */
    public boolean removeTrigger(String tableName, String triggerName) {
        InMemoryTransaction transaction = currentTransaction();
        InMemoryTable table = tables.get(tableName);
        if (table == null) {
            log.info("relation \"{}\" does not exist, skipping", tableName);
            return false;
        }
        lockTable.acquire(tableLockKey(tableName), transaction);
        InstalledTrigger removed = table.removeTrigger(triggerName);
        if (removed == null) {
            return false;
        }
        transaction.onRollback(() -> table.putTrigger(removed));
        return true;
    }
}
