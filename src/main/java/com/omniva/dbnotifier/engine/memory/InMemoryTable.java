package com.omniva.dbnotifier.engine.memory;

import com.omniva.dbnotifier.engine.fault.DbNotifierRuntimeException;
import com.omniva.dbnotifier.messaging.model.ChangeType;
import com.omniva.dbnotifier.synthesis.RowImage;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Rows and triggers of one in-memory table. Every change registers its undo action with the
 * writing transaction.
 */
public class InMemoryTable {

    /**
     * An updated row's images
     */
    public record RowChange(RowImage oldRow, RowImage newRow) {
    }

    @Getter
    private final String name;
    @Getter
    private final List<String> columns;
    private final String identityColumn;

    private final AtomicLong identitySequence = new AtomicLong();
    private final AtomicLong rowIdSequence = new AtomicLong();

    // Ordered by internal row id so an undone delete returns the row to its place
    private final TreeMap<Long, Map<String, Object>> rows = new TreeMap<>();

    // Fired in name order
    private final TreeMap<String, InstalledTrigger> triggers = new TreeMap<>();

    InMemoryTable(String name, List<String> columns, String identityColumn) {
        if (identityColumn != null && !columns.contains(identityColumn)) {
            throw new IllegalArgumentException("Identity column " + identityColumn + " is not a column of " + name);
        }
        this.name = name;
        this.columns = List.copyOf(columns);
        this.identityColumn = identityColumn;
    }

    // ===== ROWS =====

    synchronized RowImage insert(Map<String, Object> values, InMemoryTransaction transaction) {
        requireKnownColumns(values);

        Map<String, Object> row = new LinkedHashMap<>();
        for (String column : columns) {
            row.put(column, values.get(column));
        }
        if (identityColumn != null && row.get(identityColumn) == null) {
            row.put(identityColumn, identitySequence.incrementAndGet());
        }

        long rowId = rowIdSequence.incrementAndGet();
        rows.put(rowId, row);
        transaction.onRollback(() -> removeRow(rowId));
        return RowImage.of(row);
    }

    synchronized List<RowChange> update(Predicate<RowImage> where, Map<String, Object> changes,
                                        InMemoryTransaction transaction) {
        requireKnownColumns(changes);

        List<RowChange> changed = new ArrayList<>();
        for (Map.Entry<Long, Map<String, Object>> entry : rows.entrySet()) {
            RowImage before = RowImage.of(entry.getValue());
            if (!where.test(before)) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>(entry.getValue());
            row.putAll(changes);
            Long rowId = entry.getKey();
            entry.setValue(row);
            transaction.onRollback(() -> restoreRow(rowId, before));
            changed.add(new RowChange(before, RowImage.of(row)));
        }
        return changed;
    }

    synchronized List<RowImage> delete(Predicate<RowImage> where, InMemoryTransaction transaction) {
        List<RowImage> deleted = new ArrayList<>();
        List<Long> matching = new ArrayList<>();
        rows.forEach((rowId, row) -> {
            if (where.test(RowImage.of(row))) {
                matching.add(rowId);
            }
        });
        for (Long rowId : matching) {
            RowImage before = RowImage.of(rows.remove(rowId));
            transaction.onRollback(() -> restoreRow(rowId, before));
            deleted.add(before);
        }
        return deleted;
    }

    public synchronized List<RowImage> select(Predicate<RowImage> where) {
        List<RowImage> result = new ArrayList<>();
        for (Map<String, Object> row : rows.values()) {
            RowImage image = RowImage.of(row);
            if (where.test(image)) {
                result.add(image);
            }
        }
        return result;
    }

    private synchronized void removeRow(long rowId) {
        rows.remove(rowId);
    }

    private synchronized void restoreRow(long rowId, RowImage image) {
        rows.put(rowId, new LinkedHashMap<>(image.values()));
    }

    private void requireKnownColumns(Map<String, Object> values) {
        for (String column : values.keySet()) {
            if (!columns.contains(column)) {
                throw new DbNotifierRuntimeException(
                        String.format("column \"%s\" of relation \"%s\" does not exist", column, name));
            }
        }
    }

    // ===== TRIGGERS =====

    synchronized InstalledTrigger getTrigger(String triggerName) {
        return triggers.get(triggerName);
    }

    synchronized void putTrigger(InstalledTrigger trigger) {
        triggers.put(trigger.triggerName(), trigger);
    }

    synchronized InstalledTrigger removeTrigger(String triggerName) {
        return triggers.remove(triggerName);
    }

    synchronized List<InstalledTrigger> triggersFiringOn(ChangeType event) {
        return triggers.values().stream()
                .filter(trigger -> trigger.firesOn(event))
                .toList();
    }

    public synchronized List<InstalledTrigger> getTriggers() {
        return List.copyOf(triggers.values());
    }
}
