package com.omniva.dbnotifier.synthesis;

import com.omniva.dbnotifier.engine.fault.DbNotifierFatalError;
import com.omniva.dbnotifier.messaging.model.ChangeType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a {@link ColumnPolicy} against the row images of one fired event and returns exactly
 * the fields the notification's {@code data} carries.
 */
public final class ColumnSelector {

    private ColumnSelector() {
    }

    /**
     * @param oldRow pre-image; required for UPDATE and DELETE
     * @param newRow post-image; required for INSERT and UPDATE
     * @throws DbNotifierFatalError if the event is not one a handler can be bound to
     */
    public static Map<String, Object> select(ColumnPolicy policy, ChangeType event, RowImage oldRow, RowImage newRow) {
        if (event == null) {
            throw new DbNotifierFatalError("Unsupported trigger event for notifications: null");
        }

        if (policy instanceof ColumnPolicy.AllColumns) {
            return switch (event) {
                case INSERT, UPDATE -> new LinkedHashMap<>(newRow.values());
                case DELETE -> new LinkedHashMap<>(oldRow.values());
            };
        }

        if (policy instanceof ColumnPolicy.ChangedColumns changed) {
            return switch (event) {
                case INSERT -> new LinkedHashMap<>(newRow.values());
                case UPDATE -> {
                    Map<String, Object> data = newRow.changedFrom(oldRow);
                    pick(data, changed.extras(), newRow);
                    yield data;
                }
                case DELETE -> new LinkedHashMap<>(oldRow.values());
            };
        }

        if (policy instanceof ColumnPolicy.ExplicitColumns explicit) {
            Map<String, Object> data = new LinkedHashMap<>();
            switch (event) {
                case INSERT, UPDATE -> pick(data, explicit.columns(), newRow);
                case DELETE -> pick(data, explicit.columns(), oldRow);
            }
            return data;
        }

        throw new DbNotifierFatalError("Unreachable column selection branch for policy " + policy);
    }

    // Missing columns yield null values, as a JSON field lookup would
    private static void pick(Map<String, Object> data, List<String> columns, RowImage image) {
        for (String column : columns) {
            data.put(column, image.get(column));
        }
    }
}
