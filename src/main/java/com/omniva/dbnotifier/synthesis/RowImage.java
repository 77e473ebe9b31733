package com.omniva.dbnotifier.synthesis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structured view of one row before or after a write, keyed by column name in table order.
 * Values may be null.
 */
public record RowImage(Map<String, Object> values) {

    public RowImage {
        Objects.requireNonNull(values, "values");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RowImage of(Map<String, Object> values) {
        return new RowImage(values);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    /**
     * Columns present in both images whose values are distinct, with this image's values.
     * Two nulls are not distinct.
     */
    public Map<String, Object> changedFrom(RowImage previous) {
        Map<String, Object> changed = new LinkedHashMap<>();
        values.forEach((column, value) -> {
            if (previous.hasColumn(column) && !Objects.equals(previous.get(column), value)) {
                changed.put(column, value);
            }
        });
        return changed;
    }
}
