package com.omniva.dbnotifier.synthesis;

import com.omniva.dbnotifier.engine.fault.SubscriptionValidationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Which columns a notification carries. Parsed positionally from the registry's column list:
 * <ul>
 *     <li>{@code __all__} alone: every column</li>
 *     <li>{@code __changes__[, extra...]}: changed columns on update plus the extras</li>
 *     <li>anything else: exactly the listed columns</li>
 * </ul>
 * Tokens past position 0 are always literal column names.
 */
public sealed interface ColumnPolicy
        permits ColumnPolicy.AllColumns, ColumnPolicy.ChangedColumns, ColumnPolicy.ExplicitColumns {

    String ALL_TOKEN = "__all__";
    String CHANGES_TOKEN = "__changes__";

    /**
     * Literal columns sort naturally, except that columns named like a policy token sort last,
     * so a stored explicit list never starts with a token and parses back to the same policy.
     */
    Comparator<String> LITERAL_ORDER = Comparator
            .comparing((String column) -> Set.of(ALL_TOKEN, CHANGES_TOKEN).contains(column))
            .thenComparing(Comparator.naturalOrder());

    /**
     * The canonical stored form of this policy
     */
    List<String> toColumns();

    record AllColumns() implements ColumnPolicy {
        @Override
        public List<String> toColumns() {
            return List.of(ALL_TOKEN);
        }
    }

    record ChangedColumns(List<String> extras) implements ColumnPolicy {
        public ChangedColumns {
            extras = List.copyOf(extras);
        }

        @Override
        public List<String> toColumns() {
            List<String> columns = new ArrayList<>();
            columns.add(CHANGES_TOKEN);
            columns.addAll(extras);
            return List.copyOf(columns);
        }
    }

    record ExplicitColumns(List<String> columns) implements ColumnPolicy {
        public ExplicitColumns {
            if (columns.isEmpty()) {
                throw new SubscriptionValidationException("An explicit column list must name at least one column");
            }
            columns = List.copyOf(columns);
        }

        @Override
        public List<String> toColumns() {
            return columns;
        }
    }

    /**
     * Parse a registry column list. Literal column names are deduplicated and sorted so that
     * lists differing only in order yield the same policy.
     *
     * @throws SubscriptionValidationException if the list is empty, contains a null entry
     *                                         or combines {@code __all__} with other columns
     */
    static ColumnPolicy fromColumns(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new SubscriptionValidationException(
                    "Columns must be provided for notifications. This may be \"__all__\", \"__changes__\" or the name of each column to return.");
        }
        if (columns.stream().anyMatch(Objects::isNull)) {
            throw new SubscriptionValidationException("Column names must not be null. Supplied columns = " + columns);
        }

        String first = columns.get(0);
        if (ALL_TOKEN.equals(first)) {
            if (columns.size() > 1) {
                throw new SubscriptionValidationException(
                        "When subscribing to __all__ columns for a notification no other columns may be provided. Supplied columns = " + columns);
            }
            return new AllColumns();
        }
        if (CHANGES_TOKEN.equals(first)) {
            return new ChangedColumns(sortedDistinct(columns.subList(1, columns.size())));
        }
        return new ExplicitColumns(sortedDistinct(columns));
    }

    private static List<String> sortedDistinct(List<String> columns) {
        TreeSet<String> distinct = new TreeSet<>(LITERAL_ORDER);
        distinct.addAll(columns);
        return List.copyOf(distinct);
    }
}
