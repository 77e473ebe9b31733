package com.omniva.dbnotifier.synthesis;

import com.omniva.dbnotifier.messaging.model.ChangeType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Engine-neutral description of a generated notification handler: which table and events it
 * is bound to, where it publishes, and which columns it selects. Backends lower a plan into
 * their own procedural form.
 *
 * @param events non-empty, iterated in canonical order
 */
public record HandlerPlan(
        String tableName,
        String channelName,
        String notifName,
        ColumnPolicy columnPolicy,
        Set<ChangeType> events
) {

    public HandlerPlan {
        Objects.requireNonNull(tableName, "tableName");
        Objects.requireNonNull(channelName, "channelName");
        Objects.requireNonNull(columnPolicy, "columnPolicy");
        events = Collections.unmodifiableSet(EnumSet.copyOf(events));
    }

    public boolean firesOn(ChangeType event) {
        return events.contains(event);
    }
}
