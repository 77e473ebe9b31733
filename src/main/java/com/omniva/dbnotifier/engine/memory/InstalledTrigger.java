package com.omniva.dbnotifier.engine.memory;

import com.omniva.dbnotifier.messaging.model.ChangeType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A row-level AFTER trigger binding a handler to a table
 */
public record InstalledTrigger(String triggerName, String tableName, String handlerName, Set<ChangeType> events) {

    public InstalledTrigger {
        events = Collections.unmodifiableSet(EnumSet.copyOf(events));
    }

    public boolean firesOn(ChangeType event) {
        return events.contains(event);
    }
}
