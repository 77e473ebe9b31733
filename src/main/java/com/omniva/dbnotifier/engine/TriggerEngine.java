package com.omniva.dbnotifier.engine;

import com.omniva.dbnotifier.messaging.model.ChangeType;
import com.omniva.dbnotifier.synthesis.HandlerPlan;

import java.util.Set;

/**
 * Storage engine trigger API. All operations run inside the caller's transaction.
 * Failures surface as {@link com.omniva.dbnotifier.engine.fault.ArtifactOperationException}.
 */
public interface TriggerEngine {

    /**
     * Create the named handler from the plan, replacing any handler with the same name
     */
    void createOrReplaceHandler(String handlerName, HandlerPlan plan);

    void dropHandlerIfExists(String handlerName);

    boolean triggerExists(String tableName, String triggerName);

    /**
     * Bind a handler to a table, fired AFTER each affected row for exactly the given events
     */
    void createTrigger(String tableName, String triggerName, String handlerName, Set<ChangeType> events);

    /**
     * Drop the trigger; a missing trigger or a missing table is not an error
     */
    void dropTriggerIfExists(String tableName, String triggerName);
}
