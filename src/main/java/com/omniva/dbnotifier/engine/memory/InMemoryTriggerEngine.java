package com.omniva.dbnotifier.engine.memory;

import com.omniva.dbnotifier.engine.NotificationPublisher;
import com.omniva.dbnotifier.engine.TriggerEngine;
import com.omniva.dbnotifier.messaging.model.ChangeType;
import com.omniva.dbnotifier.messaging.model.NotificationCodec;
import com.omniva.dbnotifier.synthesis.HandlerPlan;
import lombok.RequiredArgsConstructor;

import java.util.Set;

/**
 * {@link TriggerEngine} over the {@link InMemoryDatabase}
 */
@RequiredArgsConstructor
public class InMemoryTriggerEngine implements TriggerEngine {

    private final InMemoryDatabase database;
    private final NotificationCodec codec;
    private final NotificationPublisher publisher;

    @Override
    public void createOrReplaceHandler(String handlerName, HandlerPlan plan) {
        database.putHandler(handlerName, new CompiledNotificationHandler(plan, codec, publisher));
    }

    @Override
    public void dropHandlerIfExists(String handlerName) {
        database.removeHandler(handlerName);
    }

    @Override
    public boolean triggerExists(String tableName, String triggerName) {
        return database.findTrigger(tableName, triggerName).isPresent();
    }

    @Override
    public void createTrigger(String tableName, String triggerName, String handlerName, Set<ChangeType> events) {
        database.addTrigger(new InstalledTrigger(triggerName, tableName, handlerName, events));
    }

    @Override
    public void dropTriggerIfExists(String tableName, String triggerName) {
        database.removeTrigger(tableName, triggerName);
    }
}
