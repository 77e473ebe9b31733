package com.omniva.dbnotifier.engine;

/**
 * Fire-and-forget delivery of a payload to a named channel. Listeners observe the payload only
 * once the enclosing transaction commits; nothing is delivered for a rolled back transaction.
 */
@FunctionalInterface
public interface NotificationPublisher {

    void publish(String channel, String payload);
}
