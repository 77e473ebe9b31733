package com.omniva.dbnotifier.messaging.listener;

/**
 * Receives raw payloads published on the channels it is subscribed to
 */
@FunctionalInterface
public interface ChannelListener {

    void onNotification(String channel, String payload);

    /**
     * Get listener name for logging/debugging
     */
    default String getListenerName() {
        return this.getClass().getSimpleName();
    }
}
