package com.omniva.dbnotifier.engine.memory;

import com.omniva.dbnotifier.engine.NotificationPublisher;
import com.omniva.dbnotifier.messaging.listener.ChannelListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publish primitive of the in-memory engine. Payloads are buffered in the publishing
 * transaction and delivered to the channel's listeners after it commits, one transaction's
 * batch at a time and in publish order.
 */
public class InMemoryChannelHub implements NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChannelHub.class);

    private final InMemoryDatabase database;
    private final Map<String, List<ChannelListener>> listeners = new ConcurrentHashMap<>();

    public InMemoryChannelHub(InMemoryDatabase database) {
        this.database = database;
    }

    @Override
    public void publish(String channel, String payload) {
        database.currentTransaction().enqueueNotification(channel, payload);
    }

    /**
     * Start receiving payloads published on the channel
     *
     * @return a handle that stops delivery when closed
     */
    public AutoCloseable listen(String channel, ChannelListener listener) {
        listeners.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("{} listening on channel {}", listener.getListenerName(), channel);
        return () -> unlisten(channel, listener);
    }

    public void unlisten(String channel, ChannelListener listener) {
        List<ChannelListener> channelListeners = listeners.get(channel);
        if (channelListeners != null) {
            channelListeners.remove(listener);
        }
    }

    synchronized void deliver(List<InMemoryTransaction.PendingNotification> notifications) {
        for (InMemoryTransaction.PendingNotification notification : notifications) {
            List<ChannelListener> channelListeners = listeners.getOrDefault(notification.channel(), List.of());
            for (ChannelListener listener : channelListeners) {
                try {
                    listener.onNotification(notification.channel(), notification.payload());
                } catch (RuntimeException e) {
                    // Delivery is fire-and-forget: the publishing transaction already committed
                    log.error("Listener {} failed on channel {}: {}",
                            listener.getListenerName(), notification.channel(), e.getMessage(), e);
                }
            }
        }
    }
}
