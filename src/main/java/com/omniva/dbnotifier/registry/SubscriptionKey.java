package com.omniva.dbnotifier.registry;

import com.omniva.dbnotifier.messaging.model.ChangeType;
import com.omniva.dbnotifier.synthesis.NotificationSynthesizer;

import java.util.Set;

/**
 * Registry uniqueness key. A null notification name is a value like any other, so two unnamed
 * subscriptions on the same table, channel and events collide.
 */
public record SubscriptionKey(String tableName, String channelName, String notifName, Set<ChangeType> events) {

    public SubscriptionKey {
        events = Set.copyOf(events);
    }

    public static SubscriptionKey of(Subscription subscription) {
        return new SubscriptionKey(
                subscription.getTableName(),
                subscription.getChannelName(),
                subscription.getNotifName(),
                NotificationSynthesizer.parseEvents(subscription.getEvents()));
    }
}
