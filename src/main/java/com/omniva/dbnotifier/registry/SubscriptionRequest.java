package com.omniva.dbnotifier.registry;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * The declarative fields of a subscription as supplied by a caller. Column and event lists may
 * come in any order and events in any case.
 */
@Data
@Builder
public class SubscriptionRequest {

    private String tableName;
    private String channelName;
    private String notifName;
    private List<String> columns;
    private List<String> events;

    Subscription toSubscription() {
        return Subscription.builder()
                .tableName(tableName)
                .channelName(channelName)
                .notifName(notifName)
                .columns(columns)
                .events(events)
                .build();
    }
}
