package com.omniva.dbnotifier.registry;

import com.omniva.dbnotifier.engine.fault.SubscriptionValidationException;
import com.omniva.dbnotifier.messaging.model.ChangeType;
import com.omniva.dbnotifier.synthesis.ColumnPolicy;
import com.omniva.dbnotifier.synthesis.NotificationSynthesizer;

import java.util.List;

/**
 * Brings a proposed registry row into canonical form so that rows differing only in list order
 * or event case store, key and synthesize identically.
 */
public class SubscriptionCanonicalizer {

    /**
     * @return a copy with canonical columns and events, an empty notification name as null and cleared generated names
     * @throws SubscriptionValidationException if a required field is missing or a token is invalid
     */
    public Subscription canonicalize(Subscription proposed) {
        requireName(proposed.getTableName(), "table_name");
        requireName(proposed.getChannelName(), "channel_name");

        List<String> events = NotificationSynthesizer.parseEvents(proposed.getEvents()).stream()
                .map(ChangeType::name)
                .toList();
        List<String> columns = ColumnPolicy.fromColumns(proposed.getColumns()).toColumns();

        // The unique index coalesces a missing name to ''
        String notifName = proposed.getNotifName();
        if (notifName != null && notifName.isEmpty()) {
            notifName = null;
        }

        return proposed.toBuilder()
                .notifName(notifName)
                .columns(columns)
                .events(events)
                .generatedHandlerName(null)
                .generatedArtifactName(null)
                .build();
    }

    private static void requireName(String value, String column) {
        if (value == null || value.trim().isEmpty()) {
            throw new SubscriptionValidationException(column + " must be provided for a notification subscription.");
        }
    }
}
