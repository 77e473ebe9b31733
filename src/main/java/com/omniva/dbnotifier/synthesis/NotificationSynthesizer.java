package com.omniva.dbnotifier.synthesis;

import com.omniva.dbnotifier.engine.fault.SubscriptionValidationException;
import com.omniva.dbnotifier.messaging.model.ChangeType;
import lombok.RequiredArgsConstructor;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a declarative subscription definition into a {@link SynthesizedArtifact}: derived names plus the
 * handler plan. Pure and deterministic; array ordering of columns and events does not matter.
 */
@RequiredArgsConstructor
public class NotificationSynthesizer {

    private final ArtifactNamer artifactNamer;

    /**
     * @param columns {@code __all__}, {@code __changes__[, extra...]} or explicit column names
     * @param events  any of insert, update, delete (case-insensitive)
     * @throws SubscriptionValidationException if the definition is incomplete or uses unknown tokens
     */
    public SynthesizedArtifact synthesize(String tableName,
                                          String channelName,
                                          String notifName,
                                          List<String> columns,
                                          Collection<String> events) {
        requireName(tableName, "table name");
        requireName(channelName, "channel name");

        Set<ChangeType> eventSet = parseEvents(events);
        ColumnPolicy columnPolicy = ColumnPolicy.fromColumns(columns);

        HandlerPlan plan = new HandlerPlan(tableName, channelName, notifName, columnPolicy, eventSet);
        ArtifactNames names = artifactNamer.derive(tableName, channelName, notifName, eventSet);
        return new SynthesizedArtifact(names, plan);
    }

    /**
     * Validate event tokens and collapse them into the canonical event set
     */
    public static Set<ChangeType> parseEvents(Collection<String> events) {
        if (events == null || events.isEmpty()) {
            throw new SubscriptionValidationException(
                    "At least one trigger event must be provided for notifications. This may be \"insert\", \"update\", and/or \"delete\".");
        }

        Set<ChangeType> eventSet = EnumSet.noneOf(ChangeType.class);
        for (String token : events) {
            ChangeType event = ChangeType.fromToken(token)
                    .orElseThrow(() -> new SubscriptionValidationException(
                            "Invalid trigger events supplied. Supplied events = " + events));
            eventSet.add(event);
        }
        return eventSet;
    }

    private static void requireName(String value, String what) {
        if (value == null || value.trim().isEmpty()) {
            throw new SubscriptionValidationException("Cannot synthesize a notification artifact with a missing " + what + ".");
        }
    }
}
