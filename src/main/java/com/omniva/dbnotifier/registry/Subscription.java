package com.omniva.dbnotifier.registry;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One registry row: a declarative subscription plus the names of the artifact generated for it.
 * <p>
 * Rows handed out by the registry are canonical: events are upper-case, deduplicated and sorted,
 * and columns are in their canonical stored order (see {@link SubscriptionCanonicalizer}).
 */
@Data
@Builder(toBuilder = true)
public class Subscription {

    private Long id;
    private String tableName;
    private String channelName;
    private String notifName;
    private List<String> columns;
    private List<String> events;

    // Derived on every write, never taken from the caller
    private String generatedHandlerName;
    private String generatedArtifactName;
}
