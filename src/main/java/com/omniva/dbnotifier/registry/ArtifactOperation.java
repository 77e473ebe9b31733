package com.omniva.dbnotifier.registry;

import com.omniva.dbnotifier.synthesis.SynthesizedArtifact;

/**
 * One step of a registry mutation against the storage engine
 */
public sealed interface ArtifactOperation permits ArtifactOperation.Install, ArtifactOperation.Uninstall {

    String tableName();

    record Install(String tableName, SynthesizedArtifact artifact) implements ArtifactOperation {
    }

    /**
     * Names may be null for rows that never had an artifact; those parts are skipped
     */
    record Uninstall(String tableName, String handlerName, String artifactName) implements ArtifactOperation {
    }
}
