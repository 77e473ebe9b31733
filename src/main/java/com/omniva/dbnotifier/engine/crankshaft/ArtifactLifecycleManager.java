package com.omniva.dbnotifier.engine.crankshaft;

import com.omniva.dbnotifier.engine.TriggerEngine;
import com.omniva.dbnotifier.synthesis.SynthesizedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Installs and removes generated handler + trigger pairs on target tables.
 * Both directions are idempotent so the registry can replay them without knowing
 * whether a previous attempt already ran.
 */
public class ArtifactLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ArtifactLifecycleManager.class);

    private final TriggerEngine triggerEngine;

    public ArtifactLifecycleManager(TriggerEngine triggerEngine) {
        this.triggerEngine = triggerEngine;
    }

    /**
     * Create (or replace) the handler and bind it to the table.
     * <p>
     * An existing trigger with the same name on the table is dropped and recreated rather than
     * reported as an error.
     *
     * @param tableName the table whose row events fire the handler
     * @param artifact  the synthesized names and handler plan
     */
    public void install(String tableName, SynthesizedArtifact artifact) {
        if (tableName == null || tableName.trim().isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }

        String handlerName = artifact.handlerName();
        String triggerName = artifact.artifactName();

        log.info("Creating function {}.", handlerName);
        triggerEngine.createOrReplaceHandler(handlerName, artifact.plan());

        if (triggerEngine.triggerExists(tableName, triggerName)) {
            log.info("Trigger {} already exists. Dropping trigger and recreating.", triggerName);
            triggerEngine.dropTriggerIfExists(tableName, triggerName);
        }

        log.info("Creating trigger {} on {} for {}.", triggerName, tableName, artifact.plan().events());
        triggerEngine.createTrigger(tableName, triggerName, handlerName, artifact.plan().events());
    }

    /**
     * Drop the trigger, then its handler. Already missing artifacts are skipped.
     */
    public void uninstall(String tableName, String handlerName, String triggerName) {
        if (triggerName != null) {
            log.info("Dropping trigger {} on {}", triggerName, tableName);
            triggerEngine.dropTriggerIfExists(tableName, triggerName);
        }
        if (handlerName != null) {
            log.info("Dropping function {}", handlerName);
            triggerEngine.dropHandlerIfExists(handlerName);
        }
    }
}
