package com.omniva.dbnotifier.synthesis;

/**
 * Derived identifiers of one generated artifact
 *
 * @param handlerName  the generated handler (trigger function)
 * @param artifactName the trigger binding the handler to its table
 */
public record ArtifactNames(String handlerName, String artifactName) {
}
