package com.omniva.dbnotifier.synthesis;

public record SynthesizedArtifact(ArtifactNames names, HandlerPlan plan) {

    public String handlerName() {
        return names.handlerName();
    }

    public String artifactName() {
        return names.artifactName();
    }
}
