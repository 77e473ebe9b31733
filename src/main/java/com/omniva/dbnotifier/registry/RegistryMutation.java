package com.omniva.dbnotifier.registry;

import java.util.List;

/**
 * The outcome of intercepting a registry write: the finalized row to persist (the removed row
 * for a delete), the artifact operations to run and the exclusive sections to hold meanwhile.
 *
 * @param sectionIds distinct, ascending
 */
public record RegistryMutation(Subscription row, List<ArtifactOperation> operations, List<Integer> sectionIds) {

    public RegistryMutation {
        operations = List.copyOf(operations);
        sectionIds = List.copyOf(sectionIds);
    }
}
