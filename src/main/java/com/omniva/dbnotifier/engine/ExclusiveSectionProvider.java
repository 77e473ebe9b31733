package com.omniva.dbnotifier.engine;

/**
 * Transaction-scoped mutual exclusion keyed by an arbitrary identifier.
 * Acquisition blocks while another transaction holds the section, is reentrant for the
 * holding transaction and is released automatically when the transaction completes.
 */
@FunctionalInterface
public interface ExclusiveSectionProvider {

    void acquire(int sectionId);
}
