package com.omniva.dbnotifier.engine.memory;

import com.omniva.dbnotifier.engine.ExclusiveSectionProvider;
import lombok.RequiredArgsConstructor;

/**
 * Exclusive sections held in the database's lock table until the current transaction completes
 */
@RequiredArgsConstructor
public class InMemoryExclusiveSections implements ExclusiveSectionProvider {

    private final InMemoryDatabase database;

    @Override
    public void acquire(int sectionId) {
        database.getLockTable().acquire(sectionKey(sectionId), database.currentTransaction());
    }

    static String sectionKey(int sectionId) {
        return "section:" + sectionId;
    }
}
