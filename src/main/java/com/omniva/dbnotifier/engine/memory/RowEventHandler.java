package com.omniva.dbnotifier.engine.memory;

/**
 * An executable trigger function of the in-memory engine
 */
@FunctionalInterface
public interface RowEventHandler {

    void handle(RowEvent event);
}
