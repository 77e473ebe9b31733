package com.omniva.dbnotifier.engine.fault;

/**
 * Error thrown when an internal contract is violated, e.g. a handler is asked to
 * select columns for an event outside INSERT, UPDATE and DELETE.
 * Never caused by user input; aborts the enclosing transaction.
 */
public class DbNotifierFatalError extends Error {
    public DbNotifierFatalError(String message, Throwable cause) {
        super(message, cause);
    }

    public DbNotifierFatalError(String message) {
        super(message);
    }
}
