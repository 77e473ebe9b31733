package com.omniva.dbnotifier.engine.fault;

/**
 * Base runtime exception for all DB Notifier related errors
 */
public class DbNotifierRuntimeException extends RuntimeException {
    public DbNotifierRuntimeException(String message) {
        super(message);
    }

    public DbNotifierRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
