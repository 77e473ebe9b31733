package com.omniva.dbnotifier.engine.fault;

/**
 * Exception thrown when a registry write would violate the
 * (table, channel, notification name, events) uniqueness key
 */
public class DuplicateSubscriptionException extends SubscriptionValidationException {
    public DuplicateSubscriptionException(String message) {
        super(message);
    }

    public DuplicateSubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
