package com.omniva.dbnotifier.engine.fault;

/**
 * Exception thrown when a subscription definition is rejected before any artifact is touched
 */
public class SubscriptionValidationException extends DbNotifierRuntimeException {
    public SubscriptionValidationException(String message) {
        super(message);
    }

    public SubscriptionValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
