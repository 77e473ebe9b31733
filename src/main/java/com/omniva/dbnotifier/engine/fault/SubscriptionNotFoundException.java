package com.omniva.dbnotifier.engine.fault;

/**
 * Exception thrown when an update or delete targets a registry row that does not exist
 */
public class SubscriptionNotFoundException extends DbNotifierRuntimeException {

    private final long subscriptionId;

    public SubscriptionNotFoundException(long subscriptionId) {
        super("Subscription " + subscriptionId + " does not exist");
        this.subscriptionId = subscriptionId;
    }

    public long getSubscriptionId() {
        return subscriptionId;
    }
}
