package com.omniva.dbnotifier.engine.fault;

import lombok.Getter;

/**
 * Exception thrown when a channel payload cannot be read as a change notification
 */
@Getter
public class MalformedNotificationException extends DbNotifierRuntimeException {
    private final String channel;
    private final Throwable originalError;

    public MalformedNotificationException(String channel, Throwable originalError) {
        super(String.format("Malformed notification payload - Channel: %s, Original error: %s",
                channel, originalError.getMessage()), originalError);
        this.channel = channel;
        this.originalError = originalError;
    }
}
