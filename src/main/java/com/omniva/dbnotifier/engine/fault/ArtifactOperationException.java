package com.omniva.dbnotifier.engine.fault;

/**
 * Exception thrown when the storage engine fails to create or drop a handler or trigger.
 * Propagated to abort the enclosing transaction.
 */
public class ArtifactOperationException extends DbNotifierRuntimeException {
    public ArtifactOperationException(String message) {
        super(message);
    }

    public ArtifactOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
