package com.chimera.core.engine;

import com.chimera.core.model.OperationStatus;

/**
 * Thrown when an operator action is not allowed in the operation's current status.
 */
public class IllegalOperationStateException extends RuntimeException {

    private final OperationStatus status;

    public IllegalOperationStateException(String operationId, OperationStatus status, String action) {
        super("Cannot " + action + " operation " + operationId + " while " + status);
        this.status = status;
    }

    public OperationStatus getStatus() {
        return status;
    }
}
