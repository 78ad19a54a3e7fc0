package com.chimera.core.engine;

/**
 * Thrown when an operation id does not name a known operation.
 */
public class OperationNotFoundException extends RuntimeException {

    private final String operationId;

    public OperationNotFoundException(String operationId) {
        super("Operation not found: " + operationId);
        this.operationId = operationId;
    }

    public String getOperationId() {
        return operationId;
    }
}
