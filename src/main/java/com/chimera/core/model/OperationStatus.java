package com.chimera.core.model;

/**
 * Lifecycle status of an operation.
 */
public enum OperationStatus {
    RUNNING,
    PAUSED,
    FINISHED,
    CANCELLED,
    ERROR;  // journal failure, needs operator intervention

    public boolean isClosed() {
        return this == FINISHED || this == CANCELLED;
    }
}
