package com.chimera.core.model;

/**
 * Lifecycle status of a link. CREATED is collapsed into QUEUED at creation time.
 */
public enum LinkStatus {
    CREATED,
    QUEUED,
    DISPATCHED,
    SUCCESS,
    FAILURE,
    TIMEOUT,
    DISCARDED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == TIMEOUT || this == DISCARDED;
    }

    /** True for the states counted as "in flight" by termination detection. */
    public boolean isInFlight() {
        return this == CREATED || this == QUEUED || this == DISPATCHED;
    }
}
