package com.chimera.core.model;

/**
 * Liveness state of an agent, derived from its beacon history.
 */
public enum AgentStatus {
    ACTIVE,
    STALE,  // missed at least one expected beacon window
    DEAD
}
