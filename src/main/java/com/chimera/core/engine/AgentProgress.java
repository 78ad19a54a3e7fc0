package com.chimera.core.engine;

import com.chimera.core.model.AgentStatus;

/**
 * Per-agent link counts within one operation.
 */
public record AgentProgress(
    String paw,
    String platform,
    AgentStatus status,
    int queued,
    int dispatched,
    int succeeded,
    int failed,
    int discarded
) {}
