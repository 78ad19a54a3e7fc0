package com.chimera.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during operation execution, used for SSE streaming and CLI watch mode.
 *
 * @param eventType   event type (e.g. "operation.started", "link.dispatched", "agent.dead")
 * @param operationId the operation this event belongs to (nullable for agent-level events)
 * @param linkId      the link this event relates to (nullable)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record ChimeraEvent(
    String eventType,
    String operationId,
    String linkId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
