package com.chimera.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One ability scheduled against one agent within one operation.
 * Instances are immutable; every transition produces a new instance.
 *
 * @param id           unique link id
 * @param operationId  owning operation
 * @param abilityId    scheduled ability
 * @param paw          agent the link is bound to
 * @param executor     executor kind handed to the agent
 * @param command      fully resolved command
 * @param status       lifecycle status
 * @param attempt      1-based attempt number for the (ability, agent) pair
 * @param sequence     creation order within the operation
 * @param createdAt    creation time
 * @param dispatchedAt beacon pickup time, null until DISPATCHED
 * @param finishedAt   terminal transition time
 * @param output       raw output reported by the agent
 * @param exitCode     reported exit code, nullable
 * @param reason       audit note for the last transition
 */
public record Link(
    String id,
    String operationId,
    String abilityId,
    String paw,
    String executor,
    String command,
    LinkStatus status,
    int attempt,
    long sequence,
    Instant createdAt,
    Instant dispatchedAt,
    Instant finishedAt,
    String output,
    Integer exitCode,
    String reason
) implements Serializable {

    public static Link queued(String id, String operationId, String abilityId, String paw,
                              String executor, String command, int attempt, long sequence, Instant now) {
        return new Link(id, operationId, abilityId, paw, executor, command, LinkStatus.QUEUED,
                attempt, sequence, now, null, null, null, null, null);
    }

    public PairKey pair() {
        return new PairKey(abilityId, paw);
    }

    public Link dispatched(Instant when) {
        return new Link(id, operationId, abilityId, paw, executor, command, LinkStatus.DISPATCHED,
                attempt, sequence, createdAt, when, null, null, null, null);
    }

    public Link finished(LinkStatus terminal, Instant when, String rawOutput, Integer code, String note) {
        return new Link(id, operationId, abilityId, paw, executor, command, terminal,
                attempt, sequence, createdAt, dispatchedAt, when, rawOutput, code, note);
    }
}
