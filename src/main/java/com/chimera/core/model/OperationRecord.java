package com.chimera.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Durable summary of an operation.
 *
 * @param id           operation id
 * @param name         operator-supplied name
 * @param adversaryId  adversary profile executed
 * @param group        agent group the operation recruits from
 * @param status       lifecycle status
 * @param error        cause of the ERROR status, null otherwise
 * @param createdAt    start time
 * @param finishedAt   time the operation reached FINISHED or CANCELLED
 */
public record OperationRecord(
    String id,
    String name,
    String adversaryId,
    String group,
    OperationStatus status,
    String error,
    Instant createdAt,
    Instant finishedAt
) implements Serializable {

    public OperationRecord withStatus(OperationStatus newStatus, String newError, Instant when) {
        return new OperationRecord(id, name, adversaryId, group, newStatus, newError, createdAt,
                newStatus.isClosed() ? when : finishedAt);
    }
}
