package com.chimera.core.engine;

import com.chimera.core.model.LinkStatus;
import com.chimera.core.model.OperationStatus;
import com.chimera.core.scheduler.BlockedPair;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable status projection of an operation, rebuilt after every mutation.
 *
 * @param linkCounts number of links per status, every status present
 * @param agents     progress per participating agent, in join order
 * @param blocked    frontier pairs waiting on facts or on an earlier phase
 * @param frontier   pairs not yet materialized as links
 */
public record OperationStatusView(
    String id,
    String name,
    String adversaryId,
    String group,
    OperationStatus status,
    String error,
    Instant createdAt,
    Instant finishedAt,
    Map<LinkStatus, Integer> linkCounts,
    List<AgentProgress> agents,
    List<BlockedPair> blocked,
    int factCount,
    int frontier
) {

    public int count(LinkStatus status) {
        return linkCounts.getOrDefault(status, 0);
    }
}
