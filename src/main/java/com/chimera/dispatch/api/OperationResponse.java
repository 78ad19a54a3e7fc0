package com.chimera.dispatch.api;

import com.chimera.core.engine.AgentProgress;
import com.chimera.core.engine.OperationStatusView;
import com.chimera.core.model.LinkStatus;
import com.chimera.core.scheduler.BlockedPair;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON response for operation endpoints.
 */
public record OperationResponse(
    @JsonProperty("operation_id") String operationId,
    String name,
    String adversary,
    String group,
    String status,
    String error,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("finished_at") Instant finishedAt,
    Map<String, Integer> links,
    List<AgentResponse> agents,
    List<BlockedResponse> blocked,
    @JsonProperty("fact_count") int factCount,
    int frontier
) {

    public record AgentResponse(
        String paw,
        String platform,
        String status,
        int queued,
        int dispatched,
        int succeeded,
        int failed,
        int discarded
    ) {}

    /**
     * A frontier pair that is BLOCKED on missing facts or on an unfinished earlier phase.
     */
    public record BlockedResponse(
        String ability,
        String paw,
        @JsonProperty("missing_facts") List<String> missingFacts,
        @JsonProperty("waiting_phase") String waitingPhase
    ) {}

    public static OperationResponse from(OperationStatusView view) {
        var links = new LinkedHashMap<String, Integer>();
        for (LinkStatus status : LinkStatus.values()) {
            if (status != LinkStatus.CREATED) {
                links.put(status.name(), view.count(status));
            }
        }
        List<AgentResponse> agents = view.agents().stream().map(OperationResponse::agent).toList();
        List<BlockedResponse> blocked = view.blocked().stream().map(OperationResponse::blocked).toList();
        return new OperationResponse(view.id(), view.name(), view.adversaryId(), view.group(),
                view.status().name(), view.error(), view.createdAt(), view.finishedAt(),
                links, agents, blocked, view.factCount(), view.frontier());
    }

    private static AgentResponse agent(AgentProgress p) {
        return new AgentResponse(p.paw(), p.platform(), p.status().name(),
                p.queued(), p.dispatched(), p.succeeded(), p.failed(), p.discarded());
    }

    private static BlockedResponse blocked(BlockedPair b) {
        return new BlockedResponse(b.abilityId(), b.paw(), b.missingFacts().stream().sorted().toList(),
                b.waitingPhase());
    }
}
