package com.chimera.dispatch.api;

import com.chimera.core.model.Link;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record LinkResponse(
    @JsonProperty("link_id") String linkId,
    String ability,
    String paw,
    String executor,
    String command,
    String status,
    int attempt,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("dispatched_at") Instant dispatchedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    String output,
    @JsonProperty("exit_code") Integer exitCode,
    String reason
) {

    public static LinkResponse from(Link link) {
        return new LinkResponse(link.id(), link.abilityId(), link.paw(), link.executor(), link.command(),
                link.status().name(), link.attempt(), link.createdAt(), link.dispatchedAt(), link.finishedAt(),
                link.output(), link.exitCode(), link.reason());
    }
}
