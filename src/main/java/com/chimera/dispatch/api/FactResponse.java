package com.chimera.dispatch.api;

import com.chimera.core.model.Fact;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One fact. {@code source} is "seed" or the id of the link that produced it.
 */
public record FactResponse(
    String key,
    String value,
    String source,
    long version,
    @JsonProperty("created_at") Instant createdAt
) {

    public static FactResponse from(Fact fact) {
        String source = fact.provenance().isSeed() ? "seed" : fact.provenance().linkId();
        return new FactResponse(fact.key(), fact.value(), source, fact.version(), fact.createdAt());
    }
}
