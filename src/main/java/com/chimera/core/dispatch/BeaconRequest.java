package com.chimera.core.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Beacon sent by an agent. Every field except the platform may be omitted;
 * a missing paw registers a new agent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BeaconRequest(
    @JsonProperty("paw") String paw,
    @JsonProperty("platform") String platform,
    @JsonProperty("host") String hostname,
    @JsonProperty("group") String group,
    @JsonProperty("executors") List<String> executors,
    @JsonProperty("sleep") Integer sleepSeconds,
    @JsonProperty("jitter") Integer jitterSeconds
) {}
