package com.chimera.core.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reply to a beacon: the agent's identity, when to beacon next, and its work.
 */
public record BeaconResponse(
    @JsonProperty("paw") String paw,
    @JsonProperty("sleep") int sleepSeconds,
    @JsonProperty("instructions") List<Instruction> instructions
) {}
