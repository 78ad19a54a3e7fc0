package com.chimera.core.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One dispatched link as handed to an agent.
 *
 * @param timeoutSeconds seconds after dispatch before the link times out
 */
public record Instruction(
    @JsonProperty("link_id") String linkId,
    @JsonProperty("operation_id") String operationId,
    @JsonProperty("command") String command,
    @JsonProperty("executor") String executor,
    @JsonProperty("timeout") long timeoutSeconds
) {}
