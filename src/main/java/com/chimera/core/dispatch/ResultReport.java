package com.chimera.core.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of one link reported by an agent.
 *
 * @param output   raw output, base64 encoded when {@code encoded} is true
 * @param exitCode process exit code; nonzero means failure unless {@code status} says otherwise
 * @param status   optional explicit outcome, "success" or "failure"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResultReport(
    @JsonProperty("paw") String paw,
    @JsonProperty("link_id") String linkId,
    @JsonProperty("output") String output,
    @JsonProperty("encoded") boolean encoded,
    @JsonProperty("exit_code") Integer exitCode,
    @JsonProperty("status") String status
) {

    /** Explicit status wins; otherwise a missing or zero exit code is success. */
    public boolean succeeded() {
        if (status != null && !status.isBlank()) {
            return status.equalsIgnoreCase("success");
        }
        return exitCode == null || exitCode == 0;
    }
}
