package com.chimera.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * An immutable technique definition from the catalog.
 *
 * @param id           unique ability id
 * @param name         human-readable name
 * @param tactic       tactic the ability belongs to; matched against profile phases
 * @param description  free text
 * @param platforms    platforms the ability runs on; empty or "*" means any
 * @param executor     executor kind tag, opaque to the engine
 * @param command      command template with {@code #{key}} placeholders
 * @param requiredFacts fact keys that must resolve before the ability is scheduled
 * @param outputRules  rules that turn output into facts
 * @param retry        retry policy applied on FAILURE and TIMEOUT
 * @param timeout      per-ability dispatch timeout; null uses the global default
 */
public record Ability(
    String id,
    String name,
    String tactic,
    String description,
    Set<String> platforms,
    String executor,
    String command,
    Set<String> requiredFacts,
    List<OutputRule> outputRules,
    RetryPolicy retry,
    Duration timeout
) implements Serializable {

    public Ability {
        platforms = platforms == null ? Set.of() : Set.copyOf(platforms);
        requiredFacts = requiredFacts == null ? Set.of() : Set.copyOf(requiredFacts);
        outputRules = outputRules == null ? List.of() : List.copyOf(outputRules);
        retry = retry == null ? RetryPolicy.NONE : retry;
    }

    public boolean runsOn(String platform) {
        return platforms.isEmpty() || platforms.contains("*")
                || (platform != null && platforms.contains(platform.toLowerCase()));
    }
}
