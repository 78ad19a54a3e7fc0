package com.chimera.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A remote execution client that polls for work.
 *
 * @param paw           opaque identity, generated once at first beacon
 * @param platform      platform tag (e.g. "linux", "windows", "darwin")
 * @param hostname      reported host name, informational
 * @param group         agent group; operations recruit agents by group
 * @param executors     executor kinds the agent can run; empty means "any"
 * @param sleepSeconds  declared beacon interval
 * @param jitterSeconds maximum random delay added to the interval
 * @param firstSeen     first registration time
 * @param lastSeen      last beacon time
 * @param status        liveness state
 */
public record Agent(
    String paw,
    String platform,
    String hostname,
    String group,
    List<String> executors,
    int sleepSeconds,
    int jitterSeconds,
    Instant firstSeen,
    Instant lastSeen,
    AgentStatus status
) implements Serializable {

    public Agent {
        executors = executors == null ? List.of() : List.copyOf(executors);
    }

    /** Longest time between two beacons that still counts as on schedule. */
    public Duration beaconWindow() {
        return Duration.ofSeconds(Math.max(1, sleepSeconds) + (long) Math.max(0, jitterSeconds));
    }

    public boolean supportsExecutor(String executor) {
        return executors.isEmpty() || executors.contains(executor);
    }

    public Agent withStatus(AgentStatus newStatus) {
        return new Agent(paw, platform, hostname, group, executors, sleepSeconds, jitterSeconds,
                firstSeen, lastSeen, newStatus);
    }
}
