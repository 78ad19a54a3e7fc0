package com.chimera.core.agent;

import com.chimera.core.config.ChimeraProperties;
import com.chimera.core.metrics.ChimeraMetrics;
import com.chimera.core.model.Agent;
import com.chimera.core.model.AgentStatus;
import com.chimera.core.persistence.JournalException;
import com.chimera.core.persistence.OperationJournal;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent identities and liveness, shared by every operation.
 * <p>
 * An agent is mutated only here: by its own beacons and by the liveness
 * sweep. Identity survives across operations and, with a JDBC journal,
 * across restarts.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final OperationJournal journal;
    private final ChimeraProperties properties;
    private final ChimeraMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, Agent> agents = new ConcurrentHashMap<>();

    public AgentRegistry(OperationJournal journal, ChimeraProperties properties,
                         ChimeraMetrics metrics, Clock clock) {
        this.journal = journal;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    void load() {
        try {
            for (Agent agent : journal.agents()) {
                agents.put(agent.paw(), agent);
            }
            if (!agents.isEmpty()) {
                log.info("Loaded {} known agent(s) from journal", agents.size());
            }
        } catch (JournalException e) {
            log.error("Could not load agents from journal: {}", e.getMessage(), e);
        }
    }

    /**
     * Applies a beacon. A missing or unknown paw registers a new agent; a
     * known paw refreshes its profile and last-seen time and makes it ACTIVE.
     */
    public synchronized Registration register(String paw, String platform, String hostname, String group,
                                              List<String> executors, Integer sleepSeconds, Integer jitterSeconds) {
        Instant now = clock.instant();
        int sleep = sleepSeconds != null && sleepSeconds > 0 ? sleepSeconds : properties.getDefaultSleepSeconds();
        int jitter = jitterSeconds != null && jitterSeconds >= 0 ? jitterSeconds : properties.getDefaultJitterSeconds();

        Agent existing = paw == null || paw.isBlank() ? null : agents.get(paw);
        Agent agent;
        boolean created = existing == null;
        boolean revived = false;
        if (created) {
            String id = paw == null || paw.isBlank() ? UUID.randomUUID().toString() : paw;
            agent = new Agent(id, normalizePlatform(platform), hostname, blankToNull(group), executors,
                    sleep, jitter, now, now, AgentStatus.ACTIVE);
            log.info("New agent {} registered ({} / {}, group {})", id, agent.platform(), hostname, agent.group());
        } else {
            revived = existing.status() == AgentStatus.DEAD;
            agent = new Agent(existing.paw(),
                    platform == null ? existing.platform() : normalizePlatform(platform),
                    hostname == null ? existing.hostname() : hostname,
                    group == null ? existing.group() : blankToNull(group),
                    executors == null || executors.isEmpty() ? existing.executors() : executors,
                    sleep, jitter, existing.firstSeen(), now, AgentStatus.ACTIVE);
            if (revived) {
                log.info("Agent {} beaconed again after being declared DEAD", agent.paw());
            } else if (existing.status() == AgentStatus.STALE) {
                log.info("Agent {} is back on schedule", agent.paw());
            }
        }
        agents.put(agent.paw(), agent);
        persist(agent);
        metrics.recordBeacon(created);
        return new Registration(agent, created, revived);
    }

    public Optional<Agent> get(String paw) {
        return Optional.ofNullable(agents.get(paw));
    }

    public List<Agent> list() {
        var result = new ArrayList<>(agents.values());
        result.sort(Comparator.comparing(Agent::firstSeen).thenComparing(Agent::paw));
        return result;
    }

    /**
     * Marks agents STALE after one missed beacon window and DEAD after the
     * configured number of missed windows. DEAD is final until the agent beacons again.
     *
     * @return the agents whose status changed
     */
    public synchronized List<LivenessChange> sweep(Instant now) {
        var changes = new ArrayList<LivenessChange>();
        int deadAfter = Math.max(1, properties.getDeadAfterMissedBeacons());
        for (Agent agent : agents.values()) {
            if (agent.status() == AgentStatus.DEAD) continue;

            Duration silent = Duration.between(agent.lastSeen(), now);
            Duration window = agent.beaconWindow();
            AgentStatus next;
            if (silent.compareTo(window.multipliedBy(deadAfter)) > 0) {
                next = AgentStatus.DEAD;
            } else if (silent.compareTo(window) > 0) {
                next = AgentStatus.STALE;
            } else {
                next = AgentStatus.ACTIVE;
            }
            if (next == agent.status()) continue;

            Agent updated = agent.withStatus(next);
            agents.put(updated.paw(), updated);
            persist(updated);
            changes.add(new LivenessChange(updated, agent.status()));
            if (next == AgentStatus.DEAD) {
                metrics.recordAgentDead();
                log.warn("Agent {} missed {} beacon windows (silent for {}), marked DEAD",
                        agent.paw(), deadAfter, silent);
            } else {
                log.info("Agent {} {} -> {} (silent for {})", agent.paw(), agent.status(), next, silent);
            }
        }
        return changes;
    }

    /** An agent joins an operation whose group matches; a null or blank operation group matches every agent. */
    public static boolean inGroup(Agent agent, String operationGroup) {
        return operationGroup == null || operationGroup.isBlank() || operationGroup.equals(agent.group());
    }

    private void persist(Agent agent) {
        try {
            journal.saveAgent(agent);
        } catch (JournalException e) {
            // Agent identity is rebuilt from the next beacon; operations are unaffected.
            log.error("Failed to journal agent {}: {}", agent.paw(), e.getMessage(), e);
        }
    }

    private static String normalizePlatform(String platform) {
        return platform == null ? null : platform.trim().toLowerCase();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
