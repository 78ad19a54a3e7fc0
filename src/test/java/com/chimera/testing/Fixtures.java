package com.chimera.testing;

import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.executor.ExecutorRegistry;
import com.chimera.core.model.Ability;
import com.chimera.core.model.AdversaryProfile;
import com.chimera.core.model.Agent;
import com.chimera.core.model.AgentStatus;
import com.chimera.core.model.OutputRule;
import com.chimera.core.model.RetryPolicy;
import com.chimera.core.model.TacticPhase;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Builders for catalog and agent objects shared by engine tests.
 */
public final class Fixtures {

    private Fixtures() {}

    public static Ability ability(String id, String tactic, String command, OutputRule... rules) {
        return new Ability(id, id, tactic, null, Set.of(), "sh", command, Set.of(), List.of(rules),
                RetryPolicy.NONE, null);
    }

    public static Ability retrying(String id, String command, int maxAttempts) {
        return new Ability(id, id, null, null, Set.of(), "sh", command, Set.of(), List.of(),
                new RetryPolicy(maxAttempts), null);
    }

    public static Ability timed(String id, String command, Duration timeout) {
        return new Ability(id, id, null, null, Set.of(), "sh", command, Set.of(), List.of(),
                RetryPolicy.NONE, timeout);
    }

    public static Ability windowsOnly(String id, String tactic) {
        return new Ability(id, id, tactic, null, Set.of("windows"), "psh", "Get-Process", Set.of(), List.of(),
                RetryPolicy.NONE, null);
    }

    public static OutputRule keyValue(String key) {
        return new OutputRule("key_value", key, null);
    }

    public static OutputRule line(String key) {
        return new OutputRule("line", key, null);
    }

    public static AdversaryProfile profile(String id, List<String> abilityIds, TacticPhase... phases) {
        return new AdversaryProfile(id, id, abilityIds, List.of(phases));
    }

    public static TacticPhase phase(String name) {
        return new TacticPhase(name, false);
    }

    public static TacticPhase optionalPhase(String name) {
        return new TacticPhase(name, true);
    }

    public static AbilityCatalog catalog(List<Ability> abilities, AdversaryProfile... profiles) {
        return new AbilityCatalog(abilities, List.of(profiles), new ExecutorRegistry());
    }

    /** A linux agent with a 60s beacon window and no jitter. */
    public static Agent agent(String paw, Instant seen) {
        return new Agent(paw, "linux", paw + "-host", "red", List.of("sh"), 60, 0, seen, seen, AgentStatus.ACTIVE);
    }

    public static Agent windowsAgent(String paw, Instant seen) {
        return new Agent(paw, "windows", paw + "-host", "red", List.of("psh", "cmd"), 60, 0, seen, seen,
                AgentStatus.ACTIVE);
    }
}
