package com.chimera.core.facts;

import com.chimera.core.model.Fact;
import com.chimera.core.model.Provenance;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only, versioned store of facts for one operation.
 * <p>
 * A key may hold several values over time; each append bumps the snapshot
 * version. Resolution picks the most recent value per key. The store has no
 * side effects beyond itself: callers decide when a version bump warrants
 * re-evaluating the schedule.
 */
public class FactStore {

    private final Clock clock;
    private final AtomicLong version = new AtomicLong();
    private final CopyOnWriteArrayList<Fact> facts = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Fact>> byKey = new ConcurrentHashMap<>();

    public FactStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Appends a new fact version. Never overwrites earlier values.
     *
     * @return the stored fact, carrying its assigned version
     */
    public synchronized Fact put(String key, String value, Provenance provenance) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Fact key must not be blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("Fact value must not be null (key " + key + ")");
        }
        var fact = new Fact(key, value, provenance == null ? Provenance.seed() : provenance,
                version.incrementAndGet(), clock.instant());
        facts.add(fact);
        byKey.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(fact);
        return fact;
    }

    /**
     * Resolves one value per required key using the most recently appended value.
     */
    public FactResolution resolve(Set<String> requiredKeys) {
        var values = new HashMap<String, String>();
        var missing = new HashSet<String>();
        for (String key : requiredKeys) {
            List<Fact> versions = byKey.get(key);
            if (versions == null || versions.isEmpty()) {
                missing.add(key);
            } else {
                values.put(key, versions.get(versions.size() - 1).value());
            }
        }
        return new FactResolution(values, missing);
    }

    public long snapshotVersion() {
        return version.get();
    }

    public List<String> values(String key) {
        List<Fact> versions = byKey.get(key);
        if (versions == null) return List.of();
        var result = new ArrayList<String>(versions.size());
        for (Fact f : versions) {
            result.add(f.value());
        }
        return result;
    }

    /** All facts in append order. */
    public List<Fact> all() {
        return List.copyOf(facts);
    }

    public int size() {
        return facts.size();
    }
}
