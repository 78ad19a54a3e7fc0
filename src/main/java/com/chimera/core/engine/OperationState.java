package com.chimera.core.engine;

import com.chimera.core.facts.FactStore;
import com.chimera.core.model.AdversaryProfile;
import com.chimera.core.model.Agent;
import com.chimera.core.model.AgentStatus;
import com.chimera.core.model.Fact;
import com.chimera.core.model.Link;
import com.chimera.core.model.LinkStatus;
import com.chimera.core.model.OperationRecord;
import com.chimera.core.model.PairKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one operation: profile, facts, participants, frontier and
 * link table.
 * <p>
 * Not thread-safe. Every access goes through the owning
 * {@link OperationController}, which holds the operation lock. Links and
 * facts stay pending until the controller reports them journaled.
 */
public class OperationState {

    private OperationRecord record;
    private AdversaryProfile profile;
    private final FactStore facts;

    private final LinkedHashMap<String, Agent> participants = new LinkedHashMap<>();
    private final LinkedHashSet<PairKey> frontier = new LinkedHashSet<>();
    private final Set<PairKey> skipped = new HashSet<>();
    private final LinkedHashMap<String, Link> links = new LinkedHashMap<>();
    private final Set<String> succeededAbilities = new HashSet<>();

    private final LinkedHashMap<String, Link> linkWrites = new LinkedHashMap<>();
    private final List<Fact> factWrites = new ArrayList<>();

    private long nextSequence = 1;
    private long topologyVersion;
    private int quiescentRounds;
    private EvaluationStamp lastEvaluation;

    public OperationState(OperationRecord record, AdversaryProfile profile, FactStore facts) {
        this.record = record;
        this.profile = profile;
        this.facts = facts;
    }

    public String id() {
        return record.id();
    }

    public OperationRecord record() {
        return record;
    }

    void setRecord(OperationRecord record) {
        this.record = record;
    }

    public AdversaryProfile profile() {
        return profile;
    }

    void setProfile(AdversaryProfile profile) {
        this.profile = profile;
        touchTopology();
    }

    public FactStore facts() {
        return facts;
    }

    // ── Participants ─────────────────────────────────────────────────────

    public Collection<Agent> participants() {
        return participants.values();
    }

    public Optional<Agent> participant(String paw) {
        return Optional.ofNullable(participants.get(paw));
    }

    public boolean isSchedulable(String paw) {
        Agent agent = participants.get(paw);
        return agent != null && agent.status() != AgentStatus.DEAD;
    }

    public void putParticipant(Agent agent) {
        Agent previous = participants.put(agent.paw(), agent);
        if (previous == null || previous.status() != agent.status()) {
            touchTopology();
        }
    }

    // ── Frontier ────────────────────────────────────────────────────────

    public Set<PairKey> frontier() {
        return frontier;
    }

    public void addToFrontier(PairKey pair) {
        if (frontier.add(pair)) {
            touchTopology();
        }
    }

    public void removeFromFrontier(PairKey pair) {
        if (frontier.remove(pair)) {
            touchTopology();
        }
    }

    public void markSkipped(PairKey pair) {
        skipped.add(pair);
    }

    public boolean isSkipped(PairKey pair) {
        return skipped.contains(pair);
    }

    // ── Links ───────────────────────────────────────────────────────────

    public Collection<Link> links() {
        return links.values();
    }

    public Optional<Link> link(String linkId) {
        return Optional.ofNullable(links.get(linkId));
    }

    /** Inserts or replaces a link and records it for journaling. */
    public void putLink(Link link) {
        Link previous = links.put(link.id(), link);
        linkWrites.put(link.id(), link);
        if (link.status() == LinkStatus.SUCCESS && (previous == null || previous.status() != LinkStatus.SUCCESS)) {
            succeededAbilities.add(link.abilityId());
        }
    }

    public long nextSequence() {
        return nextSequence++;
    }

    /** The non-terminal link of a pair, if any. At most one exists. */
    public Optional<Link> liveLink(PairKey pair) {
        return links.values().stream()
                .filter(l -> !l.status().isTerminal() && l.pair().equals(pair))
                .findFirst();
    }

    /** Whether any link other than a DISCARDED one exists for the pair. */
    public boolean wasAttempted(PairKey pair) {
        return links.values().stream()
                .anyMatch(l -> l.pair().equals(pair) && l.status() != LinkStatus.DISCARDED);
    }

    public boolean hasSuccess(String abilityId) {
        return succeededAbilities.contains(abilityId);
    }

    public int successCount() {
        return succeededAbilities.size();
    }

    public boolean hasInFlightLinks() {
        return links.values().stream().anyMatch(l -> l.status().isInFlight());
    }

    // ── Facts ───────────────────────────────────────────────────────────

    /** Records a fact appended to the store so it is journaled on the next flush. */
    public void recordFactWrite(Fact fact) {
        factWrites.add(fact);
    }

    // ── Journal bookkeeping ─────────────────────────────────────────────

    List<Link> pendingLinkWrites() {
        return new ArrayList<>(linkWrites.values());
    }

    /** Clears a journaled link unless a newer version was recorded since. */
    void linkWritten(Link link) {
        linkWrites.remove(link.id(), link);
    }

    List<Fact> pendingFactWrites() {
        return new ArrayList<>(factWrites);
    }

    void factWritten(Fact fact) {
        factWrites.remove(fact);
    }

    // ── Evaluation bookkeeping ──────────────────────────────────────────

    public void touchTopology() {
        topologyVersion++;
    }

    public EvaluationStamp currentStamp() {
        return new EvaluationStamp(facts.snapshotVersion(), succeededAbilities.size(), topologyVersion);
    }

    public EvaluationStamp lastEvaluation() {
        return lastEvaluation;
    }

    public void setLastEvaluation(EvaluationStamp stamp) {
        this.lastEvaluation = stamp;
    }

    int quiescentRounds() {
        return quiescentRounds;
    }

    void setQuiescentRounds(int rounds) {
        this.quiescentRounds = rounds;
    }

    /**
     * Everything eligibility depends on. Two evaluations with equal stamps
     * necessarily produce the same links.
     */
    public record EvaluationStamp(long factVersion, int successCount, long topologyVersion) {}
}
