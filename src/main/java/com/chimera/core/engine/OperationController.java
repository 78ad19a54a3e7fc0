package com.chimera.core.engine;

import com.chimera.core.agent.AgentRegistry;
import com.chimera.core.events.ChimeraEvent;
import com.chimera.core.link.ReportOutcome;
import com.chimera.core.link.Transition;
import com.chimera.core.logging.MdcContext;
import com.chimera.core.model.AdversaryProfile;
import com.chimera.core.model.Agent;
import com.chimera.core.model.AgentStatus;
import com.chimera.core.model.Fact;
import com.chimera.core.model.Link;
import com.chimera.core.model.LinkStatus;
import com.chimera.core.model.OperationRecord;
import com.chimera.core.model.OperationStatus;
import com.chimera.core.model.PairKey;
import com.chimera.core.model.Provenance;
import com.chimera.core.persistence.JournalException;
import com.chimera.core.scheduler.SchedulingResult;
import com.chimera.core.scheduler.TieBreak;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Orchestrates one operation.
 * <p>
 * Every mutation (fact writes, link transitions, frontier changes, status
 * changes) runs under the operation's {@link ReentrantLock}, is journaled
 * before the lock is released, and ends by publishing a fresh
 * {@link OperationStatusView}. Events are published after the lock is released.
 * <p>
 * The operation finishes when the frontier is empty, no link is QUEUED or
 * DISPATCHED, a non-DEAD agent participates, and
 * {@value #QUIESCENT_ROUNDS_TO_FINISH} consecutive evaluations created nothing.
 */
public class OperationController {

    private static final Logger log = LoggerFactory.getLogger(OperationController.class);

    static final int QUIESCENT_ROUNDS_TO_FINISH = 2;

    private final ReentrantLock lock = new ReentrantLock();
    private final OperationState state;
    private final EngineServices services;

    private final List<ChimeraEvent> pendingEvents = new ArrayList<>();
    private final Set<String> knownLinks = ConcurrentHashMap.newKeySet();
    private boolean recordDirty = true;
    private volatile OperationStatusView view;

    public OperationController(OperationState state, EngineServices services) {
        this.state = state;
        this.services = services;
        this.view = project();
    }

    public String id() {
        return state.id();
    }

    public String group() {
        return state.record().group();
    }

    /** Latest status snapshot; never blocks. */
    public OperationStatusView view() {
        return view;
    }

    /** Whether the link was created by this operation. */
    public boolean owns(String linkId) {
        return knownLinks.contains(linkId);
    }

    /** RUNNING and PAUSED operations keep recruiting agents of their group. */
    public boolean isRecruiting() {
        OperationStatus status = view.status();
        return status == OperationStatus.RUNNING || status == OperationStatus.PAUSED;
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    /**
     * Seeds the fact store, recruits the given agents and runs the first evaluation.
     */
    public OperationStatusView start(Map<String, String> seeds, Collection<Agent> agents) {
        mutate(() -> {
            if (seeds != null) {
                seeds.forEach((key, value) -> {
                    Fact fact = state.facts().put(key, value, Provenance.seed());
                    state.recordFactWrite(fact);
                });
            }
            log.info("Starting operation '{}' ({}) with adversary {}, {} seed fact(s)",
                    state.record().name(), id(), state.profile().id(), state.facts().size());
            emit("operation.started", null, Map.of(
                    "adversary", state.profile().id(),
                    "abilities", state.profile().abilityIds().size()));
            for (Agent agent : agents) {
                if (agent.status() != AgentStatus.DEAD) {
                    joinLocked(agent);
                }
            }
            stepLocked();
            return null;
        });
        return view;
    }

    /** Runs one scheduling evaluation. */
    public OperationStatusView step() {
        mutate(() -> {
            stepLocked();
            return null;
        });
        return view;
    }

    /** Expires overdue DISPATCHED links, then runs one evaluation. */
    public OperationStatusView tick() {
        mutate(() -> {
            sweepTimeoutsLocked();
            stepLocked();
            return null;
        });
        return view;
    }

    /** Expires overdue DISPATCHED links without evaluating the frontier. */
    public OperationStatusView sweepTimeouts() {
        mutate(() -> {
            sweepTimeoutsLocked();
            return null;
        });
        return view;
    }

    public OperationStatusView cancel() {
        mutate(() -> {
            OperationStatus status = state.record().status();
            if (status.isClosed()) {
                throw new IllegalOperationStateException(id(), status, "cancel");
            }
            Instant now = services.clock().instant();
            var discarded = services.links().discard(state, link -> true, "operation cancelled", now);
            discarded.forEach(this::recordDiscard);
            for (PairKey pair : new ArrayList<>(state.frontier())) {
                state.removeFromFrontier(pair);
            }
            transition(OperationStatus.CANCELLED, null);
            return null;
        });
        return view;
    }

    public OperationStatusView pause() {
        mutate(() -> {
            requireStatus(OperationStatus.RUNNING, "pause");
            transition(OperationStatus.PAUSED, null);
            return null;
        });
        return view;
    }

    public OperationStatusView resume() {
        mutate(() -> {
            requireStatus(OperationStatus.PAUSED, "resume");
            transition(OperationStatus.RUNNING, null);
            stepLocked();
            return null;
        });
        return view;
    }

    /**
     * Replaces the profile's ability list. Removed abilities lose their frontier
     * pairs and their non-terminal links are DISCARDED; added abilities are
     * expanded for every schedulable participant.
     *
     * @throws IllegalArgumentException when an ability id is not in the catalog
     */
    public OperationStatusView updateProfile(List<String> abilityIds) {
        mutate(() -> {
            OperationStatus status = state.record().status();
            if (status != OperationStatus.RUNNING && status != OperationStatus.PAUSED) {
                throw new IllegalOperationStateException(id(), status, "edit");
            }
            var next = new ArrayList<>(new LinkedHashSet<>(abilityIds));
            for (String abilityId : next) {
                if (!services.catalog().contains(abilityId)) {
                    throw new IllegalArgumentException("Unknown ability: " + abilityId);
                }
            }
            AdversaryProfile current = state.profile();
            var removed = new ArrayList<>(current.abilityIds());
            removed.removeAll(next);
            var added = new ArrayList<>(next);
            added.removeAll(current.abilityIds());

            Instant now = services.clock().instant();
            var discarded = services.links().discard(state,
                    link -> removed.contains(link.abilityId()), "ability removed from profile", now);
            discarded.forEach(this::recordDiscard);
            for (PairKey pair : new ArrayList<>(state.frontier())) {
                if (removed.contains(pair.abilityId())) {
                    state.removeFromFrontier(pair);
                }
            }

            state.setProfile(current.withAbilities(next));
            for (String abilityId : added) {
                services.scheduler().expandFrontier(state, abilityId);
            }
            state.setQuiescentRounds(0);
            log.info("Operation {} profile edited: added {}, removed {}", id(), added, removed);
            emit("operation.profile", null, Map.of("added", List.copyOf(added), "removed", List.copyOf(removed)));
            stepLocked();
            return null;
        });
        return view;
    }

    // ── Agent protocol ──────────────────────────────────────────────────

    /**
     * Handles a beacon from an agent of this operation's group: joins it,
     * runs an evaluation and dispatches all of its QUEUED links in tie-break order.
     *
     * @return the links now DISPATCHED to the agent, empty when there is no work
     */
    public List<Link> beacon(Agent agent) {
        return mutate(() -> {
            OperationStatus status = state.record().status();
            if (status != OperationStatus.RUNNING && status != OperationStatus.PAUSED) {
                return List.of();
            }
            joinLocked(agent);
            if (status == OperationStatus.PAUSED) {
                return List.of();
            }
            stepLocked();
            List<Link> dispatched = dispatchLocked(agent.paw());
            if (!flushLocked()) {
                return List.of();
            }
            return dispatched;
        });
    }

    /**
     * Applies a result report. Rejections are logged and counted; they never
     * change state.
     */
    public ReportOutcome report(String paw, String linkId, String output, Integer exitCode, boolean success) {
        return mutate(() -> {
            MdcContext.setLink(id(), linkId, paw);
            if (state.record().status() == OperationStatus.ERROR) {
                return reject(paw, linkId, ReportOutcome.rejected(ReportOutcome.RejectReason.OPERATION_HALTED));
            }
            ReportOutcome outcome = services.links().complete(state, paw, linkId, output, exitCode, success,
                    services.clock().instant());
            switch (outcome.status()) {
                case REJECTED:
                    return reject(paw, linkId, outcome);
                case DUPLICATE:
                    log.debug("Duplicate report for link {} from {}", linkId, paw);
                    return outcome;
                default:
                    recordTransition(outcome.transition());
                    stepLocked();
                    return outcome;
            }
        });
    }

    /**
     * Applies a liveness change of a participant. A DEAD agent's non-terminal
     * links are DISCARDED and its frontier pairs dropped; the operation keeps
     * scheduling the other agents. A change older than the participant's last
     * beacon is ignored.
     */
    public OperationStatusView onAgentStatus(Agent agent) {
        mutate(() -> {
            Optional<Agent> current = state.participant(agent.paw());
            if (current.isEmpty()) {
                return null;
            }
            if (current.get().lastSeen().isAfter(agent.lastSeen())) {
                log.debug("Ignoring stale {} status of agent {} in operation {}", agent.status(), agent.paw(), id());
                return null;
            }
            state.putParticipant(agent);
            if (agent.status() == AgentStatus.DEAD && !state.record().status().isClosed()) {
                MdcContext.setAgent(agent.paw());
                var discarded = services.links().discard(state,
                        link -> link.paw().equals(agent.paw()), "agent dead", services.clock().instant());
                discarded.forEach(this::recordDiscard);
                for (PairKey pair : new ArrayList<>(state.frontier())) {
                    if (pair.paw().equals(agent.paw())) {
                        state.removeFromFrontier(pair);
                    }
                }
                log.warn("Agent {} is DEAD; {} link(s) discarded in operation {}", agent.paw(), discarded.size(), id());
                emit("agent.dead", null, Map.of("paw", agent.paw(), "discarded", discarded.size()));
                stepLocked();
            }
            return null;
        });
        return view;
    }

    // ── Read views ──────────────────────────────────────────────────────

    public List<Fact> facts() {
        return state.facts().all();
    }

    public List<Link> links() {
        return read(() -> state.links().stream().sorted(Comparator.comparingLong(Link::sequence)).toList());
    }

    public AdversaryProfile profile() {
        return read(state::profile);
    }

    // ── Locked internals ────────────────────────────────────────────────

    private void joinLocked(Agent agent) {
        if (!AgentRegistry.inGroup(agent, group())) {
            return;
        }
        Optional<Agent> previous = state.participant(agent.paw());
        state.putParticipant(agent);
        if (previous.isEmpty()) {
            log.info("Agent {} ({}) joined operation {}", agent.paw(), agent.platform(), id());
            emit("agent.joined", null, Map.of("paw", agent.paw(), "platform", String.valueOf(agent.platform())));
        }
        if (agent.status() != AgentStatus.DEAD) {
            services.scheduler().expandFrontier(state, agent);
        }
    }

    private void stepLocked() {
        if (state.record().status() != OperationStatus.RUNNING) {
            return;
        }
        SchedulingResult result = services.scheduler().evaluate(state, services.clock().instant());
        for (Link link : result.created()) {
            emit("link.queued", link.id(), Map.of(
                    "ability", link.abilityId(), "paw", link.paw(), "attempt", link.attempt()));
        }
        if (!result.created().isEmpty()) {
            services.metrics().recordLinksCreated(result.created().size());
        }

        if (!result.created().isEmpty() || state.hasInFlightLinks()) {
            state.setQuiescentRounds(0);
            return;
        }
        state.setQuiescentRounds(state.quiescentRounds() + 1);
        boolean anyAlive = state.participants().stream().anyMatch(a -> a.status() != AgentStatus.DEAD);
        if (anyAlive && state.frontier().isEmpty() && state.quiescentRounds() >= QUIESCENT_ROUNDS_TO_FINISH) {
            log.info("Operation {} reached a fixed point: {} link(s), {} fact(s)",
                    id(), state.links().size(), state.facts().size());
            transition(OperationStatus.FINISHED, null);
        }
    }

    private List<Link> dispatchLocked(String paw) {
        Instant now = services.clock().instant();
        var tieBreak = new TieBreak(state.profile(), services.catalog());
        List<Link> queued = state.links().stream()
                .filter(l -> l.paw().equals(paw) && l.status() == LinkStatus.QUEUED)
                .sorted(tieBreak.links())
                .toList();
        var dispatched = new ArrayList<Link>(queued.size());
        for (Link link : queued) {
            Link sent = services.links().dispatch(state, link, now);
            dispatched.add(sent);
            emit("link.dispatched", sent.id(), Map.of(
                    "ability", sent.abilityId(), "paw", paw, "attempt", sent.attempt()));
        }
        if (!dispatched.isEmpty()) {
            services.metrics().recordLinksDispatched(dispatched.size());
            log.info("Dispatched {} link(s) to agent {}", dispatched.size(), paw);
        }
        return dispatched;
    }

    private void sweepTimeoutsLocked() {
        OperationStatus status = state.record().status();
        if (status != OperationStatus.RUNNING && status != OperationStatus.PAUSED) {
            return;
        }
        for (Transition transition : services.links().expire(state, services.clock().instant(),
                services.linkTimeout())) {
            recordTransition(transition);
        }
    }

    private ReportOutcome reject(String paw, String linkId, ReportOutcome outcome) {
        log.warn("Rejected report for link {} from agent {}: {}", linkId, paw, outcome.reason());
        services.metrics().recordRejectedReport(outcome.reason().name());
        emit("report.rejected", linkId, Map.of("paw", String.valueOf(paw), "reason", outcome.reason().name()));
        return outcome;
    }

    private void recordTransition(Transition transition) {
        Link link = transition.link();
        Duration elapsed = link.dispatchedAt() == null || link.finishedAt() == null
                ? null : Duration.between(link.dispatchedAt(), link.finishedAt());
        services.metrics().recordLinkOutcome(link.status().name(), elapsed);
        emit("link.completed", link.id(), Map.of(
                "ability", link.abilityId(), "paw", link.paw(), "status", link.status().name(),
                "attempt", link.attempt()));

        if (!transition.committed().isEmpty()) {
            services.metrics().recordFactsCommitted(transition.committed().size());
            for (Fact fact : transition.committed()) {
                emit("fact.committed", link.id(), Map.of("key", fact.key(), "value", fact.value()));
            }
        }
        Link retry = transition.retry();
        if (retry != null) {
            services.metrics().recordRetry();
            emit("link.queued", retry.id(), Map.of(
                    "ability", retry.abilityId(), "paw", retry.paw(), "attempt", retry.attempt()));
        }
    }

    private void recordDiscard(Link link) {
        services.metrics().recordLinkOutcome(LinkStatus.DISCARDED.name(), null);
        emit("link.completed", link.id(), Map.of(
                "ability", link.abilityId(), "paw", link.paw(), "status", LinkStatus.DISCARDED.name(),
                "reason", link.reason()));
    }

    private void requireStatus(OperationStatus expected, String action) {
        OperationStatus status = state.record().status();
        if (status != expected) {
            throw new IllegalOperationStateException(id(), status, action);
        }
    }

    private void transition(OperationStatus next, String error) {
        OperationRecord before = state.record();
        state.setRecord(before.withStatus(next, error, services.clock().instant()));
        recordDirty = true;
        if (next == OperationStatus.ERROR) {
            log.error("Operation {} {} -> ERROR: {}", id(), before.status(), error);
        } else {
            log.info("Operation {} {} -> {}", id(), before.status(), next);
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", next.name());
        if (error != null) {
            payload.put("error", error);
        }
        emit("operation.status", null, payload);
        if (next.isClosed() || next == OperationStatus.ERROR) {
            services.metrics().recordOperationResult(next.name());
        }
    }

    /**
     * Writes everything changed since the last flush. A journal failure moves
     * the operation to ERROR; writes that did not complete stay pending and
     * are retried on the next flush.
     *
     * @return false if the journal rejected a write
     */
    private boolean flushLocked() {
        List<Link> links = state.pendingLinkWrites();
        links.forEach(link -> knownLinks.add(link.id()));
        try {
            if (recordDirty) {
                services.journal().saveOperation(state.record());
                recordDirty = false;
            }
            for (Link link : links) {
                services.journal().saveLink(link);
                state.linkWritten(link);
            }
            for (Fact fact : state.pendingFactWrites()) {
                services.journal().appendFact(id(), fact);
                state.factWritten(fact);
            }
            return true;
        } catch (JournalException e) {
            log.error("Journal write failed for operation {}: {}", id(), e.getMessage(), e);
            OperationStatus status = state.record().status();
            if (!status.isClosed() && status != OperationStatus.ERROR) {
                transition(OperationStatus.ERROR, "journal failure: " + e.getMessage());
            }
            return false;
        }
    }

    private void emit(String type, String linkId, Map<String, Object> payload) {
        pendingEvents.add(new ChimeraEvent(type, id(), linkId, payload, services.clock().instant()));
    }

    private <T> T mutate(Supplier<T> action) {
        List<ChimeraEvent> toPublish;
        T result;
        lock.lock();
        try {
            MdcContext.setOperation(id());
            result = action.get();
            flushLocked();
        } finally {
            view = project();
            toPublish = new ArrayList<>(pendingEvents);
            pendingEvents.clear();
            lock.unlock();
            MdcContext.clear();
        }
        toPublish.forEach(services.events()::publish);
        return result;
    }

    private <T> T read(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private OperationStatusView project() {
        var counts = new EnumMap<LinkStatus, Integer>(LinkStatus.class);
        for (LinkStatus status : LinkStatus.values()) {
            counts.put(status, 0);
        }
        var perAgent = new LinkedHashMap<String, int[]>();
        for (Agent agent : state.participants()) {
            perAgent.put(agent.paw(), new int[5]);
        }
        for (Link link : state.links()) {
            counts.merge(link.status(), 1, Integer::sum);
            int[] c = perAgent.computeIfAbsent(link.paw(), k -> new int[5]);
            switch (link.status()) {
                case CREATED:
                case QUEUED:
                    c[0]++;
                    break;
                case DISPATCHED:
                    c[1]++;
                    break;
                case SUCCESS:
                    c[2]++;
                    break;
                case FAILURE:
                case TIMEOUT:
                    c[3]++;
                    break;
                default:
                    c[4]++;
            }
        }
        var agents = new ArrayList<AgentProgress>();
        for (Agent agent : state.participants()) {
            int[] c = perAgent.get(agent.paw());
            agents.add(new AgentProgress(agent.paw(), agent.platform(), agent.status(), c[0], c[1], c[2], c[3], c[4]));
        }
        OperationRecord record = state.record();
        return new OperationStatusView(record.id(), record.name(), record.adversaryId(), record.group(),
                record.status(), record.error(), record.createdAt(), record.finishedAt(),
                Map.copyOf(counts), List.copyOf(agents), List.copyOf(services.scheduler().blocked(state)),
                state.facts().size(), state.frontier().size());
    }
}
