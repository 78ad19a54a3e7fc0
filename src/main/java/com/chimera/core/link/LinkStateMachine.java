package com.chimera.core.link;

import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.engine.OperationState;
import com.chimera.core.executor.OutputInterpreter;
import com.chimera.core.executor.ParsedFact;
import com.chimera.core.model.Ability;
import com.chimera.core.model.Fact;
import com.chimera.core.model.Link;
import com.chimera.core.model.LinkStatus;
import com.chimera.core.model.Provenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Owns every link transition after creation:
 * <pre>
 *   QUEUED → DISPATCHED → {SUCCESS, FAILURE, TIMEOUT}
 *   any non-terminal → DISCARDED
 * </pre>
 * Facts are committed only on SUCCESS. FAILURE and TIMEOUT re-queue a fresh
 * link for the same pair while the ability's retry policy allows it.
 * Callers hold the operation lock.
 */
@Service
public class LinkStateMachine {

    private static final Logger log = LoggerFactory.getLogger(LinkStateMachine.class);

    private final AbilityCatalog catalog;
    private final OutputInterpreter interpreter;

    public LinkStateMachine(AbilityCatalog catalog, OutputInterpreter interpreter) {
        this.catalog = catalog;
        this.interpreter = interpreter;
    }

    /** QUEUED → DISPATCHED on beacon pickup. */
    public Link dispatch(OperationState state, Link link, Instant now) {
        if (link.status() != LinkStatus.QUEUED) {
            throw new IllegalStateException("Link " + link.id() + " is " + link.status() + ", not QUEUED");
        }
        Link dispatched = link.dispatched(now);
        state.putLink(dispatched);
        return dispatched;
    }

    /**
     * Applies a reported result. Repeat reports for SUCCESS/FAILURE/TIMEOUT
     * links are accepted without any state change.
     */
    public ReportOutcome complete(OperationState state, String paw, String linkId, String output,
                                  Integer exitCode, boolean success, Instant now) {
        Link link = state.link(linkId).orElse(null);
        if (link == null) {
            return ReportOutcome.rejected(ReportOutcome.RejectReason.UNKNOWN_LINK);
        }
        if (!link.paw().equals(paw)) {
            return ReportOutcome.rejected(ReportOutcome.RejectReason.WRONG_AGENT);
        }
        switch (link.status()) {
            case DISCARDED:
                return ReportOutcome.rejected(ReportOutcome.RejectReason.DISCARDED);
            case SUCCESS:
            case FAILURE:
            case TIMEOUT:
                log.debug("Duplicate report for link {} ({}), ignored", linkId, link.status());
                return ReportOutcome.duplicate();
            case CREATED:
            case QUEUED:
                return ReportOutcome.rejected(ReportOutcome.RejectReason.NOT_DISPATCHED);
            default:
                break;
        }

        if (success) {
            return ReportOutcome.accepted(succeed(state, link, output, exitCode, now));
        }
        return ReportOutcome.accepted(fail(state, link, LinkStatus.FAILURE, output, exitCode,
                "executor reported failure", now));
    }

    /** DISPATCHED → TIMEOUT for links whose dispatch age exceeds their timeout. */
    public List<Transition> expire(OperationState state, Instant now, Duration defaultTimeout) {
        var expired = new ArrayList<Link>();
        for (Link link : state.links()) {
            if (link.status() != LinkStatus.DISPATCHED || link.dispatchedAt() == null) continue;
            Duration timeout = timeoutFor(link.abilityId(), defaultTimeout);
            if (Duration.between(link.dispatchedAt(), now).compareTo(timeout) > 0) {
                expired.add(link);
            }
        }
        var transitions = new ArrayList<Transition>();
        for (Link link : expired) {
            log.info("Link {} ({} on {}) timed out after {}", link.id(), link.abilityId(), link.paw(),
                    Duration.between(link.dispatchedAt(), now));
            transitions.add(fail(state, link, LinkStatus.TIMEOUT, null, null, "no result within timeout", now));
        }
        return transitions;
    }

    /** Any non-terminal → DISCARDED for links matching the filter. */
    public List<Link> discard(OperationState state, Predicate<Link> filter, String reason, Instant now) {
        var targets = state.links().stream()
                .filter(l -> !l.status().isTerminal())
                .filter(filter)
                .toList();
        var discarded = new ArrayList<Link>();
        for (Link link : targets) {
            Link done = link.finished(LinkStatus.DISCARDED, now, null, null, reason);
            state.putLink(done);
            discarded.add(done);
        }
        if (!discarded.isEmpty()) {
            log.info("Operation {}: discarded {} link(s): {}", state.id(), discarded.size(), reason);
        }
        return discarded;
    }

    private Transition succeed(OperationState state, Link link, String output, Integer exitCode, Instant now) {
        Link done = link.finished(LinkStatus.SUCCESS, now, output, exitCode, null);
        state.putLink(done);

        var committed = new ArrayList<Fact>();
        if (catalog.contains(link.abilityId())) {
            Ability ability = catalog.ability(link.abilityId());
            for (ParsedFact parsed : interpreter.interpret(ability, output)) {
                Fact fact = state.facts().put(parsed.key(), parsed.value(), Provenance.link(link.id()));
                state.recordFactWrite(fact);
                committed.add(fact);
            }
        }
        log.info("Link {} ({} on {}) succeeded, {} fact(s) committed",
                link.id(), link.abilityId(), link.paw(), committed.size());
        return new Transition(done, null, committed);
    }

    private Transition fail(OperationState state, Link link, LinkStatus terminal, String output,
                            Integer exitCode, String reason, Instant now) {
        Link done = link.finished(terminal, now, output, exitCode, reason);
        state.putLink(done);

        Link retry = null;
        boolean inProfile = state.profile().abilityIds().contains(link.abilityId());
        if (inProfile && catalog.contains(link.abilityId()) && state.isSchedulable(link.paw())
                && catalog.ability(link.abilityId()).retry().allowsAnotherAttempt(link.attempt())) {
            retry = Link.queued(UUID.randomUUID().toString(), state.id(), link.abilityId(), link.paw(),
                    link.executor(), link.command(), link.attempt() + 1, state.nextSequence(), now);
            state.putLink(retry);
            log.info("Link {} ({} on {}) {}; retry attempt {} queued as {}", link.id(), link.abilityId(),
                    link.paw(), terminal, retry.attempt(), retry.id());
        } else {
            log.info("Link {} ({} on {}) {} after attempt {}", link.id(), link.abilityId(), link.paw(),
                    terminal, link.attempt());
        }
        return new Transition(done, retry, List.of());
    }

    private Duration timeoutFor(String abilityId, Duration defaultTimeout) {
        if (catalog.contains(abilityId)) {
            Duration own = catalog.ability(abilityId).timeout();
            if (own != null) return own;
        }
        return defaultTimeout;
    }
}
