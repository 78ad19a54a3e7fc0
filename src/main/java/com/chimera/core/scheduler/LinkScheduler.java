package com.chimera.core.scheduler;

import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.engine.OperationState;
import com.chimera.core.facts.FactResolution;
import com.chimera.core.model.Ability;
import com.chimera.core.model.AdversaryProfile;
import com.chimera.core.model.Agent;
import com.chimera.core.model.Link;
import com.chimera.core.model.PairKey;
import com.chimera.core.model.TacticPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;

/**
 * Turns frontier pairs into QUEUED links once their required facts resolve
 * and their tactic phase is open.
 * <p>
 * Eligibility is a pure function of the operation's fact version, success
 * set and topology (participants, frontier, profile). When none of those
 * changed since the previous evaluation the frontier scan is skipped, so
 * re-evaluating on every fact bump and on a periodic tick reach the same
 * fixed point.
 */
@Service
public class LinkScheduler {

    private static final Logger log = LoggerFactory.getLogger(LinkScheduler.class);

    private final AbilityCatalog catalog;

    public LinkScheduler(AbilityCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Adds every (ability, agent) pair of the profile for a newly joined agent
     * to the frontier. Pairs whose ability cannot run on the agent are
     * permanently skipped; pairs already attempted are left alone.
     */
    public void expandFrontier(OperationState state, Agent agent) {
        for (String abilityId : state.profile().abilityIds()) {
            addPair(state, catalog.ability(abilityId), agent);
        }
    }

    /** Adds the pairs of one ability for every schedulable participant. */
    public void expandFrontier(OperationState state, String abilityId) {
        Ability ability = catalog.ability(abilityId);
        for (Agent agent : state.participants()) {
            if (state.isSchedulable(agent.paw())) {
                addPair(state, ability, agent);
            }
        }
    }

    private void addPair(OperationState state, Ability ability, Agent agent) {
        var pair = new PairKey(ability.id(), agent.paw());
        if (!ability.runsOn(agent.platform()) || !agent.supportsExecutor(ability.executor())) {
            if (!state.isSkipped(pair)) {
                log.debug("  {}: not applicable to {} ({}), skipped permanently",
                        ability.id(), agent.paw(), agent.platform());
                state.markSkipped(pair);
            }
            return;
        }
        if (state.wasAttempted(pair) || state.liveLink(pair).isPresent()) {
            return;
        }
        state.addToFrontier(pair);
    }

    /**
     * Evaluates the frontier and materializes every newly eligible pair as a QUEUED link.
     */
    public SchedulingResult evaluate(OperationState state, Instant now) {
        var stamp = state.currentStamp();
        if (stamp.equals(state.lastEvaluation())) {
            return new SchedulingResult(List.of(), List.of(), false);
        }

        AdversaryProfile profile = state.profile();
        var tieBreak = new TieBreak(profile, catalog);
        List<PairKey> ordered = new ArrayList<>(state.frontier());
        ordered.sort(Comparator.comparing(PairKey::abilityId, tieBreak.abilities()));

        log.debug("evaluate {}: {} frontier pairs, factVersion={}, successes={}",
                state.id(), ordered.size(), stamp.factVersion(), stamp.successCount());

        var created = new ArrayList<Link>();
        var blocked = new ArrayList<BlockedPair>();
        for (PairKey pair : ordered) {
            if (!state.isSchedulable(pair.paw())) {
                continue;
            }
            if (state.liveLink(pair).isPresent()) {
                // Never two live links for one pair
                state.removeFromFrontier(pair);
                continue;
            }
            Ability ability = catalog.ability(pair.abilityId());

            String closedPhase = closedEarlierPhase(state, ability);
            if (closedPhase != null) {
                blocked.add(new BlockedPair(pair.abilityId(), pair.paw(), Set.of(), closedPhase));
                continue;
            }

            FactResolution resolution = state.facts().resolve(ability.requiredFacts());
            if (!resolution.isResolved()) {
                blocked.add(new BlockedPair(pair.abilityId(), pair.paw(), resolution.missing(), null));
                continue;
            }

            String command = catalog.render(ability.id(), resolution.values());
            Link link = Link.queued(UUID.randomUUID().toString(), state.id(), ability.id(), pair.paw(),
                    ability.executor(), command, 1, state.nextSequence(), now);
            state.putLink(link);
            state.removeFromFrontier(pair);
            created.add(link);
            log.debug("  {}: eligible, link {} queued for {}", ability.id(), link.id(), pair.paw());
        }

        state.setLastEvaluation(state.currentStamp());
        if (!created.isEmpty()) {
            log.info("Operation {}: {} link(s) queued, {} pair(s) blocked", state.id(), created.size(), blocked.size());
        }
        return new SchedulingResult(created, blocked, true);
    }

    /**
     * Lists the frontier pairs that are currently ineligible, without creating links.
     */
    public List<BlockedPair> blocked(OperationState state) {
        var blocked = new ArrayList<BlockedPair>();
        for (PairKey pair : state.frontier()) {
            if (!state.isSchedulable(pair.paw()) || !catalog.contains(pair.abilityId())) continue;
            Ability ability = catalog.ability(pair.abilityId());
            String closedPhase = closedEarlierPhase(state, ability);
            FactResolution resolution = state.facts().resolve(ability.requiredFacts());
            if (closedPhase != null || !resolution.isResolved()) {
                blocked.add(new BlockedPair(pair.abilityId(), pair.paw(), resolution.missing(), closedPhase));
            }
        }
        return blocked;
    }

    /**
     * Returns the first strictly-earlier, non-optional phase in which some
     * ability has no SUCCESS link yet, or null when the ability's phase is open.
     * Abilities that fit none of the participants cannot succeed and do not hold a phase closed.
     */
    private String closedEarlierPhase(OperationState state, Ability ability) {
        AdversaryProfile profile = state.profile();
        OptionalInt phase = profile.phaseIndex(ability.tactic());
        if (phase.isEmpty()) {
            return null;
        }
        for (int i = 0; i < phase.getAsInt(); i++) {
            TacticPhase earlier = profile.phases().get(i);
            if (earlier.optional()) continue;
            for (String abilityId : profile.abilityIds()) {
                Ability candidate = catalog.ability(abilityId);
                OptionalInt candidatePhase = profile.phaseIndex(candidate.tactic());
                if (candidatePhase.isPresent() && candidatePhase.getAsInt() == i
                        && !state.hasSuccess(abilityId) && !inapplicableEverywhere(state, abilityId)) {
                    return earlier.name();
                }
            }
        }
        return null;
    }

    private boolean inapplicableEverywhere(OperationState state, String abilityId) {
        boolean anyParticipant = false;
        for (Agent agent : state.participants()) {
            anyParticipant = true;
            if (!state.isSkipped(new PairKey(abilityId, agent.paw()))) {
                return false;
            }
        }
        return anyParticipant;
    }
}
