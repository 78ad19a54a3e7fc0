package com.chimera.core.scheduler;

import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.engine.OperationState;
import com.chimera.core.facts.FactStore;
import com.chimera.core.model.AdversaryProfile;
import com.chimera.core.model.AgentStatus;
import com.chimera.core.model.Link;
import com.chimera.core.model.LinkStatus;
import com.chimera.core.model.OperationRecord;
import com.chimera.core.model.OperationStatus;
import com.chimera.core.model.PairKey;
import com.chimera.core.model.Provenance;
import com.chimera.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.chimera.testing.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LinkSchedulerTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    private OperationState state(AdversaryProfile profile) {
        var record = new OperationRecord("op-1", "test", profile.id(), null, OperationStatus.RUNNING,
                null, clock.instant(), null);
        return new OperationState(record, profile, new FactStore(clock));
    }

    private static List<String> abilityIds(List<Link> links) {
        return links.stream().map(Link::abilityId).toList();
    }

    @Nested
    @DisplayName("fact requirements")
    class Requirements {

        private final AbilityCatalog catalog = catalog(List.of(
                ability("a", null, "whoami"),
                ability("b", null, "sudo -u #{user} id")),
                profile("p", List.of("a", "b")));
        private final LinkScheduler scheduler = new LinkScheduler(catalog);

        @Test
        @DisplayName("abilities without requirements are queued on the first evaluation")
        void noRequirements() {
            var state = state(catalog.profile("p").orElseThrow());
            state.putParticipant(agent("paw-1", clock.instant()));
            scheduler.expandFrontier(state, agent("paw-1", clock.instant()));

            var result = scheduler.evaluate(state, clock.instant());

            assertTrue(result.evaluated());
            assertEquals(List.of("a"), abilityIds(result.created()));
            Link link = result.created().get(0);
            assertEquals(LinkStatus.QUEUED, link.status());
            assertEquals("whoami", link.command());
            assertEquals(1, link.attempt());
            assertEquals(1, result.blocked().size());
            assertEquals(Set.of("user"), result.blocked().get(0).missingFacts());
            assertNull(result.blocked().get(0).waitingPhase());
        }

        @Test
        @DisplayName("a pair becomes eligible once its fact is committed, with the value rendered")
        void resolvesAfterFact() {
            var state = state(catalog.profile("p").orElseThrow());
            state.putParticipant(agent("paw-1", clock.instant()));
            scheduler.expandFrontier(state, agent("paw-1", clock.instant()));
            scheduler.evaluate(state, clock.instant());

            state.facts().put("user", "alice", Provenance.seed());
            var result = scheduler.evaluate(state, clock.instant());

            assertEquals(List.of("b"), abilityIds(result.created()));
            assertEquals("sudo -u alice id", result.created().get(0).command());
            assertTrue(state.frontier().isEmpty());
        }

        @Test
        @DisplayName("the most recent value of a key is used")
        void latestValue() {
            var state = state(catalog.profile("p").orElseThrow());
            state.facts().put("user", "alice", Provenance.seed());
            state.facts().put("user", "bob", Provenance.seed());
            state.putParticipant(agent("paw-1", clock.instant()));
            scheduler.expandFrontier(state, agent("paw-1", clock.instant()));

            var result = scheduler.evaluate(state, clock.instant());

            assertEquals("sudo -u bob id", result.created().get(1).command());
        }

        @Test
        @DisplayName("an unchanged stamp skips the evaluation")
        void skipsWhenUnchanged() {
            var state = state(catalog.profile("p").orElseThrow());
            state.putParticipant(agent("paw-1", clock.instant()));
            scheduler.expandFrontier(state, agent("paw-1", clock.instant()));
            scheduler.evaluate(state, clock.instant());

            var second = scheduler.evaluate(state, clock.instant());

            assertFalse(second.evaluated());
            assertTrue(second.created().isEmpty());
        }

        @Test
        @DisplayName("a pair with a live link is not added back to the frontier")
        void noSecondLiveLink() {
            var state = state(catalog.profile("p").orElseThrow());
            var agent = agent("paw-1", clock.instant());
            state.putParticipant(agent);
            scheduler.expandFrontier(state, agent);
            scheduler.evaluate(state, clock.instant());

            scheduler.expandFrontier(state, agent);

            assertFalse(state.frontier().contains(new PairKey("a", "paw-1")));
            assertEquals(1, state.links().size());
        }

        @Test
        @DisplayName("dead participants are not scheduled")
        void deadParticipant() {
            var state = state(catalog.profile("p").orElseThrow());
            var agent = agent("paw-1", clock.instant());
            state.putParticipant(agent);
            scheduler.expandFrontier(state, agent);
            state.putParticipant(agent.withStatus(AgentStatus.DEAD));

            var result = scheduler.evaluate(state, clock.instant());

            assertTrue(result.created().isEmpty());
        }

        @Test
        @DisplayName("blocked() reports missing facts without creating links")
        void blockedReport() {
            var state = state(catalog.profile("p").orElseThrow());
            state.putParticipant(agent("paw-1", clock.instant()));
            scheduler.expandFrontier(state, agent("paw-1", clock.instant()));

            List<BlockedPair> blocked = scheduler.blocked(state);

            assertEquals(1, blocked.size());
            assertEquals("b", blocked.get(0).abilityId());
            assertTrue(state.links().isEmpty());
        }
    }

    @Nested
    @DisplayName("platform applicability")
    class Platforms {

        @Test
        @DisplayName("abilities that cannot run on the agent are skipped permanently")
        void skipped() {
            var catalog = catalog(List.of(windowsOnly("w", null), ability("a", null, "id")),
                    profile("p", List.of("w", "a")));
            var scheduler = new LinkScheduler(catalog);
            var state = state(catalog.profile("p").orElseThrow());
            var agent = agent("paw-1", clock.instant());
            state.putParticipant(agent);

            scheduler.expandFrontier(state, agent);

            assertTrue(state.isSkipped(new PairKey("w", "paw-1")));
            assertEquals(Set.of(new PairKey("a", "paw-1")), state.frontier());
        }

        @Test
        @DisplayName("a windows agent receives only the abilities it can run")
        void windowsAgentGetsWindowsAbility() {
            var catalog = catalog(List.of(windowsOnly("w", null), ability("a", null, "id")),
                    profile("p", List.of("w", "a")));
            var scheduler = new LinkScheduler(catalog);
            var state = state(catalog.profile("p").orElseThrow());
            var agent = windowsAgent("win-1", clock.instant());
            state.putParticipant(agent);
            scheduler.expandFrontier(state, agent);

            var result = scheduler.evaluate(state, clock.instant());

            // the sh ability needs an executor the windows agent does not declare
            assertEquals(List.of("w"), abilityIds(result.created()));
        }
    }

    @Nested
    @DisplayName("phase gating")
    class Phases {

        private final AbilityCatalog catalog = catalog(List.of(
                ability("esc", "escalation", "sudo id"),
                ability("disc", "discovery", "whoami"),
                windowsOnly("win-disc", "discovery")),
                profile("gated", List.of("esc", "disc", "win-disc"), phase("discovery"), phase("escalation")),
                profile("optional", List.of("esc", "disc"), optionalPhase("discovery"), phase("escalation")));
        private final LinkScheduler scheduler = new LinkScheduler(catalog);

        @Test
        @DisplayName("later phases wait for every applicable ability of earlier phases to succeed")
        void laterPhaseWaits() {
            var state = state(catalog.profile("gated").orElseThrow());
            var agent = agent("paw-1", clock.instant());
            state.putParticipant(agent);
            scheduler.expandFrontier(state, agent);

            var first = scheduler.evaluate(state, clock.instant());

            assertEquals(List.of("disc"), abilityIds(first.created()));
            assertEquals(1, first.blocked().size());
            assertEquals("discovery", first.blocked().get(0).waitingPhase());

            Link disc = first.created().get(0);
            state.putLink(disc.dispatched(clock.instant()).finished(LinkStatus.SUCCESS, clock.instant(), "root", 0, null));

            var second = scheduler.evaluate(state, clock.instant());
            assertEquals(List.of("esc"), abilityIds(second.created()));
        }

        @Test
        @DisplayName("a failed earlier ability keeps the later phase closed")
        void failureKeepsPhaseClosed() {
            var state = state(catalog.profile("gated").orElseThrow());
            var agent = agent("paw-1", clock.instant());
            state.putParticipant(agent);
            scheduler.expandFrontier(state, agent);
            Link disc = scheduler.evaluate(state, clock.instant()).created().get(0);

            state.putLink(disc.dispatched(clock.instant()).finished(LinkStatus.FAILURE, clock.instant(), "", 1, null));
            var result = scheduler.evaluate(state, clock.instant());

            assertTrue(result.created().isEmpty());
            List<BlockedPair> blocked = scheduler.blocked(state);
            assertEquals(1, blocked.size());
            assertEquals("esc", blocked.get(0).abilityId());
            assertEquals("discovery", blocked.get(0).waitingPhase());
        }

        @Test
        @DisplayName("optional phases do not gate later phases")
        void optionalPhaseDoesNotGate() {
            var state = state(catalog.profile("optional").orElseThrow());
            var agent = agent("paw-1", clock.instant());
            state.putParticipant(agent);
            scheduler.expandFrontier(state, agent);

            var result = scheduler.evaluate(state, clock.instant());

            assertEquals(List.of("disc", "esc"), abilityIds(result.created()));
        }

        @Test
        @DisplayName("links are created in phase order, then profile order")
        void tieBreakOrder() {
            var state = state(catalog.profile("optional").orElseThrow());
            var a1 = agent("paw-1", clock.instant());
            var a2 = agent("paw-2", clock.instant());
            state.putParticipant(a1);
            state.putParticipant(a2);
            scheduler.expandFrontier(state, a1);
            scheduler.expandFrontier(state, a2);

            var created = scheduler.evaluate(state, clock.instant()).created();

            assertEquals(List.of("disc", "disc", "esc", "esc"), abilityIds(created));
            assertTrue(created.get(0).sequence() < created.get(1).sequence());
        }
    }
}
