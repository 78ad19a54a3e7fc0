package com.chimera.core.link;

import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.engine.OperationState;
import com.chimera.core.executor.ExecutorRegistry;
import com.chimera.core.executor.OutputInterpreter;
import com.chimera.core.facts.FactStore;
import com.chimera.core.model.Ability;
import com.chimera.core.model.AgentStatus;
import com.chimera.core.model.Link;
import com.chimera.core.model.LinkStatus;
import com.chimera.core.model.OperationRecord;
import com.chimera.core.model.OperationStatus;
import com.chimera.core.model.OutputRule;
import com.chimera.core.model.RetryPolicy;
import com.chimera.testing.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static com.chimera.testing.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LinkStateMachineTest {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private MutableClock clock;
    private LinkStateMachine machine;
    private OperationState state;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        AbilityCatalog catalog = catalog(List.of(
                ability("whoami", null, "whoami", keyValue("user")),
                retrying("flaky", "curl http://c2/", 3),
                timed("slow", "sleep 600", Duration.ofSeconds(30)),
                new Ability("mixed", "mixed", null, null, Set.of(), "sh", "id", Set.of(),
                        List.of(new OutputRule("regex", "uid", ""), keyValue("user")), RetryPolicy.NONE, null)),
                profile("p", List.of("whoami", "flaky", "slow")));
        machine = new LinkStateMachine(catalog, new OutputInterpreter(new ExecutorRegistry(), new ObjectMapper()));
        var record = new OperationRecord("op-1", "test", "p", null, OperationStatus.RUNNING, null,
                clock.instant(), null);
        state = new OperationState(record, catalog.profile("p").orElseThrow(), new FactStore(clock));
        state.putParticipant(agent("paw-1", clock.instant()));
    }

    private Link queue(String abilityId, String command) {
        Link link = Link.queued(abilityId + "-link", "op-1", abilityId, "paw-1", "sh", command, 1,
                state.nextSequence(), clock.instant());
        state.putLink(link);
        return link;
    }

    private Link dispatched(String abilityId, String command) {
        return machine.dispatch(state, queue(abilityId, command), clock.instant());
    }

    @Nested
    @DisplayName("dispatch")
    class Dispatch {

        @Test
        @DisplayName("moves a queued link to DISPATCHED with a pickup time")
        void dispatches() {
            Link link = dispatched("whoami", "whoami");

            assertEquals(LinkStatus.DISPATCHED, link.status());
            assertEquals(clock.instant(), link.dispatchedAt());
            assertEquals(link, state.link(link.id()).orElseThrow());
        }

        @Test
        @DisplayName("refuses links that are not queued")
        void refusesDispatched() {
            Link link = dispatched("whoami", "whoami");
            assertThrows(IllegalStateException.class, () -> machine.dispatch(state, link, clock.instant()));
        }
    }

    @Nested
    @DisplayName("reports")
    class Reports {

        @Test
        @DisplayName("SUCCESS commits parsed facts with link provenance")
        void successCommitsFacts() {
            Link link = dispatched("whoami", "whoami");

            ReportOutcome outcome = machine.complete(state, "paw-1", link.id(), "user=alice\n", 0, true,
                    clock.instant());

            assertEquals(ReportOutcome.Status.ACCEPTED, outcome.status());
            assertEquals(LinkStatus.SUCCESS, outcome.transition().link().status());
            assertEquals(1, outcome.transition().committed().size());
            assertEquals(link.id(), outcome.transition().committed().get(0).provenance().linkId());
            assertEquals(List.of("alice"), state.facts().values("user"));
            assertTrue(state.hasSuccess("whoami"));
        }

        @Test
        @DisplayName("a rule that cannot parse is skipped and the other rules still commit")
        void brokenRuleSkipped() {
            Link link = dispatched("mixed", "id");

            ReportOutcome outcome = machine.complete(state, "paw-1", link.id(), "user=alice\n", 0, true,
                    clock.instant());

            assertEquals(ReportOutcome.Status.ACCEPTED, outcome.status());
            assertEquals(LinkStatus.SUCCESS, outcome.transition().link().status());
            assertEquals(List.of("alice"), state.facts().values("user"));
            assertTrue(state.facts().values("uid").isEmpty());
        }

        @Test
        @DisplayName("FAILURE commits no facts, even when the output parses")
        void failureCommitsNothing() {
            Link link = dispatched("whoami", "whoami");

            ReportOutcome outcome = machine.complete(state, "paw-1", link.id(), "user=alice", 1, false,
                    clock.instant());

            assertEquals(LinkStatus.FAILURE, outcome.transition().link().status());
            assertTrue(outcome.transition().committed().isEmpty());
            assertNull(outcome.transition().retry());
            assertEquals(0, state.facts().size());
        }

        @Test
        @DisplayName("a repeat report on a finished link is a no-op")
        void duplicate() {
            Link link = dispatched("whoami", "whoami");
            machine.complete(state, "paw-1", link.id(), "user=alice", 0, true, clock.instant());
            long version = state.facts().snapshotVersion();

            ReportOutcome again = machine.complete(state, "paw-1", link.id(), "user=bob", 0, true, clock.instant());

            assertEquals(ReportOutcome.Status.DUPLICATE, again.status());
            assertEquals(version, state.facts().snapshotVersion());
            assertEquals(List.of("alice"), state.facts().values("user"));
        }

        @Test
        @DisplayName("reports from another agent are rejected")
        void wrongAgent() {
            Link link = dispatched("whoami", "whoami");

            ReportOutcome outcome = machine.complete(state, "paw-2", link.id(), "user=x", 0, true, clock.instant());

            assertTrue(outcome.isRejected());
            assertEquals(ReportOutcome.RejectReason.WRONG_AGENT, outcome.reason());
            assertEquals(LinkStatus.DISPATCHED, state.link(link.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("unknown links, queued links and discarded links are rejected")
        void rejections() {
            assertEquals(ReportOutcome.RejectReason.UNKNOWN_LINK,
                    machine.complete(state, "paw-1", "nope", "", 0, true, clock.instant()).reason());

            Link queued = queue("whoami", "whoami");
            assertEquals(ReportOutcome.RejectReason.NOT_DISPATCHED,
                    machine.complete(state, "paw-1", queued.id(), "", 0, true, clock.instant()).reason());

            machine.discard(state, l -> true, "cancelled", clock.instant());
            assertEquals(ReportOutcome.RejectReason.DISCARDED,
                    machine.complete(state, "paw-1", queued.id(), "", 0, true, clock.instant()).reason());
        }
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("an ability with max_attempts 3 is attempted exactly three times")
        void exactlyMaxAttempts() {
            Link link = dispatched("flaky", "curl http://c2/");
            int attempts = 1;
            while (true) {
                ReportOutcome outcome = machine.complete(state, "paw-1", link.id(), "refused", 7, false,
                        clock.instant());
                Link retry = outcome.transition().retry();
                if (retry == null) break;
                assertEquals(LinkStatus.QUEUED, retry.status());
                assertEquals(link.attempt() + 1, retry.attempt());
                assertEquals(link.command(), retry.command());
                attempts++;
                link = machine.dispatch(state, retry, clock.instant());
            }

            assertEquals(3, attempts);
            assertEquals(3, state.links().stream().filter(l -> l.status() == LinkStatus.FAILURE).count());
        }

        @Test
        @DisplayName("no retry is queued for an agent that is dead")
        void noRetryForDeadAgent() {
            Link link = dispatched("flaky", "curl http://c2/");
            state.putParticipant(agent("paw-1", clock.instant()).withStatus(AgentStatus.DEAD));

            ReportOutcome outcome = machine.complete(state, "paw-1", link.id(), "", 1, false, clock.instant());

            assertNull(outcome.transition().retry());
        }

        @Test
        @DisplayName("no retry is queued for an ability removed from the profile")
        void noRetryOutsideProfile() {
            Link link = dispatched("flaky", "curl http://c2/");
            var trimmed = state.profile().withAbilities(List.of("whoami"));
            var fresh = new OperationState(state.record(), trimmed, state.facts());
            fresh.putParticipant(agent("paw-1", clock.instant()));
            fresh.putLink(link);

            ReportOutcome outcome = machine.complete(fresh, "paw-1", link.id(), "", 1, false, clock.instant());

            assertNull(outcome.transition().retry());
        }
    }

    @Nested
    @DisplayName("timeouts")
    class Timeouts {

        @Test
        @DisplayName("links past their own timeout expire, others stay dispatched")
        void perAbilityTimeout() {
            Link slow = dispatched("slow", "sleep 600");
            Link quick = dispatched("whoami", "whoami");

            clock.advanceSeconds(31);
            List<Transition> expired = machine.expire(state, clock.instant(), DEFAULT_TIMEOUT);

            assertEquals(1, expired.size());
            assertEquals(slow.id(), expired.get(0).link().id());
            assertEquals(LinkStatus.TIMEOUT, expired.get(0).link().status());
            assertEquals(LinkStatus.DISPATCHED, state.link(quick.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("the global default applies when the ability has no timeout")
        void defaultTimeout() {
            dispatched("whoami", "whoami");

            clock.advance(DEFAULT_TIMEOUT);
            assertTrue(machine.expire(state, clock.instant(), DEFAULT_TIMEOUT).isEmpty());

            clock.advanceSeconds(1);
            assertEquals(1, machine.expire(state, clock.instant(), DEFAULT_TIMEOUT).size());
        }

        @Test
        @DisplayName("a late result after a timeout commits nothing")
        void lateResult() {
            Link link = dispatched("whoami", "whoami");
            clock.advance(DEFAULT_TIMEOUT.plusSeconds(1));
            machine.expire(state, clock.instant(), DEFAULT_TIMEOUT);

            ReportOutcome outcome = machine.complete(state, "paw-1", link.id(), "user=alice", 0, true,
                    clock.instant());

            assertEquals(ReportOutcome.Status.DUPLICATE, outcome.status());
            assertEquals(0, state.facts().size());
        }
    }

    @Test
    @DisplayName("discard only touches live links matching the filter")
    void discard() {
        Link done = dispatched("whoami", "whoami");
        machine.complete(state, "paw-1", done.id(), "", 0, true, clock.instant());
        Link live = dispatched("flaky", "curl http://c2/");

        List<Link> discarded = machine.discard(state, l -> true, "operation cancelled", clock.instant());

        assertEquals(1, discarded.size());
        assertEquals(live.id(), discarded.get(0).id());
        assertEquals("operation cancelled", discarded.get(0).reason());
        assertEquals(LinkStatus.SUCCESS, state.link(done.id()).orElseThrow().status());
    }
}
