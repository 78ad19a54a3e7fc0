package com.chimera.core.engine;

import com.chimera.core.agent.LivenessChange;
import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.dispatch.Instruction;
import com.chimera.core.link.ReportOutcome;
import com.chimera.core.model.AgentStatus;
import com.chimera.core.model.LinkStatus;
import com.chimera.core.model.OperationStatus;
import com.chimera.core.persistence.InMemoryOperationJournal;
import com.chimera.core.persistence.JournalException;
import com.chimera.testing.EngineHarness;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.chimera.testing.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class OperationControllerTest {

    private static AbilityCatalog threeAbilities() {
        return catalog(List.of(
                ability("a", null, "id"),
                ability("b", null, "uname -a"),
                ability("c", null, "hostname")),
                profile("p", List.of("a", "b", "c")));
    }

    @Nested
    @DisplayName("journal failures")
    class JournalFailures {

        @Test
        @DisplayName("a failed link write moves the operation to ERROR and withholds the work")
        void linkWriteFails() {
            InMemoryOperationJournal journal = spy(new InMemoryOperationJournal());
            var engine = new EngineHarness(threeAbilities(), journal);
            engine.register("paw-1");
            String id = engine.operations.start(null, "p", null, Map.of()).id();

            doThrow(new JournalException("connection refused", null)).when(journal).saveLink(any());
            List<Instruction> instructions = engine.beacon("paw-1");

            assertTrue(instructions.isEmpty());
            OperationStatusView view = engine.operations.view(id);
            assertEquals(OperationStatus.ERROR, view.status());
            assertTrue(view.error().startsWith("journal failure"));
            assertEquals(OperationStatus.ERROR, journal.operation(id).orElseThrow().status());
        }

        @Test
        @DisplayName("writes rejected by the journal are retried on the next flush")
        void failedWritesRetried() {
            InMemoryOperationJournal journal = spy(new InMemoryOperationJournal());
            doThrow(new JournalException("connection reset", null)).doCallRealMethod()
                    .when(journal).saveLink(any());
            var engine = new EngineHarness(threeAbilities(), journal);
            engine.register("paw-1");

            String id = engine.operations.start(null, "p", null, Map.of("target", "10.0.0.5")).id();
            assertEquals(OperationStatus.ERROR, engine.operations.view(id).status());
            assertTrue(journal.facts(id).isEmpty());

            engine.operations.get(id).cancel();

            assertEquals(1, journal.facts(id).size());
            assertEquals("10.0.0.5", journal.facts(id).get(0).value());
            assertEquals(3, journal.links(id).size());
            assertTrue(journal.links(id).stream().allMatch(l -> l.status() == LinkStatus.DISCARDED));
            assertEquals(OperationStatus.CANCELLED, journal.operation(id).orElseThrow().status());
        }

        @Test
        @DisplayName("an operation in ERROR rejects reports and only allows cancel")
        void errorIsHalted() {
            InMemoryOperationJournal journal = spy(new InMemoryOperationJournal());
            var engine = new EngineHarness(threeAbilities(), journal);
            String id = engine.operations.start(null, "p", null, Map.of()).id();
            List<Instruction> instructions = engine.beacon("paw-1");

            doThrow(new JournalException("disk full", null)).when(journal).saveLink(any());
            engine.fail("paw-1", instructions.get(0));
            assertEquals(OperationStatus.ERROR, engine.operations.view(id).status());
            assertTrue(engine.beacon("paw-1").isEmpty());

            ReportOutcome outcome = engine.succeed("paw-1", instructions.get(1), "");
            assertEquals(ReportOutcome.RejectReason.OPERATION_HALTED, outcome.reason());

            OperationController controller = engine.operations.get(id);
            assertThrows(IllegalOperationStateException.class, controller::pause);
            assertThrows(IllegalOperationStateException.class, controller::resume);
            assertThrows(IllegalOperationStateException.class, () -> controller.updateProfile(List.of("a")));
            assertEquals(OperationStatus.CANCELLED, controller.cancel().status());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("concurrent beacons from one agent never receive the same link twice")
        void sameAgentConcurrentBeacons() throws Exception {
            var engine = new EngineHarness(threeAbilities());
            engine.operations.start(null, "p", null, Map.of());

            List<Instruction> all = beaconConcurrently(engine, List.of(
                    "paw-1", "paw-1", "paw-1", "paw-1", "paw-1", "paw-1", "paw-1", "paw-1"));

            assertEquals(3, all.size());
            assertEquals(3, new HashSet<>(all.stream().map(Instruction::linkId).toList()).size());
        }

        @Test
        @DisplayName("concurrent beacons from many agents receive one link per pair")
        void manyAgentsConcurrentBeacons() throws Exception {
            var engine = new EngineHarness(threeAbilities());
            String id = engine.operations.start(null, "p", null, Map.of()).id();

            List<Instruction> all = beaconConcurrently(engine, List.of(
                    "paw-1", "paw-2", "paw-3", "paw-4", "paw-1", "paw-2", "paw-3", "paw-4"));

            assertEquals(12, all.size());
            assertEquals(12, new HashSet<>(all.stream().map(Instruction::linkId).toList()).size());
            assertEquals(12, engine.operations.get(id).links().size());
        }

        private List<Instruction> beaconConcurrently(EngineHarness engine, List<String> paws) throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(paws.size());
            CountDownLatch ready = new CountDownLatch(1);
            try {
                var futures = new ArrayList<Future<List<Instruction>>>();
                for (String paw : paws) {
                    Callable<List<Instruction>> task = () -> {
                        ready.await();
                        return engine.beacon(paw);
                    };
                    futures.add(pool.submit(task));
                }
                ready.countDown();
                var all = new ArrayList<Instruction>();
                for (Future<List<Instruction>> future : futures) {
                    all.addAll(future.get(10, TimeUnit.SECONDS));
                }
                return all;
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Test
    @DisplayName("the status view is a snapshot that later mutations do not change")
    void viewIsSnapshot() {
        var engine = new EngineHarness(threeAbilities());
        String id = engine.operations.start(null, "p", null, Map.of()).id();
        OperationStatusView before = engine.operations.view(id);

        engine.beacon("paw-1");

        assertTrue(before.agents().isEmpty());
        assertEquals(1, engine.operations.view(id).agents().size());
        assertEquals(3, engine.operations.view(id).agents().get(0).dispatched());
    }

    @Nested
    @DisplayName("liveness")
    class Liveness {

        @Test
        @DisplayName("a DEAD status older than the agent's latest beacon is ignored")
        void staleDeadIgnored() {
            var engine = new EngineHarness(threeAbilities());
            engine.register("paw-1");
            String id = engine.operations.start(null, "p", null, Map.of()).id();

            engine.clock.advance(Duration.ofMinutes(5));
            List<LivenessChange> changes = engine.agents.sweep(engine.clock.instant());
            assertTrue(changes.get(0).becameDead());

            engine.clock.advance(Duration.ofSeconds(1));
            List<Instruction> instructions = engine.beacon("paw-1");
            assertEquals(3, instructions.size());

            OperationController controller = engine.operations.get(id);
            controller.onAgentStatus(changes.get(0).agent());

            OperationStatusView view = engine.operations.view(id);
            assertEquals(AgentStatus.ACTIVE, view.agents().get(0).status());
            assertEquals(0, view.agents().get(0).discarded());
            assertEquals(ReportOutcome.Status.ACCEPTED,
                    engine.succeed("paw-1", instructions.get(0), "").status());
        }
    }
}
