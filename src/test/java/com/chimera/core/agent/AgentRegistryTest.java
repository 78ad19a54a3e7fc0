package com.chimera.core.agent;

import com.chimera.core.config.ChimeraProperties;
import com.chimera.core.metrics.ChimeraMetrics;
import com.chimera.core.model.Agent;
import com.chimera.core.model.AgentStatus;
import com.chimera.core.persistence.InMemoryOperationJournal;
import com.chimera.core.persistence.JournalException;
import com.chimera.core.persistence.OperationJournal;
import com.chimera.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentRegistryTest {

    private MutableClock clock;
    private InMemoryOperationJournal journal;
    private SimpleMeterRegistry meters;
    private AgentRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        journal = new InMemoryOperationJournal();
        meters = new SimpleMeterRegistry();
        registry = new AgentRegistry(journal, new ChimeraProperties(), new ChimeraMetrics(meters), clock);
    }

    private Agent beacon(String paw) {
        return registry.register(paw, "Linux", "host-1", "red", List.of("sh"), 60, 0).agent();
    }

    @Nested
    @DisplayName("registration")
    class Registering {

        @Test
        @DisplayName("a beacon without a paw gets a generated identity")
        void generatesPaw() {
            var registration = registry.register(null, "Linux", "host-1", "red", List.of("sh"), 30, 5);

            assertTrue(registration.created());
            Agent agent = registration.agent();
            assertNotNull(agent.paw());
            assertFalse(agent.paw().isBlank());
            assertEquals("linux", agent.platform());
            assertEquals(30, agent.sleepSeconds());
            assertEquals(5, agent.jitterSeconds());
            assertEquals(AgentStatus.ACTIVE, agent.status());
            assertEquals(List.of(agent), journal.agents());
        }

        @Test
        @DisplayName("an unknown paw is registered under that paw")
        void keepsSuppliedPaw() {
            var registration = registry.register("paw-7", "windows", "ws", null, List.of(), null, null);

            assertTrue(registration.created());
            assertEquals("paw-7", registration.agent().paw());
            assertEquals(60, registration.agent().sleepSeconds());
            assertNull(registration.agent().group());
        }

        @Test
        @DisplayName("a known paw refreshes last-seen and keeps first-seen")
        void refreshes() {
            Agent first = beacon("paw-1");
            clock.advanceSeconds(45);

            var again = registry.register("paw-1", null, null, null, null, 60, 0);

            assertFalse(again.created());
            assertEquals(first.firstSeen(), again.agent().firstSeen());
            assertEquals(clock.instant(), again.agent().lastSeen());
            assertEquals("linux", again.agent().platform());
            assertEquals("red", again.agent().group());
            assertEquals(List.of("sh"), again.agent().executors());
        }

        @Test
        @DisplayName("beacons are counted by registration type")
        void countsBeacons() {
            beacon("paw-1");
            beacon("paw-1");

            assertEquals(1.0, meters.counter("chimera.beacons.total", "registration", "true").count());
            assertEquals(1.0, meters.counter("chimera.beacons.total", "registration", "false").count());
        }

        @Test
        @DisplayName("agents already in the journal are loaded on startup")
        void loadsFromJournal() {
            beacon("paw-1");
            var restarted = new AgentRegistry(journal, new ChimeraProperties(), new ChimeraMetrics(meters), clock);
            restarted.load();

            assertTrue(restarted.get("paw-1").isPresent());
            assertFalse(restarted.register("paw-1", "linux", "h", "red", List.of("sh"), 60, 0).created());
        }

        @Test
        @DisplayName("a journal failure does not fail the beacon")
        void journalFailure() {
            OperationJournal broken = mock(OperationJournal.class);
            when(broken.agents()).thenReturn(List.of());
            doThrow(new JournalException("disk full", null)).when(broken).saveAgent(any());
            var fragile = new AgentRegistry(broken, new ChimeraProperties(), new ChimeraMetrics(meters), clock);

            var registration = fragile.register("paw-1", "linux", "h", "red", List.of("sh"), 60, 0);

            assertTrue(registration.created());
            assertTrue(fragile.get("paw-1").isPresent());
        }
    }

    @Nested
    @DisplayName("liveness sweep")
    class Liveness {

        @Test
        @DisplayName("an agent within its beacon window stays ACTIVE")
        void onSchedule() {
            beacon("paw-1");
            clock.advanceSeconds(60);

            assertTrue(registry.sweep(clock.instant()).isEmpty());
        }

        @Test
        @DisplayName("one missed window makes an agent STALE")
        void stale() {
            beacon("paw-1");
            clock.advanceSeconds(61);

            List<LivenessChange> changes = registry.sweep(clock.instant());

            assertEquals(1, changes.size());
            assertEquals(AgentStatus.STALE, changes.get(0).agent().status());
            assertEquals(AgentStatus.ACTIVE, changes.get(0).previous());
            assertFalse(changes.get(0).becameDead());
        }

        @Test
        @DisplayName("three missed windows make an agent DEAD")
        void dead() {
            beacon("paw-1");
            clock.advanceSeconds(180);
            registry.sweep(clock.instant());
            assertEquals(AgentStatus.STALE, registry.get("paw-1").orElseThrow().status());

            clock.advanceSeconds(1);
            List<LivenessChange> changes = registry.sweep(clock.instant());

            assertTrue(changes.get(0).becameDead());
            assertEquals(AgentStatus.DEAD, registry.get("paw-1").orElseThrow().status());
            assertEquals(1.0, meters.counter("chimera.agents.dead").count());
            assertTrue(registry.sweep(clock.instant()).isEmpty());
        }

        @Test
        @DisplayName("a dead agent that beacons again is revived")
        void revived() {
            beacon("paw-1");
            clock.advanceSeconds(500);
            registry.sweep(clock.instant());

            var registration = registry.register("paw-1", "linux", "h", "red", List.of("sh"), 60, 0);

            assertTrue(registration.revived());
            assertEquals(AgentStatus.ACTIVE, registration.agent().status());
        }
    }

    @Test
    @DisplayName("a blank operation group recruits every agent")
    void groups() {
        Agent agent = beacon("paw-1");

        assertTrue(AgentRegistry.inGroup(agent, null));
        assertTrue(AgentRegistry.inGroup(agent, " "));
        assertTrue(AgentRegistry.inGroup(agent, "red"));
        assertFalse(AgentRegistry.inGroup(agent, "blue"));
    }
}
