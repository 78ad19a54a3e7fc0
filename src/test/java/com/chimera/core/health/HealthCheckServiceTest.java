package com.chimera.core.health;

import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.executor.ExecutorRegistry;
import com.chimera.core.persistence.JdbcOperationJournal;
import com.chimera.testing.EngineHarness;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.chimera.testing.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static AbilityCatalog catalogWithProfile() {
        return catalog(List.of(ability("a", null, "id")), profile("p", List.of("a")));
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    private static HealthCheckService service(EngineHarness engine, DataSource dataSource) {
        return new HealthCheckService(engine.catalog, engine.journal, engine.agents, engine.operations, dataSource);
    }

    @Test
    @DisplayName("checkAll reports catalog, journal, agents and operations")
    void components() {
        var results = service(new EngineHarness(catalogWithProfile()), null).checkAll();

        assertEquals(List.of("catalog", "journal", "agents", "operations"),
                results.stream().map(HealthStatus::component).toList());
    }

    @Test
    @DisplayName("an empty catalog and an in-memory journal are DEGRADED")
    void degraded() {
        var engine = new EngineHarness(AbilityCatalog.empty(new ExecutorRegistry()));
        var results = service(engine, null).checkAll();

        assertEquals(HealthStatus.Status.DEGRADED, component(results, "catalog").status());
        assertEquals(HealthStatus.Status.DEGRADED, component(results, "journal").status());
    }

    @Test
    @DisplayName("a JDBC journal with a reachable database is UP")
    void jdbcUp() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:health-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        var journal = new JdbcOperationJournal(dataSource, new ObjectMapper());
        journal.createTables();
        var engine = new EngineHarness(catalogWithProfile(), journal);

        var results = service(engine, dataSource).checkAll();

        assertEquals(HealthStatus.Status.UP, component(results, "journal").status());
        assertEquals(HealthStatus.Status.UP, component(results, "catalog").status());
    }

    @Test
    @DisplayName("a JDBC journal whose database refuses connections is DOWN")
    void jdbcDown() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));
        var engine = new EngineHarness(catalogWithProfile(),
                new JdbcOperationJournal(dataSource, new ObjectMapper()));

        HealthStatus journal = component(service(engine, dataSource).checkAll(), "journal");

        assertEquals(HealthStatus.Status.DOWN, journal.status());
        assertTrue(journal.detail().contains("connection refused"));
    }

    @Test
    @DisplayName("agent counts are reported by liveness")
    void agents() {
        var engine = new EngineHarness(catalogWithProfile());
        engine.register("paw-1");
        engine.register("paw-2");
        engine.clock.advanceSeconds(61);
        engine.register("paw-2");
        engine.agents.sweep(engine.clock.instant());

        HealthStatus agents = component(service(engine, null).checkAll(), "agents");

        assertEquals("1", agents.metadata().get("active"));
        assertEquals("1", agents.metadata().get("stale"));
    }

    @Test
    @DisplayName("the actuator indicator is DOWN when any component is DOWN")
    void indicator() {
        var service = mock(HealthCheckService.class);
        when(service.checkAll()).thenReturn(List.of(
                new HealthStatus("catalog", HealthStatus.Status.UP, "ok", Map.of()),
                new HealthStatus("journal", HealthStatus.Status.DOWN, "db gone", Map.of())));

        Health health = new EngineHealthIndicator(service).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("DOWN (db gone)", health.getDetails().get("journal"));
    }

    @Test
    @DisplayName("the actuator indicator is DEGRADED when a component is degraded")
    void indicatorDegraded() {
        var service = mock(HealthCheckService.class);
        when(service.checkAll()).thenReturn(List.of(
                new HealthStatus("journal", HealthStatus.Status.DEGRADED, "in-memory", Map.of())));

        assertEquals("DEGRADED", new EngineHealthIndicator(service).health().getStatus().getCode());
    }
}
