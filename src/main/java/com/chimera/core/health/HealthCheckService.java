package com.chimera.core.health;

import com.chimera.core.agent.AgentRegistry;
import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.engine.OperationService;
import com.chimera.core.engine.OperationStatusView;
import com.chimera.core.model.Agent;
import com.chimera.core.model.AgentStatus;
import com.chimera.core.model.OperationStatus;
import com.chimera.core.persistence.JdbcOperationJournal;
import com.chimera.core.persistence.OperationJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AbilityCatalog catalog;
    private final OperationJournal journal;
    private final AgentRegistry agents;
    private final OperationService operations;
    private final DataSource dataSource;

    public HealthCheckService(
            AbilityCatalog catalog,
            OperationJournal journal,
            AgentRegistry agents,
            OperationService operations,
            @Autowired(required = false) DataSource dataSource) {
        this.catalog = catalog;
        this.journal = journal;
        this.agents = agents;
        this.operations = operations;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCatalog());
        results.add(checkJournal());
        results.add(checkAgents());
        results.add(checkOperations());
        return results;
    }

    private HealthStatus checkCatalog() {
        int abilities = catalog.abilities().size();
        int profiles = catalog.profiles().size();
        var metadata = Map.of("abilities", String.valueOf(abilities), "adversaries", String.valueOf(profiles));
        if (profiles == 0) {
            return new HealthStatus("catalog", HealthStatus.Status.DEGRADED,
                    "No adversary profiles loaded", metadata);
        }
        return new HealthStatus("catalog", HealthStatus.Status.UP,
                abilities + " abilities, " + profiles + " adversaries", metadata);
    }

    private HealthStatus checkJournal() {
        if (!(journal instanceof JdbcOperationJournal)) {
            return new HealthStatus("journal", HealthStatus.Status.DEGRADED,
                    "In-memory journal, state is lost on restart", Map.of());
        }
        if (dataSource == null) {
            return new HealthStatus("journal", HealthStatus.Status.DOWN,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("journal", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("journal", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Journal health check failed: {}", e.getMessage());
            return new HealthStatus("journal", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkAgents() {
        int active = 0;
        int stale = 0;
        int dead = 0;
        for (Agent agent : agents.list()) {
            if (agent.status() == AgentStatus.ACTIVE) active++;
            else if (agent.status() == AgentStatus.STALE) stale++;
            else dead++;
        }
        var metadata = Map.of("active", String.valueOf(active), "stale", String.valueOf(stale),
                "dead", String.valueOf(dead));
        return new HealthStatus("agents", HealthStatus.Status.UP,
                active + " active, " + stale + " stale, " + dead + " dead", metadata);
    }

    private HealthStatus checkOperations() {
        List<OperationStatusView> views = operations.list();
        long errored = views.stream().filter(v -> v.status() == OperationStatus.ERROR).count();
        long running = views.stream().filter(v -> v.status() == OperationStatus.RUNNING).count();
        var metadata = Map.of("running", String.valueOf(running), "error", String.valueOf(errored));
        if (errored > 0) {
            return new HealthStatus("operations", HealthStatus.Status.DEGRADED,
                    errored + " operation(s) halted by journal failures", metadata);
        }
        return new HealthStatus("operations", HealthStatus.Status.UP, running + " running", metadata);
    }
}
