package com.chimera.core.engine;

import com.chimera.core.agent.AgentRegistry;
import com.chimera.core.agent.LivenessChange;
import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.config.ChimeraProperties;
import com.chimera.core.events.EventBus;
import com.chimera.core.facts.FactStore;
import com.chimera.core.link.LinkStateMachine;
import com.chimera.core.metrics.ChimeraMetrics;
import com.chimera.core.model.AdversaryProfile;
import com.chimera.core.model.Agent;
import com.chimera.core.model.OperationRecord;
import com.chimera.core.model.OperationStatus;
import com.chimera.core.persistence.OperationJournal;
import com.chimera.core.scheduler.LinkScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every {@link OperationController} of this process and routes agent
 * traffic and operator actions to them.
 */
@Service
public class OperationService {

    private static final Logger log = LoggerFactory.getLogger(OperationService.class);

    private final AbilityCatalog catalog;
    private final AgentRegistry agents;
    private final OperationJournal journal;
    private final EngineServices services;
    private final Clock clock;

    private final ConcurrentHashMap<String, OperationController> operations = new ConcurrentHashMap<>();

    public OperationService(AbilityCatalog catalog, LinkScheduler scheduler, LinkStateMachine links,
                            OperationJournal journal, EventBus events, ChimeraMetrics metrics,
                            ChimeraProperties properties, AgentRegistry agents, Clock clock) {
        this.catalog = catalog;
        this.agents = agents;
        this.journal = journal;
        this.clock = clock;
        this.services = new EngineServices(catalog, scheduler, links, journal, events, metrics, clock,
                properties.getLinkTimeout());
    }

    /**
     * Starts an operation and recruits every known, non-DEAD agent of the group.
     *
     * @param group agent group to recruit from; null or blank recruits every agent
     * @param seeds operator-supplied facts, in insertion order
     * @throws AdversaryNotFoundException when the adversary profile is unknown
     */
    public OperationStatusView start(String name, String adversaryId, String group, Map<String, String> seeds) {
        AdversaryProfile profile = catalog.profile(adversaryId)
                .orElseThrow(() -> new AdversaryNotFoundException(adversaryId));
        String id = UUID.randomUUID().toString();
        var record = new OperationRecord(id,
                name == null || name.isBlank() ? profile.name() : name,
                profile.id(),
                group == null || group.isBlank() ? null : group,
                OperationStatus.RUNNING, null, clock.instant(), null);
        var controller = new OperationController(new OperationState(record, profile, new FactStore(clock)), services);
        operations.put(id, controller);
        return controller.start(seeds == null ? Map.of() : seeds, agents.list());
    }

    public OperationController get(String operationId) {
        OperationController controller = operations.get(operationId);
        if (controller == null) {
            throw new OperationNotFoundException(operationId);
        }
        return controller;
    }

    public boolean exists(String operationId) {
        return operations.containsKey(operationId);
    }

    public OperationStatusView view(String operationId) {
        return get(operationId).view();
    }

    /** Operations of this process, oldest first. */
    public List<OperationStatusView> list() {
        return operations.values().stream()
                .map(OperationController::view)
                .sorted(Comparator.comparing(OperationStatusView::createdAt).thenComparing(OperationStatusView::id))
                .toList();
    }

    /** Every journaled operation, including those of earlier runs. */
    public List<OperationRecord> history() {
        return journal.operations().stream()
                .sorted(Comparator.comparing(OperationRecord::createdAt).reversed())
                .toList();
    }

    /**
     * Removes a closed operation from this process and deletes its journaled
     * record, links and facts.
     *
     * @throws IllegalOperationStateException when the operation is still open
     * @throws OperationNotFoundException when neither this process nor the journal knows it
     */
    public void delete(String operationId) {
        OperationController controller = operations.get(operationId);
        if (controller != null) {
            OperationStatus status = controller.view().status();
            if (!status.isClosed()) {
                throw new IllegalOperationStateException(operationId, status, "delete");
            }
        } else if (journal.operation(operationId).isEmpty()) {
            throw new OperationNotFoundException(operationId);
        }
        journal.deleteOperation(operationId);
        operations.remove(operationId);
        log.info("Deleted operation {}", operationId);
    }

    public Optional<OperationController> findByLink(String linkId) {
        return operations.values().stream().filter(c -> c.owns(linkId)).findFirst();
    }

    /** RUNNING or PAUSED operations whose group includes the agent, oldest first. */
    public List<OperationController> recruiting(Agent agent) {
        return operations.values().stream()
                .filter(OperationController::isRecruiting)
                .filter(c -> AgentRegistry.inGroup(agent, c.group()))
                .sorted(Comparator.comparing((OperationController c) -> c.view().createdAt())
                        .thenComparing(OperationController::id))
                .toList();
    }

    /**
     * One housekeeping pass: agent liveness, then link timeouts and a
     * scheduling tick for every open operation.
     */
    public void sweep() {
        Instant now = clock.instant();
        List<LivenessChange> changes = agents.sweep(now);
        for (OperationController controller : new ArrayList<>(operations.values())) {
            if (controller.view().status().isClosed()) continue;
            try {
                for (LivenessChange change : changes) {
                    controller.onAgentStatus(change.agent());
                }
                controller.tick();
            } catch (RuntimeException e) {
                log.error("Sweep failed for operation {}: {}", controller.id(), e.getMessage(), e);
            }
        }
    }
}
