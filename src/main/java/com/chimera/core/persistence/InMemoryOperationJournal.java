package com.chimera.core.persistence;

import com.chimera.core.model.Agent;
import com.chimera.core.model.Fact;
import com.chimera.core.model.Link;
import com.chimera.core.model.OperationRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local journal used when no DataSource is configured. Not durable across restarts.
 */
public class InMemoryOperationJournal implements OperationJournal {

    private final ConcurrentHashMap<String, Agent> agents = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, OperationRecord> operations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Map<String, Link>> links = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Fact>> facts = new ConcurrentHashMap<>();

    @Override
    public void saveAgent(Agent agent) {
        agents.put(agent.paw(), agent);
    }

    @Override
    public void saveOperation(OperationRecord operation) {
        operations.put(operation.id(), operation);
    }

    @Override
    public void saveLink(Link link) {
        Map<String, Link> table = links.computeIfAbsent(link.operationId(), k -> new LinkedHashMap<>());
        synchronized (table) {
            table.put(link.id(), link);
        }
    }

    @Override
    public void appendFact(String operationId, Fact fact) {
        facts.computeIfAbsent(operationId, k -> new CopyOnWriteArrayList<>()).add(fact);
    }

    @Override
    public List<Agent> agents() {
        return agents.values().stream().sorted(Comparator.comparing(Agent::firstSeen)).toList();
    }

    @Override
    public List<OperationRecord> operations() {
        return operations.values().stream().sorted(Comparator.comparing(OperationRecord::createdAt)).toList();
    }

    @Override
    public Optional<OperationRecord> operation(String operationId) {
        return Optional.ofNullable(operations.get(operationId));
    }

    @Override
    public List<Link> links(String operationId) {
        Map<String, Link> table = links.get(operationId);
        if (table == null) return List.of();
        synchronized (table) {
            return new ArrayList<>(table.values());
        }
    }

    @Override
    public List<Fact> facts(String operationId) {
        List<Fact> list = facts.get(operationId);
        return list == null ? List.of() : List.copyOf(list);
    }

    @Override
    public void deleteOperation(String operationId) {
        operations.remove(operationId);
        links.remove(operationId);
        facts.remove(operationId);
    }
}
