package com.chimera.core.persistence;

import com.chimera.core.model.Agent;
import com.chimera.core.model.Fact;
import com.chimera.core.model.Link;
import com.chimera.core.model.OperationRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable surface of the engine: agent registry, operation records, every
 * link generation, and fact store contents, all retained until explicitly deleted.
 * <p>
 * Write methods throw {@link JournalException} on failure.
 */
public interface OperationJournal {

    void saveAgent(Agent agent);

    void saveOperation(OperationRecord operation);

    void saveLink(Link link);

    void appendFact(String operationId, Fact fact);

    List<Agent> agents();

    List<OperationRecord> operations();

    Optional<OperationRecord> operation(String operationId);

    List<Link> links(String operationId);

    List<Fact> facts(String operationId);

    /** Explicit archival: removes an operation and everything scoped to it. */
    void deleteOperation(String operationId);
}
