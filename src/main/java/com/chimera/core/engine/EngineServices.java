package com.chimera.core.engine;

import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.events.EventBus;
import com.chimera.core.link.LinkStateMachine;
import com.chimera.core.metrics.ChimeraMetrics;
import com.chimera.core.persistence.OperationJournal;
import com.chimera.core.scheduler.LinkScheduler;

import java.time.Clock;
import java.time.Duration;

/**
 * Collaborators shared by every {@link OperationController}.
 *
 * @param linkTimeout dispatch timeout for abilities that declare none
 */
public record EngineServices(
    AbilityCatalog catalog,
    LinkScheduler scheduler,
    LinkStateMachine links,
    OperationJournal journal,
    EventBus events,
    ChimeraMetrics metrics,
    Clock clock,
    Duration linkTimeout
) {}
