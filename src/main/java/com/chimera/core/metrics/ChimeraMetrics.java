package com.chimera.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for operation execution.
 */
@Service
public class ChimeraMetrics {

    private final MeterRegistry registry;

    public ChimeraMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBeacon(boolean newAgent) {
        Counter.builder("chimera.beacons.total")
                .tag("registration", String.valueOf(newAgent))
                .register(registry)
                .increment();
    }

    public void recordLinksCreated(int count) {
        Counter.builder("chimera.links.created")
                .register(registry)
                .increment(count);
    }

    public void recordLinksDispatched(int count) {
        Counter.builder("chimera.links.dispatched")
                .register(registry)
                .increment(count);
    }

    /**
     * Records a terminal link transition.
     *
     * @param status  terminal status name
     * @param elapsed dispatch-to-finish time, null when the link never ran
     */
    public void recordLinkOutcome(String status, Duration elapsed) {
        Counter.builder("chimera.links.completed")
                .tag("status", status)
                .register(registry)
                .increment();
        if (elapsed != null) {
            Timer.builder("chimera.link.duration")
                    .tag("status", status)
                    .register(registry)
                    .record(elapsed);
        }
    }

    public void recordRetry() {
        Counter.builder("chimera.links.retries")
                .description("Links re-queued after FAILURE or TIMEOUT")
                .register(registry)
                .increment();
    }

    public void recordRejectedReport(String reason) {
        Counter.builder("chimera.reports.rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordFactsCommitted(int count) {
        Counter.builder("chimera.facts.committed")
                .register(registry)
                .increment(count);
    }

    public void recordAgentDead() {
        Counter.builder("chimera.agents.dead")
                .register(registry)
                .increment();
    }

    public void recordOperationResult(String status) {
        Counter.builder("chimera.operations.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
