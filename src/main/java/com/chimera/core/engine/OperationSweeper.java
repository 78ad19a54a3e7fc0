package com.chimera.core.engine;

import com.chimera.core.config.ChimeraProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic driver for agent liveness, link timeouts and scheduler ticks.
 */
@Component
@ConditionalOnProperty(prefix = "chimera.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OperationSweeper {

    private static final Logger log = LoggerFactory.getLogger(OperationSweeper.class);

    private final OperationService operations;
    private final long intervalSeconds;
    private ScheduledExecutorService executor;

    public OperationSweeper(OperationService operations, ChimeraProperties properties) {
        this.operations = operations;
        this.intervalSeconds = Math.max(1, properties.getSweepIntervalSeconds());
    }

    @PostConstruct
    void start() {
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chimera-sweeper");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleAtFixedRate(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Operation sweeper started ({}s interval)", intervalSeconds);
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    void runOnce() {
        try {
            operations.sweep();
        } catch (Exception e) {
            log.error("Operation sweep failed: {}", e.getMessage(), e);
        }
    }
}
