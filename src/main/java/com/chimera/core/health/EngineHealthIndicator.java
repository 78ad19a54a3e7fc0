package com.chimera.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of {@link HealthCheckService}: DOWN if any component is DOWN,
 * DEGRADED if any is degraded, UP otherwise.
 */
@Component("engineHealthIndicator")
public class EngineHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public EngineHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var builder = Health.up();
        boolean anyDown = false;
        boolean anyDegraded = false;
        for (HealthStatus check : healthCheckService.checkAll()) {
            builder.withDetail(check.component(), check.status() + " (" + check.detail() + ")");
            anyDown |= check.status() == HealthStatus.Status.DOWN;
            anyDegraded |= check.status() == HealthStatus.Status.DEGRADED;
        }
        if (anyDown) {
            return builder.down().build();
        }
        return anyDegraded ? builder.status("DEGRADED").build() : builder.build();
    }
}
