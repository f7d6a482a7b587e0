package com.drautomation.api.config;

import com.drautomation.api.model.dto.SystemStatus;
import com.drautomation.api.model.enums.HealthStatus;
import com.drautomation.api.service.AutomationOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes the last automation health check under {@code /actuator/health}.
 * Only a critical component takes the application down.
 */
@Component("automation")
@RequiredArgsConstructor
public class AutomationHealthIndicator implements HealthIndicator {

    private final AutomationOrchestrator orchestrator;

    @Override
    public Health health() {
        SystemStatus status = orchestrator.getSystemStatus();
        Health.Builder builder = status.getOverall() == HealthStatus.CRITICAL ? Health.down() : Health.up();
        builder.withDetail("running", status.isRunning())
                .withDetail("overall", status.getOverall().name())
                .withDetail("openAlerts", status.getOpenAlerts());
        status.getComponents().forEach((component, health) ->
                builder.withDetail(component.name().toLowerCase(), health.getStatus().name()));
        return builder.build();
    }
}
