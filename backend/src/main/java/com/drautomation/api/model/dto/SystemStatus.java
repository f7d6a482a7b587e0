package com.drautomation.api.model.dto;

import com.drautomation.api.model.enums.AutomationComponent;
import com.drautomation.api.model.enums.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Snapshot produced by every health check. Not persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStatus {

    private boolean running;
    @Builder.Default
    private HealthStatus overall = HealthStatus.OFFLINE;
    @Builder.Default
    private Map<AutomationComponent, ComponentHealth> components = new EnumMap<>(AutomationComponent.class);
    @Builder.Default
    private SystemMetrics metrics = new SystemMetrics();
    private Instant lastCheck;
    private long openAlerts;
    private int consecutiveCriticalChecks;
}
