package com.drautomation.api.service;

import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.model.dto.BackupStatistics;
import com.drautomation.api.model.dto.ComponentHealth;
import com.drautomation.api.model.dto.RecoveryTestStatistics;
import com.drautomation.api.model.dto.ReplicationStatistics;
import com.drautomation.api.model.dto.SystemMetrics;
import com.drautomation.api.model.dto.SystemStatus;
import com.drautomation.api.model.enums.AutomationComponent;
import com.drautomation.api.model.enums.HealthStatus;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.repository.RecoveryExecutionRepository;
import com.drautomation.api.util.FormatUtils;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Computes component health from the published statistics of each engine.
 * Reads only; alerting and failover decisions belong to the orchestrator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private final BackupService backupService;
    private final ReplicationService replicationService;
    private final RecoveryTestService recoveryTestService;
    private final RecoveryExecutionRepository recoveryExecutionRepository;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final AutomationProperties properties;
    private final Clock clock;

    public SystemStatus check(boolean running) {
        Instant now = Instant.now(clock);
        Map<AutomationComponent, ComponentHealth> components = new EnumMap<>(AutomationComponent.class);
        SystemMetrics metrics = new SystemMetrics();

        components.put(AutomationComponent.BACKUP, guarded(AutomationComponent.BACKUP, now,
                () -> checkBackup(metrics, now)));
        components.put(AutomationComponent.REPLICATION, guarded(AutomationComponent.REPLICATION, now,
                () -> checkReplication(metrics, now)));
        components.put(AutomationComponent.RECOVERY_TESTING, guarded(AutomationComponent.RECOVERY_TESTING, now,
                () -> checkRecoveryTesting(metrics, now)));
        components.put(AutomationComponent.DISASTER_RECOVERY, guarded(AutomationComponent.DISASTER_RECOVERY, now,
                () -> checkDisasterRecovery(metrics, now)));
        components.put(AutomationComponent.ERROR_HANDLING, guarded(AutomationComponent.ERROR_HANDLING, now,
                () -> checkErrorHandling(metrics, now)));

        HealthStatus overall = HealthStatus.HEALTHY;
        for (ComponentHealth health : components.values()) {
            overall = HealthStatus.worst(overall, health.getStatus());
        }

        return SystemStatus.builder()
                .running(running)
                .overall(overall)
                .components(components)
                .metrics(metrics)
                .lastCheck(now)
                .build();
    }

    /**
     * Classifies a success rate against the configured backup thresholds.
     */
    public HealthStatus classifyRate(double successRate) {
        AutomationProperties.Monitoring monitoring = properties.getMonitoring();
        if (successRate >= monitoring.getHealthyBackupRate()) {
            return HealthStatus.HEALTHY;
        }
        if (successRate >= monitoring.getDegradedBackupRate()) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.CRITICAL;
    }

    private ComponentHealth guarded(AutomationComponent component, Instant now, Supplier<ComponentHealth> check) {
        try {
            return check.get();
        } catch (Exception e) {
            log.error("Health check of {} failed: {}", component, e.getMessage(), e);
            return ComponentHealth.of(HealthStatus.CRITICAL, "Statistics unavailable: " + e.getMessage(), now);
        }
    }

    private ComponentHealth checkBackup(SystemMetrics metrics, Instant now) {
        if (!properties.getBackup().isEnabled()) {
            return ComponentHealth.of(HealthStatus.OFFLINE, "Backup engine disabled", now);
        }
        BackupStatistics stats = backupService.getStatistics();
        metrics.setBackupSuccessRate(stats.getSuccessRate());
        metrics.setLastBackupTime(stats.getLastBackupTime());

        ComponentHealth health = ComponentHealth.of(classifyRate(stats.getSuccessRate()),
                String.format("Backup success rate %.1f%%", stats.getSuccessRate()), now);
        health.getMetrics().put("successRate", stats.getSuccessRate());
        health.getMetrics().put("activeJobs", stats.getActiveJobs());
        health.getMetrics().put("totalBackups", stats.getTotalBackups());
        return health;
    }

    private ComponentHealth checkReplication(SystemMetrics metrics, Instant now) {
        if (!replicationService.isEnabled()) {
            return ComponentHealth.of(HealthStatus.OFFLINE, "Cross-region replication disabled", now);
        }
        ReplicationStatistics stats = replicationService.getStatistics();
        metrics.setReplicationLatencyMs(stats.getAverageLatencyMs());

        long threshold = properties.getMonitoring().getReplicationLatencyThreshold().toMillis();
        HealthStatus latencyStatus = stats.getAverageLatencyMs() < threshold ? HealthStatus.HEALTHY : HealthStatus.DEGRADED;
        HealthStatus status = HealthStatus.worst(latencyStatus, classifyRate(stats.getSuccessRate()));

        ComponentHealth health = ComponentHealth.of(status, String.format("Replication success rate %.1f%%, latency %s",
                stats.getSuccessRate(), FormatUtils.formatDuration(stats.getAverageLatencyMs())), now);
        health.getMetrics().put("successRate", stats.getSuccessRate());
        health.getMetrics().put("averageLatencyMs", stats.getAverageLatencyMs());
        health.getMetrics().put("queuedJobs", stats.getQueuedJobs());
        return health;
    }

    private ComponentHealth checkRecoveryTesting(SystemMetrics metrics, Instant now) {
        if (!recoveryTestService.isEnabled()) {
            return ComponentHealth.of(HealthStatus.OFFLINE, "Recovery testing disabled", now);
        }
        RecoveryTestStatistics stats = recoveryTestService.getStatistics();
        metrics.setRecoveryTestSuccessRate(stats.getSuccessRate());

        ComponentHealth health = ComponentHealth.of(classifyRate(stats.getSuccessRate()),
                String.format("Recovery test success rate %.1f%%", stats.getSuccessRate()), now);
        health.getMetrics().put("successRate", stats.getSuccessRate());
        health.getMetrics().put("averageIntegrityScore", stats.getAverageIntegrityScore());
        return health;
    }

    private ComponentHealth checkDisasterRecovery(SystemMetrics metrics, Instant now) {
        if (!properties.getDisasterRecovery().isEnabled()) {
            return ComponentHealth.of(HealthStatus.OFFLINE, "Disaster recovery disabled", now);
        }
        long active = recoveryExecutionRepository.countByStatusIn(List.of(JobStatus.PENDING, JobStatus.RUNNING));
        metrics.setActiveRecoveries(active);
        ComponentHealth health = active == 0
                ? ComponentHealth.of(HealthStatus.HEALTHY, "No active recoveries", now)
                : ComponentHealth.of(HealthStatus.DEGRADED, active + " recovery runs in progress", now);
        health.getMetrics().put("activeRecoveries", active);
        return health;
    }

    private ComponentHealth checkErrorHandling(SystemMetrics metrics, Instant now) {
        int open = 0;
        for (CircuitBreaker breaker : circuitBreakerRegistry.getAllCircuitBreakers()) {
            if (breaker.getState() == CircuitBreaker.State.OPEN) {
                open++;
            }
        }
        metrics.setOpenCircuitBreakers(open);
        ComponentHealth health = open == 0
                ? ComponentHealth.of(HealthStatus.HEALTHY, "All circuit breakers closed", now)
                : ComponentHealth.of(HealthStatus.DEGRADED, open + " circuit breakers open", now);
        health.getMetrics().put("openCircuitBreakers", open);
        return health;
    }
}
