package com.drautomation.api.service;

import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.event.BackupCompletedEvent;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.model.dto.BackupOptions;
import com.drautomation.api.model.dto.ComponentHealth;
import com.drautomation.api.model.dto.DisasterRecoveryRequest;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.dto.RecoveryTestRequest;
import com.drautomation.api.model.dto.SystemStatus;
import com.drautomation.api.model.entity.BackupJob;
import com.drautomation.api.model.entity.RecoveryExecution;
import com.drautomation.api.model.enums.AutomationComponent;
import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.model.enums.DisasterType;
import com.drautomation.api.model.enums.ErrorCategory;
import com.drautomation.api.model.enums.HealthStatus;
import com.drautomation.api.model.enums.RecoveryTestType;
import com.drautomation.api.model.enums.Severity;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ties the engines together: starts the scheduler, chains replication and recovery tests after
 * automated backups, runs the periodic health check and triggers disaster recovery.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutomationOrchestrator {

    public static final String TAG_AUTOMATED = "automated";

    private final BackupService backupService;
    private final BackupSchedulerService schedulerService;
    private final ReplicationService replicationService;
    private final RecoveryTestService recoveryTestService;
    private final DisasterRecoveryService disasterRecoveryService;
    private final HealthCheckService healthCheckService;
    private final AlertService alertService;
    private final NotificationService notificationService;
    private final AutomationProperties properties;

    private final Map<AutomationComponent, HealthStatus> previousHealth = new EnumMap<>(AutomationComponent.class);
    private volatile boolean running;
    private volatile SystemStatus lastStatus;
    private int consecutiveCriticalChecks;

    public synchronized void start() {
        if (running) {
            log.debug("Automation already running");
            return;
        }
        schedulerService.start();
        running = true;
        log.info("Backup and disaster-recovery automation started");
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        schedulerService.stop();
        running = false;
        log.info("Backup and disaster-recovery automation stopped");
    }

    public boolean isRunning() {
        return running;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public BackupJob createAutomatedBackup(BackupKind kind) {
        BackupOptions options = BackupOptions.builder()
                .automated(true)
                .tags(new ArrayList<>(List.of(TAG_AUTOMATED, kind.name().toLowerCase())))
                .build();
        return backupService.createBackup(kind, options);
    }

    /**
     * Chains replication and a recovery test after a successful automated backup.
     */
    @Async
    @EventListener
    public void onBackupCompleted(BackupCompletedEvent event) {
        if (!event.isAutomated()) {
            return;
        }
        if (!event.isSuccessful()) {
            alertService.raise(AutomationComponent.BACKUP, Severity.CRITICAL,
                    "Automated backup job " + event.getJobId() + " failed: " + event.getErrorMessage());
            return;
        }

        if (replicationService.isEnabled()) {
            try {
                replicationService.startReplication(event.getBackupId());
            } catch (Exception e) {
                log.error("Could not start replication of backup {}: {}", event.getBackupId(), e.getMessage(), e);
                alertService.raise(AutomationComponent.BACKUP, Severity.CRITICAL,
                        "Replication of backup " + event.getBackupId() + " could not be started: " + e.getMessage());
            }
        }
        if (recoveryTestService.isEnabled() && properties.getRecoveryTesting().isTestAfterAutomatedBackup()) {
            try {
                recoveryTestService.startRecoveryTest(RecoveryTestRequest.builder()
                        .backupId(event.getBackupId())
                        .testType(RecoveryTestType.FULL)
                        .build());
            } catch (Exception e) {
                log.error("Could not start recovery test of backup {}: {}", event.getBackupId(), e.getMessage(), e);
                alertService.raise(AutomationComponent.BACKUP, Severity.CRITICAL,
                        "Recovery test of backup " + event.getBackupId() + " could not be started: " + e.getMessage());
            }
        }
    }

    @Scheduled(fixedDelayString = "${automation.monitoring.interval:PT1M}")
    public void performHealthCheck() {
        if (!properties.getMonitoring().isEnabled() || !running) {
            return;
        }
        checkHealth();
    }

    /**
     * Computes system health, raises or resolves component alerts and, with auto-failover
     * enabled, starts disaster recovery after repeated critical checks.
     */
    public synchronized SystemStatus checkHealth() {
        SystemStatus status = healthCheckService.check(running);

        List<AutomationComponent> critical = new ArrayList<>();
        for (Map.Entry<AutomationComponent, ComponentHealth> entry : status.getComponents().entrySet()) {
            AutomationComponent component = entry.getKey();
            HealthStatus current = entry.getValue().getStatus();
            HealthStatus previous = previousHealth.getOrDefault(component, HealthStatus.HEALTHY);

            if (current == HealthStatus.CRITICAL) {
                critical.add(component);
            }
            if (current != previous) {
                log.info("Component {} changed from {} to {}", component, previous, current);
                if (raisesAlert(previous) && raisesAlert(current)) {
                    // One open alert per component, at the current severity
                    alertService.resolveOpen(component);
                }
                switch (current) {
                    case DEGRADED -> alertService.raise(component, Severity.MEDIUM,
                            component + " degraded: " + entry.getValue().getMessage());
                    case CRITICAL -> alertService.raise(component, Severity.HIGH,
                            component + " critical: " + entry.getValue().getMessage());
                    case HEALTHY -> alertService.resolveOpen(component);
                    case OFFLINE -> log.debug("Component {} is offline", component);
                }
            }
            previousHealth.put(component, current);
        }

        consecutiveCriticalChecks = critical.isEmpty() ? 0 : consecutiveCriticalChecks + 1;
        if (!critical.isEmpty()) {
            considerFailover(critical);
        }

        status.setConsecutiveCriticalChecks(consecutiveCriticalChecks);
        status.setOpenAlerts(alertService.countOpen());
        lastStatus = status;
        log.debug("Health check: overall={}, critical={}", status.getOverall(), critical);
        return status;
    }

    private static boolean raisesAlert(HealthStatus status) {
        return status == HealthStatus.DEGRADED || status == HealthStatus.CRITICAL;
    }

    public RecoveryExecution triggerDisasterRecovery(DisasterRecoveryRequest request) {
        return startDisasterRecovery(request, false);
    }

    public SystemStatus getSystemStatus() {
        SystemStatus current = lastStatus;
        if (current == null) {
            current = healthCheckService.check(running);
        }
        return SystemStatus.builder()
                .running(running)
                .overall(current.getOverall())
                .components(current.getComponents())
                .metrics(current.getMetrics())
                .lastCheck(current.getLastCheck())
                .openAlerts(alertService.countOpen())
                .consecutiveCriticalChecks(consecutiveCriticalChecks)
                .build();
    }

    private void considerFailover(List<AutomationComponent> critical) {
        AutomationProperties.DisasterRecovery config = properties.getDisasterRecovery();
        if (!config.isAutoFailover() || !config.isEnabled()
                || consecutiveCriticalChecks < config.getFailureThreshold()) {
            return;
        }
        if (disasterRecoveryService.countActive() > 0) {
            log.info("Auto-failover threshold reached but a recovery is already active");
            return;
        }
        log.error("{} consecutive critical health checks, starting automatic failover", consecutiveCriticalChecks);
        DisasterRecoveryRequest request = DisasterRecoveryRequest.builder()
                .type(DisasterType.SYSTEM_FAILURE)
                .severity(failoverSeverity(critical.size()))
                .description("Automatic failover after " + consecutiveCriticalChecks
                        + " critical health checks: " + critical)
                .affectedSystems(new ArrayList<>(properties.getServices().keySet()))
                .build();
        try {
            startDisasterRecovery(request, true);
            consecutiveCriticalChecks = 0;
        } catch (Exception e) {
            log.error("Automatic failover could not be started: {}", e.getMessage(), e);
        }
    }

    static Severity failoverSeverity(int criticalComponents) {
        if (criticalComponents >= 3) {
            return Severity.CRITICAL;
        }
        return criticalComponents == 2 ? Severity.HIGH : Severity.MEDIUM;
    }

    private RecoveryExecution startDisasterRecovery(DisasterRecoveryRequest request, boolean automatic) {
        if (!disasterRecoveryService.isEnabled()) {
            throw new AutomationException(AutomationException.CODE_DISABLED, ErrorCategory.VALIDATION,
                    "Disaster recovery is disabled");
        }
        RecoveryExecution execution = disasterRecoveryService.triggerDisasterRecovery(request, automatic);
        alertService.raise(AutomationComponent.DISASTER_RECOVERY, Severity.CRITICAL,
                "Disaster recovery " + execution.getId() + " started: " + request.getType() + " - " + request.getDescription());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("executionId", execution.getId());
        data.put("disasterType", request.getType().name());
        data.put("severity", execution.getDisaster().getSeverity().name());
        data.put("description", request.getDescription());
        data.put("affectedSystems", execution.getDisaster().getAffectedSystems());
        data.put("automatic", automatic);
        notificationService.notify(NotificationMessage.TYPE_DISASTER_RECOVERY, data);
        return execution;
    }
}
