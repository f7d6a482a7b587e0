package com.drautomation.api.controller;

import com.drautomation.api.model.dto.AlertResponse;
import com.drautomation.api.model.dto.BackupJobResponse;
import com.drautomation.api.model.dto.DisasterRecoveryRequest;
import com.drautomation.api.model.dto.RecoveryExecutionResponse;
import com.drautomation.api.model.dto.SystemStatus;
import com.drautomation.api.model.entity.RecoveryExecution;
import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.service.AlertService;
import com.drautomation.api.service.AutomationOrchestrator;
import com.drautomation.api.service.DisasterRecoveryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/automation")
@RequiredArgsConstructor
@Tag(name = "Automation", description = "Orchestrator control, health, alerts and disaster recovery")
public class AutomationController {

    private final AutomationOrchestrator orchestrator;
    private final AlertService alertService;
    private final DisasterRecoveryService disasterRecoveryService;

    @PostMapping("/start")
    @Operation(summary = "Start schedules and monitoring")
    public ResponseEntity<SystemStatus> start() {
        orchestrator.start();
        return ResponseEntity.ok(orchestrator.getSystemStatus());
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop schedules and monitoring")
    public ResponseEntity<SystemStatus> stop() {
        orchestrator.stop();
        return ResponseEntity.ok(orchestrator.getSystemStatus());
    }

    @GetMapping("/status")
    @Operation(summary = "Current system status from the last health check")
    public ResponseEntity<SystemStatus> getStatus() {
        return ResponseEntity.ok(orchestrator.getSystemStatus());
    }

    @PostMapping("/health-check")
    @Operation(summary = "Run a health check now")
    public ResponseEntity<SystemStatus> runHealthCheck() {
        return ResponseEntity.ok(orchestrator.checkHealth());
    }

    @PostMapping("/backups")
    @Operation(summary = "Create an automated backup, chaining replication and a recovery test")
    public ResponseEntity<BackupJobResponse> createAutomatedBackup(
            @RequestParam(defaultValue = "FULL") BackupKind kind) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BackupJobResponse.fromEntity(orchestrator.createAutomatedBackup(kind)));
    }

    // ============ Alerts ============

    @GetMapping("/alerts")
    @Operation(summary = "List alerts")
    public ResponseEntity<List<AlertResponse>> listAlerts(@RequestParam(defaultValue = "true") boolean openOnly) {
        return ResponseEntity.ok(alertService.list(openOnly).stream()
                .map(AlertResponse::fromEntity)
                .toList());
    }

    @PostMapping("/alerts/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge an alert")
    public ResponseEntity<AlertResponse> acknowledgeAlert(@PathVariable String alertId) {
        return ResponseEntity.ok(AlertResponse.fromEntity(alertService.acknowledge(alertId)));
    }

    @PostMapping("/alerts/{alertId}/resolve")
    @Operation(summary = "Resolve an alert")
    public ResponseEntity<AlertResponse> resolveAlert(@PathVariable String alertId) {
        return ResponseEntity.ok(AlertResponse.fromEntity(alertService.resolve(alertId)));
    }

    // ============ Disaster recovery ============

    @PostMapping("/disaster-recovery")
    @Operation(summary = "Trigger disaster recovery")
    public ResponseEntity<RecoveryExecutionResponse> triggerDisasterRecovery(
            @Valid @RequestBody DisasterRecoveryRequest request) {
        RecoveryExecution execution = orchestrator.triggerDisasterRecovery(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(RecoveryExecutionResponse.fromEntity(execution));
    }

    @GetMapping("/disaster-recovery")
    @Operation(summary = "List recovery runs")
    public ResponseEntity<List<RecoveryExecutionResponse>> listRecoveries() {
        return ResponseEntity.ok(disasterRecoveryService.list().stream()
                .map(RecoveryExecutionResponse::fromEntity)
                .toList());
    }

    @GetMapping("/disaster-recovery/{executionId}")
    @Operation(summary = "Get recovery run progress")
    public ResponseEntity<RecoveryExecutionResponse> getRecovery(@PathVariable String executionId) {
        return ResponseEntity.ok(RecoveryExecutionResponse.fromEntity(disasterRecoveryService.get(executionId)));
    }

    @PostMapping("/disaster-recovery/{executionId}/cancel")
    @Operation(summary = "Cancel an active recovery run")
    public ResponseEntity<RecoveryExecutionResponse> cancelRecovery(@PathVariable String executionId) {
        return ResponseEntity.ok(RecoveryExecutionResponse.fromEntity(disasterRecoveryService.cancel(executionId)));
    }
}
