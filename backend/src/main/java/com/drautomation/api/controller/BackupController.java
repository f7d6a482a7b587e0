package com.drautomation.api.controller;

import com.drautomation.api.exception.ResourceNotFoundException;
import com.drautomation.api.model.dto.BackupJobResponse;
import com.drautomation.api.model.dto.BackupMetadataResponse;
import com.drautomation.api.model.dto.BackupStatistics;
import com.drautomation.api.model.dto.CreateBackupRequest;
import com.drautomation.api.model.entity.BackupJob;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.RetentionTier;
import com.drautomation.api.service.BackupService;
import com.drautomation.api.service.RetentionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/backups")
@RequiredArgsConstructor
@Tag(name = "Backups", description = "Backup creation, catalog and retention")
public class BackupController {

    private final BackupService backupService;
    private final RetentionService retentionService;

    @PostMapping
    @Operation(summary = "Create a backup job")
    public ResponseEntity<BackupJobResponse> createBackup(@Valid @RequestBody CreateBackupRequest request) {
        BackupJob job = backupService.createBackup(request.getKind(), request.toOptions());
        return ResponseEntity.status(HttpStatus.CREATED).body(BackupJobResponse.fromEntity(job));
    }

    @GetMapping
    @Operation(summary = "List completed backups, newest first")
    public ResponseEntity<List<BackupMetadataResponse>> listBackups(
            @RequestParam(required = false) BackupKind kind,
            @RequestParam(required = false) RetentionTier tier) {
        List<BackupMetadataResponse> responses = backupService.listBackups(kind, tier).stream()
                .map(BackupMetadataResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/latest")
    @Operation(summary = "Get the most recent completed backup")
    public ResponseEntity<BackupMetadataResponse> getLatestBackup() {
        BackupMetadata latest = backupService.getLatestBackup()
                .orElseThrow(() -> new ResourceNotFoundException("Backup", "latest"));
        return ResponseEntity.ok(BackupMetadataResponse.fromEntity(latest));
    }

    @GetMapping("/{backupId}")
    @Operation(summary = "Get backup metadata")
    public ResponseEntity<BackupMetadataResponse> getBackup(@PathVariable String backupId) {
        return ResponseEntity.ok(BackupMetadataResponse.fromEntity(backupService.getBackupMetadata(backupId)));
    }

    @GetMapping("/jobs")
    @Operation(summary = "List backup jobs")
    public ResponseEntity<List<BackupJobResponse>> listJobs(@RequestParam(required = false) JobStatus status) {
        List<BackupJobResponse> responses = backupService.listJobs(status).stream()
                .map(BackupJobResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Get backup job progress")
    public ResponseEntity<BackupJobResponse> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(BackupJobResponse.fromEntity(backupService.getJob(jobId)));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    @Operation(summary = "Cancel a pending or running backup job")
    public ResponseEntity<BackupJobResponse> cancelJob(@PathVariable String jobId) {
        return ResponseEntity.ok(BackupJobResponse.fromEntity(backupService.cancelBackup(jobId)));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Backup statistics")
    public ResponseEntity<BackupStatistics> getStatistics() {
        return ResponseEntity.ok(backupService.getStatistics());
    }

    @PostMapping("/retention/apply")
    @Operation(summary = "Apply the default retention policy now")
    public ResponseEntity<Map<String, Object>> applyRetention() {
        List<String> deleted = retentionService.applyRetention(retentionService.defaultPolicy());
        return ResponseEntity.ok(Map.of("deleted", deleted, "count", deleted.size()));
    }
}
