package com.drautomation.api.controller;

import com.drautomation.api.model.dto.ReplicationJobResponse;
import com.drautomation.api.model.dto.ReplicationRequest;
import com.drautomation.api.model.dto.ReplicationStatistics;
import com.drautomation.api.model.entity.ReplicationJob;
import com.drautomation.api.service.ReplicationService;
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
@RequestMapping("/api/v1/replications")
@RequiredArgsConstructor
@Tag(name = "Replication", description = "Cross-region backup replication")
public class ReplicationController {

    private final ReplicationService replicationService;

    @PostMapping
    @Operation(summary = "Queue replication of a backup to all target regions")
    public ResponseEntity<ReplicationJobResponse> startReplication(@Valid @RequestBody ReplicationRequest request) {
        ReplicationJob job = replicationService.startReplication(request.getBackupId());
        return ResponseEntity.status(HttpStatus.CREATED).body(ReplicationJobResponse.fromEntity(job));
    }

    @GetMapping
    @Operation(summary = "List replication jobs")
    public ResponseEntity<List<ReplicationJobResponse>> listJobs(@RequestParam(required = false) String backupId) {
        List<ReplicationJobResponse> responses = replicationService.listJobs(backupId).stream()
                .map(ReplicationJobResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/statistics")
    @Operation(summary = "Replication statistics")
    public ResponseEntity<ReplicationStatistics> getStatistics() {
        return ResponseEntity.ok(replicationService.getStatistics());
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get replication job status")
    public ResponseEntity<ReplicationJobResponse> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(ReplicationJobResponse.fromEntity(replicationService.getJobStatus(jobId)));
    }

    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "Cancel a queued or running replication")
    public ResponseEntity<ReplicationJobResponse> cancelJob(@PathVariable String jobId) {
        return ResponseEntity.ok(ReplicationJobResponse.fromEntity(replicationService.cancelReplication(jobId)));
    }

    @PostMapping("/cleanup")
    @Operation(summary = "Delete replicas older than the replica retention")
    public ResponseEntity<Map<String, Integer>> cleanupReplicas() {
        return ResponseEntity.ok(Map.of("deleted", replicationService.cleanupOldReplicas()));
    }
}
