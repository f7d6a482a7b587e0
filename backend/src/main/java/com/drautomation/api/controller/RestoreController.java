package com.drautomation.api.controller;

import com.drautomation.api.model.dto.RestoreJobResponse;
import com.drautomation.api.model.dto.RestoreRequest;
import com.drautomation.api.model.dto.RestoreStatistics;
import com.drautomation.api.model.entity.RestoreJob;
import com.drautomation.api.service.RestoreService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/restores")
@RequiredArgsConstructor
@Tag(name = "Restores", description = "Restore jobs and verification")
public class RestoreController {

    private final RestoreService restoreService;

    @PostMapping
    @Operation(summary = "Start a restore from a backup")
    public ResponseEntity<RestoreJobResponse> startRestore(@Valid @RequestBody RestoreRequest request) {
        RestoreJob job = restoreService.startRestore(request.getBackupId(), request.toOptions());
        return ResponseEntity.status(HttpStatus.CREATED).body(RestoreJobResponse.fromEntity(job));
    }

    @GetMapping
    @Operation(summary = "List restore jobs")
    public ResponseEntity<List<RestoreJobResponse>> listRestoreJobs(@RequestParam(required = false) String backupId) {
        List<RestoreJobResponse> responses = restoreService.listRestoreJobs(backupId).stream()
                .map(RestoreJobResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/statistics")
    @Operation(summary = "Restore statistics")
    public ResponseEntity<RestoreStatistics> getStatistics() {
        return ResponseEntity.ok(restoreService.getStatistics());
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get restore job details")
    public ResponseEntity<RestoreJobResponse> getRestoreJob(@PathVariable String jobId) {
        return ResponseEntity.ok(RestoreJobResponse.fromEntity(restoreService.getRestoreJob(jobId)));
    }

    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "Cancel an active restore job")
    public ResponseEntity<RestoreJobResponse> cancelRestore(@PathVariable String jobId) {
        return ResponseEntity.ok(RestoreJobResponse.fromEntity(restoreService.cancelRestore(jobId)));
    }
}
