package com.drautomation.api.controller;

import com.drautomation.api.model.dto.BackupJobResponse;
import com.drautomation.api.model.dto.ScheduleRequest;
import com.drautomation.api.model.dto.ScheduleResponse;
import com.drautomation.api.model.entity.BackupSchedule;
import com.drautomation.api.service.BackupSchedulerService;
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
@RequestMapping("/api/v1/schedules")
@RequiredArgsConstructor
@Tag(name = "Schedules", description = "Recurring backup schedules")
public class ScheduleController {

    private final BackupSchedulerService schedulerService;

    @GetMapping
    @Operation(summary = "List backup schedules")
    public ResponseEntity<List<ScheduleResponse>> listSchedules() {
        List<ScheduleResponse> responses = schedulerService.listSchedules().stream()
                .map(ScheduleResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(responses);
    }

    @PostMapping
    @Operation(summary = "Create a backup schedule")
    public ResponseEntity<ScheduleResponse> createSchedule(@Valid @RequestBody ScheduleRequest request) {
        BackupSchedule schedule = schedulerService.createSchedule(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ScheduleResponse.fromEntity(schedule));
    }

    @GetMapping("/next")
    @Operation(summary = "Get the next schedule due to run")
    public ResponseEntity<ScheduleResponse> getNextScheduled() {
        return schedulerService.getNextScheduledBackup()
                .map(s -> ResponseEntity.ok(ScheduleResponse.fromEntity(s)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{scheduleId}")
    @Operation(summary = "Get schedule details")
    public ResponseEntity<ScheduleResponse> getSchedule(@PathVariable String scheduleId) {
        return ResponseEntity.ok(ScheduleResponse.fromEntity(schedulerService.getSchedule(scheduleId)));
    }

    @PutMapping("/{scheduleId}")
    @Operation(summary = "Update a schedule")
    public ResponseEntity<ScheduleResponse> updateSchedule(
            @PathVariable String scheduleId,
            @Valid @RequestBody ScheduleRequest request) {
        return ResponseEntity.ok(ScheduleResponse.fromEntity(schedulerService.updateSchedule(scheduleId, request)));
    }

    @DeleteMapping("/{scheduleId}")
    @Operation(summary = "Delete a schedule")
    public ResponseEntity<Map<String, String>> deleteSchedule(@PathVariable String scheduleId) {
        schedulerService.deleteSchedule(scheduleId);
        return ResponseEntity.ok(Map.of("message", "Schedule deleted successfully"));
    }

    @PostMapping("/{scheduleId}/toggle")
    @Operation(summary = "Enable or disable a schedule")
    public ResponseEntity<ScheduleResponse> toggleSchedule(@PathVariable String scheduleId) {
        return ResponseEntity.ok(ScheduleResponse.fromEntity(schedulerService.toggleSchedule(scheduleId)));
    }

    @PostMapping("/{scheduleId}/trigger")
    @Operation(summary = "Run a schedule's backup now")
    public ResponseEntity<BackupJobResponse> triggerSchedule(@PathVariable String scheduleId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BackupJobResponse.fromEntity(schedulerService.triggerImmediateBackup(scheduleId)));
    }
}
