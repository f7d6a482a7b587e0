package com.drautomation.api.controller;

import com.drautomation.api.model.dto.RecoveryTestRequest;
import com.drautomation.api.model.dto.RecoveryTestResponse;
import com.drautomation.api.model.dto.RecoveryTestStatistics;
import com.drautomation.api.model.entity.RecoveryTest;
import com.drautomation.api.service.RecoveryTestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/recovery-tests")
@RequiredArgsConstructor
@Tag(name = "Recovery tests", description = "Automated restore testing")
public class RecoveryTestController {

    private final RecoveryTestService recoveryTestService;

    @PostMapping
    @Operation(summary = "Start a recovery test of a backup")
    public ResponseEntity<RecoveryTestResponse> startTest(@Valid @RequestBody RecoveryTestRequest request) {
        RecoveryTest test = recoveryTestService.startRecoveryTest(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(RecoveryTestResponse.fromEntity(test));
    }

    @GetMapping("/active")
    @Operation(summary = "List tests that have not finished")
    public ResponseEntity<List<RecoveryTestResponse>> getActiveTests() {
        return ResponseEntity.ok(recoveryTestService.getActiveTests().stream()
                .map(RecoveryTestResponse::fromEntity)
                .toList());
    }

    @GetMapping("/history")
    @Operation(summary = "List finished tests, newest first")
    public ResponseEntity<List<RecoveryTestResponse>> getHistory(@RequestParam(defaultValue = "0") int limit) {
        return ResponseEntity.ok(recoveryTestService.getTestHistory(limit).stream()
                .map(RecoveryTestResponse::fromEntity)
                .toList());
    }

    @GetMapping("/statistics")
    @Operation(summary = "Recovery test statistics")
    public ResponseEntity<RecoveryTestStatistics> getStatistics() {
        return ResponseEntity.ok(recoveryTestService.getStatistics());
    }

    @GetMapping("/{testId}")
    @Operation(summary = "Get recovery test result")
    public ResponseEntity<RecoveryTestResponse> getTest(@PathVariable String testId) {
        return ResponseEntity.ok(RecoveryTestResponse.fromEntity(recoveryTestService.getTestStatus(testId)));
    }
}
