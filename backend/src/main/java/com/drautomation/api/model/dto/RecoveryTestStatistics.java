package com.drautomation.api.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryTestStatistics {

    private long totalTests;
    private long passedTests;
    private long failedTests;
    private int activeTests;
    private double successRate;
    private double averageIntegrityScore;
    private long averageRestoreTimeMs;
    private Instant lastTestTime;
}
