package com.drautomation.api.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreStatistics {

    private long totalJobs;
    private long completedJobs;
    private long failedJobs;
    private long cancelledJobs;
    private long activeJobs;
    private double successRate;
    private long averageDurationMs;
    private long totalRowsRestored;
}
