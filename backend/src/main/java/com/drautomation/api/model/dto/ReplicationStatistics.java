package com.drautomation.api.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplicationStatistics {

    private long totalJobs;
    private long completedJobs;
    private long failedJobs;
    private long activeJobs;
    private int queuedJobs;
    private double successRate;
    private long averageLatencyMs;
    private long totalBytesTransferred;
}
