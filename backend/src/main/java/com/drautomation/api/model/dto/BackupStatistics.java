package com.drautomation.api.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupStatistics {

    private long totalJobs;
    private long completedJobs;
    private long failedJobs;
    private long activeJobs;
    // Completed over finished, 100 when nothing finished yet
    private double successRate;
    private long totalBackups;
    private long totalSizeBytes;
    private String formattedTotalSize;
    private long averageDurationMs;
    private Instant lastBackupTime;
    @Builder.Default
    private Map<String, Long> sizeByKind = new LinkedHashMap<>();
}
