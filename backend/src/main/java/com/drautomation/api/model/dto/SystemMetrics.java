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
public class SystemMetrics {

    private Instant lastBackupTime;
    private double backupSuccessRate;
    private long replicationLatencyMs;
    private double recoveryTestSuccessRate;
    private long activeRecoveries;
    private int openCircuitBreakers;
}
