package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.RecoveryStepType;
import com.drautomation.api.model.enums.StepStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one recovery step inside a recovery run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StepExecution {

    private String stepId;
    private String name;
    private RecoveryStepType type;
    private int order;
    private boolean critical;
    @Builder.Default
    private StepStatus status = StepStatus.PENDING;
    private int attempts;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private String error;
}
