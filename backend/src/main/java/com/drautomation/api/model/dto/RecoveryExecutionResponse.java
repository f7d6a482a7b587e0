package com.drautomation.api.model.dto;

import com.drautomation.api.model.entity.DisasterEvent;
import com.drautomation.api.model.entity.OperationLogEntry;
import com.drautomation.api.model.entity.RecoveryExecution;
import com.drautomation.api.model.entity.StepExecution;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class RecoveryExecutionResponse {

    private String id;
    private DisasterEvent disaster;
    private String status;
    private Integer progress;
    private String currentStep;
    private List<StepExecution> steps;
    private List<OperationLogEntry> logs;
    private String backupId;
    private String restoreJobId;
    private String errorMessage;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public static RecoveryExecutionResponse fromEntity(RecoveryExecution execution) {
        return RecoveryExecutionResponse.builder()
                .id(execution.getId())
                .disaster(execution.getDisaster())
                .status(execution.getStatus().name())
                .progress(execution.getProgress())
                .currentStep(execution.getCurrentStep())
                .steps(execution.getSteps())
                .logs(execution.getLogs())
                .backupId(execution.getBackupId())
                .restoreJobId(execution.getRestoreJobId())
                .errorMessage(execution.getErrorMessage())
                .createdAt(execution.getCreatedAt())
                .startedAt(execution.getStartedAt())
                .completedAt(execution.getCompletedAt())
                .build();
    }
}
