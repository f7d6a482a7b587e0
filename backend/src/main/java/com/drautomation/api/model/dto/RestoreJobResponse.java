package com.drautomation.api.model.dto;

import com.drautomation.api.model.entity.OperationLogEntry;
import com.drautomation.api.model.entity.RestoreJob;
import com.drautomation.api.model.entity.RestoreOptions;
import com.drautomation.api.model.entity.VerificationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class RestoreJobResponse {

    private String id;
    private String backupId;
    private String kind;
    private String targetDatabase;
    private String status;
    private Integer progress;
    private String currentOperation;
    private RestoreOptions options;
    private VerificationResult verification;
    private long rowsRestored;
    private int filesRestored;
    private String recoveryExecutionId;
    private ErrorResponse error;
    private List<OperationLogEntry> logs;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public static RestoreJobResponse fromEntity(RestoreJob job) {
        return RestoreJobResponse.builder()
                .id(job.getId())
                .backupId(job.getBackupId())
                .kind(job.getOptions() != null ? job.getOptions().getKind().name() : null)
                .targetDatabase(job.getOptions() != null ? job.getOptions().getTargetDatabase() : null)
                .status(job.getStatus().name())
                .progress(job.getProgress())
                .currentOperation(job.getCurrentOperation())
                .options(job.getOptions())
                .verification(job.getVerification())
                .rowsRestored(job.getRowsRestored())
                .filesRestored(job.getFilesRestored())
                .recoveryExecutionId(job.getRecoveryExecutionId())
                .error(ErrorResponse.fromEntity(job.getError()))
                .logs(job.getLogs())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
