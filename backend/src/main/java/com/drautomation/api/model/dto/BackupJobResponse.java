package com.drautomation.api.model.dto;

import com.drautomation.api.model.entity.BackupJob;
import com.drautomation.api.model.entity.OperationLogEntry;
import com.drautomation.api.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class BackupJobResponse {

    private String id;
    private String kind;
    private String status;
    private Integer progress;
    private String currentOperation;
    private String name;
    private String description;
    private List<String> tags;
    private String scheduleId;
    private String retentionTier;
    private boolean automated;
    private String backupId;
    private Long sizeBytes;
    private String formattedSize;
    private String checksum;
    private ErrorResponse error;
    private List<OperationLogEntry> logs;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public static BackupJobResponse fromEntity(BackupJob job) {
        return BackupJobResponse.builder()
                .id(job.getId())
                .kind(job.getKind().name())
                .status(job.getStatus().name())
                .progress(job.getProgress())
                .currentOperation(job.getCurrentOperation())
                .name(job.getName())
                .description(job.getDescription())
                .tags(job.getTags())
                .scheduleId(job.getScheduleId())
                .retentionTier(job.getRetentionTier() != null ? job.getRetentionTier().name() : null)
                .automated(job.isAutomated())
                .backupId(job.getBackupId())
                .sizeBytes(job.getSizeBytes())
                .formattedSize(job.getSizeBytes() != null ? FormatUtils.formatBytes(job.getSizeBytes()) : null)
                .checksum(job.getChecksum())
                .error(ErrorResponse.fromEntity(job.getError()))
                .logs(job.getLogs())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
