package com.drautomation.api.model.dto;

import com.drautomation.api.model.entity.ReplicationJob;
import com.drautomation.api.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class ReplicationJobResponse {

    private String id;
    private String backupId;
    private String artifactKey;
    private String sourceRegion;
    private List<String> targetRegions;
    private List<String> completedRegions;
    private String status;
    private Integer progress;
    private long backupSize;
    private long transferredBytes;
    private String formattedTransferred;
    private ErrorResponse error;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public static ReplicationJobResponse fromEntity(ReplicationJob job) {
        return ReplicationJobResponse.builder()
                .id(job.getId())
                .backupId(job.getBackupId())
                .artifactKey(job.getArtifactKey())
                .sourceRegion(job.getSourceRegion())
                .targetRegions(job.getTargetRegions())
                .completedRegions(job.getCompletedRegions())
                .status(job.getStatus().name())
                .progress(job.getProgress())
                .backupSize(job.getBackupSize())
                .transferredBytes(job.getTransferredBytes())
                .formattedTransferred(FormatUtils.formatBytes(job.getTransferredBytes()))
                .error(ErrorResponse.fromEntity(job.getError()))
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
