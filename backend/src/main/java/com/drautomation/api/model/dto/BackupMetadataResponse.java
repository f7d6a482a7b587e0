package com.drautomation.api.model.dto;

import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class BackupMetadataResponse {

    private String id;
    private String name;
    private String description;
    private String kind;
    private String retentionTier;
    private long sizeBytes;
    private String formattedSize;
    private String checksum;
    private boolean encrypted;
    private String encryptionAlgorithm;
    private String region;
    private String bucket;
    private String storageKey;
    private List<String> tags;
    private String baseBackupId;
    private String sourceJobId;
    private String scheduleId;
    private Instant createdAt;
    private Instant completedAt;

    public static BackupMetadataResponse fromEntity(BackupMetadata metadata) {
        return BackupMetadataResponse.builder()
                .id(metadata.getId())
                .name(metadata.getName())
                .description(metadata.getDescription())
                .kind(metadata.getKind().name())
                .retentionTier(metadata.getRetentionTier().name())
                .sizeBytes(metadata.getSizeBytes())
                .formattedSize(FormatUtils.formatBytes(metadata.getSizeBytes()))
                .checksum(metadata.getChecksum())
                .encrypted(metadata.getEncryption() != null && metadata.getEncryption().isEnabled())
                .encryptionAlgorithm(metadata.getEncryption() != null ? metadata.getEncryption().getAlgorithm() : null)
                .region(metadata.getLocation() != null ? metadata.getLocation().getRegion() : null)
                .bucket(metadata.getLocation() != null ? metadata.getLocation().getBucket() : null)
                .storageKey(metadata.getStorageKey())
                .tags(metadata.getTags())
                .baseBackupId(metadata.getBaseBackupId())
                .sourceJobId(metadata.getSourceJobId())
                .scheduleId(metadata.getScheduleId())
                .createdAt(metadata.getCreatedAt())
                .completedAt(metadata.getCompletedAt())
                .build();
    }
}
