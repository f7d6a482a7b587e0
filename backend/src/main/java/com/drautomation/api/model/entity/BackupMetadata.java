package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.model.enums.RetentionTier;
import com.drautomation.api.util.StringListConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Catalog record of a finished backup. Written once from a completed job, only ever deleted afterwards.
 */
@Entity
@Immutable
@Table(name = "backup_metadata")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackupMetadata {

    @Id
    @Column(length = 60)
    private String id;

    @Column(length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BackupKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "retention_tier", nullable = false, length = 20)
    private RetentionTier retentionTier;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(nullable = false, length = 64)
    private String checksum;

    @Embedded
    private EncryptionSettings encryption;

    @Embedded
    private StorageLocation location;

    @Column(name = "storage_key", nullable = false, length = 300)
    private String storageKey;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    // Incremental and differential backups only
    @Column(name = "base_backup_id", length = 60)
    private String baseBackupId;

    @Column(name = "source_job_id", nullable = false, length = 60)
    private String sourceJobId;

    @Column(name = "schedule_id", length = 60)
    private String scheduleId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "completed_at", nullable = false)
    private Instant completedAt;
}
