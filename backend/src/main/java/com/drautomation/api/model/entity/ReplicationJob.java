package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.util.StringListConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Copy of one backup artifact to every configured secondary region. Succeeds only when all regions do.
 */
@Entity
@Table(name = "replication_jobs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReplicationJob {

    public static final String SOURCE_PREFIX = "backups/";
    public static final String TARGET_PREFIX = "cross-region-backups/";
    public static final String CANCELLED_BY_USER = "Cancelled by user";

    @Id
    @Column(length = 60)
    private String id;

    @Column(name = "backup_id", nullable = false, length = 60)
    private String backupId;

    @Column(name = "artifact_key", nullable = false, length = 300)
    private String artifactKey;

    @Column(name = "source_region", nullable = false, length = 50)
    private String sourceRegion;

    @Column(name = "source_bucket", nullable = false, length = 100)
    private String sourceBucket;

    @Convert(converter = StringListConverter.class)
    @Column(name = "target_regions", nullable = false, columnDefinition = "TEXT")
    @Builder.Default
    private List<String> targetRegions = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "completed_regions", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> completedRegions = new ArrayList<>();

    // Persisted only through the repository's updateStatus; save() leaves the column untouched
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column
    @Builder.Default
    private Integer progress = 0;

    @Column(name = "backup_size")
    private long backupSize;

    @Column(name = "transferred_bytes")
    private long transferredBytes;

    @Embedded
    private JobError error;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public void transitionTo(JobStatus next) {
        this.status = status.transitionTo(next);
    }

    public long durationMillis() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    public static String sourceKey(String backupId) {
        return SOURCE_PREFIX + backupId;
    }

    public static String targetKey(String region, String backupId) {
        return TARGET_PREFIX + region + "/" + backupId;
    }
}
