package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.LogLevel;
import com.drautomation.api.model.enums.RetentionTier;
import com.drautomation.api.util.OperationLogConverter;
import com.drautomation.api.util.StringListConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One attempt at producing a backup artifact. Mutated only by the backup engine.
 */
@Entity
@Table(name = "backup_jobs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackupJob {

    @Id
    @Column(length = 60)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private BackupKind kind;

    // Persisted only through the repository's updateStatus; save() leaves the column untouched
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column
    @Builder.Default
    private Integer progress = 0;

    @Column(name = "current_operation", length = 200)
    private String currentOperation;

    @Convert(converter = OperationLogConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<OperationLogEntry> logs = new ArrayList<>();

    @Embedded
    private JobError error;

    @Column(length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Column(name = "schedule_id", length = 60)
    private String scheduleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "retention_tier", length = 20)
    @Builder.Default
    private RetentionTier retentionTier = RetentionTier.MANUAL;

    // Chains replication and recovery testing on completion
    @Column(nullable = false)
    private boolean automated;

    @Embedded
    private StorageLocation storageLocation;

    @Embedded
    private EncryptionSettings encryption;

    @Column(name = "backup_id", length = 60)
    private String backupId;

    @Column(name = "size_bytes")
    private Long sizeBytes;

    @Column(length = 64)
    private String checksum;

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

    public void updateProgress(int progress, String operation) {
        this.progress = progress;
        this.currentOperation = operation;
    }

    public void addLog(LogLevel level, String message, Instant at) {
        this.logs = OperationLogEntry.append(logs, new OperationLogEntry(at, level, message));
    }

    public long durationMillis() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    // Backup phases
    public static final String OP_QUEUED = "Queued";
    public static final String OP_VALIDATING = "Validating prerequisites";
    public static final String OP_PREPARING_LOCATION = "Preparing storage location";
    public static final String OP_CREATING_PAYLOAD = "Creating backup data";
    public static final String OP_SERIALIZING = "Serializing backup";
    public static final String OP_ENCRYPTING = "Encrypting backup";
    public static final String OP_STORING = "Storing backup";
    public static final String OP_VERIFYING = "Verifying backup integrity";
    public static final String OP_FINALIZING = "Finalizing backup";
    public static final String OP_COMPLETED = "Completed";
    public static final String OP_FAILED = "Failed";
    public static final String OP_CANCELLED = "Cancelled";
}
