package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.LogLevel;
import com.drautomation.api.util.OperationLogConverter;
import com.drautomation.api.util.VerificationResultConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "restore_jobs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RestoreJob {

    @Id
    @Column(length = 60)
    private String id;

    @Column(name = "backup_id", nullable = false, length = 60)
    private String backupId;

    @Embedded
    private RestoreOptions options;

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

    @Convert(converter = VerificationResultConverter.class)
    @Column(columnDefinition = "TEXT")
    private VerificationResult verification;

    @Embedded
    private JobError error;

    // Set when the restore runs as part of a recovery run
    @Column(name = "recovery_execution_id", length = 60)
    private String recoveryExecutionId;

    @Column(name = "rows_restored")
    private long rowsRestored;

    @Column(name = "files_restored")
    private int filesRestored;

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

    // Restore phases
    public static final String OP_QUEUED = "Queued";
    public static final String OP_VALIDATING = "Validating restore prerequisites";
    public static final String OP_LOADING = "Loading backup data";
    public static final String OP_PREPARING = "Preparing target environment";
    public static final String OP_RESTORING_SCHEMA = "Restoring schema";
    public static final String OP_RESTORING_DATA = "Restoring data";
    public static final String OP_RESTORING_FILES = "Restoring files";
    public static final String OP_RESTORING_CONFIGURATION = "Restoring configuration";
    public static final String OP_VERIFYING = "Verifying restore";
    public static final String OP_FINALIZING = "Finalizing restore";
    public static final String OP_COMPLETED = "Completed";
    public static final String OP_FAILED = "Failed";
    public static final String OP_CANCELLED = "Cancelled";
}
