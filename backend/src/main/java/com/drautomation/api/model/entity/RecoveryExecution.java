package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.LogLevel;
import com.drautomation.api.util.OperationLogConverter;
import com.drautomation.api.util.StepExecutionListConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One disaster-recovery run through the configured recovery steps.
 */
@Entity
@Table(name = "recovery_executions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecoveryExecution {

    @Id
    @Column(length = 60)
    private String id;

    @Embedded
    private DisasterEvent disaster;

    // Persisted only through the repository's updateStatus; save() leaves the column untouched
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column
    @Builder.Default
    private Integer progress = 0;

    @Column(name = "current_step", length = 60)
    private String currentStep;

    @Convert(converter = StepExecutionListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<StepExecution> steps = new ArrayList<>();

    @Convert(converter = OperationLogConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<OperationLogEntry> logs = new ArrayList<>();

    @Column(name = "backup_id", length = 60)
    private String backupId;

    @Column(name = "restore_job_id", length = 60)
    private String restoreJobId;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

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

    public void addLog(LogLevel level, String message, Instant at) {
        this.logs = OperationLogEntry.append(logs, new OperationLogEntry(at, level, message));
    }

    /**
     * Replaces the record for {@code updated.stepId} keeping list order.
     */
    public void replaceStep(StepExecution updated) {
        List<StepExecution> copy = new ArrayList<>(steps);
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).getStepId().equals(updated.getStepId())) {
                copy.set(i, updated);
            }
        }
        this.steps = copy;
    }

    public StepExecution findStep(String stepId) {
        return steps.stream()
                .filter(s -> s.getStepId().equals(stepId))
                .findFirst()
                .orElse(null);
    }
}
