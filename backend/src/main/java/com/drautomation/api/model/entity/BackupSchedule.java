package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.model.enums.RetentionTier;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "backup_schedules")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackupSchedule {

    public static final String DEFAULT_TIME = "02:00";
    public static final String DEFAULT_TIMEZONE = "UTC";

    @Id
    @Column(length = 60)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "backup_kind", nullable = false, length = 20)
    private BackupKind backupKind;

    @Embedded
    private ScheduleFrequency frequency;

    // HH:mm in the schedule's timezone
    @Column(name = "run_time", nullable = false, length = 5)
    @Builder.Default
    private String time = DEFAULT_TIME;

    @Column(nullable = false, length = 50)
    @Builder.Default
    private String timezone = DEFAULT_TIMEZONE;

    @Enumerated(EnumType.STRING)
    @Column(name = "retention_tier", length = 20)
    private RetentionTier retentionTier;

    @Embedded
    private RetentionPolicy retention;

    @Embedded
    private StorageLocation storageLocation;

    @Embedded
    private EncryptionSettings encryption;

    @Embedded
    private NotificationSettings notifications;

    @Column(name = "next_run")
    private Instant nextRun;

    @Column(name = "last_run")
    private Instant lastRun;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Tier recorded on backups from this schedule, derived from frequency when not set.
     */
    public RetentionTier effectiveRetentionTier() {
        if (retentionTier != null) {
            return retentionTier;
        }
        if (frequency == null || frequency.getType() == null) {
            return RetentionTier.DAILY;
        }
        return switch (frequency.getType()) {
            case DAILY, CUSTOM -> RetentionTier.DAILY;
            case WEEKLY -> RetentionTier.WEEKLY;
            case MONTHLY -> RetentionTier.MONTHLY;
        };
    }
}
