package com.drautomation.api.model.dto;

import com.drautomation.api.model.entity.BackupSchedule;
import com.drautomation.api.model.entity.RetentionPolicy;
import com.drautomation.api.model.entity.ScheduleFrequency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class ScheduleResponse {

    private String id;
    private String name;
    private boolean enabled;
    private String backupKind;
    private String frequencyType;
    private List<String> daysOfWeek;
    private Integer dayOfMonth;
    private Integer intervalHours;
    private String cronExpression;
    private String time;
    private String timezone;
    private String retentionTier;
    private RetentionPolicy retention;
    private boolean encrypted;
    private boolean notifyOnSuccess;
    private boolean notifyOnFailure;
    private Instant nextRun;
    private Instant lastRun;
    private Instant createdAt;
    private Instant updatedAt;

    public static ScheduleResponse fromEntity(BackupSchedule schedule) {
        ScheduleFrequency frequency = schedule.getFrequency();
        return ScheduleResponse.builder()
                .id(schedule.getId())
                .name(schedule.getName())
                .enabled(schedule.isEnabled())
                .backupKind(schedule.getBackupKind().name())
                .frequencyType(frequency != null && frequency.getType() != null ? frequency.getType().name() : null)
                .daysOfWeek(frequency != null && frequency.getDaysOfWeek() != null
                        ? frequency.getDaysOfWeek().stream().map(Enum::name).toList()
                        : List.of())
                .dayOfMonth(frequency != null ? frequency.getDayOfMonth() : null)
                .intervalHours(frequency != null ? frequency.getIntervalHours() : null)
                .cronExpression(frequency != null ? frequency.getCronExpression() : null)
                .time(schedule.getTime())
                .timezone(schedule.getTimezone())
                .retentionTier(schedule.effectiveRetentionTier().name())
                .retention(schedule.getRetention())
                .encrypted(schedule.getEncryption() != null && schedule.getEncryption().isEnabled())
                .notifyOnSuccess(schedule.getNotifications() != null && schedule.getNotifications().isOnSuccess())
                .notifyOnFailure(schedule.getNotifications() == null || schedule.getNotifications().isOnFailure())
                .nextRun(schedule.getNextRun())
                .lastRun(schedule.getLastRun())
                .createdAt(schedule.getCreatedAt())
                .updatedAt(schedule.getUpdatedAt())
                .build();
    }
}
