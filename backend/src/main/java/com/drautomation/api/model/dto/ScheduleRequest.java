package com.drautomation.api.model.dto;

import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.model.enums.FrequencyType;
import com.drautomation.api.model.enums.RetentionTier;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {

    @NotBlank(message = "Schedule name is required")
    @Size(max = 100, message = "Schedule name must be at most 100 characters")
    private String name;

    @Builder.Default
    private boolean enabled = true;

    @NotNull(message = "Backup kind is required")
    private BackupKind backupKind;

    @NotNull(message = "Frequency type is required")
    private FrequencyType frequencyType;

    @Builder.Default
    private List<DayOfWeek> daysOfWeek = new ArrayList<>();

    @Min(value = 1, message = "Day of month must be between 1 and 31")
    @Max(value = 31, message = "Day of month must be between 1 and 31")
    private Integer dayOfMonth;

    @Min(value = 1, message = "Interval must be at least one hour")
    private Integer intervalHours;

    private String cronExpression;

    @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$", message = "Time must be HH:mm")
    private String time;

    private String timezone;

    private RetentionTier retentionTier;

    @Min(value = 0, message = "keepDaily must not be negative")
    private Integer keepDaily;
    @Min(value = 0, message = "keepWeekly must not be negative")
    private Integer keepWeekly;
    @Min(value = 0, message = "keepMonthly must not be negative")
    private Integer keepMonthly;
    @Min(value = 0, message = "keepYearly must not be negative")
    private Integer keepYearly;
    @Min(value = 1, message = "maxAgeDays must be positive")
    private Integer maxAgeDays;
    @Min(value = 1, message = "maxSizeBytes must be positive")
    private Long maxSizeBytes;

    private Boolean encrypt;

    private boolean notifyOnSuccess;
    @Builder.Default
    private boolean notifyOnFailure = true;
    @Builder.Default
    private List<String> recipients = new ArrayList<>();
}
