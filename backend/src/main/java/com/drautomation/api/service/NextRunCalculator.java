package com.drautomation.api.service;

import com.drautomation.api.model.entity.BackupSchedule;
import com.drautomation.api.model.entity.ScheduleFrequency;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Computes when a schedule fires next, in the schedule's timezone. The result is always
 * strictly after the reference instant.
 */
@Component
@RequiredArgsConstructor
public class NextRunCalculator {

    private static final int CRON_FIELDS = 5;

    private final Clock clock;

    public Instant nextRun(BackupSchedule schedule) {
        return nextRun(schedule, Instant.now(clock));
    }

    public Instant nextRun(BackupSchedule schedule, Instant now) {
        ZoneId zone = ZoneId.of(schedule.getTimezone() != null ? schedule.getTimezone() : BackupSchedule.DEFAULT_TIMEZONE);
        LocalTime time = LocalTime.parse(schedule.getTime() != null ? schedule.getTime() : BackupSchedule.DEFAULT_TIME);
        ZonedDateTime current = now.atZone(zone);
        ScheduleFrequency frequency = schedule.getFrequency();

        ZonedDateTime next = switch (frequency.getType()) {
            case DAILY -> daily(current, time);
            case WEEKLY -> weekly(current, time, frequency.getDaysOfWeek());
            case MONTHLY -> monthly(current, time, frequency.getDayOfMonth());
            case CUSTOM -> custom(current, frequency, schedule.getLastRun());
        };
        return next.toInstant();
    }

    private ZonedDateTime daily(ZonedDateTime current, LocalTime time) {
        ZonedDateTime candidate = ZonedDateTime.of(current.toLocalDate(), time, current.getZone());
        if (!candidate.isAfter(current)) {
            candidate = ZonedDateTime.of(current.toLocalDate().plusDays(1), time, current.getZone());
        }
        return candidate;
    }

    private ZonedDateTime weekly(ZonedDateTime current, LocalTime time, List<DayOfWeek> days) {
        List<DayOfWeek> effective = days == null || days.isEmpty() ? List.of(DayOfWeek.SUNDAY) : days;
        // Offset 7 covers today's weekday when its slot already passed
        for (int offset = 0; offset <= 7; offset++) {
            LocalDate date = current.toLocalDate().plusDays(offset);
            if (effective.contains(date.getDayOfWeek())) {
                ZonedDateTime candidate = ZonedDateTime.of(date, time, current.getZone());
                if (candidate.isAfter(current)) {
                    return candidate;
                }
            }
        }
        throw new IllegalStateException("No weekly run found for days " + effective);
    }

    private ZonedDateTime monthly(ZonedDateTime current, LocalTime time, Integer dayOfMonth) {
        int day = dayOfMonth != null ? dayOfMonth : 1;
        YearMonth month = YearMonth.from(current);
        ZonedDateTime candidate = atDay(month, day, time, current.getZone());
        if (!candidate.isAfter(current)) {
            candidate = atDay(month.plusMonths(1), day, time, current.getZone());
        }
        return candidate;
    }

    private ZonedDateTime atDay(YearMonth month, int day, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(month.atDay(Math.min(day, month.lengthOfMonth())), time, zone);
    }

    private ZonedDateTime custom(ZonedDateTime current, ScheduleFrequency frequency, Instant lastRun) {
        if (frequency.getCronExpression() != null && !frequency.getCronExpression().isBlank()) {
            ZonedDateTime next = toSpringCron(frequency.getCronExpression()).next(current);
            if (next == null) {
                throw new IllegalArgumentException("Cron expression never fires: " + frequency.getCronExpression());
            }
            return next;
        }
        Duration interval = Duration.ofHours(frequency.getIntervalHours());
        ZonedDateTime candidate = (lastRun != null ? lastRun.atZone(current.getZone()) : current).plus(interval);
        while (!candidate.isAfter(current)) {
            candidate = candidate.plus(interval);
        }
        return candidate;
    }

    /**
     * Spring cron expressions carry a leading seconds field.
     */
    public static CronExpression toSpringCron(String fiveFieldCron) {
        String trimmed = fiveFieldCron.trim();
        if (trimmed.split("\\s+").length != CRON_FIELDS) {
            throw new IllegalArgumentException(
                    "Cron expression must have five fields (minute hour day-of-month month day-of-week): " + fiveFieldCron);
        }
        return CronExpression.parse("0 " + trimmed);
    }

    /**
     * Rejects schedules whose next run cannot be computed.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public static void validate(ScheduleFrequency frequency, String time, String timezone) {
        if (frequency == null || frequency.getType() == null) {
            throw new IllegalArgumentException("Frequency type is required");
        }
        try {
            LocalTime.parse(time);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Time must be HH:mm: " + time);
        }
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timezone: " + timezone);
        }
        switch (frequency.getType()) {
            case MONTHLY -> {
                Integer day = frequency.getDayOfMonth();
                if (day != null && (day < 1 || day > 31)) {
                    throw new IllegalArgumentException("Day of month must be between 1 and 31");
                }
            }
            case CUSTOM -> {
                boolean hasCron = frequency.getCronExpression() != null && !frequency.getCronExpression().isBlank();
                if (hasCron) {
                    toSpringCron(frequency.getCronExpression());
                } else if (frequency.getIntervalHours() == null || frequency.getIntervalHours() < 1) {
                    throw new IllegalArgumentException("Custom schedules need a cron expression or an interval of at least one hour");
                }
            }
            default -> {
            }
        }
    }
}
