package com.drautomation.api.service;

import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.exception.ResourceNotFoundException;
import com.drautomation.api.model.dto.BackupOptions;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.dto.ScheduleRequest;
import com.drautomation.api.model.entity.BackupJob;
import com.drautomation.api.model.entity.BackupSchedule;
import com.drautomation.api.model.entity.EncryptionSettings;
import com.drautomation.api.model.entity.NotificationSettings;
import com.drautomation.api.model.entity.RetentionPolicy;
import com.drautomation.api.model.entity.ScheduleFrequency;
import com.drautomation.api.model.entity.StorageLocation;
import com.drautomation.api.model.enums.FrequencyType;
import com.drautomation.api.model.enums.RetentionTier;
import com.drautomation.api.repository.BackupScheduleRepository;
import com.drautomation.api.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps one timer per enabled backup schedule and creates an automated backup each time one fires.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupSchedulerService {

    public static final String DEFAULT_DAILY = "default-daily";
    public static final String DEFAULT_WEEKLY = "default-weekly";
    public static final String DEFAULT_MONTHLY = "default-monthly";
    public static final String TAG_SCHEDULED = "scheduled";

    private final BackupScheduleRepository scheduleRepository;
    private final BackupService backupService;
    private final NextRunCalculator nextRunCalculator;
    private final NotificationService notificationService;
    private final RetentionService retentionService;
    private final IdGenerator idGenerator;
    private final AutomationProperties properties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private volatile boolean running;

    /**
     * Seed default schedules, refresh stale next-run times and arm a timer per enabled schedule.
     */
    @Transactional
    public void start() {
        if (running) {
            return;
        }
        seedDefaultSchedules();
        Instant now = Instant.now(clock);
        for (BackupSchedule schedule : scheduleRepository.findByEnabledTrue()) {
            if (schedule.getNextRun() == null || !schedule.getNextRun().isAfter(now)) {
                schedule.setNextRun(nextRunCalculator.nextRun(schedule, now));
                scheduleRepository.save(schedule);
            }
            arm(schedule);
        }
        running = true;
        log.info("Backup scheduler started with {} active schedules", timers.size());
    }

    public void stop() {
        timers.values().forEach(timer -> timer.cancel(false));
        timers.clear();
        running = false;
        log.info("Backup scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public int getActiveTimerCount() {
        return timers.size();
    }

    @Transactional
    public BackupSchedule createSchedule(ScheduleRequest request) {
        BackupSchedule schedule = BackupSchedule.builder()
                .id(idGenerator.generate(IdGenerator.PREFIX_SCHEDULE))
                .build();
        apply(schedule, request);
        schedule.setNextRun(schedule.isEnabled() ? nextRunCalculator.nextRun(schedule) : null);
        schedule = scheduleRepository.save(schedule);

        if (running && schedule.isEnabled()) {
            arm(schedule);
        }
        log.info("Created backup schedule {} ({}), next run {}", schedule.getName(), schedule.getId(), schedule.getNextRun());
        return schedule;
    }

    @Transactional
    public BackupSchedule updateSchedule(String scheduleId, ScheduleRequest request) {
        BackupSchedule schedule = getSchedule(scheduleId);
        apply(schedule, request);
        schedule.setNextRun(schedule.isEnabled() ? nextRunCalculator.nextRun(schedule) : null);
        schedule = scheduleRepository.save(schedule);

        disarm(scheduleId);
        if (running && schedule.isEnabled()) {
            arm(schedule);
        }
        log.info("Updated backup schedule {}, next run {}", scheduleId, schedule.getNextRun());
        return schedule;
    }

    @Transactional
    public void deleteSchedule(String scheduleId) {
        BackupSchedule schedule = getSchedule(scheduleId);
        disarm(scheduleId);
        scheduleRepository.delete(schedule);
        log.info("Deleted backup schedule {} ({})", schedule.getName(), scheduleId);
    }

    @Transactional
    public BackupSchedule toggleSchedule(String scheduleId) {
        BackupSchedule schedule = getSchedule(scheduleId);
        schedule.setEnabled(!schedule.isEnabled());
        if (schedule.isEnabled()) {
            schedule.setNextRun(nextRunCalculator.nextRun(schedule));
        } else {
            schedule.setNextRun(null);
        }
        schedule = scheduleRepository.save(schedule);

        disarm(scheduleId);
        if (running && schedule.isEnabled()) {
            arm(schedule);
        }
        log.info("Backup schedule {} {}", scheduleId, schedule.isEnabled() ? "enabled" : "disabled");
        return schedule;
    }

    /**
     * Run a schedule's backup now without touching its timer.
     */
    @Transactional
    public BackupJob triggerImmediateBackup(String scheduleId) {
        BackupSchedule schedule = getSchedule(scheduleId);
        log.info("Manually triggering backup for schedule {}", scheduleId);
        return backupService.createBackup(schedule.getBackupKind(), optionsFor(schedule));
    }

    @Transactional(readOnly = true)
    public BackupSchedule getSchedule(String scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule", scheduleId));
    }

    @Transactional(readOnly = true)
    public List<BackupSchedule> listSchedules() {
        return scheduleRepository.findAllByOrderByCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public Optional<BackupSchedule> getNextScheduledBackup() {
        return scheduleRepository.findFirstByEnabledTrueAndNextRunNotNullOrderByNextRunAsc();
    }

    /**
     * Timer callback. Records the run, re-arms for the next one and creates the backup; the
     * timer is re-armed even when the backup could not be created.
     */
    void executeSchedule(String scheduleId) {
        BackupSchedule schedule = scheduleRepository.findById(scheduleId).orElse(null);
        if (schedule == null || !schedule.isEnabled()) {
            timers.remove(scheduleId);
            return;
        }

        Instant now = Instant.now(clock);
        schedule.setLastRun(now);
        schedule.setNextRun(nextRunCalculator.nextRun(schedule, now));
        schedule = scheduleRepository.save(schedule);

        try {
            BackupJob job = backupService.createBackup(schedule.getBackupKind(), optionsFor(schedule));
            log.info("Schedule {} fired: backup job {}, next run {}", schedule.getName(), job.getId(), schedule.getNextRun());
        } catch (Exception e) {
            log.error("Scheduled backup for {} failed: {}", schedule.getName(), e.getMessage(), e);
            notifyFailure(schedule, e);
        } finally {
            if (running) {
                arm(schedule);
            }
        }
    }

    private void arm(BackupSchedule schedule) {
        disarm(schedule.getId());
        if (schedule.getNextRun() == null) {
            return;
        }
        String scheduleId = schedule.getId();
        ScheduledFuture<?> timer = taskScheduler.schedule(() -> executeSchedule(scheduleId), schedule.getNextRun());
        if (timer != null) {
            timers.put(scheduleId, timer);
        }
        log.debug("Armed schedule {} for {}", scheduleId, schedule.getNextRun());
    }

    private void disarm(String scheduleId) {
        ScheduledFuture<?> timer = timers.remove(scheduleId);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private BackupOptions optionsFor(BackupSchedule schedule) {
        List<String> tags = new ArrayList<>(List.of(TAG_SCHEDULED,
                schedule.getBackupKind().name().toLowerCase(), schedule.getId()));
        return BackupOptions.builder()
                .name(schedule.getName())
                .description("Scheduled backup from " + schedule.getName())
                .tags(tags)
                .retentionTier(schedule.effectiveRetentionTier())
                .scheduleId(schedule.getId())
                .automated(true)
                .storageLocation(schedule.getStorageLocation())
                .encryption(schedule.getEncryption())
                .build();
    }

    private void notifyFailure(BackupSchedule schedule, Exception e) {
        NotificationSettings notifications = schedule.getNotifications();
        if (notifications != null && !notifications.isOnFailure()) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scheduleId", schedule.getId());
        data.put("scheduleName", schedule.getName());
        data.put("error", e.getMessage());
        notificationService.notify(NotificationMessage.TYPE_SCHEDULE_FAILURE, data,
                notifications != null ? notifications.getRecipients() : List.of());
    }

    private void apply(BackupSchedule schedule, ScheduleRequest request) {
        ScheduleFrequency frequency = ScheduleFrequency.builder()
                .type(request.getFrequencyType())
                .daysOfWeek(request.getDaysOfWeek() != null ? new ArrayList<>(request.getDaysOfWeek()) : new ArrayList<>())
                .dayOfMonth(request.getDayOfMonth())
                .intervalHours(request.getIntervalHours())
                .cronExpression(request.getCronExpression())
                .build();
        String time = request.getTime() != null ? request.getTime() : BackupSchedule.DEFAULT_TIME;
        String timezone = request.getTimezone() != null
                ? request.getTimezone()
                : properties.getBackup().getSchedules().getTimezone();
        NextRunCalculator.validate(frequency, time, timezone);

        RetentionPolicy defaults = retentionService.defaultPolicy();
        schedule.setName(request.getName());
        schedule.setEnabled(request.isEnabled());
        schedule.setBackupKind(request.getBackupKind());
        schedule.setFrequency(frequency);
        schedule.setTime(time);
        schedule.setTimezone(timezone);
        schedule.setRetentionTier(request.getRetentionTier());
        schedule.setRetention(RetentionPolicy.builder()
                .keepDaily(request.getKeepDaily() != null ? request.getKeepDaily() : defaults.getKeepDaily())
                .keepWeekly(request.getKeepWeekly() != null ? request.getKeepWeekly() : defaults.getKeepWeekly())
                .keepMonthly(request.getKeepMonthly() != null ? request.getKeepMonthly() : defaults.getKeepMonthly())
                .keepYearly(request.getKeepYearly() != null ? request.getKeepYearly() : defaults.getKeepYearly())
                .maxAgeDays(request.getMaxAgeDays() != null ? request.getMaxAgeDays() : defaults.getMaxAgeDays())
                .maxSizeBytes(request.getMaxSizeBytes() != null ? request.getMaxSizeBytes() : defaults.getMaxSizeBytes())
                .build());
        schedule.setStorageLocation(defaultLocation());
        boolean encrypt = request.getEncrypt() != null
                ? request.getEncrypt()
                : properties.getBackup().getEncryption().isEnabled();
        schedule.setEncryption(EncryptionSettings.builder()
                .enabled(encrypt)
                .algorithm(encrypt ? EncryptionSettings.ALGORITHM_AES_256_GCM : null)
                .keyId(encrypt ? properties.getBackup().getEncryption().getKeyId() : null)
                .build());
        schedule.setNotifications(NotificationSettings.builder()
                .onSuccess(request.isNotifyOnSuccess())
                .onFailure(request.isNotifyOnFailure())
                .recipients(request.getRecipients() != null ? new ArrayList<>(request.getRecipients()) : new ArrayList<>())
                .build());
    }

    private void seedDefaultSchedules() {
        AutomationProperties.Schedules defaults = properties.getBackup().getSchedules();
        if (!defaults.isSeedDefaults() || !properties.getBackup().isEnabled()) {
            return;
        }
        seedDefault(DEFAULT_DAILY, defaults.getDaily(), RetentionTier.DAILY, defaults);
        seedDefault(DEFAULT_WEEKLY, defaults.getWeekly(), RetentionTier.WEEKLY, defaults);
        seedDefault(DEFAULT_MONTHLY, defaults.getMonthly(), RetentionTier.MONTHLY, defaults);
    }

    private void seedDefault(String name, String cron, RetentionTier tier, AutomationProperties.Schedules defaults) {
        if (cron == null || cron.isBlank() || scheduleRepository.existsByName(name)) {
            return;
        }
        createSchedule(ScheduleRequest.builder()
                .name(name)
                .backupKind(defaults.getKind())
                .frequencyType(FrequencyType.CUSTOM)
                .cronExpression(cron)
                .timezone(defaults.getTimezone())
                .retentionTier(tier)
                .build());
        log.info("Seeded default {} backup schedule ({})", tier.name().toLowerCase(), cron);
    }

    private StorageLocation defaultLocation() {
        AutomationProperties.Location location = properties.getBackup().getLocation();
        return StorageLocation.builder()
                .region(location.getRegion())
                .bucket(location.getBucket())
                .prefix(location.getPrefix())
                .build();
    }
}
