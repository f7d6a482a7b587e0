package com.drautomation.api.service;

import com.drautomation.api.client.ConfigurationSnapshotClient;
import com.drautomation.api.client.DatabaseClient;
import com.drautomation.api.client.FileStoreClient;
import com.drautomation.api.client.StorageClient;
import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.event.BackupCompletedEvent;
import com.drautomation.api.event.BackupRequestedEvent;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.exception.ErrorClassifier;
import com.drautomation.api.exception.ResourceNotFoundException;
import com.drautomation.api.model.dto.BackupOptions;
import com.drautomation.api.model.dto.BackupStatistics;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.entity.BackupJob;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.entity.BackupSchedule;
import com.drautomation.api.model.entity.EncryptionSettings;
import com.drautomation.api.model.entity.JobError;
import com.drautomation.api.model.entity.RetentionPolicy;
import com.drautomation.api.model.entity.StorageLocation;
import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.model.enums.ErrorCategory;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.LogLevel;
import com.drautomation.api.model.enums.RetentionTier;
import com.drautomation.api.model.payload.BackupPayload;
import com.drautomation.api.repository.BackupJobRepository;
import com.drautomation.api.repository.BackupMetadataRepository;
import com.drautomation.api.repository.BackupScheduleRepository;
import com.drautomation.api.security.BackupEncryptor;
import com.drautomation.api.util.Checksums;
import com.drautomation.api.util.FormatUtils;
import com.drautomation.api.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backup engine. Produces backup artifacts for every backup kind, encrypts and checksums them,
 * stores them and records the catalog entry. Retention runs after each successful backup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupService {

    private final BackupJobRepository backupJobRepository;
    private final BackupMetadataRepository backupMetadataRepository;
    private final BackupScheduleRepository backupScheduleRepository;
    private final DatabaseClient databaseClient;
    private final FileStoreClient fileStoreClient;
    private final ConfigurationSnapshotClient configurationSnapshotClient;
    private final StorageClient storageClient;
    private final BackupArtifactService artifactService;
    private final BackupEncryptor encryptor;
    private final RetentionService retentionService;
    private final NotificationService notificationService;
    private final ErrorClassifier errorClassifier;
    private final IdGenerator idGenerator;
    private final AutomationProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // Jobs whose cancellation the running pipeline has yet to observe
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    /**
     * Create a pending backup job. Execution starts after the surrounding transaction commits.
     */
    @Transactional
    public BackupJob createBackup(BackupKind kind, BackupOptions options) {
        if (!properties.getBackup().isEnabled()) {
            throw new AutomationException(AutomationException.CODE_DISABLED, ErrorCategory.VALIDATION,
                    "Backup engine is disabled");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Backup kind is required");
        }
        BackupOptions opts = options != null ? options : new BackupOptions();
        Instant now = Instant.now(clock);

        BackupJob job = BackupJob.builder()
                .id(idGenerator.generate(IdGenerator.PREFIX_JOB))
                .kind(kind)
                .status(JobStatus.PENDING)
                .name(opts.getName() != null ? opts.getName() : kind.name().toLowerCase() + " backup " + now)
                .description(opts.getDescription())
                .tags(opts.getTags() != null ? new ArrayList<>(opts.getTags()) : new ArrayList<>())
                .scheduleId(opts.getScheduleId())
                .retentionTier(opts.getRetentionTier() != null ? opts.getRetentionTier() : RetentionTier.MANUAL)
                .automated(opts.isAutomated())
                .storageLocation(opts.getStorageLocation() != null ? opts.getStorageLocation() : defaultLocation())
                .encryption(resolveEncryption(opts))
                .build();
        job.updateProgress(0, BackupJob.OP_QUEUED);
        job.addLog(LogLevel.INFO, "Backup job queued", now);
        job = backupJobRepository.save(job);

        eventPublisher.publishEvent(new BackupRequestedEvent(this, job.getId()));
        log.info("Created {} backup job {} (automated={}, schedule={})",
                kind, job.getId(), job.isAutomated(), job.getScheduleId());
        return job;
    }

    /**
     * Run the backup pipeline for a pending job. Progress is saved after each phase so it is
     * visible while the job runs; cancellation and the overall timeout are checked between phases.
     */
    public void executeBackup(String jobId) {
        BackupJob job = backupJobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Backup job", jobId));
        if (job.getStatus() != JobStatus.PENDING) {
            log.warn("Skipping backup job {} in status {}", jobId, job.getStatus());
            cancelRequested.remove(jobId);
            return;
        }

        if (!claimStatus(job, JobStatus.RUNNING)) {
            log.info("Backup job {} was cancelled before it started", jobId);
            cancelRequested.remove(jobId);
            return;
        }
        Instant startedAt = Instant.now(clock);
        log.info("Starting {} backup job {}", job.getKind(), jobId);
        job.setStartedAt(startedAt);

        try {
            advance(job, 10, BackupJob.OP_VALIDATING, startedAt);
            validatePrerequisites(job);

            advance(job, 20, BackupJob.OP_PREPARING_LOCATION, startedAt);
            StorageLocation location = job.getStorageLocation();
            storageClient.ensureBucket(location.getRegion(), location.getBucket());

            advance(job, 60, BackupJob.OP_CREATING_PAYLOAD, startedAt);
            String backupId = idGenerator.generate(IdGenerator.PREFIX_BACKUP);
            BackupPayload payload = createPayload(job, backupId);
            job.addLog(LogLevel.INFO, String.format("Captured %d tables, %d rows, %d files",
                    payload.getTables().size(), payload.totalRowCount(), payload.getFiles().size()), Instant.now(clock));

            advance(job, 70, BackupJob.OP_SERIALIZING, startedAt);
            byte[] artifact = artifactService.serialize(payload);

            boolean encrypted = job.getEncryption() != null && job.getEncryption().isEnabled();
            if (encrypted) {
                advance(job, 80, BackupJob.OP_ENCRYPTING, startedAt);
                artifact = encryptor.encrypt(artifact);
            }
            String checksum = Checksums.sha256(artifact);

            advance(job, 90, BackupJob.OP_STORING, startedAt);
            String storageKey = BackupArtifactService.artifactKey(location, backupId);
            storageClient.putObject(location.getRegion(), location.getBucket(), storageKey, artifact);

            advance(job, 95, BackupJob.OP_VERIFYING, startedAt);
            verifyStoredArtifact(location, storageKey, artifact.length, checksum);

            advance(job, 100, BackupJob.OP_FINALIZING, startedAt);
            Instant completedAt = Instant.now(clock);
            BackupMetadata metadata = BackupMetadata.builder()
                    .id(backupId)
                    .name(job.getName())
                    .description(job.getDescription())
                    .kind(job.getKind())
                    .retentionTier(job.getRetentionTier())
                    .sizeBytes(artifact.length)
                    .checksum(checksum)
                    .encryption(job.getEncryption())
                    .location(location)
                    .storageKey(storageKey)
                    .tags(new ArrayList<>(job.getTags()))
                    .baseBackupId(payload.getBaseBackupId())
                    .sourceJobId(job.getId())
                    .scheduleId(job.getScheduleId())
                    .createdAt(startedAt)
                    .completedAt(completedAt)
                    .build();
            backupMetadataRepository.save(metadata);

            if (!claimStatus(job, JobStatus.COMPLETED)) {
                backupMetadataRepository.deleteById(backupId);
                storageClient.deleteObject(location.getRegion(), location.getBucket(), storageKey);
                throw new CancellationException("Backup job " + jobId + " was cancelled before it completed");
            }
            job.setBackupId(backupId);
            job.setSizeBytes((long) artifact.length);
            job.setChecksum(checksum);
            job.setCompletedAt(completedAt);
            job.updateProgress(100, BackupJob.OP_COMPLETED);
            job.addLog(LogLevel.INFO, "Backup completed: " + FormatUtils.formatBytes(artifact.length), completedAt);
            backupJobRepository.save(job);

            log.info("Backup job {} completed: backup={}, size={}, duration={}", jobId, backupId,
                    FormatUtils.formatBytes(artifact.length), FormatUtils.formatDuration(job.durationMillis()));

            applyRetention(job);
            notifySuccess(job, metadata);
            eventPublisher.publishEvent(new BackupCompletedEvent(this, jobId, backupId, true, job.isAutomated(), null));

        } catch (CancellationException e) {
            log.info("Backup job {} cancelled", jobId);
            markCancelled(job);
        } catch (Exception e) {
            JobError error = errorClassifier.classify(e, AutomationException.CODE_BACKUP_ERROR);
            log.error("Backup job {} failed [{}]: {}", jobId, error.getCode(), error.getMessage(), e);
            if (markFailed(job, error)) {
                notifyFailure(job, error);
                eventPublisher.publishEvent(new BackupCompletedEvent(this, jobId, null, false, job.isAutomated(),
                        error.getMessage()));
            }
        } finally {
            cancelRequested.remove(jobId);
        }
    }

    @Transactional
    public BackupJob cancelBackup(String jobId) {
        BackupJob job = getJob(jobId);
        if (job.getStatus().isTerminal()) {
            throw new IllegalStateException("Backup job " + jobId + " is already " + job.getStatus());
        }
        cancelRequested.add(jobId);
        if (!claimStatus(job, JobStatus.CANCELLED)) {
            cancelRequested.remove(jobId);
            throw new IllegalStateException("Backup job " + jobId + " finished while it was being cancelled");
        }
        Instant now = Instant.now(clock);
        job.setCompletedAt(now);
        job.updateProgress(job.getProgress(), BackupJob.OP_CANCELLED);
        job.addLog(LogLevel.WARN, "Backup cancelled", now);
        log.info("Cancellation requested for backup job {}", jobId);
        return backupJobRepository.save(job);
    }

    @Transactional(readOnly = true)
    public List<BackupMetadata> listBackups(BackupKind kind, RetentionTier tier) {
        if (kind != null) {
            return backupMetadataRepository.findByKindOrderByCompletedAtDesc(kind);
        }
        if (tier != null) {
            return backupMetadataRepository.findByRetentionTierOrderByCompletedAtDesc(tier);
        }
        return backupMetadataRepository.findAllByOrderByCompletedAtDesc();
    }

    @Transactional(readOnly = true)
    public BackupMetadata getBackupMetadata(String backupId) {
        return backupMetadataRepository.findById(backupId)
                .orElseThrow(() -> new ResourceNotFoundException("Backup", backupId));
    }

    @Transactional(readOnly = true)
    public Optional<BackupMetadata> getLatestBackup() {
        return backupMetadataRepository.findFirstByOrderByCompletedAtDesc();
    }

    @Transactional(readOnly = true)
    public BackupJob getJob(String jobId) {
        return backupJobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Backup job", jobId));
    }

    @Transactional(readOnly = true)
    public List<BackupJob> listJobs(JobStatus status) {
        if (status != null) {
            return backupJobRepository.findByStatusOrderByCreatedAtDesc(status);
        }
        return backupJobRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * Totals over all jobs. The success rate only counts jobs finished within the monitoring window.
     */
    @Transactional(readOnly = true)
    public BackupStatistics getStatistics() {
        List<BackupJob> jobs = backupJobRepository.findAll();
        long completed = jobs.stream().filter(j -> j.getStatus() == JobStatus.COMPLETED).count();
        long failed = jobs.stream().filter(j -> j.getStatus() == JobStatus.FAILED).count();
        long active = jobs.stream().filter(j -> j.getStatus().isActive()).count();
        long averageDuration = Math.round(jobs.stream()
                .filter(j -> j.getStatus() == JobStatus.COMPLETED)
                .mapToLong(BackupJob::durationMillis)
                .average()
                .orElse(0));

        Instant windowStart = Instant.now(clock).minus(properties.getMonitoring().getStatisticsWindow());
        List<BackupJob> recent = backupJobRepository.findFinishedSince(
                List.of(JobStatus.COMPLETED, JobStatus.FAILED), windowStart);
        long recentCompleted = recent.stream().filter(j -> j.getStatus() == JobStatus.COMPLETED).count();
        double successRate = recent.isEmpty() ? 100.0 : recentCompleted * 100.0 / recent.size();

        List<BackupMetadata> catalog = backupMetadataRepository.findAllByOrderByCompletedAtDesc();
        long totalSize = catalog.stream().mapToLong(BackupMetadata::getSizeBytes).sum();
        Map<String, Long> sizeByKind = new LinkedHashMap<>();
        for (BackupMetadata backup : catalog) {
            sizeByKind.merge(backup.getKind().name(), backup.getSizeBytes(), Long::sum);
        }

        return BackupStatistics.builder()
                .totalJobs(jobs.size())
                .completedJobs(completed)
                .failedJobs(failed)
                .activeJobs(active)
                .successRate(successRate)
                .totalBackups(catalog.size())
                .totalSizeBytes(totalSize)
                .formattedTotalSize(FormatUtils.formatBytes(totalSize))
                .averageDurationMs(averageDuration)
                .lastBackupTime(catalog.isEmpty() ? null : catalog.get(0).getCompletedAt())
                .sizeByKind(sizeByKind)
                .build();
    }

    /**
     * Sweep expired backups at 5 AM daily
     */
    @Scheduled(cron = "0 0 5 * * *")
    public void cleanupExpiredBackups() {
        if (!properties.getBackup().isEnabled() || !storageClient.isConfigured()) {
            return;
        }
        log.info("Starting cleanup of expired backups...");
        List<String> deleted = retentionService.applyRetention(retentionService.defaultPolicy());
        log.info("Cleanup completed. Removed {} expired backups.", deleted.size());
    }

    private void advance(BackupJob job, int progress, String operation, Instant startedAt) {
        if (cancelRequested.contains(job.getId())) {
            throw new CancellationException("Backup job " + job.getId() + " was cancelled");
        }
        Duration timeout = properties.getBackup().getTimeout();
        Instant now = Instant.now(clock);
        if (Duration.between(startedAt, now).compareTo(timeout) > 0) {
            throw AutomationException.timeout("Backup exceeded timeout of " + FormatUtils.formatDuration(timeout.toMillis()));
        }
        job.updateProgress(progress, operation);
        job.addLog(LogLevel.INFO, operation, now);
        backupJobRepository.save(job);
        log.debug("Backup job {}: {} ({}%)", job.getId(), operation, progress);
    }

    private void validatePrerequisites(BackupJob job) {
        if (!storageClient.isConfigured()) {
            throw AutomationException.validation(AutomationException.CODE_PREREQUISITE_FAILED,
                    "Backup storage is not configured");
        }
        if (job.getEncryption() != null && job.getEncryption().isEnabled() && !encryptor.isConfigured()) {
            throw AutomationException.validation(AutomationException.CODE_PREREQUISITE_FAILED,
                    "Encryption requested but no backup encryption key is configured");
        }
        BackupKind kind = job.getKind();
        boolean needsDatabase = kind.includesSchema() || kind.includesData() || kind.isChangeSet();
        if (needsDatabase && !databaseClient.testConnection(properties.getBackup().getSourceDatabase())) {
            throw new AutomationException(AutomationException.CODE_NETWORK_ERROR, ErrorCategory.NETWORK,
                    "Source database " + properties.getBackup().getSourceDatabase() + " is not reachable");
        }
    }

    private BackupPayload createPayload(BackupJob job, String backupId) {
        String database = properties.getBackup().getSourceDatabase();
        BackupPayload payload = BackupPayload.builder()
                .backupId(backupId)
                .kind(job.getKind())
                .createdAt(Instant.now(clock))
                .sourceDatabase(database)
                .build();

        switch (job.getKind()) {
            case FULL -> {
                payload.setSchema(databaseClient.exportSchema(database));
                payload.setTables(databaseClient.exportTables(database, databaseClient.listTables(database)));
                payload.setFiles(fileStoreClient.collectFiles());
                payload.setConfiguration(configurationSnapshotClient.captureSnapshot());
            }
            case INCREMENTAL -> exportChanges(payload, database,
                    backupMetadataRepository.findFirstByOrderByCompletedAtDesc());
            case DIFFERENTIAL -> exportChanges(payload, database,
                    backupMetadataRepository.findFirstByKindOrderByCompletedAtDesc(BackupKind.FULL));
            case SCHEMA -> payload.setSchema(databaseClient.exportSchema(database));
            case DATA -> {
                // Definitions travel with the rows so they can be typed on restore
                payload.setSchema(databaseClient.exportSchema(database));
                payload.setTables(databaseClient.exportTables(database, databaseClient.listTables(database)));
            }
            case FILES -> payload.setFiles(fileStoreClient.collectFiles());
            case CONFIGURATION -> payload.setConfiguration(configurationSnapshotClient.captureSnapshot());
        }
        return payload;
    }

    private void exportChanges(BackupPayload payload, String database, Optional<BackupMetadata> base) {
        // From the start of the base backup, so rows changed while it ran are not lost
        Instant since = base.map(BackupMetadata::getCreatedAt).orElse(Instant.EPOCH);
        payload.setBaseBackupId(base.map(BackupMetadata::getId).orElse(null));
        payload.setChangesSince(since);
        payload.setSchema(databaseClient.exportSchema(database));
        payload.setTables(databaseClient.exportChangesSince(database, since,
                properties.getBackup().getTimestampColumns()));
        if (base.isEmpty()) {
            log.info("No base backup found for {} backup {}, capturing all rows", payload.getKind(), payload.getBackupId());
        }
    }

    private void verifyStoredArtifact(StorageLocation location, String key, long expectedSize, String expectedChecksum) {
        long storedSize = storageClient.getObjectSize(location.getRegion(), location.getBucket(), key);
        if (storedSize != expectedSize) {
            throw AutomationException.integrity(AutomationException.CODE_SIZE_MISMATCH,
                    "Stored size " + storedSize + " does not match expected " + expectedSize + " for " + key);
        }
        byte[] stored = storageClient.getObject(location.getRegion(), location.getBucket(), key);
        if (stored == null || !Checksums.sha256(stored).equals(expectedChecksum)) {
            throw AutomationException.integrity(AutomationException.CODE_CHECKSUM_MISMATCH,
                    "Checksum verification failed for " + key);
        }
    }

    private void applyRetention(BackupJob job) {
        try {
            retentionService.applyRetention(retentionPolicyFor(job));
        } catch (Exception e) {
            log.warn("Retention after backup job {} failed: {}", job.getId(), e.getMessage());
        }
    }

    private RetentionPolicy retentionPolicyFor(BackupJob job) {
        if (job.getScheduleId() != null) {
            Optional<RetentionPolicy> schedulePolicy = backupScheduleRepository.findById(job.getScheduleId())
                    .map(BackupSchedule::getRetention);
            if (schedulePolicy.isPresent()) {
                return schedulePolicy.get();
            }
        }
        return retentionService.defaultPolicy();
    }

    /**
     * Moves the job to {@code next} unless another writer, usually a cancel request, changed its
     * stored status since this copy was loaded.
     */
    private boolean claimStatus(BackupJob job, JobStatus next) {
        if (!job.getStatus().canTransitionTo(next)
                || backupJobRepository.updateStatus(job.getId(), job.getStatus(), next) == 0) {
            return false;
        }
        job.transitionTo(next);
        return true;
    }

    private boolean markFailed(BackupJob job, JobError error) {
        if (!claimStatus(job, JobStatus.FAILED)) {
            log.info("Backup job {} already finished elsewhere, not recording failure", job.getId());
            return false;
        }
        Instant now = Instant.now(clock);
        job.setError(error);
        job.setCompletedAt(now);
        job.updateProgress(job.getProgress(), BackupJob.OP_FAILED);
        job.addLog(LogLevel.ERROR, "Backup failed: " + error.getMessage(), now);
        backupJobRepository.save(job);
        return true;
    }

    private void markCancelled(BackupJob job) {
        if (!claimStatus(job, JobStatus.CANCELLED)) {
            return;
        }
        Instant now = Instant.now(clock);
        job.setCompletedAt(now);
        job.updateProgress(job.getProgress(), BackupJob.OP_CANCELLED);
        job.addLog(LogLevel.WARN, "Backup cancelled", now);
        backupJobRepository.save(job);
    }

    private void notifySuccess(BackupJob job, BackupMetadata metadata) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", job.getId());
        data.put("backupId", metadata.getId());
        data.put("kind", job.getKind().name());
        data.put("size", FormatUtils.formatBytes(metadata.getSizeBytes()));
        data.put("duration", FormatUtils.formatDuration(job.durationMillis()));
        notificationService.notify(NotificationMessage.TYPE_BACKUP_SUCCESS, data);
    }

    private void notifyFailure(BackupJob job, JobError error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", job.getId());
        data.put("kind", job.getKind().name());
        data.put("errorCode", error.getCode());
        data.put("error", error.getMessage());
        data.put("recoverable", error.getRecoverable());
        notificationService.notify(NotificationMessage.TYPE_BACKUP_FAILURE, data);
    }

    private StorageLocation defaultLocation() {
        AutomationProperties.Location location = properties.getBackup().getLocation();
        return StorageLocation.builder()
                .region(location.getRegion())
                .bucket(location.getBucket())
                .prefix(location.getPrefix())
                .build();
    }

    private EncryptionSettings resolveEncryption(BackupOptions options) {
        if (options.getEncryption() != null) {
            return options.getEncryption();
        }
        boolean enabled = options.getEncrypt() != null
                ? options.getEncrypt()
                : properties.getBackup().getEncryption().isEnabled();
        return EncryptionSettings.builder()
                .enabled(enabled)
                .algorithm(enabled ? EncryptionSettings.ALGORITHM_AES_256_GCM : null)
                .keyId(enabled ? properties.getBackup().getEncryption().getKeyId() : null)
                .build();
    }
}
