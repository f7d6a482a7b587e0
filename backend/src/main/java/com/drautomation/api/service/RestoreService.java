package com.drautomation.api.service;

import com.drautomation.api.client.ConfigurationSnapshotClient;
import com.drautomation.api.client.DatabaseClient;
import com.drautomation.api.client.FileStoreClient;
import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.event.RestoreRequestedEvent;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.exception.ErrorClassifier;
import com.drautomation.api.exception.ResourceNotFoundException;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.dto.RestoreStatistics;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.entity.JobError;
import com.drautomation.api.model.entity.RestoreJob;
import com.drautomation.api.model.entity.RestoreOptions;
import com.drautomation.api.model.entity.VerificationResult;
import com.drautomation.api.model.enums.ErrorCategory;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.LogLevel;
import com.drautomation.api.model.enums.RestoreKind;
import com.drautomation.api.model.payload.BackupPayload;
import com.drautomation.api.model.payload.TableData;
import com.drautomation.api.repository.BackupMetadataRepository;
import com.drautomation.api.repository.RestoreJobRepository;
import com.drautomation.api.util.FormatUtils;
import com.drautomation.api.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Restore engine. Loads a verified backup artifact and writes its schema, data, files and
 * configuration back, then verifies the result. TEST restores only simulate and write nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RestoreService {

    private final RestoreJobRepository restoreJobRepository;
    private final BackupMetadataRepository backupMetadataRepository;
    private final BackupArtifactService artifactService;
    private final DatabaseClient databaseClient;
    private final DatabaseRestoreWriter restoreWriter;
    private final FileStoreClient fileStoreClient;
    private final ConfigurationSnapshotClient configurationSnapshotClient;
    private final RestoreVerificationService verificationService;
    private final NotificationService notificationService;
    private final ErrorClassifier errorClassifier;
    private final IdGenerator idGenerator;
    private final AutomationProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    /**
     * Create a pending restore job. Execution starts after the surrounding transaction commits.
     */
    @Transactional
    public RestoreJob startRestore(String backupId, RestoreOptions options) {
        RestoreJob job = createJob(backupId, options, null);
        eventPublisher.publishEvent(new RestoreRequestedEvent(this, job.getId()));
        return job;
    }

    /**
     * Run a restore on the calling thread, as the recovery pipeline does.
     *
     * @return the finished job
     */
    public RestoreJob runRestore(String backupId, RestoreOptions options, String recoveryExecutionId) {
        RestoreJob job = createJob(backupId, options, recoveryExecutionId);
        executeRestore(job.getId());
        return getRestoreJob(job.getId());
    }

    public void executeRestore(String jobId) {
        RestoreJob job = restoreJobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Restore job", jobId));
        if (job.getStatus() != JobStatus.PENDING) {
            log.warn("Skipping restore job {} in status {}", jobId, job.getStatus());
            cancelRequested.remove(jobId);
            return;
        }

        if (!claimStatus(job, JobStatus.RUNNING)) {
            log.info("Restore job {} was cancelled before it started", jobId);
            cancelRequested.remove(jobId);
            return;
        }

        RestoreOptions options = job.getOptions();
        boolean simulated = options.getKind() == RestoreKind.TEST;
        Instant startedAt = Instant.now(clock);
        job.setStartedAt(startedAt);
        log.info("Starting {} restore job {} from backup {}", options.getKind(), jobId, job.getBackupId());
        PhaseClock phases = new PhaseClock(startedAt);

        try {
            advance(job, 10, RestoreJob.OP_VALIDATING, phases);
            BackupMetadata backup = backupMetadataRepository.findById(job.getBackupId())
                    .orElseThrow(() -> AutomationException.validation(AutomationException.CODE_PREREQUISITE_FAILED,
                            "Backup " + job.getBackupId() + " does not exist"));
            validateOptions(options);

            advance(job, 20, RestoreJob.OP_LOADING, phases);
            BackupArtifactService.LoadedArtifact artifact = artifactService.load(backup);
            BackupPayload payload = options.getKind() == RestoreKind.POINT_IN_TIME
                    ? DatabaseRestoreWriter.rowsUpTo(artifact.getPayload(), options.getPointInTime(),
                            properties.getBackup().getTimestampColumns())
                    : artifact.getPayload();
            List<String> tables = selectTables(payload, options);
            String database = targetDatabase(options);

            advance(job, 30, RestoreJob.OP_PREPARING, phases);
            if (!simulated && (options.isRestoreSchema() || options.isRestoreData())
                    && !databaseClient.databaseExists(database)) {
                databaseClient.createDatabase(database);
            }

            Map<String, Long> rows = new LinkedHashMap<>();
            if (options.isRestoreSchema()) {
                advance(job, 40, RestoreJob.OP_RESTORING_SCHEMA, phases);
                List<String> defined = withDefinitions(payload, tables);
                if (simulated) {
                    job.addLog(LogLevel.INFO, "Would create " + defined.size() + " tables", Instant.now(clock));
                } else {
                    restoreWriter.createTables(database, restoreWriter.definitionsFor(payload, defined),
                            options.isOverwriteExisting(), true);
                }
            }
            if (options.isRestoreData()) {
                advance(job, 55, RestoreJob.OP_RESTORING_DATA, phases);
                List<String> withData = tables.stream().filter(t -> payload.findTableData(t) != null).toList();
                if (simulated) {
                    for (String table : withData) {
                        rows.put(table, payload.findTableData(table).rowCount());
                    }
                } else {
                    rows.putAll(restoreWriter.writeRows(database, payload, withData, options.isOverwriteExisting()));
                }
                job.setRowsRestored(rows.values().stream().mapToLong(Long::longValue).sum());
            }
            if (options.isRestoreFiles() && !payload.getFiles().isEmpty()) {
                advance(job, 70, RestoreJob.OP_RESTORING_FILES, phases);
                if (simulated) {
                    job.setFilesRestored(payload.getFiles().size());
                } else {
                    String root = options.getKind() == RestoreKind.CLONE ? options.getTargetLocation() : null;
                    job.setFilesRestored(fileStoreClient.restoreFiles(payload.getFiles(), root));
                }
            }
            if (options.isRestoreConfiguration() && !payload.getConfiguration().isEmpty()) {
                advance(job, 75, RestoreJob.OP_RESTORING_CONFIGURATION, phases);
                if (!simulated) {
                    String location = configurationSnapshotClient.restoreSnapshot(payload.getConfiguration(),
                            backup.getId());
                    job.addLog(LogLevel.INFO, "Configuration written to " + location, Instant.now(clock));
                }
            }

            advance(job, 80, RestoreJob.OP_VERIFYING, phases);
            if (options.anyVerificationEnabled()) {
                VerificationResult verification = verificationService.verify(
                        RestoreVerificationService.VerificationInput.builder()
                                .database(database)
                                .payload(payload)
                                .options(options)
                                .tables(options.isRestoreSchema() || options.isRestoreData()
                                        ? withDefinitions(payload, tables) : List.of())
                                .expectedRows(rows)
                                .files(options.isRestoreFiles() ? payload.getFiles() : List.of())
                                .expectedChecksum(backup.getChecksum())
                                .actualChecksum(artifact.getChecksum())
                                .simulated(simulated)
                                .build());
                job.setVerification(verification);
                if (!verification.isPassed()) {
                    throw new AutomationException(AutomationException.CODE_VERIFICATION_FAILED, ErrorCategory.INTEGRITY,
                            verification.getFailedChecks() + " of " + verification.getTotalChecks()
                                    + " verification checks failed");
                }
            }

            advance(job, 95, RestoreJob.OP_FINALIZING, phases);
            if (!claimStatus(job, JobStatus.COMPLETED)) {
                throw new CancellationException("Restore job " + jobId + " was cancelled before it completed");
            }
            Instant completedAt = Instant.now(clock);
            job.setCompletedAt(completedAt);
            job.updateProgress(100, RestoreJob.OP_COMPLETED);
            job.addLog(LogLevel.INFO, String.format("%s restored %d rows and %d files",
                    simulated ? "Simulation" : "Restore", job.getRowsRestored(), job.getFilesRestored()), completedAt);
            restoreJobRepository.save(job);

            log.info("Restore job {} completed into {}: rows={}, files={}, duration={}", jobId, database,
                    job.getRowsRestored(), job.getFilesRestored(), FormatUtils.formatDuration(job.durationMillis()));
            notifyOutcome(job, null);

        } catch (CancellationException e) {
            log.info("Restore job {} cancelled", jobId);
            markCancelled(job);
        } catch (Exception e) {
            JobError error = errorClassifier.classify(e, AutomationException.CODE_RESTORE_ERROR);
            log.error("Restore job {} failed [{}]: {}", jobId, error.getCode(), error.getMessage(), e);
            if (markFailed(job, error)) {
                notifyOutcome(job, error);
            }
        } finally {
            cancelRequested.remove(jobId);
        }
    }

    @Transactional
    public RestoreJob cancelRestore(String jobId) {
        RestoreJob job = getRestoreJob(jobId);
        if (!job.getStatus().isActive()) {
            throw new IllegalStateException("Restore job " + jobId + " is already " + job.getStatus());
        }
        cancelRequested.add(jobId);
        if (!claimStatus(job, JobStatus.CANCELLED)) {
            cancelRequested.remove(jobId);
            throw new IllegalStateException("Restore job " + jobId + " finished while it was being cancelled");
        }
        Instant now = Instant.now(clock);
        job.setCompletedAt(now);
        job.updateProgress(job.getProgress(), RestoreJob.OP_CANCELLED);
        job.addLog(LogLevel.WARN, "Restore cancelled", now);
        log.info("Cancellation requested for restore job {}", jobId);
        return restoreJobRepository.save(job);
    }

    @Transactional(readOnly = true)
    public RestoreJob getRestoreJob(String jobId) {
        return restoreJobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Restore job", jobId));
    }

    @Transactional(readOnly = true)
    public List<RestoreJob> listRestoreJobs(String backupId) {
        if (backupId != null) {
            return restoreJobRepository.findByBackupIdOrderByCreatedAtDesc(backupId);
        }
        return restoreJobRepository.findAllByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public RestoreStatistics getStatistics() {
        List<RestoreJob> jobs = restoreJobRepository.findAll();
        long completed = jobs.stream().filter(j -> j.getStatus() == JobStatus.COMPLETED).count();
        long failed = jobs.stream().filter(j -> j.getStatus() == JobStatus.FAILED).count();
        long cancelled = jobs.stream().filter(j -> j.getStatus() == JobStatus.CANCELLED).count();
        long active = jobs.stream().filter(j -> j.getStatus().isActive()).count();
        long finished = completed + failed;
        return RestoreStatistics.builder()
                .totalJobs(jobs.size())
                .completedJobs(completed)
                .failedJobs(failed)
                .cancelledJobs(cancelled)
                .activeJobs(active)
                .successRate(finished == 0 ? 100.0 : completed * 100.0 / finished)
                .averageDurationMs(Math.round(jobs.stream()
                        .filter(j -> j.getStatus() == JobStatus.COMPLETED)
                        .mapToLong(RestoreJob::durationMillis)
                        .average()
                        .orElse(0)))
                .totalRowsRestored(jobs.stream()
                        .filter(j -> j.getStatus() == JobStatus.COMPLETED)
                        .mapToLong(RestoreJob::getRowsRestored)
                        .sum())
                .build();
    }

    private RestoreJob createJob(String backupId, RestoreOptions options, String recoveryExecutionId) {
        if (!backupMetadataRepository.existsById(backupId)) {
            throw new ResourceNotFoundException("Backup", backupId);
        }
        RestoreOptions opts = options != null ? options : RestoreOptions.builder().build();
        validateOptions(opts);
        Instant now = Instant.now(clock);
        RestoreJob job = RestoreJob.builder()
                .id(idGenerator.generate(IdGenerator.PREFIX_RESTORE))
                .backupId(backupId)
                .options(opts)
                .status(JobStatus.PENDING)
                .recoveryExecutionId(recoveryExecutionId)
                .build();
        job.updateProgress(0, RestoreJob.OP_QUEUED);
        job.addLog(LogLevel.INFO, "Restore job queued", now);
        job = restoreJobRepository.save(job);
        log.info("Created {} restore job {} for backup {}", opts.getKind(), job.getId(), backupId);
        return job;
    }

    private void validateOptions(RestoreOptions options) {
        if (options.getKind() == RestoreKind.POINT_IN_TIME && options.getPointInTime() == null) {
            throw new IllegalArgumentException("Point-in-time restore requires a point in time");
        }
        if (options.getKind() == RestoreKind.PARTIAL
                && (options.getTableFilters() == null || options.getTableFilters().isEmpty())) {
            throw new IllegalArgumentException("Partial restore requires at least one table filter");
        }
    }

    private List<String> selectTables(BackupPayload payload, RestoreOptions options) {
        List<String> all = DatabaseRestoreWriter.tableNames(payload);
        Set<String> available = caseInsensitive(all);
        if (options.getKind() == RestoreKind.PARTIAL) {
            List<String> missing = options.getTableFilters().stream().filter(t -> !available.contains(t)).toList();
            if (!missing.isEmpty()) {
                throw AutomationException.validation(AutomationException.CODE_PREREQUISITE_FAILED,
                        "Tables not in backup: " + missing);
            }
            return new ArrayList<>(options.getTableFilters());
        }
        Set<String> excluded = caseInsensitive(options.getExcludedTables());
        return all.stream().filter(t -> !excluded.contains(t)).toList();
    }

    private static List<String> withDefinitions(BackupPayload payload, List<String> tables) {
        return tables.stream().filter(t -> payload.findTableDefinition(t) != null).toList();
    }

    private String targetDatabase(RestoreOptions options) {
        String target = options.getTargetDatabase() != null && !options.getTargetDatabase().isBlank()
                ? options.getTargetDatabase()
                : properties.getRestore().getTargetDatabase();
        if (options.getKind() == RestoreKind.CLONE) {
            return options.getTargetLocation() != null && !options.getTargetLocation().isBlank()
                    ? options.getTargetLocation()
                    : target + "_clone";
        }
        return target;
    }

    private void advance(RestoreJob job, int progress, String operation, PhaseClock phases) {
        if (cancelRequested.contains(job.getId())) {
            throw new CancellationException("Restore job " + job.getId() + " was cancelled");
        }
        Instant now = Instant.now(clock);
        Duration timeout = properties.getRestore().getPhaseTimeout();
        if (Duration.between(phases.phaseStartedAt, now).compareTo(timeout) > 0) {
            throw AutomationException.timeout("Restore phase '" + job.getCurrentOperation()
                    + "' exceeded timeout of " + FormatUtils.formatDuration(timeout.toMillis()));
        }
        phases.phaseStartedAt = now;
        job.updateProgress(progress, operation);
        job.addLog(LogLevel.INFO, operation, now);
        restoreJobRepository.save(job);
        log.debug("Restore job {}: {} ({}%)", job.getId(), operation, progress);
    }

    private boolean claimStatus(RestoreJob job, JobStatus next) {
        if (!job.getStatus().canTransitionTo(next)
                || restoreJobRepository.updateStatus(job.getId(), job.getStatus(), next) == 0) {
            return false;
        }
        job.transitionTo(next);
        return true;
    }

    private boolean markFailed(RestoreJob job, JobError error) {
        if (!claimStatus(job, JobStatus.FAILED)) {
            log.info("Restore job {} already finished elsewhere, not recording failure", job.getId());
            return false;
        }
        Instant now = Instant.now(clock);
        job.setError(error);
        job.setCompletedAt(now);
        job.updateProgress(job.getProgress(), RestoreJob.OP_FAILED);
        job.addLog(LogLevel.ERROR, "Restore failed: " + error.getMessage(), now);
        restoreJobRepository.save(job);
        return true;
    }

    private void markCancelled(RestoreJob job) {
        if (!claimStatus(job, JobStatus.CANCELLED)) {
            return;
        }
        Instant now = Instant.now(clock);
        job.setCompletedAt(now);
        job.updateProgress(job.getProgress(), RestoreJob.OP_CANCELLED);
        job.addLog(LogLevel.WARN, "Restore cancelled", now);
        restoreJobRepository.save(job);
    }

    private void notifyOutcome(RestoreJob job, JobError error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", job.getId());
        data.put("backupId", job.getBackupId());
        data.put("kind", job.getOptions().getKind().name());
        if (error == null) {
            data.put("rowsRestored", job.getRowsRestored());
            data.put("filesRestored", job.getFilesRestored());
            data.put("duration", FormatUtils.formatDuration(job.durationMillis()));
            notificationService.notify(NotificationMessage.TYPE_RESTORE_SUCCESS, data);
        } else {
            data.put("errorCode", error.getCode());
            data.put("error", error.getMessage());
            notificationService.notify(NotificationMessage.TYPE_RESTORE_FAILURE, data);
        }
    }

    private static Set<String> caseInsensitive(List<String> values) {
        Set<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (values != null) {
            set.addAll(values);
        }
        return set;
    }

    private static class PhaseClock {
        private Instant phaseStartedAt;

        PhaseClock(Instant startedAt) {
            this.phaseStartedAt = startedAt;
        }
    }
}
