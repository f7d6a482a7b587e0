package com.drautomation.api.service;

import com.drautomation.api.client.StorageClient;
import com.drautomation.api.config.AsyncConfig;
import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.exception.ErrorClassifier;
import com.drautomation.api.exception.ResourceNotFoundException;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.dto.ReplicationStatistics;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.entity.JobError;
import com.drautomation.api.model.entity.ReplicationJob;
import com.drautomation.api.model.enums.ErrorCategory;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.repository.BackupMetadataRepository;
import com.drautomation.api.repository.ReplicationJobRepository;
import com.drautomation.api.util.FormatUtils;
import com.drautomation.api.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
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
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Copies completed backup artifacts to every configured secondary region.
 * Jobs are processed one at a time by a single worker; within a job all regions are copied
 * concurrently and the job only succeeds when every region does.
 */
@Slf4j
@Service
public class ReplicationService {

    private final ReplicationJobRepository replicationJobRepository;
    private final BackupMetadataRepository backupMetadataRepository;
    private final StorageClient storageClient;
    private final NotificationService notificationService;
    private final ErrorClassifier errorClassifier;
    private final IdGenerator idGenerator;
    private final AutomationProperties properties;
    private final Clock clock;
    private final TaskExecutor worker;
    private final Executor regionExecutor;

    private final Queue<String> queue = new LinkedBlockingQueue<>();
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    public ReplicationService(ReplicationJobRepository replicationJobRepository,
                              BackupMetadataRepository backupMetadataRepository,
                              StorageClient storageClient,
                              NotificationService notificationService,
                              ErrorClassifier errorClassifier,
                              IdGenerator idGenerator,
                              AutomationProperties properties,
                              Clock clock,
                              @Qualifier(AsyncConfig.REPLICATION_WORKER) TaskExecutor worker,
                              @Qualifier(AsyncConfig.REPLICATION_REGIONS) Executor regionExecutor) {
        this.replicationJobRepository = replicationJobRepository;
        this.backupMetadataRepository = backupMetadataRepository;
        this.storageClient = storageClient;
        this.notificationService = notificationService;
        this.errorClassifier = errorClassifier;
        this.idGenerator = idGenerator;
        this.properties = properties;
        this.clock = clock;
        this.worker = worker;
        this.regionExecutor = regionExecutor;
    }

    public boolean isEnabled() {
        return properties.getCrossRegion().isEnabled();
    }

    public ReplicationJob startReplication(String backupId) {
        BackupMetadata metadata = backupMetadataRepository.findById(backupId)
                .orElseThrow(() -> new ResourceNotFoundException("Backup", backupId));
        return startReplication(metadata);
    }

    /**
     * Queue a replication of {@code metadata}'s artifact. The job is saved before it is queued
     * so the worker always finds it.
     */
    public ReplicationJob startReplication(BackupMetadata metadata) {
        AutomationProperties.CrossRegion config = properties.getCrossRegion();
        if (!config.isEnabled()) {
            throw new AutomationException(AutomationException.CODE_DISABLED, ErrorCategory.VALIDATION,
                    "Cross-region replication is disabled");
        }
        List<String> regions = targetRegions(metadata.getLocation().getRegion());
        if (regions.isEmpty()) {
            throw AutomationException.validation(AutomationException.CODE_PREREQUISITE_FAILED,
                    "No replication regions configured");
        }

        String artifactKey = metadata.getStorageKey() != null
                ? metadata.getStorageKey()
                : ReplicationJob.sourceKey(metadata.getId());
        ReplicationJob job = ReplicationJob.builder()
                .id(idGenerator.generate(IdGenerator.PREFIX_REPLICATION))
                .backupId(metadata.getId())
                .artifactKey(artifactKey)
                .sourceRegion(metadata.getLocation().getRegion())
                .sourceBucket(metadata.getLocation().getBucket())
                .targetRegions(new ArrayList<>(regions))
                .backupSize(metadata.getSizeBytes())
                .status(JobStatus.PENDING)
                .build();
        job = replicationJobRepository.save(job);

        queue.add(job.getId());
        worker.execute(this::processNext);
        log.info("Queued replication {} of backup {} to {}", job.getId(), metadata.getId(), regions);
        return job;
    }

    @Transactional
    public ReplicationJob cancelReplication(String jobId) {
        ReplicationJob job = getJobStatus(jobId);
        if (job.getStatus().isTerminal()) {
            throw new IllegalStateException("Replication job " + jobId + " is already " + job.getStatus());
        }
        queue.remove(jobId);
        cancelRequested.add(jobId);
        if (!claimStatus(job, JobStatus.CANCELLED)) {
            cancelRequested.remove(jobId);
            throw new IllegalStateException("Replication job " + jobId + " finished while it was being cancelled");
        }
        Instant now = Instant.now(clock);
        job.setCompletedAt(now);
        job.setError(JobError.builder()
                .code(AutomationException.CODE_CANCELLED)
                .message(ReplicationJob.CANCELLED_BY_USER)
                .category(ErrorCategory.VALIDATION)
                .recoverable(false)
                .occurredAt(now)
                .build());
        log.info("Replication job {} cancelled", jobId);
        return replicationJobRepository.save(job);
    }

    @Transactional(readOnly = true)
    public ReplicationJob getJobStatus(String jobId) {
        return replicationJobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Replication job", jobId));
    }

    @Transactional(readOnly = true)
    public List<ReplicationJob> listJobs(String backupId) {
        if (backupId != null) {
            return replicationJobRepository.findByBackupIdOrderByCreatedAtDesc(backupId);
        }
        return replicationJobRepository.findAllByOrderByCreatedAtDesc();
    }

    public int getQueueSize() {
        return queue.size();
    }

    @Transactional(readOnly = true)
    public ReplicationStatistics getStatistics() {
        List<ReplicationJob> jobs = replicationJobRepository.findAll();
        List<ReplicationJob> completed = jobs.stream().filter(j -> j.getStatus() == JobStatus.COMPLETED).toList();
        long failed = jobs.stream().filter(j -> j.getStatus() == JobStatus.FAILED).count();
        long finished = completed.size() + failed;

        return ReplicationStatistics.builder()
                .totalJobs(jobs.size())
                .completedJobs(completed.size())
                .failedJobs(failed)
                .activeJobs(jobs.stream().filter(j -> j.getStatus().isActive()).count())
                .queuedJobs(queue.size())
                .successRate(finished == 0 ? 100.0 : completed.size() * 100.0 / finished)
                .averageLatencyMs(Math.round(completed.stream().mapToLong(ReplicationJob::durationMillis).average().orElse(0)))
                .totalBytesTransferred(completed.stream().mapToLong(ReplicationJob::getTransferredBytes).sum())
                .build();
    }

    /**
     * Replica sweep at 5:30 AM daily
     */
    @Scheduled(cron = "0 30 5 * * *")
    public void scheduledReplicaCleanup() {
        if (!isEnabled() || !storageClient.isConfigured()) {
            return;
        }
        cleanupOldReplicas();
    }

    /**
     * Delete replicas older than the replica retention window in every target region.
     *
     * @return number of replica objects deleted
     */
    public int cleanupOldReplicas() {
        AutomationProperties.CrossRegion config = properties.getCrossRegion();
        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(config.getReplicaRetentionDays()));
        String bucket = targetBucket(properties.getBackup().getLocation().getBucket());
        int deleted = 0;

        for (String region : targetRegions(config.getPrimaryRegion())) {
            try {
                for (StorageClient.StoredObject replica : storageClient.listObjects(region, bucket,
                        ReplicationJob.TARGET_PREFIX + region + "/")) {
                    if (replica.getLastModified() != null && replica.getLastModified().isBefore(cutoff)) {
                        storageClient.deleteObject(region, bucket, replica.getKey());
                        deleted++;
                    }
                }
            } catch (Exception e) {
                log.error("Replica cleanup in region {} failed: {}", region, e.getMessage());
            }
        }
        log.info("Replica cleanup removed {} objects older than {}", deleted, cutoff);
        return deleted;
    }

    void processNext() {
        String jobId = queue.poll();
        if (jobId != null) {
            processJob(jobId);
        }
    }

    void processJob(String jobId) {
        ReplicationJob job = replicationJobRepository.findById(jobId).orElse(null);
        if (job == null || job.getStatus() != JobStatus.PENDING) {
            cancelRequested.remove(jobId);
            return;
        }
        if (!claimStatus(job, JobStatus.RUNNING)) {
            log.info("Replication job {} was cancelled before it started", jobId);
            cancelRequested.remove(jobId);
            return;
        }

        Queue<String> completedRegions = new ConcurrentLinkedQueue<>();
        try {
            job.setStartedAt(Instant.now(clock));
            job.setProgress(10);
            replicationJobRepository.save(job);
            log.info("Replicating backup {} to {}", job.getBackupId(), job.getTargetRegions());

            String bucket = targetBucket(job.getSourceBucket());
            long timeoutMillis = properties.getCrossRegion().getCopyTimeout().toMillis();
            List<CompletableFuture<Void>> copies = new ArrayList<>();
            for (String region : job.getTargetRegions()) {
                copies.add(CompletableFuture
                        .runAsync(() -> {
                            replicateToRegion(job, region, bucket);
                            completedRegions.add(region);
                        }, regionExecutor)
                        .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS));
            }
            CompletableFuture.allOf(copies.toArray(new CompletableFuture[0])).join();

            job.setCompletedRegions(new ArrayList<>(completedRegions));
            if (cancelRequested.contains(jobId) || !claimStatus(job, JobStatus.COMPLETED)) {
                log.info("Replication job {} was cancelled while running", jobId);
                return;
            }
            job.setProgress(100);
            job.setTransferredBytes(job.getBackupSize() * job.getTargetRegions().size());
            job.setCompletedAt(Instant.now(clock));
            replicationJobRepository.save(job);
            log.info("Replication job {} completed in {}", jobId, FormatUtils.formatDuration(job.durationMillis()));
        } catch (Exception e) {
            job.setCompletedRegions(new ArrayList<>(completedRegions));
            if (cancelRequested.contains(jobId)) {
                log.info("Replication job {} was cancelled while running", jobId);
                return;
            }
            JobError error = errorClassifier.classify(e, AutomationException.CODE_REPLICATION_ERROR);
            log.error("Replication job {} failed [{}]: {}", jobId, error.getCode(), error.getMessage(), e);
            markFailed(job, error, completedRegions.size());
        } finally {
            cancelRequested.remove(jobId);
        }
    }

    /**
     * Moves the job to {@code next} unless another writer changed its stored status since this
     * copy was loaded.
     */
    private boolean claimStatus(ReplicationJob job, JobStatus next) {
        if (!job.getStatus().canTransitionTo(next)
                || replicationJobRepository.updateStatus(job.getId(), job.getStatus(), next) == 0) {
            return false;
        }
        job.transitionTo(next);
        return true;
    }

    private void markFailed(ReplicationJob job, JobError error, int completedRegionCount) {
        try {
            if (!claimStatus(job, JobStatus.FAILED)) {
                log.info("Replication job {} already finished elsewhere, not recording failure", job.getId());
                return;
            }
            job.setError(error);
            job.setTransferredBytes(job.getBackupSize() * completedRegionCount);
            job.setCompletedAt(Instant.now(clock));
            replicationJobRepository.save(job);
        } catch (RuntimeException e) {
            log.error("Could not record failure of replication job {}: {}", job.getId(), e.getMessage(), e);
        }
        notifyFailure(job, error);
    }

    private void replicateToRegion(ReplicationJob job, String region, String bucket) {
        String targetKey = ReplicationJob.targetKey(region, job.getBackupId());
        storageClient.ensureBucket(region, bucket);
        storageClient.copyObject(job.getSourceRegion(), job.getSourceBucket(), job.getArtifactKey(),
                region, bucket, targetKey);

        long replicaSize = storageClient.getObjectSize(region, bucket, targetKey);
        if (replicaSize != job.getBackupSize()) {
            throw AutomationException.integrity(AutomationException.CODE_SIZE_MISMATCH,
                    "Replica in " + region + " has " + replicaSize + " bytes, expected " + job.getBackupSize());
        }
        log.debug("Replicated {} to {}/{}", job.getArtifactKey(), region, targetKey);
    }

    private List<String> targetRegions(String sourceRegion) {
        return properties.getCrossRegion().getReplicationRegions().stream()
                .filter(region -> !region.equals(sourceRegion))
                .distinct()
                .toList();
    }

    private String targetBucket(String sourceBucket) {
        String configured = properties.getCrossRegion().getBucket();
        return configured != null && !configured.isBlank() ? configured : sourceBucket;
    }

    private void notifyFailure(ReplicationJob job, JobError error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", job.getId());
        data.put("backupId", job.getBackupId());
        data.put("targetRegions", job.getTargetRegions());
        data.put("completedRegions", job.getCompletedRegions());
        data.put("errorCode", error.getCode());
        data.put("error", error.getMessage());
        notificationService.notify(NotificationMessage.TYPE_REPLICATION_FAILURE, data);
    }
}
