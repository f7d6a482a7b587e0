package com.drautomation.api.service;

import com.drautomation.api.client.DatabaseClient;
import com.drautomation.api.client.ServiceControlClient;
import com.drautomation.api.config.AsyncConfig;
import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.event.DisasterRecoveryRequestedEvent;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.exception.ResourceNotFoundException;
import com.drautomation.api.model.dto.DisasterRecoveryRequest;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.entity.DisasterEvent;
import com.drautomation.api.model.entity.RecoveryExecution;
import com.drautomation.api.model.entity.RestoreJob;
import com.drautomation.api.model.entity.RestoreOptions;
import com.drautomation.api.model.entity.StepExecution;
import com.drautomation.api.model.enums.ErrorCategory;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.LogLevel;
import com.drautomation.api.model.enums.RestoreKind;
import com.drautomation.api.model.enums.Severity;
import com.drautomation.api.model.enums.StepStatus;
import com.drautomation.api.repository.BackupMetadataRepository;
import com.drautomation.api.repository.RecoveryExecutionRepository;
import com.drautomation.api.util.FormatUtils;
import com.drautomation.api.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the disaster-recovery plan: an ordered list of dependent steps, each with its own
 * timeout and retry budget.
 */
@Slf4j
@Service
public class DisasterRecoveryService {

    private static final int HEALTH_POLLS = 5;
    private static final List<JobStatus> ACTIVE = List.of(JobStatus.PENDING, JobStatus.RUNNING);

    private final RecoveryExecutionRepository executionRepository;
    private final BackupMetadataRepository backupMetadataRepository;
    private final BackupArtifactService artifactService;
    private final RestoreService restoreService;
    private final DatabaseClient databaseClient;
    private final ServiceControlClient serviceControlClient;
    private final NotificationService notificationService;
    private final IdGenerator idGenerator;
    private final AutomationProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Executor stepExecutor;

    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    public DisasterRecoveryService(RecoveryExecutionRepository executionRepository,
                                   BackupMetadataRepository backupMetadataRepository,
                                   BackupArtifactService artifactService,
                                   RestoreService restoreService,
                                   DatabaseClient databaseClient,
                                   ServiceControlClient serviceControlClient,
                                   NotificationService notificationService,
                                   IdGenerator idGenerator,
                                   AutomationProperties properties,
                                   ApplicationEventPublisher eventPublisher,
                                   Clock clock,
                                   @Qualifier(AsyncConfig.RECOVERY_STEPS) Executor stepExecutor) {
        this.executionRepository = executionRepository;
        this.backupMetadataRepository = backupMetadataRepository;
        this.artifactService = artifactService;
        this.restoreService = restoreService;
        this.databaseClient = databaseClient;
        this.serviceControlClient = serviceControlClient;
        this.notificationService = notificationService;
        this.idGenerator = idGenerator;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.stepExecutor = stepExecutor;
    }

    public boolean isEnabled() {
        return properties.getDisasterRecovery().isEnabled();
    }

    /**
     * Record a disaster and queue a recovery run for it. The run starts after the transaction commits.
     */
    @Transactional
    public RecoveryExecution triggerDisasterRecovery(DisasterRecoveryRequest request, boolean automatic) {
        if (!isEnabled()) {
            throw new AutomationException(AutomationException.CODE_DISABLED, ErrorCategory.VALIDATION,
                    "Disaster recovery is disabled");
        }
        Instant now = Instant.now(clock);
        AutomationProperties.DisasterRecovery config = properties.getDisasterRecovery();
        DisasterEvent disaster = DisasterEvent.builder()
                .disasterId(idGenerator.generate(IdGenerator.PREFIX_DISASTER))
                .type(request.getType())
                .severity(request.getSeverity() != null ? request.getSeverity() : Severity.CRITICAL)
                .description(request.getDescription())
                .affectedSystems(request.getAffectedSystems() != null
                        ? new ArrayList<>(request.getAffectedSystems()) : new ArrayList<>())
                .detectedAt(now)
                .automatic(automatic)
                .estimatedImpact("RTO " + config.getRtoMinutes() + " min, RPO " + config.getRpoMinutes() + " min")
                .build();

        List<StepExecution> steps = new ArrayList<>();
        for (AutomationProperties.RecoveryStep step : sortedSteps()) {
            steps.add(StepExecution.builder()
                    .stepId(step.getId())
                    .name(step.getName())
                    .type(step.getType())
                    .order(step.getOrder())
                    .critical(step.isCritical())
                    .status(StepStatus.PENDING)
                    .build());
        }

        RecoveryExecution execution = RecoveryExecution.builder()
                .id(idGenerator.generate(IdGenerator.PREFIX_RECOVERY))
                .disaster(disaster)
                .status(JobStatus.PENDING)
                .steps(steps)
                .build();
        execution.addLog(LogLevel.WARN, "Disaster recorded: " + request.getType() + " - " + request.getDescription(), now);
        execution = executionRepository.save(execution);

        eventPublisher.publishEvent(new DisasterRecoveryRequestedEvent(this, execution.getId()));
        log.warn("Disaster recovery {} triggered for {} ({}, automatic={})", execution.getId(),
                request.getType(), disaster.getSeverity(), automatic);
        return execution;
    }

    /**
     * Run the recovery steps of a pending run in order.
     */
    public void executeRecovery(String executionId) {
        RecoveryExecution execution = executionRepository.findById(executionId)
                .orElseThrow(() -> new ResourceNotFoundException("Recovery execution", executionId));
        if (execution.getStatus() != JobStatus.PENDING) {
            log.warn("Skipping recovery execution {} in status {}", executionId, execution.getStatus());
            cancelRequested.remove(executionId);
            return;
        }

        if (!claimStatus(execution, JobStatus.RUNNING)) {
            log.info("Recovery execution {} was cancelled before it started", executionId);
            cancelRequested.remove(executionId);
            return;
        }
        Instant startedAt = Instant.now(clock);
        execution.setStartedAt(startedAt);
        execution.addLog(LogLevel.INFO, "Recovery started", startedAt);
        executionRepository.save(execution);
        log.info("Starting recovery execution {}", executionId);

        List<AutomationProperties.RecoveryStep> plan = sortedSteps();
        String abortReason = null;
        int finished = 0;
        try {
            for (AutomationProperties.RecoveryStep step : plan) {
                checkCancelled(executionId);
                List<String> unmet = unmetDependencies(execution, step);
                if (!unmet.isEmpty()) {
                    skipStep(execution, step, "Dependencies not completed: " + unmet);
                    if (step.isCritical()) {
                        abortReason = "Critical step " + step.getId() + " skipped: dependencies " + unmet + " not completed";
                        break;
                    }
                } else {
                    boolean completed = runStepWithRetries(execution, step);
                    if (!completed && step.isCritical()) {
                        abortReason = "Critical step " + step.getId() + " failed: "
                                + execution.findStep(step.getId()).getError();
                        break;
                    }
                }
                checkCancelled(executionId);
                finished++;
                execution.setProgress(FormatUtils.percentage(finished, plan.size()));
                executionRepository.save(execution);
            }
        } catch (CancellationException e) {
            log.info("Recovery execution {} cancelled", executionId);
            markCancelled(execution);
            cancelRequested.remove(executionId);
            return;
        }
        cancelRequested.remove(executionId);

        long failedSteps = execution.getSteps().stream().filter(s -> s.getStatus() == StepStatus.FAILED).count();
        boolean succeeded = abortReason == null && failedSteps == 0;
        if (!claimStatus(execution, succeeded ? JobStatus.COMPLETED : JobStatus.FAILED)) {
            log.info("Recovery execution {} was cancelled before it finished", executionId);
            return;
        }
        Instant completedAt = Instant.now(clock);
        execution.setCompletedAt(completedAt);
        execution.setCurrentStep(null);
        if (succeeded) {
            execution.setProgress(100);
            execution.addLog(LogLevel.INFO, "Recovery completed in "
                    + FormatUtils.formatDuration(Duration.between(startedAt, completedAt).toMillis()), completedAt);
            log.info("Recovery execution {} completed", executionId);
        } else {
            String reason = abortReason != null ? abortReason : failedSteps + " non-critical steps failed";
            execution.setErrorMessage(reason);
            execution.addLog(LogLevel.ERROR, "Recovery failed: " + reason, completedAt);
            log.error("Recovery execution {} failed: {}", executionId, reason);
        }
        executionRepository.save(execution);
        notifyOutcome(execution);
    }

    @Transactional
    public RecoveryExecution cancel(String executionId) {
        RecoveryExecution execution = get(executionId);
        if (!execution.getStatus().isActive()) {
            throw new IllegalStateException("Recovery execution " + executionId + " is already " + execution.getStatus());
        }
        cancelRequested.add(executionId);
        if (!claimStatus(execution, JobStatus.CANCELLED)) {
            cancelRequested.remove(executionId);
            throw new IllegalStateException("Recovery execution " + executionId + " finished while it was being cancelled");
        }
        Instant now = Instant.now(clock);
        execution.setCompletedAt(now);
        execution.addLog(LogLevel.WARN, "Recovery cancelled", now);
        log.info("Cancellation requested for recovery execution {}", executionId);
        return executionRepository.save(execution);
    }

    @Transactional(readOnly = true)
    public RecoveryExecution get(String executionId) {
        return executionRepository.findById(executionId)
                .orElseThrow(() -> new ResourceNotFoundException("Recovery execution", executionId));
    }

    @Transactional(readOnly = true)
    public List<RecoveryExecution> list() {
        return executionRepository.findAllByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public long countActive() {
        return executionRepository.countByStatusIn(ACTIVE);
    }

    private void checkCancelled(String executionId) {
        if (cancelRequested.contains(executionId)) {
            throw new CancellationException("Recovery execution " + executionId + " was cancelled");
        }
    }

    private List<AutomationProperties.RecoveryStep> sortedSteps() {
        List<AutomationProperties.RecoveryStep> steps = new ArrayList<>(properties.getDisasterRecovery().getSteps());
        steps.sort(Comparator.comparingInt(AutomationProperties.RecoveryStep::getOrder));
        return steps;
    }

    private List<String> unmetDependencies(RecoveryExecution execution, AutomationProperties.RecoveryStep step) {
        List<String> unmet = new ArrayList<>();
        for (String dependency : step.getDependencies()) {
            StepExecution record = execution.findStep(dependency);
            if (record == null || record.getStatus() != StepStatus.COMPLETED) {
                unmet.add(dependency);
            }
        }
        return unmet;
    }

    private void skipStep(RecoveryExecution execution, AutomationProperties.RecoveryStep step, String reason) {
        Instant now = Instant.now(clock);
        execution.replaceStep(execution.findStep(step.getId()).toBuilder()
                .status(StepStatus.SKIPPED)
                .error(reason)
                .completedAt(now)
                .build());
        execution.addLog(LogLevel.WARN, "Step " + step.getId() + " skipped: " + reason, now);
        log.warn("Recovery {}: step {} skipped ({})", execution.getId(), step.getId(), reason);
    }

    private boolean runStepWithRetries(RecoveryExecution execution, AutomationProperties.RecoveryStep step) {
        int maxAttempts = 1 + Math.max(step.getRetries(), 0);
        Instant stepStart = Instant.now(clock);
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            execution.setCurrentStep(step.getId());
            execution.replaceStep(execution.findStep(step.getId()).toBuilder()
                    .status(StepStatus.RUNNING)
                    .attempts(attempt)
                    .startedAt(stepStart)
                    .build());
            execution.addLog(LogLevel.INFO, "Running step " + step.getId() + " (attempt " + attempt + "/" + maxAttempts + ")",
                    Instant.now(clock));
            executionRepository.save(execution);

            try {
                runWithTimeout(execution, step);
                Instant now = Instant.now(clock);
                execution.replaceStep(execution.findStep(step.getId()).toBuilder()
                        .status(StepStatus.COMPLETED)
                        .completedAt(now)
                        .durationMs(Duration.between(stepStart, now).toMillis())
                        .error(null)
                        .build());
                execution.addLog(LogLevel.INFO, "Step " + step.getId() + " completed", now);
                log.info("Recovery {}: step {} completed on attempt {}", execution.getId(), step.getId(), attempt);
                return true;
            } catch (CancellationException e) {
                throw e;
            } catch (AttemptStillRunningException e) {
                lastError = e.getMessage();
                log.error("Recovery {}: step {} attempt {} did not stop after timeout, not retrying",
                        execution.getId(), step.getId(), attempt);
                execution.addLog(LogLevel.ERROR, lastError, Instant.now(clock));
                break;
            } catch (Exception e) {
                lastError = e.getMessage();
                log.warn("Recovery {}: step {} attempt {}/{} failed: {}", execution.getId(), step.getId(),
                        attempt, maxAttempts, lastError);
                execution.addLog(LogLevel.WARN, "Step " + step.getId() + " attempt " + attempt + " failed: " + lastError,
                        Instant.now(clock));
                if (attempt < maxAttempts) {
                    backoff(attempt);
                }
            }
        }

        Instant now = Instant.now(clock);
        execution.replaceStep(execution.findStep(step.getId()).toBuilder()
                .status(StepStatus.FAILED)
                .completedAt(now)
                .durationMs(Duration.between(stepStart, now).toMillis())
                .error(lastError)
                .build());
        execution.addLog(LogLevel.ERROR, "Step " + step.getId() + " failed after "
                + execution.findStep(step.getId()).getAttempts() + " attempts", now);
        return false;
    }

    /**
     * Runs one attempt of a step on the step executor. A timed-out attempt is interrupted and
     * awaited, so a retry never overlaps it. Step results are only applied to the execution
     * when the attempt ends within its timeout.
     */
    private void runWithTimeout(RecoveryExecution execution, AutomationProperties.RecoveryStep step) throws Exception {
        StepOutcome outcome = new StepOutcome();
        FutureTask<Void> attempt = new FutureTask<>(() -> {
            runStep(execution, step, outcome);
            return null;
        });
        CountDownLatch stopped = new CountDownLatch(1);
        stepExecutor.execute(() -> {
            try {
                attempt.run();
            } finally {
                stopped.countDown();
            }
        });

        Duration timeout = step.getTimeout() != null ? step.getTimeout() : Duration.ofMinutes(10);
        try {
            attempt.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            outcome.applyTo(execution);
        } catch (TimeoutException e) {
            attempt.cancel(true);
            String message = "Step " + step.getId() + " exceeded timeout of "
                    + FormatUtils.formatDuration(timeout.toMillis());
            if (!awaitStopped(stopped)) {
                throw new AttemptStillRunningException(message + " and did not stop");
            }
            throw AutomationException.timeout(message);
        } catch (ExecutionException e) {
            outcome.applyTo(execution);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    private boolean awaitStopped(CountDownLatch stopped) {
        try {
            return stopped.await(properties.getDisasterRecovery().getStepCancelGrace().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for a timed-out step");
        }
    }

    private void runStep(RecoveryExecution execution, AutomationProperties.RecoveryStep step, StepOutcome outcome) {
        switch (step.getType()) {
            case VALIDATION -> validate(execution, outcome);
            case DATABASE -> restoreDatabase(execution, outcome);
            case FILES -> restoreFiles(execution);
            case SERVICE -> restartServices(execution);
        }
    }

    private void validate(RecoveryExecution execution, StepOutcome outcome) {
        BackupMetadata backup = recoveryBackup(execution);
        artifactService.load(backup);
        outcome.backupId = backup.getId();

        if (execution.getRestoreJobId() == null) {
            return;
        }
        RestoreJob restore = restoreService.getRestoreJob(execution.getRestoreJobId());
        if (restore.getStatus() != JobStatus.COMPLETED) {
            throw new AutomationException(AutomationException.CODE_RECOVERY_STEP_FAILED, ErrorCategory.INTEGRITY,
                    "Restore " + restore.getId() + " did not complete");
        }
        if (restore.getVerification() != null && !restore.getVerification().isPassed()) {
            throw new AutomationException(AutomationException.CODE_VERIFICATION_FAILED, ErrorCategory.INTEGRITY,
                    "Restore " + restore.getId() + " failed verification");
        }
        String target = restore.getOptions().getTargetDatabase() != null
                ? restore.getOptions().getTargetDatabase()
                : properties.getRestore().getTargetDatabase();
        if (!databaseClient.testConnection(target)) {
            throw new AutomationException(AutomationException.CODE_NETWORK_ERROR, ErrorCategory.NETWORK,
                    "Restored database " + target + " is not reachable");
        }
    }

    private void restoreDatabase(RecoveryExecution execution, StepOutcome outcome) {
        RestoreOptions options = RestoreOptions.builder()
                .kind(RestoreKind.COMPLETE)
                .overwriteExisting(true)
                .restoreFiles(false)
                .restoreConfiguration(false)
                .build();
        RestoreJob restore = restoreService.runRestore(recoveryBackup(execution).getId(), options, execution.getId());
        outcome.restoreJobId = restore.getId();
        requireCompleted(restore);
    }

    private void restoreFiles(RecoveryExecution execution) {
        RestoreOptions options = RestoreOptions.builder()
                .kind(RestoreKind.COMPLETE)
                .restoreSchema(false)
                .restoreData(false)
                .restoreFiles(true)
                .restoreConfiguration(false)
                .testConnections(false)
                .build();
        requireCompleted(restoreService.runRestore(recoveryBackup(execution).getId(), options, execution.getId()));
    }

    private void restartServices(RecoveryExecution execution) {
        for (String service : execution.getDisaster().getAffectedSystems()) {
            if (!serviceControlClient.isManaged(service)) {
                log.debug("Recovery {}: {} is not a managed service", execution.getId(), service);
                continue;
            }
            serviceControlClient.restartService(service);
            if (!awaitHealthy(service)) {
                throw new AutomationException(AutomationException.CODE_RECOVERY_STEP_FAILED, ErrorCategory.SERVER,
                        "Service " + service + " did not become healthy after restart");
            }
            log.info("Recovery {}: service {} restarted and healthy", execution.getId(), service);
        }
    }

    private boolean awaitHealthy(String service) {
        for (int poll = 1; poll <= HEALTH_POLLS; poll++) {
            if (serviceControlClient.isHealthy(service)) {
                return true;
            }
            backoff(1);
        }
        return false;
    }

    private BackupMetadata recoveryBackup(RecoveryExecution execution) {
        if (execution.getBackupId() != null) {
            return backupMetadataRepository.findById(execution.getBackupId())
                    .orElseThrow(() -> new ResourceNotFoundException("Backup", execution.getBackupId()));
        }
        return backupMetadataRepository.findFirstByOrderByCompletedAtDesc()
                .orElseThrow(() -> AutomationException.validation(AutomationException.CODE_PREREQUISITE_FAILED,
                        "No backup available for recovery"));
    }

    private void requireCompleted(RestoreJob restore) {
        if (restore.getStatus() != JobStatus.COMPLETED) {
            String reason = restore.getError() != null ? restore.getError().getMessage() : String.valueOf(restore.getStatus());
            throw new AutomationException(AutomationException.CODE_RECOVERY_STEP_FAILED, ErrorCategory.SERVER,
                    "Restore " + restore.getId() + " failed: " + reason);
        }
    }

    private void backoff(int attempt) {
        long millis = properties.getDisasterRecovery().getRetryBackoff().toMillis() * attempt;
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during retry backoff");
        }
    }

    private boolean claimStatus(RecoveryExecution execution, JobStatus next) {
        if (!execution.getStatus().canTransitionTo(next)
                || executionRepository.updateStatus(execution.getId(), execution.getStatus(), next) == 0) {
            return false;
        }
        execution.transitionTo(next);
        return true;
    }

    private void markCancelled(RecoveryExecution execution) {
        if (!claimStatus(execution, JobStatus.CANCELLED)) {
            return;
        }
        Instant now = Instant.now(clock);
        execution.setCompletedAt(now);
        execution.setCurrentStep(null);
        execution.addLog(LogLevel.WARN, "Recovery cancelled", now);
        executionRepository.save(execution);
    }

    private void notifyOutcome(RecoveryExecution execution) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("executionId", execution.getId());
        data.put("disasterType", execution.getDisaster().getType().name());
        data.put("status", execution.getStatus().name());
        data.put("steps", execution.getSteps().stream()
                .map(s -> s.getStepId() + "=" + s.getStatus())
                .toList());
        if (execution.getErrorMessage() != null) {
            data.put("error", execution.getErrorMessage());
        }
        notificationService.notify(NotificationMessage.TYPE_DISASTER_RECOVERY, data);
    }

    /**
     * Values a step attempt produced for the execution.
     */
    private static final class StepOutcome {
        private volatile String backupId;
        private volatile String restoreJobId;

        void applyTo(RecoveryExecution execution) {
            if (backupId != null) {
                execution.setBackupId(backupId);
            }
            if (restoreJobId != null) {
                execution.setRestoreJobId(restoreJobId);
            }
        }
    }

    private static final class AttemptStillRunningException extends Exception {
        AttemptStillRunningException(String message) {
            super(message);
        }
    }
}
