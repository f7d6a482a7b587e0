package com.drautomation.api.service;

import com.drautomation.api.client.ServiceControlClient;
import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.event.DisasterRecoveryRequestedEvent;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.model.dto.DisasterRecoveryRequest;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.entity.RecoveryExecution;
import com.drautomation.api.model.entity.RestoreJob;
import com.drautomation.api.model.entity.RestoreOptions;
import com.drautomation.api.model.entity.StepExecution;
import com.drautomation.api.model.enums.DisasterType;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.Severity;
import com.drautomation.api.model.enums.StepStatus;
import com.drautomation.api.repository.BackupMetadataRepository;
import com.drautomation.api.repository.RecoveryExecutionRepository;
import com.drautomation.api.security.BackupEncryptor;
import com.drautomation.api.support.BackupFixtures;
import com.drautomation.api.support.InMemoryDatabaseClient;
import com.drautomation.api.support.InMemoryStorageClient;
import com.drautomation.api.support.MutableClock;
import com.drautomation.api.util.IdGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DisasterRecoveryService")
@ExtendWith(MockitoExtension.class)
class DisasterRecoveryServiceTest {

    @Mock private RecoveryExecutionRepository executionRepository;
    @Mock private BackupMetadataRepository backupMetadataRepository;
    @Mock private RestoreService restoreService;
    @Mock private ServiceControlClient serviceControlClient;
    @Mock private NotificationService notificationService;
    @Mock private ApplicationEventPublisher eventPublisher;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-05T03:00:00Z"));
    private final InMemoryStorageClient storageClient = new InMemoryStorageClient();
    private final InMemoryDatabaseClient databaseClient = new InMemoryDatabaseClient();
    private final Map<String, RecoveryExecution> executions = new HashMap<>();
    private final Map<String, JobStatus> storedStatus = new ConcurrentHashMap<>();

    private AutomationProperties properties;
    private BackupArtifactService artifactService;
    private BackupMetadata backup;
    private DisasterRecoveryService disasterRecoveryService;

    @BeforeEach
    void setUp() {
        properties = new AutomationProperties();
        properties.getDisasterRecovery().setRetryBackoff(Duration.ZERO);
        artifactService = BackupFixtures.artifactService(storageClient, new BackupEncryptor(properties));
        backup = BackupFixtures.store(artifactService, storageClient, BackupFixtures.samplePayload("backup_1"));

        lenient().when(backupMetadataRepository.findFirstByOrderByCompletedAtDesc()).thenReturn(Optional.of(backup));
        lenient().when(backupMetadataRepository.findById("backup_1")).thenReturn(Optional.of(backup));
        lenient().when(executionRepository.save(any(RecoveryExecution.class))).thenAnswer(inv -> {
            RecoveryExecution execution = inv.getArgument(0);
            executions.put(execution.getId(), execution);
            storedStatus.putIfAbsent(execution.getId(), execution.getStatus());
            return execution;
        });
        lenient().when(executionRepository.updateStatus(anyString(), any(JobStatus.class), any(JobStatus.class)))
                .thenAnswer(inv -> storedStatus.replace(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2))
                        ? 1 : 0);
        lenient().when(executionRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(executions.get(inv.<String>getArgument(0))));

        RestoreJob restored = restoreJob("restore_db", JobStatus.COMPLETED);
        lenient().when(restoreService.runRestore(eq("backup_1"), any(RestoreOptions.class), anyString()))
                .thenReturn(restored);
        lenient().when(restoreService.getRestoreJob("restore_db")).thenReturn(restored);
        lenient().when(serviceControlClient.isManaged("api")).thenReturn(true);
        lenient().when(serviceControlClient.isHealthy("api")).thenReturn(true);

        disasterRecoveryService = serviceWith(Runnable::run);
    }

    private DisasterRecoveryService serviceWith(Executor stepExecutor) {
        return new DisasterRecoveryService(executionRepository, backupMetadataRepository,
                artifactService, restoreService, databaseClient, serviceControlClient, notificationService,
                new IdGenerator(clock), properties, eventPublisher, clock, stepExecutor);
    }

    private AutomationProperties.RecoveryStep planStep(String stepId) {
        return properties.getDisasterRecovery().getSteps().stream()
                .filter(s -> s.getId().equals(stepId))
                .findFirst()
                .orElseThrow();
    }

    private static RestoreJob restoreJob(String id, JobStatus status) {
        return RestoreJob.builder()
                .id(id)
                .backupId("backup_1")
                .status(status)
                .options(RestoreOptions.builder().targetDatabase("restored").build())
                .build();
    }

    private static DisasterRecoveryRequest request() {
        return DisasterRecoveryRequest.builder()
                .type(DisasterType.DATABASE_FAILURE)
                .description("primary database lost")
                .affectedSystems(List.of("api", "reporting"))
                .build();
    }

    private RecoveryExecution run() {
        RecoveryExecution execution = disasterRecoveryService.triggerDisasterRecovery(request(), false);
        disasterRecoveryService.executeRecovery(execution.getId());
        return executions.get(execution.getId());
    }

    private static StepExecution step(RecoveryExecution execution, String stepId) {
        return execution.findStep(stepId);
    }

    @Nested
    @DisplayName("triggerDisasterRecovery")
    class Trigger {

        @Test
        @DisplayName("should record the disaster with the plan in order and queue the run")
        void shouldRecordDisaster() {
            RecoveryExecution execution = disasterRecoveryService.triggerDisasterRecovery(request(), true);

            assertThat(execution.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(execution.getDisaster().getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(execution.getDisaster().isAutomatic()).isTrue();
            assertThat(execution.getDisaster().getEstimatedImpact()).isEqualTo("RTO 60 min, RPO 15 min");
            assertThat(execution.getSteps()).extracting(StepExecution::getStepId).containsExactly(
                    "validate_backup", "restore_database", "restore_files", "restart_services", "validate_recovery");
            assertThat(execution.getSteps()).allMatch(s -> s.getStatus() == StepStatus.PENDING);
            verify(eventPublisher).publishEvent(any(DisasterRecoveryRequestedEvent.class));
        }

        @Test
        @DisplayName("should reject requests while disabled")
        void shouldRejectWhenDisabled() {
            properties.getDisasterRecovery().setEnabled(false);

            assertThatThrownBy(() -> disasterRecoveryService.triggerDisasterRecovery(request(), false))
                    .isInstanceOf(AutomationException.class)
                    .satisfies(e -> assertThat(((AutomationException) e).getCode())
                            .isEqualTo(AutomationException.CODE_DISABLED));
        }
    }

    @Nested
    @DisplayName("executeRecovery")
    class ExecuteRecovery {

        @Test
        @DisplayName("should complete every step and restart managed services")
        void shouldComplete() {
            RecoveryExecution execution = run();

            assertThat(execution.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(execution.getProgress()).isEqualTo(100);
            assertThat(execution.getSteps()).allMatch(s -> s.getStatus() == StepStatus.COMPLETED);
            assertThat(execution.getBackupId()).isEqualTo("backup_1");
            assertThat(execution.getRestoreJobId()).isEqualTo("restore_db");
            assertThat(execution.getCurrentStep()).isNull();
            verify(serviceControlClient).restartService("api");
            verify(serviceControlClient, never()).restartService("reporting");
            verify(notificationService).notify(eq(NotificationMessage.TYPE_DISASTER_RECOVERY), anyMap());
        }

        @Test
        @DisplayName("should abort when a critical step exhausts its retries")
        void shouldAbortOnCriticalFailure() {
            storageClient.overwrite(BackupFixtures.REGION, BackupFixtures.BUCKET, backup.getStorageKey(), new byte[]{9});

            RecoveryExecution execution = run();

            assertThat(execution.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(execution.getErrorMessage()).startsWith("Critical step validate_backup failed");
            assertThat(step(execution, "validate_backup").getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(step(execution, "validate_backup").getAttempts()).isEqualTo(3);
            assertThat(step(execution, "restore_database").getStatus()).isEqualTo(StepStatus.PENDING);
            verify(restoreService, never()).runRestore(anyString(), any(RestoreOptions.class), anyString());
        }

        @Test
        @DisplayName("should skip dependents of a failed step and abort on a skipped critical step")
        void shouldSkipDependents() {
            RestoreJob failedFiles = restoreJob("restore_files", JobStatus.FAILED);
            lenient().when(restoreService.runRestore(eq("backup_1"),
                            argThat(o -> o != null && o.isRestoreFiles() && !o.isRestoreData()), anyString()))
                    .thenReturn(failedFiles);

            RecoveryExecution execution = run();

            assertThat(step(execution, "restore_database").getStatus()).isEqualTo(StepStatus.COMPLETED);
            assertThat(step(execution, "restore_files").getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(step(execution, "restore_files").getAttempts()).isEqualTo(3);
            assertThat(step(execution, "restart_services").getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(step(execution, "restart_services").getError()).contains("restore_files");
            assertThat(execution.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(execution.getErrorMessage()).startsWith("Critical step restart_services skipped");
            verify(serviceControlClient, never()).restartService(anyString());
        }

        @Test
        @DisplayName("should retry a failing step and record the attempts")
        void shouldRetry() {
            doThrow(new IllegalStateException("connection refused"))
                    .doNothing()
                    .when(serviceControlClient).restartService("api");

            RecoveryExecution execution = run();

            assertThat(execution.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(step(execution, "restart_services").getAttempts()).isEqualTo(2);
            assertThat(step(execution, "restart_services").getError()).isNull();
            verify(serviceControlClient, times(2)).restartService("api");
        }

        @Test
        @DisplayName("should fail a service step when the service never becomes healthy")
        void shouldFailWhenServiceUnhealthy() {
            lenient().when(serviceControlClient.isHealthy("api")).thenReturn(false);
            doNothing().when(serviceControlClient).restartService("api");

            RecoveryExecution execution = run();

            assertThat(step(execution, "restart_services").getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(step(execution, "restart_services").getError()).contains("did not become healthy");
            assertThat(step(execution, "validate_recovery").getStatus()).isEqualTo(StepStatus.PENDING);
            assertThat(execution.getStatus()).isEqualTo(JobStatus.FAILED);
        }

        @Test
        @DisplayName("should fail validation when the restored database is unreachable")
        void shouldFailValidationWhenUnreachable() {
            databaseClient.setUnreachable("restored");

            RecoveryExecution execution = run();

            assertThat(step(execution, "validate_backup").getStatus()).isEqualTo(StepStatus.COMPLETED);
            assertThat(step(execution, "validate_recovery").getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(step(execution, "validate_recovery").getError()).contains("restored");
            assertThat(execution.getStatus()).isEqualTo(JobStatus.FAILED);
        }
    }

    @Nested
    @DisplayName("step timeouts")
    class StepTimeouts {

        private final ExecutorService stepPool = Executors.newCachedThreadPool();

        @AfterEach
        void tearDown() throws InterruptedException {
            stepPool.shutdownNow();
            stepPool.awaitTermination(5, TimeUnit.SECONDS);
        }

        @Test
        @DisplayName("should interrupt a timed-out attempt before starting the retry")
        void shouldNotOverlapAttempts() {
            planStep("restore_database").setTimeout(Duration.ofMillis(200));
            planStep("restore_database").setRetries(1);
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxRunning = new AtomicInteger();
            AtomicInteger interrupted = new AtomicInteger();
            when(restoreService.runRestore(eq("backup_1"), argThat(o -> o != null && o.isRestoreData()), anyString()))
                    .thenAnswer(inv -> {
                        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                        try {
                            Thread.sleep(600);
                            return restoreJob("restore_db", JobStatus.COMPLETED);
                        } catch (InterruptedException e) {
                            interrupted.incrementAndGet();
                            throw new IllegalStateException("restore interrupted");
                        } finally {
                            running.decrementAndGet();
                        }
                    });
            disasterRecoveryService = serviceWith(stepPool);

            RecoveryExecution execution = run();

            assertThat(maxRunning.get()).isEqualTo(1);
            assertThat(interrupted.get()).isEqualTo(2);
            assertThat(step(execution, "restore_database").getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(step(execution, "restore_database").getAttempts()).isEqualTo(2);
            assertThat(step(execution, "restore_database").getError()).contains("exceeded timeout");
            assertThat(execution.getRestoreJobId()).isNull();
            assertThat(execution.getStatus()).isEqualTo(JobStatus.FAILED);
        }

        @Test
        @DisplayName("should fail without retrying when a timed-out attempt ignores the interrupt")
        void shouldNotRetryStuckAttempt() throws InterruptedException {
            properties.getDisasterRecovery().setStepCancelGrace(Duration.ofMillis(100));
            planStep("restore_database").setTimeout(Duration.ofMillis(100));
            planStep("restore_database").setRetries(2);
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger calls = new AtomicInteger();
            when(restoreService.runRestore(eq("backup_1"), argThat(o -> o != null && o.isRestoreData()), anyString()))
                    .thenAnswer(inv -> {
                        calls.incrementAndGet();
                        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                        while (release.getCount() > 0 && System.nanoTime() < deadline) {
                            Thread.onSpinWait();
                        }
                        return restoreJob("restore_db", JobStatus.COMPLETED);
                    });
            disasterRecoveryService = serviceWith(stepPool);

            RecoveryExecution execution = run();
            release.countDown();
            stepPool.shutdown();
            assertThat(stepPool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

            assertThat(calls.get()).isEqualTo(1);
            assertThat(step(execution, "restore_database").getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(step(execution, "restore_database").getAttempts()).isEqualTo(1);
            assertThat(step(execution, "restore_database").getError()).contains("did not stop");
            assertThat(execution.getRestoreJobId()).isNull();
            assertThat(execution.getStatus()).isEqualTo(JobStatus.FAILED);
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("should cancel a pending run before any step executes")
        void shouldCancelPending() {
            RecoveryExecution execution = disasterRecoveryService.triggerDisasterRecovery(request(), false);

            disasterRecoveryService.cancel(execution.getId());
            disasterRecoveryService.executeRecovery(execution.getId());

            RecoveryExecution cancelled = executions.get(execution.getId());
            assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
            assertThat(cancelled.getSteps()).allMatch(s -> s.getStatus() == StepStatus.PENDING);
            verify(restoreService, never()).runRestore(anyString(), any(RestoreOptions.class), anyString());
        }

        @Test
        @DisplayName("should refuse to cancel a finished run")
        void shouldRefuseFinished() {
            RecoveryExecution execution = run();

            assertThatThrownBy(() -> disasterRecoveryService.cancel(execution.getId()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("COMPLETED");
        }

        @Test
        @DisplayName("should keep a cancel stored while a step was running")
        void shouldKeepCancelDuringStep() {
            RecoveryExecution execution = disasterRecoveryService.triggerDisasterRecovery(request(), false);
            RestoreJob restored = restoreJob("restore_db", JobStatus.COMPLETED);
            when(restoreService.runRestore(eq("backup_1"), any(RestoreOptions.class), anyString())).thenAnswer(inv -> {
                // Cancelled through another instance, so only the stored row knows
                storedStatus.put(execution.getId(), JobStatus.CANCELLED);
                return restored;
            });

            disasterRecoveryService.executeRecovery(execution.getId());

            assertThat(storedStatus.get(execution.getId())).isEqualTo(JobStatus.CANCELLED);
            assertThat(executions.get(execution.getId()).getStatus()).isNotEqualTo(JobStatus.COMPLETED);
            verify(notificationService, never()).notify(eq(NotificationMessage.TYPE_DISASTER_RECOVERY), anyMap());
        }
    }
}
