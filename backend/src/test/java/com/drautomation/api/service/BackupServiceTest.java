package com.drautomation.api.service;

import com.drautomation.api.client.ConfigurationSnapshotClient;
import com.drautomation.api.client.FileStoreClient;
import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.event.BackupCompletedEvent;
import com.drautomation.api.event.BackupRequestedEvent;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.exception.ErrorClassifier;
import com.drautomation.api.model.dto.BackupOptions;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.entity.BackupJob;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.RetentionTier;
import com.drautomation.api.model.payload.BackupPayload;
import com.drautomation.api.repository.BackupJobRepository;
import com.drautomation.api.repository.BackupMetadataRepository;
import com.drautomation.api.repository.BackupScheduleRepository;
import com.drautomation.api.security.BackupEncryptor;
import com.drautomation.api.support.InMemoryDatabaseClient;
import com.drautomation.api.support.InMemoryStorageClient;
import com.drautomation.api.support.MutableClock;
import com.drautomation.api.util.Checksums;
import com.drautomation.api.util.IdGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.drautomation.api.support.InMemoryDatabaseClient.definition;
import static com.drautomation.api.support.InMemoryDatabaseClient.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("BackupService")
@ExtendWith(MockitoExtension.class)
class BackupServiceTest {

    private static final String BUCKET = "dr-automation-backups";
    private static final String REGION = "us-east-1";

    @Mock private BackupJobRepository backupJobRepository;
    @Mock private BackupMetadataRepository backupMetadataRepository;
    @Mock private BackupScheduleRepository backupScheduleRepository;
    @Mock private FileStoreClient fileStoreClient;
    @Mock private ConfigurationSnapshotClient configurationSnapshotClient;
    @Mock private RetentionService retentionService;
    @Mock private NotificationService notificationService;
    @Mock private ApplicationEventPublisher eventPublisher;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
    private final InMemoryStorageClient storageClient = new InMemoryStorageClient();
    private final InMemoryDatabaseClient databaseClient = new InMemoryDatabaseClient();

    private AutomationProperties properties;
    private BackupEncryptor encryptor;
    private BackupArtifactService artifactService;
    private BackupService backupService;

    @BeforeEach
    void setUp() {
        properties = new AutomationProperties();
        properties.getBackup().getEncryption().setEnabled(false);
        properties.getBackup().getEncryption().setKey(Base64.getEncoder().encodeToString(new byte[32]));
        encryptor = new BackupEncryptor(properties);
        encryptor.init();
        artifactService = new BackupArtifactService(storageClient, encryptor, new ObjectMapper().findAndRegisterModules());

        databaseClient.addTable("public", definition("users", "id", "email"), List.of(
                row("id", "1", "email", "a@example.com"),
                row("id", "2", "email", "b@example.com")));

        lenient().when(backupJobRepository.save(any(BackupJob.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(backupMetadataRepository.save(any(BackupMetadata.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(backupJobRepository.updateStatus(anyString(), any(JobStatus.class), any(JobStatus.class)))
                .thenReturn(1);

        backupService = new BackupService(backupJobRepository, backupMetadataRepository, backupScheduleRepository,
                databaseClient, fileStoreClient, configurationSnapshotClient, storageClient, artifactService,
                encryptor, retentionService, notificationService, new ErrorClassifier(clock),
                new IdGenerator(clock), properties, eventPublisher, clock);
    }

    private BackupJob createAndStub(BackupKind kind, BackupOptions options) {
        BackupJob job = backupService.createBackup(kind, options);
        when(backupJobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        return job;
    }

    private BackupMetadata savedMetadata() {
        ArgumentCaptor<BackupMetadata> captor = ArgumentCaptor.forClass(BackupMetadata.class);
        verify(backupMetadataRepository).save(captor.capture());
        return captor.getValue();
    }

    private BackupCompletedEvent completedEvent() {
        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
        return captor.getAllValues().stream()
                .filter(e -> e instanceof BackupCompletedEvent)
                .map(e -> (BackupCompletedEvent) e)
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("createBackup")
    class CreateBackup {

        @Test
        @DisplayName("should save a pending job and publish a request event")
        void shouldSavePendingJob() {
            BackupJob job = backupService.createBackup(BackupKind.FULL, null);

            assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(job.getId()).startsWith("job_");
            assertThat(job.getRetentionTier()).isEqualTo(RetentionTier.MANUAL);
            assertThat(job.getStorageLocation().getBucket()).isEqualTo(BUCKET);
            verify(eventPublisher).publishEvent(any(BackupRequestedEvent.class));
        }

        @Test
        @DisplayName("should reject requests while the engine is disabled")
        void shouldRejectWhenDisabled() {
            properties.getBackup().setEnabled(false);

            assertThatThrownBy(() -> backupService.createBackup(BackupKind.FULL, null))
                    .isInstanceOf(AutomationException.class)
                    .hasFieldOrPropertyWithValue("code", AutomationException.CODE_DISABLED);
        }

        @Test
        @DisplayName("should require a backup kind")
        void shouldRequireKind() {
            assertThatThrownBy(() -> backupService.createBackup(null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("executeBackup")
    class ExecuteBackup {

        @Test
        @DisplayName("should complete a full backup and record exactly one catalog entry")
        void shouldCompleteFullBackup() {
            when(fileStoreClient.collectFiles()).thenReturn(List.of());
            when(configurationSnapshotClient.captureSnapshot()).thenReturn(Map.of("server.port", "8080"));
            BackupJob job = createAndStub(BackupKind.FULL, null);

            backupService.executeBackup(job.getId());

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.getProgress()).isEqualTo(100);
            BackupMetadata metadata = savedMetadata();
            assertThat(metadata.getId()).isEqualTo(job.getBackupId());
            assertThat(metadata.getSourceJobId()).isEqualTo(job.getId());
            assertThat(metadata.getStorageKey()).isEqualTo("backups/" + metadata.getId());

            byte[] stored = storageClient.getObject(REGION, BUCKET, metadata.getStorageKey());
            assertThat(stored).hasSize((int) metadata.getSizeBytes());
            assertThat(Checksums.sha256(stored)).isEqualTo(metadata.getChecksum());

            BackupCompletedEvent event = completedEvent();
            assertThat(event.isSuccessful()).isTrue();
            assertThat(event.getBackupId()).isEqualTo(metadata.getId());
            verify(retentionService).applyRetention(any());
            verify(notificationService).notify(eq(NotificationMessage.TYPE_BACKUP_SUCCESS), anyMap());
        }

        @Test
        @DisplayName("should store an encrypted artifact that loads back to the captured rows")
        void shouldEncryptArtifact() {
            BackupOptions options = new BackupOptions();
            options.setEncrypt(true);
            BackupJob job = createAndStub(BackupKind.DATA, options);

            backupService.executeBackup(job.getId());

            BackupMetadata metadata = savedMetadata();
            assertThat(metadata.getEncryption().isEnabled()).isTrue();
            BackupPayload payload = artifactService.load(metadata).getPayload();
            assertThat(payload.findTableData("users").getRows()).hasSize(2);
            assertThat(payload.findTableDefinition("users")).isNotNull();
        }

        @Test
        @DisplayName("should capture everything for an incremental backup without a base")
        void shouldCaptureAllWithoutBase() {
            BackupJob job = createAndStub(BackupKind.INCREMENTAL, null);

            backupService.executeBackup(job.getId());

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            BackupMetadata metadata = savedMetadata();
            assertThat(metadata.getBaseBackupId()).isNull();
            assertThat(artifactService.load(metadata).getPayload().totalRowCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fail with a prerequisite error when storage is not configured")
        void shouldFailWithoutStorage() {
            storageClient.setConfigured(false);
            BackupJob job = createAndStub(BackupKind.SCHEMA, null);

            backupService.executeBackup(job.getId());

            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getError().getCode()).isEqualTo(AutomationException.CODE_PREREQUISITE_FAILED);
            assertThat(job.getError().getRecoverable()).isFalse();
            verify(backupMetadataRepository, never()).save(any());
            assertThat(completedEvent().isSuccessful()).isFalse();
            verify(notificationService).notify(eq(NotificationMessage.TYPE_BACKUP_FAILURE), anyMap());
        }

        @Test
        @DisplayName("should fail as a recoverable network error when the source is unreachable")
        void shouldFailWhenSourceUnreachable() {
            databaseClient.setUnreachable("public");
            BackupJob job = createAndStub(BackupKind.SCHEMA, null);

            backupService.executeBackup(job.getId());

            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getError().getCode()).isEqualTo(AutomationException.CODE_NETWORK_ERROR);
            assertThat(job.getError().getRecoverable()).isTrue();
        }
    }

    @Nested
    @DisplayName("change set backups")
    class ChangeSetBackups {

        private BackupMetadata catalogEntry(String id, BackupKind kind) {
            return BackupMetadata.builder()
                    .id(id)
                    .kind(kind)
                    .createdAt(Instant.parse("2024-01-01T02:00:00Z"))
                    .completedAt(Instant.parse("2024-01-01T03:30:00Z"))
                    .build();
        }

        @Test
        @DisplayName("should export changes from the start of the latest backup")
        void shouldExportFromBaseStart() {
            when(backupMetadataRepository.findFirstByOrderByCompletedAtDesc())
                    .thenReturn(Optional.of(catalogEntry("bkp_base", BackupKind.DATA)));
            BackupJob job = createAndStub(BackupKind.INCREMENTAL, null);

            backupService.executeBackup(job.getId());

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(databaseClient.getChangeExportsSince())
                    .containsExactly(Instant.parse("2024-01-01T02:00:00Z"));
            BackupMetadata metadata = savedMetadata();
            assertThat(metadata.getBaseBackupId()).isEqualTo("bkp_base");
            assertThat(artifactService.load(metadata).getPayload().getChangesSince())
                    .isEqualTo(Instant.parse("2024-01-01T02:00:00Z"));
        }

        @Test
        @DisplayName("should base a differential backup on the latest full backup")
        void shouldBaseDifferentialOnFull() {
            when(backupMetadataRepository.findFirstByKindOrderByCompletedAtDesc(BackupKind.FULL))
                    .thenReturn(Optional.of(catalogEntry("bkp_full", BackupKind.FULL)));
            BackupJob job = createAndStub(BackupKind.DIFFERENTIAL, null);

            backupService.executeBackup(job.getId());

            assertThat(savedMetadata().getBaseBackupId()).isEqualTo("bkp_full");
            verify(backupMetadataRepository, never()).findFirstByOrderByCompletedAtDesc();
        }
    }

    @Nested
    @DisplayName("stored artifact verification")
    class StoredArtifactVerification {

        @Test
        @DisplayName("should fail when the stored object is shorter than the artifact")
        void shouldFailOnSizeMismatch() {
            storageClient.damageNextPut(data -> Arrays.copyOf(data, data.length - 1));
            BackupJob job = createAndStub(BackupKind.SCHEMA, null);

            backupService.executeBackup(job.getId());

            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getError().getCode()).isEqualTo(AutomationException.CODE_SIZE_MISMATCH);
            verify(backupMetadataRepository, never()).save(any());
            assertThat(completedEvent().isSuccessful()).isFalse();
        }

        @Test
        @DisplayName("should fail when the stored bytes do not match the checksum")
        void shouldFailOnChecksumMismatch() {
            storageClient.damageNextPut(data -> {
                data[0] ^= 0x01;
                return data;
            });
            BackupJob job = createAndStub(BackupKind.SCHEMA, null);

            backupService.executeBackup(job.getId());

            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getError().getCode()).isEqualTo(AutomationException.CODE_CHECKSUM_MISMATCH);
            verify(backupMetadataRepository, never()).save(any());
            verify(notificationService).notify(eq(NotificationMessage.TYPE_BACKUP_FAILURE), anyMap());
        }
    }

    @Nested
    @DisplayName("cancelBackup")
    class CancelBackup {

        @Test
        @DisplayName("should cancel a pending job so the pipeline never runs it")
        void shouldCancelPendingJob() {
            BackupJob job = createAndStub(BackupKind.FULL, null);

            backupService.cancelBackup(job.getId());
            backupService.executeBackup(job.getId());

            assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
            assertThat(storageClient.objectCount()).isZero();
            verify(backupMetadataRepository, never()).save(any());
        }

        @Test
        @DisplayName("should refuse to cancel a finished job")
        void shouldRefuseFinishedJob() {
            BackupJob job = createAndStub(BackupKind.SCHEMA, null);
            backupService.executeBackup(job.getId());

            assertThatThrownBy(() -> backupService.cancelBackup(job.getId()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("COMPLETED");
        }

        @Test
        @DisplayName("should keep a cancel that lands while the backup is running")
        void shouldKeepCancelDuringExecution() {
            BackupJob job = createAndStub(BackupKind.DATA, null);
            // The stored row was cancelled after this worker moved it to RUNNING
            when(backupJobRepository.updateStatus(job.getId(), JobStatus.RUNNING, JobStatus.COMPLETED)).thenReturn(0);
            when(backupJobRepository.updateStatus(job.getId(), JobStatus.RUNNING, JobStatus.CANCELLED)).thenReturn(0);

            backupService.executeBackup(job.getId());

            assertThat(job.getStatus()).isNotEqualTo(JobStatus.COMPLETED);
            assertThat(job.getBackupId()).isNull();
            assertThat(storageClient.objectCount()).isZero();
            BackupMetadata metadata = savedMetadata();
            verify(backupMetadataRepository).deleteById(metadata.getId());
            verify(backupJobRepository, never()).updateStatus(job.getId(), JobStatus.RUNNING, JobStatus.FAILED);
            verify(eventPublisher, never()).publishEvent(any(BackupCompletedEvent.class));
            verify(notificationService, never()).notify(eq(NotificationMessage.TYPE_BACKUP_SUCCESS), anyMap());
        }

        @Test
        @DisplayName("should not start a job cancelled after it was loaded")
        void shouldNotStartJobCancelledAfterLoad() {
            BackupJob job = createAndStub(BackupKind.DATA, null);
            when(backupJobRepository.updateStatus(job.getId(), JobStatus.PENDING, JobStatus.RUNNING)).thenReturn(0);

            backupService.executeBackup(job.getId());

            assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(storageClient.objectCount()).isZero();
            verify(backupMetadataRepository, never()).save(any());
            verify(eventPublisher, never()).publishEvent(any(BackupCompletedEvent.class));
        }

        @Test
        @DisplayName("should report a conflict when the job finishes while it is being cancelled")
        void shouldConflictWhenJobFinishesFirst() {
            BackupJob job = createAndStub(BackupKind.DATA, null);
            when(backupJobRepository.updateStatus(job.getId(), JobStatus.PENDING, JobStatus.CANCELLED)).thenReturn(0);

            assertThatThrownBy(() -> backupService.cancelBackup(job.getId()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("finished while it was being cancelled");
            assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        }
    }
}
