package com.drautomation.api.service;

import com.drautomation.api.client.ConfigurationSnapshotClient;
import com.drautomation.api.client.FileStoreClient;
import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.event.RestoreRequestedEvent;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.exception.ErrorClassifier;
import com.drautomation.api.exception.ResourceNotFoundException;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.entity.RestoreJob;
import com.drautomation.api.model.entity.RestoreOptions;
import com.drautomation.api.model.enums.CheckStatus;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.RestoreKind;
import com.drautomation.api.repository.BackupMetadataRepository;
import com.drautomation.api.repository.RestoreJobRepository;
import com.drautomation.api.security.BackupEncryptor;
import com.drautomation.api.support.BackupFixtures;
import com.drautomation.api.support.InMemoryDatabaseClient;
import com.drautomation.api.support.InMemoryStorageClient;
import com.drautomation.api.support.MutableClock;
import com.drautomation.api.util.IdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("RestoreService")
@ExtendWith(MockitoExtension.class)
class RestoreServiceTest {

    private static final String TARGET = "restored";

    @Mock private RestoreJobRepository restoreJobRepository;
    @Mock private BackupMetadataRepository backupMetadataRepository;
    @Mock private FileStoreClient fileStoreClient;
    @Mock private ConfigurationSnapshotClient configurationSnapshotClient;
    @Mock private NotificationService notificationService;
    @Mock private ApplicationEventPublisher eventPublisher;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-05T08:00:00Z"));
    private final InMemoryStorageClient storageClient = new InMemoryStorageClient();
    private final InMemoryDatabaseClient databaseClient = new InMemoryDatabaseClient();
    private final Map<String, RestoreJob> jobs = new HashMap<>();
    private final Map<String, JobStatus> storedStatus = new HashMap<>();

    private RestoreService restoreService;
    private BackupMetadata backup;

    @BeforeEach
    void setUp() {
        AutomationProperties properties = new AutomationProperties();
        BackupArtifactService artifactService =
                BackupFixtures.artifactService(storageClient, new BackupEncryptor(properties));
        backup = BackupFixtures.store(artifactService, storageClient, BackupFixtures.samplePayload("backup_1"));

        lenient().when(backupMetadataRepository.existsById("backup_1")).thenReturn(true);
        lenient().when(backupMetadataRepository.findById("backup_1")).thenReturn(Optional.of(backup));
        lenient().when(restoreJobRepository.save(any(RestoreJob.class))).thenAnswer(inv -> {
            RestoreJob job = inv.getArgument(0);
            jobs.put(job.getId(), job);
            storedStatus.putIfAbsent(job.getId(), job.getStatus());
            return job;
        });
        lenient().when(restoreJobRepository.updateStatus(anyString(), any(JobStatus.class), any(JobStatus.class)))
                .thenAnswer(inv -> {
                    String id = inv.getArgument(0);
                    if (storedStatus.get(id) != inv.getArgument(1)) {
                        return 0;
                    }
                    storedStatus.put(id, inv.getArgument(2));
                    return 1;
                });
        lenient().when(restoreJobRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(jobs.get(inv.<String>getArgument(0))));

        restoreService = new RestoreService(restoreJobRepository, backupMetadataRepository, artifactService,
                databaseClient, new DatabaseRestoreWriter(databaseClient, properties), fileStoreClient,
                configurationSnapshotClient, new RestoreVerificationService(databaseClient), notificationService,
                new ErrorClassifier(clock), new IdGenerator(clock), properties, eventPublisher, clock);
    }

    private RestoreOptions options(RestoreKind kind) {
        return RestoreOptions.builder().kind(kind).targetDatabase(TARGET).build();
    }

    @Nested
    @DisplayName("complete restore")
    class CompleteRestore {

        @Test
        @DisplayName("should write every table and pass verification")
        void shouldRestoreEverything() {
            RestoreJob job = restoreService.runRestore("backup_1", options(RestoreKind.COMPLETE), null);

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.getProgress()).isEqualTo(100);
            assertThat(job.getRowsRestored()).isEqualTo(5);
            assertThat(databaseClient.countRows(TARGET, "users")).isEqualTo(2);
            assertThat(databaseClient.countRows(TARGET, "orders")).isEqualTo(3);
            assertThat(job.getVerification().isPassed()).isTrue();
            assertThat(job.getVerification().getFailedChecks()).isZero();
            verify(notificationService).notify(eq(NotificationMessage.TYPE_RESTORE_SUCCESS), anyMap());
        }

        @Test
        @DisplayName("should fail the job when verification finds a failed check")
        void shouldFailOnVerificationFailure() {
            databaseClient.setUnreachable(TARGET);

            RestoreJob job = restoreService.runRestore("backup_1", options(RestoreKind.COMPLETE), null);

            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getError().getCode()).isEqualTo(AutomationException.CODE_VERIFICATION_FAILED);
            assertThat(job.getVerification().isPassed()).isFalse();
            assertThat(job.getVerification().getChecks())
                    .anyMatch(c -> c.getName().startsWith("connection:") && c.getStatus() == CheckStatus.FAILED);
            verify(notificationService).notify(eq(NotificationMessage.TYPE_RESTORE_FAILURE), anyMap());
        }

        @Test
        @DisplayName("should fail with a checksum mismatch when the stored artifact was altered")
        void shouldFailOnCorruptArtifact() {
            storageClient.overwrite(BackupFixtures.REGION, BackupFixtures.BUCKET, backup.getStorageKey(), new byte[]{1, 2, 3});

            RestoreJob job = restoreService.runRestore("backup_1", options(RestoreKind.COMPLETE), null);

            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getError().getCode()).isEqualTo(AutomationException.CODE_CHECKSUM_MISMATCH);
            assertThat(databaseClient.databaseExists(TARGET)).isFalse();
        }
    }

    @Nested
    @DisplayName("test restore")
    class TestRestore {

        @Test
        @DisplayName("should report what it would restore without writing anything")
        void shouldNotWrite() {
            RestoreJob job = restoreService.runRestore("backup_1", options(RestoreKind.TEST), null);

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.getRowsRestored()).isEqualTo(5);
            assertThat(job.getVerification().isPassed()).isTrue();
            assertThat(databaseClient.getWriteCount()).isZero();
            assertThat(databaseClient.databaseExists(TARGET)).isFalse();
        }

        @Test
        @DisplayName("should give the same outcome when repeated")
        void shouldBeRepeatable() {
            RestoreJob first = restoreService.runRestore("backup_1", options(RestoreKind.TEST), null);
            RestoreJob second = restoreService.runRestore("backup_1", options(RestoreKind.TEST), null);

            assertThat(second.getId()).isNotEqualTo(first.getId());
            assertThat(second.getStatus()).isEqualTo(first.getStatus());
            assertThat(second.getRowsRestored()).isEqualTo(first.getRowsRestored());
            assertThat(second.getVerification().getTotalChecks()).isEqualTo(first.getVerification().getTotalChecks());
            assertThat(databaseClient.getWriteCount()).isZero();
        }
    }

    @Nested
    @DisplayName("clone and overwrite")
    class CloneAndOverwrite {

        @Test
        @DisplayName("should restore a clone into its target location instead of the target database")
        void shouldCloneIntoTargetLocation() {
            RestoreOptions options = options(RestoreKind.CLONE).toBuilder().targetLocation("analytics_copy").build();

            RestoreJob job = restoreService.runRestore("backup_1", options, null);

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(databaseClient.countRows("analytics_copy", "orders")).isEqualTo(3);
            assertThat(databaseClient.databaseExists(TARGET)).isFalse();
        }

        @Test
        @DisplayName("should derive the clone database from the target database")
        void shouldDeriveCloneName() {
            RestoreJob job = restoreService.runRestore("backup_1", options(RestoreKind.CLONE), null);

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(databaseClient.countRows(TARGET + "_clone", "users")).isEqualTo(2);
            assertThat(databaseClient.databaseExists(TARGET)).isFalse();
        }

        @Test
        @DisplayName("should replace existing rows when overwriting")
        void shouldReplaceExistingRows() {
            databaseClient.addTable(TARGET, InMemoryDatabaseClient.definition("users", "id", "email"),
                    List.of(InMemoryDatabaseClient.row("id", "99", "email", "stale@example.com")));
            databaseClient.addTable(TARGET, InMemoryDatabaseClient.definition("orders", "id", "total", "updated_at"),
                    List.of());
            RestoreOptions options = options(RestoreKind.COMPLETE).toBuilder()
                    .restoreSchema(false)
                    .overwriteExisting(true)
                    .build();

            RestoreJob job = restoreService.runRestore("backup_1", options, null);

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(databaseClient.rows(TARGET, "users"))
                    .extracting(r -> r.get("id"))
                    .containsExactly("1", "2");
        }
    }

    @Nested
    @DisplayName("partial and point-in-time restore")
    class SelectiveRestore {

        @Test
        @DisplayName("should restore only the filtered tables")
        void shouldRestoreFilteredTables() {
            RestoreOptions options = options(RestoreKind.PARTIAL).toBuilder().tableFilters(List.of("users")).build();

            RestoreJob job = restoreService.runRestore("backup_1", options, null);

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.getRowsRestored()).isEqualTo(2);
            assertThat(databaseClient.listTables(TARGET)).containsExactly("users");
        }

        @Test
        @DisplayName("should fail when a filtered table is not in the backup")
        void shouldFailOnUnknownTable() {
            RestoreOptions options = options(RestoreKind.PARTIAL).toBuilder().tableFilters(List.of("invoices")).build();

            RestoreJob job = restoreService.runRestore("backup_1", options, null);

            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getError().getCode()).isEqualTo(AutomationException.CODE_PREREQUISITE_FAILED);
            assertThat(job.getError().getMessage()).contains("invoices");
        }

        @Test
        @DisplayName("should drop rows stamped after the point in time")
        void shouldCutAtPointInTime() {
            RestoreOptions options = options(RestoreKind.POINT_IN_TIME).toBuilder()
                    .pointInTime(Instant.parse("2024-01-02T12:00:00Z"))
                    .build();

            RestoreJob job = restoreService.runRestore("backup_1", options, null);

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(databaseClient.rows(TARGET, "orders"))
                    .extracting(r -> r.get("id"))
                    .containsExactly("10", "11");
        }

        @Test
        @DisplayName("should reject a point-in-time restore without a point in time")
        void shouldRequirePointInTime() {
            assertThatThrownBy(() -> restoreService.startRestore("backup_1", options(RestoreKind.POINT_IN_TIME)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject an unknown backup")
        void shouldRejectUnknownBackup() {
            assertThatThrownBy(() -> restoreService.startRestore("backup_missing", options(RestoreKind.COMPLETE)))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("should not run a job cancelled while pending")
    void shouldCancelPendingRestore() {
        RestoreJob job = restoreService.startRestore("backup_1", options(RestoreKind.COMPLETE));
        verify(eventPublisher).publishEvent(any(RestoreRequestedEvent.class));

        restoreService.cancelRestore(job.getId());
        restoreService.executeRestore(job.getId());

        assertThat(jobs.get(job.getId()).getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(databaseClient.getWriteCount()).isZero();
        assertThatThrownBy(() -> restoreService.cancelRestore(job.getId()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should keep a cancel stored while the restore was running")
    void shouldKeepCancelDuringRestore() {
        RestoreJob job = restoreService.startRestore("backup_1", options(RestoreKind.COMPLETE));
        // Another node cancels the row right after this worker starts it
        doAnswer(inv -> {
            storedStatus.put(job.getId(), JobStatus.CANCELLED);
            return 1;
        }).when(restoreJobRepository).updateStatus(job.getId(), JobStatus.PENDING, JobStatus.RUNNING);

        restoreService.executeRestore(job.getId());

        assertThat(storedStatus.get(job.getId())).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getStatus()).isNotEqualTo(JobStatus.COMPLETED);
        verify(notificationService, never()).notify(anyString(), anyMap());
    }
}
