package com.drautomation.api.service;

import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.event.RecoveryTestRequestedEvent;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.dto.RecoveryTestRequest;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.entity.RecoveryTest;
import com.drautomation.api.model.entity.TestIssue;
import com.drautomation.api.model.enums.IssueCategory;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.RecoveryTestType;
import com.drautomation.api.model.enums.Severity;
import com.drautomation.api.repository.BackupMetadataRepository;
import com.drautomation.api.repository.RecoveryTestRepository;
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
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("RecoveryTestService")
@ExtendWith(MockitoExtension.class)
class RecoveryTestServiceTest {

    @Mock private RecoveryTestRepository recoveryTestRepository;
    @Mock private BackupMetadataRepository backupMetadataRepository;
    @Mock private NotificationService notificationService;
    @Mock private ApplicationEventPublisher eventPublisher;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-07T06:00:00Z"));
    private final InMemoryStorageClient storageClient = new InMemoryStorageClient();
    private final InMemoryDatabaseClient databaseClient = new InMemoryDatabaseClient();
    private final Map<String, RecoveryTest> tests = new HashMap<>();

    private AutomationProperties properties;
    private RecoveryTestService recoveryTestService;
    private BackupMetadata backup;

    @BeforeEach
    void setUp() {
        properties = new AutomationProperties();
        properties.getRecoveryTesting().setEnabled(true);
        BackupArtifactService artifactService =
                BackupFixtures.artifactService(storageClient, new BackupEncryptor(properties));
        backup = BackupFixtures.store(artifactService, storageClient, BackupFixtures.samplePayload("backup_1"));

        lenient().when(backupMetadataRepository.existsById("backup_1")).thenReturn(true);
        lenient().when(backupMetadataRepository.findById("backup_1")).thenReturn(Optional.of(backup));
        lenient().when(recoveryTestRepository.save(any(RecoveryTest.class))).thenAnswer(inv -> {
            RecoveryTest test = inv.getArgument(0);
            tests.put(test.getId(), test);
            return test;
        });
        lenient().when(recoveryTestRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(tests.get(inv.<String>getArgument(0))));

        recoveryTestService = new RecoveryTestService(recoveryTestRepository, backupMetadataRepository,
                artifactService, databaseClient, new DatabaseRestoreWriter(databaseClient, properties),
                notificationService, new IdGenerator(clock), properties, eventPublisher, clock);
    }

    private RecoveryTest run(RecoveryTestRequest request) {
        RecoveryTest test = recoveryTestService.startRecoveryTest(request);
        recoveryTestService.executeTest(test.getId());
        return tests.get(test.getId());
    }

    private RecoveryTestRequest request(RecoveryTestType type) {
        return RecoveryTestRequest.builder().backupId("backup_1").testType(type).build();
    }

    @Nested
    @DisplayName("startRecoveryTest")
    class StartRecoveryTest {

        @Test
        @DisplayName("should name an isolated test database after the test id")
        void shouldNameTestDatabase() {
            RecoveryTest test = recoveryTestService.startRecoveryTest(request(RecoveryTestType.FULL));

            String suffix = test.getId().substring(test.getId().lastIndexOf('_') + 1);
            assertThat(test.getTestDatabase()).isEqualTo("recovery_test_" + suffix);
            assertThat(test.getStatus()).isEqualTo(JobStatus.PENDING);
            verify(eventPublisher).publishEvent(any(RecoveryTestRequestedEvent.class));
        }

        @Test
        @DisplayName("should reject requests while recovery testing is disabled")
        void shouldRejectWhenDisabled() {
            properties.getRecoveryTesting().setEnabled(false);

            assertThatThrownBy(() -> recoveryTestService.startRecoveryTest(request(RecoveryTestType.FULL)))
                    .isInstanceOf(AutomationException.class)
                    .hasFieldOrPropertyWithValue("code", AutomationException.CODE_DISABLED);
        }

        @Test
        @DisplayName("should reject custom validations that are not a single SELECT")
        void shouldRejectWritingValidations() {
            for (String query : List.of("DELETE FROM users",
                    "SELECT COUNT(*) FROM OLD TABLE (DELETE FROM public.users)",
                    "SELECT 1; DROP TABLE users")) {
                RecoveryTestRequest request = RecoveryTestRequest.builder()
                        .backupId("backup_1")
                        .testType(RecoveryTestType.FULL)
                        .customValidations(List.of(query))
                        .build();

                assertThatThrownBy(() -> recoveryTestService.startRecoveryTest(request))
                        .isInstanceOf(IllegalArgumentException.class)
                        .hasMessageContaining("Only single SELECT statements are allowed");
            }
            assertThat(tests).isEmpty();
            verify(eventPublisher, never()).publishEvent(any(RecoveryTestRequestedEvent.class));
        }

        @Test
        @DisplayName("should require selected tables for a partial test")
        void shouldRequireTablesForPartial() {
            assertThatThrownBy(() -> recoveryTestService.startRecoveryTest(request(RecoveryTestType.PARTIAL)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("executeTest")
    class ExecuteTest {

        @Test
        @DisplayName("should restore, validate every table and score 100")
        void shouldPassFullTest() {
            RecoveryTest test = run(request(RecoveryTestType.FULL));

            assertThat(test.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(test.isRestoreSuccessful()).isTrue();
            assertThat(test.getRestoredTableCount()).isEqualTo(2);
            assertThat(test.getRestoredRecordCount()).isEqualTo(5);
            assertThat(test.getRestoredBackupSize()).isEqualTo(backup.getSizeBytes());
            assertThat(test.getValidationResults()).hasSize(2).allMatch(r -> r.isPassed());
            assertThat(test.getIntegrityScore()).isEqualTo(100);
            assertThat(test.getIssues()).extracting(TestIssue::getMessage).containsExactly("All tests passed");
            assertThat(test.isArchived()).isTrue();
            assertThat(RecoveryTestService.isPassed(test)).isTrue();
        }

        @Test
        @DisplayName("should always drop the test database")
        void shouldDropTestDatabase() {
            RecoveryTest test = run(request(RecoveryTestType.FULL));

            assertThat(databaseClient.getDroppedDatabases()).containsExactly(test.getTestDatabase());
            assertThat(databaseClient.databaseExists(test.getTestDatabase())).isFalse();
        }

        @Test
        @DisplayName("should flag a failed validation and a low integrity score")
        void shouldScoreFailedValidation() {
            RecoveryTest test = run(RecoveryTestRequest.builder()
                    .backupId("backup_1")
                    .testType(RecoveryTestType.FULL)
                    .customValidations(List.of("SELECT COUNT(*) FROM users", "SELECT COUNT(*) FROM missing_table"))
                    .build());

            assertThat(test.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(test.getIntegrityScore()).isEqualTo(50);
            assertThat(test.getIssues())
                    .anyMatch(i -> i.getSeverity() == Severity.HIGH && i.getCategory() == IssueCategory.VALIDATION)
                    .anyMatch(i -> i.getSeverity() == Severity.CRITICAL && i.getCategory() == IssueCategory.INTEGRITY);
            assertThat(RecoveryTestService.isPassed(test)).isFalse();
            verify(notificationService).notify(eq(NotificationMessage.TYPE_RECOVERY_TEST_FAILURE), anyMap());
        }

        @Test
        @DisplayName("should fail a configured write query without sending it to the database")
        void shouldNotRunConfiguredWriteQuery() {
            properties.getRecoveryTesting().setValidationQueries(
                    List.of("SELECT COUNT(*) FROM orders", "TRUNCATE TABLE orders"));

            RecoveryTest test = run(request(RecoveryTestType.FULL));

            assertThat(databaseClient.getExecutedQueries()).containsExactly("SELECT COUNT(*) FROM orders");
            assertThat(test.getValidationResults()).hasSize(2);
            assertThat(test.getValidationResults().get(0).getRowCount()).isEqualTo(3);
            assertThat(test.getValidationResults().get(1).isPassed()).isFalse();
            assertThat(test.getValidationResults().get(1).getError()).contains("TRUNCATE is not allowed");
            assertThat(test.getIntegrityScore()).isEqualTo(50);
        }

        @Test
        @DisplayName("should fail with a critical restore issue when the artifact is corrupt")
        void shouldFailOnCorruptArtifact() {
            storageClient.overwrite(BackupFixtures.REGION, BackupFixtures.BUCKET, backup.getStorageKey(), new byte[]{9});

            RecoveryTest test = run(request(RecoveryTestType.FULL));

            assertThat(test.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(test.getIssues()).anyMatch(i -> i.getSeverity() == Severity.CRITICAL
                    && i.getCategory() == IssueCategory.RESTORE);
            assertThat(databaseClient.getDroppedDatabases()).containsExactly(test.getTestDatabase());
        }

        @Test
        @DisplayName("should restore tables without rows for a schema-only test")
        void shouldRestoreSchemaOnly() {
            RecoveryTest test = run(request(RecoveryTestType.SCHEMA_ONLY));

            assertThat(test.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(test.getRestoredRecordCount()).isZero();
            assertThat(test.getValidationResults()).allMatch(r -> r.isPassed() && r.getRowCount() == 0);
        }

        @Test
        @DisplayName("should restore only the selected tables for a partial test")
        void shouldRestoreSelectedTables() {
            RecoveryTest test = run(RecoveryTestRequest.builder()
                    .backupId("backup_1")
                    .testType(RecoveryTestType.PARTIAL)
                    .selectedTables(List.of("orders"))
                    .build());

            assertThat(test.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(test.getRestoredTableCount()).isEqualTo(1);
            assertThat(test.getRestoredRecordCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should not notify a passing test unless asked to")
        void shouldNotNotifySuccessByDefault() {
            run(request(RecoveryTestType.FULL));

            verify(notificationService, never()).notify(anyString(), anyMap());
        }
    }
}
