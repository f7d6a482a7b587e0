package com.drautomation.api.service;

import com.drautomation.api.client.DatabaseClient;
import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.event.RecoveryTestRequestedEvent;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.exception.ResourceNotFoundException;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.dto.RecoveryTestRequest;
import com.drautomation.api.model.dto.RecoveryTestStatistics;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.entity.RecoveryTest;
import com.drautomation.api.model.entity.TestIssue;
import com.drautomation.api.model.entity.ValidationResult;
import com.drautomation.api.model.enums.ErrorCategory;
import com.drautomation.api.model.enums.IssueCategory;
import com.drautomation.api.model.enums.JobStatus;
import com.drautomation.api.model.enums.RecoveryTestType;
import com.drautomation.api.model.enums.Severity;
import com.drautomation.api.model.payload.BackupPayload;
import com.drautomation.api.model.payload.TableDefinition;
import com.drautomation.api.repository.BackupMetadataRepository;
import com.drautomation.api.repository.RecoveryTestRepository;
import com.drautomation.api.util.FormatUtils;
import com.drautomation.api.util.IdGenerator;
import com.drautomation.api.util.ReadOnlyQueries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Recovery tester. Restores a backup into an isolated test database, runs validation queries,
 * scores the result and always drops the test database afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecoveryTestService {

    private final RecoveryTestRepository recoveryTestRepository;
    private final BackupMetadataRepository backupMetadataRepository;
    private final BackupArtifactService artifactService;
    private final DatabaseClient databaseClient;
    private final DatabaseRestoreWriter restoreWriter;
    private final NotificationService notificationService;
    private final IdGenerator idGenerator;
    private final AutomationProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public boolean isEnabled() {
        return properties.getRecoveryTesting().isEnabled();
    }

    @Transactional
    public RecoveryTest startRecoveryTest(RecoveryTestRequest request) {
        if (!isEnabled()) {
            throw new AutomationException(AutomationException.CODE_DISABLED, ErrorCategory.VALIDATION,
                    "Recovery testing is disabled");
        }
        if (!backupMetadataRepository.existsById(request.getBackupId())) {
            throw new ResourceNotFoundException("Backup", request.getBackupId());
        }
        RecoveryTestType type = request.getTestType() != null ? request.getTestType() : RecoveryTestType.FULL;
        List<String> selected = request.getSelectedTables() != null ? request.getSelectedTables() : List.of();
        if (type == RecoveryTestType.PARTIAL && selected.isEmpty()) {
            throw new IllegalArgumentException("Partial recovery test requires at least one selected table");
        }
        List<String> customValidations = request.getCustomValidations() != null
                ? request.getCustomValidations() : List.of();
        customValidations.forEach(ReadOnlyQueries::requireReadOnlySelect);

        String testId = idGenerator.generate(IdGenerator.PREFIX_TEST);
        RecoveryTest test = RecoveryTest.builder()
                .id(testId)
                .backupId(request.getBackupId())
                .testType(type)
                .status(JobStatus.PENDING)
                .testDatabase(testDatabaseName(testId))
                .selectedTables(new ArrayList<>(selected))
                .customValidations(new ArrayList<>(customValidations))
                .build();
        test = recoveryTestRepository.save(test);

        eventPublisher.publishEvent(new RecoveryTestRequestedEvent(this, testId));
        log.info("Created {} recovery test {} for backup {}", type, testId, request.getBackupId());
        return test;
    }

    /**
     * Run a pending test. The test database is dropped whatever the outcome.
     */
    public void executeTest(String testId) {
        RecoveryTest test = recoveryTestRepository.findById(testId)
                .orElseThrow(() -> new ResourceNotFoundException("Recovery test", testId));
        if (test.getStatus() != JobStatus.PENDING) {
            log.warn("Skipping recovery test {} in status {}", testId, test.getStatus());
            return;
        }

        Instant startedAt = Instant.now(clock);
        test.transitionTo(JobStatus.RUNNING);
        test.setStartedAt(startedAt);
        recoveryTestRepository.save(test);
        log.info("Starting {} recovery test {} into {}", test.getTestType(), testId, test.getTestDatabase());

        try {
            BackupMetadata backup = backupMetadataRepository.findById(test.getBackupId())
                    .orElseThrow(() -> new ResourceNotFoundException("Backup", test.getBackupId()));

            Instant restoreStart = Instant.now(clock);
            BackupArtifactService.LoadedArtifact artifact = artifactService.load(backup);
            List<String> restored = restoreIntoTestDatabase(test, artifact.getPayload());
            test.setRestoreSuccessful(true);
            test.setRestoreTimeMs(Duration.between(restoreStart, Instant.now(clock)).toMillis());
            test.setRestoredBackupSize(artifact.getStoredSize());
            test.setRestoredTableCount(restored.size());
            test.setRestoredRecordCount(countRecords(test, artifact.getPayload(), restored));

            Instant validationStart = Instant.now(clock);
            List<ValidationResult> results = runValidations(test, restored);
            test.setValidationResults(results);
            test.setValidationTimeMs(Duration.between(validationStart, Instant.now(clock)).toMillis());

            long passed = results.stream().filter(ValidationResult::isPassed).count();
            test.setIntegrityScore(FormatUtils.percentage(passed, results.size()));
            assess(test);

            test.transitionTo(JobStatus.COMPLETED);
            log.info("Recovery test {} completed: score={}, restore={}, validation={}", testId,
                    test.getIntegrityScore(), FormatUtils.formatDuration(test.getRestoreTimeMs()),
                    FormatUtils.formatDuration(test.getValidationTimeMs()));
        } catch (Exception e) {
            log.error("Recovery test {} failed: {}", testId, e.getMessage(), e);
            test.addIssue(issue(Severity.CRITICAL, IssueCategory.RESTORE, "Recovery test failed",
                    e.getMessage(), "Check backup integrity and restore prerequisites"));
            if (test.getStatus().canTransitionTo(JobStatus.FAILED)) {
                test.transitionTo(JobStatus.FAILED);
            }
        } finally {
            dropTestDatabase(test.getTestDatabase());
            Instant completedAt = Instant.now(clock);
            test.setCompletedAt(completedAt);
            test.setTotalTimeMs(Duration.between(startedAt, completedAt).toMillis());
            test.setArchived(true);
            recoveryTestRepository.save(test);
            pruneHistory();
        }
        notifyOutcome(test);
    }

    /**
     * A test passes when it completed without a critical issue.
     */
    public static boolean isPassed(RecoveryTest test) {
        return test.getStatus() == JobStatus.COMPLETED
                && test.getIssues().stream().noneMatch(i -> i.getSeverity() == Severity.CRITICAL);
    }

    @Transactional(readOnly = true)
    public RecoveryTest getTestStatus(String testId) {
        return recoveryTestRepository.findById(testId)
                .orElseThrow(() -> new ResourceNotFoundException("Recovery test", testId));
    }

    @Transactional(readOnly = true)
    public List<RecoveryTest> getActiveTests() {
        return recoveryTestRepository.findByArchivedFalseOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<RecoveryTest> getTestHistory(int limit) {
        int size = limit > 0 ? limit : properties.getRecoveryTesting().getHistoryLimit();
        return recoveryTestRepository.findByArchivedTrueOrderByCompletedAtDesc(PageRequest.of(0, size));
    }

    @Transactional(readOnly = true)
    public RecoveryTestStatistics getStatistics() {
        List<RecoveryTest> history = recoveryTestRepository.findByArchivedTrue();
        long passed = history.stream().filter(RecoveryTestService::isPassed).count();
        long failed = history.size() - passed;
        double averageScore = history.stream()
                .filter(t -> t.getStatus() == JobStatus.COMPLETED)
                .mapToInt(RecoveryTest::getIntegrityScore)
                .average()
                .orElse(0);
        long averageRestore = Math.round(history.stream()
                .filter(RecoveryTest::isRestoreSuccessful)
                .mapToLong(RecoveryTest::getRestoreTimeMs)
                .average()
                .orElse(0));
        Instant lastTest = history.stream()
                .map(RecoveryTest::getCompletedAt)
                .filter(t -> t != null)
                .max(Comparator.naturalOrder())
                .orElse(null);

        return RecoveryTestStatistics.builder()
                .totalTests(history.size())
                .passedTests(passed)
                .failedTests(failed)
                .activeTests(recoveryTestRepository.findByArchivedFalseOrderByCreatedAtDesc().size())
                .successRate(history.isEmpty() ? 100.0 : passed * 100.0 / history.size())
                .averageIntegrityScore(averageScore)
                .averageRestoreTimeMs(averageRestore)
                .lastTestTime(lastTest)
                .build();
    }

    /**
     * Periodic full test of the latest backup
     */
    @Scheduled(cron = "${automation.recovery-testing.cron:0 0 6 * * SUN}")
    public void scheduledRecoveryTest() {
        if (!isEnabled()) {
            return;
        }
        Optional<BackupMetadata> latest = backupMetadataRepository.findFirstByOrderByCompletedAtDesc();
        if (latest.isEmpty()) {
            log.info("No backup available for scheduled recovery test");
            return;
        }
        try {
            startRecoveryTest(RecoveryTestRequest.builder()
                    .backupId(latest.get().getId())
                    .testType(RecoveryTestType.FULL)
                    .build());
        } catch (Exception e) {
            log.error("Scheduled recovery test could not be started: {}", e.getMessage(), e);
        }
    }

    private List<String> restoreIntoTestDatabase(RecoveryTest test, BackupPayload payload) {
        String database = test.getTestDatabase();
        if (!databaseClient.databaseExists(database)) {
            databaseClient.createDatabase(database);
        }
        List<String> tables = tablesFor(test, payload);
        List<TableDefinition> definitions = restoreWriter.definitionsFor(payload, tables);

        switch (test.getTestType()) {
            case SCHEMA_ONLY -> restoreWriter.createTables(database, definitions, true, true);
            case DATA_ONLY -> {
                restoreWriter.createTables(database, definitions, true, false);
                restoreWriter.writeRows(database, payload, tables, false);
            }
            case FULL, PARTIAL -> {
                restoreWriter.createTables(database, definitions, true, true);
                restoreWriter.writeRows(database, payload, tables, false);
            }
        }
        return tables;
    }

    private List<String> tablesFor(RecoveryTest test, BackupPayload payload) {
        List<String> all = DatabaseRestoreWriter.tableNames(payload);
        if (test.getTestType() != RecoveryTestType.PARTIAL) {
            return all;
        }
        Set<String> available = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        available.addAll(all);
        List<String> missing = test.getSelectedTables().stream().filter(t -> !available.contains(t)).toList();
        if (!missing.isEmpty()) {
            throw AutomationException.validation(AutomationException.CODE_PREREQUISITE_FAILED,
                    "Selected tables not in backup: " + missing);
        }
        return new ArrayList<>(test.getSelectedTables());
    }

    private long countRecords(RecoveryTest test, BackupPayload payload, Collection<String> tables) {
        if (test.getTestType() == RecoveryTestType.SCHEMA_ONLY) {
            return 0;
        }
        long total = 0;
        for (String table : tables) {
            if (payload.findTableData(table) != null) {
                total += payload.findTableData(table).rowCount();
            }
        }
        return total;
    }

    private List<ValidationResult> runValidations(RecoveryTest test, List<String> restoredTables) {
        List<String> queries = new ArrayList<>(properties.getRecoveryTesting().getValidationQueries());
        queries.addAll(test.getCustomValidations());
        if (queries.isEmpty()) {
            for (String table : restoredTables) {
                queries.add("SELECT COUNT(*) FROM " + table);
            }
        }

        List<ValidationResult> results = new ArrayList<>();
        for (String query : queries) {
            Instant start = Instant.now(clock);
            try {
                ReadOnlyQueries.requireReadOnlySelect(query);
                long rows = databaseClient.runQuery(test.getTestDatabase(), query);
                results.add(ValidationResult.builder()
                        .query(query)
                        .passed(true)
                        .rowCount(rows)
                        .executionTimeMs(Duration.between(start, Instant.now(clock)).toMillis())
                        .build());
            } catch (Exception e) {
                log.warn("Validation query failed in {}: {} ({})", test.getTestDatabase(), query, e.getMessage());
                results.add(ValidationResult.builder()
                        .query(query)
                        .passed(false)
                        .error(e.getMessage())
                        .executionTimeMs(Duration.between(start, Instant.now(clock)).toMillis())
                        .build());
                test.addIssue(issue(Severity.HIGH, IssueCategory.VALIDATION, "Validation query failed",
                        query + ": " + e.getMessage(), "Review the query and the restored data"));
            }
        }
        return results;
    }

    private void assess(RecoveryTest test) {
        AutomationProperties.Thresholds thresholds = properties.getRecoveryTesting().getThresholds();

        if (test.getRestoreTimeMs() > thresholds.getMaxRestoreTime().toMillis()) {
            test.addIssue(issue(Severity.MEDIUM, IssueCategory.PERFORMANCE, "Restore time exceeded threshold",
                    FormatUtils.formatDuration(test.getRestoreTimeMs()) + " > "
                            + FormatUtils.formatDuration(thresholds.getMaxRestoreTime().toMillis()),
                    "Consider smaller backups or faster storage"));
        }
        if (test.getValidationTimeMs() > thresholds.getMaxValidationTime().toMillis()) {
            test.addIssue(issue(Severity.LOW, IssueCategory.PERFORMANCE, "Validation time exceeded threshold",
                    FormatUtils.formatDuration(test.getValidationTimeMs()) + " > "
                            + FormatUtils.formatDuration(thresholds.getMaxValidationTime().toMillis()),
                    "Simplify validation queries"));
        }
        if (test.getIntegrityScore() < thresholds.getMinDataIntegrity()) {
            test.addIssue(issue(Severity.CRITICAL, IssueCategory.INTEGRITY, "Data integrity below minimum",
                    "Score " + test.getIntegrityScore() + " < " + thresholds.getMinDataIntegrity(),
                    "Investigate backup consistency before relying on it"));
        }
        if (test.getIssues().isEmpty()) {
            test.addIssue(issue(Severity.LOW, IssueCategory.VALIDATION, "All tests passed", null, null));
        }
    }

    private void dropTestDatabase(String database) {
        try {
            databaseClient.dropDatabase(database);
        } catch (Exception e) {
            log.warn("Failed to drop test database {}: {}", database, e.getMessage());
        }
    }

    private void pruneHistory() {
        int limit = properties.getRecoveryTesting().getHistoryLimit();
        List<RecoveryTest> history = recoveryTestRepository.findByArchivedTrue();
        if (history.size() <= limit) {
            return;
        }
        List<RecoveryTest> sorted = new ArrayList<>(history);
        sorted.sort(Comparator.comparing(RecoveryTest::getCompletedAt,
                Comparator.nullsFirst(Comparator.naturalOrder())).reversed());
        List<RecoveryTest> excess = sorted.subList(limit, sorted.size());
        recoveryTestRepository.deleteAll(new ArrayList<>(excess));
        log.debug("Pruned {} recovery tests from history", excess.size());
    }

    private void notifyOutcome(RecoveryTest test) {
        boolean passed = isPassed(test);
        AutomationProperties.RecoveryTesting config = properties.getRecoveryTesting();
        if (passed && !config.isNotifyOnSuccess() || !passed && !config.isNotifyOnFailure()) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("testId", test.getId());
        data.put("backupId", test.getBackupId());
        data.put("testType", test.getTestType().name());
        data.put("status", test.getStatus().name());
        data.put("integrityScore", test.getIntegrityScore());
        data.put("issues", test.getIssues().size());
        data.put("duration", FormatUtils.formatDuration(test.getTotalTimeMs()));
        notificationService.notify(passed
                ? NotificationMessage.TYPE_RECOVERY_TEST_SUCCESS
                : NotificationMessage.TYPE_RECOVERY_TEST_FAILURE, data);
    }

    private String testDatabaseName(String testId) {
        String suffix = testId.substring(testId.lastIndexOf('_') + 1);
        return properties.getRecoveryTesting().getTestDatabase() + "_" + suffix;
    }

    private static TestIssue issue(Severity severity, IssueCategory category, String message,
                                   String details, String recommendation) {
        return TestIssue.builder()
                .severity(severity)
                .category(category)
                .message(message)
                .details(details)
                .recommendation(recommendation)
                .build();
    }
}
