package com.drautomation.api.service;

import com.drautomation.api.client.DatabaseClient;
import com.drautomation.api.model.entity.RestoreOptions;
import com.drautomation.api.model.entity.VerificationCheck;
import com.drautomation.api.model.entity.VerificationResult;
import com.drautomation.api.model.enums.CheckStatus;
import com.drautomation.api.model.enums.VerificationCategory;
import com.drautomation.api.model.payload.BackupPayload;
import com.drautomation.api.model.payload.FileEntry;
import com.drautomation.api.model.payload.TableData;
import com.drautomation.api.model.payload.TableDefinition;
import com.drautomation.api.util.Checksums;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Post-restore checks in four categories: integrity, data validation, checksum comparison and
 * connection test. Each category runs only when enabled in the restore options.
 * Simulated restores are checked against the payload and never write to the target.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RestoreVerificationService {

    private final DatabaseClient databaseClient;

    public VerificationResult verify(VerificationInput input) {
        RestoreOptions options = input.getOptions();
        List<VerificationCheck> checks = new ArrayList<>();

        if (options.isVerifyIntegrity()) {
            checks.addAll(input.isSimulated() ? structureChecks(input) : tablePresenceChecks(input));
        }
        if (options.isValidateData()) {
            checks.addAll(input.isSimulated() ? simulatedRowChecks(input) : rowCountChecks(input));
        }
        if (options.isCompareChecksums()) {
            checks.addAll(checksumChecks(input));
        }
        if (options.isTestConnections()) {
            checks.add(connectionCheck(input));
        }

        VerificationResult result = VerificationResult.of(checks);
        log.info("Verification of {}: {}/{} passed, {} failed, {} warnings", input.getDatabase(),
                result.getPassedChecks(), result.getTotalChecks(), result.getFailedChecks(), result.getWarnings());
        return result;
    }

    private List<VerificationCheck> tablePresenceChecks(VerificationInput input) {
        Set<String> present = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        present.addAll(databaseClient.listTables(input.getDatabase()));
        List<VerificationCheck> checks = new ArrayList<>();
        for (String table : input.getTables()) {
            boolean exists = present.contains(table);
            checks.add(check(VerificationCategory.INTEGRITY, "table:" + table,
                    exists ? CheckStatus.PASSED : CheckStatus.FAILED,
                    exists ? "Table exists" : "Table missing after restore",
                    "present", exists ? "present" : "missing"));
        }
        return checks;
    }

    private List<VerificationCheck> structureChecks(VerificationInput input) {
        BackupPayload payload = input.getPayload();
        List<VerificationCheck> checks = new ArrayList<>();
        for (String table : input.getTables()) {
            TableDefinition definition = payload.findTableDefinition(table);
            TableData data = payload.findTableData(table);
            if (definition == null) {
                checks.add(check(VerificationCategory.INTEGRITY, "structure:" + table, CheckStatus.FAILED,
                        "No table definition in backup", "definition", "missing"));
                continue;
            }
            List<String> unknown = new ArrayList<>();
            if (data != null) {
                for (String column : data.getColumns()) {
                    if (definition.findColumn(column) == null) {
                        unknown.add(column);
                    }
                }
            }
            checks.add(check(VerificationCategory.INTEGRITY, "structure:" + table,
                    unknown.isEmpty() ? CheckStatus.PASSED : CheckStatus.FAILED,
                    unknown.isEmpty() ? "Rows match table definition" : "Columns not in definition: " + unknown,
                    String.valueOf(definition.getColumns().size()), String.valueOf(definition.getColumns().size())));
        }
        return checks;
    }

    private List<VerificationCheck> rowCountChecks(VerificationInput input) {
        List<VerificationCheck> checks = new ArrayList<>();
        for (Map.Entry<String, Long> entry : input.getExpectedRows().entrySet()) {
            String table = entry.getKey();
            long expected = entry.getValue();
            long actual;
            try {
                actual = databaseClient.countRows(input.getDatabase(), table);
            } catch (Exception e) {
                checks.add(check(VerificationCategory.DATA_VALIDATION, "rows:" + table, CheckStatus.FAILED,
                        "Row count failed: " + e.getMessage(), String.valueOf(expected), null));
                continue;
            }
            CheckStatus status;
            String message;
            if (actual == expected) {
                status = CheckStatus.PASSED;
                message = "Row count matches";
            } else if (actual > expected) {
                // Rows kept from before the restore when not overwriting
                status = CheckStatus.WARNING;
                message = "Target holds more rows than were restored";
            } else {
                status = CheckStatus.FAILED;
                message = "Target holds fewer rows than were restored";
            }
            checks.add(check(VerificationCategory.DATA_VALIDATION, "rows:" + table, status, message,
                    String.valueOf(expected), String.valueOf(actual)));
        }
        return checks;
    }

    private List<VerificationCheck> simulatedRowChecks(VerificationInput input) {
        List<VerificationCheck> checks = new ArrayList<>();
        for (Map.Entry<String, Long> entry : input.getExpectedRows().entrySet()) {
            TableData data = input.getPayload().findTableData(entry.getKey());
            long inBackup = data != null ? data.rowCount() : 0;
            checks.add(check(VerificationCategory.DATA_VALIDATION, "rows:" + entry.getKey(),
                    inBackup == entry.getValue() ? CheckStatus.PASSED : CheckStatus.FAILED,
                    "Would restore " + entry.getValue() + " rows",
                    String.valueOf(inBackup), String.valueOf(entry.getValue())));
        }
        return checks;
    }

    private List<VerificationCheck> checksumChecks(VerificationInput input) {
        List<VerificationCheck> checks = new ArrayList<>();
        boolean artifactMatches = input.getExpectedChecksum() != null
                && input.getExpectedChecksum().equals(input.getActualChecksum());
        checks.add(check(VerificationCategory.CHECKSUM, "artifact",
                artifactMatches ? CheckStatus.PASSED : CheckStatus.FAILED,
                artifactMatches ? "Artifact checksum verified" : "Artifact checksum mismatch",
                input.getExpectedChecksum(), input.getActualChecksum()));

        for (FileEntry file : input.getFiles()) {
            if (file.getSha256() == null || file.getContent() == null) {
                checks.add(check(VerificationCategory.CHECKSUM, "file:" + file.getPath(), CheckStatus.WARNING,
                        "No checksum recorded", null, null));
                continue;
            }
            String actual = Checksums.sha256(file.getContent());
            boolean matches = actual.equals(file.getSha256());
            checks.add(check(VerificationCategory.CHECKSUM, "file:" + file.getPath(),
                    matches ? CheckStatus.PASSED : CheckStatus.FAILED,
                    matches ? "File checksum verified" : "File checksum mismatch",
                    file.getSha256(), actual));
        }
        return checks;
    }

    private VerificationCheck connectionCheck(VerificationInput input) {
        boolean connected;
        try {
            connected = databaseClient.testConnection(input.getDatabase());
        } catch (Exception e) {
            connected = false;
        }
        // A simulated restore may target a database that does not exist yet
        CheckStatus failedStatus = input.isSimulated() ? CheckStatus.WARNING : CheckStatus.FAILED;
        return check(VerificationCategory.CONNECTION, "connection:" + input.getDatabase(),
                connected ? CheckStatus.PASSED : failedStatus,
                connected ? "Target database reachable" : "Target database not reachable",
                "reachable", connected ? "reachable" : "unreachable");
    }

    private VerificationCheck check(VerificationCategory category, String name, CheckStatus status,
                                    String message, String expected, String actual) {
        return VerificationCheck.builder()
                .category(category)
                .name(name)
                .status(status)
                .message(message)
                .expected(expected)
                .actual(actual)
                .build();
    }

    /**
     * What a restore wrote, or would have written when simulated.
     */
    @Getter
    @Builder
    public static class VerificationInput {
        private final String database;
        private final BackupPayload payload;
        private final RestoreOptions options;
        @Builder.Default
        private final List<String> tables = new ArrayList<>();
        @Builder.Default
        private final Map<String, Long> expectedRows = new LinkedHashMap<>();
        @Builder.Default
        private final List<FileEntry> files = new ArrayList<>();
        private final String expectedChecksum;
        private final String actualChecksum;
        private final boolean simulated;
    }
}
