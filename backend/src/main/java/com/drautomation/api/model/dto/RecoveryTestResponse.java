package com.drautomation.api.model.dto;

import com.drautomation.api.model.entity.RecoveryTest;
import com.drautomation.api.model.entity.TestIssue;
import com.drautomation.api.model.entity.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class RecoveryTestResponse {

    private String id;
    private String backupId;
    private String testType;
    private String status;
    private boolean restoreSuccessful;
    private long restoreTimeMs;
    private long validationTimeMs;
    private long totalTimeMs;
    private int integrityScore;
    private List<ValidationResult> validationResults;
    private List<TestIssue> issues;
    private long restoredBackupSize;
    private long restoredRecordCount;
    private int restoredTableCount;
    private boolean archived;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public static RecoveryTestResponse fromEntity(RecoveryTest test) {
        return RecoveryTestResponse.builder()
                .id(test.getId())
                .backupId(test.getBackupId())
                .testType(test.getTestType().name())
                .status(test.getStatus().name())
                .restoreSuccessful(test.isRestoreSuccessful())
                .restoreTimeMs(test.getRestoreTimeMs())
                .validationTimeMs(test.getValidationTimeMs())
                .totalTimeMs(test.getTotalTimeMs())
                .integrityScore(test.getIntegrityScore())
                .validationResults(test.getValidationResults())
                .issues(test.getIssues())
                .restoredBackupSize(test.getRestoredBackupSize())
                .restoredRecordCount(test.getRestoredRecordCount())
                .restoredTableCount(test.getRestoredTableCount())
                .archived(test.isArchived())
                .createdAt(test.getCreatedAt())
                .startedAt(test.getStartedAt())
                .completedAt(test.getCompletedAt())
                .build();
    }
}
