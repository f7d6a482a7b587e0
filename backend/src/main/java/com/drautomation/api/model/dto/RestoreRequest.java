package com.drautomation.api.model.dto;

import com.drautomation.api.model.entity.RestoreOptions;
import com.drautomation.api.model.enums.RestoreKind;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreRequest {

    @NotBlank(message = "Backup id is required")
    private String backupId;

    @Builder.Default
    private RestoreKind kind = RestoreKind.COMPLETE;

    /**
     * Database the restore writes into. Defaults to automation.restore.target-database.
     */
    private String targetDatabase;

    /**
     * Clone restores only: explicit clone target. Defaults to {@code <targetDatabase>_clone}.
     */
    private String targetLocation;

    private boolean overwriteExisting;

    @Builder.Default
    private boolean restoreSchema = true;
    @Builder.Default
    private boolean restoreData = true;
    @Builder.Default
    private boolean restoreFiles = true;
    private boolean restoreConfiguration;

    /**
     * Required for POINT_IN_TIME restores.
     */
    private Instant pointInTime;

    @Builder.Default
    private List<String> tableFilters = new ArrayList<>();
    @Builder.Default
    private List<String> excludedTables = new ArrayList<>();

    @Builder.Default
    private boolean verifyIntegrity = true;
    @Builder.Default
    private boolean validateData = true;
    @Builder.Default
    private boolean compareChecksums = true;
    @Builder.Default
    private boolean testConnections = true;

    @AssertTrue(message = "pointInTime is required for POINT_IN_TIME restores")
    public boolean isPointInTimeValid() {
        return kind != RestoreKind.POINT_IN_TIME || pointInTime != null;
    }

    @AssertTrue(message = "tableFilters must list at least one table for PARTIAL restores")
    public boolean isPartialValid() {
        return kind != RestoreKind.PARTIAL || (tableFilters != null && !tableFilters.isEmpty());
    }

    public RestoreOptions toOptions() {
        return RestoreOptions.builder()
                .kind(kind != null ? kind : RestoreKind.COMPLETE)
                .targetDatabase(targetDatabase)
                .targetLocation(targetLocation)
                .overwriteExisting(overwriteExisting)
                .restoreSchema(restoreSchema)
                .restoreData(restoreData)
                .restoreFiles(restoreFiles)
                .restoreConfiguration(restoreConfiguration)
                .pointInTime(pointInTime)
                .tableFilters(tableFilters != null ? new ArrayList<>(tableFilters) : new ArrayList<>())
                .excludedTables(excludedTables != null ? new ArrayList<>(excludedTables) : new ArrayList<>())
                .verifyIntegrity(verifyIntegrity)
                .validateData(validateData)
                .compareChecksums(compareChecksums)
                .testConnections(testConnections)
                .build();
    }
}
