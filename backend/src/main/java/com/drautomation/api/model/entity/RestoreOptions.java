package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.RestoreKind;
import com.drautomation.api.util.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * What a restore writes and where. Phase toggles default to schema, data and files on,
 * configuration off; all verification categories on.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class RestoreOptions {

    @Enumerated(EnumType.STRING)
    @Column(name = "restore_kind", nullable = false, length = 20)
    @Builder.Default
    private RestoreKind kind = RestoreKind.COMPLETE;

    @Column(name = "target_database", length = 100)
    private String targetDatabase;

    @Column(name = "target_location", length = 200)
    private String targetLocation;

    @Column(name = "overwrite_existing")
    private boolean overwriteExisting;

    @Column(name = "restore_schema")
    @Builder.Default
    private boolean restoreSchema = true;

    @Column(name = "restore_data")
    @Builder.Default
    private boolean restoreData = true;

    @Column(name = "restore_files")
    @Builder.Default
    private boolean restoreFiles = true;

    @Column(name = "restore_configuration")
    private boolean restoreConfiguration;

    @Column(name = "point_in_time")
    private Instant pointInTime;

    @Convert(converter = StringListConverter.class)
    @Column(name = "table_filters", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> tableFilters = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "excluded_tables", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> excludedTables = new ArrayList<>();

    @Column(name = "verify_integrity")
    @Builder.Default
    private boolean verifyIntegrity = true;

    @Column(name = "validate_data")
    @Builder.Default
    private boolean validateData = true;

    @Column(name = "compare_checksums")
    @Builder.Default
    private boolean compareChecksums = true;

    @Column(name = "test_connections")
    @Builder.Default
    private boolean testConnections = true;

    public boolean anyVerificationEnabled() {
        return verifyIntegrity || validateData || compareChecksums || testConnections;
    }
}
