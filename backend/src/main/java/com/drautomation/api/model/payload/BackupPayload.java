package com.drautomation.api.model.payload;

import com.drautomation.api.model.enums.BackupKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content of a backup artifact before serialization, compression and encryption.
 * Sections not covered by the backup kind stay empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupPayload {

    public static final int FORMAT_VERSION = 1;

    @Builder.Default
    private int formatVersion = FORMAT_VERSION;
    private String backupId;
    private BackupKind kind;
    private Instant createdAt;
    private String sourceDatabase;

    // Incremental and differential payloads carry changes since this backup
    private String baseBackupId;
    private Instant changesSince;

    @Builder.Default
    private List<TableDefinition> schema = new ArrayList<>();
    @Builder.Default
    private List<TableData> tables = new ArrayList<>();
    @Builder.Default
    private List<FileEntry> files = new ArrayList<>();
    @Builder.Default
    private Map<String, String> configuration = new LinkedHashMap<>();

    public long totalRowCount() {
        return tables.stream().mapToLong(TableData::rowCount).sum();
    }

    public TableDefinition findTableDefinition(String name) {
        return schema.stream()
                .filter(t -> t.getName().equalsIgnoreCase(name))
                .findFirst()
                .orElse(null);
    }

    public TableData findTableData(String name) {
        return tables.stream()
                .filter(t -> t.getTable().equalsIgnoreCase(name))
                .findFirst()
                .orElse(null);
    }
}
