package com.drautomation.api.service;

import com.drautomation.api.client.DatabaseClient;
import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.model.payload.BackupPayload;
import com.drautomation.api.model.payload.TableData;
import com.drautomation.api.model.payload.TableDefinition;
import com.drautomation.api.util.TemporalValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Writes tables from a backup payload into a target database in fixed-size batches.
 * Shared by real restores and recovery tests.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseRestoreWriter {

    private final DatabaseClient databaseClient;
    private final AutomationProperties properties;

    /**
     * Every table in the payload, schema entries first, in payload order.
     */
    public static List<String> tableNames(BackupPayload payload) {
        Set<String> names = new LinkedHashSet<>();
        payload.getSchema().forEach(t -> names.add(t.getName()));
        payload.getTables().forEach(t -> names.add(t.getTable()));
        return new ArrayList<>(names);
    }

    /**
     * Copy of {@code payload} without rows whose timestamp columns are after {@code pointInTime}.
     * Rows without any parseable timestamp column are kept.
     */
    public static BackupPayload rowsUpTo(BackupPayload payload, Instant pointInTime, List<String> timestampColumns) {
        List<TableData> filtered = new ArrayList<>();
        for (TableData table : payload.getTables()) {
            List<Map<String, Object>> kept = new ArrayList<>();
            for (Map<String, Object> row : table.getRows()) {
                if (!isAfter(row, pointInTime, timestampColumns)) {
                    kept.add(row);
                }
            }
            filtered.add(TableData.builder()
                    .table(table.getTable())
                    .columns(table.getColumns())
                    .rows(kept)
                    .build());
        }
        return BackupPayload.builder()
                .formatVersion(payload.getFormatVersion())
                .backupId(payload.getBackupId())
                .kind(payload.getKind())
                .createdAt(payload.getCreatedAt())
                .sourceDatabase(payload.getSourceDatabase())
                .baseBackupId(payload.getBaseBackupId())
                .changesSince(payload.getChangesSince())
                .schema(payload.getSchema())
                .tables(filtered)
                .files(payload.getFiles())
                .configuration(payload.getConfiguration())
                .build();
    }

    private static boolean isAfter(Map<String, Object> row, Instant pointInTime, List<String> timestampColumns) {
        Map<String, Object> lookup = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        lookup.putAll(row);
        for (String column : timestampColumns) {
            Instant value = TemporalValues.tryParseInstant(lookup.get(column));
            if (value != null && value.isAfter(pointInTime)) {
                return true;
            }
        }
        return false;
    }

    public List<TableDefinition> definitionsFor(BackupPayload payload, Collection<String> tables) {
        List<TableDefinition> definitions = new ArrayList<>();
        for (String table : tables) {
            definitions.add(requireDefinition(payload, table));
        }
        return definitions;
    }

    public void createTables(String database, List<TableDefinition> definitions,
                             boolean dropExisting, boolean withConstraints) {
        databaseClient.applySchema(database, definitions, dropExisting, withConstraints);
        log.info("Created {} tables in {} (dropExisting={}, constraints={})",
                definitions.size(), database, dropExisting, withConstraints);
    }

    /**
     * Inserts the rows of {@code tables}, clearing each table first when {@code clearFirst} is set.
     *
     * @return rows written per table, in write order
     */
    public Map<String, Long> writeRows(String database, BackupPayload payload, Collection<String> tables,
                                       boolean clearFirst) {
        int batchSize = properties.getRestore().getBatchSize();
        Map<String, Long> written = new LinkedHashMap<>();
        for (String table : tables) {
            TableData data = payload.findTableData(table);
            if (data == null) {
                written.put(table, 0L);
                continue;
            }
            TableDefinition definition = requireDefinition(payload, table);
            if (clearFirst) {
                databaseClient.clearTable(database, definition.getName());
            }
            List<Map<String, Object>> rows = data.getRows();
            long count = 0;
            for (int from = 0; from < rows.size(); from += batchSize) {
                List<Map<String, Object>> batch = rows.subList(from, Math.min(from + batchSize, rows.size()));
                count += databaseClient.insertBatch(database, definition, batch);
            }
            written.put(table, count);
            log.debug("Restored {} rows into {}.{}", count, database, definition.getName());
        }
        return written;
    }

    private TableDefinition requireDefinition(BackupPayload payload, String table) {
        TableDefinition definition = payload.findTableDefinition(table);
        if (definition == null) {
            throw AutomationException.integrity(AutomationException.CODE_RESTORE_ERROR,
                    "Backup " + payload.getBackupId() + " has no definition for table " + table);
        }
        return definition;
    }
}
