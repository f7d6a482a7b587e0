package com.drautomation.api.client;

import com.drautomation.api.model.payload.TableData;
import com.drautomation.api.model.payload.TableDefinition;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Access to the databases being backed up and restored. A "database" is addressed by name;
 * the JDBC adapter maps it to a schema of the configured data source.
 */
public interface DatabaseClient {

    boolean testConnection(String database);

    boolean databaseExists(String database);

    void createDatabase(String database);

    void dropDatabase(String database);

    List<String> listTables(String database);

    List<TableDefinition> exportSchema(String database);

    List<TableData> exportTables(String database, Collection<String> tables);

    /**
     * Rows of every table having at least one of {@code timestampColumns} after {@code since}.
     * Tables without any such column are exported whole.
     */
    List<TableData> exportChangesSince(String database, Instant since, List<String> timestampColumns);

    /**
     * Create the given tables, dropping existing ones first when {@code dropExisting} is set.
     * Primary keys are only created when {@code withConstraints} is set.
     */
    void applySchema(String database, List<TableDefinition> tables, boolean dropExisting, boolean withConstraints);

    void clearTable(String database, String table);

    int insertBatch(String database, TableDefinition definition, List<Map<String, Object>> rows);

    long countRows(String database, String table);

    /**
     * Runs a read-only query with {@code database} as the default schema.
     *
     * @return the single numeric value for a one-cell result, otherwise the number of rows returned
     */
    long runQuery(String database, String sql);
}
