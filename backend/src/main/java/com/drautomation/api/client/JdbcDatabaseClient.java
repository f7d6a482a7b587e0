package com.drautomation.api.client;

import com.drautomation.api.model.payload.ColumnDefinition;
import com.drautomation.api.model.payload.TableData;
import com.drautomation.api.model.payload.TableDefinition;
import com.drautomation.api.util.ReadOnlyQueries;
import com.drautomation.api.util.TemporalValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import javax.sql.DataSource;

/**
 * {@link DatabaseClient} over the application's data source. Each logical database is a schema.
 * Identifiers are validated and used unquoted so the server applies its own case folding.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcDatabaseClient implements DatabaseClient {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");
    private static final Pattern TYPE_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_ ]{0,62}$");
    private static final int MAX_RENDERED_LENGTH = 10_485_760;
    private static final int CONNECTION_VALID_TIMEOUT_SECONDS = 5;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public boolean testConnection(String database) {
        try {
            Boolean valid = jdbcTemplate.execute((ConnectionCallback<Boolean>) con ->
                    con.isValid(CONNECTION_VALID_TIMEOUT_SECONDS) && findSchema(con, database) != null);
            return Boolean.TRUE.equals(valid);
        } catch (DataAccessException e) {
            log.warn("Connection test failed for {}: {}", database, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean databaseExists(String database) {
        Boolean exists = jdbcTemplate.execute((ConnectionCallback<Boolean>) con -> findSchema(con, database) != null);
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public void createDatabase(String database) {
        jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS " + identifier(database));
        log.info("Created database {}", database);
    }

    @Override
    public void dropDatabase(String database) {
        jdbcTemplate.execute("DROP SCHEMA IF EXISTS " + identifier(database) + " CASCADE");
        log.info("Dropped database {}", database);
    }

    @Override
    public List<String> listTables(String database) {
        return jdbcTemplate.execute((ConnectionCallback<List<String>>) con -> {
            String schema = requireSchema(con, database);
            List<String> tables = new ArrayList<>();
            try (ResultSet rs = con.getMetaData().getTables(null, schema, "%", new String[]{"TABLE"})) {
                while (rs.next()) {
                    tables.add(rs.getString("TABLE_NAME"));
                }
            }
            tables.sort(String.CASE_INSENSITIVE_ORDER);
            return tables;
        });
    }

    @Override
    public List<TableDefinition> exportSchema(String database) {
        return jdbcTemplate.execute((ConnectionCallback<List<TableDefinition>>) con -> {
            String schema = requireSchema(con, database);
            DatabaseMetaData metaData = con.getMetaData();
            List<TableDefinition> definitions = new ArrayList<>();
            for (String table : tableNames(metaData, schema)) {
                definitions.add(describeTable(metaData, schema, table));
            }
            return definitions;
        });
    }

    @Override
    public List<TableData> exportTables(String database, Collection<String> tables) {
        List<TableData> result = new ArrayList<>();
        for (String table : tables) {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                    "SELECT * FROM " + qualified(database, table));
            result.add(toTableData(table, rows));
        }
        return result;
    }

    @Override
    public List<TableData> exportChangesSince(String database, Instant since, List<String> timestampColumns) {
        List<TableData> result = new ArrayList<>();
        for (TableDefinition definition : exportSchema(database)) {
            List<String> present = timestampColumns.stream()
                    .map(definition::findColumn)
                    .filter(c -> c != null)
                    .map(ColumnDefinition::getName)
                    .collect(Collectors.toList());

            String sql = "SELECT * FROM " + qualified(database, definition.getName());
            List<Map<String, Object>> rows;
            if (present.isEmpty()) {
                rows = jdbcTemplate.queryForList(sql);
            } else {
                String where = present.stream()
                        .map(c -> identifier(c) + " > ?")
                        .collect(Collectors.joining(" OR "));
                Object[] args = present.stream().map(c -> Timestamp.from(since)).toArray();
                rows = jdbcTemplate.queryForList(sql + " WHERE " + where, args);
            }
            result.add(toTableData(definition.getName(), rows));
        }
        return result;
    }

    @Override
    public void applySchema(String database, List<TableDefinition> tables, boolean dropExisting, boolean withConstraints) {
        for (TableDefinition table : tables) {
            String name = qualified(database, table.getName());
            if (dropExisting) {
                jdbcTemplate.execute("DROP TABLE IF EXISTS " + name + " CASCADE");
            }
            jdbcTemplate.execute(createTableSql(name, table, withConstraints));
            log.debug("Applied table {}", name);
        }
    }

    @Override
    public void clearTable(String database, String table) {
        jdbcTemplate.execute("DELETE FROM " + qualified(database, table));
    }

    @Override
    public int insertBatch(String database, TableDefinition definition, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        List<ColumnDefinition> columns = definition.getColumns();
        String columnList = columns.stream()
                .map(c -> identifier(c.getName()))
                .collect(Collectors.joining(", "));
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + qualified(database, definition.getName())
                + " (" + columnList + ") VALUES (" + placeholders + ")";

        int[] argTypes = columns.stream().mapToInt(ColumnDefinition::getJdbcType).toArray();
        List<Object[]> batchArgs = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> lookup = caseInsensitive(row);
            Object[] args = new Object[columns.size()];
            for (int i = 0; i < columns.size(); i++) {
                ColumnDefinition column = columns.get(i);
                args[i] = toJdbcValue(lookup.get(column.getName()), column.getJdbcType());
            }
            batchArgs.add(args);
        }

        int inserted = 0;
        for (int count : jdbcTemplate.batchUpdate(sql, batchArgs, argTypes)) {
            inserted += count == Statement.SUCCESS_NO_INFO ? 1 : count;
        }
        return inserted;
    }

    @Override
    public long countRows(String database, String table) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + qualified(database, table), Long.class);
        return count != null ? count : 0;
    }

    @Override
    public long runQuery(String database, String sql) {
        ReadOnlyQueries.requireReadOnlySelect(sql);
        return executeReadOnly(database, sql);
    }

    /**
     * Runs {@code sql} on a dedicated read-only connection whose transaction is always rolled back,
     * so nothing it does outlives the call.
     */
    long executeReadOnly(String database, String sql) {
        DataSource dataSource = jdbcTemplate.getDataSource();
        if (dataSource == null) {
            throw new IllegalStateException("No data source configured");
        }
        try (Connection con = dataSource.getConnection()) {
            String schema = requireSchema(con, database);
            con.setReadOnly(true);
            con.setAutoCommit(false);
            try {
                con.setSchema(schema);
                return firstValueOrRowCount(con, sql);
            } finally {
                con.rollback();
            }
        } catch (SQLException e) {
            DataAccessException translated = jdbcTemplate.getExceptionTranslator().translate("runQuery", sql, e);
            throw translated != null ? translated : new UncategorizedSQLException("runQuery", sql, e);
        }
    }

    private long firstValueOrRowCount(Connection con, String sql) throws SQLException {
        try (Statement statement = con.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            long rows = 0;
            Object firstValue = null;
            int columnCount = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                if (rows == 0) {
                    firstValue = rs.getObject(1);
                }
                rows++;
            }
            if (rows == 1 && columnCount == 1 && firstValue instanceof Number) {
                return ((Number) firstValue).longValue();
            }
            return rows;
        }
    }

    private List<String> tableNames(DatabaseMetaData metaData, String schema) throws SQLException {
        List<String> tables = new ArrayList<>();
        try (ResultSet rs = metaData.getTables(null, schema, "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                tables.add(rs.getString("TABLE_NAME"));
            }
        }
        tables.sort(String.CASE_INSENSITIVE_ORDER);
        return tables;
    }

    private TableDefinition describeTable(DatabaseMetaData metaData, String schema, String table) throws SQLException {
        List<ColumnDefinition> columns = new ArrayList<>();
        try (ResultSet rs = metaData.getColumns(null, schema, table, "%")) {
            while (rs.next()) {
                int size = rs.getInt("COLUMN_SIZE");
                Integer columnSize = rs.wasNull() ? null : size;
                int digits = rs.getInt("DECIMAL_DIGITS");
                Integer scale = rs.wasNull() ? null : digits;
                columns.add(ColumnDefinition.builder()
                        .name(rs.getString("COLUMN_NAME"))
                        .typeName(rs.getString("TYPE_NAME"))
                        .jdbcType(rs.getInt("DATA_TYPE"))
                        .size(columnSize)
                        .scale(scale)
                        .nullable(rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls)
                        .build());
            }
        }

        Map<Short, String> keyColumns = new TreeMap<>();
        try (ResultSet rs = metaData.getPrimaryKeys(null, schema, table)) {
            while (rs.next()) {
                keyColumns.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }

        return TableDefinition.builder()
                .name(table)
                .columns(columns)
                .primaryKey(new ArrayList<>(keyColumns.values()))
                .build();
    }

    private String createTableSql(String qualifiedName, TableDefinition table, boolean withConstraints) {
        List<String> parts = new ArrayList<>();
        for (ColumnDefinition column : table.getColumns()) {
            String part = identifier(column.getName()) + " " + renderType(column);
            if (withConstraints && !column.isNullable()) {
                part += " NOT NULL";
            }
            parts.add(part);
        }
        if (withConstraints && !table.getPrimaryKey().isEmpty()) {
            parts.add("PRIMARY KEY (" + table.getPrimaryKey().stream()
                    .map(this::identifier)
                    .collect(Collectors.joining(", ")) + ")");
        }
        return "CREATE TABLE IF NOT EXISTS " + qualifiedName + " (" + String.join(", ", parts) + ")";
    }

    private String renderType(ColumnDefinition column) {
        String typeName = column.getTypeName();
        if (typeName == null || !TYPE_NAME.matcher(typeName).matches()) {
            throw new IllegalArgumentException("Unsupported column type for " + column.getName() + ": " + typeName);
        }
        Integer size = column.getSize();
        switch (column.getJdbcType()) {
            case Types.VARCHAR, Types.CHAR, Types.NVARCHAR, Types.NCHAR -> {
                if (size != null && size > 0 && size < MAX_RENDERED_LENGTH) {
                    return typeName + "(" + size + ")";
                }
            }
            case Types.NUMERIC, Types.DECIMAL -> {
                if (size != null && size > 0 && size <= 1000) {
                    int scale = column.getScale() != null ? column.getScale() : 0;
                    return typeName + "(" + size + ", " + scale + ")";
                }
            }
            default -> {
            }
        }
        return typeName;
    }

    private TableData toTableData(String table, List<Map<String, Object>> rows) {
        List<Map<String, Object>> normalized = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>();
            row.forEach((column, value) -> copy.put(column, normalize(value)));
            normalized.add(copy);
        }
        List<String> columns = normalized.isEmpty() ? new ArrayList<>() : new ArrayList<>(normalized.get(0).keySet());
        return TableData.builder()
                .table(table)
                .columns(columns)
                .rows(normalized)
                .build();
    }

    /**
     * Converts driver values into JSON-friendly ones. Temporal values become ISO-8601 strings.
     */
    static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant().toString();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().toString();
        }
        if (value instanceof Time) {
            return ((Time) value).toLocalTime().toString();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant().toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof byte[]) {
            return Base64.getEncoder().encodeToString((byte[]) value);
        }
        return value.toString();
    }

    static Object toJdbcValue(Object value, int jdbcType) {
        if (value == null) {
            return null;
        }
        return switch (jdbcType) {
            case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> value instanceof String
                    ? Timestamp.from(TemporalValues.parseInstant((String) value)) : value;
            case Types.DATE -> value instanceof String ? java.sql.Date.valueOf(LocalDate.parse((String) value)) : value;
            case Types.TIME, Types.TIME_WITH_TIMEZONE -> value instanceof String
                    ? Time.valueOf(LocalTime.parse((String) value)) : value;
            case Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY, Types.BLOB -> value instanceof String
                    ? Base64.getDecoder().decode((String) value) : value;
            case Types.NUMERIC, Types.DECIMAL -> new BigDecimal(value.toString());
            case Types.BIGINT -> value instanceof Number ? ((Number) value).longValue() : Long.parseLong(value.toString());
            case Types.INTEGER, Types.SMALLINT, Types.TINYINT -> value instanceof Number
                    ? ((Number) value).intValue() : Integer.parseInt(value.toString());
            case Types.DOUBLE, Types.FLOAT, Types.REAL -> value instanceof Number
                    ? ((Number) value).doubleValue() : Double.parseDouble(value.toString());
            case Types.BOOLEAN, Types.BIT -> value instanceof Boolean ? value : Boolean.parseBoolean(value.toString());
            default -> value;
        };
    }

    private Map<String, Object> caseInsensitive(Map<String, Object> row) {
        Map<String, Object> lookup = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        lookup.putAll(row);
        return lookup;
    }

    private String findSchema(Connection con, String database) throws SQLException {
        try (ResultSet rs = con.getMetaData().getSchemas()) {
            while (rs.next()) {
                String schema = rs.getString("TABLE_SCHEM");
                if (schema.equalsIgnoreCase(database)) {
                    return schema;
                }
            }
        }
        return null;
    }

    private String requireSchema(Connection con, String database) throws SQLException {
        String schema = findSchema(con, identifier(database));
        if (schema == null) {
            throw new IllegalArgumentException("Database not found: " + database);
        }
        return schema;
    }

    private String qualified(String database, String table) {
        return identifier(database) + "." + identifier(table);
    }

    private String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid identifier: " + name);
        }
        return name;
    }
}
