package com.amblue.agent.sql;

import com.amblue.agent.config.ToolProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The SQL toolkit behind the sql_db_* tools: table listing, schema description
 * and read-only query execution against the configured DataSource.
 *
 * Schema introspection goes through JDBC DatabaseMetaData so it works the same
 * on PostgreSQL (production) and H2 (tests). Queries run in a read-only
 * transaction that is rolled back, with a row cap and a timeout. Statement screening happens in the
 * query tool before anything reaches this class.
 */
@Component
@Slf4j
public class SqlDatabase {

    private static final Set<String> SYSTEM_SCHEMAS =
            Set.of("INFORMATION_SCHEMA", "PG_CATALOG", "SYS", "SYSTEM_LOBS");

    private final JdbcTemplate jdbcTemplate;
    private final ToolProperties toolProperties;

    public SqlDatabase(JdbcTemplate jdbcTemplate, ToolProperties toolProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.toolProperties = toolProperties;
    }

    /**
     * Usable table names, sorted, after the include/ignore lists are applied.
     */
    public List<String> listTables() {
        List<String> all = jdbcTemplate.execute((ConnectionCallback<List<String>>) con -> {
            DatabaseMetaData meta = con.getMetaData();
            Set<String> names = new TreeSet<>();
            try (ResultSet rs = meta.getTables(null, schemaPattern(), "%", null)) {
                while (rs.next()) {
                    if (isUserTable(rs.getString("TABLE_TYPE"), rs.getString("TABLE_SCHEM"))) {
                        names.add(rs.getString("TABLE_NAME"));
                    }
                }
            }
            return new ArrayList<>(names);
        });

        ToolProperties.Sql sql = toolProperties.getSql();
        List<String> include = lower(sql.getIncludeTableList());
        List<String> ignore = lower(sql.getIgnoreTableList());

        return all == null ? List.of() : all.stream()
                .filter(t -> include.isEmpty() || include.contains(t.toLowerCase(Locale.ROOT)))
                .filter(t -> !ignore.contains(t.toLowerCase(Locale.ROOT)))
                .toList();
    }

    /**
     * CREATE TABLE style description plus a few sample rows per table.
     *
     * @throws IllegalArgumentException when any requested table is not a usable table
     */
    public String describeTables(List<String> requested) {
        Map<String, String> known = new LinkedHashMap<>();
        listTables().forEach(t -> known.put(t.toLowerCase(Locale.ROOT), t));

        List<String> missing = new ArrayList<>();
        List<String> resolved = new ArrayList<>();
        for (String name : requested) {
            String actual = known.get(name.trim().toLowerCase(Locale.ROOT));
            if (actual == null) missing.add(name.trim());
            else if (!resolved.contains(actual)) resolved.add(actual);
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("table_names " + missing + " not found in database");
        }

        return jdbcTemplate.execute((ConnectionCallback<String>) con -> {
            StringBuilder sb = new StringBuilder();
            for (String table : resolved) {
                if (!sb.isEmpty()) sb.append("\n\n");
                sb.append(createTableStatement(con, table));
                appendSampleRows(con, table, sb);
            }
            return sb.toString();
        });
    }

    /**
     * Runs one query inside a read-only transaction that is always rolled back,
     * so nothing it does is committed even where the driver treats the read-only
     * flag as a hint. At most maxResultRows rows are kept.
     */
    public QueryResult runQuery(String sql) {
        ToolProperties.Sql props = toolProperties.getSql();
        int maxRows = props.getMaxResultRows();

        return jdbcTemplate.execute((ConnectionCallback<QueryResult>) con -> {
            boolean wasAutoCommit = con.getAutoCommit();
            boolean wasReadOnly = con.isReadOnly();
            con.setAutoCommit(false);
            con.setReadOnly(true);
            try (Statement st = con.createStatement()) {
                st.setMaxRows(maxRows + 1);
                st.setQueryTimeout(props.getQueryTimeoutSeconds());
                try (ResultSet rs = st.executeQuery(sql)) {
                    return readAll(rs, maxRows);
                }
            } finally {
                con.rollback();
                con.setReadOnly(wasReadOnly);
                con.setAutoCommit(wasAutoCommit);
            }
        });
    }

    /** Product name of the connected database, e.g. "PostgreSQL". */
    public String dialect() {
        String name = jdbcTemplate.execute(
                (ConnectionCallback<String>) con -> con.getMetaData().getDatabaseProductName());
        return name != null ? name : "SQL";
    }

    private String createTableStatement(Connection con, String table) throws SQLException {
        DatabaseMetaData meta = con.getMetaData();
        List<String> columnLines = new ArrayList<>();

        try (ResultSet rs = meta.getColumns(null, schemaPattern(), table, "%")) {
            while (rs.next()) {
                String line = "\t" + rs.getString("COLUMN_NAME") + " " + rs.getString("TYPE_NAME");
                if (rs.getInt("NULLABLE") == DatabaseMetaData.columnNoNulls) {
                    line += " NOT NULL";
                }
                columnLines.add(line);
            }
        }

        List<String> keyColumns = new ArrayList<>();
        try (ResultSet rs = meta.getPrimaryKeys(null, schemaPattern(), table)) {
            while (rs.next()) {
                keyColumns.add(rs.getString("COLUMN_NAME"));
            }
        }
        if (!keyColumns.isEmpty()) {
            columnLines.add("\tPRIMARY KEY (" + String.join(", ", keyColumns) + ")");
        }

        return "CREATE TABLE " + table + " (\n" + String.join(", \n", columnLines) + "\n)";
    }

    private void appendSampleRows(Connection con, String table, StringBuilder sb) {
        int sampleRows = toolProperties.getSql().getSampleRowsInTableInfo();
        if (sampleRows <= 0) return;

        try (Statement st = con.createStatement()) {
            st.setMaxRows(sampleRows);
            try (ResultSet rs = st.executeQuery("SELECT * FROM " + qualifiedName(con, table))) {
                QueryResult sample = readAll(rs, sampleRows);
                sb.append("\n\n/*\n").append(sampleRows).append(" rows from ").append(table).append(" table:\n");
                sb.append(String.join("\t", sample.columns())).append("\n");
                for (List<Object> row : sample.rows()) {
                    sb.append(String.join("\t", row.stream().map(SqlDatabase::cell).toList())).append("\n");
                }
                sb.append("*/");
            }
        } catch (SQLException e) {
            log.warn("Could not read sample rows from {}: {}", table, e.getMessage());
        }
    }

    private QueryResult readAll(ResultSet rs, int maxRows) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int count = md.getColumnCount();

        List<String> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(md.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (rows.size() == maxRows) {
                truncated = true;
                break;
            }
            List<Object> row = new ArrayList<>(count);
            for (int i = 1; i <= count; i++) {
                row.add(rs.getObject(i));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows, truncated);
    }

    private String qualifiedName(Connection con, String table) throws SQLException {
        String quote = con.getMetaData().getIdentifierQuoteString();
        if (quote == null || quote.isBlank()) quote = "";
        String quotedTable = quote + table.replace(quote.isEmpty() ? "\0" : quote, quote + quote) + quote;
        String schema = schemaPattern();
        return schema == null ? quotedTable : quote + schema + quote + "." + quotedTable;
    }

    private String schemaPattern() {
        String schema = toolProperties.getSql().getSchema();
        return schema == null || schema.isBlank() ? null : schema;
    }

    private boolean isUserTable(String type, String schema) {
        if (type == null) return false;
        String upperType = type.toUpperCase(Locale.ROOT);
        if (!upperType.contains("TABLE") || upperType.contains("SYSTEM")) return false;
        return schema == null || !SYSTEM_SCHEMAS.contains(schema.toUpperCase(Locale.ROOT));
    }

    private static List<String> lower(List<String> names) {
        return names.stream().map(n -> n.toLowerCase(Locale.ROOT)).toList();
    }

    static String cell(Object value) {
        return value == null ? "NULL" : value.toString();
    }
}
