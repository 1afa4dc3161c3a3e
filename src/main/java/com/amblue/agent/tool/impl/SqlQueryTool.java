package com.amblue.agent.tool.impl;

import com.amblue.agent.config.ToolProperties;
import com.amblue.agent.sql.QueryResult;
import com.amblue.agent.sql.ReadOnlySqlPolicy;
import com.amblue.agent.sql.SqlDatabase;
import com.amblue.agent.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a single read-only query and returns the rows as a text table.
 *
 * Layers:
 * 1. {@link ReadOnlySqlPolicy} screens the statement. Anything with write intent
 *    comes back as POLICY_VIOLATION and never reaches the database.
 * 2. The query runs in a read-only transaction that is always rolled back.
 * 3. Row cap and query timeout from tools.sql.
 * 4. Long cells are cut so a single blob column cannot flood the context window.
 */
@Component
@Slf4j
public class SqlQueryTool implements AgentTool {

    static final String POLICY_VIOLATION = "POLICY_VIOLATION: ";

    private final SqlDatabase sqlDatabase;
    private final ToolProperties toolProperties;

    public SqlQueryTool(SqlDatabase sqlDatabase, ToolProperties toolProperties) {
        this.sqlDatabase = sqlDatabase;
        this.toolProperties = toolProperties;
    }

    @Override
    public String getName() {
        return "sql_db_query";
    }

    @Override
    public String getDescription() {
        return """
                Input to this tool is a detailed and correct SQL query, output is a result from the database.
                Only read-only SELECT (or WITH ... SELECT) queries are accepted.
                If the query is not correct, an error message will be returned. If an error is returned,
                rewrite the query, check the query, and try again. If you encounter an issue with
                unknown column names, use sql_db_schema to query the correct table fields.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of(
                                "type", "string",
                                "description", "A detailed and correct SQL query."
                        )
                ),
                "required", List.of("query")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String sql = String.valueOf(arguments.get("query")).trim();

        Optional<String> violation = ReadOnlySqlPolicy.findViolation(sql);
        if (violation.isPresent()) {
            log.warn("Rejected SQL [{}]: {}", violation.get(), sql);
            return POLICY_VIOLATION + "Statement rejected, " + violation.get() +
                   ". Only read-only SELECT queries may be run.";
        }

        try {
            QueryResult result = sqlDatabase.runQuery(sql);
            if (result.isEmpty()) {
                return "Query returned 0 rows.";
            }
            return format(result);
        } catch (Exception e) {
            Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
            log.warn("SQL query failed: {}: {}", sql, cause.getMessage());
            return "ERROR: Query execution failed: " + cause.getMessage();
        }
    }

    private String format(QueryResult result) {
        int maxCell = toolProperties.getSql().getMaxCellLength();
        List<String> columns = result.columns();

        List<List<String>> cells = new ArrayList<>();
        for (List<Object> row : result.rows()) {
            List<String> line = new ArrayList<>(row.size());
            for (Object value : row) {
                String cell = value == null ? "NULL" : value.toString().replace('\n', ' ');
                if (cell.length() > maxCell) cell = cell.substring(0, Math.max(0, maxCell - 3)) + "...";
                line.add(cell);
            }
            cells.add(line);
        }

        int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = columns.get(c).length();
            for (List<String> line : cells) {
                widths[c] = Math.max(widths[c], line.get(c).length());
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int c = 0; c < columns.size(); c++) {
            sb.append(pad(columns.get(c), widths[c])).append(" | ");
        }
        sb.append("\n");
        for (int width : widths) {
            sb.append("-".repeat(width)).append("-+-");
        }
        sb.append("\n");
        for (List<String> line : cells) {
            for (int c = 0; c < line.size(); c++) {
                sb.append(pad(line.get(c), widths[c])).append(" | ");
            }
            sb.append("\n");
        }

        sb.append("\n").append(result.rows().size()).append(" row(s) returned.");
        if (result.truncated()) {
            sb.append(" Result truncated at ").append(result.rows().size())
              .append(" rows; add filters or aggregation to narrow it down.");
        }
        return sb.toString();
    }

    private String pad(String s, int width) {
        return s + " ".repeat(width - s.length());
    }
}
