package com.amblue.agent.tool.impl;

import com.amblue.agent.sql.SqlDatabase;
import com.amblue.agent.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Describes tables the model is about to query: column names and types,
 * primary key, and a handful of sample rows.
 */
@Component
@Slf4j
public class TableSchemaTool implements AgentTool {

    private final SqlDatabase sqlDatabase;

    public TableSchemaTool(SqlDatabase sqlDatabase) {
        this.sqlDatabase = sqlDatabase;
    }

    @Override
    public String getName() {
        return "sql_db_schema";
    }

    @Override
    public String getDescription() {
        return """
                Input to this tool is a comma-separated list of tables, output is the schema and sample rows for those tables.
                Be sure that the tables actually exist by calling sql_db_list_tables first!
                Example Input: table1, table2, table3
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "table_names", Map.of(
                                "type", "string",
                                "description", "A comma-separated list of the table names for which to return the schema. " +
                                               "Example input: 'table1, table2, table3'"
                        )
                ),
                "required", List.of("table_names")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String raw = String.valueOf(arguments.get("table_names"));
        List<String> tables = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .toList();

        if (tables.isEmpty()) {
            return "ERROR: 'table_names' must name at least one table";
        }

        try {
            return sqlDatabase.describeTables(tables);
        } catch (IllegalArgumentException e) {
            return "ERROR: " + e.getMessage();
        } catch (Exception e) {
            log.error("Describing tables {} failed", tables, e);
            return "ERROR: Could not read schema: " + e.getMessage();
        }
    }
}
