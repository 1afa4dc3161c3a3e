package com.amblue.agent.tool.impl;

import com.amblue.agent.sql.SqlDatabase;
import com.amblue.agent.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class ListTablesTool implements AgentTool {

    private final SqlDatabase sqlDatabase;

    public ListTablesTool(SqlDatabase sqlDatabase) {
        this.sqlDatabase = sqlDatabase;
    }

    @Override
    public String getName() {
        return "sql_db_list_tables";
    }

    @Override
    public String getDescription() {
        return "Input is an empty string, output is a comma-separated list of tables in the database.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "tool_input", Map.of(
                                "type", "string",
                                "description", "An empty string"
                        )
                )
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            List<String> tables = sqlDatabase.listTables();
            if (tables.isEmpty()) {
                return "No tables found.";
            }
            return String.join(", ", tables);
        } catch (Exception e) {
            log.error("Listing tables failed", e);
            return "ERROR: Could not list tables: " + e.getMessage();
        }
    }
}
