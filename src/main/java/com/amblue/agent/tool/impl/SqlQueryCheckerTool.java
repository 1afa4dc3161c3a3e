package com.amblue.agent.tool.impl;

import com.amblue.agent.llm.LlmClient;
import com.amblue.agent.model.Message;
import com.amblue.agent.sql.SqlDatabase;
import com.amblue.agent.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Second opinion on a query before it is run. One plain model call, no tools;
 * the model answers with the (possibly rewritten) query only.
 */
@Component
@Slf4j
public class SqlQueryCheckerTool implements AgentTool {

    private static final String CHECKER_PROMPT = """
            %s
            Double check the %s query above for common mistakes, including:
            - Using NOT IN with NULL values
            - Using UNION when UNION ALL should have been used
            - Using BETWEEN for exclusive ranges
            - Data type mismatch in predicates
            - Properly quoting identifiers
            - Using the correct number of arguments for functions
            - Casting to the correct data type
            - Using the proper columns for joins

            If there are any of the above mistakes, rewrite the query. If there are no mistakes, just reproduce the original query.

            Output the final SQL query only.
            """;

    private final LlmClient llmClient;
    private final SqlDatabase sqlDatabase;

    public SqlQueryCheckerTool(LlmClient llmClient, SqlDatabase sqlDatabase) {
        this.llmClient = llmClient;
        this.sqlDatabase = sqlDatabase;
    }

    @Override
    public String getName() {
        return "sql_db_query_checker";
    }

    @Override
    public String getDescription() {
        return """
                Use this tool to double check if your query is correct before executing it.
                Always use this tool before executing a query with sql_db_query!
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of(
                                "type", "string",
                                "description", "A detailed and SQL query to be checked."
                        )
                ),
                "required", List.of("query")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String query = String.valueOf(arguments.get("query"));
        try {
            String prompt = CHECKER_PROMPT.formatted(query, sqlDatabase.dialect());
            String checked = llmClient.chat(List.of(Message.human(prompt)), List.of()).getContent();
            return checked == null || checked.isBlank() ? query : checked.trim();
        } catch (Exception e) {
            log.warn("Query check failed: {}", e.getMessage());
            return "ERROR: Query check failed: " + e.getMessage();
        }
    }
}
