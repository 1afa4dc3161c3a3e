package com.amblue.agent.tool.impl;

import com.amblue.agent.config.ToolProperties;
import com.amblue.agent.sql.QueryResult;
import com.amblue.agent.sql.SqlDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SqlQueryToolTest {

    private SqlDatabase sqlDatabase;
    private ToolProperties props;
    private SqlQueryTool tool;

    @BeforeEach
    void setUp() {
        sqlDatabase = mock(SqlDatabase.class);
        props = new ToolProperties();
        tool = new SqlQueryTool(sqlDatabase, props);
    }

    @Test
    void execute_deleteStatement_returnsPolicyViolationWithoutTouchingDatabase() {
        String result = tool.execute(Map.of("query", "DELETE FROM resources"));

        assertThat(result).startsWith(SqlQueryTool.POLICY_VIOLATION).contains("DELETE");
        verify(sqlDatabase, never()).runQuery(any());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "INSERT INTO resources VALUES (1)",
            "update resources set cost = 0",
            "DROP TABLE resources",
            "ALTER TABLE resources DROP COLUMN cost",
            "SELECT 1; DELETE FROM resources"
    })
    void execute_writeStatements_areRejected(String sql) {
        assertThat(tool.execute(Map.of("query", sql))).startsWith("POLICY_VIOLATION:");
        verify(sqlDatabase, never()).runQuery(anyString());
    }

    @Test
    void execute_select_formatsRowsAsTable() {
        when(sqlDatabase.runQuery("SELECT name, cost FROM resources")).thenReturn(new QueryResult(
                List.of("name", "cost"),
                List.of(List.of("vm-east", 10.5), Arrays.asList("storage", null)),
                false));

        String result = tool.execute(Map.of("query", "SELECT name, cost FROM resources"));

        assertThat(result)
                .contains("name    | cost")
                .contains("vm-east | 10.5")
                .contains("storage | NULL")
                .contains("2 row(s) returned.")
                .doesNotContain("truncated");
    }

    @Test
    void execute_truncatedResult_saysSo() {
        when(sqlDatabase.runQuery(anyString())).thenReturn(new QueryResult(
                List.of("id"), List.of(List.of(1), List.of(2)), true));

        assertThat(tool.execute(Map.of("query", "SELECT id FROM resources")))
                .contains("Result truncated at 2 rows");
    }

    @Test
    void execute_longCell_isCut() {
        props.getSql().setMaxCellLength(10);
        when(sqlDatabase.runQuery(anyString())).thenReturn(new QueryResult(
                List.of("notes"), List.of(List.of("x".repeat(50))), false));

        String result = tool.execute(Map.of("query", "SELECT notes FROM resources"));

        assertThat(result).contains("xxxxxxx...").doesNotContain("x".repeat(11));
    }

    @Test
    void execute_emptyResult_returnsZeroRows() {
        when(sqlDatabase.runQuery(anyString())).thenReturn(new QueryResult(List.of("id"), List.of(), false));

        assertThat(tool.execute(Map.of("query", "SELECT id FROM resources WHERE 1 = 0")))
                .isEqualTo("Query returned 0 rows.");
    }

    @Test
    void execute_databaseError_returnsMostSpecificCause() {
        when(sqlDatabase.runQuery(anyString())).thenThrow(new BadSqlGrammarException(
                "StatementCallback", "SELECT nme FROM resources",
                new SQLException("Column \"NME\" not found")));

        String result = tool.execute(Map.of("query", "SELECT nme FROM resources"));

        assertThat(result).startsWith("ERROR: Query execution failed").contains("Column \"NME\" not found");
    }
}
