package com.amblue.agent.tool.impl;

import com.amblue.agent.sql.SqlDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TableSchemaToolTest {

    private SqlDatabase sqlDatabase;
    private TableSchemaTool tool;

    @BeforeEach
    void setUp() {
        sqlDatabase = mock(SqlDatabase.class);
        tool = new TableSchemaTool(sqlDatabase);
    }

    @Test
    void execute_splitsCommaSeparatedNames() {
        when(sqlDatabase.describeTables(List.of("resources", "invoices"))).thenReturn("CREATE TABLE ...");

        assertThat(tool.execute(Map.of("table_names", " resources , invoices,"))).isEqualTo("CREATE TABLE ...");
    }

    @Test
    void execute_unknownTable_returnsError() {
        when(sqlDatabase.describeTables(List.of("secrets")))
                .thenThrow(new IllegalArgumentException("table_names [secrets] not found in database"));

        assertThat(tool.execute(Map.of("table_names", "secrets")))
                .isEqualTo("ERROR: table_names [secrets] not found in database");
    }

    @Test
    void execute_blankNames_returnsErrorWithoutLookup() {
        assertThat(tool.execute(Map.of("table_names", " , "))).startsWith("ERROR:");
        verify(sqlDatabase, never()).describeTables(any());
    }

    @Test
    void execute_databaseFailure_returnsError() {
        when(sqlDatabase.describeTables(any())).thenThrow(new IllegalStateException("connection refused"));

        assertThat(tool.execute(Map.of("table_names", "resources")))
                .startsWith("ERROR: Could not read schema").contains("connection refused");
    }
}
