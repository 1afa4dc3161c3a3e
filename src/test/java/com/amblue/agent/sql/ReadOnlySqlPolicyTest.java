package com.amblue.agent.sql;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ReadOnlySqlPolicyTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "DELETE FROM resources",
            "delete from resources where id = 1",
            "  \n\tDeLeTe FROM resources",
            "INSERT INTO resources (id) VALUES (1)",
            "UPDATE resources SET name = 'x'",
            "DROP TABLE resources",
            "ALTER TABLE resources ADD COLUMN hack text",
            "TRUNCATE resources",
            "CREATE TABLE evil (id int)",
            "GRANT ALL ON resources TO hacker",
            "/* harmless */ DELETE FROM resources",
            "-- note\nDELETE FROM resources",
            "WITH gone AS (DELETE FROM resources RETURNING *) SELECT * FROM gone",
            "SELECT * FROM resources; DROP TABLE resources",
            "SELECT 1; SELECT 2",
            "COPY resources TO '/tmp/out.csv'",
            "CALL cleanup()",
            "SELECT E'\\''; DELETE FROM resources; --'",
            "SELECT e'\\''; DELETE FROM resources; --'",
            "SELECT '\\''; DELETE FROM resources; --'"
    })
    void findViolation_writeOrMultiStatement_isRejected(String sql) {
        assertThat(ReadOnlySqlPolicy.findViolation(sql)).isPresent();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT * FROM resources",
            "select name, cost from resources where region = 'eastus' limit 10",
            "SELECT * FROM resources;",
            "  SELECT COUNT(*) FROM resources ;  ",
            "WITH totals AS (SELECT region, SUM(cost) c FROM resources GROUP BY region) SELECT * FROM totals",
            "(SELECT 1)",
            "SELECT 'please delete me' AS note",
            "SELECT \"update\" FROM audit_log",
            "SELECT updated_at, deleted_flag FROM resources",
            "SELECT name FROM resources -- drop everything later",
            "SELECT $$ insert; drop $$ AS body",
            "SELECT 'C:\\temp\\drop' AS path",
            "SELECT E'it\\'s; delete' AS note"
    })
    void findViolation_plainReads_areAllowed(String sql) {
        assertThat(ReadOnlySqlPolicy.findViolation(sql)).isEmpty();
    }

    @Test
    void findViolation_nonSelectStatement_isRejected() {
        assertThat(ReadOnlySqlPolicy.findViolation("SHOW TABLES"))
                .hasValueSatisfying(reason -> assertThat(reason).contains("SELECT"));
    }

    @Test
    void findViolation_blankOrNull_isRejected() {
        assertThat(ReadOnlySqlPolicy.findViolation("   ")).isPresent();
        assertThat(ReadOnlySqlPolicy.findViolation(null)).isPresent();
        assertThat(ReadOnlySqlPolicy.findViolation("-- only a comment")).isPresent();
    }

    @Test
    void findViolation_namesTheKeyword() {
        assertThat(ReadOnlySqlPolicy.findViolation("DELETE FROM resources"))
                .hasValueSatisfying(reason -> assertThat(reason).contains("DELETE"));
    }

    @Test
    void blankOutCommentsAndLiterals_keepsStatementStructure() {
        String stripped = ReadOnlySqlPolicy.blankOutCommentsAndLiterals(
                "SELECT 'it''s' /* c */ FROM t -- trailing");
        assertThat(stripped).doesNotContain("it").doesNotContain("trailing").contains("SELECT").contains("FROM t");
    }
}
