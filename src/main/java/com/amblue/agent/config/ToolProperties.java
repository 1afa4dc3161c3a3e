package com.amblue.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Strongly-typed configuration for all tools.
 * Bound from application.yml under the "tools" prefix.
 */
@Component
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private Sql sql = new Sql();
    private Retrieval retrieval = new Retrieval();

    @Data
    public static class Sql {
        /** Schema to introspect. Blank means every non-system schema */
        private String schema = "";
        /** Comma-separated allowlist: empty means every table */
        private String includeTables = "";
        /** Comma-separated, hidden from the model even when they exist */
        private String ignoreTables = "agent_checkpoints";
        private int sampleRowsInTableInfo = 3;
        private int maxResultRows = 100;
        private int queryTimeoutSeconds = 30;
        /** Cells longer than this are cut in query results */
        private int maxCellLength = 200;

        public List<String> getIncludeTableList() {
            return split(includeTables);
        }

        public List<String> getIgnoreTableList() {
            return split(ignoreTables);
        }
    }

    @Data
    public static class Retrieval {
        private int topK = 5;
        /** Cosine similarity below this is not returned. 0 returns the plain top-k */
        private double minScore = 0.0;
        private String collection = "document_chunks";
        /** Chunks loaded and scored per query */
        private int maxCandidates = 5000;
    }

    private static List<String> split(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .toList();
    }
}
