package com.amblue.agent.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Trace of one agent request, stored in MongoDB.
 *
 * Collection: agent_run_traces
 *
 * Captures:
 * - Question / answer
 * - Total latency and per-tool latency
 * - Token usage (prompt + completion)
 * - Tool execution sequence
 * - Failure details if the run errored
 */
@Document(collection = "agent_run_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunTrace {

    public enum Status { SUCCESS, STEP_BUDGET_EXHAUSTED, CANCELLED, ERROR }

    @Id
    private String id;

    @Indexed
    private String conversationId;

    @Indexed
    private String userId;

    private String question;

    private String answer;

    @Indexed
    private Status status;

    private int stepsUsed;
    private long totalLatencyMs;

    private int promptTokens;
    private int completionTokens;
    private int totalTokens;

    /**
     * Tool calls in execution order.
     * E.g: [{"toolName":"sql_db_query","latencyMs":340,"resultPreview":"..."}]
     */
    private List<Map<String, Object>> toolCalls;

    /** Exception message if status = ERROR */
    private String errorMessage;

    @CreatedDate
    @Indexed
    private Instant createdAt;
}
