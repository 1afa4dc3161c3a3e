package com.amblue.agent.observability;

import com.amblue.agent.model.AgentResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists run traces and exposes analytics.
 *
 * Trace persistence is @Async: it never blocks the agent response.
 * Analytics queries are synchronous (called explicitly by the traces endpoint).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private static final int PREVIEW_LENGTH = 200;

    private final AgentRunTraceRepository traceRepository;

    /**
     * Persist a finished run. {@code response} is null when the run failed.
     */
    @Async("traceTaskExecutor")
    public void persistTrace(String conversationId, String userId, String question,
                             AgentResponse response, RunContext runCtx, Throwable error) {
        try {
            AgentRunTrace trace = AgentRunTrace.builder()
                    .conversationId(conversationId)
                    .userId(userId)
                    .question(truncate(question, 4000))
                    .answer(response != null ? truncate(response.getAnswer(), 8000) : null)
                    .status(statusOf(response, error))
                    .stepsUsed(response != null ? response.getStepsUsed() : 0)
                    .totalLatencyMs(runCtx.elapsedMs())
                    .promptTokens(runCtx.getPromptTokens())
                    .completionTokens(runCtx.getCompletionTokens())
                    .totalTokens(runCtx.totalTokens())
                    .toolCalls(toolCallSummaries(runCtx.getToolCallRecords()))
                    .errorMessage(error != null ? truncate(error.getMessage(), 2000) : null)
                    .build();

            traceRepository.save(trace);

            log.info("Trace persisted [conversationId={}, status={}, latency={}ms, tokens={}]",
                    conversationId, trace.getStatus(), trace.getTotalLatencyMs(), trace.getTotalTokens());

        } catch (Exception e) {
            // Trace persistence must never fail a request
            log.error("Failed to persist run trace for conversationId={}", conversationId, e);
        }
    }

    public List<AgentRunTrace> getTracesForUser(String userId) {
        return traceRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public List<AgentRunTrace> getTracesForConversation(String conversationId) {
        return traceRepository.findByConversationIdOrderByCreatedAtDesc(conversationId);
    }

    /**
     * Summary analytics for a user: avg latency, token usage last 24h, status breakdown.
     */
    public Map<String, Object> getAnalytics(String userId) {
        Instant since24h = Instant.now().minus(24, ChronoUnit.HOURS);

        Double avgLatency = traceRepository.avgLatencyForUser(userId);
        Long tokensLast24h = traceRepository.totalTokensUsedSince(userId, since24h);
        Map<String, Long> statusBreakdown = traceRepository.statusBreakdownForUser(userId).stream()
                .collect(Collectors.toMap(
                        AgentRunTraceRepository.StatusCount::id,
                        AgentRunTraceRepository.StatusCount::count,
                        Long::sum,
                        LinkedHashMap::new));

        return Map.of(
                "userId", userId,
                "avgLatencyMs", avgLatency != null ? Math.round(avgLatency) : 0L,
                "totalTokensLast24h", tokensLast24h != null ? tokensLast24h : 0L,
                "statusBreakdown", statusBreakdown
        );
    }

    static AgentRunTrace.Status statusOf(AgentResponse response, Throwable error) {
        if (error != null || response == null) return AgentRunTrace.Status.ERROR;
        if (response.isCancelled()) return AgentRunTrace.Status.CANCELLED;
        if (response.isStepBudgetExhausted()) return AgentRunTrace.Status.STEP_BUDGET_EXHAUSTED;
        return AgentRunTrace.Status.SUCCESS;
    }

    private List<Map<String, Object>> toolCallSummaries(List<RunContext.ToolCallRecord> records) {
        return records.stream()
                .map(r -> {
                    Map<String, Object> summary = new LinkedHashMap<>();
                    summary.put("toolName", r.toolName());
                    summary.put("latencyMs", r.latencyMs());
                    summary.put("resultPreview", truncate(r.result(), PREVIEW_LENGTH));
                    return summary;
                })
                .toList();
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
