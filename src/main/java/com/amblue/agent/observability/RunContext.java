package com.amblue.agent.observability;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-request observability data: timing, token usage and the tools that ran.
 * Created at the start of each agent run and flushed to an AgentRunTrace at the end.
 *
 * Kept out of ConversationState so none of this is ever checkpointed.
 */
@Getter
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    private int promptTokens;
    private int completionTokens;

    public void recordToolCall(String toolName, Object args, long latencyMs, String result) {
        toolCallRecords.add(new ToolCallRecord(toolName, args, latencyMs, result));
    }

    public void addTokens(int prompt, int completion) {
        this.promptTokens += prompt;
        this.completionTokens += completion;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    public record ToolCallRecord(
            String toolName,
            Object args,
            long latencyMs,
            String result
    ) {}
}
