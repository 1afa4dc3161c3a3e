package com.amblue.agent.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One assistant turn as returned by the model gateway.
 */
@Data
@Builder
public class LlmResponse {

    /** Text of the turn. May be null when the model only requested tools */
    private String content;

    /** Tool calls in the order the model emitted them */
    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    private String finishReason;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public Message toAssistantMessage() {
        return Message.builder()
                .role(Message.Role.assistant)
                .content(content)
                .toolCalls(hasToolCalls() ? List.copyOf(toolCalls) : null)
                .build();
    }
}
