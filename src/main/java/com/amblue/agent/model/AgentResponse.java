package com.amblue.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResponse {

    private String answer;

    private String conversationId;

    @Builder.Default
    private List<ToolCall> toolCallsExecuted = new ArrayList<>();

    /** Reasoning/acting cycles completed in this request */
    private int stepsUsed;

    private int remainingSteps;

    private boolean stepBudgetExhausted;

    /** True when the caller went away before the loop produced an answer */
    private boolean cancelled;
}
