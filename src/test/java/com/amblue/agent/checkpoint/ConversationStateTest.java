package com.amblue.agent.checkpoint;

import com.amblue.agent.model.Message;
import com.amblue.agent.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationStateTest {

    @Test
    void isLastStep_trueOnlyWhenBudgetSpent() {
        ConversationState state = ConversationState.empty("c1");

        state.setRemainingSteps(1);
        assertThat(state.isLastStep()).isFalse();
        state.setRemainingSteps(0);
        assertThat(state.isLastStep()).isTrue();
    }

    @Test
    void pendingToolCalls_listsUnansweredCallsOfLastAssistantTurn() {
        ToolCall a = call("call_a");
        ToolCall b = call("call_b");
        ConversationState state = ConversationState.empty("c1");
        state.append(Message.human("q"));
        state.append(Message.builder().role(Message.Role.assistant).toolCalls(List.of(a, b)).build());
        state.append(Message.tool(a, "done"));

        assertThat(state.pendingToolCalls()).containsExactly(b);
    }

    @Test
    void pendingToolCalls_emptyWhenAllAnswered() {
        ToolCall a = call("call_a");
        ConversationState state = ConversationState.empty("c1");
        state.append(Message.builder().role(Message.Role.assistant).toolCalls(List.of(a)).build());
        state.append(Message.tool(a, "done"));

        assertThat(state.pendingToolCalls()).isEmpty();
    }

    @Test
    void pendingToolCalls_emptyWhenLastAssistantTurnIsAnAnswer() {
        ConversationState state = ConversationState.empty("c1");
        state.append(Message.human("q"));
        state.append(Message.assistant("answer"));
        state.append(Message.human("follow-up"));

        assertThat(state.pendingToolCalls()).isEmpty();
        assertThat(ConversationState.empty("c2").pendingToolCalls()).isEmpty();
    }

    private static ToolCall call(String id) {
        return ToolCall.builder().id(id).toolName("sql_db_list_tables").arguments(Map.of()).build();
    }
}
