package com.amblue.agent.checkpoint;

import com.amblue.agent.model.Message;
import com.amblue.agent.model.ToolCall;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Everything the agent loop needs to resume a conversation.
 *
 * Owned by one in-flight request at a time; the checkpoint store owns it
 * between requests. Messages never include the system prompt.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversationState {

    private String conversationId;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    /** Acting cycles left in the current request */
    private int remainingSteps;

    /** Time of the last save; store metadata, not part of the conversation */
    @EqualsAndHashCode.Exclude
    private Instant updatedAt;

    public static ConversationState empty(String conversationId) {
        return ConversationState.builder()
                .conversationId(conversationId)
                .messages(new ArrayList<>())
                .build();
    }

    /** True once the step budget is spent: further tool calls are refused */
    @JsonIgnore
    public boolean isLastStep() {
        return remainingSteps <= 0;
    }

    public void append(Message message) {
        messages.add(message);
    }

    /**
     * Tool calls of the latest assistant turn that have no tool message yet.
     * Non-empty only when a previous run stopped between a model turn and its tool results.
     */
    @JsonIgnore
    public List<ToolCall> pendingToolCalls() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.getRole() != Message.Role.assistant) continue;
            if (!message.hasToolCalls()) return List.of();

            Set<String> answered = messages.subList(i + 1, messages.size()).stream()
                    .filter(m -> m.getRole() == Message.Role.tool)
                    .map(Message::getToolCallId)
                    .collect(Collectors.toSet());
            return message.getToolCalls().stream()
                    .filter(call -> !answered.contains(call.getId()))
                    .toList();
        }
        return List.of();
    }
}
