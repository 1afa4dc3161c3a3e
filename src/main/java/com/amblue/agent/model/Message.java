package com.amblue.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    /**
     * {@code system} is only ever built at call time for the prompt; it is never
     * stored in a conversation checkpoint.
     */
    public enum Role {
        system, human, assistant, tool
    }

    private Role role;

    /** May be null on an assistant turn that only carries tool calls */
    private String content;

    /** Present when role = tool: links back to the assistant's tool call id */
    private String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    private String name;

    /**
     * Present when role = assistant and the model requested tool calls.
     * Echoed back verbatim on every later model call so tool results stay correlated.
     */
    private List<ToolCall> toolCalls;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message human(String content) {
        return Message.builder().role(Role.human).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message tool(ToolCall call, String content) {
        return Message.builder()
                .role(Role.tool)
                .toolCallId(call.getId())
                .name(call.getToolName())
                .content(content)
                .build();
    }

    public boolean hasToolCalls() {
        return role == Role.assistant && toolCalls != null && !toolCalls.isEmpty();
    }
}
