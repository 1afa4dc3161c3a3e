package com.amblue.agent.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One streamed event. Serialized as a flat JSON object with a {@code type}
 * discriminator; fields that do not apply to the type are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentEvent(
        AgentEventType type,
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("tool_call_id") String toolCallId,
        String content
) {

    public static AgentEvent toolMessage(String toolName, String toolCallId, String content) {
        return new AgentEvent(AgentEventType.TOOL_MESSAGE, toolName, toolCallId, content);
    }

    public static AgentEvent delta(String content) {
        return new AgentEvent(AgentEventType.AGENT_MESSAGE_DELTA, null, null, content);
    }

    public static AgentEvent complete(String content) {
        return new AgentEvent(AgentEventType.AGENT_MESSAGE_COMPLETE, null, null, content);
    }

    public static AgentEvent error(String content) {
        return new AgentEvent(AgentEventType.ERROR, null, null, content);
    }
}
