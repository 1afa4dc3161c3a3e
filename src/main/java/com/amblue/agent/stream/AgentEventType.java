package com.amblue.agent.stream;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentEventType {
    TOOL_MESSAGE("tool_message"),
    AGENT_MESSAGE_DELTA("agent_message_delta"),
    AGENT_MESSAGE_COMPLETE("agent_message_complete"),
    /** Last event of a stream that failed; carries a generic message only */
    ERROR("error");

    private final String wireName;

    AgentEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
