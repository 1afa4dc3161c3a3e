package com.amblue.agent.exception;

/**
 * Another request kept the conversation locked for longer than the configured wait.
 */
public class ConversationBusyException extends AgentException {

    public ConversationBusyException(String conversationId) {
        super("Conversation '" + conversationId + "' is busy with another request");
    }
}
