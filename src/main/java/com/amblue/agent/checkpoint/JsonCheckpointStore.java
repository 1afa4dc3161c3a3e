package com.amblue.agent.checkpoint;

import com.amblue.agent.exception.CheckpointException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;

/**
 * Shared JSON snapshot handling for the backends that store one blob per conversation.
 */
abstract class JsonCheckpointStore implements CheckpointStore {

    protected final ObjectMapper objectMapper;

    protected JsonCheckpointStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected String serialize(String conversationId, ConversationState state) {
        ConversationState snapshot = state.toBuilder()
                .conversationId(conversationId)
                .updatedAt(Instant.now())
                .build();
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to serialize checkpoint for conversation " + conversationId, e);
        }
    }

    protected ConversationState deserialize(String conversationId, String json) {
        if (json == null) {
            return ConversationState.empty(conversationId);
        }
        try {
            ConversationState state = objectMapper.readValue(json, ConversationState.class);
            if (state.getMessages() == null) {
                state.setMessages(new ArrayList<>());
            }
            return state;
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Corrupt checkpoint for conversation " + conversationId, e);
        }
    }
}
