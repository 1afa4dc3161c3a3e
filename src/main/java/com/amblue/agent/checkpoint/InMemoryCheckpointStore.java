package com.amblue.agent.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local checkpoints. Snapshots are kept as JSON so a loaded state
 * never aliases the one a previous request is still holding.
 * Lost on restart.
 */
@Slf4j
public class InMemoryCheckpointStore extends JsonCheckpointStore {

    private final Map<String, String> snapshots = new ConcurrentHashMap<>();

    public InMemoryCheckpointStore(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ConversationState load(String conversationId) {
        return deserialize(conversationId, snapshots.get(conversationId));
    }

    @Override
    public void save(String conversationId, ConversationState state) {
        snapshots.put(conversationId, serialize(conversationId, state));
        log.debug("Checkpoint saved in memory [conversationId={}, messages={}]",
                conversationId, state.getMessages().size());
    }
}
