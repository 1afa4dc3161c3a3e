package com.amblue.agent.checkpoint;

/**
 * Per-conversation persistence of {@link ConversationState}.
 *
 * Implementations do not arbitrate concurrent writers for the same id;
 * the agent loop serializes requests per conversation before touching the store.
 * Failures surface as {@link com.amblue.agent.exception.CheckpointException}.
 */
public interface CheckpointStore {

    /**
     * @return the stored state, or a fresh empty state when none exists
     */
    ConversationState load(String conversationId);

    /**
     * Durable once this returns.
     */
    void save(String conversationId, ConversationState state);
}
