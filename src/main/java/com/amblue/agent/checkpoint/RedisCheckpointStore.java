package com.amblue.agent.checkpoint;

import com.amblue.agent.exception.CheckpointException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis-backed checkpoints.
 *
 * - Key pattern: agent:checkpoint:{conversationId}
 * - Whole state stored as a single JSON document (atomic read/write per conversation)
 * - No sliding window: the loop needs the complete history to keep tool results correlated
 * - Optional TTL, reset on every write; 0 keeps the key until it is removed externally
 */
@Slf4j
public class RedisCheckpointStore extends JsonCheckpointStore {

    private static final String KEY_PREFIX = "agent:checkpoint:";

    private final StringRedisTemplate redisTemplate;
    private final long ttlMinutes;

    public RedisCheckpointStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, long ttlMinutes) {
        super(objectMapper);
        this.redisTemplate = redisTemplate;
        this.ttlMinutes = ttlMinutes;
    }

    @Override
    public ConversationState load(String conversationId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(buildKey(conversationId));
        } catch (DataAccessException e) {
            throw new CheckpointException("Failed to load checkpoint for conversation " + conversationId, e);
        }

        if (json == null) {
            log.debug("No checkpoint found for conversation: {}", conversationId);
        }
        return deserialize(conversationId, json);
    }

    @Override
    public void save(String conversationId, ConversationState state) {
        String json = serialize(conversationId, state);
        try {
            if (ttlMinutes > 0) {
                redisTemplate.opsForValue().set(buildKey(conversationId), json, Duration.ofMinutes(ttlMinutes));
            } else {
                redisTemplate.opsForValue().set(buildKey(conversationId), json);
            }
        } catch (DataAccessException e) {
            throw new CheckpointException("Failed to save checkpoint for conversation " + conversationId, e);
        }
        log.debug("Saved checkpoint for conversation: {} ({} messages)", conversationId, state.getMessages().size());
    }

    private String buildKey(String conversationId) {
        return KEY_PREFIX + conversationId;
    }
}
