package com.amblue.agent.checkpoint;

import com.amblue.agent.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Picks the checkpoint backend from agent.checkpoint.backend.
 */
@Configuration
@Slf4j
public class CheckpointStoreConfig {

    @Bean
    public CheckpointStore checkpointStore(AgentProperties agentProperties,
                                           ObjectMapper objectMapper,
                                           ObjectProvider<StringRedisTemplate> redisTemplate,
                                           ObjectProvider<JdbcTemplate> jdbcTemplate) {
        AgentProperties.Checkpoint props = agentProperties.getCheckpoint();
        log.info("Checkpoint backend: {}", props.getBackend());

        return switch (props.getBackend().toLowerCase()) {
            case "memory" -> new InMemoryCheckpointStore(objectMapper);
            case "redis" -> new RedisCheckpointStore(redisTemplate.getObject(), objectMapper, props.getTtlMinutes());
            case "jdbc" -> new JdbcCheckpointStore(jdbcTemplate.getObject(), objectMapper, props.getTable());
            default -> throw new IllegalStateException(
                    "Unknown agent.checkpoint.backend '" + props.getBackend() + "'. Use memory, redis or jdbc.");
        };
    }
}
