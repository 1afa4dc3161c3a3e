package com.amblue.agent.checkpoint;

import com.amblue.agent.exception.CheckpointException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Durable checkpoints in a relational table, one row per conversation.
 * The table is created on startup when missing.
 *
 * Upsert is UPDATE-then-INSERT so it runs unchanged on PostgreSQL and H2.
 */
@Slf4j
public class JdbcCheckpointStore extends JsonCheckpointStore {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;
    private final String table;

    public JdbcCheckpointStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, String table) {
        super(objectMapper);
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid checkpoint table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.table = table;
    }

    @PostConstruct
    public void createTableIfMissing() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + table + " (" +
                "conversation_id VARCHAR(255) PRIMARY KEY, " +
                "state TEXT NOT NULL, " +
                "updated_at TIMESTAMP NOT NULL)");
        log.info("Checkpoint table ready: {}", table);
    }

    @Override
    public ConversationState load(String conversationId) {
        try {
            List<String> rows = jdbcTemplate.queryForList(
                    "SELECT state FROM " + table + " WHERE conversation_id = ?", String.class, conversationId);
            return deserialize(conversationId, rows.isEmpty() ? null : rows.get(0));
        } catch (DataAccessException e) {
            throw new CheckpointException("Failed to load checkpoint for conversation " + conversationId, e);
        }
    }

    @Override
    public void save(String conversationId, ConversationState state) {
        String json = serialize(conversationId, state);
        Timestamp now = Timestamp.from(Instant.now());
        try {
            int updated = jdbcTemplate.update(
                    "UPDATE " + table + " SET state = ?, updated_at = ? WHERE conversation_id = ?",
                    json, now, conversationId);
            if (updated == 0) {
                try {
                    jdbcTemplate.update(
                            "INSERT INTO " + table + " (conversation_id, state, updated_at) VALUES (?, ?, ?)",
                            conversationId, json, now);
                } catch (DuplicateKeyException e) {
                    jdbcTemplate.update(
                            "UPDATE " + table + " SET state = ?, updated_at = ? WHERE conversation_id = ?",
                            json, now, conversationId);
                }
            }
        } catch (DataAccessException e) {
            throw new CheckpointException("Failed to save checkpoint for conversation " + conversationId, e);
        }
        log.debug("Saved checkpoint row for conversation: {}", conversationId);
    }
}
