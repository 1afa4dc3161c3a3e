package com.amblue.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Reasoning loop settings, bound from application.yml under "agent".
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /** Reasoning/acting cycles allowed per request before the loop gives up */
    private int maxSteps = 5;

    /** Used when the caller does not send a conversation id */
    private String defaultConversationId = "default";

    /** Seconds a request waits for another request on the same conversation */
    private long conversationLockTimeoutSeconds = 120;

    /** Prepended to every model call, never persisted. Empty uses the built-in prompt */
    private String systemPrompt = "";

    private Checkpoint checkpoint = new Checkpoint();
    private Stream stream = new Stream();

    @Data
    public static class Checkpoint {
        /**
         * memory | redis | jdbc. Conversation locking stays per instance whichever
         * backend is chosen.
         */
        private String backend = "memory";
        /** Redis only. 0 keeps checkpoints until removed externally */
        private long ttlMinutes = 0;
        /** JDBC only */
        private String table = "agent_checkpoints";
    }

    @Data
    public static class Stream {
        /** Events buffered before the loop waits for a slow consumer */
        private int queueCapacity = 256;
        /** SSE connection timeout */
        private long timeoutMs = 15 * 60 * 1000;
    }
}
