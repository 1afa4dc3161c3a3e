package com.amblue.agent.exception;

/**
 * Base for failures that end the current agent run.
 *
 * Thrown directly for non-retryable problems (bad credentials, 4xx from the
 * model provider). Tool problems never surface as exceptions: tools report
 * them back to the model as text.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
