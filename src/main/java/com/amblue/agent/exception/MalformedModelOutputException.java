package com.amblue.agent.exception;

/**
 * The provider answered, but the payload cannot be turned into an assistant message.
 * Not retried.
 */
public class MalformedModelOutputException extends AgentException {

    public MalformedModelOutputException(String message) {
        super(message);
    }

    public MalformedModelOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
