package com.amblue.agent.exception;

/**
 * The model provider could not be reached or answered with a server-side error.
 * Retryable; counted as a failure by the circuit breaker.
 */
public class ModelUnavailableException extends AgentException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
