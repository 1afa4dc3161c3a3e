package com.amblue.agent.exception;

public class CheckpointException extends AgentException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
