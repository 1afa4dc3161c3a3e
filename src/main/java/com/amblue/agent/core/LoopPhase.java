package com.amblue.agent.core;

/**
 * THINKING waits on the model, ACTING runs the requested tools, TERMINATED holds the answer.
 */
public enum LoopPhase {
    THINKING, ACTING, TERMINATED
}
