package com.amblue.agent.core;

import com.amblue.agent.model.ToolCall;

/**
 * Observer of loop transitions. The streaming side turns these into events;
 * blocking callers use {@link #NONE}.
 */
public interface LoopListener {

    LoopListener NONE = new LoopListener() {};

    /** A tool message was appended to the history */
    default void onToolMessage(ToolCall call, String content) {
    }

    /** A fragment of the assistant turn currently being generated */
    default void onAssistantDelta(String delta) {
    }

    /** The assistant turn the loop terminates on */
    default void onAssistantComplete(String content) {
    }

    /** Checked before every model call */
    default boolean isCancelled() {
        return false;
    }

    /** When true the loop uses the streaming model call */
    default boolean wantsDeltas() {
        return false;
    }
}
