package com.amblue.agent.tool;

import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the model so it knows exactly how to invoke the tool.
 *
 * Tools are read-only and safe to retry. Execution errors should NOT throw -
 * return an "ERROR: ..." string instead. This keeps the agent loop alive; the
 * model can recover or try another query.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /**
     * Human-readable description. This is the primary signal the model uses
     * to decide when to call this tool.
     */
    String getDescription();

    /**
     * JSON Schema (as a Map) describing the tool's input parameters.
     * Follow the JSON Schema spec: type, properties, required, descriptions.
     */
    Map<String, Object> getInputSchema();

    /**
     * Execute the tool and return a string observation fed back to the model.
     * Never throw: catch internally and return "ERROR: ..." strings.
     */
    String execute(Map<String, Object> arguments);
}
