package com.amblue.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** ID assigned by the model: must be echoed back in the tool result message */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;

    /**
     * Raw argument text when the model produced something that is not a JSON object.
     * Null for well-formed calls. The registry answers such calls with an error.
     */
    private String malformedArguments;
}
