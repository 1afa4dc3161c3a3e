package com.amblue.agent.tool;

import com.amblue.agent.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central registry for all AgentTool implementations.
 *
 * Spring discovers every @Component that implements AgentTool and injects them
 * as a List<AgentTool>. They are indexed by name once, at startup; the map is
 * read-only afterwards and shared by every conversation.
 *
 * Every failure mode (unknown tool, malformed or missing arguments, an adapter
 * that throws) comes back as an observation string so the agent loop always
 * continues and the model can decide what to do next.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools;
    private final List<ToolDefinition> definitions;

    public ToolRegistry(List<AgentTool> toolBeans) {
        Map<String, AgentTool> byName = new LinkedHashMap<>();
        toolBeans.forEach(tool -> {
            AgentTool previous = byName.putIfAbsent(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}]", tool.getName());
        });
        this.tools = Collections.unmodifiableMap(byName);
        this.definitions = byName.values().stream().map(ToolDefinition::from).toList();
        log.info("Total tools registered: {}", tools.size());
    }

    /** Stable order: registration order */
    public List<ToolDefinition> getAllDefinitions() {
        return definitions;
    }

    /**
     * Dispatches a tool call and returns the observation string.
     * Never throws.
     */
    public String execute(ToolCall toolCall) {
        AgentTool tool = tools.get(toolCall.getToolName());

        if (tool == null) {
            String msg = String.format(
                    "ERROR: Unknown tool '%s'. Available tools: %s",
                    toolCall.getToolName(), tools.keySet()
            );
            log.warn(msg);
            return msg;
        }

        if (toolCall.getMalformedArguments() != null) {
            log.warn("Tool [{}] called with malformed arguments: {}",
                    toolCall.getToolName(), toolCall.getMalformedArguments());
            return "ERROR: Arguments for tool '" + toolCall.getToolName() +
                   "' are not a valid JSON object. Expected schema: " + tool.getInputSchema();
        }

        Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        List<String> missing = ToolDefinition.from(tool).requiredArguments().stream()
                .filter(name -> arguments.get(name) == null)
                .toList();
        if (!missing.isEmpty()) {
            log.warn("Tool [{}] called without required arguments {}", toolCall.getToolName(), missing);
            return "ERROR: Missing required argument(s) " + missing + " for tool '" +
                   toolCall.getToolName() + "'";
        }

        log.info("Executing tool: [{}] with args: {}", toolCall.getToolName(), arguments);

        try {
            String result = tool.execute(arguments);
            log.debug("Tool [{}] returned: {}", toolCall.getToolName(), result);
            return result != null ? result : "";
        } catch (Exception e) {
            log.error("Unexpected error in tool [{}]", toolCall.getToolName(), e);
            return "ERROR: Tool execution failed: " + e.getMessage();
        }
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }
}
