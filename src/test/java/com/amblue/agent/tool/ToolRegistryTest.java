package com.amblue.agent.tool;

import com.amblue.agent.model.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry(List.of(new LookupTool(), new ExplodingTool()));
    }

    @Test
    void getAllDefinitions_keepsRegistrationOrder() {
        assertThat(registry.getAllDefinitions())
                .extracting(ToolDefinition::getName)
                .containsExactly("lookup", "explode");
        assertThat(registry.toolCount()).isEqualTo(2);
        assertThat(registry.hasTool("lookup")).isTrue();
    }

    @Test
    void execute_knownTool_returnsObservation() {
        String result = registry.execute(call("lookup", Map.of("key", "region")));

        assertThat(result).isEqualTo("value of region");
    }

    @Test
    void execute_unknownTool_listsAvailableTools() {
        String result = registry.execute(call("teleport", Map.of()));

        assertThat(result)
                .startsWith("ERROR: Unknown tool 'teleport'")
                .contains("lookup")
                .contains("explode");
    }

    @Test
    void execute_missingRequiredArgument_returnsError() {
        String result = registry.execute(call("lookup", Map.of("other", "x")));

        assertThat(result).startsWith("ERROR: Missing required argument(s) [key]");
    }

    @Test
    void execute_nullArguments_treatedAsEmpty() {
        assertThat(registry.execute(call("lookup", null))).startsWith("ERROR: Missing required argument(s)");
    }

    @Test
    void execute_malformedArguments_returnsErrorWithSchema() {
        ToolCall malformed = ToolCall.builder()
                .id("call_9").toolName("lookup").arguments(Map.of()).malformedArguments("{key: region")
                .build();

        assertThat(registry.execute(malformed))
                .startsWith("ERROR: Arguments for tool 'lookup' are not a valid JSON object");
    }

    @Test
    void execute_toolThrows_returnsErrorInsteadOfPropagating() {
        String result = registry.execute(call("explode", Map.of()));

        assertThat(result).startsWith("ERROR: Tool execution failed").contains("boom");
    }

    @Test
    void constructor_duplicateNames_fail() {
        assertThatThrownBy(() -> new ToolRegistry(List.of(new LookupTool(), new LookupTool())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("lookup");
    }

    private static ToolCall call(String name, Map<String, Object> args) {
        return ToolCall.builder().id("call_1").toolName(name).arguments(args).build();
    }

    private static class LookupTool implements AgentTool {
        @Override public String getName() { return "lookup"; }
        @Override public String getDescription() { return "Looks a key up"; }
        @Override public Map<String, Object> getInputSchema() {
            return Map.of("type", "object",
                    "properties", Map.of("key", Map.of("type", "string")),
                    "required", List.of("key"));
        }
        @Override public String execute(Map<String, Object> arguments) {
            return "value of " + arguments.get("key");
        }
    }

    private static class ExplodingTool implements AgentTool {
        @Override public String getName() { return "explode"; }
        @Override public String getDescription() { return "Always fails"; }
        @Override public Map<String, Object> getInputSchema() { return Map.of("type", "object"); }
        @Override public String execute(Map<String, Object> arguments) {
            throw new IllegalStateException("boom");
        }
    }
}
