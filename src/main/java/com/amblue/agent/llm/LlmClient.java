package com.amblue.agent.llm;

import com.amblue.agent.model.LlmResponse;
import com.amblue.agent.model.Message;
import com.amblue.agent.tool.ToolDefinition;

import java.util.List;
import java.util.function.Consumer;

/**
 * Model gateway: one call in, one assistant turn out.
 *
 * Implementations throw {@link com.amblue.agent.exception.ModelUnavailableException}
 * when the provider cannot be reached (retryable) and
 * {@link com.amblue.agent.exception.MalformedModelOutputException} when its answer
 * cannot be read (not retryable).
 */
public interface LlmClient {

    /**
     * Send the full conversation history and available tool schemas to the model.
     *
     * @param messages  system prompt + conversation so far (human, assistant, tool results)
     * @param tools     tool definitions the model can choose to invoke
     * @return a final text answer, or an assistant turn carrying tool calls
     */
    LlmResponse chat(List<Message> messages, List<ToolDefinition> tools);

    /**
     * Same as {@link #chat} but hands content to {@code onDelta} as it is generated.
     * The returned response carries the full content as well.
     *
     * The default falls back to a blocking call and emits the whole content once.
     */
    default LlmResponse streamChat(List<Message> messages, List<ToolDefinition> tools, Consumer<String> onDelta) {
        LlmResponse response = chat(messages, tools);
        if (response.getContent() != null && !response.getContent().isEmpty()) {
            onDelta.accept(response.getContent());
        }
        return response;
    }
}
