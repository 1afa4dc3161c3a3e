package com.amblue.agent.llm;

import com.amblue.agent.exception.AgentException;
import com.amblue.agent.exception.MalformedModelOutputException;
import com.amblue.agent.exception.ModelUnavailableException;
import com.amblue.agent.model.LlmResponse;
import com.amblue.agent.model.Message;
import com.amblue.agent.model.ToolCall;
import com.amblue.agent.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenAI-compatible chat/completions client. Works with OpenAI, Azure OpenAI and Groq.
 *
 * Error handling strategy:
 *
 * | Error                    | Action                                              |
 * |--------------------------|-----------------------------------------------------|
 * | 401 invalid_api_key      | AgentException (not retried, not a CB failure)      |
 * | 400 model_decommissioned | AgentException with a loud guidance message         |
 * | 400 tool_use_failed      | Recover the call from failed_generation (Groq)      |
 * | 408 / 429                | ModelUnavailableException (retried)                 |
 * | 4xx other                | AgentException (not retried, not a CB failure)      |
 * | 5xx                      | ModelUnavailableException (retried, CB failure)     |
 * | network error            | ModelUnavailableException (retried, CB failure)     |
 * | no choices / bad payload | MalformedModelOutputException (not retried)         |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    // Matches both broken XML formats Groq emits:
    //   <function=name({"arg": "val"})</function>
    //   <function=name{"arg": "val"}></function>
    private static final Pattern GROQ_XML_TOOL_PATTERN =
            Pattern.compile("<function=(\\w+)\\(?(\\{.+?\\})\\)?(?:</function>|>)", Pattern.DOTALL);

    private static final String DATA_PREFIX = "data:";
    private static final String DONE = "[DONE]";

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            ObjectMapper objectMapper,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;

        restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Content-Type", "application/json");
        if (props.isAzure()) {
            restClientBuilder.defaultHeader("api-key", props.getApiKey());
        } else {
            restClientBuilder.defaultHeader("Authorization", "Bearer " + props.getApiKey());
        }
        this.restClient = restClientBuilder.build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools, false);

        log.debug("Sending {} messages to {} [model={}]",
                messages.size(), providerName, props.getModel());

        try {
            Map<String, Object> response = restClient.post()
                    .uri(this::chatCompletionsUri)
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) ->
                            handleErrorStatus(res.getStatusCode().value(), readBody(res)))
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (GroqToolUseFailedException e) {
            return recoverFromGroqToolUseFailure(e.getErrorBody());
        } catch (ResourceAccessException e) {
            throw new ModelUnavailableException(providerName + " is unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new MalformedModelOutputException(providerName + " returned an unreadable response", e);
        }
    }

    /**
     * Streams the completion over SSE. Content fragments go to {@code onDelta} as they
     * arrive; tool-call fragments are stitched together by index and returned at the end.
     */
    @Override
    public LlmResponse streamChat(List<Message> messages, List<ToolDefinition> tools, Consumer<String> onDelta) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools, true);

        log.debug("Streaming {} messages to {} [model={}]",
                messages.size(), providerName, props.getModel());

        try {
            return restClient.post()
                    .uri(this::chatCompletionsUri)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .body(requestBody)
                    .exchange((req, res) -> {
                        if (res.getStatusCode().isError()) {
                            handleErrorStatus(res.getStatusCode().value(), readBody(res));
                        }
                        return readStream(res.getBody(), onDelta);
                    });

        } catch (GroqToolUseFailedException e) {
            LlmResponse recovered = recoverFromGroqToolUseFailure(e.getErrorBody());
            if (recovered.getContent() != null) onDelta.accept(recovered.getContent());
            return recovered;
        } catch (ResourceAccessException e) {
            throw new ModelUnavailableException(providerName + " stream failed: " + e.getMessage(), e);
        }
    }

    private URI chatCompletionsUri(UriBuilder uri) {
        uri.path("/chat/completions");
        if (props.isAzure()) {
            uri.queryParam("api-version", props.getApiVersion());
        }
        return uri.build();
    }

    /**
     * Central error-status handler: maps status codes to the exception types
     * the retry and circuit breaker are configured around.
     */
    private void handleErrorStatus(int statusCode, String body) {
        log.error("{} error [{}]: {}", providerName, statusCode, body);

        if (statusCode >= 500 || statusCode == 429 || statusCode == 408) {
            throw new ModelUnavailableException(
                    providerName + " unavailable [" + statusCode + "]");
        }

        if (body.contains("model_decommissioned")) {
            log.error("================================================================");
            log.error("  MODEL DECOMMISSIONED: {} is no longer supported by {}.", props.getModel(), providerName);
            log.error("  Update the model in application.yml or via its environment variable.");
            log.error("================================================================");
            throw new AgentException("Model '" + props.getModel() + "' is decommissioned");
        }

        // Groq emitted an XML tool call instead of JSON
        if (body.contains("tool_use_failed")) {
            throw new GroqToolUseFailedException(body);
        }

        if (statusCode == 401) {
            throw new AgentException(
                    providerName + " API key is invalid. Check your " +
                    providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        throw new AgentException(providerName + " client error [" + statusCode + "]");
    }

    private String readBody(ClientHttpResponse res) throws IOException {
        return new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Groq's tool_use_failed error carries the broken generation in "failed_generation".
     * The XML-ish call is parsed back into a regular tool call so the loop can go on.
     */
    @SuppressWarnings("unchecked")
    private LlmResponse recoverFromGroqToolUseFailure(String errorBody) {
        String failedGeneration;
        try {
            Map<String, Object> errorMap = objectMapper.readValue(errorBody, new TypeReference<>() {});
            Map<String, Object> error = (Map<String, Object>) errorMap.get("error");
            failedGeneration = error != null ? (String) error.get("failed_generation") : null;
        } catch (JsonProcessingException | ClassCastException e) {
            throw new MalformedModelOutputException("Unreadable tool_use_failed body from " + providerName, e);
        }

        if (failedGeneration == null || failedGeneration.isBlank()) {
            throw new MalformedModelOutputException(providerName + " tool_use_failed without failed_generation");
        }

        log.debug("Recovering from Groq tool_use_failed. Generation: {}", failedGeneration);

        Matcher matcher = GROQ_XML_TOOL_PATTERN.matcher(failedGeneration);
        List<ToolCall> calls = new ArrayList<>();
        while (matcher.find()) {
            ToolCall call = toolCall("groq-recovered-" + UUID.randomUUID().toString().substring(0, 8),
                    matcher.group(1), matcher.group(2));
            log.info("Recovered Groq tool call: tool={} args={}", call.getToolName(), call.getArguments());
            calls.add(call);
        }

        if (calls.isEmpty()) {
            throw new MalformedModelOutputException(
                    "Could not parse a tool call from " + providerName + " failed_generation");
        }

        return LlmResponse.builder()
                .toolCalls(calls)
                .finishReason("tool_calls")
                .build();
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools, boolean stream) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);

        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }

        if (stream) {
            body.put("stream", true);
            body.put("stream_options", Map.of("include_usage", true));
        }
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();

        switch (msg.getRole()) {
            case system -> {
                m.put("role", "system");
                m.put("content", msg.getContent() != null ? msg.getContent() : "");
            }
            case human -> {
                m.put("role", "user");
                m.put("content", msg.getContent() != null ? msg.getContent() : "");
            }
            case tool -> {
                m.put("role", "tool");
                m.put("tool_call_id", msg.getToolCallId());
                m.put("content", msg.getContent() != null ? msg.getContent() : "");
            }
            case assistant -> {
                m.put("role", "assistant");
                // An assistant turn with tool calls must carry the tool_calls array,
                // otherwise the provider cannot correlate the tool messages that follow
                m.put("content", msg.getContent());
                if (msg.hasToolCalls()) {
                    m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
                }
            }
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getToolName());
        if (tc.getMalformedArguments() != null) {
            fn.put("arguments", tc.getMalformedArguments());
        } else {
            try {
                fn.put("arguments", objectMapper.writeValueAsString(
                        tc.getArguments() != null ? tc.getArguments() : Map.of()));
            } catch (JsonProcessingException e) {
                fn.put("arguments", "{}");
            }
        }

        Map<String, Object> tcMap = new HashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");
        tcMap.put("function", fn);
        return tcMap;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new MalformedModelOutputException(providerName + " returned an empty body");
        }

        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new MalformedModelOutputException(providerName + " returned no choices in response");
        }

        Map<String, Object> choice = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        if (message == null) {
            throw new MalformedModelOutputException(providerName + " returned a choice without a message");
        }
        String finishReason = (String) choice.get("finish_reason");
        log.debug("{} finish_reason: {}", providerName, finishReason);

        List<ToolCall> toolCalls = new ArrayList<>();
        Object rawCalls = message.get("tool_calls");
        if (rawCalls instanceof List<?> list) {
            for (Object item : list) {
                Map<String, Object> call = (Map<String, Object>) item;
                Map<String, Object> function = (Map<String, Object>) call.get("function");
                if (function == null) {
                    throw new MalformedModelOutputException(providerName + " returned a tool call without a function");
                }
                Object args = function.get("arguments");
                String argsJson = args instanceof String s ? s : writeJson(args);
                toolCalls.add(toolCall((String) call.get("id"), (String) function.get("name"), argsJson));
            }
        }

        LlmResponse.LlmResponseBuilder builder = LlmResponse.builder()
                .content((String) message.get("content"))
                .toolCalls(toolCalls)
                .finishReason(finishReason);
        applyUsage(builder, response.get("usage"));
        return builder.build();
    }

    /**
     * Reads "data:" frames until [DONE] or end of body.
     */
    @SuppressWarnings("unchecked")
    private LlmResponse readStream(InputStream body, Consumer<String> onDelta) throws IOException {
        StringBuilder content = new StringBuilder();
        Map<Integer, PartialToolCall> partialCalls = new TreeMap<>();
        LlmResponse.LlmResponseBuilder builder = LlmResponse.builder();
        String finishReason = null;
        boolean sawChunk = false;

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.startsWith(DATA_PREFIX)) continue;

                String payload = line.substring(DATA_PREFIX.length()).trim();
                if (payload.isEmpty()) continue;
                if (DONE.equals(payload)) break;

                Map<String, Object> chunk;
                try {
                    chunk = objectMapper.readValue(payload, new TypeReference<>() {});
                } catch (JsonProcessingException e) {
                    throw new MalformedModelOutputException(providerName + " sent an unreadable stream chunk", e);
                }
                sawChunk = true;

                if (chunk.get("error") != null) {
                    log.error("{} stream error: {}", providerName, chunk.get("error"));
                    throw new ModelUnavailableException(providerName + " reported an error mid-stream");
                }

                applyUsage(builder, chunk.get("usage"));

                if (!(chunk.get("choices") instanceof List<?> choices) || choices.isEmpty()) continue;
                Map<String, Object> choice = (Map<String, Object>) choices.get(0);
                if (choice.get("finish_reason") instanceof String reason) {
                    finishReason = reason;
                }

                Map<String, Object> delta = (Map<String, Object>) choice.get("delta");
                if (delta == null) continue;

                if (delta.get("content") instanceof String text && !text.isEmpty()) {
                    content.append(text);
                    onDelta.accept(text);
                }

                if (delta.get("tool_calls") instanceof List<?> callDeltas) {
                    for (Object item : callDeltas) {
                        Map<String, Object> callDelta = (Map<String, Object>) item;
                        int index = callDelta.get("index") instanceof Number n ? n.intValue() : partialCalls.size();
                        PartialToolCall partial = partialCalls.computeIfAbsent(index, i -> new PartialToolCall());
                        partial.merge(callDelta);
                    }
                }
            }
        }

        if (!sawChunk) {
            throw new MalformedModelOutputException(providerName + " stream ended without any chunk");
        }

        List<ToolCall> toolCalls = partialCalls.values().stream()
                .map(p -> toolCall(p.id, p.name, p.arguments.toString()))
                .toList();

        return builder
                .content(content.isEmpty() ? null : content.toString())
                .toolCalls(new ArrayList<>(toolCalls))
                .finishReason(finishReason)
                .build();
    }

    /**
     * Builds a ToolCall from raw argument text. Text that is not a JSON object is kept
     * on the call so the registry can answer it with an error instead of failing the turn.
     */
    private ToolCall toolCall(String id, String name, String argsJson) {
        if (name == null || name.isBlank()) {
            throw new MalformedModelOutputException(providerName + " returned a tool call without a name");
        }
        String callId = id != null && !id.isBlank() ? id : "call_" + UUID.randomUUID().toString().substring(0, 8);

        ToolCall.ToolCallBuilder call = ToolCall.builder().id(callId).toolName(name);
        if (argsJson == null || argsJson.isBlank()) {
            return call.arguments(new HashMap<>()).build();
        }
        try {
            Map<String, Object> args = objectMapper.readValue(argsJson, new TypeReference<>() {});
            return call.arguments(args != null ? args : new HashMap<>()).build();
        } catch (JsonProcessingException e) {
            log.warn("{} produced non-JSON arguments for [{}]: {}", providerName, name, argsJson);
            return call.arguments(new HashMap<>()).malformedArguments(argsJson).build();
        }
    }

    @SuppressWarnings("unchecked")
    private void applyUsage(LlmResponse.LlmResponseBuilder builder, Object rawUsage) {
        if (!(rawUsage instanceof Map<?, ?> usage)) return;
        int promptTokens = usage.get("prompt_tokens") instanceof Number n ? n.intValue() : 0;
        int completionTokens = usage.get("completion_tokens") instanceof Number n ? n.intValue() : 0;
        builder.promptTokens(promptTokens).completionTokens(completionTokens);
        log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /** Tool call assembled from stream fragments sharing one index */
    private static class PartialToolCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();

        @SuppressWarnings("unchecked")
        void merge(Map<String, Object> delta) {
            if (delta.get("id") instanceof String s && !s.isEmpty()) id = s;
            if (delta.get("function") instanceof Map<?, ?> fn) {
                Map<String, Object> function = (Map<String, Object>) fn;
                if (function.get("name") instanceof String s && !s.isEmpty()) name = s;
                if (function.get("arguments") instanceof String s) arguments.append(s);
            }
        }
    }

    private static class GroqToolUseFailedException extends RuntimeException {
        private final String errorBody;

        GroqToolUseFailedException(String errorBody) {
            super("Groq tool_use_failed");
            this.errorBody = errorBody;
        }

        String getErrorBody() {
            return errorBody;
        }
    }
}
