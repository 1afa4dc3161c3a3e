package com.amblue.agent.resilience;

import com.amblue.agent.exception.AgentException;
import com.amblue.agent.exception.ModelUnavailableException;
import com.amblue.agent.llm.LlmClient;
import com.amblue.agent.model.LlmResponse;
import com.amblue.agent.model.Message;
import com.amblue.agent.tool.ToolDefinition;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

/**
 * Decorator around the active provider client that adds retry + circuit breaker.
 *
 * - @Primary ensures AgentLoop and the tools get this bean, not the raw client
 * - Fallbacks never invent an answer: they rethrow, so the caller sees a
 *   ModelUnavailableException and answers with a generic error
 *
 * Retry config (in application.yml):
 * - 3 attempts, exponential backoff
 * - Only ModelUnavailableException is retried (network, 5xx, 429)
 * - Streaming calls are not retried: deltas may already have reached the client
 *
 * Circuit breaker config:
 * - Opens after 50% failure rate in a sliding window of 10 calls
 * - Waits 30s before allowing trial calls (half-open state)
 * - Only ModelUnavailableException counts as a failure
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient")
    @CircuitBreaker(name = "llmClient", fallbackMethod = "chatFallback")
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        return delegate.chat(messages, tools);
    }

    @Override
    @CircuitBreaker(name = "llmClient", fallbackMethod = "streamFallback")
    public LlmResponse streamChat(List<Message> messages, List<ToolDefinition> tools, Consumer<String> onDelta) {
        return delegate.streamChat(messages, tools, onDelta);
    }

    public LlmResponse chatFallback(List<Message> messages, List<ToolDefinition> tools, Throwable ex) {
        throw translate(ex);
    }

    public LlmResponse streamFallback(List<Message> messages, List<ToolDefinition> tools,
                                      Consumer<String> onDelta, Throwable ex) {
        throw translate(ex);
    }

    private AgentException translate(Throwable ex) {
        if (ex instanceof CallNotPermittedException) {
            log.error("LLM circuit breaker is OPEN: rejecting call");
            return new ModelUnavailableException("Model circuit breaker is open", ex);
        }
        if (ex instanceof AgentException agentException) {
            return agentException;
        }
        log.error("LLM call failed: {}", ex.getMessage());
        return new ModelUnavailableException("Model call failed: " + ex.getMessage(), ex);
    }
}
