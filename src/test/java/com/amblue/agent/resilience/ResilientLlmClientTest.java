package com.amblue.agent.resilience;

import com.amblue.agent.exception.AgentException;
import com.amblue.agent.exception.MalformedModelOutputException;
import com.amblue.agent.exception.ModelUnavailableException;
import com.amblue.agent.llm.LlmClient;
import com.amblue.agent.model.LlmResponse;
import com.amblue.agent.model.Message;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResilientLlmClientTest {

    private LlmClient delegate;
    private ResilientLlmClient client;

    @BeforeEach
    void setUp() {
        delegate = mock(LlmClient.class);
        client = new ResilientLlmClient(delegate);
    }

    @Test
    void chat_delegates() {
        LlmResponse expected = LlmResponse.builder().content("ok").build();
        when(delegate.chat(anyList(), anyList())).thenReturn(expected);

        assertThat(client.chat(List.of(Message.human("q")), List.of())).isSameAs(expected);
    }

    @Test
    @SuppressWarnings("unchecked")
    void streamChat_delegatesWithSameConsumer() {
        Consumer<String> onDelta = mock(Consumer.class);
        LlmResponse expected = LlmResponse.builder().content("ok").build();
        when(delegate.streamChat(anyList(), anyList(), any())).thenReturn(expected);

        assertThat(client.streamChat(List.of(), List.of(), onDelta)).isSameAs(expected);
        verify(delegate).streamChat(List.of(), List.of(), onDelta);
    }

    @Test
    void chatFallback_openCircuit_throwsModelUnavailable() {
        CircuitBreaker breaker = CircuitBreaker.ofDefaults("llmClient");
        breaker.transitionToOpenState();
        CallNotPermittedException open = CallNotPermittedException.createCallNotPermittedException(breaker);

        assertThatThrownBy(() -> client.chatFallback(List.of(), List.of(), open))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("circuit breaker is open");
    }

    @Test
    void chatFallback_agentException_isRethrownUnchanged() {
        MalformedModelOutputException malformed = new MalformedModelOutputException("no choices");

        assertThatThrownBy(() -> client.chatFallback(List.of(), List.of(), malformed)).isSameAs(malformed);
    }

    @Test
    void streamFallback_unexpectedException_wrappedAsModelUnavailable() {
        ResourceAccessException io = new ResourceAccessException("reset");

        assertThatThrownBy(() -> client.streamFallback(List.of(), List.of(), delta -> { }, io))
                .isInstanceOf(ModelUnavailableException.class)
                .hasCause(io);
    }

    @Test
    void chatFallback_neverReturnsAnAnswer() {
        assertThatThrownBy(() -> client.chatFallback(List.of(), List.of(), new AgentException("bad request")))
                .isExactlyInstanceOf(AgentException.class);
    }
}
