package com.amblue.agent.stream;

import com.amblue.agent.config.AgentProperties;
import com.amblue.agent.core.AgentLoop;
import com.amblue.agent.core.LoopListener;
import com.amblue.agent.exception.ConversationBusyException;
import com.amblue.agent.exception.GlobalExceptionHandler;
import com.amblue.agent.exception.ModelUnavailableException;
import com.amblue.agent.model.AgentRequest;
import com.amblue.agent.model.AgentResponse;
import com.amblue.agent.model.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentStreamServiceTest {

    private AgentLoop agentLoop;
    private AgentProperties props;
    private AgentStreamService service;

    @BeforeEach
    void setUp() {
        agentLoop = mock(AgentLoop.class);
        props = new AgentProperties();
        Executor direct = Runnable::run;
        service = new AgentStreamService(agentLoop, props, direct);
    }

    @Test
    void streamAnswer_forwardsLoopTransitionsAsEvents() {
        doAnswer(inv -> {
            LoopListener listener = inv.getArgument(1);
            assertThat(listener.wantsDeltas()).isTrue();
            ToolCall call = ToolCall.builder().id("call_1").toolName("sql_db_list_tables").arguments(Map.of()).build();
            listener.onToolMessage(call, "invoices, resources");
            listener.onAssistantDelta("Two ");
            listener.onAssistantDelta("tables.");
            listener.onAssistantComplete("Two tables.");
            return AgentResponse.builder().answer("Two tables.").build();
        }).when(agentLoop).run(any(AgentRequest.class), any(LoopListener.class));

        List<AgentEvent> events = drain(service.streamAnswer("c1", "List the tables"));

        assertThat(events).extracting(AgentEvent::type).containsExactly(
                AgentEventType.TOOL_MESSAGE,
                AgentEventType.AGENT_MESSAGE_DELTA,
                AgentEventType.AGENT_MESSAGE_DELTA,
                AgentEventType.AGENT_MESSAGE_COMPLETE);
        assertThat(events.get(0).toolCallId()).isEqualTo("call_1");
        assertThat(events.get(0).toolName()).isEqualTo("sql_db_list_tables");
        assertThat(events.get(3).content()).isEqualTo("Two tables.");
    }

    @Test
    void streamAnswer_passesConversationAndQuestion() {
        when(agentLoop.run(any(AgentRequest.class), any(LoopListener.class)))
                .thenReturn(AgentResponse.builder().build());

        drain(service.streamAnswer("c7", "What is Azure?"));

        ArgumentCaptor<AgentRequest> request = ArgumentCaptor.forClass(AgentRequest.class);
        verify(agentLoop).run(request.capture(), any(LoopListener.class));
        assertThat(request.getValue().getConversationId()).isEqualTo("c7");
        assertThat(request.getValue().getQuestion()).isEqualTo("What is Azure?");
    }

    @Test
    void streamAnswer_loopFailure_endsWithGenericErrorEvent() {
        when(agentLoop.run(any(AgentRequest.class), any(LoopListener.class)))
                .thenThrow(new ModelUnavailableException("azure unavailable [503]"));

        List<AgentEvent> events = drain(service.streamAnswer("c1", "hi"));

        assertThat(events).hasSize(1);
        assertThat(events.get(0).type()).isEqualTo(AgentEventType.ERROR);
        assertThat(events.get(0).content()).isEqualTo(GlobalExceptionHandler.PROCESSING_ERROR).doesNotContain("503");
    }

    @Test
    void streamAnswer_busyConversation_endsWithBusyEvent() {
        when(agentLoop.run(any(AgentRequest.class), any(LoopListener.class)))
                .thenThrow(new ConversationBusyException("c1"));

        List<AgentEvent> events = drain(service.streamAnswer("c1", "hi"));

        assertThat(events).extracting(AgentEvent::content).containsExactly(AgentStreamService.BUSY_MESSAGE);
    }

    @Test
    void streamAnswer_poolSaturated_endsWithErrorEvent() {
        service = new AgentStreamService(agentLoop, props, task -> {
            throw new RejectedExecutionException("full");
        });

        List<AgentEvent> events = drain(service.streamAnswer("c1", "hi"));

        assertThat(events).extracting(AgentEvent::type).containsExactly(AgentEventType.ERROR);
        verify(agentLoop, never()).run(any(AgentRequest.class), any(LoopListener.class));
    }

    @Test
    void cancel_isVisibleToTheLoop() {
        AtomicReference<LoopListener> captured = new AtomicReference<>();
        doAnswer(inv -> {
            LoopListener listener = inv.getArgument(1);
            assertThat(listener.isCancelled()).isFalse();
            captured.set(listener);
            return AgentResponse.builder().build();
        }).when(agentLoop).run(any(AgentRequest.class), any(LoopListener.class));

        AgentEventStream events = service.streamAnswer("c1", "hi");
        events.cancel();

        assertThat(captured.get().isCancelled()).isTrue();
    }

    private static List<AgentEvent> drain(AgentEventStream stream) {
        List<AgentEvent> events = new ArrayList<>();
        stream.forEachRemaining(events::add);
        return events;
    }
}
