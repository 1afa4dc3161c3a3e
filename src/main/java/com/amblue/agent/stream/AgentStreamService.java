package com.amblue.agent.stream;

import com.amblue.agent.config.AgentProperties;
import com.amblue.agent.core.AgentLoop;
import com.amblue.agent.core.LoopListener;
import com.amblue.agent.exception.ConversationBusyException;
import com.amblue.agent.exception.GlobalExceptionHandler;
import com.amblue.agent.model.AgentRequest;
import com.amblue.agent.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the agent loop on the agent pool and exposes its transitions as an event stream.
 *
 * Every stream ends: normally after agent_message_complete, after one error event when
 * the run fails, or silently when the reader cancels.
 */
@Service
@Slf4j
public class AgentStreamService {

    static final String BUSY_MESSAGE = "The conversation is busy with another request. Please retry shortly.";

    private final AgentLoop agentLoop;
    private final AgentProperties agentProperties;
    private final Executor agentTaskExecutor;

    public AgentStreamService(AgentLoop agentLoop,
                              AgentProperties agentProperties,
                              @Qualifier("agentTaskExecutor") Executor agentTaskExecutor) {
        this.agentLoop = agentLoop;
        this.agentProperties = agentProperties;
        this.agentTaskExecutor = agentTaskExecutor;
    }

    public AgentEventStream streamAnswer(String conversationId, String question) {
        return stream(AgentRequest.builder()
                .conversationId(conversationId)
                .question(question)
                .build());
    }

    public AgentEventStream stream(AgentRequest request) {
        AgentEventStream events = new AgentEventStream(agentProperties.getStream().getQueueCapacity());
        try {
            agentTaskExecutor.execute(() -> runInto(request, events));
        } catch (RejectedExecutionException e) {
            log.error("Agent pool saturated, rejecting stream [conversationId={}]", request.getConversationId());
            events.emit(AgentEvent.error(GlobalExceptionHandler.PROCESSING_ERROR));
            events.complete();
        }
        return events;
    }

    private void runInto(AgentRequest request, AgentEventStream events) {
        try {
            agentLoop.run(request, new StreamingListener(events));
        } catch (ConversationBusyException e) {
            events.emit(AgentEvent.error(BUSY_MESSAGE));
        } catch (Exception e) {
            log.error("Streaming run failed [conversationId={}]", request.getConversationId(), e);
            events.emit(AgentEvent.error(GlobalExceptionHandler.PROCESSING_ERROR));
        } finally {
            events.complete();
        }
    }

    private record StreamingListener(AgentEventStream events) implements LoopListener {

        @Override
        public void onToolMessage(ToolCall call, String content) {
            events.emit(AgentEvent.toolMessage(call.getToolName(), call.getId(), content));
        }

        @Override
        public void onAssistantDelta(String delta) {
            events.emit(AgentEvent.delta(delta));
        }

        @Override
        public void onAssistantComplete(String content) {
            events.emit(AgentEvent.complete(content));
        }

        @Override
        public boolean isCancelled() {
            return events.isCancelled();
        }

        @Override
        public boolean wantsDeltas() {
            return true;
        }
    }
}
