package com.amblue.agent.api;

import com.amblue.agent.config.AgentProperties;
import com.amblue.agent.core.AgentLoop;
import com.amblue.agent.model.AgentRequest;
import com.amblue.agent.model.AgentResponse;
import com.amblue.agent.stream.AgentEvent;
import com.amblue.agent.stream.AgentEventStream;
import com.amblue.agent.stream.AgentStreamService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Agent endpoints.
 *
 * POST /api/v1/agent        : runs the loop on the request thread, returns the final answer
 * POST /api/v1/agent/stream : text/event-stream; SSE event name = event type, data = event JSON
 * GET  /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@Slf4j
public class AgentController {

    private final AgentLoop agentLoop;
    private final AgentStreamService agentStreamService;
    private final AgentProperties agentProperties;
    private final ObjectMapper objectMapper;
    private final Executor sseTaskExecutor;

    public AgentController(AgentLoop agentLoop,
                           AgentStreamService agentStreamService,
                           AgentProperties agentProperties,
                           ObjectMapper objectMapper,
                           @Qualifier("sseTaskExecutor") Executor sseTaskExecutor) {
        this.agentLoop = agentLoop;
        this.agentStreamService = agentStreamService;
        this.agentProperties = agentProperties;
        this.objectMapper = objectMapper;
        this.sseTaskExecutor = sseTaskExecutor;
    }

    @PostMapping
    public ResponseEntity<AgentResponse> run(@Valid @RequestBody AgentRequest request) {
        log.info("Agent request [conversationId={}, userId={}]", request.getConversationId(), request.getUserId());
        return ResponseEntity.ok(agentLoop.run(request));
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody AgentRequest request) {
        log.info("Agent stream request [conversationId={}, userId={}]", request.getConversationId(), request.getUserId());

        SseEmitter emitter = new SseEmitter(agentProperties.getStream().getTimeoutMs());
        AgentEventStream events = agentStreamService.stream(request);

        emitter.onTimeout(events::cancel);
        emitter.onError(ex -> events.cancel());

        sseTaskExecutor.execute(() -> drain(events, emitter, request.getConversationId()));
        return emitter;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private void drain(AgentEventStream events, SseEmitter emitter, String conversationId) {
        try {
            while (events.hasNext()) {
                AgentEvent event = events.next();
                emitter.send(SseEmitter.event()
                        .name(event.type().wireName())
                        .data(objectMapper.writeValueAsString(event)));
            }
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            // Client went away; the container reports the broken connection itself
            log.warn("SSE stream aborted by client [conversationId={}]: {}", conversationId, e.getMessage());
            events.cancel();
        }
    }
}
