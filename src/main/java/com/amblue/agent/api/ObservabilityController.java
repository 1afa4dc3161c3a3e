package com.amblue.agent.api;

import com.amblue.agent.observability.AgentRunTrace;
import com.amblue.agent.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for agent run traces and analytics.
 *
 * GET /api/v1/traces/{userId}                        : all run traces for a user
 * GET /api/v1/traces/conversation/{conversationId}   : traces for one conversation
 * GET /api/v1/traces/{userId}/analytics              : aggregated stats (latency, tokens, status)
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/{userId}")
    public ResponseEntity<List<AgentRunTrace>> getTraces(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getTracesForUser(userId));
    }

    @GetMapping("/conversation/{conversationId}")
    public ResponseEntity<List<AgentRunTrace>> getConversationTraces(@PathVariable String conversationId) {
        return ResponseEntity.ok(traceService.getTracesForConversation(conversationId));
    }

    @GetMapping("/{userId}/analytics")
    public ResponseEntity<Map<String, Object>> getAnalytics(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getAnalytics(userId));
    }
}
