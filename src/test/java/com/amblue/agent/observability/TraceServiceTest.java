package com.amblue.agent.observability;

import com.amblue.agent.exception.ModelUnavailableException;
import com.amblue.agent.model.AgentResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TraceServiceTest {

    @Mock
    private AgentRunTraceRepository traceRepository;

    @InjectMocks
    private TraceService traceService;

    @Test
    void persistTrace_success_savesRunSummary() {
        RunContext runCtx = new RunContext();
        runCtx.addTokens(100, 20);
        runCtx.recordToolCall("sql_db_list_tables", Map.of(), 12, "invoices, resources");
        AgentResponse response = AgentResponse.builder().answer("Two tables.").stepsUsed(1).build();

        traceService.persistTrace("c1", "u1", "List the tables", response, runCtx, null);

        ArgumentCaptor<AgentRunTrace> trace = ArgumentCaptor.forClass(AgentRunTrace.class);
        verify(traceRepository).save(trace.capture());
        assertThat(trace.getValue().getStatus()).isEqualTo(AgentRunTrace.Status.SUCCESS);
        assertThat(trace.getValue().getConversationId()).isEqualTo("c1");
        assertThat(trace.getValue().getTotalTokens()).isEqualTo(120);
        assertThat(trace.getValue().getStepsUsed()).isEqualTo(1);
        assertThat(trace.getValue().getToolCalls()).hasSize(1);
        assertThat(trace.getValue().getToolCalls().get(0)).containsEntry("toolName", "sql_db_list_tables");
    }

    @Test
    void persistTrace_failedRun_recordsError() {
        traceService.persistTrace("c1", "u1", "hi", null, new RunContext(),
                new ModelUnavailableException("provider down"));

        ArgumentCaptor<AgentRunTrace> trace = ArgumentCaptor.forClass(AgentRunTrace.class);
        verify(traceRepository).save(trace.capture());
        assertThat(trace.getValue().getStatus()).isEqualTo(AgentRunTrace.Status.ERROR);
        assertThat(trace.getValue().getErrorMessage()).isEqualTo("provider down");
        assertThat(trace.getValue().getAnswer()).isNull();
    }

    @Test
    void persistTrace_repositoryFailure_doesNotPropagate() {
        when(traceRepository.save(any(AgentRunTrace.class))).thenThrow(new IllegalStateException("mongo down"));

        assertThatCode(() -> traceService.persistTrace("c1", "u1", "hi",
                AgentResponse.builder().answer("ok").build(), new RunContext(), null))
                .doesNotThrowAnyException();
    }

    @Test
    void statusOf_mapsTerminalStates() {
        assertThat(TraceService.statusOf(AgentResponse.builder().stepBudgetExhausted(true).build(), null))
                .isEqualTo(AgentRunTrace.Status.STEP_BUDGET_EXHAUSTED);
        assertThat(TraceService.statusOf(AgentResponse.builder().cancelled(true).build(), null))
                .isEqualTo(AgentRunTrace.Status.CANCELLED);
        assertThat(TraceService.statusOf(null, null)).isEqualTo(AgentRunTrace.Status.ERROR);
    }

    @Test
    void getAnalytics_combinesAggregations() {
        when(traceRepository.avgLatencyForUser("u1")).thenReturn(1234.4);
        when(traceRepository.totalTokensUsedSince(eq("u1"), any(Instant.class))).thenReturn(5000L);
        when(traceRepository.statusBreakdownForUser("u1")).thenReturn(List.of(
                new AgentRunTraceRepository.StatusCount("SUCCESS", 3),
                new AgentRunTraceRepository.StatusCount("ERROR", 1)));

        Map<String, Object> analytics = traceService.getAnalytics("u1");

        assertThat(analytics)
                .containsEntry("avgLatencyMs", 1234L)
                .containsEntry("totalTokensLast24h", 5000L)
                .containsEntry("statusBreakdown", Map.of("SUCCESS", 3L, "ERROR", 1L));
    }

    @Test
    void getAnalytics_noTraces_returnsZeros() {
        when(traceRepository.avgLatencyForUser(anyString())).thenReturn(null);
        when(traceRepository.totalTokensUsedSince(anyString(), any(Instant.class))).thenReturn(null);
        when(traceRepository.statusBreakdownForUser(anyString())).thenReturn(List.of());

        assertThat(traceService.getAnalytics("nobody"))
                .containsEntry("avgLatencyMs", 0L)
                .containsEntry("totalTokensLast24h", 0L);
    }
}
