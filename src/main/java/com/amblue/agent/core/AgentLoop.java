package com.amblue.agent.core;

import com.amblue.agent.checkpoint.CheckpointStore;
import com.amblue.agent.checkpoint.ConversationState;
import com.amblue.agent.config.AgentProperties;
import com.amblue.agent.llm.LlmClient;
import com.amblue.agent.model.AgentRequest;
import com.amblue.agent.model.AgentResponse;
import com.amblue.agent.model.LlmResponse;
import com.amblue.agent.model.Message;
import com.amblue.agent.model.ToolCall;
import com.amblue.agent.observability.RunContext;
import com.amblue.agent.observability.TraceService;
import com.amblue.agent.tool.ToolDefinition;
import com.amblue.agent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Core ReAct (Reason → Act → Observe) agent loop.
 *
 * Per-request flow:
 * 1. Lock the conversation (one loop per conversation id at a time)
 * 2. Load the checkpoint, answer any tool calls a previous run left open
 * 3. Reset the step budget, append the human message
 * 4. THINKING: model call with system prompt + history
 *    - no tool calls → append, TERMINATED
 *    - tool calls on the last step → refuse them, append the step-limit message, TERMINATED
 *    - tool calls otherwise → append, ACTING
 * 5. ACTING: run each call in request order, append one tool message per call,
 *    spend one step, back to THINKING
 * 6. Async: persist the run trace
 *
 * The checkpoint is saved before every model call, before every tool call and on
 * termination, so a crash loses at most the step in flight.
 */
@Service
@Slf4j
public class AgentLoop {

    static final String STEP_LIMIT_MESSAGE = "Sorry, need more steps to process this request.";

    static final String INTERRUPTED_TOOL_CALL =
            "ERROR: This tool call was interrupted before it returned a result. Call the tool again if you still need it.";

    static final String DEFAULT_SYSTEM_PROMPT = """
            You are a helpful and knowledgeable assistant with access to tools. Your goal is to give accurate \
            answers to user questions by using the appropriate tools.

            You have two kinds of tools:
            1. SQL database tools
            2. A document retrieval tool

            When using SQL tools:
            - Start by listing the available tables with `sql_db_list_tables` and pick the ones related to the question.
            - Look at the schema of those tables with `sql_db_schema`.
            - Check your query with `sql_db_query_checker`, then run it with `sql_db_query`.
            - Never write data. INSERT, UPDATE, DELETE, DROP and other DML/DDL statements are rejected.
            - Use the exact column names and types from the schema; do not assume the schema.
            - Select only the columns and rows you need. Use WHERE clauses to filter and aggregate \
            functions (SUM, AVG, COUNT) for calculations instead of fetching raw rows. Avoid SELECT *.
            - If a query fails, read the error, fix the query and try again. Try alternative tables or \
            queries for a couple of iterations before giving up.

            When using the document retrieval tool:
            - Use clear, specific queries.
            - Combine information from several documents when needed.

            Guidelines:
            - Use the SQL tools for specific data points, calculations and statistics from the database.
            - Use the document retrieval tool for general knowledge and explanations not stored in the database.
            - If a question needs both, use both and combine the results.
            - If the tools return nothing useful, answer from your own knowledge and say so.
            - Never claim to know something the tools did not provide. If information is missing, say what \
            is missing and how the user might refine the question.
            - Never mention tool names or table names when speaking to the user.
            """;

    private final LlmClient llmClient;
    private final ToolRegistry toolRegistry;
    private final CheckpointStore checkpointStore;
    private final ConversationLockRegistry lockRegistry;
    private final AgentProperties agentProperties;
    private final TraceService traceService;

    public AgentLoop(LlmClient llmClient,
                     ToolRegistry toolRegistry,
                     CheckpointStore checkpointStore,
                     ConversationLockRegistry lockRegistry,
                     AgentProperties agentProperties,
                     TraceService traceService) {
        this.llmClient = llmClient;
        this.toolRegistry = toolRegistry;
        this.checkpointStore = checkpointStore;
        this.lockRegistry = lockRegistry;
        this.agentProperties = agentProperties;
        this.traceService = traceService;
    }

    /**
     * Runs the loop to termination and returns the final assistant content.
     */
    public String answer(String conversationId, String question) {
        return run(AgentRequest.builder()
                .conversationId(conversationId)
                .question(question)
                .build()).getAnswer();
    }

    public AgentResponse run(AgentRequest request) {
        return run(request, LoopListener.NONE);
    }

    public AgentResponse run(AgentRequest request, LoopListener listener) {
        String conversationId = resolveConversationId(request.getConversationId());
        String userId = request.getUserId() != null && !request.getUserId().isBlank() ? request.getUserId() : "default";

        log.info("Agent run started [conversationId={}, userId={}, question='{}']",
                conversationId, userId, request.getQuestion());

        RunContext runCtx = new RunContext();
        AgentResponse response = null;
        Throwable error = null;

        try (ConversationLockRegistry.Lease ignored = lockRegistry.acquire(conversationId)) {
            ConversationState state = checkpointStore.load(conversationId);
            repairInterruptedToolCalls(state);
            state.setRemainingSteps(agentProperties.getMaxSteps());
            state.append(Message.human(request.getQuestion()));

            response = executeLoop(conversationId, state, listener, runCtx);
            return response;

        } catch (RuntimeException e) {
            error = e;
            log.error("Agent run failed [conversationId={}]: {}", conversationId, e.getMessage());
            throw e;
        } finally {
            traceService.persistTrace(conversationId, userId, request.getQuestion(), response, runCtx, error);
            log.info("Agent run finished [conversationId={}, steps={}, latency={}ms, tokens={}]",
                    conversationId, response != null ? response.getStepsUsed() : 0,
                    runCtx.elapsedMs(), runCtx.totalTokens());
        }
    }

    private AgentResponse executeLoop(String conversationId, ConversationState state,
                                      LoopListener listener, RunContext runCtx) {
        List<ToolDefinition> tools = toolRegistry.getAllDefinitions();
        List<ToolCall> executed = new ArrayList<>();
        int stepsUsed = 0;
        LoopPhase phase = LoopPhase.THINKING;

        while (phase != LoopPhase.TERMINATED) {
            if (listener.isCancelled()) {
                checkpointStore.save(conversationId, state);
                log.info("Agent run cancelled by caller [conversationId={}, steps={}]", conversationId, stepsUsed);
                return response(conversationId, state, null, executed, stepsUsed)
                        .cancelled(true)
                        .build();
            }

            // THINKING
            log.info("Thinking [conversationId={}, remainingSteps={}]", conversationId, state.getRemainingSteps());
            checkpointStore.save(conversationId, state);

            List<Message> prompt = buildPrompt(state);
            LlmResponse llmResponse = listener.wantsDeltas()
                    ? llmClient.streamChat(prompt, tools, listener::onAssistantDelta)
                    : llmClient.chat(prompt, tools);
            runCtx.addTokens(llmResponse.getPromptTokens(), llmResponse.getCompletionTokens());

            if (!llmResponse.hasToolCalls()) {
                String answer = llmResponse.getContent() != null ? llmResponse.getContent() : "";
                state.append(Message.assistant(answer));
                checkpointStore.save(conversationId, state);
                listener.onAssistantComplete(answer);
                return response(conversationId, state, answer, executed, stepsUsed).build();
            }

            if (state.isLastStep()) {
                log.warn("Step budget exhausted, refusing {} tool call(s) [conversationId={}]",
                        llmResponse.getToolCalls().size(), conversationId);
                state.append(Message.assistant(STEP_LIMIT_MESSAGE));
                checkpointStore.save(conversationId, state);
                listener.onAssistantComplete(STEP_LIMIT_MESSAGE);
                return response(conversationId, state, STEP_LIMIT_MESSAGE, executed, stepsUsed)
                        .stepBudgetExhausted(true)
                        .build();
            }

            // ACTING
            phase = LoopPhase.ACTING;
            state.append(llmResponse.toAssistantMessage());

            for (ToolCall call : llmResponse.getToolCalls()) {
                log.info("Model requested tool: [{}] [conversationId={}]", call.getToolName(), conversationId);
                checkpointStore.save(conversationId, state);

                long toolStart = System.currentTimeMillis();
                String observation = toolRegistry.execute(call);
                runCtx.recordToolCall(call.getToolName(), call.getArguments(),
                        System.currentTimeMillis() - toolStart, observation);

                state.append(Message.tool(call, observation));
                executed.add(call);
                listener.onToolMessage(call, observation);
            }

            state.setRemainingSteps(state.getRemainingSteps() - 1);
            stepsUsed++;
            phase = LoopPhase.THINKING;
        }

        throw new IllegalStateException("Loop left without an answer");
    }

    /**
     * A run that died between a model turn and its tool results leaves tool calls
     * without answers, which providers reject. Each gets a tool message saying so.
     */
    private void repairInterruptedToolCalls(ConversationState state) {
        List<ToolCall> pending = state.pendingToolCalls();
        if (pending.isEmpty()) return;

        log.warn("Repairing {} interrupted tool call(s) [conversationId={}]",
                pending.size(), state.getConversationId());
        pending.forEach(call -> state.append(Message.tool(call, INTERRUPTED_TOOL_CALL)));
    }

    private List<Message> buildPrompt(ConversationState state) {
        List<Message> prompt = new ArrayList<>(state.getMessages().size() + 1);
        prompt.add(Message.system(systemPrompt()));
        prompt.addAll(state.getMessages());
        return prompt;
    }

    private String systemPrompt() {
        String configured = agentProperties.getSystemPrompt();
        return configured != null && !configured.isBlank() ? configured : DEFAULT_SYSTEM_PROMPT;
    }

    private AgentResponse.AgentResponseBuilder response(String conversationId, ConversationState state,
                                                        String answer, List<ToolCall> executed, int stepsUsed) {
        return AgentResponse.builder()
                .answer(answer)
                .conversationId(conversationId)
                .toolCallsExecuted(List.copyOf(executed))
                .stepsUsed(stepsUsed)
                .remainingSteps(state.getRemainingSteps());
    }

    private String resolveConversationId(String provided) {
        return provided != null && !provided.isBlank() ? provided : agentProperties.getDefaultConversationId();
    }
}
