package me.golemcore.agent.domain.system.toolloop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agent.domain.exception.LlmProviderException;
import me.golemcore.agent.domain.exception.RoundLimitExceededException;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ConversationSession;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolCallDelta;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.TurnEvent;
import me.golemcore.agent.domain.model.TurnPhase;
import me.golemcore.agent.domain.tool.ExceptionMessages;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.domain.tool.ToolSchemaGenerator;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Tool loop orchestrator (single-turn internal loop).
 *
 * <p>
 * Each round sends the full history plus the schemas of every registered tool.
 * While the response streams, content deltas are forwarded to the listener and
 * tool-call fragments are reassembled; on the finish signal the calls are
 * frozen, executed and their results appended in issue order. The turn ends
 * when the model answers without tool calls.
 *
 * <pre>
 * AWAITING_MODEL -> STREAMING_RESPONSE -> EXECUTING_TOOLS -> AWAITING_MODEL ...
 *                                      -> DONE
 * </pre>
 *
 * When the round counter reaches {@code maxToolRounds} before a request is
 * sent, the turn aborts with {@link RoundLimitExceededException}. A
 * cancellation observed before a round, between chunks or before a tool call
 * ends the turn in {@link TurnPhase#CANCELLED}; tools already running are
 * allowed to finish.
 */
public class StreamingToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(StreamingToolLoopSystem.class);

    private static final String CANCELLED_REASON = "Cancelled before execution";

    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final TokenCounter tokenCounter;
    private final AgentProperties.ToolLoopProperties settings;
    private final AgentProperties.LlmProperties llmSettings;
    private final Executor parallelExecutor;
    private final Clock clock;

    public StreamingToolLoopSystem(LlmPort llmPort, ToolRegistry toolRegistry, ToolExecutorPort toolExecutor,
            HistoryWriter historyWriter, TokenCounter tokenCounter, AgentProperties.ToolLoopProperties settings,
            AgentProperties.LlmProperties llmSettings, Executor parallelExecutor) {
        this(llmPort, toolRegistry, toolExecutor, historyWriter, tokenCounter, settings, llmSettings,
                parallelExecutor, Clock.systemUTC());
    }

    // Visible for testing
    public StreamingToolLoopSystem(LlmPort llmPort, ToolRegistry toolRegistry, ToolExecutorPort toolExecutor,
            HistoryWriter historyWriter, TokenCounter tokenCounter, AgentProperties.ToolLoopProperties settings,
            AgentProperties.LlmProperties llmSettings, Executor parallelExecutor, Clock clock) {
        this.llmPort = llmPort;
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.tokenCounter = tokenCounter;
        this.settings = settings != null ? settings : new AgentProperties.ToolLoopProperties();
        this.llmSettings = llmSettings != null ? llmSettings : new AgentProperties.LlmProperties();
        this.parallelExecutor = parallelExecutor;
        this.clock = clock;
    }

    @Override
    public ToolLoopTurnResult processTurn(ConversationSession session, String userText, TurnEventListener listener,
            CancellationToken cancellation) {
        boolean streaming = llmSettings.isStream() && llmPort.supportsStreaming();
        return runTurn(session, userText, listener != null ? listener : TurnEventListener.NOOP,
                cancellation != null ? cancellation : CancellationToken.none(), streaming);
    }

    @Override
    public ToolLoopTurnResult chat(ConversationSession session, String userText) {
        return runTurn(session, userText, TurnEventListener.NOOP, CancellationToken.none(), false);
    }

    private ToolLoopTurnResult runTurn(ConversationSession session, String userText, TurnEventListener listener,
            CancellationToken cancellation, boolean streaming) {
        Instant started = clock.instant();
        TurnState state = new TurnState(session.getId());
        int turnStart = session.snapshot().size();

        historyWriter.appendUserMessage(session, userText);
        recountTokens(session, turnStart, state, listener);

        int maxRounds = settings.getMaxToolRounds();
        while (true) {
            if (cancellation.isCancelled()) {
                return finishCancelled(state, listener);
            }
            if (state.round() >= maxRounds) {
                state.transition(TurnPhase.ROUND_LIMIT_EXCEEDED);
                log.warn("[ToolLoop] Round limit reached ({}) in session {}", maxRounds, session.getId());
                throw new RoundLimitExceededException(maxRounds);
            }

            LlmRequest request = buildRequest(session, streaming);
            state.requestSent();
            RoundResponse response = streaming
                    ? streamRound(request, state, listener, cancellation)
                    : callRound(request, state);

            if (response.cancelled()) {
                if (!response.content().isEmpty()) {
                    historyWriter.appendFinalAssistantAnswer(session, response.content());
                    state.finalContent(response.content());
                    recountTokens(session, turnStart, state, listener);
                }
                return finishCancelled(state, listener);
            }

            if (response.toolCalls().isEmpty()) {
                if (LlmChunk.FINISH_TOOL_CALLS.equals(response.finishReason())) {
                    log.warn("[ToolLoop] Finish reason '{}' without tool calls, requesting again (round {})",
                            response.finishReason(), state.round());
                    state.transition(TurnPhase.AWAITING_MODEL);
                    state.nextRound();
                    continue;
                }
                historyWriter.appendFinalAssistantAnswer(session, response.content());
                state.finalContent(response.content());
                recountTokens(session, turnStart, state, listener);
                state.transition(TurnPhase.DONE);
                listener.onEvent(TurnEvent.done());
                log.info("[ToolLoop] Turn done: {} requests, {} tool executions, {} ms", state.requests(),
                        state.toolExecutions(), Duration.between(started, clock.instant()).toMillis());
                return state.toResult();
            }

            historyWriter.appendAssistantToolCalls(session, emptyToNull(response.content()), response.toolCalls());
            state.finalContent(response.content());
            recountTokens(session, turnStart, state, listener);
            listener.onEvent(TurnEvent.toolCalls(response.toolCalls()));

            state.transition(TurnPhase.EXECUTING_TOOLS);
            executeTools(session, response.toolCalls(), state, listener, cancellation, turnStart);

            if (cancellation.isCancelled()) {
                return finishCancelled(state, listener);
            }
            state.transition(TurnPhase.AWAITING_MODEL);
            state.nextRound();
        }
    }

    // ==================== model rounds ====================

    private RoundResponse streamRound(LlmRequest request, TurnState state, TurnEventListener listener,
            CancellationToken cancellation) {
        state.transition(TurnPhase.STREAMING_RESPONSE);
        StringBuilder content = new StringBuilder();
        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        String[] finishReason = new String[1];

        llmPort.chatStream(request)
                .takeWhile(chunk -> !cancellation.isCancelled())
                .doOnNext(chunk -> {
                    if (chunk.hasText()) {
                        content.append(chunk.getText());
                        listener.onEvent(TurnEvent.content(chunk.getText()));
                    }
                    if (chunk.hasToolCallDeltas()) {
                        for (ToolCallDelta delta : chunk.getToolCallDeltas()) {
                            accumulator.accept(delta);
                        }
                    }
                    if (chunk.getFinishReason() != null) {
                        finishReason[0] = chunk.getFinishReason();
                    }
                    logProviderUsage(chunk.getUsage());
                })
                .blockLast();

        if (cancellation.isCancelled()) {
            return new RoundResponse(content.toString(), List.of(), finishReason[0], true);
        }
        return new RoundResponse(content.toString(), accumulator.finish(), finishReason[0], false);
    }

    private RoundResponse callRound(LlmRequest request, TurnState state) {
        state.transition(TurnPhase.STREAMING_RESPONSE);
        LlmResponse response;
        try {
            response = llmPort.chat(request).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new LlmProviderException("Provider API error: " + e.getMessage(), e);
        }
        if (response == null) {
            return new RoundResponse("", List.of(), null, false);
        }
        logProviderUsage(response.getUsage());
        String content = response.getContent() != null ? response.getContent() : "";
        List<Message.ToolCall> toolCalls = response.hasToolCalls() ? response.getToolCalls() : List.of();
        return new RoundResponse(content, toolCalls, response.getFinishReason(), false);
    }

    // Provider counts are logged only; turn totals come from the token counter
    private void logProviderUsage(LlmUsage usage) {
        if (usage != null) {
            log.debug("[ToolLoop] Provider reported {} input, {} output tokens", usage.getInputTokens(),
                    usage.getOutputTokens());
        }
    }

    private LlmRequest buildRequest(ConversationSession session, boolean streaming) {
        List<ToolDefinition> tools = toolRegistry.list();
        return LlmRequest.builder()
                .model(session.getModel())
                .systemPrompt(buildSystemPrompt(session, tools))
                .messages(new ArrayList<>(session.snapshot()))
                .tools(new ArrayList<>(ToolSchemaGenerator.toSchemas(tools)))
                .temperature(llmSettings.getTemperature())
                .maxTokens(llmSettings.getMaxTokens())
                .stream(streaming)
                .build();
    }

    private String buildSystemPrompt(ConversationSession session, List<ToolDefinition> tools) {
        StringBuilder prompt = new StringBuilder();
        if (llmSettings.getSystemPrompt() != null && !llmSettings.getSystemPrompt().isBlank()) {
            prompt.append(llmSettings.getSystemPrompt().strip()).append("\n\n");
        }
        prompt.append("Working directory: ").append(session.getToolContext().getWorkingDirectory()).append('\n');
        String toolSection = ToolSchemaGenerator.promptSection(tools);
        if (!toolSection.isEmpty()) {
            prompt.append('\n').append(toolSection);
        }
        return prompt.toString();
    }

    // ==================== tool execution ====================

    private void executeTools(ConversationSession session, List<Message.ToolCall> toolCalls, TurnState state,
            TurnEventListener listener, CancellationToken cancellation, int turnStart) {
        if (settings.isParallelToolCalls() && parallelExecutor != null && toolCalls.size() > 1) {
            executeInParallel(session, toolCalls, state, listener, cancellation, turnStart);
            return;
        }
        for (Message.ToolCall toolCall : toolCalls) {
            ToolExecutionOutcome outcome = executeOne(session, toolCall, cancellation);
            appendOutcome(session, toolCall, outcome, state, listener, turnStart);
        }
    }

    /**
     * Independent calls run concurrently, calls to the same tool are chained,
     * and results are still appended in issue order.
     */
    private void executeInParallel(ConversationSession session, List<Message.ToolCall> toolCalls, TurnState state,
            TurnEventListener listener, CancellationToken cancellation, int turnStart) {
        Map<String, CompletableFuture<ToolExecutionOutcome>> tails = new HashMap<>();
        List<CompletableFuture<ToolExecutionOutcome>> futures = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall toolCall : toolCalls) {
            String key = String.valueOf(toolCall.getName());
            CompletableFuture<ToolExecutionOutcome> previous = tails.get(key);
            CompletableFuture<ToolExecutionOutcome> future = previous == null
                    ? CompletableFuture.supplyAsync(() -> executeOne(session, toolCall, cancellation),
                            parallelExecutor)
                    : previous.handle((ignored, error) -> toolCall)
                            .thenApplyAsync(call -> executeOne(session, call, cancellation), parallelExecutor);
            tails.put(key, future);
            futures.add(future);
        }
        for (int i = 0; i < toolCalls.size(); i++) {
            Message.ToolCall toolCall = toolCalls.get(i);
            ToolExecutionOutcome outcome;
            try {
                outcome = futures.get(i).join();
            } catch (CompletionException e) {
                outcome = ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                        "Tool execution failed: " + ExceptionMessages.rootMessage(e));
            }
            appendOutcome(session, toolCall, outcome, state, listener, turnStart);
        }
    }

    private ToolExecutionOutcome executeOne(ConversationSession session, Message.ToolCall toolCall,
            CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            return toolExecutor.skip(toolCall, ToolFailureKind.EXECUTION_FAILED, CANCELLED_REASON);
        }
        try {
            ToolExecutionOutcome outcome = toolExecutor.execute(session.getToolContext(), toolCall);
            if (outcome == null) {
                return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                        "Tool execution failed: no result");
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("[ToolLoop] Tool executor failed for '{}'", toolCall.getName(), e);
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + e.getMessage());
        }
    }

    private void appendOutcome(ConversationSession session, Message.ToolCall toolCall, ToolExecutionOutcome outcome,
            TurnState state, TurnEventListener listener, int turnStart) {
        if (!outcome.synthetic()) {
            state.toolExecuted();
        }
        historyWriter.appendToolResult(session, outcome);
        recountTokens(session, turnStart, state, listener);
        listener.onEvent(TurnEvent.toolResult(toolCall, outcome.toolResult()));
    }

    // ==================== bookkeeping ====================

    private void recountTokens(ConversationSession session, int turnStart, TurnState state,
            TurnEventListener listener) {
        List<Message> history = session.snapshot();
        int input = tokenCounter.countTokens(llmSettings.getSystemPrompt()) + tokenCounter.countTokens(history);
        int output = 0;
        for (int i = Math.min(turnStart, history.size()); i < history.size(); i++) {
            Message message = history.get(i);
            if (message.isAssistantMessage()) {
                output += tokenCounter.countTokens(List.of(message));
            }
        }
        state.updateTokens(input, output);
        listener.onEvent(TurnEvent.tokenCount(input, output));
    }

    private ToolLoopTurnResult finishCancelled(TurnState state, TurnEventListener listener) {
        state.transition(TurnPhase.CANCELLED);
        listener.onEvent(TurnEvent.cancelled());
        log.info("[ToolLoop] Turn cancelled after {} requests", state.requests());
        return state.toResult();
    }

    private static String emptyToNull(String text) {
        return text == null || text.isEmpty() ? null : text;
    }

    private record RoundResponse(String content, List<Message.ToolCall> toolCalls, String finishReason,
            boolean cancelled) {
    }
}
