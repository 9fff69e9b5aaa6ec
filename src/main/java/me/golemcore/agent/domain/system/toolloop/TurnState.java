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

import me.golemcore.agent.domain.model.TurnPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable state of one user turn. Owned by a single
 * {@link StreamingToolLoopSystem#processTurn} invocation and discarded when it
 * returns.
 */
class TurnState {

    private static final Logger log = LoggerFactory.getLogger(TurnState.class);

    private final String sessionId;
    private TurnPhase phase = TurnPhase.AWAITING_MODEL;
    private int round;
    private int requests;
    private int toolExecutions;
    private int inputTokens;
    private int outputTokens;
    private String finalContent = "";

    TurnState(String sessionId) {
        this.sessionId = sessionId;
    }

    void transition(TurnPhase next) {
        if (phase.isTerminal()) {
            throw new IllegalStateException("Turn already finished in " + phase);
        }
        log.trace("[ToolLoop] {}: {} -> {} (round {})", sessionId, phase, next, round);
        phase = next;
    }

    TurnPhase phase() {
        return phase;
    }

    int round() {
        return round;
    }

    void nextRound() {
        round++;
    }

    int requests() {
        return requests;
    }

    void requestSent() {
        requests++;
    }

    int toolExecutions() {
        return toolExecutions;
    }

    void toolExecuted() {
        toolExecutions++;
    }

    int inputTokens() {
        return inputTokens;
    }

    int outputTokens() {
        return outputTokens;
    }

    void updateTokens(int input, int output) {
        this.inputTokens = input;
        this.outputTokens = output;
    }

    String finalContent() {
        return finalContent;
    }

    void finalContent(String content) {
        this.finalContent = content != null ? content : "";
    }

    ToolLoopTurnResult toResult() {
        return new ToolLoopTurnResult(phase, finalContent, requests, toolExecutions, inputTokens, outputTokens);
    }
}
