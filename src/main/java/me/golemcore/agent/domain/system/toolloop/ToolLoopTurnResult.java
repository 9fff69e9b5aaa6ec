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

/**
 * Outcome of one user turn.
 *
 * @param phase
 *            terminal phase, DONE or CANCELLED
 * @param finalContent
 *            text of the last assistant message, empty when cancelled before
 *            any content arrived
 * @param rounds
 *            model requests sent during the turn
 * @param toolExecutions
 *            tool calls executed, synthetic results excluded
 * @param inputTokens
 *            estimated size of the history the next request would send
 * @param outputTokens
 *            estimated size of the assistant output of this turn
 */
public record ToolLoopTurnResult(TurnPhase phase, String finalContent, int rounds, int toolExecutions,
        int inputTokens, int outputTokens) {

    public boolean isDone() {
        return phase == TurnPhase.DONE;
    }

    public boolean isCancelled() {
        return phase == TurnPhase.CANCELLED;
    }
}
