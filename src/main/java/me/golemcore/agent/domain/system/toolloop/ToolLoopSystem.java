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

import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ConversationSession;

/**
 * Executes LLM -> tools -> LLM loop inside a single user turn.
 */
public interface ToolLoopSystem {

    /**
     * Runs one turn, streaming when the provider supports it.
     *
     * @throws me.golemcore.agent.domain.exception.RoundLimitExceededException
     *             when the model keeps requesting tools past the round budget
     * @throws me.golemcore.agent.domain.exception.LlmProviderException
     *             on transport or API failures
     */
    ToolLoopTurnResult processTurn(ConversationSession session, String userText, TurnEventListener listener,
            CancellationToken cancellation);

    /**
     * Runs one turn over the blocking provider call, without events.
     */
    ToolLoopTurnResult chat(ConversationSession session, String userText);
}
