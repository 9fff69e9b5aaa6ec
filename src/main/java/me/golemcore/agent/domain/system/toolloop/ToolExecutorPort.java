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

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolFailureKind;

/**
 * Hexagonal outbound port for executing a single tool call.
 *
 * <p>
 * ToolLoopSystem is the owner of the loop; it invokes this port for each
 * finalized tool call. Implementations never throw for per-tool failures.
 */
public interface ToolExecutorPort {

    ToolExecutionOutcome execute(ToolContext context, Message.ToolCall toolCall);

    /**
     * Answers a call that will not run, e.g. because the turn was cancelled.
     */
    default ToolExecutionOutcome skip(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        return ToolExecutionOutcome.synthetic(toolCall, kind, reason);
    }
}
