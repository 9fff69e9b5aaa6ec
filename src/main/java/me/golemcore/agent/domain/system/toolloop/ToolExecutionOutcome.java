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
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;

/**
 * Result of a single tool execution (real or synthetic).
 *
 * @param toolCallId
 *            tool_call_id as provided by the LLM
 * @param toolName
 *            tool name (as used in history)
 * @param toolResult
 *            raw ToolResult (success/failure + structured data)
 * @param messageContent
 *            content to write into the "tool" message (possibly truncated)
 * @param synthetic
 *            whether this result was produced without executing the tool
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult,
        String messageContent, boolean synthetic) {

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), ToolResult.failure(kind, reason),
                "Error: " + reason, true);
    }
}
