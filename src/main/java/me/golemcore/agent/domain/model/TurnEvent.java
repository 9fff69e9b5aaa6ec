package me.golemcore.agent.domain.model;

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

import java.util.List;

/**
 * Event emitted to the caller while a turn is processed.
 */
public record TurnEvent(Type type, String text, List<Message.ToolCall> toolCalls, Message.ToolCall toolCall,
        ToolResult toolResult, int inputTokens, int outputTokens) {

    public enum Type {
        CONTENT, TOOL_CALLS, TOOL_RESULT, TOKEN_COUNT, DONE, CANCELLED
    }

    public static TurnEvent content(String text) {
        return new TurnEvent(Type.CONTENT, text, null, null, null, 0, 0);
    }

    public static TurnEvent toolCalls(List<Message.ToolCall> toolCalls) {
        return new TurnEvent(Type.TOOL_CALLS, null, List.copyOf(toolCalls), null, null, 0, 0);
    }

    public static TurnEvent toolResult(Message.ToolCall toolCall, ToolResult result) {
        return new TurnEvent(Type.TOOL_RESULT, null, null, toolCall, result, 0, 0);
    }

    public static TurnEvent tokenCount(int inputTokens, int outputTokens) {
        return new TurnEvent(Type.TOKEN_COUNT, null, null, null, null, inputTokens, outputTokens);
    }

    public static TurnEvent done() {
        return new TurnEvent(Type.DONE, null, null, null, null, 0, 0);
    }

    public static TurnEvent cancelled() {
        return new TurnEvent(Type.CANCELLED, null, null, null, null, 0, 0);
    }
}
