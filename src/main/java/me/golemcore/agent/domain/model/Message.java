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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Represents a single message in a conversation between user and assistant.
 * Supports multiple roles (user, assistant, system, tool) and carries the tool
 * calls requested by the assistant or the call id a tool result answers.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String role; // user, assistant, system, tool
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private Instant timestamp;

    /**
     * Checks if this message is from the user.
     */
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    /**
     * Checks if this message is from the assistant.
     */
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    /**
     * Checks if this is a tool result message.
     */
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Represents a function call requested by the LLM. The arguments are the raw
     * JSON text exactly as the model produced it; parsing happens only when the
     * call is executed.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private String arguments;
    }
}
