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

import me.golemcore.agent.domain.model.ConversationSession;
import me.golemcore.agent.domain.model.Message;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Default implementation that appends timestamped messages to the session
 * history.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendUserMessage(ConversationSession session, String text) {
        session.addMessage(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_USER)
                .content(text)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendAssistantToolCalls(ConversationSession session, String content,
            List<Message.ToolCall> toolCalls) {
        session.addMessage(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .toolCalls(List.copyOf(toolCalls))
                .timestamp(now())
                .build());
    }

    @Override
    public void appendToolResult(ConversationSession session, ToolExecutionOutcome outcome) {
        session.addMessage(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .timestamp(now())
                .build());
    }

    @Override
    public void appendFinalAssistantAnswer(ConversationSession session, String finalText) {
        session.addMessage(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(finalText)
                .timestamp(now())
                .build());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
