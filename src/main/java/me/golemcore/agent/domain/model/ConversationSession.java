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

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conversation state of one console session: message history, selected model
 * and the tool context shared by every tool call of the session.
 */
@Getter
public class ConversationSession {

    @Getter(AccessLevel.NONE)
    private final List<Message> messages = new ArrayList<>();
    private final ToolContext toolContext;
    @Setter
    private String model;

    public ConversationSession(ToolContext toolContext, String model) {
        this.toolContext = toolContext;
        this.model = model;
    }

    public String getId() {
        return toolContext.getSessionId();
    }

    public synchronized void addMessage(Message message) {
        messages.add(message);
    }

    public synchronized List<Message> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public synchronized void clear() {
        messages.clear();
    }
}
