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

import java.util.List;

/**
 * Estimates token counts of conversation text.
 */
public interface TokenCounter {

    int countTokens(String text);

    default int countTokens(List<Message> messages) {
        int total = 0;
        for (Message message : messages) {
            total += countTokens(message.getContent());
            if (message.hasToolCalls()) {
                for (Message.ToolCall call : message.getToolCalls()) {
                    total += countTokens(call.getName()) + countTokens(call.getArguments());
                }
            }
        }
        return total;
    }
}
