package me.golemcore.agent.adapter.outbound.llm;

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

import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;

import java.util.List;

/**
 * A chat backend that can be selected with {@code agent.llm.provider}.
 *
 * @see LlmProviderRouter
 */
public interface LlmProvider extends LlmPort {

    /**
     * Problems with the given settings that do not prevent requests but are
     * worth a warning at startup, such as a missing API key.
     */
    default List<String> checkSettings(AgentProperties.LlmProperties settings) {
        return List.of();
    }
}
