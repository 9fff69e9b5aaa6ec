package me.golemcore.agent.domain.tool;

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

import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;

import java.util.Map;
import java.util.Optional;

/**
 * Executes a tool by id. Implementations never throw: every failure is
 * returned as a failed {@link ToolResult}.
 */
@FunctionalInterface
public interface ToolInvoker {

    ToolResult execute(String toolId, Map<String, Object> arguments, ToolContext context);

    /**
     * Definition behind the id, when this invoker knows it.
     */
    default Optional<ToolDefinition> describe(String toolId) {
        return Optional.empty();
    }
}
