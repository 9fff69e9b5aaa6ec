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

import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolExecutionStats;
import me.golemcore.agent.domain.model.ToolFilter;
import me.golemcore.agent.domain.model.ToolRegistryStats;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.ValidationResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of tool definitions: registration, lookup, filtering and search,
 * validated execution, composition and per-tool usage metrics.
 */
public interface ToolRegistry extends ToolInvoker {

    /**
     * @throws me.golemcore.agent.domain.exception.DuplicateToolException
     *             if a tool with the same id is already registered
     */
    void register(ToolDefinition definition);

    /**
     * Runs the tool's cleanup hook when it was initialized, then removes it.
     *
     * @throws me.golemcore.agent.domain.exception.ToolNotFoundException
     *             if no tool with this id is registered
     */
    void unregister(String toolId);

    Optional<ToolDefinition> get(String toolId);

    @Override
    default Optional<ToolDefinition> describe(String toolId) {
        return get(toolId);
    }

    boolean contains(String toolId);

    /**
     * Tools matching the filter, in registration order.
     */
    List<ToolDefinition> list(ToolFilter filter);

    default List<ToolDefinition> list() {
        return list(ToolFilter.all());
    }

    /**
     * Case-insensitive substring search over id, name, description and tags.
     */
    List<ToolDefinition> search(String query);

    /**
     * Validates arguments against the tool's declared contract. Never throws;
     * unknown ids yield an invalid result.
     */
    ValidationResult validateArguments(String toolId, Map<String, ?> arguments);

    /**
     * Executes with the registry's default context.
     */
    ToolResult execute(String toolId, Map<String, Object> arguments);

    /**
     * Builds a composite tool from registered tools. The result is not
     * registered.
     *
     * @throws me.golemcore.agent.domain.exception.ToolNotFoundException
     *             if any of the ids is not registered
     */
    ToolDefinition compose(CompositionPattern pattern, List<String> toolIds, CompositionConfig config);

    ToolRegistryStats getStats();

    Optional<ToolExecutionStats> getExecutionStats(String toolId);

    ToolContext getDefaultContext();

    void setWorkingDirectory(Path directory);
}
