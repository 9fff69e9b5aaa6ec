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

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable definition of a tool: identity, descriptive metadata, declared
 * side-effect capabilities, argument contract, executor and lifecycle hooks.
 *
 * <p>
 * Instances are normally produced by
 * {@link me.golemcore.agent.domain.tool.ToolBuilder}, which validates the
 * definition before building it.
 */
@Value
@Builder(toBuilder = true)
public class ToolDefinition {

    String id;
    String name;
    String description;
    ToolCategory category;
    @Builder.Default
    Set<ToolCapability> capabilities = Set.of();
    @Builder.Default
    List<ArgumentSpec> arguments = List.of();
    ToolExecutor executor;
    ToolLifecycleHook initializer;
    ToolLifecycleHook cleanup;
    @Builder.Default
    List<ToolExample> examples = List.of();
    @Builder.Default
    List<String> tags = List.of();
    String version;
    String author;
    boolean composable;
    boolean retrySafe;

    public boolean hasCapability(ToolCapability capability) {
        return capabilities != null && capabilities.contains(capability);
    }

    /**
     * True when a repeated body run may change state again: the tool writes
     * files, runs commands or asks for confirmation, and is not marked
     * {@code retrySafe}.
     */
    public boolean isSideEffecting() {
        return !retrySafe && (hasCapability(ToolCapability.FILE_WRITE)
                || hasCapability(ToolCapability.SYSTEM_EXECUTE)
                || hasCapability(ToolCapability.USER_CONFIRMATION));
    }

    public Optional<ArgumentSpec> findArgument(String argumentName) {
        return arguments.stream()
                .filter(spec -> spec.getName().equals(argumentName))
                .findFirst();
    }
}
