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

import me.golemcore.agent.domain.exception.InvalidToolDefinitionException;
import me.golemcore.agent.domain.model.ArgumentSpec;
import me.golemcore.agent.domain.model.ArgumentType;
import me.golemcore.agent.domain.model.ArgumentValue;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExample;
import me.golemcore.agent.domain.model.ToolExecutor;
import me.golemcore.agent.domain.model.ToolLifecycleHook;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Fluent builder producing validated {@link ToolDefinition}s.
 *
 * <pre>{@code
 * ToolDefinition list = ToolBuilder.create()
 *         .id("list")
 *         .description("List directory contents")
 *         .category(ToolCategory.FILE_SYSTEM)
 *         .capabilities(ToolCapability.FILE_READ)
 *         .stringArg("path", "Directory to list", arg -> arg.defaultValue("."))
 *         .execute((args, context) -> ToolResult.success("..."))
 *         .build();
 * }</pre>
 *
 * <p>
 * {@link #build()} rejects definitions without an id, a description or an
 * executor, with duplicate argument names, or with defaults that contradict
 * their own type or enumerated values. The name defaults to the id and the
 * category to {@link ToolCategory#CUSTOM}.
 */
public final class ToolBuilder {

    private String id;
    private String name;
    private String description;
    private String version;
    private String author;
    private ToolCategory category;
    private final List<String> tags = new ArrayList<>();
    private final Set<ToolCapability> capabilities = EnumSet.noneOf(ToolCapability.class);
    private final List<ArgumentSpec> arguments = new ArrayList<>();
    private final List<ToolExample> examples = new ArrayList<>();
    private boolean composable;
    private boolean retrySafe;
    private ToolExecutor executor;
    private ToolLifecycleHook initializer;
    private ToolLifecycleHook cleanup;

    private ToolBuilder() {
    }

    public static ToolBuilder create() {
        return new ToolBuilder();
    }

    public ToolBuilder id(String id) {
        this.id = id;
        return this;
    }

    public ToolBuilder name(String name) {
        this.name = name;
        return this;
    }

    public ToolBuilder description(String description) {
        this.description = description;
        return this;
    }

    public ToolBuilder version(String version) {
        this.version = version;
        return this;
    }

    public ToolBuilder author(String author) {
        this.author = author;
        return this;
    }

    public ToolBuilder category(ToolCategory category) {
        this.category = category;
        return this;
    }

    public ToolBuilder tags(String... tags) {
        this.tags.addAll(Arrays.asList(tags));
        return this;
    }

    public ToolBuilder capabilities(ToolCapability... capabilities) {
        this.capabilities.addAll(Arrays.asList(capabilities));
        return this;
    }

    public ToolBuilder capabilities(Set<ToolCapability> capabilities) {
        this.capabilities.addAll(capabilities);
        return this;
    }

    public ToolBuilder argument(ArgumentSpec spec) {
        this.arguments.add(spec);
        return this;
    }

    public ToolBuilder arguments(List<ArgumentSpec> specs) {
        this.arguments.addAll(specs);
        return this;
    }

    public ToolBuilder stringArg(String argName, String argDescription) {
        return typedArg(argName, ArgumentType.STRING, argDescription, UnaryOperator.identity());
    }

    public ToolBuilder stringArg(String argName, String argDescription,
            UnaryOperator<ArgumentSpec.ArgumentSpecBuilder> options) {
        return typedArg(argName, ArgumentType.STRING, argDescription, options);
    }

    public ToolBuilder numberArg(String argName, String argDescription,
            UnaryOperator<ArgumentSpec.ArgumentSpecBuilder> options) {
        return typedArg(argName, ArgumentType.NUMBER, argDescription, options);
    }

    public ToolBuilder booleanArg(String argName, String argDescription,
            UnaryOperator<ArgumentSpec.ArgumentSpecBuilder> options) {
        return typedArg(argName, ArgumentType.BOOLEAN, argDescription, options);
    }

    public ToolBuilder arrayArg(String argName, String argDescription,
            UnaryOperator<ArgumentSpec.ArgumentSpecBuilder> options) {
        return typedArg(argName, ArgumentType.ARRAY, argDescription, options);
    }

    public ToolBuilder objectArg(String argName, String argDescription,
            UnaryOperator<ArgumentSpec.ArgumentSpecBuilder> options) {
        return typedArg(argName, ArgumentType.OBJECT, argDescription, options);
    }

    public ToolBuilder composable(boolean composable) {
        this.composable = composable;
        return this;
    }

    /**
     * Declares that running the body again after it failed is harmless, even
     * though the tool writes files or runs commands.
     */
    public ToolBuilder retrySafe(boolean retrySafe) {
        this.retrySafe = retrySafe;
        return this;
    }

    public ToolBuilder execute(ToolExecutor executor) {
        this.executor = executor;
        return this;
    }

    public ToolBuilder onInitialize(ToolLifecycleHook initializer) {
        this.initializer = initializer;
        return this;
    }

    public ToolBuilder onCleanup(ToolLifecycleHook cleanup) {
        this.cleanup = cleanup;
        return this;
    }

    public ToolBuilder example(ToolExample example) {
        this.examples.add(example);
        return this;
    }

    public ToolBuilder examples(List<ToolExample> examples) {
        this.examples.addAll(examples);
        return this;
    }

    public ToolDefinition build() {
        if (id == null || id.isBlank()) {
            throw new InvalidToolDefinitionException("Tool ID is required");
        }
        if (description == null || description.isBlank()) {
            throw new InvalidToolDefinitionException("Tool description is required for '" + id + "'");
        }
        if (executor == null) {
            throw new InvalidToolDefinitionException("Tool executor is required for '" + id + "'");
        }
        validateArguments();

        return ToolDefinition.builder()
                .id(id)
                .name(name != null && !name.isBlank() ? name : id)
                .description(description)
                .category(category != null ? category : ToolCategory.CUSTOM)
                .capabilities(capabilities.isEmpty() ? Set.of() : Set.copyOf(capabilities))
                .arguments(List.copyOf(arguments))
                .executor(executor)
                .initializer(initializer)
                .cleanup(cleanup)
                .examples(List.copyOf(examples))
                .tags(List.copyOf(tags))
                .version(version)
                .author(author)
                .composable(composable)
                .retrySafe(retrySafe)
                .build();
    }

    private ToolBuilder typedArg(String argName, ArgumentType type, String argDescription,
            UnaryOperator<ArgumentSpec.ArgumentSpecBuilder> options) {
        ArgumentSpec.ArgumentSpecBuilder spec = ArgumentSpec.builder()
                .name(argName)
                .type(type)
                .description(argDescription);
        return argument(options.apply(spec).build());
    }

    private void validateArguments() {
        Set<String> seen = new HashSet<>();
        for (ArgumentSpec spec : arguments) {
            if (spec.getName() == null || spec.getName().isBlank()) {
                throw new InvalidToolDefinitionException("Argument name is required for tool '" + id + "'");
            }
            if (!seen.add(spec.getName())) {
                throw new InvalidToolDefinitionException(
                        "Duplicate argument '" + spec.getName() + "' in tool '" + id + "'");
            }
            if (spec.getType() == null) {
                throw new InvalidToolDefinitionException(
                        "Argument '" + spec.getName() + "' of tool '" + id + "' has no type");
            }
            if (spec.hasDefault()) {
                ArgumentValue defaultValue = ArgumentValue.of(spec.getDefaultValue());
                if (!ArgumentValidator.matchesType(spec.getType(), defaultValue)) {
                    throw new InvalidToolDefinitionException("Default value of '" + spec.getName()
                            + "' does not match type " + spec.getType().wireName());
                }
                if (spec.hasEnum() && !spec.getEnumValues().contains(spec.getDefaultValue())) {
                    throw new InvalidToolDefinitionException("Default value of '" + spec.getName()
                            + "' is not one of its allowed values");
                }
            }
        }
    }
}
