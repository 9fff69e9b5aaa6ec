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

import me.golemcore.agent.domain.model.ArgumentSpec;
import me.golemcore.agent.domain.model.ArgumentType;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExecutor;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Builds composite tools out of registered ones. Member tools are always
 * invoked through the registry, so they keep their own validation, metrics and
 * confirmation gating.
 */
@Slf4j
class ToolComposer {

    private static final String ITEMS = "items";
    private static final String ITEM = "item";
    private static final String ACCUMULATOR = "accumulator";
    private static final String INDEX = "index";
    private static final String INPUT = "input";

    private final ToolInvoker invoker;

    ToolComposer(ToolInvoker invoker) {
        this.invoker = invoker;
    }

    ToolDefinition compose(CompositionPattern pattern, List<ToolDefinition> members, CompositionConfig config) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Composition requires at least one tool");
        }
        List<String> ids = members.stream().map(ToolDefinition::getId).toList();
        String id = config.getId() != null
                ? config.getId()
                : pattern.idPrefix() + "_" + String.join("_", ids);
        String description = config.getDescription() != null
                ? config.getDescription()
                : pattern.idPrefix() + " composition of: " + String.join(", ", ids);

        Set<ToolCapability> capabilities = EnumSet.noneOf(ToolCapability.class);
        members.forEach(member -> capabilities.addAll(member.getCapabilities()));

        ToolExecutor executor = switch (pattern) {
        case PIPELINE -> pipeline(ids);
        case PARALLEL -> parallel(members);
        case CONDITIONAL -> conditional(members, config);
        case MAP -> map(ids.get(0), config);
        case REDUCE -> reduce(ids.get(0), config);
        };

        log.debug("[Registry] Composed {} tool '{}' from {}", pattern, id, ids);
        return ToolBuilder.create()
                .id(id)
                .description(description)
                .category(ToolCategory.COMPOSITION)
                .capabilities(capabilities)
                .arguments(argumentsFor(pattern, members, config))
                .tags("composition", pattern.idPrefix())
                .composable(true)
                .execute(executor)
                .build();
    }

    // ==================== patterns ====================

    private ToolExecutor pipeline(List<String> ids) {
        return (args, context) -> {
            Map<String, Object> currentInput = args.asMap();
            ToolResult last = null;
            for (String toolId : ids) {
                ToolResult result = invoker.execute(toolId, currentInput, context);
                if (!result.isSuccess()) {
                    return result;
                }
                currentInput = chainedInput(result);
                last = result;
            }
            return last;
        };
    }

    private ToolExecutor parallel(List<ToolDefinition> members) {
        return (args, context) -> {
            List<CompletableFuture<ToolResult>> futures = members.stream()
                    .map(member -> CompletableFuture.supplyAsync(
                            () -> invoker.execute(member.getId(), argsFor(member, args.asMap()), context)))
                    .toList();
            List<ToolResult> results = futures.stream().map(CompletableFuture::join).toList();

            List<String> errors = results.stream()
                    .filter(result -> !result.isSuccess())
                    .map(ToolResult::getError)
                    .toList();
            if (!errors.isEmpty()) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        errors.size() + " tools failed: " + String.join(", ", errors));
            }
            List<Object> data = results.stream().map(ToolComposer::payload).toList();
            return ToolResult.success(joinOutputs(results), data);
        };
    }

    private ToolExecutor conditional(List<ToolDefinition> members, CompositionConfig config) {
        String selector = config.getSelectorArgument();
        return (args, context) -> {
            String branchKey = String.valueOf(args.get(selector));
            Integer index = config.getBranches().get(branchKey);
            if (index == null || index < 0 || index >= members.size()) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                        "No tool defined for branch: " + branchKey);
            }
            ToolDefinition member = members.get(index);
            return invoker.execute(member.getId(), argsFor(member, args.asMap()), context);
        };
    }

    private ToolExecutor map(String toolId, CompositionConfig config) {
        int concurrency = Math.max(1, config.getConcurrency());
        return (args, context) -> {
            List<Object> items = args.getList(ITEMS);
            Map<String, Object> shared = withoutKeys(args.asMap(), ITEMS);

            List<Object> results = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            for (int start = 0; start < items.size(); start += concurrency) {
                List<Object> chunk = items.subList(start, Math.min(items.size(), start + concurrency));
                List<ToolResult> chunkResults = runChunk(toolId, chunk, shared, context);
                for (int i = 0; i < chunkResults.size(); i++) {
                    ToolResult result = chunkResults.get(i);
                    if (result.isSuccess()) {
                        results.add(payload(result));
                    } else if (config.isContinueOnError()) {
                        errors.add(chunk.get(i) + ": " + result.getError());
                    } else {
                        return result;
                    }
                }
            }
            return ToolResult.builder()
                    .success(true)
                    .output("Processed " + items.size() + " items" + (errors.isEmpty()
                            ? ""
                            : ", " + errors.size() + " failed"))
                    .data(results)
                    .error(errors.isEmpty() ? null : errors.size() + " items failed: " + String.join("; ", errors))
                    .build();
        };
    }

    private ToolExecutor reduce(String toolId, CompositionConfig config) {
        return (args, context) -> {
            List<Object> items = args.getList(ITEMS);
            Map<String, Object> shared = withoutKeys(args.asMap(), ITEMS);
            Object accumulator = config.getInitialValue();
            for (int index = 0; index < items.size(); index++) {
                Map<String, Object> itemArgs = new LinkedHashMap<>(shared);
                itemArgs.put(ITEM, items.get(index));
                if (accumulator != null) {
                    itemArgs.put(ACCUMULATOR, accumulator);
                }
                itemArgs.put(INDEX, index);
                ToolResult result = invoker.execute(toolId, itemArgs, context);
                if (!result.isSuccess()) {
                    return result;
                }
                accumulator = config.getReducer() != null
                        ? config.getReducer().reduce(accumulator, payload(result), index)
                        : payload(result);
            }
            return ToolResult.success(String.valueOf(accumulator), accumulator);
        };
    }

    // ==================== helpers ====================

    private List<ToolResult> runChunk(String toolId, List<Object> chunk, Map<String, Object> shared,
            ToolContext context) {
        if (chunk.size() == 1) {
            return List.of(invoker.execute(toolId, itemArgs(shared, chunk.get(0)), context));
        }
        List<CompletableFuture<ToolResult>> futures = chunk.stream()
                .map(item -> CompletableFuture.supplyAsync(
                        () -> invoker.execute(toolId, itemArgs(shared, item), context)))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private static Map<String, Object> itemArgs(Map<String, Object> shared, Object item) {
        Map<String, Object> itemArgs = new LinkedHashMap<>(shared);
        itemArgs.put(ITEM, item);
        return itemArgs;
    }

    /**
     * Only the arguments the member declares; the rest belong to its siblings.
     */
    private static Map<String, Object> argsFor(ToolDefinition member, Map<String, Object> args) {
        Map<String, Object> memberArgs = new LinkedHashMap<>();
        for (ArgumentSpec spec : member.getArguments()) {
            if (args.containsKey(spec.getName())) {
                memberArgs.put(spec.getName(), args.get(spec.getName()));
            }
        }
        return memberArgs;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> chainedInput(ToolResult result) {
        if (result.getData() instanceof Map<?, ?> data) {
            return new LinkedHashMap<>((Map<String, Object>) data);
        }
        Map<String, Object> next = new LinkedHashMap<>();
        if (result.getOutput() != null) {
            next.put(INPUT, result.getOutput());
        }
        return next;
    }

    private static Object payload(ToolResult result) {
        return result.getData() != null ? result.getData() : result.getOutput();
    }

    private static String joinOutputs(List<ToolResult> results) {
        return results.stream()
                .map(ToolResult::getOutput)
                .filter(output -> output != null && !output.isBlank())
                .collect(Collectors.joining("\n"));
    }

    private static Map<String, Object> withoutKeys(Map<String, Object> source, String... keys) {
        Map<String, Object> copy = new LinkedHashMap<>(source);
        for (String key : keys) {
            copy.remove(key);
        }
        return copy;
    }

    private static List<ArgumentSpec> argumentsFor(CompositionPattern pattern, List<ToolDefinition> members,
            CompositionConfig config) {
        return switch (pattern) {
        case PIPELINE -> members.get(0).getArguments();
        case PARALLEL -> union(members, false);
        case CONDITIONAL -> {
            List<ArgumentSpec> specs = new ArrayList<>();
            specs.add(ArgumentSpec.builder()
                    .name(config.getSelectorArgument())
                    .type(ArgumentType.ANY)
                    .description("Selects which tool runs")
                    .required(true)
                    .build());
            union(members, true).stream()
                    .filter(spec -> !spec.getName().equals(config.getSelectorArgument()))
                    .forEach(specs::add);
            yield specs;
        }
        case MAP -> withItems(members.get(0), Set.of(ITEM));
        case REDUCE -> withItems(members.get(0), Set.of(ITEM, ACCUMULATOR, INDEX));
        };
    }

    private static List<ArgumentSpec> union(List<ToolDefinition> members, boolean optional) {
        Map<String, ArgumentSpec> byName = new LinkedHashMap<>();
        for (ToolDefinition member : members) {
            for (ArgumentSpec spec : member.getArguments()) {
                byName.putIfAbsent(spec.getName(), optional ? spec.toBuilder().required(false).build() : spec);
            }
        }
        return new ArrayList<>(byName.values());
    }

    private static List<ArgumentSpec> withItems(ToolDefinition member, Set<String> supplied) {
        List<ArgumentSpec> specs = new ArrayList<>();
        specs.add(ArgumentSpec.builder()
                .name(ITEMS)
                .type(ArgumentType.ARRAY)
                .description("Items to process with " + member.getId())
                .required(true)
                .build());
        member.getArguments().stream()
                .filter(spec -> !supplied.contains(spec.getName()))
                .forEach(specs::add);
        return specs;
    }
}
