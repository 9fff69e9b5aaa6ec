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

import me.golemcore.agent.domain.exception.DuplicateToolException;
import me.golemcore.agent.domain.exception.InvalidToolDefinitionException;
import me.golemcore.agent.domain.exception.ToolNotFoundException;
import me.golemcore.agent.domain.model.ConfirmationDecision;
import me.golemcore.agent.domain.model.ConfirmationGroup;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.domain.model.ToolArguments;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExecutionStats;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolFilter;
import me.golemcore.agent.domain.model.ToolRegistryStats;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.ValidationError;
import me.golemcore.agent.domain.model.ValidationResult;
import me.golemcore.agent.domain.service.ToolConfirmationPolicy;
import me.golemcore.agent.port.outbound.ConfirmationPort;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Default {@link ToolRegistry}.
 *
 * <p>
 * Execution pipeline for a single call:
 * <ol>
 * <li>lookup: unknown ids fail with {@link ToolFailureKind#NOT_FOUND}</li>
 * <li>validation: every violation is reported</li>
 * <li>lazy initialization, once per tool, retried on the next call when it
 * fails</li>
 * <li>confirmation gate for tools the {@link ToolConfirmationPolicy} flags</li>
 * <li>defaults applied, executor invoked; anything thrown becomes a failed
 * result</li>
 * </ol>
 * Metrics are recorded for every call that gets past validation, whether it
 * succeeds or fails.
 *
 * <p>
 * The id map is guarded by a read/write lock; metric updates are synchronized
 * per tool. Concurrent calls to the same tool are not serialized here.
 */
@Slf4j
public class DefaultToolRegistry implements ToolRegistry {

    private static final int MOST_USED_LIMIT = 10;

    private final Map<String, RegisteredTool> tools = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ToolConfirmationPolicy confirmationPolicy;
    private final ToolContext defaultContext;
    private final Clock clock;
    private final ToolComposer composer;

    public DefaultToolRegistry(ToolConfirmationPolicy confirmationPolicy, ToolContext defaultContext, Clock clock) {
        this.confirmationPolicy = confirmationPolicy;
        this.defaultContext = defaultContext;
        this.clock = clock;
        this.composer = new ToolComposer(this);
    }

    // ==================== registration ====================

    @Override
    public void register(ToolDefinition definition) {
        requireComplete(definition);
        lock.writeLock().lock();
        try {
            if (tools.containsKey(definition.getId())) {
                throw new DuplicateToolException(definition.getId());
            }
            tools.put(definition.getId(), new RegisteredTool(definition));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[Registry] Registered tool: {}", definition.getId());
    }

    @Override
    public void unregister(String toolId) {
        RegisteredTool tool;
        lock.writeLock().lock();
        try {
            tool = tools.get(toolId);
            if (tool == null) {
                throw ToolNotFoundException.forId(toolId);
            }
            if (tool.isInitialized() && tool.definition().getCleanup() != null) {
                runCleanup(tool);
            }
            tools.remove(toolId);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[Registry] Unregistered tool: {}", toolId);
    }

    // ==================== lookup ====================

    @Override
    public Optional<ToolDefinition> get(String toolId) {
        return Optional.ofNullable(lookup(toolId)).map(RegisteredTool::definition);
    }

    @Override
    public boolean contains(String toolId) {
        return lookup(toolId) != null;
    }

    @Override
    public List<ToolDefinition> list(ToolFilter filter) {
        ToolFilter effective = filter != null ? filter : ToolFilter.all();
        return snapshot().stream()
                .map(RegisteredTool::definition)
                .filter(effective::matches)
                .toList();
    }

    @Override
    public List<ToolDefinition> search(String query) {
        if (query == null || query.isBlank()) {
            return list();
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return snapshot().stream()
                .map(RegisteredTool::definition)
                .filter(definition -> matchesQuery(definition, needle))
                .toList();
    }

    @Override
    public ValidationResult validateArguments(String toolId, Map<String, ?> arguments) {
        RegisteredTool tool = lookup(toolId);
        if (tool == null) {
            return ValidationResult.of(List.of(ValidationError.of("toolId", "Tool '" + toolId + "' not found")));
        }
        try {
            return ArgumentValidator.validate(tool.definition().getArguments(), arguments);
        } catch (RuntimeException e) {
            log.warn("[Registry] Validation of '{}' arguments failed unexpectedly", toolId, e);
            return ValidationResult.of(List.of(ValidationError.of("arguments",
                    "Validation error: " + ExceptionMessages.rootMessage(e))));
        }
    }

    // ==================== execution ====================

    @Override
    public ToolResult execute(String toolId, Map<String, Object> arguments) {
        return execute(toolId, arguments, defaultContext);
    }

    @Override
    public ToolResult execute(String toolId, Map<String, Object> arguments, ToolContext context) {
        RegisteredTool tool = lookup(toolId);
        if (tool == null) {
            return ToolResult.failure(ToolFailureKind.NOT_FOUND, "Tool '" + toolId + "' not found");
        }

        Map<String, Object> safeArgs = arguments != null ? arguments : Map.of();
        ValidationResult validation = validateArguments(toolId, safeArgs);
        if (!validation.valid()) {
            log.debug("[Registry] Invalid arguments for '{}': {}", toolId, validation.messages());
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                    "Validation failed: " + String.join(", ", validation.messages()));
        }

        ToolContext effectiveContext = context != null ? context : defaultContext;
        long startNanos = System.nanoTime();
        try {
            return runAttempt(tool, safeArgs, effectiveContext);
        } finally {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            tool.recordExecution(durationMs, clock.instant());
        }
    }

    private ToolResult runAttempt(RegisteredTool tool, Map<String, Object> arguments, ToolContext context) {
        ToolDefinition definition = tool.definition();

        ToolResult initFailure = ensureInitialized(tool, context);
        if (initFailure != null) {
            return initFailure;
        }

        ToolArguments toolArguments = ToolArguments.of(
                ArgumentValidator.applyDefaults(definition.getArguments(), arguments), definition.getArguments());

        ToolResult denied = awaitConfirmation(definition, toolArguments, context);
        if (denied != null) {
            return denied;
        }

        try {
            ToolResult result = definition.getExecutor().execute(toolArguments, context);
            if (result == null) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Tool execution failed: tool returned no result");
            }
            if (!result.isSuccess() && result.getFailureKind() == null) {
                return result.withFailureKind(ToolFailureKind.TOOL_REPORTED);
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: interrupted");
        } catch (Exception e) {
            log.error("[Registry] Tool execution failed: {}", definition.getId(), e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + ExceptionMessages.rootMessage(e));
        }
    }

    private ToolResult ensureInitialized(RegisteredTool tool, ToolContext context) {
        if (tool.isInitialized() || tool.definition().getInitializer() == null) {
            return null;
        }
        tool.initializationLock().lock();
        try {
            if (tool.isInitialized()) {
                return null;
            }
            tool.definition().getInitializer().run(context);
            tool.markInitialized();
            log.debug("[Registry] Initialized tool: {}", tool.definition().getId());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.INITIALIZATION_FAILED,
                    "Failed to initialize tool: interrupted");
        } catch (Exception e) {
            log.warn("[Registry] Failed to initialize tool '{}': {}", tool.definition().getId(),
                    ExceptionMessages.rootMessage(e));
            return ToolResult.failure(ToolFailureKind.INITIALIZATION_FAILED,
                    "Failed to initialize tool: " + ExceptionMessages.rootMessage(e));
        } finally {
            tool.initializationLock().unlock();
        }
    }

    private ToolResult awaitConfirmation(ToolDefinition definition, ToolArguments arguments, ToolContext context) {
        if (!confirmationPolicy.requiresConfirmation(definition)) {
            return null;
        }
        ConfirmationGroup group = confirmationPolicy.groupOf(definition);
        if (context.getConfirmationFlags().isApproved(group) || context.isApprovedForCall(group)) {
            return null;
        }

        ConfirmationPort gate = context.getConfirmationGate();
        if (gate == null || !gate.isAvailable()) {
            return ToolResult.failure(ToolFailureKind.CONFIRMATION_DENIED,
                    "Confirmation required for '" + definition.getId() + "' but no confirmation channel is available");
        }

        String description = confirmationPolicy.describeAction(definition, arguments);
        log.info("[Tools] Requesting confirmation for '{}': {}", definition.getId(), description);
        ConfirmationRequest request = new ConfirmationRequest(context.getSessionId(), definition.getId(),
                definition.getName(), description, group);

        ConfirmationDecision decision;
        try {
            decision = gate.requestConfirmation(request)
                    .get(confirmationPolicy.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.CONFIRMATION_DENIED, "Confirmation interrupted");
        } catch (ExecutionException | TimeoutException e) {
            log.error("[Tools] Confirmation request failed, denying", e);
            return ToolResult.failure(ToolFailureKind.CONFIRMATION_DENIED,
                    "Confirmation failed: " + ExceptionMessages.rootMessage(e));
        }

        if (decision == null || !decision.isApproved()) {
            return ToolResult.failure(ToolFailureKind.CONFIRMATION_DENIED, "Cancelled by user");
        }
        if (decision == ConfirmationDecision.APPROVED_FOR_SESSION) {
            context.getConfirmationFlags().approveForSession(group);
        }
        context.approveForCall(group);
        return null;
    }

    private void runCleanup(RegisteredTool tool) {
        try {
            tool.definition().getCleanup().run(defaultContext);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Registry] Cleanup of '{}' interrupted", tool.definition().getId());
        } catch (Exception e) {
            log.warn("[Registry] Cleanup of '{}' failed: {}", tool.definition().getId(),
                    ExceptionMessages.rootMessage(e), e);
        }
    }

    // ==================== composition & stats ====================

    @Override
    public ToolDefinition compose(CompositionPattern pattern, List<String> toolIds, CompositionConfig config) {
        List<ToolDefinition> members = new ArrayList<>();
        for (String toolId : toolIds) {
            members.add(get(toolId).orElseThrow(
                    () -> new ToolNotFoundException("Tool '" + toolId + "' not found for composition")));
        }
        return composer.compose(pattern, members, config != null ? config : CompositionConfig.defaults());
    }

    @Override
    public ToolRegistryStats getStats() {
        List<RegisteredTool> all = snapshot();
        Map<ToolCategory, Long> byCategory = new EnumMap<>(ToolCategory.class);
        Map<ToolCapability, Long> byCapability = new EnumMap<>(ToolCapability.class);
        for (RegisteredTool tool : all) {
            ToolCategory category = tool.definition().getCategory() != null
                    ? tool.definition().getCategory()
                    : ToolCategory.CUSTOM;
            byCategory.merge(category, 1L, Long::sum);
            for (ToolCapability capability : tool.definition().getCapabilities()) {
                byCapability.merge(capability, 1L, Long::sum);
            }
        }
        List<ToolExecutionStats> mostUsed = all.stream()
                .map(RegisteredTool::stats)
                .filter(stats -> stats.executionCount() > 0)
                .sorted(Comparator.comparingLong(ToolExecutionStats::executionCount).reversed())
                .limit(MOST_USED_LIMIT)
                .toList();
        return new ToolRegistryStats(all.size(), byCategory, byCapability, mostUsed);
    }

    @Override
    public Optional<ToolExecutionStats> getExecutionStats(String toolId) {
        return Optional.ofNullable(lookup(toolId)).map(RegisteredTool::stats);
    }

    @Override
    public ToolContext getDefaultContext() {
        return defaultContext;
    }

    @Override
    public void setWorkingDirectory(Path directory) {
        defaultContext.setWorkingDirectory(directory);
    }

    // ==================== internals ====================

    private RegisteredTool lookup(String toolId) {
        if (toolId == null) {
            return null;
        }
        lock.readLock().lock();
        try {
            return tools.get(toolId);
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<RegisteredTool> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(tools.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static boolean matchesQuery(ToolDefinition definition, String needle) {
        return contains(definition.getId(), needle)
                || contains(definition.getName(), needle)
                || contains(definition.getDescription(), needle)
                || definition.getTags().stream().anyMatch(tag -> contains(tag, needle));
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static void requireComplete(ToolDefinition definition) {
        if (definition == null || definition.getId() == null || definition.getId().isBlank()) {
            throw new InvalidToolDefinitionException("Tool ID is required");
        }
        if (definition.getDescription() == null || definition.getDescription().isBlank()) {
            throw new InvalidToolDefinitionException("Tool description is required for '" + definition.getId() + "'");
        }
        if (definition.getExecutor() == null) {
            throw new InvalidToolDefinitionException("Tool executor is required for '" + definition.getId() + "'");
        }
    }
}
