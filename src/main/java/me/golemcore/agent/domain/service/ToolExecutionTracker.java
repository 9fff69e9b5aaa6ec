package me.golemcore.agent.domain.service;

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

import me.golemcore.agent.domain.model.ExecutionStatus;
import me.golemcore.agent.domain.model.ToolExecution;
import me.golemcore.agent.domain.model.ToolExecutionEvent;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.event.SpringEventBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records the lifecycle of every tool invocation.
 *
 * <p>
 * Each call id maps to the execution created for it. The mapping lives as long
 * as the tracker (one application session), so a completion or a lookup
 * resolves correctly no matter how many other calls started or finished in the
 * meantime. {@link #clear()} drops the execution history but keeps the
 * mapping.
 */
@Component
@Slf4j
public class ToolExecutionTracker {

    private final Map<String, ToolExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, String> executionIdsByCallId = new ConcurrentHashMap<>();
    private final SpringEventBus eventBus;
    private final Clock clock;

    public ToolExecutionTracker(SpringEventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Creates an execution in EXECUTING status for the call.
     *
     * @return the execution id
     */
    public String start(String callId, String toolName, Map<String, Object> arguments) {
        String executionId = UUID.randomUUID().toString();
        ToolExecution execution = new ToolExecution(executionId, callId, toolName, arguments, clock.instant());
        executions.put(executionId, execution);
        if (callId != null) {
            String previous = executionIdsByCallId.put(callId, executionId);
            if (previous != null) {
                log.warn("[Tools] Call id '{}' started twice, tracking the latest execution", callId);
            }
        }
        log.debug("[Tools] Execution {} started: {} (call {})", executionId, toolName, callId);
        publish(execution, ExecutionStatus.EXECUTING);
        return executionId;
    }

    /**
     * Moves the execution of the call to COMPLETED or FAILED.
     *
     * @return {@code false} when the call is unknown or its execution already
     *         finished
     */
    public boolean complete(String callId, ToolResult result) {
        Optional<ToolExecution> execution = get(callId);
        if (execution.isEmpty()) {
            log.warn("[Tools] Completion for unknown call id '{}' ignored", callId);
            return false;
        }
        ToolExecution tracked = execution.get();
        if (!tracked.complete(result, clock.instant())) {
            log.debug("[Tools] Execution {} already finished", tracked.getId());
            return false;
        }
        log.debug("[Tools] Execution {} {}: {}", tracked.getId(), tracked.getStatus(), tracked.getToolName());
        publish(tracked, tracked.getStatus());
        return true;
    }

    public Optional<ToolExecution> get(String callId) {
        if (callId == null) {
            return Optional.empty();
        }
        String executionId = executionIdsByCallId.get(callId);
        return executionId != null ? Optional.ofNullable(executions.get(executionId)) : Optional.empty();
    }

    public Optional<String> getExecutionId(String callId) {
        return callId != null ? Optional.ofNullable(executionIdsByCallId.get(callId)) : Optional.empty();
    }

    /**
     * All tracked executions, oldest first.
     */
    public List<ToolExecution> getHistory() {
        List<ToolExecution> history = new ArrayList<>(executions.values());
        history.sort(Comparator.comparing(ToolExecution::getStartTime));
        return history;
    }

    public void clear() {
        executions.clear();
    }

    private void publish(ToolExecution execution, ExecutionStatus status) {
        if (eventBus != null) {
            eventBus.publish(new ToolExecutionEvent(execution.getId(), execution.getCallId(),
                    execution.getToolName(), status));
        }
    }
}
