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
import me.golemcore.agent.domain.model.ToolExecutionStats;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry-owned runtime state of a tool: initialization flag and usage
 * metrics. Mutated only by {@link DefaultToolRegistry}.
 */
final class RegisteredTool {

    private final ToolDefinition definition;
    private final ReentrantLock initializationLock = new ReentrantLock();
    private volatile boolean initialized;
    private long executionCount;
    private long totalDurationMs;
    private Instant lastExecutedAt;

    RegisteredTool(ToolDefinition definition) {
        this.definition = definition;
    }

    ToolDefinition definition() {
        return definition;
    }

    ReentrantLock initializationLock() {
        return initializationLock;
    }

    boolean isInitialized() {
        return initialized;
    }

    void markInitialized() {
        initialized = true;
    }

    synchronized void recordExecution(long durationMs, Instant executedAt) {
        executionCount++;
        totalDurationMs += durationMs;
        lastExecutedAt = executedAt;
    }

    synchronized ToolExecutionStats stats() {
        return new ToolExecutionStats(definition.getId(), executionCount, totalDurationMs, lastExecutedAt);
    }
}
