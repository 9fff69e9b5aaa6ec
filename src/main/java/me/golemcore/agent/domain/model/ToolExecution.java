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

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracked invocation of a tool. Created in {@link ExecutionStatus#EXECUTING}
 * and moved to a terminal status exactly once.
 */
@Getter
public class ToolExecution {

    private final String id;
    private final String callId;
    private final String toolName;
    private final Map<String, Object> arguments;
    private final Instant startTime;
    private ExecutionStatus status = ExecutionStatus.EXECUTING;
    private ToolResult result;
    private Instant endTime;

    public ToolExecution(String id, String callId, String toolName, Map<String, Object> arguments,
            Instant startTime) {
        this.id = id;
        this.callId = callId;
        this.toolName = toolName;
        this.arguments = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Map.of();
        this.startTime = startTime;
    }

    /**
     * Moves the execution to COMPLETED or FAILED depending on the result.
     *
     * @return {@code false} if the execution had already reached a terminal status
     */
    public synchronized boolean complete(ToolResult toolResult, Instant finishedAt) {
        if (status.isTerminal()) {
            return false;
        }
        this.result = toolResult;
        this.endTime = finishedAt;
        this.status = toolResult != null && toolResult.isSuccess()
                ? ExecutionStatus.COMPLETED
                : ExecutionStatus.FAILED;
        return true;
    }

    public synchronized ExecutionStatus getStatus() {
        return status;
    }

    public synchronized ToolResult getResult() {
        return result;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }
}
