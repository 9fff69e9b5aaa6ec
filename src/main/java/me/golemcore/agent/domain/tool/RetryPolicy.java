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
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Bounded-attempt retry policy for tool calls.
 *
 * <p>
 * A failed result is retried only when its {@link ToolFailureKind} is listed
 * as retryable. Validation, lookup, parse and confirmation failures are
 * deterministic and never retryable by default.
 *
 * @param maxAttempts
 *            total attempts including the first one, at least 1
 * @param initialBackoff
 *            delay before the second attempt
 * @param multiplier
 *            growth factor applied to the delay after each attempt
 * @param maxBackoff
 *            upper bound of a single delay
 * @param retryableKinds
 *            failure kinds considered transient
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff,
        Set<ToolFailureKind> retryableKinds) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        initialBackoff = initialBackoff != null ? initialBackoff : Duration.ZERO;
        multiplier = multiplier < 1.0 ? 1.0 : multiplier;
        maxBackoff = maxBackoff != null ? maxBackoff : initialBackoff;
        retryableKinds = retryableKinds == null || retryableKinds.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(retryableKinds));
    }

    /**
     * Single attempt, no retries.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, Set.of());
    }

    public boolean isRetryable(ToolResult result) {
        return result != null
                && !result.isSuccess()
                && result.getFailureKind() != null
                && retryableKinds.contains(result.getFailureKind());
    }

    /**
     * Like {@link #isRetryable(ToolResult)}, but an execution failure of a
     * side-effecting tool is final: its body already ran and may have changed
     * something.
     */
    public boolean isRetryable(ToolResult result, ToolDefinition definition) {
        if (!isRetryable(result)) {
            return false;
        }
        boolean bodyRan = result.getFailureKind() != ToolFailureKind.INITIALIZATION_FAILED;
        return !(bodyRan && definition != null && definition.isSideEffecting());
    }

    /**
     * Delay after the given failed attempt (1-based):
     * {@code min(initialBackoff * multiplier^(attempt-1), maxBackoff)}.
     */
    public long backoffMillis(int attempt) {
        double delay = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(delay, maxBackoff.toMillis());
    }
}
