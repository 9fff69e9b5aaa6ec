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
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Decorates a {@link ToolInvoker} with the bounded retry of a
 * {@link RetryPolicy}.
 *
 * <p>
 * Terminal failures pass through on the first attempt. The last result is
 * returned as produced by the delegate, so a caller cannot tell a retried call
 * from a direct one except by its latency. All attempts of one call share a
 * call-scoped context, so a confirmation given on the first attempt covers the
 * retries.
 */
@Slf4j
public class RetryingToolInvoker implements ToolInvoker {

    private final ToolInvoker delegate;
    private final RetryPolicy policy;

    public RetryingToolInvoker(ToolInvoker delegate, RetryPolicy policy) {
        this.delegate = delegate;
        this.policy = policy != null ? policy : RetryPolicy.none();
    }

    @Override
    public ToolResult execute(String toolId, Map<String, Object> arguments, ToolContext context) {
        ToolContext callContext = context != null ? context.forCall() : null;
        ToolDefinition definition = delegate.describe(toolId).orElse(null);
        ToolResult result = delegate.execute(toolId, arguments, callContext);
        int attempt = 1;
        while (attempt < policy.maxAttempts() && policy.isRetryable(result, definition)) {
            long backoffMs = policy.backoffMillis(attempt);
            log.info("[Tools] Retrying '{}' after {} (attempt {}/{}), backoff={}ms",
                    toolId, result.getFailureKind(), attempt + 1, policy.maxAttempts(), backoffMs);
            try {
                sleepBeforeRetry(backoffMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[Tools] Retry of '{}' interrupted", toolId);
                return result;
            }
            result = delegate.execute(toolId, arguments, callContext);
            attempt++;
        }
        return result;
    }

    @Override
    public Optional<ToolDefinition> describe(String toolId) {
        return delegate.describe(toolId);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    protected void sleepBeforeRetry(long backoffMs) throws InterruptedException {
        if (backoffMs > 0) {
            Thread.sleep(backoffMs);
        }
    }
}
