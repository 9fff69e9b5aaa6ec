package me.golemcore.agent.domain.system.toolloop;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.service.ToolCallExecutionService;
import me.golemcore.agent.domain.service.ToolExecutionTracker;
import me.golemcore.agent.domain.tool.ArgumentCoercer;
import me.golemcore.agent.domain.tool.RetryingToolInvoker;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(ToolRegistry toolRegistry, RetryingToolInvoker retryingToolInvoker,
            ArgumentCoercer argumentCoercer, ToolExecutionTracker tracker, ObjectMapper objectMapper,
            AgentProperties properties) {
        return new ToolCallExecutionService(toolRegistry, retryingToolInvoker, argumentCoercer, tracker,
                objectMapper, properties);
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public TokenCounter tokenCounter(AgentProperties properties) {
        return new HeuristicTokenCounter(properties.getToolLoop().getCharsPerToken());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService toolLoopExecutor(AgentProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "tool-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getToolLoop().getParallelism()), threadFactory);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolRegistry toolRegistry, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, TokenCounter tokenCounter, AgentProperties properties,
            @Qualifier("toolLoopExecutor") ExecutorService toolLoopExecutor, Clock clock) {
        return new StreamingToolLoopSystem(llmPort, toolRegistry, toolExecutorPort, historyWriter, tokenCounter,
                properties.getToolLoop(), properties.getLlm(), toolLoopExecutor, clock);
    }
}
