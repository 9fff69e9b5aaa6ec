package me.golemcore.agent.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.service.ToolConfirmationPolicy;
import me.golemcore.agent.domain.tool.ArgumentCoercer;
import me.golemcore.agent.domain.tool.DefaultToolRegistry;
import me.golemcore.agent.domain.tool.RetryPolicy;
import me.golemcore.agent.domain.tool.RetryingToolInvoker;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.port.outbound.ConfirmationPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Spring configuration for the shared infrastructure beans and the tool
 * runtime.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link ObjectMapper} and {@link Clock}</li>
 * <li>Creates the session {@link ToolContext} rooted at the configured
 * workspace</li>
 * <li>Creates the tool registry and registers every {@link ToolComponent} not
 * listed in {@code agent.tools.disabled}</li>
 * <li>Wraps the registry with the configured retry policy</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AgentProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ArgumentCoercer argumentCoercer(ObjectMapper objectMapper) {
        return new ArgumentCoercer(objectMapper);
    }

    @Bean
    public ToolContext toolContext(ConfirmationPort confirmationPort) {
        String workspace = properties.getTools().getWorkspace();
        Path workingDirectory = workspace == null || workspace.isBlank()
                ? Path.of("").toAbsolutePath()
                : Path.of(workspace).toAbsolutePath();
        return ToolContext.builder()
                .workingDirectory(workingDirectory)
                .confirmationGate(confirmationPort)
                .build();
    }

    @Bean
    public ToolRegistry toolRegistry(ToolConfirmationPolicy confirmationPolicy, ToolContext toolContext,
            Clock clock, List<ToolComponent> toolComponents) {
        DefaultToolRegistry registry = new DefaultToolRegistry(confirmationPolicy, toolContext, clock);
        Set<String> disabled = properties.getTools().getDisabled();
        for (ToolComponent component : toolComponents) {
            ToolDefinition definition = component.getDefinition();
            if (disabled.contains(definition.getId())) {
                log.info("[Registry] Tool disabled by configuration: {}", definition.getId());
                continue;
            }
            registry.register(definition);
        }
        log.info("[Registry] {} built-in tools registered", registry.list().size());
        return registry;
    }

    @Bean
    public RetryPolicy retryPolicy() {
        AgentProperties.RetryProperties retry = properties.getTools().getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMultiplier(),
                retry.getMaxBackoff(), retry.getRetryableKinds());
    }

    @Bean
    public RetryingToolInvoker retryingToolInvoker(ToolRegistry toolRegistry, RetryPolicy retryPolicy) {
        return new RetryingToolInvoker(toolRegistry, retryPolicy);
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Agent starting...");
        log.info("LLM Provider: {}", properties.getLlm().getProvider());
        log.info("Model: {}", properties.getLlm().getModel());
        log.info("Max tool rounds: {}", properties.getToolLoop().getMaxToolRounds());
    }
}
