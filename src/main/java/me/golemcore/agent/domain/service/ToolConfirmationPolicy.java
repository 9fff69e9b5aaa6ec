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

import me.golemcore.agent.domain.model.ConfirmationGroup;
import me.golemcore.agent.domain.model.ToolArguments;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Policy engine determining which tool calls require explicit user confirmation
 * before execution. Identifies potentially destructive tools from their
 * declared capabilities (file writes, shell commands, explicit confirmation
 * requests) and provides human-readable action descriptions for confirmation
 * prompts. Can be disabled via configuration while still detecting notable
 * actions for informational logging.
 */
@Component
@Slf4j
public class ToolConfirmationPolicy {

    private static final String UNKNOWN = "unknown";
    private static final String PATH = "path";
    private static final int COMMAND_LENGTH_THRESHOLD = 80;

    private final boolean enabled;
    private final boolean confirmDestructive;
    private final Duration timeout;

    public ToolConfirmationPolicy(AgentProperties properties) {
        AgentProperties.ToolConfirmationProperties confirmation = properties.getSecurity().getToolConfirmation();
        this.enabled = confirmation.isEnabled();
        this.confirmDestructive = confirmation.isConfirmDestructive();
        this.timeout = confirmation.getTimeout();
        log.info("ToolConfirmationPolicy enabled: {}, confirmDestructive: {}", enabled, confirmDestructive);
    }

    /**
     * Check if a tool requires user confirmation before its body runs.
     */
    public boolean requiresConfirmation(ToolDefinition definition) {
        if (!enabled) {
            return false;
        }
        if (definition.hasCapability(ToolCapability.USER_CONFIRMATION)) {
            return true;
        }
        return confirmDestructive && isDestructive(definition);
    }

    /**
     * Check if a tool is a notable/dangerous action (regardless of enabled
     * state).
     */
    public boolean isNotableAction(ToolDefinition definition) {
        return definition.hasCapability(ToolCapability.USER_CONFIRMATION) || isDestructive(definition);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Session group an "always" answer applies to.
     */
    public ConfirmationGroup groupOf(ToolDefinition definition) {
        if (definition.hasCapability(ToolCapability.SYSTEM_EXECUTE)) {
            return ConfirmationGroup.BASH_COMMANDS;
        }
        if (definition.hasCapability(ToolCapability.FILE_WRITE)) {
            return ConfirmationGroup.FILE_OPERATIONS;
        }
        return ConfirmationGroup.OTHER;
    }

    /**
     * Build a human-readable description of the action for the confirmation
     * prompt.
     */
    public String describeAction(ToolDefinition definition, ToolArguments args) {
        return switch (definition.getId()) {
        case "bash" -> describeShellAction(args);
        case "write_to_file" -> "Write file: " + args.getString(PATH, UNKNOWN);
        case "replace_in_file" -> "Edit file: " + args.getString(PATH, UNKNOWN);
        case "remove" -> describeRemoveAction(args);
        default -> definition.getName() + ": " + args;
        };
    }

    private boolean isDestructive(ToolDefinition definition) {
        return definition.hasCapability(ToolCapability.FILE_WRITE)
                || definition.hasCapability(ToolCapability.SYSTEM_EXECUTE);
    }

    private String describeShellAction(ToolArguments args) {
        String command = args.getString("command", UNKNOWN);
        if (command.length() > COMMAND_LENGTH_THRESHOLD) {
            command = command.substring(0, COMMAND_LENGTH_THRESHOLD) + "...";
        }
        return "Run command: " + command;
    }

    private String describeRemoveAction(ToolArguments args) {
        List<Object> paths = args.getList("paths");
        if (!paths.isEmpty()) {
            return "Delete files: " + paths;
        }
        return "Delete file: " + args.getString(PATH, UNKNOWN);
    }
}
