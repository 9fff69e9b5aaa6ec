package me.golemcore.agent.plugin;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.exception.InvalidToolDefinitionException;
import me.golemcore.agent.domain.model.ArgumentSpec;
import me.golemcore.agent.domain.model.ArgumentType;
import me.golemcore.agent.domain.model.ToolArguments;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import me.golemcore.agent.infrastructure.process.ProcessResult;
import me.golemcore.agent.infrastructure.process.ProcessRunner;
import me.golemcore.agent.plugin.manifest.ToolManifestEntry;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds tool definitions for manifest entries that run as separate
 * processes.
 *
 * <p>
 * Protocol: the validated arguments are written to the child's stdin as one
 * JSON object; the child answers on stdout with a JSON result
 * {@code {"success": true, "output": "...", "data": ..., "error": "..."}}.
 * Plain-text stdout from a zero exit code counts as a successful output. A
 * non-zero exit code fails the call with the child's stderr.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubprocessToolFactory {

    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;

    public ToolDefinition create(ToolManifestEntry entry, long defaultTimeoutMs) {
        long timeoutMs = entry.getTimeoutMs() != null && entry.getTimeoutMs() > 0
                ? entry.getTimeoutMs()
                : defaultTimeoutMs;
        List<String> command = List.copyOf(entry.getCommand());

        return ToolBuilder.create()
                .id(entry.getId())
                .description(entry.getDescription())
                .category(parseCategory(entry.getCategory()))
                .capabilities(parseCapabilities(entry.getCapabilities()))
                .arguments(parseArguments(entry))
                .tags("external")
                .execute((args, context) -> run(entry.getId(), command, timeoutMs, args, context))
                .build();
    }

    private ToolResult run(String toolId, List<String> command, long timeoutMs, ToolArguments args,
            ToolContext context) throws IOException, InterruptedException {
        String payload = objectMapper.writeValueAsString(args.asMap());
        log.debug("[Plugins] Running subprocess tool '{}': {}", toolId, command);
        ProcessResult result = processRunner.run(command, context.getWorkingDirectory(), payload, timeoutMs);

        if (result.timedOut()) {
            return ToolResult.failure("Tool process timed out after " + timeoutMs + " ms");
        }
        if (result.exitCode() != 0) {
            String stderr = result.stderr().strip();
            return ToolResult.failure("Tool process exited with code " + result.exitCode()
                    + (stderr.isEmpty() ? "" : ": " + stderr));
        }

        String stdout = result.stdout().strip();
        if (stdout.startsWith("{")) {
            try {
                SubprocessReply reply = objectMapper.readValue(stdout, SubprocessReply.class);
                return reply.isSuccess()
                        ? ToolResult.success(reply.getOutput(), reply.getData())
                        : ToolResult.failure(reply.getError() != null ? reply.getError() : "Tool reported failure");
            } catch (JsonProcessingException e) {
                log.debug("[Plugins] '{}' stdout is not a JSON result, using it as text", toolId);
            }
        }
        return ToolResult.success(stdout);
    }

    private static List<ArgumentSpec> parseArguments(ToolManifestEntry entry) {
        List<ArgumentSpec> specs = new ArrayList<>();
        for (ToolManifestEntry.Argument argument : entry.getArguments()) {
            if (argument.getName() == null || argument.getName().isBlank()) {
                throw new InvalidToolDefinitionException("Argument without name in '" + entry.getId() + "'");
            }
            specs.add(ArgumentSpec.builder()
                    .name(argument.getName())
                    .type(parseType(entry.getId(), argument.getType()))
                    .description(argument.getDescription())
                    .required(argument.isRequired())
                    .defaultValue(argument.getDefaultValue())
                    .enumValues(argument.getEnumValues())
                    .build());
        }
        return specs;
    }

    private static ArgumentType parseType(String toolId, String type) {
        if (type == null || type.isBlank()) {
            return ArgumentType.STRING;
        }
        try {
            return ArgumentType.valueOf(type.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidToolDefinitionException("Unknown argument type '" + type + "' in '" + toolId + "'");
        }
    }

    static Set<ToolCapability> parseCapabilities(List<String> names) {
        Set<ToolCapability> capabilities = EnumSet.noneOf(ToolCapability.class);
        if (names == null) {
            return capabilities;
        }
        for (String name : names) {
            try {
                capabilities.add(ToolCapability.valueOf(name.strip().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new InvalidToolDefinitionException("Unknown capability: " + name);
            }
        }
        return capabilities;
    }

    private static ToolCategory parseCategory(String category) {
        if (category == null || category.isBlank()) {
            return ToolCategory.CUSTOM;
        }
        try {
            return ToolCategory.valueOf(category.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidToolDefinitionException("Unknown category: " + category);
        }
    }

    @Data
    static class SubprocessReply {
        private boolean success;
        private String output;
        private Object data;
        private String error;
    }
}
