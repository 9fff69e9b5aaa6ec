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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import me.golemcore.agent.domain.model.ArgumentSpec;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.system.toolloop.ToolExecutionOutcome;
import me.golemcore.agent.domain.system.toolloop.ToolExecutorPort;
import me.golemcore.agent.domain.tool.ArgumentCoercer;
import me.golemcore.agent.domain.tool.ToolInvoker;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes one finalized tool call on behalf of the tool loop: parses the
 * reassembled argument text, coerces loosely typed values, tracks the execution
 * and runs it through the retrying invoker.
 *
 * <p>
 * Does NOT mutate conversation history. A malformed argument buffer becomes a
 * {@link ToolFailureKind#PARSE_FAILED} result that quotes the raw text and the
 * tool's expected arguments so the model can correct itself on the next round.
 */
@Slf4j
public class ToolCallExecutionService implements ToolExecutorPort {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ToolRegistry toolRegistry;
    private final ToolInvoker invoker;
    private final ArgumentCoercer coercer;
    private final ToolExecutionTracker tracker;
    private final ObjectMapper objectMapper;
    private final ObjectReader argumentsReader;
    private final int maxToolResultChars;

    public ToolCallExecutionService(ToolRegistry toolRegistry, ToolInvoker invoker, ArgumentCoercer coercer,
            ToolExecutionTracker tracker, ObjectMapper objectMapper, AgentProperties properties) {
        this.toolRegistry = toolRegistry;
        this.invoker = invoker;
        this.coercer = coercer;
        this.tracker = tracker;
        this.objectMapper = objectMapper;
        this.argumentsReader = objectMapper.readerFor(ARGUMENTS_TYPE)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.maxToolResultChars = properties.getToolLoop().getMaxToolResultChars();
    }

    @Override
    public ToolExecutionOutcome execute(ToolContext context, Message.ToolCall toolCall) {
        String toolName = sanitizeToolName(toolCall.getName());
        Optional<ToolDefinition> definition = Optional.ofNullable(toolName).flatMap(toolRegistry::get);

        Map<String, Object> arguments;
        try {
            arguments = parseArguments(toolCall.getArguments());
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Unparseable arguments for '{}': {}", toolName, e.getOriginalMessage());
            ToolResult failure = ToolResult.failure(ToolFailureKind.PARSE_FAILED,
                    parseFailureMessage(toolName, toolCall.getArguments(), e, definition));
            tracker.start(toolCall.getId(), toolName, Map.of());
            tracker.complete(toolCall.getId(), failure);
            return outcome(toolCall, toolName, failure);
        }

        if (definition.isPresent()) {
            arguments = coercer.coerce(definition.get().getArguments(), arguments);
        }

        tracker.start(toolCall.getId(), toolName, arguments);
        ToolResult result;
        try {
            result = invoker.execute(toolName, arguments, context);
        } catch (RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: " + e.getMessage());
        }
        if (result == null) {
            result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: no result");
        }
        tracker.complete(toolCall.getId(), result);

        if (!result.isSuccess()) {
            log.info("[Tools] '{}' failed ({}): {}", toolName, result.getFailureKind(), result.getError());
        }
        return outcome(toolCall, toolName, result);
    }

    @Override
    public ToolExecutionOutcome skip(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        ToolExecutionOutcome outcome = ToolExecutionOutcome.synthetic(toolCall, kind, reason);
        tracker.start(toolCall.getId(), sanitizeToolName(toolCall.getName()), Map.of());
        tracker.complete(toolCall.getId(), outcome.toolResult());
        return outcome;
    }

    /**
     * Parses the reassembled argument text. Blank text and a JSON {@code null}
     * both mean "no arguments". Anything after the first JSON value is an
     * error.
     */
    Map<String, Object> parseArguments(String raw) throws JsonProcessingException {
        if (raw == null || raw.isBlank()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> parsed = argumentsReader.readValue(raw);
        return parsed != null ? new LinkedHashMap<>(parsed) : new LinkedHashMap<>();
    }

    private ToolExecutionOutcome outcome(Message.ToolCall toolCall, String toolName, ToolResult result) {
        String content = truncateToolResult(buildToolMessageContent(result), toolName);
        return new ToolExecutionOutcome(toolCall.getId(), toolName, result, content, false);
    }

    private String parseFailureMessage(String toolName, String raw, JsonProcessingException error,
            Optional<ToolDefinition> definition) {
        StringBuilder message = new StringBuilder()
                .append("Failed to parse JSON arguments: ").append(error.getOriginalMessage())
                .append("\n\nThe raw arguments were: ").append(raw)
                .append("\n\nTool \"").append(toolName).append("\" expects:\n");
        List<ArgumentSpec> specs = definition.map(ToolDefinition::getArguments).orElse(List.of());
        if (specs.isEmpty()) {
            message.append("No arguments required (use empty object: {})");
            return message.toString();
        }
        for (ArgumentSpec spec : specs) {
            message.append("- ").append(spec.getName()).append(": ").append(spec.getType().wireName())
                    .append(spec.isRequired() ? " (required)" : " (optional)");
            if (spec.getDescription() != null && !spec.getDescription().isBlank()) {
                message.append(" - ").append(spec.getDescription());
            }
            message.append('\n');
        }
        return message.toString().stripTrailing();
    }

    private String buildToolMessageContent(ToolResult result) {
        if (!result.isSuccess()) {
            return "Error: " + result.getError();
        }
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            return result.getOutput();
        }
        if (result.getData() != null) {
            try {
                return objectMapper.writeValueAsString(result.getData());
            } catch (JsonProcessingException e) {
                log.debug("[Tools] Result data is not serializable, using its string form", e);
                return String.valueOf(result.getData());
            }
        }
        return "Success";
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    /**
     * Truncate tool result content that exceeds the configured max length.
     */
    public String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return null;
        }
        if (maxToolResultChars <= 0 || content.length() <= maxToolResultChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxToolResultChars + " chars. The full result is too large for the context window."
                + " Try a more specific query, use filtering/pagination, or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxToolResultChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }
}
