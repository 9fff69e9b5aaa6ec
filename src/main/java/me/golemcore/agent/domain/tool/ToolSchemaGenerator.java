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

import me.golemcore.agent.domain.model.ArgumentSpec;
import me.golemcore.agent.domain.model.ArgumentType;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExample;
import me.golemcore.agent.domain.model.ToolSchema;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns tool definitions into the function schemas advertised to the model.
 *
 * <p>
 * The schema name is the tool id. Parameters follow JSON Schema:
 *
 * <pre>{@code
 * {"type": "object", "properties": {...}, "required": [...]}
 * }</pre>
 *
 * The {@code any} type has no JSON Schema counterpart and is advertised as
 * {@code string}; the coercer turns the text back into structured values.
 */
public final class ToolSchemaGenerator {

    private ToolSchemaGenerator() {
    }

    public static List<ToolSchema> toSchemas(List<ToolDefinition> definitions) {
        return definitions.stream().map(ToolSchemaGenerator::toSchema).toList();
    }

    public static ToolSchema toSchema(ToolDefinition definition) {
        return ToolSchema.builder()
                .name(definition.getId())
                .description(describe(definition))
                .inputSchema(parameters(definition.getArguments()))
                .build();
    }

    static Map<String, Object> parameters(List<ArgumentSpec> arguments) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ArgumentSpec spec : arguments) {
            properties.put(spec.getName(), property(spec));
            if (spec.isRequired()) {
                required.add(spec.getName());
            }
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    private static Map<String, Object> property(ArgumentSpec spec) {
        ArgumentType type = spec.getType() == ArgumentType.ANY || spec.getType() == null
                ? ArgumentType.STRING
                : spec.getType();
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", type.wireName());
        if (spec.getDescription() != null) {
            property.put("description", spec.getDescription());
        }
        if (spec.hasEnum()) {
            property.put("enum", spec.getEnumValues());
        }
        if (spec.hasDefault()) {
            property.put("default", spec.getDefaultValue());
        }
        return property;
    }

    private static String describe(ToolDefinition definition) {
        List<String> parts = new ArrayList<>();
        parts.add(stripTrailingPeriod(definition.getDescription()));
        if (!definition.getCapabilities().isEmpty()) {
            parts.add("Capabilities: " + definition.getCapabilities().stream()
                    .sorted()
                    .map(ToolCapability::getDescription)
                    .collect(Collectors.joining(", ")));
        }
        if (!definition.getTags().isEmpty()) {
            parts.add("Tags: " + String.join(", ", definition.getTags()));
        }
        if (!definition.getExamples().isEmpty()) {
            parts.add("Examples: " + definition.getExamples().stream()
                    .map(ToolSchemaGenerator::describeExample)
                    .collect(Collectors.joining("; ")));
        }
        return String.join(". ", parts);
    }

    private static String describeExample(ToolExample example) {
        StringBuilder text = new StringBuilder(example.description());
        if (example.arguments() != null && !example.arguments().isEmpty()) {
            text.append(' ').append(example.arguments());
        }
        if (example.result() != null) {
            text.append(" -> ").append(example.result());
        }
        return text.toString();
    }

    private static String stripTrailingPeriod(String text) {
        String trimmed = text.strip();
        return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /**
     * Markdown section listing the tools grouped by category, for the system
     * prompt.
     */
    public static String promptSection(List<ToolDefinition> definitions) {
        if (definitions.isEmpty()) {
            return "";
        }
        Map<ToolCategory, List<ToolDefinition>> byCategory = new EnumMap<>(ToolCategory.class);
        for (ToolDefinition definition : definitions) {
            ToolCategory category = definition.getCategory() != null ? definition.getCategory() : ToolCategory.CUSTOM;
            byCategory.computeIfAbsent(category, key -> new ArrayList<>()).add(definition);
        }

        StringBuilder section = new StringBuilder("# Available Tools\n");
        byCategory.forEach((category, tools) -> {
            section.append("\n## ").append(category.getDisplayName()).append('\n');
            for (ToolDefinition tool : tools) {
                section.append("- **").append(tool.getId()).append("**: ")
                        .append(tool.getDescription().strip()).append('\n');
            }
        });
        return section.toString();
    }
}
