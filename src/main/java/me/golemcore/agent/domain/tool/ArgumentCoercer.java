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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.model.ArgumentSpec;
import me.golemcore.agent.domain.model.ArgumentType;
import me.golemcore.agent.domain.model.ArgumentValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes loosely typed, model-produced argument values towards their
 * declared types. Only string values are converted; everything else passes
 * through untouched and is left for validation to judge.
 *
 * <ul>
 * <li>number: numeric parse, unchanged when not a finite number
 * <li>boolean: {@code "true"}, {@code "1"} and {@code "yes"} are true, any
 * other string is false
 * <li>array: comma split with each element trimmed
 * <li>object: JSON parse, unchanged when the text is not JSON
 * </ul>
 */
public final class ArgumentCoercer {

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes");

    private final ObjectMapper objectMapper;

    public ArgumentCoercer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> coerce(List<ArgumentSpec> specs, Map<String, ?> arguments) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (arguments != null) {
            result.putAll(arguments);
        }
        if (specs == null) {
            return result;
        }
        for (ArgumentSpec spec : specs) {
            Object value = result.get(spec.getName());
            if (value == null || spec.getType() == null) {
                continue;
            }
            result.put(spec.getName(), coerceValue(ArgumentValue.of(value), spec.getType()).unwrap());
        }
        return result;
    }

    /**
     * Converts a single value towards {@code target}.
     */
    public ArgumentValue coerceValue(ArgumentValue value, ArgumentType target) {
        if (target == ArgumentType.ANY || ArgumentValidator.matchesType(target, value)
                && !(target == ArgumentType.NUMBER && value instanceof ArgumentValue.StringValue)) {
            return value;
        }
        if (!(value instanceof ArgumentValue.StringValue text)) {
            return value;
        }
        return switch (target) {
        case NUMBER -> toNumber(text);
        case BOOLEAN -> new ArgumentValue.BoolValue(TRUE_VALUES.contains(text.value()));
        case ARRAY -> toArray(text);
        case OBJECT -> toObject(text);
        default -> value;
        };
    }

    private static ArgumentValue toNumber(ArgumentValue.StringValue text) {
        Number parsed = text.parseNumber();
        return parsed != null ? new ArgumentValue.NumberValue(parsed) : text;
    }

    private static ArgumentValue toArray(ArgumentValue.StringValue text) {
        List<Object> parts = new ArrayList<>();
        for (String part : text.value().split(",", -1)) {
            parts.add(part.trim());
        }
        return ArgumentValue.of(parts);
    }

    private ArgumentValue toObject(ArgumentValue.StringValue text) {
        try {
            return ArgumentValue.of(objectMapper.readValue(text.value(), Object.class));
        } catch (JsonProcessingException e) {
            return text;
        }
    }
}
