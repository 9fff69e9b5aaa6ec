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
import me.golemcore.agent.domain.model.ArgumentValue;
import me.golemcore.agent.domain.model.CheckResult;
import me.golemcore.agent.domain.model.ValidationError;
import me.golemcore.agent.domain.model.ValidationResult;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks tool arguments against their declared {@link ArgumentSpec}s.
 *
 * <p>
 * Validation never stops at the first problem: every violation is collected so
 * the model can fix all of them in one go. Checks per argument, in order:
 * required, type (numeric strings count as numbers), enumerated values, custom
 * validator. Keys without a spec are reported as unknown.
 *
 * <p>
 * {@link #validate(List, Map)} never throws.
 */
public final class ArgumentValidator {

    private ArgumentValidator() {
    }

    public static ValidationResult validate(List<ArgumentSpec> specs, Map<String, ?> arguments) {
        List<ArgumentSpec> safeSpecs = specs != null ? specs : List.of();
        Map<String, ?> safeArgs = arguments != null ? arguments : Map.of();
        List<ValidationError> errors = new ArrayList<>();
        Set<String> declared = new HashSet<>();

        for (ArgumentSpec spec : safeSpecs) {
            if (spec == null || spec.getName() == null) {
                continue;
            }
            declared.add(spec.getName());
            validateOne(spec, safeArgs.get(spec.getName()), errors);
        }

        for (String key : safeArgs.keySet()) {
            if (!declared.contains(key)) {
                errors.add(new ValidationError(key, "Unknown argument '" + key + "'", null, null));
            }
        }
        return ValidationResult.of(errors);
    }

    /**
     * Copy of {@code arguments} with every absent or null field that declares a
     * default filled in.
     */
    public static Map<String, Object> applyDefaults(List<ArgumentSpec> specs, Map<String, ?> arguments) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (arguments != null) {
            result.putAll(arguments);
        }
        if (specs == null) {
            return result;
        }
        for (ArgumentSpec spec : specs) {
            if (spec.hasDefault() && result.get(spec.getName()) == null) {
                result.put(spec.getName(), spec.getDefaultValue());
            }
        }
        return result;
    }

    /**
     * One bullet line per error, including expected/received types when known.
     */
    public static String format(List<ValidationError> errors) {
        return errors.stream()
                .map(error -> {
                    String line = "- " + error.message();
                    if (error.expected() != null && error.received() != null) {
                        line += " (expected: " + error.expected() + ", received: " + error.received() + ")";
                    }
                    return line;
                })
                .collect(Collectors.joining("\n"));
    }

    private static void validateOne(ArgumentSpec spec, Object value, List<ValidationError> errors) {
        String name = spec.getName();
        ArgumentType type = spec.getType() != null ? spec.getType() : ArgumentType.ANY;

        if (value == null) {
            if (spec.isRequired()) {
                errors.add(new ValidationError(name, "Required argument '" + name + "' is missing",
                        type.wireName(), "undefined"));
            }
            return;
        }

        ArgumentValue typed = ArgumentValue.of(value);
        if (!matchesType(type, typed)) {
            errors.add(new ValidationError(name, "Expected " + type.wireName() + " but got " + typed.typeName(),
                    type.wireName(), typed.typeName()));
            return;
        }

        if (spec.hasEnum() && !enumContains(spec.getEnumValues(), value)) {
            String allowed = spec.getEnumValues().stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(", "));
            errors.add(new ValidationError(name, "Value must be one of: " + allowed, allowed, String.valueOf(value)));
            return;
        }

        if (spec.getValidator() != null) {
            try {
                CheckResult result = spec.getValidator().check(value);
                if (result == null || !result.passed()) {
                    String message = result != null && result.message() != null
                            ? result.message()
                            : "Validation failed for '" + name + "'";
                    errors.add(ValidationError.of(name, message));
                }
            } catch (RuntimeException e) {
                errors.add(ValidationError.of(name, "Validation failed for '" + name + "': " + e.getMessage()));
            }
        }
    }

    static boolean matchesType(ArgumentType type, ArgumentValue value) {
        return switch (type) {
        case ANY -> true;
        case STRING -> value instanceof ArgumentValue.StringValue;
        case BOOLEAN -> value instanceof ArgumentValue.BoolValue;
        case ARRAY -> value instanceof ArgumentValue.ArrayValue;
        case OBJECT -> value instanceof ArgumentValue.ObjectValue;
        case NUMBER -> value instanceof ArgumentValue.NumberValue
                || value instanceof ArgumentValue.StringValue text && text.isNumeric();
        };
    }

    private static boolean enumContains(List<?> allowed, Object value) {
        for (Object candidate : allowed) {
            if (looselyEquals(candidate, value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean looselyEquals(Object expected, Object actual) {
        Number expectedNumber = toNumber(expected);
        Number actualNumber = toNumber(actual);
        if (expected instanceof Number && expectedNumber != null && actualNumber != null) {
            return new BigDecimal(expectedNumber.toString()).compareTo(new BigDecimal(actualNumber.toString())) == 0;
        }
        return Objects.equals(expected, actual);
    }

    private static Number toNumber(Object raw) {
        ArgumentValue value = ArgumentValue.of(raw);
        if (value instanceof ArgumentValue.NumberValue number && number.isFinite()) {
            return number.value();
        }
        if (value instanceof ArgumentValue.StringValue text) {
            return text.parseNumber();
        }
        return null;
    }
}
