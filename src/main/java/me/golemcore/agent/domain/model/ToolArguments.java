package me.golemcore.agent.domain.model;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view over the arguments of a single tool invocation. Typed getters
 * fall back to the argument's declared default when the value is absent.
 */
public final class ToolArguments {

    private final Map<String, Object> values;
    private final List<ArgumentSpec> specs;

    private ToolArguments(Map<String, Object> values, List<ArgumentSpec> specs) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.specs = specs;
    }

    public static ToolArguments of(Map<String, Object> values, List<ArgumentSpec> specs) {
        return new ToolArguments(values != null ? values : Map.of(), specs != null ? specs : List.of());
    }

    public static ToolArguments of(Map<String, Object> values) {
        return of(values, List.of());
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Object get(String name) {
        Object value = values.get(name);
        if (value != null) {
            return value;
        }
        for (ArgumentSpec spec : specs) {
            if (spec.getName().equals(name)) {
                return spec.getDefaultValue();
            }
        }
        return null;
    }

    public String getString(String name) {
        Object value = get(name);
        return value != null ? value.toString() : null;
    }

    public String getString(String name, String fallback) {
        String value = getString(name);
        return value != null ? value : fallback;
    }

    public boolean getBoolean(String name, boolean fallback) {
        ArgumentValue value = ArgumentValue.of(get(name));
        if (value instanceof ArgumentValue.BoolValue bool) {
            return bool.value();
        }
        if (value instanceof ArgumentValue.StringValue text) {
            return Boolean.parseBoolean(text.value().trim());
        }
        return fallback;
    }

    public long getLong(String name, long fallback) {
        Number number = asNumber(get(name));
        return number != null ? number.longValue() : fallback;
    }

    public int getInt(String name, int fallback) {
        Number number = asNumber(get(name));
        return number != null ? number.intValue() : fallback;
    }

    public List<Object> getList(String name) {
        ArgumentValue value = ArgumentValue.of(get(name));
        if (value instanceof ArgumentValue.ArrayValue array) {
            return array.values();
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String name) {
        Object value = get(name);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    /**
     * The explicitly supplied values, without defaults.
     */
    public Map<String, Object> asMap() {
        return values;
    }

    private static Number asNumber(Object raw) {
        ArgumentValue value = ArgumentValue.of(raw);
        if (value instanceof ArgumentValue.NumberValue number) {
            return number.value();
        }
        if (value instanceof ArgumentValue.StringValue text) {
            return text.parseNumber();
        }
        return null;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
