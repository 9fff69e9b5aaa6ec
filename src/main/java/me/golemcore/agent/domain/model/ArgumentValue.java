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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Tagged value union over the shapes a JSON argument can take: null, boolean,
 * number, string, array and object.
 *
 * <p>
 * Tool arguments arrive as loosely typed Java values produced by Jackson
 * ({@code Map}, {@code List}, {@code String}, {@code Number}, {@code Boolean},
 * {@code null}). {@link #of(Object)} classifies such a value once so that
 * validation and coercion can work on the tag instead of probing runtime types
 * over and over.
 */
public sealed interface ArgumentValue
        permits ArgumentValue.NullValue, ArgumentValue.BoolValue, ArgumentValue.NumberValue,
        ArgumentValue.StringValue, ArgumentValue.ArrayValue, ArgumentValue.ObjectValue {

    /**
     * Tag of this value as reported in validation messages ("null", "boolean",
     * "number", "string", "array", "object").
     */
    String typeName();

    /**
     * Plain Java value, as it would be handed to a tool.
     */
    Object unwrap();

    /**
     * Classifies a raw Java value.
     */
    static ArgumentValue of(Object raw) {
        if (raw == null) {
            return NullValue.INSTANCE;
        }
        if (raw instanceof ArgumentValue value) {
            return value;
        }
        if (raw instanceof Boolean bool) {
            return new BoolValue(bool);
        }
        if (raw instanceof Number number) {
            return new NumberValue(number);
        }
        if (raw instanceof CharSequence text) {
            return new StringValue(text.toString());
        }
        if (raw instanceof Collection<?> collection) {
            return new ArrayValue(Collections.unmodifiableList(new ArrayList<>(collection)));
        }
        if (raw instanceof Object[] array) {
            return new ArrayValue(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(array))));
        }
        return new ObjectValue(raw);
    }

    /**
     * JSON null or an absent value.
     */
    final class NullValue implements ArgumentValue {

        public static final NullValue INSTANCE = new NullValue();

        private NullValue() {
        }

        @Override
        public String typeName() {
            return "null";
        }

        @Override
        public Object unwrap() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record BoolValue(boolean value) implements ArgumentValue {

        @Override
        public String typeName() {
            return "boolean";
        }

        @Override
        public Object unwrap() {
            return value;
        }
    }

    record NumberValue(Number value) implements ArgumentValue {

        @Override
        public String typeName() {
            return "number";
        }

        @Override
        public Object unwrap() {
            return value;
        }

        public boolean isFinite() {
            if (value instanceof Double d) {
                return Double.isFinite(d);
            }
            if (value instanceof Float f) {
                return Float.isFinite(f);
            }
            return true;
        }
    }

    record StringValue(String value) implements ArgumentValue {

        private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
        private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

        @Override
        public String typeName() {
            return "string";
        }

        @Override
        public Object unwrap() {
            return value;
        }

        /**
         * Whether the text parses as a finite decimal number. Blank text is not
         * numeric.
         */
        public boolean isNumeric() {
            return parseNumber() != null;
        }

        /**
         * Parses the text as a number: {@code Long} when integral and in range,
         * {@code Double} otherwise, {@code null} when not numeric.
         */
        public Number parseNumber() {
            String trimmed = value.trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            BigDecimal decimal;
            try {
                decimal = new BigDecimal(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
            boolean integral = decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
            if (integral && decimal.compareTo(LONG_MIN) >= 0 && decimal.compareTo(LONG_MAX) <= 0) {
                return decimal.longValue();
            }
            double asDouble = decimal.doubleValue();
            return Double.isFinite(asDouble) ? asDouble : null;
        }
    }

    record ArrayValue(List<Object> values) implements ArgumentValue {

        @Override
        public String typeName() {
            return "array";
        }

        @Override
        public Object unwrap() {
            return values;
        }
    }

    /**
     * A JSON object ({@code Map}) or any other structured value.
     */
    record ObjectValue(Object value) implements ArgumentValue {

        @Override
        public String typeName() {
            return "object";
        }

        @Override
        public Object unwrap() {
            return value;
        }

        public boolean isMap() {
            return value instanceof Map<?, ?>;
        }
    }
}
