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

import me.golemcore.agent.domain.model.ArgumentCheck;
import me.golemcore.agent.domain.model.ArgumentValue;
import me.golemcore.agent.domain.model.CheckResult;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ready-made {@link ArgumentCheck}s for common constraints.
 */
public final class ArgumentChecks {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private ArgumentChecks() {
    }

    public static ArgumentCheck minLength(int min) {
        return value -> String.valueOf(value).length() >= min
                ? CheckResult.pass()
                : CheckResult.fail("Must be at least " + min + " characters");
    }

    public static ArgumentCheck maxLength(int max) {
        return value -> String.valueOf(value).length() <= max
                ? CheckResult.pass()
                : CheckResult.fail("Must be at most " + max + " characters");
    }

    public static ArgumentCheck pattern(Pattern regex) {
        return value -> regex.matcher(String.valueOf(value)).find()
                ? CheckResult.pass()
                : CheckResult.fail("Does not match required pattern");
    }

    public static ArgumentCheck email() {
        return value -> EMAIL.matcher(String.valueOf(value)).matches()
                ? CheckResult.pass()
                : CheckResult.fail("Must be a valid email address");
    }

    public static ArgumentCheck url() {
        return value -> {
            try {
                URI uri = new URI(String.valueOf(value));
                return uri.getScheme() != null ? CheckResult.pass() : CheckResult.fail("Must be a valid URL");
            } catch (URISyntaxException e) {
                return CheckResult.fail("Must be a valid URL");
            }
        };
    }

    public static ArgumentCheck min(double min) {
        return value -> {
            Double number = asDouble(value);
            return number != null && number >= min
                    ? CheckResult.pass()
                    : CheckResult.fail("Must be at least " + formatBound(min));
        };
    }

    public static ArgumentCheck max(double max) {
        return value -> {
            Double number = asDouble(value);
            return number != null && number <= max
                    ? CheckResult.pass()
                    : CheckResult.fail("Must be at most " + formatBound(max));
        };
    }

    public static ArgumentCheck integer() {
        return value -> {
            Double number = asDouble(value);
            return number != null && number == Math.rint(number)
                    ? CheckResult.pass()
                    : CheckResult.fail("Must be an integer");
        };
    }

    public static ArgumentCheck positive() {
        return value -> {
            Double number = asDouble(value);
            return number != null && number > 0
                    ? CheckResult.pass()
                    : CheckResult.fail("Must be positive");
        };
    }

    public static ArgumentCheck minItems(int min) {
        return value -> size(value) >= min
                ? CheckResult.pass()
                : CheckResult.fail("Must have at least " + min + " items");
    }

    public static ArgumentCheck maxItems(int max) {
        return value -> size(value) <= max
                ? CheckResult.pass()
                : CheckResult.fail("Must have at most " + max + " items");
    }

    public static ArgumentCheck unique() {
        return value -> {
            if (!(value instanceof Collection<?> items)) {
                return CheckResult.pass();
            }
            return new HashSet<>(items).size() == items.size()
                    ? CheckResult.pass()
                    : CheckResult.fail("Items must be unique");
        };
    }

    /**
     * Runs the checks in order and reports the first failure.
     */
    public static ArgumentCheck allOf(ArgumentCheck... checks) {
        List<ArgumentCheck> chain = List.of(checks);
        return value -> {
            for (ArgumentCheck check : chain) {
                CheckResult result = check.check(value);
                if (!result.passed()) {
                    return result;
                }
            }
            return CheckResult.pass();
        };
    }

    private static Double asDouble(Object raw) {
        ArgumentValue value = ArgumentValue.of(raw);
        if (value instanceof ArgumentValue.NumberValue number) {
            return number.value().doubleValue();
        }
        if (value instanceof ArgumentValue.StringValue text) {
            Number parsed = text.parseNumber();
            return parsed != null ? parsed.doubleValue() : null;
        }
        return null;
    }

    private static int size(Object value) {
        return value instanceof Collection<?> items ? items.size() : 0;
    }

    private static String formatBound(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
