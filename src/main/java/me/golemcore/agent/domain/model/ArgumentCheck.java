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

/**
 * Custom validator attached to an {@link ArgumentSpec}. Only invoked for values
 * that are present (not {@code null}).
 */
@FunctionalInterface
public interface ArgumentCheck {

    CheckResult check(Object value);

    /**
     * Runs this check and then {@code next} when this one passes.
     */
    default ArgumentCheck and(ArgumentCheck next) {
        return value -> {
            CheckResult first = check(value);
            return first.passed() ? next.check(value) : first;
        };
    }
}
