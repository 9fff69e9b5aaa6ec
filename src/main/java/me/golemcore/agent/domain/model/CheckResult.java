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
 * Outcome of a custom argument check: pass, fail with the generic message, or
 * fail with a specific message.
 */
public record CheckResult(boolean passed, String message) {

    private static final CheckResult PASS = new CheckResult(true, null);
    private static final CheckResult FAIL = new CheckResult(false, null);

    public static CheckResult pass() {
        return PASS;
    }

    public static CheckResult fail() {
        return FAIL;
    }

    public static CheckResult fail(String message) {
        return new CheckResult(false, message);
    }

    public static CheckResult of(boolean passed) {
        return passed ? PASS : FAIL;
    }
}
