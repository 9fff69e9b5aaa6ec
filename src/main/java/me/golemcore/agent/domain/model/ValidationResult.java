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

import java.util.List;

/**
 * Outcome of argument validation. Valid results carry no errors; invalid
 * results carry at least one.
 */
public record ValidationResult(boolean valid, List<ValidationError> errors) {

    private static final ValidationResult VALID = new ValidationResult(true, List.of());

    public static ValidationResult ok() {
        return VALID;
    }

    public static ValidationResult of(List<ValidationError> errors) {
        return errors.isEmpty() ? VALID : new ValidationResult(false, List.copyOf(errors));
    }

    public List<String> messages() {
        return errors.stream().map(ValidationError::message).toList();
    }
}
