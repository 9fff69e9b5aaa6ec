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

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Criteria for listing tools. Unset criteria match everything.
 */
@Value
@Builder
public class ToolFilter {

    ToolCategory category;
    Set<ToolCapability> capabilities;
    Set<String> tags;
    Boolean composable;

    public static ToolFilter all() {
        return ToolFilter.builder().build();
    }

    public boolean matches(ToolDefinition definition) {
        if (category != null && category != definition.getCategory()) {
            return false;
        }
        if (capabilities != null && !capabilities.isEmpty()
                && !definition.getCapabilities().containsAll(capabilities)) {
            return false;
        }
        if (tags != null && !tags.isEmpty()
                && definition.getTags().stream().noneMatch(tags::contains)) {
            return false;
        }
        return composable == null || composable == definition.isComposable();
    }
}
