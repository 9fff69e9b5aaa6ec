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
 * Grouping of tools used for filtering and for the system prompt section.
 */
public enum ToolCategory {

    FILE_SYSTEM("File System"),
    SYSTEM("System"),
    SEARCH("Search"),
    TASK("Task"),
    UTILITY("Utility"),
    NETWORK("Network"),
    COMPOSITION("Composition"),
    CUSTOM("Custom");

    private final String displayName;

    ToolCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
