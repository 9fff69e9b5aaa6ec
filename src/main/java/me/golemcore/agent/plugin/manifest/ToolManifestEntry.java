package me.golemcore.agent.plugin.manifest;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One manifest entry. Exactly one of {@code module} (a {@code ToolPlugin}
 * class name) or {@code command} (an argv list for a subprocess tool) is set.
 * The remaining fields describe a subprocess tool; class modules describe
 * their own tools.
 */
@Data
public class ToolManifestEntry {

    private String id;
    private String module;
    private List<String> command;
    private String description;
    private String category;
    private List<Argument> arguments = new ArrayList<>();
    private List<String> capabilities = new ArrayList<>();
    @JsonProperty("timeout_ms")
    private Long timeoutMs;

    public boolean isCommand() {
        return command != null && !command.isEmpty();
    }

    public boolean isModule() {
        return module != null && !module.isBlank();
    }

    @Data
    public static class Argument {
        private String name;
        private String type = "string";
        private String description;
        private boolean required;
        @JsonProperty("default")
        private Object defaultValue;
        @JsonProperty("enum")
        private List<Object> enumValues;
    }
}
