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

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Discovery manifest listing external tools.
 *
 * <pre>{@code
 * {
 *   "version": "1.0.0",
 *   "generated": "2026-01-01T00:00:00Z",
 *   "tools": [
 *     {"id": "git_tools", "module": "com.example.GitToolsPlugin"},
 *     {"id": "fetch_url", "command": ["python3", "fetch.py"], "description": "...",
 *      "capabilities": ["NETWORK_ACCESS"]}
 *   ]
 * }
 * }</pre>
 */
@Data
public class ToolManifest {

    private String version;
    private String generated;
    private List<ToolManifestEntry> tools = new ArrayList<>();
}
