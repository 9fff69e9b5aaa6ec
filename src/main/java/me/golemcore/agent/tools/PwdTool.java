package me.golemcore.agent.tools;

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

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reports the session working directory.
 */
@Component
public class PwdTool implements ToolComponent {

    private final ToolDefinition definition = ToolBuilder.create()
            .id("pwd")
            .description("Print the current working directory")
            .category(ToolCategory.FILE_SYSTEM)
            .execute((args, context) -> {
                String path = context.getWorkingDirectory().toString();
                return ToolResult.success(path, Map.of("path", path));
            })
            .build();

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }
}
