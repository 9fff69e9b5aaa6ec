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
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExample;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a whole text file and records it in the session file tracker, which
 * unlocks {@code replace_in_file} for that file. The content is returned in the
 * result data, the output only confirms the read.
 */
@Component
public class ReadFileTool implements ToolComponent {

    private final ToolDefinition definition;
    private final long maxFileBytes;

    public ReadFileTool(AgentProperties properties) {
        this.maxFileBytes = properties.getTools().getFiles().getMaxFileBytes();
        this.definition = ToolBuilder.create()
                .id("read_file")
                .description("Read the full content of a text file. A file must be read before it can be edited "
                        + "with replace_in_file.")
                .category(ToolCategory.FILE_SYSTEM)
                .capabilities(ToolCapability.FILE_READ)
                .stringArg("path", "Path of the file to read", arg -> arg.required(true))
                .example(new ToolExample("Read the build file", Map.of("path", "pom.xml"),
                        "Successfully read pom.xml"))
                .execute((args, context) -> read(args.getString("path"), context))
                .build();
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    private ToolResult read(String path, ToolContext context) throws IOException {
        Path file = context.resolvePath(path);
        if (!Files.exists(file)) {
            return ToolResult.failure("File not found: " + path);
        }
        if (Files.isDirectory(file)) {
            return ToolResult.failure("Path is a directory, not a file: " + path);
        }
        long size = Files.size(file);
        if (size > maxFileBytes) {
            return ToolResult.failure("File too large: " + size + " bytes (max " + maxFileBytes + ")");
        }

        String content = Files.readString(file, StandardCharsets.UTF_8);
        context.getFileTracker().record(file, content);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("filePath", file.toString());
        data.put("content", content);
        data.put("totalLines", content.isEmpty() ? 0 : content.split("\n", -1).length);
        data.put("sizeInBytes", size);
        return ToolResult.success("Successfully read " + path, data);
    }
}
