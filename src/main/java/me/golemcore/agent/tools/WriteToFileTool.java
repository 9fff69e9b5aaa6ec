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
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates or overwrites a text file. Missing parent directories are created.
 * The written content is recorded in the file tracker so the file can be
 * edited right away.
 */
@Component
@Slf4j
public class WriteToFileTool implements ToolComponent {

    private final ToolDefinition definition = ToolBuilder.create()
            .id("write_to_file")
            .description("Write content to a file, creating it (and its parent directories) if needed. "
                    + "Set create_only to true to refuse overwriting an existing file.")
            .category(ToolCategory.FILE_SYSTEM)
            .capabilities(ToolCapability.FILE_WRITE)
            .stringArg("path", "Path of the file to write", arg -> arg.required(true))
            .stringArg("content", "Complete file content", arg -> arg.required(true))
            .booleanArg("create_only", "Fail if the file already exists", arg -> arg.defaultValue(false))
            .execute((args, context) -> write(args.getString("path"), args.getString("content", ""),
                    args.getBoolean("create_only", false), context))
            .build();

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    private static ToolResult write(String path, String content, boolean createOnly, ToolContext context)
            throws IOException {
        Path file = context.resolvePath(path);
        boolean existed = Files.exists(file);
        if (existed && Files.isDirectory(file)) {
            return ToolResult.failure("Path is a directory: " + path);
        }
        if (existed && createOnly) {
            return ToolResult.failure("File already exists: " + path + ". Set create_only to false to overwrite.");
        }

        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content, StandardCharsets.UTF_8);
        context.getFileTracker().record(file, content);
        log.debug("[Tools] Wrote {} chars to {}", content.length(), file);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("filePath", file.toString());
        data.put("created", !existed);
        data.put("sizeInBytes", content.getBytes(StandardCharsets.UTF_8).length);
        String verb = existed ? "overwrote" : "created";
        return ToolResult.success("Successfully " + verb + " file: " + path, data);
    }
}
