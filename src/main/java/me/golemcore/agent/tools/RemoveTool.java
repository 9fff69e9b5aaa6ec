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
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deletes one or more files. Directories are never removed.
 */
@Component
@Slf4j
public class RemoveTool implements ToolComponent {

    private final ToolDefinition definition = ToolBuilder.create()
            .id("remove")
            .description("Remove one file (path) or several files (paths). Directories cannot be removed.")
            .category(ToolCategory.FILE_SYSTEM)
            .capabilities(ToolCapability.FILE_WRITE)
            .stringArg("path", "Single file to remove")
            .arrayArg("paths", "Several files to remove", arg -> arg)
            .execute((args, context) -> {
                boolean single = args.has("path");
                boolean multiple = args.has("paths");
                if (single == multiple) {
                    return ToolResult.failure("Provide exactly one of 'path' or 'paths'");
                }
                List<String> targets = new ArrayList<>();
                if (single) {
                    targets.add(args.getString("path"));
                } else {
                    args.getList("paths").forEach(p -> targets.add(String.valueOf(p)));
                }
                if (targets.isEmpty()) {
                    return ToolResult.failure("No paths given");
                }
                return remove(targets, context);
            })
            .build();

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    private static ToolResult remove(List<String> targets, ToolContext context) {
        List<String> removed = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (String target : targets) {
            Path file = context.resolvePath(target);
            if (!Files.exists(file)) {
                missing.add(target);
                continue;
            }
            if (Files.isDirectory(file)) {
                failed.add(target + " (is a directory)");
                continue;
            }
            try {
                Files.delete(file);
                context.getFileTracker().forget(file);
                removed.add(target);
            } catch (IOException e) {
                log.warn("[Tools] Failed to remove {}: {}", file, e.getMessage());
                failed.add(target + " (" + e.getMessage() + ")");
            }
        }

        if (removed.isEmpty() && failed.isEmpty()) {
            return ToolResult.failure("No files found to remove. Missing: " + String.join(", ", missing));
        }

        StringBuilder output = new StringBuilder();
        if (!removed.isEmpty()) {
            output.append("Removed: ").append(String.join(", ", removed)).append('\n');
        }
        if (!failed.isEmpty()) {
            output.append("Failed: ").append(String.join(", ", failed)).append('\n');
        }
        if (!missing.isEmpty()) {
            output.append("Missing: ").append(String.join(", ", missing)).append('\n');
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("removed", removed);
        data.put("failed", failed);
        data.put("missing", missing);
        if (removed.isEmpty()) {
            return ToolResult.builder()
                    .success(false)
                    .output(output.toString().trim())
                    .data(data)
                    .error("Failed to remove: " + String.join(", ", failed))
                    .failureKind(ToolFailureKind.TOOL_REPORTED)
                    .build();
        }
        return ToolResult.success(output.toString().trim(), data);
    }
}
