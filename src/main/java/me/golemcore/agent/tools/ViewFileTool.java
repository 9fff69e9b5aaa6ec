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
import me.golemcore.agent.domain.tool.ArgumentChecks;
import me.golemcore.agent.domain.tool.ToolBuilder;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Shows a file with line numbers, optionally restricted to a line range. At
 * most {@code agent.tools.files.max-view-lines} lines are shown per call.
 * Viewing a directory produces a short listing instead.
 */
@Component
public class ViewFileTool implements ToolComponent {

    private static final int MAX_OUTPUT_CHARS = 50_000;

    private final ToolDefinition definition;
    private final int maxLines;
    private final long maxFileBytes;

    public ViewFileTool(AgentProperties properties) {
        this.maxLines = properties.getTools().getFiles().getMaxViewLines();
        this.maxFileBytes = properties.getTools().getFiles().getMaxFileBytes();
        this.definition = ToolBuilder.create()
                .id("view_file")
                .description("View a file with line numbers. Use start_line and end_line (1-based, inclusive) "
                        + "to page through large files.")
                .category(ToolCategory.FILE_SYSTEM)
                .capabilities(ToolCapability.FILE_READ)
                .stringArg("path", "Path of the file or directory to view", arg -> arg.required(true))
                .numberArg("start_line", "First line to show (1-based)",
                        arg -> arg.validator(ArgumentChecks.integer().and(ArgumentChecks.min(1))))
                .numberArg("end_line", "Last line to show (inclusive)",
                        arg -> arg.validator(ArgumentChecks.integer().and(ArgumentChecks.min(1))))
                .execute((args, context) -> view(args.getString("path"),
                        args.getInt("start_line", 1), args.getInt("end_line", -1), context))
                .build();
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    private ToolResult view(String path, int startLine, int endLine, ToolContext context) throws IOException {
        Path file = context.resolvePath(path);
        if (!Files.exists(file)) {
            return ToolResult.failure("File not found: " + path);
        }
        if (Files.isDirectory(file)) {
            return viewDirectory(path, file);
        }
        long size = Files.size(file);
        if (size > maxFileBytes) {
            return ToolResult.failure("File too large: " + size + " bytes (max " + maxFileBytes + ")");
        }

        String content = Files.readString(file, StandardCharsets.UTF_8);
        context.getFileTracker().record(file, content);

        String[] lines = content.split("\n", -1);
        int total = content.isEmpty() ? 0 : lines.length;
        if (total == 0) {
            return ToolResult.success("File: " + path + " (empty)", Map.of("filePath", file.toString(),
                    "totalLines", 0));
        }
        if (startLine > total) {
            return ToolResult.failure("start_line " + startLine + " is beyond the end of the file (" + total
                    + " lines)");
        }
        int last = endLine < 0 ? total : Math.min(endLine, total);
        if (last < startLine) {
            return ToolResult.failure("end_line must not be less than start_line");
        }
        last = Math.min(last, startLine + maxLines - 1);

        StringBuilder output = new StringBuilder();
        output.append("File: ").append(path)
                .append(" (lines ").append(startLine).append('-').append(last)
                .append(" of ").append(total).append("):\n");
        for (int i = startLine; i <= last; i++) {
            output.append(i).append(": ").append(lines[i - 1]).append('\n');
            if (output.length() > MAX_OUTPUT_CHARS) {
                output.append("[Output truncated at line ").append(i).append("]\n");
                last = i;
                break;
            }
        }
        if (last < total) {
            output.append("... ").append(total - last).append(" more lines. Use start_line=")
                    .append(last + 1).append(" to continue.\n");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("filePath", file.toString());
        data.put("startLine", startLine);
        data.put("endLine", last);
        data.put("totalLines", total);
        return ToolResult.success(output.toString().trim(), data);
    }

    private ToolResult viewDirectory(String path, Path directory) throws IOException {
        List<Path> entries;
        try (Stream<Path> stream = Files.list(directory)) {
            entries = stream
                    .sorted(Comparator.comparing((Path p) -> !Files.isDirectory(p))
                            .thenComparing(p -> p.getFileName().toString()))
                    .toList();
        }
        StringBuilder output = new StringBuilder("Directory: ").append(path).append('\n');
        for (Path entry : entries) {
            output.append(Files.isDirectory(entry) ? "[DIR]  " : "[FILE] ")
                    .append(entry.getFileName()).append('\n');
        }
        return ToolResult.success(output.toString().trim(),
                Map.of("path", directory.toString(), "count", entries.size()));
    }
}
