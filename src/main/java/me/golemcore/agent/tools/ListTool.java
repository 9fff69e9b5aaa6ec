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
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExample;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Lists the entries of a directory, directories first, then files, each group
 * sorted by name. Directory names carry a trailing slash.
 */
@Component
@Slf4j
public class ListTool implements ToolComponent {

    private final ToolDefinition definition;
    private final int maxEntries;

    public ListTool(AgentProperties properties) {
        this.maxEntries = properties.getTools().getFiles().getMaxListEntries();
        this.definition = ToolBuilder.create()
                .id("list")
                .description("List the files and directories in a directory. Directories are marked with a trailing '/'.")
                .category(ToolCategory.FILE_SYSTEM)
                .capabilities(ToolCapability.FILE_READ)
                .stringArg("path", "Directory to list, relative to the working directory",
                        arg -> arg.defaultValue("."))
                .booleanArg("detailed", "Include size and type for every entry",
                        arg -> arg.defaultValue(false))
                .example(new ToolExample("List the current directory", Map.of("path", "."),
                        "src/\npom.xml\nREADME.md"))
                .execute((args, context) -> list(context.resolvePath(args.getString("path", ".")),
                        args.getBoolean("detailed", false)))
                .build();
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    private ToolResult list(Path directory, boolean detailed) throws IOException {
        if (!Files.exists(directory)) {
            return ToolResult.failure("Path does not exist: " + directory);
        }
        if (!Files.isDirectory(directory)) {
            return ToolResult.failure("Path is not a directory: " + directory);
        }

        List<Path> entries;
        try (Stream<Path> stream = Files.list(directory)) {
            entries = stream
                    .sorted(Comparator.comparing((Path p) -> !Files.isDirectory(p))
                            .thenComparing(p -> p.getFileName().toString()))
                    .toList();
        }

        if (entries.isEmpty()) {
            return ToolResult.success("Empty directory",
                    Map.of("path", directory.toString(), "count", 0, "items", List.of()));
        }

        List<Map<String, Object>> items = new ArrayList<>();
        StringBuilder output = new StringBuilder();
        int shown = Math.min(entries.size(), maxEntries);
        for (Path entry : entries.subList(0, shown)) {
            boolean isDirectory = Files.isDirectory(entry);
            String name = entry.getFileName().toString() + (isDirectory ? "/" : "");
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", entry.getFileName().toString());
            item.put("type", isDirectory ? "directory" : "file");
            if (detailed) {
                long size = isDirectory ? 0 : sizeOf(entry);
                item.put("size", size);
                output.append(isDirectory ? "[DIR]  " : "[FILE] ").append(name);
                if (!isDirectory) {
                    output.append(" (").append(size).append(" bytes)");
                }
            } else {
                output.append(name);
            }
            output.append('\n');
            items.add(item);
        }
        if (entries.size() > shown) {
            output.append("... and ").append(entries.size() - shown).append(" more items\n");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("path", directory.toString());
        data.put("count", entries.size());
        data.put("items", items);
        return ToolResult.success(output.toString().trim(), data);
    }

    private static long sizeOf(Path file) {
        try {
            return Files.readAttributes(file, BasicFileAttributes.class).size();
        } catch (IOException e) {
            log.debug("[Tools] Cannot stat {}: {}", file, e.getMessage());
            return -1;
        }
    }
}
