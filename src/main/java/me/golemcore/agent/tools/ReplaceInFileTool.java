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
import me.golemcore.agent.domain.model.CheckResult;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExample;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies exact search/replace edits to a file.
 *
 * <p>
 * The file must have been read (or written) earlier in the session and must
 * not have changed on disk since then. Every search string must occur in the
 * content at the point it is applied; otherwise nothing is written. Each
 * replacement affects the first occurrence only.
 */
@Component
@Slf4j
public class ReplaceInFileTool implements ToolComponent {

    private final ToolDefinition definition = ToolBuilder.create()
            .id("replace_in_file")
            .description("Replace exact text in a file. The file must be read with read_file first. Each "
                    + "replacement is an object with 'search' (exact text to find) and 'replace' (new text).")
            .category(ToolCategory.FILE_SYSTEM)
            .capabilities(ToolCapability.FILE_READ, ToolCapability.FILE_WRITE)
            .stringArg("path", "Path of the file to edit", arg -> arg.required(true))
            .arrayArg("replacements", "List of {search, replace} objects applied in order",
                    arg -> arg.required(true).validator(ReplaceInFileTool::checkReplacements))
            .example(new ToolExample("Rename a variable",
                    Map.of("path", "app.js", "replacements",
                            List.of(Map.of("search", "let count", "replace", "let total"))),
                    "Successfully applied 1 replacement(s) in app.js"))
            .execute((args, context) -> replace(args.getString("path"), args.getList("replacements"), context))
            .build();

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    private static CheckResult checkReplacements(Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            return CheckResult.fail("Must contain at least one replacement");
        }
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map) || !(map.get("search") instanceof String search)
                    || search.isEmpty() || !(map.get("replace") instanceof String)) {
                return CheckResult.fail("Each replacement needs a non-empty 'search' and a 'replace' string");
            }
        }
        return CheckResult.pass();
    }

    private static ToolResult replace(String path, List<Object> replacements, ToolContext context)
            throws IOException {
        Path file = context.resolvePath(path);
        if (!context.getFileTracker().isTracked(file)) {
            return ToolResult.failure("You must read the file before editing it. Please use read_file to read \""
                    + path + "\" first.");
        }
        if (!Files.isRegularFile(file)) {
            context.getFileTracker().forget(file);
            return ToolResult.failure("File not found: " + path);
        }

        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (!context.getFileTracker().matches(file, content)) {
            context.getFileTracker().forget(file);
            return ToolResult.failure("File \"" + path + "\" has been modified since it was last read. "
                    + "Please use read_file to read it again before editing.");
        }

        String updated = content;
        List<String> problems = new ArrayList<>();
        for (int i = 0; i < replacements.size(); i++) {
            Map<?, ?> replacement = (Map<?, ?>) replacements.get(i);
            String search = (String) replacement.get("search");
            String replaceWith = (String) replacement.get("replace");
            int index = updated.indexOf(search);
            if (index < 0) {
                problems.add("Replacement " + (i + 1) + ": search text not found: " + abbreviate(search));
                continue;
            }
            updated = updated.substring(0, index) + replaceWith + updated.substring(index + search.length());
        }
        if (!problems.isEmpty()) {
            return ToolResult.failure("Invalid replacements:\n" + String.join("\n", problems));
        }

        Files.writeString(file, updated, StandardCharsets.UTF_8);
        context.getFileTracker().record(file, updated);
        log.debug("[Tools] Applied {} replacement(s) to {}", replacements.size(), file);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("filePath", file.toString());
        data.put("replacements", replacements.size());
        return ToolResult.success("Successfully applied " + replacements.size() + " replacement(s) in " + path,
                data);
    }

    private static String abbreviate(String text) {
        String singleLine = text.replace('\n', ' ');
        return singleLine.length() > 80 ? singleLine.substring(0, 77) + "..." : singleLine;
    }
}
