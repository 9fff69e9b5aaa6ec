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
import me.golemcore.agent.domain.model.ToolArguments;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ArgumentChecks;
import me.golemcore.agent.domain.tool.ToolBuilder;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Searches file contents and file names below the working directory.
 *
 * <p>
 * Text search matches line by line, either literally or as a regular
 * expression, optionally case-sensitive and whole-word. File search matches
 * the query against relative paths, as a glob when the query contains glob
 * characters and as a substring otherwise. Hidden entries and well-known build
 * output directories are skipped unless {@code include_hidden} is set.
 */
@Component
@Slf4j
public class SearchTool implements ToolComponent {

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("node_modules", "target", "build", "dist");

    private final ToolDefinition definition;
    private final long maxFileBytes;

    public SearchTool(AgentProperties properties) {
        AgentProperties.SearchToolProperties config = properties.getTools().getSearch();
        this.maxFileBytes = config.getMaxFileBytes();
        this.definition = ToolBuilder.create()
                .id("search")
                .name("Unified Search Tool")
                .description("Search for text inside files and/or for files by name below the working directory.")
                .category(ToolCategory.SEARCH)
                .capabilities(ToolCapability.FILE_READ)
                .tags("search", "find", "grep")
                .stringArg("query", "Text to search for or file name/path pattern", arg -> arg.required(true))
                .stringArg("search_type", "\"text\" for content, \"files\" for names, \"both\" for both",
                        arg -> arg.defaultValue("both").enumValues(List.of("text", "files", "both")))
                .stringArg("include_pattern", "Glob for files to include (e.g. \"*.java\")")
                .stringArg("exclude_pattern", "Glob for files to exclude (e.g. \"*.log\")")
                .booleanArg("case_sensitive", "Match case", arg -> arg.defaultValue(false))
                .booleanArg("whole_word", "Match whole words only", arg -> arg.defaultValue(false))
                .booleanArg("regex", "Treat the query as a regular expression", arg -> arg.defaultValue(false))
                .numberArg("max_results", "Maximum number of results",
                        arg -> arg.defaultValue(config.getDefaultMaxResults())
                                .validator(ArgumentChecks.integer().and(ArgumentChecks.min(1))))
                .arrayArg("file_types", "File extensions to search (e.g. [\"java\", \"xml\"])", arg -> arg)
                .booleanArg("include_hidden", "Include hidden files and directories", arg -> arg.defaultValue(false))
                .execute(this::search)
                .build();
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    private ToolResult search(ToolArguments args, ToolContext context) throws IOException {
        String query = args.getString("query");
        if (query == null || query.isEmpty()) {
            return ToolResult.failure("Query must not be empty");
        }
        String searchType = args.getString("search_type", "both");
        int maxResults = args.getInt("max_results", 50);

        Options options = Options.builder()
                .root(context.getWorkingDirectory())
                .include(globMatcher(args.getString("include_pattern")))
                .exclude(globMatcher(args.getString("exclude_pattern")))
                .fileTypes(args.getList("file_types").stream().map(String::valueOf)
                        .map(type -> type.startsWith(".") ? type.substring(1) : type).toList())
                .includeHidden(args.getBoolean("include_hidden", false))
                .build();

        List<String> files = collectFiles(options);
        List<String> sections = new ArrayList<>();
        List<Map<String, Object>> results = new ArrayList<>();
        int total = 0;

        if (!searchType.equals("files")) {
            Pattern pattern;
            try {
                pattern = textPattern(query, args.getBoolean("case_sensitive", false),
                        args.getBoolean("whole_word", false), args.getBoolean("regex", false));
            } catch (PatternSyntaxException e) {
                return ToolResult.failure("Invalid regular expression: " + e.getDescription());
            }
            List<String> lines = textSearch(options.root, files, pattern, maxResults, results);
            if (!lines.isEmpty()) {
                sections.add("=== Text Search Results ===");
                sections.addAll(lines);
                total += results.size();
            }
        }

        if (!searchType.equals("text") && total < maxResults) {
            List<String> matches = fileSearch(files, query, args.getBoolean("case_sensitive", false),
                    maxResults - total);
            if (!matches.isEmpty()) {
                if (!sections.isEmpty()) {
                    sections.add("");
                }
                sections.add("=== File Search Results ===");
                sections.addAll(matches);
                matches.forEach(file -> results.add(Map.of("file", file)));
                total += matches.size();
            }
        }

        if (total == 0) {
            return ToolResult.success("No matches found", Map.of("query", query, "results", List.of()));
        }

        StringBuilder output = new StringBuilder("Found ").append(total)
                .append(total == 1 ? " match" : " matches");
        if (total >= maxResults) {
            output.append(" (showing first ").append(maxResults).append(" results)");
        }
        output.append("\n\n").append(String.join("\n", sections));
        log.debug("[Tools] Search '{}' found {} matches", query, total);
        return ToolResult.success(output.toString(), Map.of("query", query, "results", results));
    }

    static Pattern textPattern(String query, boolean caseSensitive, boolean wholeWord, boolean regex) {
        String body = regex ? query : Pattern.quote(query);
        if (wholeWord) {
            body = "\\b(?:" + body + ")\\b";
        }
        return Pattern.compile(body, caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private List<String> textSearch(Path root, List<String> files, Pattern pattern, int maxResults,
            List<Map<String, Object>> results) {
        List<String> formatted = new ArrayList<>();
        for (String relative : files) {
            if (results.size() >= maxResults) {
                break;
            }
            Path file = root.resolve(relative);
            List<String> lines;
            try {
                if (Files.size(file) > maxFileBytes) {
                    continue;
                }
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (MalformedInputException e) {
                continue; // binary
            } catch (IOException e) {
                log.debug("[Tools] Skipping unreadable file {}: {}", file, e.getMessage());
                continue;
            }
            boolean headerWritten = false;
            for (int i = 0; i < lines.size() && results.size() < maxResults; i++) {
                String line = lines.get(i);
                if (!pattern.matcher(line).find()) {
                    continue;
                }
                if (!headerWritten) {
                    formatted.add(relative + ":");
                    headerWritten = true;
                }
                formatted.add("  " + (i + 1) + ": " + line.trim());
                Map<String, Object> match = new LinkedHashMap<>();
                match.put("file", relative);
                match.put("line_number", i + 1);
                match.put("line", line);
                results.add(match);
            }
        }
        return formatted;
    }

    private static List<String> fileSearch(List<String> files, String query, boolean caseSensitive, int limit) {
        PathMatcher glob = hasGlobCharacters(query) ? globMatcher(query) : null;
        String needle = caseSensitive ? query : query.toLowerCase(Locale.ROOT);
        List<String> matches = new ArrayList<>();
        for (String relative : files) {
            if (matches.size() >= limit) {
                break;
            }
            boolean matched;
            if (glob != null) {
                Path path = Path.of(relative);
                matched = glob.matches(path) || glob.matches(path.getFileName());
            } else {
                String haystack = caseSensitive ? relative : relative.toLowerCase(Locale.ROOT);
                matched = haystack.contains(needle);
            }
            if (matched) {
                matches.add(relative);
            }
        }
        return matches;
    }

    private static List<String> collectFiles(Options options) throws IOException {
        List<String> files = new ArrayList<>();
        Files.walkFileTree(options.root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(options.root)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (!options.includeHidden && (name.startsWith(".") || SKIPPED_DIRECTORIES.contains(name))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && options.accepts(options.root.relativize(file))) {
                    files.add(options.root.relativize(file).toString());
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.debug("[Tools] Cannot visit {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(String::compareTo);
        return files;
    }

    private static boolean hasGlobCharacters(String text) {
        return text.indexOf('*') >= 0 || text.indexOf('?') >= 0 || text.indexOf('{') >= 0
                || text.indexOf('[') >= 0;
    }

    private static PathMatcher globMatcher(String glob) {
        if (glob == null || glob.isBlank()) {
            return null;
        }
        return FileSystems.getDefault().getPathMatcher("glob:" + glob);
    }

    @Builder
    private record Options(Path root, PathMatcher include, PathMatcher exclude, List<String> fileTypes,
            boolean includeHidden) {

        boolean accepts(Path relative) {
            String name = relative.getFileName().toString();
            if (!includeHidden && name.startsWith(".")) {
                return false;
            }
            if (include != null && !include.matches(relative) && !include.matches(relative.getFileName())) {
                return false;
            }
            if (exclude != null && (exclude.matches(relative) || exclude.matches(relative.getFileName()))) {
                return false;
            }
            if (!fileTypes.isEmpty()) {
                int dot = name.lastIndexOf('.');
                return dot >= 0 && fileTypes.contains(name.substring(dot + 1));
            }
            return true;
        }
    }
}
