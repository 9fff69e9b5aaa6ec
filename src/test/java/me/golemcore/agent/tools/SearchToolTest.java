package me.golemcore.agent.tools;

import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.ToolConfirmationPolicy;
import me.golemcore.agent.domain.tool.DefaultToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchToolTest {

    @TempDir
    Path tempDir;

    private DefaultToolRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        AgentProperties properties = new AgentProperties();
        ToolContext context = ToolContext.builder().workingDirectory(tempDir).build();
        registry = new DefaultToolRegistry(new ToolConfirmationPolicy(properties), context, Clock.systemUTC());
        registry.register(new SearchTool(properties).getDefinition());

        Files.createDirectories(tempDir.resolve("src"));
        Files.createDirectories(tempDir.resolve("node_modules/lib"));
        Files.createDirectories(tempDir.resolve(".git"));
        Files.writeString(tempDir.resolve("src/App.java"), "class App {\n    // TODO wire config\n}\n");
        Files.writeString(tempDir.resolve("src/Config.java"), "class Config {\n    String todoList;\n}\n");
        Files.writeString(tempDir.resolve("README.md"), "Application readme\n");
        Files.writeString(tempDir.resolve("node_modules/lib/index.js"), "// TODO vendor\n");
        Files.writeString(tempDir.resolve(".git/config"), "TODO hidden\n");
    }

    private ToolResult search(Map<String, Object> extra) {
        Map<String, Object> args = new HashMap<>(extra);
        return registry.execute("search", args);
    }

    @Test
    void shouldFindTextCaseInsensitivelyAndSkipHiddenAndVendorDirectories() {
        ToolResult result = search(Map.of("query", "todo", "search_type", "text"));

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Found 2 matches"));
        assertTrue(result.getOutput().contains("src/App.java:\n  2: // TODO wire config"));
        assertTrue(result.getOutput().contains("src/Config.java:\n  2: String todoList;"));
        assertFalse(result.getOutput().contains("vendor"));
        assertFalse(result.getOutput().contains("hidden"));
    }

    @Test
    void shouldHonorCaseSensitiveAndWholeWord() {
        ToolResult caseSensitive = search(Map.of("query", "TODO", "search_type", "text", "case_sensitive", true));
        ToolResult wholeWord = search(Map.of("query", "todo", "search_type", "text", "whole_word", true));

        assertTrue(caseSensitive.getOutput().startsWith("Found 1 match\n"));
        assertTrue(wholeWord.getOutput().startsWith("Found 1 match\n"));
        assertTrue(wholeWord.getOutput().contains("src/App.java"));
    }

    @Test
    void shouldSearchWithRegex() {
        ToolResult result = search(Map.of("query", "class \\w+ \\{", "search_type", "text", "regex", true));

        assertTrue(result.getOutput().startsWith("Found 2 matches"));
    }

    @Test
    void shouldReportInvalidRegex() {
        ToolResult result = search(Map.of("query", "(unclosed", "regex", true));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Invalid regular expression"));
    }

    @Test
    void shouldFindFilesBySubstringAndGlob() {
        ToolResult substring = search(Map.of("query", "config", "search_type", "files"));
        ToolResult glob = search(Map.of("query", "*.md", "search_type", "files"));

        assertTrue(substring.getOutput().contains("=== File Search Results ===\nsrc/Config.java"));
        assertTrue(glob.getOutput().contains("README.md"));
        assertFalse(glob.getOutput().contains("App.java"));
    }

    @Test
    void shouldFilterByFileTypeAndPatterns() {
        ToolResult byType = search(Map.of("query", "a", "search_type", "files", "file_types", List.of(".md")));
        ToolResult excluded = search(Map.of("query", "class", "search_type", "text",
                "exclude_pattern", "Config.java"));
        ToolResult included = search(Map.of("query", "class", "search_type", "text",
                "include_pattern", "src/Config.*"));

        assertEquals("Found 1 match\n\n=== File Search Results ===\nREADME.md", byType.getOutput());
        assertTrue(excluded.getOutput().startsWith("Found 1 match\n"));
        assertTrue(excluded.getOutput().contains("src/App.java"));
        assertTrue(included.getOutput().contains("src/Config.java"));
        assertFalse(included.getOutput().contains("src/App.java"));
    }

    @Test
    void shouldIncludeHiddenWhenAsked() {
        ToolResult result = search(Map.of("query", "TODO", "search_type", "text", "include_hidden", true));

        assertTrue(result.getOutput().contains("hidden"));
        assertTrue(result.getOutput().contains("vendor"));
    }

    @Test
    void shouldLimitResults() {
        ToolResult result = search(Map.of("query", "class", "search_type", "text", "max_results", 1));

        assertTrue(result.getOutput().startsWith("Found 1 match (showing first 1 results)"));
    }

    @Test
    void shouldReportNoMatches() {
        ToolResult result = search(Map.of("query", "nothing-here-at-all"));

        assertTrue(result.isSuccess());
        assertEquals("No matches found", result.getOutput());
    }

    @Test
    void shouldRejectUnknownSearchType() {
        ToolResult result = search(Map.of("query", "x", "search_type", "everything"));

        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
    }

    @Test
    void shouldBuildTextPatterns() {
        Pattern literal = SearchTool.textPattern("a.b", false, false, false);
        Pattern word = SearchTool.textPattern("cat", true, true, false);

        assertTrue(literal.matcher("A.B").find());
        assertFalse(literal.matcher("axb").find());
        assertTrue(word.matcher("the cat sat").find());
        assertFalse(word.matcher("concatenate").find());
        assertFalse(word.matcher("CAT").find());
    }
}
