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
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplaceInFileToolTest {

    @TempDir
    Path tempDir;

    private DefaultToolRegistry registry;
    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        AgentProperties properties = new AgentProperties();
        ToolContext context = ToolContext.builder().workingDirectory(tempDir).build();
        context.getConfirmationFlags().setBypassAll(true);
        registry = new DefaultToolRegistry(new ToolConfirmationPolicy(properties), context, Clock.systemUTC());
        registry.register(new ReadFileTool(properties).getDefinition());
        registry.register(new ReplaceInFileTool().getDefinition());
        file = Files.writeString(tempDir.resolve("app.js"), "let count = 1;\nlet count2 = count;\n");
    }

    private ToolResult replace(Object replacements) {
        return registry.execute("replace_in_file", Map.of("path", "app.js", "replacements", replacements));
    }

    private static Map<String, Object> edit(String search, String replace) {
        return Map.of("search", search, "replace", replace);
    }

    @Test
    void shouldRequireReadBeforeEdit() throws Exception {
        ToolResult result = replace(List.of(edit("count", "total")));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("You must read the file before editing it."));
        assertEquals("let count = 1;\nlet count2 = count;\n", Files.readString(file));
    }

    @Test
    void shouldApplyReplacementsInOrderToFirstOccurrence() throws Exception {
        registry.execute("read_file", Map.of("path", "app.js"));

        ToolResult result = replace(List.of(edit("let count", "let total"), edit("count", "sum")));

        assertTrue(result.isSuccess());
        assertEquals("Successfully applied 2 replacement(s) in app.js", result.getOutput());
        assertEquals("let total = 1;\nlet sum2 = count;\n", Files.readString(file));
    }

    @Test
    void shouldAllowConsecutiveEditsWithoutRereading() throws Exception {
        registry.execute("read_file", Map.of("path", "app.js"));

        assertTrue(replace(List.of(edit("= 1", "= 2"))).isSuccess());
        assertTrue(replace(List.of(edit("= 2", "= 3"))).isSuccess());

        assertTrue(Files.readString(file).startsWith("let count = 3;"));
    }

    @Test
    void shouldWriteNothingWhenAnySearchIsMissing() throws Exception {
        registry.execute("read_file", Map.of("path", "app.js"));

        ToolResult result = replace(List.of(edit("let count", "let total"), edit("missing text", "x")));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("Replacement 2: search text not found: missing text"));
        assertEquals("let count = 1;\nlet count2 = count;\n", Files.readString(file));
    }

    @Test
    void shouldRefuseEditAfterExternalChange() throws Exception {
        registry.execute("read_file", Map.of("path", "app.js"));
        Files.writeString(file, "changed elsewhere");

        ToolResult result = replace(List.of(edit("changed", "edited")));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("has been modified since it was last read"));
        assertEquals("changed elsewhere", Files.readString(file));
    }

    @Test
    void shouldRejectMalformedReplacements() {
        ToolResult empty = replace(List.of());
        ToolResult noSearch = replace(List.of(Map.of("replace", "x")));

        assertEquals(ToolFailureKind.VALIDATION_FAILED, empty.getFailureKind());
        assertEquals(ToolFailureKind.VALIDATION_FAILED, noSearch.getFailureKind());
    }
}
