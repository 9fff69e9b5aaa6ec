package me.golemcore.agent.tools;

import me.golemcore.agent.domain.model.ToolArguments;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ListToolTest {

    @TempDir
    Path tempDir;

    private AgentProperties properties;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        context = ToolContext.builder().workingDirectory(tempDir).build();
    }

    private ToolResult run(Map<String, Object> args) throws Exception {
        ToolDefinition definition = new ListTool(properties).getDefinition();
        return definition.getExecutor().execute(ToolArguments.of(args, definition.getArguments()), context);
    }

    @Test
    void shouldListDirectoriesFirstThenFiles() throws Exception {
        Files.writeString(tempDir.resolve("b.txt"), "b");
        Files.writeString(tempDir.resolve("a.txt"), "a");
        Files.createDirectory(tempDir.resolve("src"));

        ToolResult result = run(Map.of());

        assertTrue(result.isSuccess());
        assertEquals("src/\na.txt\nb.txt", result.getOutput());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(3, data.get("count"));
    }

    @Test
    void shouldShowDetails() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "hello");
        Files.createDirectory(tempDir.resolve("docs"));

        ToolResult result = run(Map.of("detailed", true));

        assertEquals("[DIR]  docs/\n[FILE] a.txt (5 bytes)", result.getOutput());
    }

    @Test
    void shouldReportEmptyDirectory() throws Exception {
        ToolResult result = run(Map.of("path", "."));

        assertTrue(result.isSuccess());
        assertEquals("Empty directory", result.getOutput());
    }

    @Test
    void shouldLimitEntries() throws Exception {
        properties.getTools().getFiles().setMaxListEntries(2);
        for (String name : List.of("a", "b", "c", "d")) {
            Files.writeString(tempDir.resolve(name), name);
        }

        ToolResult result = run(Map.of());

        assertEquals("a\nb\n... and 2 more items", result.getOutput());
    }

    @Test
    void shouldFailForMissingOrNonDirectoryPath() throws Exception {
        Files.writeString(tempDir.resolve("file.txt"), "x");

        ToolResult missing = run(Map.of("path", "nope"));
        ToolResult file = run(Map.of("path", "file.txt"));

        assertFalse(missing.isSuccess());
        assertTrue(missing.getError().startsWith("Path does not exist"));
        assertFalse(file.isSuccess());
        assertTrue(file.getError().startsWith("Path is not a directory"));
    }
}
