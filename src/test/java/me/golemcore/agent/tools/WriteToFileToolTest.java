package me.golemcore.agent.tools;

import me.golemcore.agent.domain.model.ToolArguments;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WriteToFileToolTest {

    @TempDir
    Path tempDir;

    private ToolContext context;
    private final ToolDefinition definition = new WriteToFileTool().getDefinition();

    @BeforeEach
    void setUp() {
        context = ToolContext.builder().workingDirectory(tempDir).build();
    }

    private ToolResult run(Map<String, Object> args) throws Exception {
        return definition.getExecutor().execute(ToolArguments.of(args, definition.getArguments()), context);
    }

    @Test
    void shouldCreateFileWithParentDirectories() throws Exception {
        ToolResult result = run(Map.of("path", "src/main/App.java", "content", "class App {}"));

        assertTrue(result.isSuccess());
        assertEquals("Successfully created file: src/main/App.java", result.getOutput());
        Path file = tempDir.resolve("src/main/App.java");
        assertEquals("class App {}", Files.readString(file));
        assertTrue(context.getFileTracker().isTracked(file));
    }

    @Test
    void shouldOverwriteExistingFile() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "old");

        ToolResult result = run(Map.of("path", "a.txt", "content", "new"));

        assertEquals("Successfully overwrote file: a.txt", result.getOutput());
        assertEquals("new", Files.readString(tempDir.resolve("a.txt")));
    }

    @Test
    void shouldRefuseOverwriteWhenCreateOnly() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "old");

        ToolResult result = run(Map.of("path", "a.txt", "content", "new", "create_only", true));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("File already exists: a.txt"));
        assertEquals("old", Files.readString(tempDir.resolve("a.txt")));
    }

    @Test
    void shouldRefuseDirectoryTarget() throws Exception {
        Files.createDirectory(tempDir.resolve("dir"));

        assertEquals("Path is a directory: dir", run(Map.of("path", "dir", "content", "x")).getError());
    }
}
