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
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadFileToolTest {

    @TempDir
    Path tempDir;

    private AgentProperties properties;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        context = ToolContext.builder().workingDirectory(tempDir).build();
    }

    private ToolResult run(String path) throws Exception {
        ToolDefinition definition = new ReadFileTool(properties).getDefinition();
        return definition.getExecutor().execute(ToolArguments.of(Map.of("path", path), definition.getArguments()),
                context);
    }

    @Test
    void shouldReturnContentAndTrackFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("notes.txt"), "one\ntwo");

        ToolResult result = run("notes.txt");

        assertTrue(result.isSuccess());
        assertEquals("Successfully read notes.txt", result.getOutput());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals("one\ntwo", data.get("content"));
        assertEquals(2, data.get("totalLines"));
        assertTrue(context.getFileTracker().isTracked(file));
    }

    @Test
    void shouldFailForMissingFileOrDirectory() throws Exception {
        Files.createDirectory(tempDir.resolve("dir"));

        assertEquals("File not found: missing.txt", run("missing.txt").getError());
        assertEquals("Path is a directory, not a file: dir", run("dir").getError());
    }

    @Test
    void shouldRefuseFilesOverSizeLimit() throws Exception {
        properties.getTools().getFiles().setMaxFileBytes(4);
        Files.writeString(tempDir.resolve("big.txt"), "0123456789");

        ToolResult result = run("big.txt");

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("File too large: 10 bytes"));
    }
}
