package me.golemcore.agent.tools;

import me.golemcore.agent.domain.model.ToolArguments;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PwdToolTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldFollowWorkingDirectoryChanges() throws Exception {
        ToolContext context = ToolContext.builder().workingDirectory(tempDir).build();
        PwdTool tool = new PwdTool();

        ToolResult before = tool.getDefinition().getExecutor().execute(ToolArguments.of(Map.of()), context);
        context.setWorkingDirectory(tempDir.resolve("sub"));
        ToolResult after = tool.getDefinition().getExecutor().execute(ToolArguments.of(Map.of()), context);

        assertEquals(tempDir.toAbsolutePath().normalize().toString(), before.getOutput());
        assertEquals(tempDir.resolve("sub").toAbsolutePath().normalize().toString(), after.getOutput());
    }
}
