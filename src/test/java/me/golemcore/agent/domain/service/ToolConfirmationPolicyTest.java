package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.model.ConfirmationGroup;
import me.golemcore.agent.domain.model.ToolArguments;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolConfirmationPolicyTest {

    private static ToolDefinition tool(String id, ToolCapability... capabilities) {
        return ToolBuilder.create()
                .id(id)
                .description("Test tool")
                .capabilities(capabilities)
                .execute((args, ctx) -> ToolResult.success(""))
                .build();
    }

    @Test
    void shouldRequireConfirmationForDestructiveTools() {
        ToolConfirmationPolicy policy = new ToolConfirmationPolicy(new AgentProperties());

        assertTrue(policy.requiresConfirmation(tool("bash", ToolCapability.SYSTEM_EXECUTE)));
        assertTrue(policy.requiresConfirmation(tool("write_to_file", ToolCapability.FILE_WRITE)));
        assertTrue(policy.requiresConfirmation(tool("ask", ToolCapability.USER_CONFIRMATION)));
        assertFalse(policy.requiresConfirmation(tool("list", ToolCapability.FILE_READ)));
    }

    @Test
    void shouldOnlyHonorExplicitRequestWhenDestructiveCheckIsOff() {
        AgentProperties properties = new AgentProperties();
        properties.getSecurity().getToolConfirmation().setConfirmDestructive(false);
        ToolConfirmationPolicy policy = new ToolConfirmationPolicy(properties);

        assertFalse(policy.requiresConfirmation(tool("write_to_file", ToolCapability.FILE_WRITE)));
        assertTrue(policy.requiresConfirmation(tool("bash", ToolCapability.SYSTEM_EXECUTE,
                ToolCapability.USER_CONFIRMATION)));
    }

    @Test
    void shouldNeverRequireConfirmationWhenDisabled() {
        AgentProperties properties = new AgentProperties();
        properties.getSecurity().getToolConfirmation().setEnabled(false);
        ToolConfirmationPolicy policy = new ToolConfirmationPolicy(properties);

        assertFalse(policy.requiresConfirmation(tool("ask", ToolCapability.USER_CONFIRMATION)));
        assertTrue(policy.isNotableAction(tool("ask", ToolCapability.USER_CONFIRMATION)));
    }

    @Test
    void shouldGroupByCapability() {
        ToolConfirmationPolicy policy = new ToolConfirmationPolicy(new AgentProperties());

        assertEquals(ConfirmationGroup.BASH_COMMANDS, policy.groupOf(tool("bash", ToolCapability.SYSTEM_EXECUTE)));
        assertEquals(ConfirmationGroup.FILE_OPERATIONS, policy.groupOf(tool("remove", ToolCapability.FILE_WRITE)));
        assertEquals(ConfirmationGroup.OTHER, policy.groupOf(tool("ask", ToolCapability.USER_CONFIRMATION)));
    }

    @Test
    void shouldDescribeActions() {
        ToolConfirmationPolicy policy = new ToolConfirmationPolicy(new AgentProperties());

        assertEquals("Run command: ls -la",
                policy.describeAction(tool("bash"), ToolArguments.of(Map.of("command", "ls -la"))));
        assertEquals("Write file: a.txt",
                policy.describeAction(tool("write_to_file"), ToolArguments.of(Map.of("path", "a.txt"))));
        assertEquals("Edit file: a.txt",
                policy.describeAction(tool("replace_in_file"), ToolArguments.of(Map.of("path", "a.txt"))));
        assertEquals("Delete files: [a, b]",
                policy.describeAction(tool("remove"), ToolArguments.of(Map.of("paths", List.of("a", "b")))));
        assertEquals("Delete file: a",
                policy.describeAction(tool("remove"), ToolArguments.of(Map.of("path", "a"))));
    }

    @Test
    void shouldTruncateLongCommands() {
        ToolConfirmationPolicy policy = new ToolConfirmationPolicy(new AgentProperties());
        String command = "x".repeat(100);

        String description = policy.describeAction(tool("bash"), ToolArguments.of(Map.of("command", command)));

        assertEquals("Run command: " + "x".repeat(80) + "...", description);
    }
}
