package me.golemcore.agent.domain.tool;

import me.golemcore.agent.domain.exception.InvalidToolDefinitionException;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolBuilderTest {

    @Test
    void shouldFillDefaults() {
        ToolDefinition definition = ToolBuilder.create()
                .id("noop")
                .description("Does nothing")
                .execute((args, ctx) -> ToolResult.success(""))
                .build();

        assertEquals("noop", definition.getName());
        assertEquals(ToolCategory.CUSTOM, definition.getCategory());
        assertTrue(definition.getCapabilities().isEmpty());
        assertTrue(definition.getArguments().isEmpty());
    }

    @Test
    void shouldKeepDeclaredArgumentsInOrder() {
        ToolDefinition definition = ToolBuilder.create()
                .id("list")
                .description("List")
                .capabilities(ToolCapability.FILE_READ)
                .stringArg("path", "Directory", arg -> arg.defaultValue("."))
                .booleanArg("detailed", "Details", arg -> arg.defaultValue(false))
                .execute((args, ctx) -> ToolResult.success(""))
                .build();

        assertEquals(List.of("path", "detailed"),
                definition.getArguments().stream().map(spec -> spec.getName()).toList());
        assertTrue(definition.hasCapability(ToolCapability.FILE_READ));
        assertFalse(definition.hasCapability(ToolCapability.FILE_WRITE));
    }

    @Test
    void shouldRequireIdDescriptionAndExecutor() {
        assertThrows(InvalidToolDefinitionException.class, () -> ToolBuilder.create()
                .description("x").execute((args, ctx) -> null).build());
        assertThrows(InvalidToolDefinitionException.class, () -> ToolBuilder.create()
                .id("x").execute((args, ctx) -> null).build());
        assertThrows(InvalidToolDefinitionException.class, () -> ToolBuilder.create()
                .id("x").description("x").build());
    }

    @Test
    void shouldRejectDuplicateArgumentNames() {
        ToolBuilder builder = ToolBuilder.create()
                .id("dup")
                .description("Duplicate args")
                .stringArg("path", "One")
                .stringArg("path", "Two")
                .execute((args, ctx) -> ToolResult.success(""));

        assertThrows(InvalidToolDefinitionException.class, builder::build);
    }

    @Test
    void shouldRejectDefaultOfWrongType() {
        ToolBuilder builder = ToolBuilder.create()
                .id("typed")
                .description("Bad default")
                .numberArg("limit", "Limit", arg -> arg.defaultValue("ten"))
                .execute((args, ctx) -> ToolResult.success(""));

        assertThrows(InvalidToolDefinitionException.class, builder::build);
    }

    @Test
    void shouldRejectDefaultOutsideEnum() {
        ToolBuilder builder = ToolBuilder.create()
                .id("mode")
                .description("Bad enum default")
                .stringArg("mode", "Mode", arg -> arg.enumValues(List.of("a", "b")).defaultValue("c"))
                .execute((args, ctx) -> ToolResult.success(""));

        assertThrows(InvalidToolDefinitionException.class, builder::build);
    }
}
