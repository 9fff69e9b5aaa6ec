package me.golemcore.agent.tools;

import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.ToolConfirmationPolicy;
import me.golemcore.agent.domain.tool.DefaultToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TodoToolsTest {

    private DefaultToolRegistry registry;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        context = ToolContext.builder().build();
        registry = new DefaultToolRegistry(new ToolConfirmationPolicy(new AgentProperties()), context,
                Clock.systemUTC());
        registry.register(new CreateTodoListTool().getDefinition());
        registry.register(new UpdateTodoListTool().getDefinition());
        registry.register(new ListTodosTool().getDefinition());
    }

    private static Map<String, Object> todo(String id, String content, String status, String priority) {
        return Map.of("id", id, "content", content, "status", status, "priority", priority);
    }

    private void createDefaultList() {
        ToolResult created = registry.execute("create_todo_list", Map.of("todos", List.of(
                todo("1", "Read the project files", "pending", "high"),
                todo("2", "Write the summary", "pending", "medium"),
                todo("3", "Fix typos", "in_progress", "low"))));
        assertTrue(created.isSuccess(), created.getError());
    }

    // ==================== create ====================

    @Test
    void shouldCreateListAndRenderSummary() {
        createDefaultList();

        ToolResult listed = registry.execute("list_todos", Map.of());

        assertEquals("""
                High Priority:
                  [ ] [1] Read the project files

                Other Tasks:
                  [ ] (medium) [2] Write the summary
                  [~] (low) [3] Fix typos

                Total: 3 | Pending: 2 | In Progress: 1 | Completed: 0""", listed.getOutput());
    }

    @Test
    void shouldReplaceExistingList() {
        createDefaultList();

        registry.execute("create_todo_list", Map.of("todos", List.of(todo("a", "Only task", "pending", "low"))));

        assertEquals(1, context.getTodoList().snapshot().size());
        assertTrue(context.getTodoList().find("a").isPresent());
    }

    @Test
    void shouldRejectInvalidTodos() {
        ToolResult duplicate = registry.execute("create_todo_list", Map.of("todos", List.of(
                todo("1", "a", "pending", "high"), todo("1", "b", "pending", "high"))));
        ToolResult badStatus = registry.execute("create_todo_list", Map.of("todos", List.of(
                todo("1", "a", "done", "high"))));

        assertEquals(ToolFailureKind.VALIDATION_FAILED, duplicate.getFailureKind());
        assertTrue(duplicate.getError().contains("Duplicate todo id: 1"));
        assertEquals(ToolFailureKind.VALIDATION_FAILED, badStatus.getFailureKind());
        assertTrue(context.getTodoList().isEmpty());
    }

    // ==================== update ====================

    @Test
    void shouldUpdateTodosById() {
        createDefaultList();

        ToolResult result = registry.execute("update_todo_list", Map.of("updates", List.of(
                Map.of("id", "1", "status", "completed"),
                Map.of("id", "2", "content", "Write a short summary", "priority", "high"))));

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Updated 2 todo(s): 1, 2"));
        assertTrue(result.getOutput().contains("Completed (1):\n  [x] [1] Read the project files"));
        assertEquals("Write a short summary", context.getTodoList().find("2").orElseThrow().getContent());
    }

    @Test
    void shouldFailWhenAnyIdIsUnknownButApplyTheRest() {
        createDefaultList();

        ToolResult result = registry.execute("update_todo_list", Map.of("updates", List.of(
                Map.of("id", "3", "status", "completed"),
                Map.of("id", "42", "status", "completed"))));

        assertFalse(result.isSuccess());
        assertEquals("Todo(s) not found: 42", result.getError());
        assertEquals("completed", context.getTodoList().find("3").orElseThrow().getStatus());
    }

    @Test
    void shouldRejectInvalidUpdates() {
        ToolResult result = registry.execute("update_todo_list", Map.of("updates", List.of(
                Map.of("id", "1", "priority", "urgent"))));

        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
    }

    // ==================== list ====================

    @Test
    void shouldReportEmptyList() {
        assertEquals("No todos in the list", registry.execute("list_todos", Map.of()).getOutput());
    }
}
