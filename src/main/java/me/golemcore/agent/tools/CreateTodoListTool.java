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
import me.golemcore.agent.domain.model.CheckResult;
import me.golemcore.agent.domain.model.TodoItem;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExample;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replaces the session todo list.
 */
@Component
@Slf4j
public class CreateTodoListTool implements ToolComponent {

    private final ToolDefinition definition = ToolBuilder.create()
            .id("create_todo_list")
            .description("Create a todo list to plan and track multi-step work. Replaces any existing list. "
                    + "Each todo has id, content, status (pending, in_progress, completed) and priority "
                    + "(high, medium, low).")
            .category(ToolCategory.TASK)
            .tags("todo", "planning")
            .arrayArg("todos", "The complete list of todos",
                    arg -> arg.required(true).validator(CreateTodoListTool::checkTodos))
            .example(new ToolExample("Create a todo list with two tasks",
                    Map.of("todos", List.of(
                            Map.of("id", "1", "content", "Read the project files", "status", "pending",
                                    "priority", "high"),
                            Map.of("id", "2", "content", "Summarize the important files", "status", "pending",
                                    "priority", "medium"))),
                    "Created todo list with 2 items"))
            .execute((args, context) -> {
                List<TodoItem> todos = new ArrayList<>();
                for (Object raw : args.getList("todos")) {
                    Map<?, ?> todo = (Map<?, ?>) raw;
                    todos.add(TodoItem.builder()
                            .id(String.valueOf(todo.get("id")))
                            .content(String.valueOf(todo.get("content")))
                            .status(String.valueOf(todo.get("status")))
                            .priority(String.valueOf(todo.get("priority")))
                            .build());
                }
                context.getTodoList().replace(todos);
                log.debug("[Tools] Created todo list with {} items", todos.size());
                List<TodoItem> snapshot = context.getTodoList().snapshot();
                return ToolResult.success("Created todo list with " + todos.size() + " items:\n\n"
                        + TodoSummary.render(snapshot), Map.of("todos", snapshot));
            })
            .build();

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    private static CheckResult checkTodos(Object value) {
        if (!(value instanceof List<?> todos)) {
            return CheckResult.fail("Todos must be an array");
        }
        Set<String> ids = new HashSet<>();
        for (Object raw : todos) {
            if (!(raw instanceof Map<?, ?> todo)) {
                return CheckResult.fail("Each todo must be an object");
            }
            if (!(todo.get("id") instanceof String id) || id.isBlank()) {
                return CheckResult.fail("Each todo must have a string id");
            }
            if (!ids.add(id)) {
                return CheckResult.fail("Duplicate todo id: " + id);
            }
            if (!(todo.get("content") instanceof String content) || content.isBlank()) {
                return CheckResult.fail("Each todo must have content");
            }
            if (!TodoItem.STATUSES.contains(todo.get("status"))) {
                return CheckResult.fail("Each todo status must be pending, in_progress, or completed");
            }
            if (!TodoItem.PRIORITIES.contains(todo.get("priority"))) {
                return CheckResult.fail("Each todo priority must be high, medium, or low");
            }
        }
        return CheckResult.pass();
    }
}
