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
import me.golemcore.agent.domain.model.TodoItem;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Shows the session todo list.
 */
@Component
public class ListTodosTool implements ToolComponent {

    private final ToolDefinition definition = ToolBuilder.create()
            .id("list_todos")
            .description("Show the current todo list")
            .category(ToolCategory.TASK)
            .tags("todo", "planning")
            .execute((args, context) -> {
                List<TodoItem> todos = context.getTodoList().snapshot();
                if (todos.isEmpty()) {
                    return ToolResult.success("No todos in the list", Map.of("todos", List.of()));
                }
                return ToolResult.success(TodoSummary.render(todos), Map.of("todos", todos));
            })
            .build();

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }
}
