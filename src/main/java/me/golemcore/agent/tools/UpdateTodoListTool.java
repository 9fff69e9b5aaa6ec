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
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExample;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Updates status, priority or content of existing todos by id. The call
 * succeeds only when every id was found; found items are updated either way.
 */
@Component
@Slf4j
public class UpdateTodoListTool implements ToolComponent {

    private final ToolDefinition definition = ToolBuilder.create()
            .id("update_todo_list")
            .description("Update existing todos by id. Each update has an id and any of status, priority, content.")
            .category(ToolCategory.TASK)
            .tags("todo", "planning")
            .arrayArg("updates", "Array of todo updates",
                    arg -> arg.required(true).validator(UpdateTodoListTool::checkUpdates))
            .example(new ToolExample("Mark a todo as completed",
                    Map.of("updates", List.of(Map.of("id", "1", "status", "completed"))),
                    "Updated 1 todo(s): 1"))
            .execute((args, context) -> update(args.getList("updates"), context))
            .build();

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    private static ToolResult update(List<Object> updates, ToolContext context) {
        List<String> updated = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (Object raw : updates) {
            Map<?, ?> update = (Map<?, ?>) raw;
            String id = (String) update.get("id");
            boolean found = context.getTodoList().update(id, item -> {
                if (update.get("status") instanceof String status) {
                    item.setStatus(status);
                }
                if (update.get("priority") instanceof String priority) {
                    item.setPriority(priority);
                }
                if (update.get("content") instanceof String content && !content.isBlank()) {
                    item.setContent(content);
                }
            });
            if (found) {
                updated.add(id);
            } else {
                log.warn("[Tools] Todo not found: {}", id);
                notFound.add(id);
            }
        }

        List<String> messages = new ArrayList<>();
        if (!updated.isEmpty()) {
            messages.add("Updated " + updated.size() + " todo(s): " + String.join(", ", updated));
        }
        if (!notFound.isEmpty()) {
            messages.add("Todo(s) not found: " + String.join(", ", notFound));
        }
        List<TodoItem> snapshot = context.getTodoList().snapshot();
        String output = String.join("\n", messages) + "\n\n" + TodoSummary.render(snapshot);
        if (!notFound.isEmpty()) {
            return ToolResult.builder()
                    .success(false)
                    .output(output)
                    .data(Map.of("todos", snapshot))
                    .error("Todo(s) not found: " + String.join(", ", notFound))
                    .failureKind(ToolFailureKind.TOOL_REPORTED)
                    .build();
        }
        return ToolResult.success(output, Map.of("todos", snapshot));
    }

    private static CheckResult checkUpdates(Object value) {
        if (!(value instanceof List<?> updates)) {
            return CheckResult.fail("Updates must be an array");
        }
        for (Object raw : updates) {
            if (!(raw instanceof Map<?, ?> update)) {
                return CheckResult.fail("Each update must be an object");
            }
            if (!(update.get("id") instanceof String id) || id.isBlank()) {
                return CheckResult.fail("Each update must have a string id");
            }
            Object status = update.get("status");
            if (status != null && !TodoItem.STATUSES.contains(status)) {
                return CheckResult.fail("Status must be pending, in_progress, or completed");
            }
            Object priority = update.get("priority");
            if (priority != null && !TodoItem.PRIORITIES.contains(priority)) {
                return CheckResult.fail("Priority must be high, medium, or low");
            }
            Object content = update.get("content");
            if (content != null && !(content instanceof String)) {
                return CheckResult.fail("Content must be a string");
            }
        }
        return CheckResult.pass();
    }
}
