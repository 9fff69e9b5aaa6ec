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

import me.golemcore.agent.domain.model.TodoItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Plain-text rendering of a todo list shared by the todo tools. Open high
 * priority items come first, then the other open items by priority, then up to
 * five completed items, then a totals line.
 */
final class TodoSummary {

    private static final int MAX_COMPLETED_SHOWN = 5;
    private static final Map<String, Integer> PRIORITY_ORDER = Map.of("high", 0, "medium", 1, "low", 2);

    private TodoSummary() {
    }

    static String render(List<TodoItem> todos) {
        if (todos.isEmpty()) {
            return "No todos";
        }

        List<TodoItem> pending = byStatus(todos, "pending");
        List<TodoItem> inProgress = byStatus(todos, "in_progress");
        List<TodoItem> completed = byStatus(todos, "completed");

        Comparator<TodoItem> inProgressFirst = Comparator.comparing(item -> !"in_progress".equals(item.getStatus()));
        List<TodoItem> open = new ArrayList<>(pending);
        open.addAll(inProgress);

        List<TodoItem> urgent = open.stream()
                .filter(item -> "high".equals(item.getPriority()))
                .sorted(inProgressFirst)
                .toList();
        List<TodoItem> other = open.stream()
                .filter(item -> !"high".equals(item.getPriority()))
                .sorted(Comparator.<TodoItem, Integer>comparing(item -> PRIORITY_ORDER.getOrDefault(item.getPriority(),
                        3)).thenComparing(inProgressFirst))
                .toList();

        List<String> lines = new ArrayList<>();
        if (!urgent.isEmpty()) {
            lines.add("High Priority:");
            urgent.forEach(item -> lines.add("  " + marker(item) + " [" + item.getId() + "] " + item.getContent()));
            lines.add("");
        }
        if (!other.isEmpty()) {
            lines.add("Other Tasks:");
            other.forEach(item -> lines.add("  " + marker(item) + " (" + item.getPriority() + ") [" + item.getId()
                    + "] " + item.getContent()));
            lines.add("");
        }
        if (!completed.isEmpty()) {
            lines.add("Completed (" + completed.size() + "):");
            completed.stream().limit(MAX_COMPLETED_SHOWN)
                    .forEach(item -> lines.add("  [x] [" + item.getId() + "] " + item.getContent()));
            if (completed.size() > MAX_COMPLETED_SHOWN) {
                lines.add("  ... and " + (completed.size() - MAX_COMPLETED_SHOWN) + " more");
            }
            lines.add("");
        }
        lines.add("Total: " + todos.size() + " | Pending: " + pending.size() + " | In Progress: " + inProgress.size()
                + " | Completed: " + completed.size());
        return String.join("\n", lines);
    }

    private static List<TodoItem> byStatus(List<TodoItem> todos, String status) {
        return todos.stream().filter(item -> status.equals(item.getStatus())).toList();
    }

    private static String marker(TodoItem item) {
        return "in_progress".equals(item.getStatus()) ? "[~]" : "[ ]";
    }
}
