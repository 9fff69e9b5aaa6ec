package me.golemcore.agent.domain.model;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Session todo list shared by the todo tools.
 */
public class TodoList {

    private final List<TodoItem> items = new ArrayList<>();

    public synchronized void replace(List<TodoItem> newItems) {
        items.clear();
        items.addAll(newItems);
    }

    public synchronized Optional<TodoItem> find(String id) {
        return items.stream().filter(item -> item.getId().equals(id)).findFirst();
    }

    /**
     * Applies {@code change} to the item with the given id.
     *
     * @return false when no such item exists
     */
    public synchronized boolean update(String id, Consumer<TodoItem> change) {
        for (TodoItem item : items) {
            if (item.getId().equals(id)) {
                change.accept(item);
                return true;
            }
        }
        return false;
    }

    public synchronized List<TodoItem> snapshot() {
        List<TodoItem> copy = new ArrayList<>(items.size());
        for (TodoItem item : items) {
            copy.add(item.toBuilder().build());
        }
        return copy;
    }

    public synchronized boolean isEmpty() {
        return items.isEmpty();
    }
}
