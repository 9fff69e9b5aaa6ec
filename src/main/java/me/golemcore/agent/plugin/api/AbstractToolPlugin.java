package me.golemcore.agent.plugin.api;

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

import me.golemcore.agent.domain.model.ToolDefinition;

import java.util.List;

public abstract class AbstractToolPlugin implements ToolPlugin {

    private final String id;
    private final String description;

    protected AbstractToolPlugin(String id, String description) {
        this.id = id;
        this.description = description;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public void register(ToolRegistrar registrar) {
        for (ToolDefinition definition : definitions()) {
            registrar.register(definition);
        }
    }

    protected abstract List<ToolDefinition> definitions();
}
