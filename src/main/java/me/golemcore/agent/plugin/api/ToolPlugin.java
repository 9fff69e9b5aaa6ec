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

/**
 * Explicit descriptor of a tool plugin loaded from the discovery manifest.
 *
 * <p>
 * Implementations need a public no-argument constructor. {@link #register}
 * is called once at startup; every definition handed to the registrar is
 * checked against the isolation policy before it reaches the registry.
 */
public interface ToolPlugin {

    String id();

    String description();

    void register(ToolRegistrar registrar);
}
