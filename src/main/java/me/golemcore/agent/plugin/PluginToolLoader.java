package me.golemcore.agent.plugin;

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

import me.golemcore.agent.domain.exception.ToolRegistryException;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.plugin.api.ToolPlugin;
import me.golemcore.agent.plugin.manifest.ToolManifest;
import me.golemcore.agent.plugin.manifest.ToolManifestEntry;
import me.golemcore.agent.plugin.manifest.ToolManifestLoader;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Loads external tools listed in the discovery manifest into the registry.
 *
 * <p>
 * Class modules are instantiated in process from the application classpath or
 * from the jars in {@code agent.plugins.directory}. A class module whose
 * definitions declare an isolated capability is rejected as a whole; such
 * tools have to be shipped as {@code command} entries and run in their own
 * process. Malformed entries, classes that fail to load and duplicate ids are
 * skipped with a warning and never abort startup.
 */
@Component
@Slf4j
public class PluginToolLoader {

    private final ToolRegistry toolRegistry;
    private final ToolManifestLoader manifestLoader;
    private final SubprocessToolFactory subprocessToolFactory;
    private final AgentProperties.PluginsProperties settings;

    private final List<String> loadedToolIds = new ArrayList<>();
    private URLClassLoader pluginClassLoader;

    public PluginToolLoader(ToolRegistry toolRegistry, ToolManifestLoader manifestLoader,
            SubprocessToolFactory subprocessToolFactory, AgentProperties properties) {
        this.toolRegistry = toolRegistry;
        this.manifestLoader = manifestLoader;
        this.subprocessToolFactory = subprocessToolFactory;
        this.settings = properties.getPlugins();
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.info("[Plugins] External tools disabled");
            return;
        }
        Path manifestPath = toolRegistry.getDefaultContext().resolvePath(settings.getManifest());
        manifestLoader.load(manifestPath).ifPresent(this::load);
    }

    @PreDestroy
    public void close() {
        if (pluginClassLoader != null) {
            try {
                pluginClassLoader.close();
            } catch (IOException e) {
                log.warn("[Plugins] Failed to close plugin class loader: {}", e.getMessage());
            }
        }
    }

    /**
     * Registers every acceptable entry of the manifest.
     *
     * @return ids of the tools that were registered
     */
    public synchronized List<String> load(ToolManifest manifest) {
        List<String> registered = new ArrayList<>();
        for (ToolManifestEntry entry : manifest.getTools()) {
            if (entry == null || entry.getId() == null || entry.getId().isBlank()) {
                log.warn("[Plugins] Skipping manifest entry without id");
                continue;
            }
            if (entry.isCommand()) {
                loadCommand(entry, registered);
            } else if (entry.isModule()) {
                loadModule(entry, registered);
            } else {
                log.warn("[Plugins] Skipping '{}': neither module nor command given", entry.getId());
            }
        }
        loadedToolIds.addAll(registered);
        log.info("[Plugins] Loaded {} external tools: {}", registered.size(), registered);
        return registered;
    }

    public synchronized List<String> getLoadedToolIds() {
        return List.copyOf(loadedToolIds);
    }

    private void loadCommand(ToolManifestEntry entry, List<String> registered) {
        if (entry.getDescription() == null || entry.getDescription().isBlank()) {
            log.warn("[Plugins] Skipping '{}': command tools need a description", entry.getId());
            return;
        }
        try {
            ToolDefinition definition = subprocessToolFactory.create(entry, settings.getProcessTimeoutMs());
            register(definition, registered);
        } catch (ToolRegistryException e) {
            log.warn("[Plugins] Skipping '{}': {}", entry.getId(), e.getMessage());
        }
    }

    private void loadModule(ToolManifestEntry entry, List<String> registered) {
        ToolPlugin plugin;
        try {
            Class<?> type = Class.forName(entry.getModule(), true, classLoader());
            if (!ToolPlugin.class.isAssignableFrom(type)) {
                log.warn("[Plugins] Skipping '{}': {} does not implement ToolPlugin", entry.getId(),
                        entry.getModule());
                return;
            }
            plugin = (ToolPlugin) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | LinkageError e) {
            log.warn("[Plugins] Skipping '{}': cannot load {}: {}", entry.getId(), entry.getModule(), e.toString());
            return;
        }
        if (!entry.getId().equals(plugin.id())) {
            log.warn("[Plugins] Manifest id '{}' differs from plugin id '{}'", entry.getId(), plugin.id());
        }

        List<ToolDefinition> contributed = new ArrayList<>();
        try {
            plugin.register(contributed::add);
        } catch (RuntimeException e) {
            log.warn("[Plugins] Skipping '{}': registration failed: {}", entry.getId(), e.getMessage());
            return;
        }

        Set<ToolCapability> isolated = isolatedCapabilities(contributed);
        if (!isolated.isEmpty()) {
            log.warn("[Plugins] Rejecting module '{}': capabilities {} must run as a command entry",
                    entry.getId(), isolated);
            return;
        }
        for (ToolDefinition definition : contributed) {
            register(definition, registered);
        }
    }

    private void register(ToolDefinition definition, List<String> registered) {
        try {
            toolRegistry.register(definition);
            registered.add(definition.getId());
        } catch (ToolRegistryException e) {
            log.warn("[Plugins] Skipping tool '{}': {}", definition != null ? definition.getId() : null,
                    e.getMessage());
        }
    }

    private Set<ToolCapability> isolatedCapabilities(List<ToolDefinition> definitions) {
        Set<ToolCapability> found = EnumSet.noneOf(ToolCapability.class);
        for (ToolDefinition definition : definitions) {
            if (definition == null || definition.getCapabilities() == null) {
                continue;
            }
            for (ToolCapability capability : definition.getCapabilities()) {
                if (settings.getIsolateCapabilities().contains(capability)) {
                    found.add(capability);
                }
            }
        }
        return found;
    }

    private ClassLoader classLoader() {
        if (pluginClassLoader != null) {
            return pluginClassLoader;
        }
        ClassLoader parent = getClass().getClassLoader();
        Path directory = toolRegistry.getDefaultContext().resolvePath(settings.getDirectory());
        if (!Files.isDirectory(directory)) {
            return parent;
        }
        List<URL> jars = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.jar")) {
            for (Path jar : stream) {
                jars.add(jar.toUri().toURL());
            }
        } catch (MalformedURLException e) {
            log.warn("[Plugins] Invalid plugin jar path: {}", e.getMessage());
        } catch (IOException e) {
            log.warn("[Plugins] Cannot list plugin directory {}: {}", directory, e.getMessage());
        }
        if (jars.isEmpty()) {
            return parent;
        }
        log.info("[Plugins] Plugin jars: {}", jars);
        pluginClassLoader = new URLClassLoader(jars.toArray(new URL[0]), parent);
        return pluginClassLoader;
    }
}
