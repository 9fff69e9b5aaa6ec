package me.golemcore.agent.plugin;

import me.golemcore.agent.domain.exception.DuplicateToolException;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolBuilder;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.infrastructure.config.AutoConfiguration;
import me.golemcore.agent.infrastructure.process.ProcessRunner;
import me.golemcore.agent.plugin.api.AbstractToolPlugin;
import me.golemcore.agent.plugin.manifest.ToolManifest;
import me.golemcore.agent.plugin.manifest.ToolManifestEntry;
import me.golemcore.agent.plugin.manifest.ToolManifestLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PluginToolLoaderTest {

    @TempDir
    Path tempDir;

    private ToolRegistry toolRegistry;
    private AgentProperties properties;
    private ProcessRunner processRunner;
    private PluginToolLoader loader;

    @BeforeEach
    void setUp() {
        toolRegistry = mock(ToolRegistry.class);
        when(toolRegistry.getDefaultContext()).thenReturn(ToolContext.builder().workingDirectory(tempDir).build());
        properties = new AgentProperties();
        processRunner = new ProcessRunner();
        loader = new PluginToolLoader(toolRegistry, new ToolManifestLoader(AutoConfiguration.objectMapper()),
                new SubprocessToolFactory(processRunner, AutoConfiguration.objectMapper()), properties);
    }

    @AfterEach
    void tearDown() {
        loader.close();
        processRunner.shutdown();
    }

    private static ToolDefinition tool(String id, ToolCapability... capabilities) {
        return ToolBuilder.create().id(id).description("Test tool " + id).capabilities(capabilities)
                .execute((args, ctx) -> ToolResult.success(id)).build();
    }

    private static ToolManifestEntry module(String id, Class<?> type) {
        ToolManifestEntry entry = new ToolManifestEntry();
        entry.setId(id);
        entry.setModule(type.getName());
        return entry;
    }

    private static ToolManifestEntry command(String id, String description) {
        ToolManifestEntry entry = new ToolManifestEntry();
        entry.setId(id);
        entry.setCommand(List.of("sh", "-c", "echo hi"));
        entry.setDescription(description);
        return entry;
    }

    private static ToolManifest manifest(ToolManifestEntry... entries) {
        ToolManifest manifest = new ToolManifest();
        manifest.setTools(List.of(entries));
        return manifest;
    }

    public static class GitToolsPlugin extends AbstractToolPlugin {

        public GitToolsPlugin() {
            super("git_tools", "Git helpers");
        }

        @Override
        protected List<ToolDefinition> definitions() {
            return List.of(tool("git_status", ToolCapability.SYSTEM_EXECUTE), tool("git_log"));
        }
    }

    public static class FetchPlugin extends AbstractToolPlugin {

        public FetchPlugin() {
            super("fetch", "Network fetcher");
        }

        @Override
        protected List<ToolDefinition> definitions() {
            return List.of(tool("fetch_text"), tool("fetch_url", ToolCapability.NETWORK_ACCESS));
        }
    }

    public static class BrokenPlugin extends AbstractToolPlugin {

        public BrokenPlugin() {
            super("broken", "Fails while registering");
        }

        @Override
        protected List<ToolDefinition> definitions() {
            throw new IllegalStateException("boom");
        }
    }

    // ==================== Modules ====================

    @Test
    void shouldRegisterModuleTools() {
        List<String> loaded = loader.load(manifest(module("git_tools", GitToolsPlugin.class)));

        assertEquals(List.of("git_status", "git_log"), loaded);
        verify(toolRegistry, times(2)).register(any());
        assertEquals(loaded, loader.getLoadedToolIds());
    }

    @Test
    void shouldRejectWholeModuleDeclaringIsolatedCapability() {
        List<String> loaded = loader.load(manifest(module("fetch", FetchPlugin.class)));

        assertTrue(loaded.isEmpty());
        verify(toolRegistry, never()).register(any());
    }

    @Test
    void shouldAllowCapabilityWhenNotIsolated() {
        properties.getPlugins().getIsolateCapabilities().clear();

        List<String> loaded = loader.load(manifest(module("fetch", FetchPlugin.class)));

        assertEquals(List.of("fetch_text", "fetch_url"), loaded);
    }

    @Test
    void shouldSkipClassesThatCannotBeUsed() {
        ToolManifestEntry notPlugin = module("string", String.class);
        ToolManifestEntry missing = new ToolManifestEntry();
        missing.setId("missing");
        missing.setModule("com.example.DoesNotExist");

        List<String> loaded = loader.load(manifest(notPlugin, missing, module("broken", BrokenPlugin.class),
                module("git_tools", GitToolsPlugin.class)));

        assertEquals(List.of("git_status", "git_log"), loaded);
    }

    @Test
    void shouldSkipDuplicateToolAndKeepOthers() {
        doThrow(new DuplicateToolException("git_status")).when(toolRegistry)
                .register(argThat(definition -> "git_status".equals(definition.getId())));

        List<String> loaded = loader.load(manifest(module("git_tools", GitToolsPlugin.class)));

        assertEquals(List.of("git_log"), loaded);
    }

    // ==================== Commands ====================

    @Test
    void shouldRegisterCommandTools() {
        List<String> loaded = loader.load(manifest(command("say_hi", "Print a greeting")));

        assertEquals(List.of("say_hi"), loaded);
        ArgumentCaptor<ToolDefinition> captor = ArgumentCaptor.forClass(ToolDefinition.class);
        verify(toolRegistry).register(captor.capture());
        assertTrue(captor.getValue().getTags().contains("external"));
    }

    @Test
    void shouldSkipInvalidEntries() {
        ToolManifestEntry noId = command(null, "No id");
        ToolManifestEntry noDescription = command("quiet", " ");
        ToolManifestEntry neither = new ToolManifestEntry();
        neither.setId("empty");
        ToolManifestEntry badCapability = command("bad", "Bad capability");
        badCapability.setCapabilities(List.of("TELEPORT"));

        List<String> loaded = loader.load(manifest(noId, noDescription, neither, badCapability));

        assertTrue(loaded.isEmpty());
        verify(toolRegistry, never()).register(any());
    }

    // ==================== Startup ====================

    @Test
    void shouldLoadManifestFromWorkingDirectoryOnInit() throws Exception {
        Path manifest = tempDir.resolve(properties.getPlugins().getManifest());
        Files.createDirectories(manifest.getParent());
        Files.writeString(manifest, """
                {"tools": [{"id": "say_hi", "command": ["sh", "-c", "echo hi"], "description": "Greet"}]}
                """);

        loader.init();

        assertEquals(List.of("say_hi"), loader.getLoadedToolIds());
    }

    @Test
    void shouldDoNothingWhenDisabled() {
        properties.getPlugins().setEnabled(false);

        loader.init();

        assertTrue(loader.getLoadedToolIds().isEmpty());
    }
}
