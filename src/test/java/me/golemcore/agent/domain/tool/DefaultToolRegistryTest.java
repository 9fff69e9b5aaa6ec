package me.golemcore.agent.domain.tool;

import me.golemcore.agent.domain.exception.DuplicateToolException;
import me.golemcore.agent.domain.exception.ToolNotFoundException;
import me.golemcore.agent.domain.model.ArgumentSpec;
import me.golemcore.agent.domain.model.ArgumentType;
import me.golemcore.agent.domain.model.ConfirmationDecision;
import me.golemcore.agent.domain.model.ConfirmationGroup;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolFilter;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.ValidationResult;
import me.golemcore.agent.domain.service.ToolConfirmationPolicy;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConfirmationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ConfirmationPort confirmationPort;
    private ToolContext context;
    private DefaultToolRegistry registry;

    @BeforeEach
    void setUp() {
        confirmationPort = mock(ConfirmationPort.class);
        when(confirmationPort.isAvailable()).thenReturn(true);
        context = ToolContext.builder().confirmationGate(confirmationPort).build();
        registry = new DefaultToolRegistry(new ToolConfirmationPolicy(new AgentProperties()), context,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ToolDefinition echoTool(String id) {
        return ToolBuilder.create()
                .id(id)
                .description("Echo the message")
                .category(ToolCategory.UTILITY)
                .tags("echo")
                .stringArg("message", "Message to echo", arg -> arg.required(true))
                .execute((args, ctx) -> ToolResult.success(args.getString("message")))
                .build();
    }

    // ==================== registration ====================

    @Test
    void shouldRejectDuplicateRegistrationAndKeepOriginal() {
        registry.register(echoTool("echo"));
        ToolDefinition replacement = ToolBuilder.create()
                .id("echo")
                .description("Other")
                .execute((args, ctx) -> ToolResult.success("other"))
                .build();

        assertThrows(DuplicateToolException.class, () -> registry.register(replacement));

        ToolResult result = registry.execute("echo", Map.of("message", "hi"));
        assertEquals("hi", result.getOutput());
        assertEquals(1, registry.list().size());
    }

    @Test
    void shouldThrowWhenUnregisteringUnknownTool() {
        assertThrows(ToolNotFoundException.class, () -> registry.unregister("missing"));
    }

    @Test
    void shouldRunCleanupOnlyWhenInitialized() {
        AtomicInteger cleanups = new AtomicInteger();
        registry.register(ToolBuilder.create()
                .id("stateful")
                .description("Has lifecycle hooks")
                .onInitialize(ctx -> {
                })
                .onCleanup(ctx -> cleanups.incrementAndGet())
                .execute((args, ctx) -> ToolResult.success("ok"))
                .build());

        registry.execute("stateful", Map.of());
        registry.unregister("stateful");

        assertEquals(1, cleanups.get());
        assertFalse(registry.contains("stateful"));
    }

    @Test
    void shouldRemoveToolEvenWhenCleanupFails() {
        registry.register(ToolBuilder.create()
                .id("fragile")
                .description("Cleanup throws")
                .onInitialize(ctx -> {
                })
                .onCleanup(ctx -> {
                    throw new IllegalStateException("cleanup broke");
                })
                .execute((args, ctx) -> ToolResult.success("ok"))
                .build());
        registry.execute("fragile", Map.of());

        registry.unregister("fragile");

        assertFalse(registry.contains("fragile"));
    }

    // ==================== lookup ====================

    @Test
    void shouldSearchCaseInsensitivelyAcrossIdDescriptionAndTags() {
        registry.register(echoTool("echo"));
        registry.register(ToolBuilder.create()
                .id("clock")
                .description("Current TIME")
                .execute((args, ctx) -> ToolResult.success("noon"))
                .build());

        assertEquals(List.of("clock"), registry.search("time").stream().map(ToolDefinition::getId).toList());
        assertEquals(List.of("echo"), registry.search("ECHO").stream().map(ToolDefinition::getId).toList());
        assertEquals(2, registry.search("").size());
    }

    @Test
    void shouldFilterByCategoryInRegistrationOrder() {
        registry.register(echoTool("b_echo"));
        registry.register(echoTool("a_echo"));
        registry.register(ToolBuilder.create()
                .id("other")
                .description("Custom tool")
                .execute((args, ctx) -> ToolResult.success(""))
                .build());

        List<ToolDefinition> utilities = registry.list(ToolFilter.builder().category(ToolCategory.UTILITY).build());

        assertEquals(List.of("b_echo", "a_echo"), utilities.stream().map(ToolDefinition::getId).toList());
    }

    // ==================== validation ====================

    @Test
    void shouldReportEveryViolationWithoutThrowing() {
        registry.register(ToolBuilder.create()
                .id("typed")
                .description("Typed arguments")
                .stringArg("name", "Name", arg -> arg.required(true))
                .numberArg("count", "Count", arg -> arg)
                .execute((args, ctx) -> ToolResult.success("ok"))
                .build());

        Map<String, Object> arguments = new HashMap<>();
        arguments.put("count", "many");
        arguments.put("extra", true);
        ValidationResult result = registry.validateArguments("typed", arguments);

        assertFalse(result.valid());
        assertEquals(3, result.errors().size());
    }

    @Test
    void shouldReturnInvalidResultForUnknownTool() {
        ValidationResult result = registry.validateArguments("missing", Map.of());

        assertFalse(result.valid());
        assertTrue(result.messages().get(0).contains("not found"));
    }

    @Test
    void shouldConvertThrowingValidatorIntoValidationError() {
        registry.register(ToolBuilder.create()
                .id("checked")
                .description("Custom check throws")
                .argument(ArgumentSpec.builder()
                        .name("value")
                        .type(ArgumentType.STRING)
                        .validator(value -> {
                            throw new IllegalStateException("bad validator");
                        })
                        .build())
                .execute((args, ctx) -> ToolResult.success("ok"))
                .build());

        ValidationResult result = registry.validateArguments("checked", Map.of("value", "x"));

        assertFalse(result.valid());
        assertTrue(result.messages().get(0).contains("bad validator"));
    }

    // ==================== execution ====================

    @Test
    void shouldReturnNotFoundForUnknownTool() {
        ToolResult result = registry.execute("missing", Map.of());

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.NOT_FOUND, result.getFailureKind());
    }

    @Test
    void shouldNotInvokeExecutorWhenValidationFails() {
        AtomicInteger calls = new AtomicInteger();
        registry.register(ToolBuilder.create()
                .id("strict")
                .description("Needs a path")
                .stringArg("path", "Path", arg -> arg.required(true))
                .execute((args, ctx) -> {
                    calls.incrementAndGet();
                    return ToolResult.success("ok");
                })
                .build());

        ToolResult result = registry.execute("strict", Map.of());

        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
        assertTrue(result.getError().startsWith("Validation failed: "));
        assertEquals(0, calls.get());
        assertTrue(registry.getExecutionStats("strict").isEmpty());
    }

    @Test
    void shouldConvertThrowingExecutorIntoExecutionFailure() {
        registry.register(ToolBuilder.create()
                .id("boom")
                .description("Always throws")
                .execute((args, ctx) -> {
                    throw new IllegalStateException("kaboom");
                })
                .build());

        ToolResult result = registry.execute("boom", Map.of());

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Tool execution failed: kaboom", result.getError());
    }

    @Test
    void shouldTagToolReportedFailures() {
        registry.register(ToolBuilder.create()
                .id("reporter")
                .description("Reports failure")
                .execute((args, ctx) -> ToolResult.builder().success(false).error("nope").build())
                .build());

        ToolResult result = registry.execute("reporter", Map.of());

        assertEquals(ToolFailureKind.TOOL_REPORTED, result.getFailureKind());
        assertEquals("nope", result.getError());
    }

    @Test
    void shouldInitializeOnceAcrossCalls() {
        AtomicInteger initializations = new AtomicInteger();
        registry.register(ToolBuilder.create()
                .id("lazy")
                .description("Lazy init")
                .onInitialize(ctx -> initializations.incrementAndGet())
                .execute((args, ctx) -> ToolResult.success("ok"))
                .build());

        registry.execute("lazy", Map.of());
        registry.execute("lazy", Map.of());

        assertEquals(1, initializations.get());
    }

    @Test
    void shouldReportInitializationFailureAndRetryInitOnNextCall() {
        AtomicInteger attempts = new AtomicInteger();
        registry.register(ToolBuilder.create()
                .id("flaky_init")
                .description("Init fails first")
                .onInitialize(ctx -> {
                    if (attempts.incrementAndGet() == 1) {
                        throw new IllegalStateException("not ready");
                    }
                })
                .execute((args, ctx) -> ToolResult.success("ok"))
                .build());

        ToolResult first = registry.execute("flaky_init", Map.of());
        ToolResult second = registry.execute("flaky_init", Map.of());

        assertEquals(ToolFailureKind.INITIALIZATION_FAILED, first.getFailureKind());
        assertEquals("Failed to initialize tool: not ready", first.getError());
        assertTrue(second.isSuccess());
    }

    @Test
    void shouldApplyDefaultsBeforeExecution() {
        registry.register(ToolBuilder.create()
                .id("greeter")
                .description("Greets")
                .stringArg("name", "Name", arg -> arg.defaultValue("world"))
                .execute((args, ctx) -> ToolResult.success("hello " + args.getString("name")))
                .build());

        assertEquals("hello world", registry.execute("greeter", Map.of()).getOutput());
    }

    @Test
    void shouldCountOnlyValidatedAttemptsInMetrics() {
        registry.register(echoTool("echo"));

        registry.execute("echo", Map.of("message", "a"));
        registry.execute("echo", Map.of("message", "b"));
        registry.execute("echo", Map.of());

        var stats = registry.getExecutionStats("echo").orElseThrow();
        assertEquals(2, stats.executionCount());
        assertEquals(NOW, stats.lastExecutedAt());
        assertEquals(1, registry.getStats().totalTools());
        assertEquals(1L, registry.getStats().byCategory().get(ToolCategory.UTILITY));
    }

    // ==================== confirmation ====================

    private ToolDefinition writeTool(AtomicInteger calls) {
        return ToolBuilder.create()
                .id("write_to_file")
                .description("Writes")
                .capabilities(ToolCapability.FILE_WRITE)
                .stringArg("path", "Path", arg -> arg.required(true))
                .execute((args, ctx) -> {
                    calls.incrementAndGet();
                    return ToolResult.success("written");
                })
                .build();
    }

    @Test
    void shouldDenyWhenUserRejects() {
        AtomicInteger calls = new AtomicInteger();
        registry.register(writeTool(calls));
        when(confirmationPort.requestConfirmation(any()))
                .thenReturn(CompletableFuture.completedFuture(ConfirmationDecision.DENIED));

        ToolResult result = registry.execute("write_to_file", Map.of("path", "a.txt"));

        assertEquals(ToolFailureKind.CONFIRMATION_DENIED, result.getFailureKind());
        assertEquals("Cancelled by user", result.getError());
        assertEquals(0, calls.get());
    }

    @Test
    void shouldRememberSessionApprovalForGroup() {
        AtomicInteger calls = new AtomicInteger();
        registry.register(writeTool(calls));
        when(confirmationPort.requestConfirmation(any()))
                .thenReturn(CompletableFuture.completedFuture(ConfirmationDecision.APPROVED_FOR_SESSION));

        registry.execute("write_to_file", Map.of("path", "a.txt"));
        registry.execute("write_to_file", Map.of("path", "b.txt"));

        assertEquals(2, calls.get());
        verify(confirmationPort, times(1)).requestConfirmation(any());
        assertTrue(context.getConfirmationFlags().isApproved(ConfirmationGroup.FILE_OPERATIONS));
    }

    @Test
    void shouldSkipPromptWhenBypassIsOn() {
        AtomicInteger calls = new AtomicInteger();
        registry.register(writeTool(calls));
        context.getConfirmationFlags().setBypassAll(true);

        ToolResult result = registry.execute("write_to_file", Map.of("path", "a.txt"));

        assertTrue(result.isSuccess());
        verify(confirmationPort, never()).requestConfirmation(any());
    }

    @Test
    void shouldDenyWhenNoConfirmationChannelIsAvailable() {
        AtomicInteger calls = new AtomicInteger();
        registry.register(writeTool(calls));
        when(confirmationPort.isAvailable()).thenReturn(false);

        ToolResult result = registry.execute("write_to_file", Map.of("path", "a.txt"));

        assertEquals(ToolFailureKind.CONFIRMATION_DENIED, result.getFailureKind());
        assertEquals(0, calls.get());
    }

    // ==================== composition ====================

    @Test
    void shouldComposeWithoutRegisteringComposite() {
        registry.register(echoTool("echo"));

        ToolDefinition composite = registry.compose(CompositionPattern.PIPELINE, List.of("echo"), null);

        assertNotNull(composite);
        assertEquals("pipeline_echo", composite.getId());
        assertEquals(ToolCategory.COMPOSITION, composite.getCategory());
        assertFalse(registry.contains("pipeline_echo"));
    }

    @Test
    void shouldRejectCompositionOfUnknownTool() {
        registry.register(echoTool("echo"));

        assertThrows(ToolNotFoundException.class,
                () -> registry.compose(CompositionPattern.PARALLEL, List.of("echo", "missing"), null));
    }

    @Test
    void shouldChangeDefaultWorkingDirectory() {
        registry.setWorkingDirectory(Path.of("/tmp"));

        assertEquals(Path.of("/tmp"), registry.getDefaultContext().getWorkingDirectory());
    }
}
