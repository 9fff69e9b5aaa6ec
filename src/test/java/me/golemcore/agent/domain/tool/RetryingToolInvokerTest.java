package me.golemcore.agent.domain.tool;

import me.golemcore.agent.domain.model.ConfirmationDecision;
import me.golemcore.agent.domain.model.ConfirmationGroup;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.ToolConfirmationPolicy;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConfirmationPort;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetryingToolInvokerTest {

    private static final RetryPolicy POLICY = new RetryPolicy(3, Duration.ofMillis(100), 2.0,
            Duration.ofMillis(150), Set.of(ToolFailureKind.EXECUTION_FAILED));

    private final ToolContext context = ToolContext.builder().build();

    private static final class RecordingInvoker extends RetryingToolInvoker {

        private final List<Long> sleeps = new ArrayList<>();

        RecordingInvoker(ToolInvoker delegate, RetryPolicy policy) {
            super(delegate, policy);
        }

        @Override
        protected void sleepBeforeRetry(long backoffMs) {
            sleeps.add(backoffMs);
        }
    }

    @Test
    void shouldRetryTransientFailureUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        ToolInvoker delegate = (id, args, ctx) -> calls.incrementAndGet() < 3
                ? ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "flaky")
                : ToolResult.success("ok");
        RecordingInvoker invoker = new RecordingInvoker(delegate, POLICY);

        ToolResult result = invoker.execute("tool", Map.of(), context);

        assertTrue(result.isSuccess());
        assertEquals(3, calls.get());
        assertEquals(List.of(100L, 150L), invoker.sleeps);
    }

    @Test
    void shouldReturnLastFailureWhenAttemptsRunOut() {
        AtomicInteger calls = new AtomicInteger();
        ToolInvoker delegate = (id, args, ctx) -> ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                "attempt " + calls.incrementAndGet());
        RecordingInvoker invoker = new RecordingInvoker(delegate, POLICY);

        ToolResult result = invoker.execute("tool", Map.of(), context);

        assertFalse(result.isSuccess());
        assertEquals("attempt 3", result.getError());
    }

    @Test
    void shouldNotRetryTerminalFailure() {
        AtomicInteger calls = new AtomicInteger();
        ToolInvoker delegate = (id, args, ctx) -> {
            calls.incrementAndGet();
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "bad args");
        };
        RecordingInvoker invoker = new RecordingInvoker(delegate, POLICY);

        invoker.execute("tool", Map.of(), context);

        assertEquals(1, calls.get());
        assertTrue(invoker.sleeps.isEmpty());
    }

    @Test
    void shouldCalculateCappedBackoff() {
        assertEquals(100, POLICY.backoffMillis(1));
        assertEquals(150, POLICY.backoffMillis(2));
        assertEquals(150, POLICY.backoffMillis(5));
    }

    @Test
    void shouldNormalizeDegeneratePolicy() {
        RetryPolicy policy = new RetryPolicy(0, null, 0.5, null, null);

        assertEquals(1, policy.maxAttempts());
        assertEquals(0, policy.backoffMillis(3));
        assertFalse(policy.isRetryable(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "x")));
        assertFalse(RetryPolicy.none().isRetryable(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "x")));
    }

    // ==================== side effects and confirmation ====================

    private static ConfirmationPort approvingGate() {
        ConfirmationPort gate = mock(ConfirmationPort.class);
        when(gate.isAvailable()).thenReturn(true);
        when(gate.requestConfirmation(any()))
                .thenReturn(CompletableFuture.completedFuture(ConfirmationDecision.APPROVED));
        return gate;
    }

    private static DefaultToolRegistry registryWith(ToolContext sessionContext) {
        return new DefaultToolRegistry(new ToolConfirmationPolicy(new AgentProperties()), sessionContext,
                Clock.systemUTC());
    }

    @Test
    void shouldNotRerunSideEffectingToolAfterExecutionFailure() {
        ConfirmationPort gate = approvingGate();
        ToolContext sessionContext = ToolContext.builder().confirmationGate(gate).build();
        DefaultToolRegistry registry = registryWith(sessionContext);
        AtomicInteger bodies = new AtomicInteger();
        registry.register(ToolBuilder.create()
                .id("deploy")
                .description("Run the deploy script")
                .capabilities(ToolCapability.SYSTEM_EXECUTE, ToolCapability.USER_CONFIRMATION)
                .execute((args, ctx) -> {
                    bodies.incrementAndGet();
                    throw new IOException("broken pipe");
                })
                .build());
        RecordingInvoker invoker = new RecordingInvoker(registry, POLICY);

        ToolResult result = invoker.execute("deploy", Map.of(), sessionContext);

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals(1, bodies.get());
        verify(gate, times(1)).requestConfirmation(any());
        assertTrue(invoker.sleeps.isEmpty());
    }

    @Test
    void shouldAskOnceForRetriesOfRetrySafeTool() {
        ConfirmationPort gate = approvingGate();
        ToolContext sessionContext = ToolContext.builder().confirmationGate(gate).build();
        DefaultToolRegistry registry = registryWith(sessionContext);
        AtomicInteger bodies = new AtomicInteger();
        registry.register(ToolBuilder.create()
                .id("status")
                .description("Query service status")
                .capabilities(ToolCapability.SYSTEM_EXECUTE, ToolCapability.USER_CONFIRMATION)
                .retrySafe(true)
                .execute((args, ctx) -> {
                    if (bodies.incrementAndGet() < 3) {
                        throw new IOException("timeout");
                    }
                    return ToolResult.success("up");
                })
                .build());
        RecordingInvoker invoker = new RecordingInvoker(registry, POLICY);

        ToolResult result = invoker.execute("status", Map.of(), sessionContext);

        assertTrue(result.isSuccess());
        assertEquals(3, bodies.get());
        verify(gate, times(1)).requestConfirmation(any());
    }

    @Test
    void shouldAskAgainForNextCallOfSameTool() {
        ConfirmationPort gate = approvingGate();
        ToolContext sessionContext = ToolContext.builder().confirmationGate(gate).build();
        DefaultToolRegistry registry = registryWith(sessionContext);
        registry.register(ToolBuilder.create()
                .id("touch")
                .description("Create a marker file")
                .capabilities(ToolCapability.FILE_WRITE)
                .execute((args, ctx) -> ToolResult.success("done"))
                .build());
        RecordingInvoker invoker = new RecordingInvoker(registry, POLICY);

        invoker.execute("touch", Map.of(), sessionContext);
        invoker.execute("touch", Map.of(), sessionContext);

        verify(gate, times(2)).requestConfirmation(any());
        assertFalse(sessionContext.isApprovedForCall(ConfirmationGroup.FILE_OPERATIONS));
    }

    @Test
    void shouldRetrySideEffectingToolWhenInitializationFailed() {
        AtomicInteger inits = new AtomicInteger();
        ToolContext sessionContext = ToolContext.builder().build();
        sessionContext.getConfirmationFlags().setBypassAll(true);
        DefaultToolRegistry registry = registryWith(sessionContext);
        registry.register(ToolBuilder.create()
                .id("writer")
                .description("Write a report")
                .capabilities(ToolCapability.FILE_WRITE)
                .onInitialize(ctx -> {
                    if (inits.incrementAndGet() < 2) {
                        throw new IOException("disk not ready");
                    }
                })
                .execute((args, ctx) -> ToolResult.success("written"))
                .build());
        RecordingInvoker invoker = new RecordingInvoker(registry, new RetryPolicy(3, Duration.ZERO, 1.0,
                Duration.ZERO, Set.of(ToolFailureKind.INITIALIZATION_FAILED, ToolFailureKind.EXECUTION_FAILED)));

        ToolResult result = invoker.execute("writer", Map.of(), sessionContext);

        assertTrue(result.isSuccess());
        assertEquals(2, inits.get());
    }
}
