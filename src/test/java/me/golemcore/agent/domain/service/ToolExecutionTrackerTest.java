package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.model.ExecutionStatus;
import me.golemcore.agent.domain.model.ToolExecution;
import me.golemcore.agent.domain.model.ToolExecutionEvent;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.event.SpringEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ToolExecutionTrackerTest {

    private SpringEventBus eventBus;
    private ToolExecutionTracker tracker;

    @BeforeEach
    void setUp() {
        eventBus = mock(SpringEventBus.class);
        tracker = new ToolExecutionTracker(eventBus,
                Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC")));
    }

    @Test
    void shouldResolveEachCallToItsOwnExecution() {
        String first = tracker.start("call_1", "list", Map.of("path", "."));
        String second = tracker.start("call_2", "pwd", Map.of());

        tracker.complete("call_2", ToolResult.success("/"));
        tracker.complete("call_1", ToolResult.failure("boom"));

        assertNotEquals(first, second);
        assertEquals(first, tracker.getExecutionId("call_1").orElseThrow());
        assertEquals(ExecutionStatus.FAILED, tracker.get("call_1").orElseThrow().getStatus());
        assertEquals(ExecutionStatus.COMPLETED, tracker.get("call_2").orElseThrow().getStatus());
    }

    @Test
    void shouldCompleteOnlyOnce() {
        tracker.start("call_1", "list", Map.of());

        assertTrue(tracker.complete("call_1", ToolResult.success("ok")));
        assertFalse(tracker.complete("call_1", ToolResult.failure("late")));
        assertEquals(ExecutionStatus.COMPLETED, tracker.get("call_1").orElseThrow().getStatus());
    }

    @Test
    void shouldIgnoreUnknownCall() {
        assertFalse(tracker.complete("nope", ToolResult.success("ok")));
        assertTrue(tracker.get(null).isEmpty());
    }

    @Test
    void shouldPublishStartAndCompletion() {
        tracker.start("call_1", "list", Map.of());
        tracker.complete("call_1", ToolResult.success("ok"));

        ArgumentCaptor<ToolExecutionEvent> captor = ArgumentCaptor.forClass(ToolExecutionEvent.class);
        verify(eventBus, times(2)).publish(captor.capture());
        List<ToolExecutionEvent> published = captor.getAllValues();
        assertEquals(ExecutionStatus.EXECUTING, published.get(0).status());
        assertEquals(ExecutionStatus.COMPLETED, published.get(1).status());
    }

    @Test
    void shouldClearHistory() {
        tracker.start("call_1", "list", Map.of("path", "src"));
        List<ToolExecution> history = tracker.getHistory();
        assertEquals(1, history.size());
        assertEquals("src", history.get(0).getArguments().get("path"));

        tracker.clear();

        assertTrue(tracker.getHistory().isEmpty());
        assertTrue(tracker.get("call_1").isEmpty());
    }
}
