package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.ConversationSession;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultHistoryWriterTest {

    private static final Instant FIXED_INSTANT = Instant.parse("2026-02-14T00:00:00Z");

    private DefaultHistoryWriter writer;
    private ConversationSession session;

    @BeforeEach
    void setUp() {
        writer = new DefaultHistoryWriter(Clock.fixed(FIXED_INSTANT, ZoneId.of("UTC")));
        session = new ConversationSession(ToolContext.builder().build(), "model-a");
    }

    @Test
    void shouldAppendMessagesInCallOrder() {
        Message.ToolCall call = Message.ToolCall.builder().id("tc-1").name("pwd").arguments("{}").build();

        writer.appendUserMessage(session, "where am I?");
        writer.appendAssistantToolCalls(session, null, List.of(call));
        writer.appendToolResult(session,
                new ToolExecutionOutcome("tc-1", "pwd", ToolResult.success("/work"), "/work", false));
        writer.appendFinalAssistantAnswer(session, "You are in /work");

        List<Message> history = session.snapshot();
        assertEquals(4, history.size());
        assertTrue(history.get(0).isUserMessage());
        assertTrue(history.get(1).hasToolCalls());
        assertNull(history.get(1).getContent());
        assertEquals("tc-1", history.get(2).getToolCallId());
        assertEquals("pwd", history.get(2).getToolName());
        assertEquals("/work", history.get(2).getContent());
        assertEquals("You are in /work", history.get(3).getContent());
        assertEquals(FIXED_INSTANT, history.get(3).getTimestamp());
    }

    @Test
    void shouldWriteSyntheticOutcomeAsError() {
        Message.ToolCall call = Message.ToolCall.builder().id("tc-2").name("bash").arguments("{}").build();

        writer.appendToolResult(session,
                ToolExecutionOutcome.synthetic(call, ToolFailureKind.EXECUTION_FAILED, "Cancelled before execution"));

        Message message = session.snapshot().get(0);
        assertTrue(message.isToolMessage());
        assertEquals("Error: Cancelled before execution", message.getContent());
    }
}
