package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmChunkTest {

    @Test
    void shouldReplayToolCallsAsIndexedDeltas() {
        LlmResponse response = LlmResponse.builder()
                .content("Looking")
                .toolCalls(List.of(
                        Message.ToolCall.builder().id("c1").name("pwd").arguments("{}").build(),
                        Message.ToolCall.builder().id("c2").name("list").arguments("{\"path\":\".\"}").build()))
                .usage(LlmUsage.of(10, 5))
                .build();

        LlmChunk chunk = LlmChunk.completeOf(response);

        assertTrue(chunk.isFinished());
        assertEquals("Looking", chunk.getText());
        assertEquals(LlmChunk.FINISH_TOOL_CALLS, chunk.getFinishReason());
        assertEquals(2, chunk.getToolCallDeltas().size());
        ToolCallDelta second = chunk.getToolCallDeltas().get(1);
        assertEquals(1, second.getIndex());
        assertEquals("c2", second.getId());
        assertEquals("{\"path\":\".\"}", second.getArgumentsFragment());
        assertEquals(15, chunk.getUsage().getTotalTokens());
    }

    @Test
    void shouldKeepProviderFinishReason() {
        LlmChunk chunk = LlmChunk.completeOf(LlmResponse.builder().content("cut").finishReason("length").build());

        assertEquals("length", chunk.getFinishReason());
        assertFalse(chunk.hasToolCallDeltas());
    }

    @Test
    void shouldDefaultToStopWithoutToolCalls() {
        LlmChunk chunk = LlmChunk.completeOf(LlmResponse.builder().content("done").build());

        assertEquals(LlmChunk.FINISH_STOP, chunk.getFinishReason());
    }
}
