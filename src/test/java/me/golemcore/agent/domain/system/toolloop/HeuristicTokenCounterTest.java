package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HeuristicTokenCounterTest {

    @Test
    void shouldRoundUpCharactersPerToken() {
        HeuristicTokenCounter counter = new HeuristicTokenCounter(4.0);

        assertEquals(0, counter.countTokens((String) null));
        assertEquals(1, counter.countTokens("abc"));
        assertEquals(2, counter.countTokens("abcdefgh!"));
    }

    @Test
    void shouldCountToolCallsOfMessages() {
        HeuristicTokenCounter counter = new HeuristicTokenCounter(4.0);
        Message message = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content("abcd")
                .toolCalls(List.of(Message.ToolCall.builder().name("list").arguments("{\"a\":1}").build()))
                .build();

        assertEquals(1 + 1 + 2, counter.countTokens(List.of(message)));
    }

    @Test
    void shouldFallBackToDefaultRatio() {
        assertEquals(1, new HeuristicTokenCounter(0).countTokens("abc"));
    }
}
