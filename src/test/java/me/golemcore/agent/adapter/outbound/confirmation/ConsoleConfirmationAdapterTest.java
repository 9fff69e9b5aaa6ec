package me.golemcore.agent.adapter.outbound.confirmation;

import me.golemcore.agent.adapter.inbound.cli.ConsoleIO;
import me.golemcore.agent.domain.model.ConfirmationDecision;
import me.golemcore.agent.domain.model.ConfirmationGroup;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsoleConfirmationAdapterTest {

    private static final ConfirmationRequest REQUEST = new ConfirmationRequest("session-1", "bash", "bash",
            "Run command: ls", ConfirmationGroup.BASH_COMMANDS);

    private final StringWriter output = new StringWriter();

    private ConfirmationDecision answer(String input) {
        ConsoleConfirmationAdapter adapter = new ConsoleConfirmationAdapter(
                new ConsoleIO(new StringReader(input), output));
        return adapter.requestConfirmation(REQUEST).join();
    }

    @Test
    void shouldParseAnswers() {
        assertEquals(ConfirmationDecision.APPROVED, ConsoleConfirmationAdapter.parse("Y"));
        assertEquals(ConfirmationDecision.APPROVED, ConsoleConfirmationAdapter.parse(" yes "));
        assertEquals(ConfirmationDecision.DENIED, ConsoleConfirmationAdapter.parse("n"));
        assertEquals(ConfirmationDecision.DENIED, ConsoleConfirmationAdapter.parse(""));
        assertEquals(ConfirmationDecision.APPROVED_FOR_SESSION, ConsoleConfirmationAdapter.parse("always"));
        assertNull(ConsoleConfirmationAdapter.parse("maybe"));
    }

    @Test
    void shouldShowActionAndApprove() {
        assertEquals(ConfirmationDecision.APPROVED, answer("y\n"));
        assertTrue(output.toString().contains("[bash] Run command: ls"));
        assertTrue(output.toString().contains("Allow? [y]es / [n]o / [a]lways: "));
    }

    @Test
    void shouldAskAgainAfterInvalidAnswer() {
        assertEquals(ConfirmationDecision.APPROVED_FOR_SESSION, answer("what\na\n"));
        assertTrue(output.toString().contains("Please answer y, n or a."));
    }

    @Test
    void shouldDenyAfterRepeatedInvalidAnswers() {
        assertEquals(ConfirmationDecision.DENIED, answer("x\nx\nx\ny\n"));
    }

    @Test
    void shouldDenyAtEndOfInput() {
        assertEquals(ConfirmationDecision.DENIED, answer(""));
    }
}
