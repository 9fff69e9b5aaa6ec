package me.golemcore.agent.adapter.outbound.confirmation;

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

import me.golemcore.agent.adapter.inbound.cli.ConsoleIO;
import me.golemcore.agent.domain.model.ConfirmationDecision;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.port.outbound.ConfirmationPort;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Terminal implementation of ConfirmationPort.
 *
 * <p>
 * Prints the action and asks {@code [y]es / [n]o / [a]lways}. "Always"
 * approves the action's group (file operations or bash commands) for the rest
 * of the session; the registry records it in the session flags. End of input
 * counts as a denial. Prompts are serialized, so concurrent tool calls ask one
 * at a time.
 */
@Slf4j
public class ConsoleConfirmationAdapter implements ConfirmationPort {

    private static final String PROMPT = "Allow? [y]es / [n]o / [a]lways: ";
    private static final int MAX_ATTEMPTS = 3;

    private final ConsoleIO console;

    public ConsoleConfirmationAdapter(ConsoleIO console) {
        this.console = console;
    }

    @Override
    public CompletableFuture<ConfirmationDecision> requestConfirmation(ConfirmationRequest request) {
        synchronized (console) {
            console.println();
            console.println("[" + request.toolId() + "] " + request.description());
            try {
                for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
                    String answer = console.readLine(PROMPT);
                    if (answer == null) {
                        return CompletableFuture.completedFuture(ConfirmationDecision.DENIED);
                    }
                    ConfirmationDecision decision = parse(answer);
                    if (decision != null) {
                        log.info("[Confirmation] {} -> {}", request.toolId(), decision);
                        return CompletableFuture.completedFuture(decision);
                    }
                    console.println("Please answer y, n or a.");
                }
            } catch (UncheckedIOException e) {
                return CompletableFuture.failedFuture(e);
            }
            return CompletableFuture.completedFuture(ConfirmationDecision.DENIED);
        }
    }

    static ConfirmationDecision parse(String answer) {
        return switch (answer.strip().toLowerCase(Locale.ROOT)) {
        case "y", "yes" -> ConfirmationDecision.APPROVED;
        case "n", "no", "" -> ConfirmationDecision.DENIED;
        case "a", "always" -> ConfirmationDecision.APPROVED_FOR_SESSION;
        default -> null;
        };
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
