package me.golemcore.agent.adapter.inbound.cli;

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

import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ConversationSession;
import me.golemcore.agent.domain.model.TurnEvent;
import me.golemcore.agent.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.agent.domain.system.toolloop.ToolLoopTurnResult;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.inbound.CommandPort;
import me.golemcore.agent.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Interactive console: reads lines, routes slash commands to the
 * {@link CommandPort} and everything else through the tool loop as one turn.
 *
 * <p>
 * When {@code agent.cli.prompt} is set the runner processes that single prompt
 * and returns (headless mode). Disabled with {@code agent.cli.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "agent.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ConsoleChatRunner implements CommandLineRunner {

    private static final String PROMPT = "> ";

    private final ToolLoopSystem toolLoopSystem;
    private final ToolRegistry toolRegistry;
    private final CommandPort commandPort;
    private final LlmPort llmPort;
    private final ConsoleIO console;
    private final AgentProperties properties;

    public ConsoleChatRunner(ToolLoopSystem toolLoopSystem, ToolRegistry toolRegistry, CommandPort commandPort,
            LlmPort llmPort, ConsoleIO console, AgentProperties properties) {
        this.toolLoopSystem = toolLoopSystem;
        this.toolRegistry = toolRegistry;
        this.commandPort = commandPort;
        this.llmPort = llmPort;
        this.console = console;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        ConversationSession session = new ConversationSession(toolRegistry.getDefaultContext(),
                properties.getLlm().getModel());
        String prompt = properties.getCli().getPrompt();
        if (prompt != null && !prompt.isBlank()) {
            log.info("Headless mode: processing a single prompt");
            runTurn(session, prompt);
            return;
        }

        printBanner(session);
        while (true) {
            String line = console.readLine(PROMPT);
            if (line == null) {
                console.println();
                break;
            }
            String input = line.trim();
            if (input.isEmpty()) {
                continue;
            }
            if (input.startsWith("/")) {
                if (handleCommand(session, input.substring(1))) {
                    break;
                }
                continue;
            }
            runTurn(session, input);
        }
        log.info("Console session {} ended", session.getId());
    }

    private void printBanner(ConversationSession session) {
        console.println("GolemCore Agent - " + llmPort.getProviderId() + " / " + session.getModel());
        if (!llmPort.isAvailable()) {
            console.println("No LLM provider is configured. Set agent.llm.base-url and AGENT_LLM_API_KEY.");
        }
        console.println("Working directory: " + session.getToolContext().getWorkingDirectory());
        console.println("Type /help for commands, /exit to quit.");
        console.println();
    }

    /**
     * @return true when the console should stop
     */
    private boolean handleCommand(ConversationSession session, String commandLine) {
        List<String> parts = Arrays.stream(commandLine.trim().split("\\s+")).filter(p -> !p.isEmpty()).toList();
        if (parts.isEmpty()) {
            console.println("Type /help for commands.");
            return false;
        }
        CommandPort.CommandResult result = commandPort
                .execute(parts.get(0), parts.subList(1, parts.size()),
                        Map.of(CommandRouter.CONTEXT_SESSION, session))
                .join();
        console.println(result.output());
        console.println();
        return result.exit();
    }

    // Visible for testing
    void runTurn(ConversationSession session, String userText) {
        AtomicBoolean contentPrinted = new AtomicBoolean(false);
        try {
            ToolLoopTurnResult result = toolLoopSystem.processTurn(session, userText,
                    event -> onEvent(event, contentPrinted), CancellationToken.none());
            if (!contentPrinted.get() && result.finalContent() != null && !result.finalContent().isEmpty()) {
                console.print(result.finalContent());
            }
            console.println();
            log.debug("Turn finished in {} round(s), {} tool call(s), ~{} input / ~{} output tokens",
                    result.rounds(), result.toolExecutions(), result.inputTokens(), result.outputTokens());
        } catch (RuntimeException e) {
            log.error("Turn failed", e);
            if (contentPrinted.get()) {
                console.println();
            }
            console.println("Error: " + e.getMessage());
        }
        console.println();
    }

    private void onEvent(TurnEvent event, AtomicBoolean contentPrinted) {
        switch (event.type()) {
        case CONTENT -> {
            console.print(event.text());
            contentPrinted.set(true);
        }
        case TOOL_CALLS -> {
            if (contentPrinted.getAndSet(false)) {
                console.println();
            }
            event.toolCalls().forEach(call -> console.println("[" + call.getName() + "]"));
        }
        case TOOL_RESULT -> {
            if (!event.toolResult().isSuccess()) {
                console.println("[" + event.toolCall().getName() + "] Error: " + event.toolResult().getError());
            }
        }
        case CANCELLED -> console.println("\n(cancelled)");
        default -> {
            // token counts and completion are logged by the loop
        }
        }
    }
}
