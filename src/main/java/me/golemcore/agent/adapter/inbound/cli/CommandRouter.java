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

import me.golemcore.agent.domain.model.ConversationSession;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExecutionStats;
import me.golemcore.agent.domain.model.ToolRegistryStats;
import me.golemcore.agent.domain.service.ToolExecutionTracker;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.port.inbound.CommandPort;
import me.golemcore.agent.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routes console slash commands to their handlers.
 *
 * <ul>
 * <li>/help - Show available commands
 * <li>/tools [query] - List registered tools, optionally filtered
 * <li>/stats - Show registry and session statistics
 * <li>/clear - Clear the conversation history
 * <li>/model [name] - Show or switch the model
 * <li>/dbp [on|off] - Toggle the confirmation bypass
 * <li>/exit - Leave the console
 * </ul>
 *
 * <p>
 * The session a command acts on is passed in the context map under
 * {@link #CONTEXT_SESSION}.
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    public static final String CONTEXT_SESSION = "session";

    private static final int MAX_TOOL_DESC_LENGTH = 100;
    private static final String CMD_HELP = "help";
    private static final String CMD_TOOLS = "tools";
    private static final String CMD_STATS = "stats";
    private static final String CMD_CLEAR = "clear";
    private static final String CMD_MODEL = "model";
    private static final String CMD_BYPASS = "dbp";
    private static final String CMD_EXIT = "exit";

    private static final List<CommandDefinition> COMMANDS = List.of(
            new CommandDefinition(CMD_HELP, "Show available commands", "/help"),
            new CommandDefinition(CMD_TOOLS, "List registered tools", "/tools [query]"),
            new CommandDefinition(CMD_STATS, "Show tool usage and session statistics", "/stats"),
            new CommandDefinition(CMD_CLEAR, "Clear the conversation history", "/clear"),
            new CommandDefinition(CMD_MODEL, "Show or switch the model", "/model [name]"),
            new CommandDefinition(CMD_BYPASS, "Dangerously bypass all tool confirmations", "/dbp [on|off]"),
            new CommandDefinition(CMD_EXIT, "Exit", "/exit"));

    private static final Set<String> KNOWN_COMMANDS = Set.of(
            CMD_HELP, CMD_TOOLS, CMD_STATS, CMD_CLEAR, CMD_MODEL, CMD_BYPASS, CMD_EXIT, "quit");

    private final ToolRegistry toolRegistry;
    private final ToolExecutionTracker executionTracker;
    private final LlmPort llmPort;

    public CommandRouter(ToolRegistry toolRegistry, ToolExecutionTracker executionTracker, LlmPort llmPort) {
        this.toolRegistry = toolRegistry;
        this.executionTracker = executionTracker;
        this.llmPort = llmPort;
        log.info("CommandRouter initialized with commands: {}", COMMANDS.stream().map(CommandDefinition::name)
                .toList());
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        log.debug("Executing command: /{} {}", command, args);
        String name = command.toLowerCase(Locale.ROOT);
        if (!hasCommand(name)) {
            return CompletableFuture.completedFuture(
                    CommandResult.failure("Unknown command: /" + command + ". Type /help for the list."));
        }
        ConversationSession session = (ConversationSession) context.get(CONTEXT_SESSION);

        CommandResult result = switch (name) {
        case CMD_HELP -> handleHelp();
        case CMD_TOOLS -> handleTools(args);
        case CMD_STATS -> handleStats(session);
        case CMD_CLEAR -> handleClear(session);
        case CMD_MODEL -> handleModel(session, args);
        case CMD_BYPASS -> handleBypass(session, args);
        case CMD_EXIT, "quit" -> CommandResult.exit("Goodbye.");
        default -> CommandResult.failure("Unknown command: /" + command);
        };
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMANDS.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return COMMANDS;
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder("Available commands:\n");
        for (CommandDefinition command : COMMANDS) {
            sb.append("  ").append(command.usage()).append(" - ").append(command.description()).append("\n");
        }
        sb.append("\nAnything else is sent to the model.");
        return CommandResult.success(sb.toString());
    }

    // ==================== Tools ====================

    private CommandResult handleTools(List<String> args) {
        String query = String.join(" ", args).trim();
        List<ToolDefinition> tools = query.isEmpty() ? toolRegistry.list() : toolRegistry.search(query);
        if (tools.isEmpty()) {
            return CommandResult.success(query.isEmpty() ? "No tools registered." : "No tools match '" + query + "'.");
        }

        Map<ToolCategory, StringBuilder> byCategory = new EnumMap<>(ToolCategory.class);
        for (ToolDefinition tool : tools) {
            byCategory.computeIfAbsent(tool.getCategory(), category -> new StringBuilder())
                    .append("  ").append(tool.getId()).append(" - ").append(shortDescription(tool)).append("\n");
        }

        StringBuilder sb = new StringBuilder("Tools (").append(tools.size()).append("):\n");
        byCategory.forEach((category, lines) -> sb.append("\n").append(category.getDisplayName()).append(":\n")
                .append(lines));
        return CommandResult.success(sb.toString().trim());
    }

    private static String shortDescription(ToolDefinition tool) {
        String desc = tool.getDescription().trim().replace('\n', ' ').replace('\t', ' ');
        int dotIdx = desc.indexOf(". ");
        if (dotIdx > 0 && dotIdx < MAX_TOOL_DESC_LENGTH) {
            return desc.substring(0, dotIdx + 1);
        }
        if (desc.length() > MAX_TOOL_DESC_LENGTH) {
            return desc.substring(0, MAX_TOOL_DESC_LENGTH) + "...";
        }
        return desc;
    }

    // ==================== Stats ====================

    private CommandResult handleStats(ConversationSession session) {
        ToolRegistryStats stats = toolRegistry.getStats();
        StringBuilder sb = new StringBuilder();
        sb.append("Registered tools: ").append(stats.totalTools()).append("\n");
        stats.byCategory().forEach((category, count) -> sb.append("  ").append(category.getDisplayName())
                .append(": ").append(count).append("\n"));

        if (!stats.mostUsed().isEmpty()) {
            sb.append("\nMost used:\n");
            for (ToolExecutionStats used : stats.mostUsed()) {
                sb.append("  ").append(used.toolId())
                        .append(" - ").append(used.executionCount()).append(" run(s), avg ")
                        .append(used.averageDurationMs()).append(" ms\n");
            }
        }

        Map<String, Long> byStatus = new LinkedHashMap<>();
        executionTracker.getHistory().forEach(execution -> byStatus.merge(
                execution.getStatus().name().toLowerCase(Locale.ROOT), 1L, Long::sum));
        sb.append("\nTool executions this session: ").append(executionTracker.getHistory().size());
        if (!byStatus.isEmpty()) {
            sb.append(" ").append(byStatus);
        }
        sb.append("\n");

        if (session != null) {
            sb.append("Messages: ").append(session.snapshot().size()).append("\n");
            sb.append("Model: ").append(session.getModel()).append(" (").append(llmPort.getProviderId())
                    .append(")\n");
            sb.append("Working directory: ").append(session.getToolContext().getWorkingDirectory());
        }
        return CommandResult.success(sb.toString().trim());
    }

    // ==================== Session ====================

    private CommandResult handleClear(ConversationSession session) {
        if (session == null) {
            return CommandResult.failure("No active session");
        }
        session.clear();
        executionTracker.clear();
        return CommandResult.success("Conversation cleared.");
    }

    private CommandResult handleModel(ConversationSession session, List<String> args) {
        if (session == null) {
            return CommandResult.failure("No active session");
        }
        if (args.isEmpty()) {
            StringBuilder sb = new StringBuilder("Current model: ").append(session.getModel());
            List<String> models = llmPort.getSupportedModels();
            if (!models.isEmpty()) {
                sb.append("\nAvailable models:");
                for (String model : models) {
                    sb.append("\n  ").append(model.equals(session.getModel()) ? "* " : "  ").append(model);
                }
            }
            return CommandResult.success(sb.toString());
        }
        String model = args.get(0);
        session.setModel(model);
        log.info("Model switched to {}", model);
        return CommandResult.success("Model set to " + model);
    }

    private CommandResult handleBypass(ConversationSession session, List<String> args) {
        if (session == null) {
            return CommandResult.failure("No active session");
        }
        var flags = session.getToolContext().getConfirmationFlags();
        if (args.isEmpty()) {
            return CommandResult.success("Confirmation bypass is " + (flags.isBypassAll() ? "on" : "off"));
        }
        String mode = args.get(0).toLowerCase(Locale.ROOT);
        if (!"on".equals(mode) && !"off".equals(mode)) {
            return CommandResult.failure("Usage: /dbp [on|off]");
        }
        flags.setBypassAll("on".equals(mode));
        if (flags.isBypassAll()) {
            log.warn("[Confirmation] Bypass enabled for session {}", session.getId());
            return CommandResult.success("Confirmation bypass enabled. Tools will run without asking.");
        }
        return CommandResult.success("Confirmation bypass disabled.");
    }
}
