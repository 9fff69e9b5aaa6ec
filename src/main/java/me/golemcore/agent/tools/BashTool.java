package me.golemcore.agent.tools;

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

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExample;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ArgumentChecks;
import me.golemcore.agent.domain.tool.ToolBuilder;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.infrastructure.process.ProcessResult;
import me.golemcore.agent.infrastructure.process.ProcessRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs a shell command in the session working directory.
 *
 * <p>
 * A command of the form {@code cd <dir>} changes the session working directory
 * instead of spawning a process. Commands containing an entry of
 * {@code agent.tools.shell.blocked-commands} are refused. Because the tool
 * declares {@link ToolCapability#USER_CONFIRMATION}, every invocation goes
 * through the confirmation gate first.
 */
@Component
@Slf4j
public class BashTool implements ToolComponent {

    private static final String NO_OUTPUT = "Command executed successfully (no output)";

    private final ProcessRunner processRunner;
    private final AgentProperties.ShellToolProperties config;
    private final ToolDefinition definition;

    public BashTool(AgentProperties properties, ProcessRunner processRunner) {
        this.processRunner = processRunner;
        this.config = properties.getTools().getShell();
        this.definition = ToolBuilder.create()
                .id("bash")
                .description("Execute a shell command in the working directory. Use 'cd <dir>' to change the "
                        + "working directory for subsequent commands.")
                .category(ToolCategory.SYSTEM)
                .capabilities(ToolCapability.SYSTEM_EXECUTE, ToolCapability.USER_CONFIRMATION)
                .stringArg("command", "Shell command to execute", arg -> arg.required(true))
                .numberArg("timeout", "Timeout in milliseconds (default " + config.getDefaultTimeoutMs() + ")",
                        arg -> arg.validator(ArgumentChecks.min(1)))
                .example(new ToolExample("Show git status", Map.of("command", "git status --short"),
                        "M src/App.java"))
                .execute((args, context) -> run(args.getString("command"),
                        args.getLong("timeout", config.getDefaultTimeoutMs()), context))
                .build();
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    private ToolResult run(String command, long requestedTimeout, ToolContext context)
            throws IOException, InterruptedException {
        String trimmed = command.trim();
        if (trimmed.isEmpty()) {
            return ToolResult.failure("Command is empty");
        }
        if (trimmed.equals("cd") || trimmed.startsWith("cd ")) {
            return changeDirectory(trimmed.substring(2).trim(), context);
        }

        String normalized = trimmed.toLowerCase(Locale.ROOT);
        for (String blocked : config.getBlockedCommands()) {
            if (normalized.contains(blocked.toLowerCase(Locale.ROOT))) {
                log.warn("[Shell] Blocked command attempt: {}", command);
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Command blocked for security reasons");
            }
        }

        long timeout = Math.min(requestedTimeout, config.getMaxTimeoutMs());
        Path workDir = context.getWorkingDirectory();
        log.info("[Shell] Executing in {}: {}", workDir, command);

        ProcessResult result = processRunner.run(List.of("/bin/sh", "-c", command), workDir, null, timeout);
        if (result.timedOut()) {
            return ToolResult.failure("Command timed out after " + timeout + " ms");
        }

        String output = combine(result.stdout(), result.stderr());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("exitCode", result.exitCode());
        data.put("durationMs", result.durationMs());
        if (!result.isSuccess()) {
            log.debug("[Shell] Command exited with {}", result.exitCode());
            return ToolResult.builder()
                    .success(false)
                    .output(output)
                    .data(data)
                    .error("Command failed: exit code " + result.exitCode()
                            + (output.isEmpty() ? "" : "\n" + output))
                    .failureKind(ToolFailureKind.TOOL_REPORTED)
                    .build();
        }
        return ToolResult.success(output.isEmpty() ? NO_OUTPUT : output, data);
    }

    private ToolResult changeDirectory(String target, ToolContext context) {
        if (target.isEmpty()) {
            target = System.getProperty("user.home");
        }
        Path directory = context.resolvePath(target);
        if (!Files.isDirectory(directory)) {
            return ToolResult.failure("Directory does not exist: " + target);
        }
        context.setWorkingDirectory(directory);
        log.info("[Shell] Working directory changed to {}", context.getWorkingDirectory());
        return ToolResult.success("Changed directory to: " + context.getWorkingDirectory(),
                Map.of("path", context.getWorkingDirectory().toString()));
    }

    private String combine(String stdout, String stderr) {
        StringBuilder output = new StringBuilder();
        if (stdout != null && !stdout.isBlank()) {
            output.append(stdout.stripTrailing());
        }
        if (stderr != null && !stderr.isBlank()) {
            if (!output.isEmpty()) {
                output.append('\n');
            }
            output.append("STDERR: ").append(stderr);
        }
        String text = output.toString().trim();
        if (text.length() > config.getMaxOutputChars()) {
            return text.substring(0, config.getMaxOutputChars()) + "\n[Output truncated...]";
        }
        return text;
    }
}
