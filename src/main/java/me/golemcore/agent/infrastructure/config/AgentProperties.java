package me.golemcore.agent.infrastructure.config;

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

import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolFailureKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Centralized configuration properties for the agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix. This class
 * contains nested property classes for the different subsystems:
 * <ul>
 * <li>{@link LlmProperties} - completion provider settings</li>
 * <li>{@link ToolLoopProperties} - round budget and tool call scheduling</li>
 * <li>{@link ToolsProperties} - retry policy and built-in tool settings</li>
 * <li>{@link SecurityProperties} - confirmation gating</li>
 * <li>{@link PluginsProperties} - discovery manifest and plugin isolation</li>
 * <li>{@link CliProperties} - console runner</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding.
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private ToolsProperties tools = new ToolsProperties();
    private SecurityProperties security = new SecurityProperties();
    private PluginsProperties plugins = new PluginsProperties();
    private CliProperties cli = new CliProperties();

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String apiKey;
        private String baseUrl = "https://api.x.ai/v1";
        private String model = "grok-3-latest";
        private List<String> models = new ArrayList<>(List.of("grok-3-latest", "grok-3-fast", "grok-3-mini"));
        private double temperature = 0.7;
        private int maxTokens = 4000;
        private boolean stream = true;
        private String systemPrompt = "You are a helpful command-line assistant. You can read, search and edit "
                + "files and run shell commands in the user's working directory through the tools provided. "
                + "Prefer small, verifiable steps and report what you changed.";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== TOOL LOOP ====================

    @Data
    public static class ToolLoopProperties {

        /**
         * Number of rounds after which a turn that keeps requesting tools is
         * aborted.
         */
        private int maxToolRounds = 30;

        /**
         * Run the tool calls of one round concurrently. Results are still appended
         * in the order the calls were issued.
         */
        private boolean parallelToolCalls = false;

        private int parallelism = 4;

        /**
         * Characters per token used by the token estimate.
         */
        private double charsPerToken = 3.5;

        private int maxToolResultChars = 100000;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private String workspace = "";
        private Set<String> disabled = new HashSet<>();
        private RetryProperties retry = new RetryProperties();
        private ShellToolProperties shell = new ShellToolProperties();
        private FileToolProperties files = new FileToolProperties();
        private SearchToolProperties search = new SearchToolProperties();
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(5);
        private Set<ToolFailureKind> retryableKinds = EnumSet.of(
                ToolFailureKind.INITIALIZATION_FAILED, ToolFailureKind.EXECUTION_FAILED);
    }

    @Data
    public static class ShellToolProperties {
        private long defaultTimeoutMs = 30000;
        private long maxTimeoutMs = 300000;
        private int maxOutputChars = 100000;
        private List<String> blockedCommands = new ArrayList<>(List.of(
                "rm -rf /", "rm -rf /*", "mkfs", "dd if=/dev/zero", ":(){ :|:& };:", "shutdown", "reboot"));
    }

    @Data
    public static class FileToolProperties {
        private int maxListEntries = 100;
        private int maxViewLines = 2000;
        private long maxFileBytes = 2 * 1024 * 1024;
    }

    @Data
    public static class SearchToolProperties {
        private int defaultMaxResults = 50;
        private int maxFileBytes = 1024 * 1024;
    }

    // ==================== SECURITY ====================

    @Data
    public static class SecurityProperties {
        private ToolConfirmationProperties toolConfirmation = new ToolConfirmationProperties();
    }

    @Data
    public static class ToolConfirmationProperties {
        private boolean enabled = true;

        /**
         * Also gate tools declaring FILE_WRITE or SYSTEM_EXECUTE, not only those
         * declaring USER_CONFIRMATION.
         */
        private boolean confirmDestructive = true;

        private Duration timeout = Duration.ofMinutes(5);
    }

    // ==================== PLUGINS ====================

    @Data
    public static class PluginsProperties {
        private boolean enabled = true;
        private String manifest = ".golemcore/tools/manifest.json";
        private String directory = ".golemcore/tools";

        /**
         * Capabilities that in-process plugin classes may not declare. Tools with
         * these capabilities must be provided as subprocess commands.
         */
        private Set<ToolCapability> isolateCapabilities = EnumSet.of(ToolCapability.NETWORK_ACCESS);

        private long processTimeoutMs = 60000;
    }

    // ==================== CLI ====================

    @Data
    public static class CliProperties {
        private boolean enabled = true;

        /**
         * Single prompt to process headlessly. The runner exits after the turn.
         */
        private String prompt;

        private boolean autoApprove = false;
    }
}
