package me.golemcore.agent.port.inbound;

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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Slash commands typed at the console prompt. A line starting with {@code /}
 * never reaches the model; it is split on whitespace and routed here with the
 * current {@code ConversationSession} under the {@code "session"} key of the
 * context map.
 */
public interface CommandPort {

    CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context);

    /**
     * Case-insensitive lookup, without the leading slash.
     */
    boolean hasCommand(String command);

    /**
     * In the order {@code /help} prints them.
     */
    List<CommandDefinition> listCommands();

    /**
     * Text to print after a command. Failed results are printed as errors;
     * {@code exit} ends the console loop once the text is shown.
     */
    record CommandResult(boolean success, String output, boolean exit) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output, false);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error, false);
        }

        public static CommandResult exit(String output) {
            return new CommandResult(true, output, true);
        }
    }

    record CommandDefinition(String name, String description, String usage) {
    }
}
