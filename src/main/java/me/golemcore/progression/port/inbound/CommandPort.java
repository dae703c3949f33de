package me.golemcore.progression.port.inbound;

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
 * Port for executing textual commands ({@code play}, {@code rule},
 * {@code replay}) against the progression engine.
 */
public interface CommandPort {

    /**
     * Executes a command with the given arguments and context.
     *
     * @param command
     *            Command name
     * @param args
     *            List of command arguments
     * @param context
     *            Execution context; {@code username} selects the user
     * @return Command execution result with success status and output
     */
    CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context);

    /**
     * Checks if a command with the given name is registered.
     */
    boolean hasCommand(String command);

    /**
     * Returns a list of all available commands with their definitions.
     */
    List<CommandDefinition> listCommands();

    /**
     * Result of a command execution: success flag, human-readable output and
     * the structured result the output was rendered from.
     */
    record CommandResult(
            boolean success,
            String output,
            Object data) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output, null);
        }

        public static CommandResult success(String output, Object data) {
            return new CommandResult(true, output, data);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error, null);
        }

        public static CommandResult failure(String error, Object data) {
            return new CommandResult(false, error, data);
        }
    }

    /**
     * A command's name, description and usage.
     */
    record CommandDefinition(
            String name,
            String description,
            String usage) {
    }
}
