package me.subaru.bot.port.inbound;

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

import me.subaru.bot.domain.model.CommandDefinition;

import java.util.List;

/**
 * Entry point for prefixed chat commands ({@code !ping}, {@code !reload}, ...).
 */
public interface CommandPort {

    /**
     * Resolves and executes a command line typed by a user.
     *
     * @param userId
     *            sender of the command
     * @param roomId
     *            room the command was typed in
     * @param commandText
     *            full text including the prefix, e.g. {@code "!magnet-info ABC"}
     */
    CommandResult route(String userId, String roomId, String commandText);

    boolean hasCommand(String token);

    List<CommandDefinition> listCommands(String userId);

    record CommandResult(Status status, String output) {

        public enum Status {
            OK,
            PERMISSION_DENIED,
            NOT_FOUND,
            EXECUTION_TIMEOUT,
            FAILED,
            BACKEND_UNAVAILABLE,
            CONFIG_PARSE_ERROR
        }

        public static CommandResult ok(String output) {
            return new CommandResult(Status.OK, output);
        }

        public static CommandResult permissionDenied(String output) {
            return new CommandResult(Status.PERMISSION_DENIED, output);
        }

        public static CommandResult notFound() {
            return new CommandResult(Status.NOT_FOUND, null);
        }

        public static CommandResult timeout(String output) {
            return new CommandResult(Status.EXECUTION_TIMEOUT, output);
        }

        public static CommandResult failure(String output) {
            return new CommandResult(Status.FAILED, output);
        }

        public static CommandResult backendUnavailable(String output) {
            return new CommandResult(Status.BACKEND_UNAVAILABLE, output);
        }

        public static CommandResult configError(String output) {
            return new CommandResult(Status.CONFIG_PARSE_ERROR, output);
        }

        public boolean isSilent() {
            return status == Status.NOT_FOUND || output == null || output.isBlank();
        }
    }
}
