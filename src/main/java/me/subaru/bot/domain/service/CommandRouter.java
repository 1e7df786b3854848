package me.subaru.bot.domain.service;

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
import me.subaru.bot.domain.model.CommandTable;
import me.subaru.bot.domain.model.ExecutionKind;
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.inbound.CommandPort;
import me.subaru.bot.tools.ScriptExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves a prefixed command against the current command table, checks the
 * allow-list and executes it.
 *
 * <p>
 * The table is read once per invocation, so a reload running concurrently
 * does not affect a command already being routed. A denied invocation is
 * reported to the security audit and never reaches the script.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String TRUNCATION_NOTE = "\n… (output truncated)";

    private final ConfigRegistry configRegistry;
    private final BuiltinCommandHandler builtinHandler;
    private final ScriptExecutor scriptExecutor;
    private final SessionService sessionService;
    private final SecurityAuditService securityAudit;
    private final BotProperties properties;

    @Override
    public CommandResult route(String userId, String roomId, String commandText) {
        String trimmed = commandText != null ? commandText.trim() : "";
        if (trimmed.isEmpty()) {
            return CommandResult.notFound();
        }
        String[] parts = trimmed.split("\\s+", 2);
        String token = parts[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1].trim() : "";

        CommandTable table = configRegistry.snapshot();
        Optional<CommandDefinition> found = table.find(token);
        if (found.isEmpty()) {
            log.debug("[Commands] Unknown command {} from {}", token, userId);
            return CommandResult.notFound();
        }

        CommandDefinition definition = found.get();
        if (!definition.permits(userId)) {
            securityAudit.permissionDenied(userId, token, roomId);
            return CommandResult.permissionDenied("⛔ You are not allowed to run " + token + ".");
        }

        sessionService.update(userId, session -> {
            session.recordCommand();
            return null;
        });
        securityAudit.commandExecuted(userId, token, roomId);

        if (definition.kind() == ExecutionKind.BUILTIN) {
            return builtinHandler.execute(definition.builtin(),
                    new BuiltinCommandHandler.CommandContext(userId, roomId, argument, table));
        }
        return runScript(definition, argument);
    }

    @Override
    public boolean hasCommand(String token) {
        return configRegistry.snapshot().find(token).isPresent();
    }

    @Override
    public List<CommandDefinition> listCommands(String userId) {
        return configRegistry.snapshot().visibleTo(userId);
    }

    private CommandResult runScript(CommandDefinition definition, String argument) {
        BotProperties.CommandsProperties config = properties.getCommands();
        List<String> args = argument.isEmpty() ? List.of() : Arrays.asList(argument.split("\\s+"));
        log.info("[Commands] Running script for {}: {}", definition.token(), definition.script());

        ScriptExecutor.ScriptResult result = scriptExecutor.runScript(definition.script(), args,
                config.getScriptTimeout());
        return switch (result.outcome()) {
        case TIMED_OUT -> CommandResult.timeout("⏱️ " + definition.token() + " timed out after "
                + config.getScriptTimeout().toSeconds() + "s and was stopped.");
        case START_FAILED -> CommandResult.failure("❌ Could not run " + definition.token() + ": " + result.error());
        case COMPLETED -> result.exitCode() == 0
                ? CommandResult.ok(renderOutput(result, config.getMaxOutputChars()))
                : CommandResult.failure("❌ Exit code " + result.exitCode() + "\n"
                        + renderOutput(result, config.getMaxOutputChars()));
        };
    }

    static String renderOutput(ScriptExecutor.ScriptResult result, int maxChars) {
        StringBuilder output = new StringBuilder();
        if (result.stdout() != null && !result.stdout().isBlank()) {
            output.append(result.stdout().strip());
        }
        if (result.stderr() != null && !result.stderr().isBlank()) {
            if (output.length() > 0) {
                output.append("\n\n");
            }
            output.append("[stderr]\n").append(result.stderr().strip());
        }
        String text = output.length() > 0 ? output.toString() : "(no output)";
        if (text.length() > maxChars) {
            text = text.substring(0, maxChars) + TRUNCATION_NOTE;
        }
        return "```\n" + text + "\n```";
    }
}
