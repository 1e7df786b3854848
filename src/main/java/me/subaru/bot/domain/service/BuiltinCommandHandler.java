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

import me.subaru.bot.domain.model.BuiltinCommand;
import me.subaru.bot.domain.model.CommandDefinition;
import me.subaru.bot.domain.model.CommandTable;
import me.subaru.bot.domain.model.UserSession;
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.inbound.CommandPort.CommandResult;
import me.subaru.bot.tools.ScriptExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Implementations of the {@link BuiltinCommand} set. Torrent commands are
 * delegated to {@link MagnetCommandHandler}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BuiltinCommandHandler {

    private final ConfigRegistry configRegistry;
    private final SessionService sessionService;
    private final ScriptExecutor scriptExecutor;
    private final MagnetCommandHandler magnetHandler;
    private final DownloadTracker downloadTracker;
    private final BotProperties properties;

    public record CommandContext(String userId, String roomId, String argument, CommandTable table) {
    }

    public CommandResult execute(BuiltinCommand command, CommandContext context) {
        return switch (command) {
        case HELP -> CommandResult.ok(help(context));
        case PING -> CommandResult.ok("Pong! 🏓");
        case RELOAD -> reload();
        case DISK_USAGE -> diskUsage();
        case STATUS -> CommandResult.ok(status(context.userId()));
        case MAGNET -> magnetHandler.addMagnet(context.userId(), context.roomId(), context.argument());
        case MAGNET_CONFIG -> magnetHandler.configure(context.userId(), context.argument());
        case MAGNET_LIST -> magnetHandler.list(context.userId());
        case MAGNET_INFO -> magnetHandler.info(context.userId(), context.argument());
        };
    }

    private String help(CommandContext context) {
        StringBuilder text = new StringBuilder("**Available Commands:**\n\n");
        List<CommandDefinition> visible = context.table().visibleTo(context.userId());
        for (CommandDefinition definition : visible) {
            text.append("• `").append(definition.token()).append('`');
            if (!definition.description().isBlank()) {
                text.append(" - ").append(definition.description());
            }
            text.append('\n');
        }
        UserSession session = sessionService.snapshot(context.userId());
        if (session.isAiEnabled()) {
            text.append("\n**AI:**\n• Mention `").append(session.getTrigger())
                    .append("` in a message to talk to the AI\n");
        }
        return text.toString().trim();
    }

    private CommandResult reload() {
        try {
            CommandTable table = configRegistry.reload();
            return CommandResult.ok("✅ Configuration reloaded: " + table.commands().size() + " commands, "
                    + table.users().size() + " users.");
        } catch (ConfigRegistry.ConfigParseException e) {
            log.warn("[Commands] Reload requested but failed: {}", e.getMessage());
            return CommandResult.configError("❌ Reload failed, previous configuration kept:\n" + e.getMessage());
        }
    }

    private CommandResult diskUsage() {
        ScriptExecutor.ScriptResult result = scriptExecutor.run(List.of("df", "-h", "/"),
                properties.getCommands().getDiskUsageTimeout());
        if (result.outcome() == ScriptExecutor.ScriptResult.Outcome.TIMED_OUT) {
            return CommandResult.timeout("❌ Timeout getting disk space information");
        }
        if (!result.isSuccess()) {
            String detail = result.error() != null ? result.error() : result.stderr().strip();
            return CommandResult.failure("❌ Error getting disk space: " + detail);
        }
        return formatDiskUsage(result.stdout())
                .map(CommandResult::ok)
                .orElseGet(() -> CommandResult.failure("❌ Unable to parse disk space information"));
    }

    static Optional<String> formatDiskUsage(String dfOutput) {
        String[] lines = dfOutput.strip().split("\\n");
        if (lines.length < 2) {
            return Optional.empty();
        }
        String[] data = lines[lines.length - 1].trim().split("\\s+");
        if (data.length < 6) {
            return Optional.empty();
        }
        return Optional.of("💾 **Disk space (" + data[5] + "):**\n\n"
                + "• **Total:** " + data[1] + "\n"
                + "• **Used:** " + data[2] + " (" + data[4] + ")\n"
                + "• **Available:** " + data[3] + "\n"
                + "• **Filesystem:** " + data[0]);
    }

    private String status(String userId) {
        UserSession session = sessionService.snapshot(userId);
        long activeDownloads = downloadTracker.jobsOf(userId).stream().filter(job -> !job.isTerminal()).count();
        return "📊 **Status for " + userId + "**\n\n"
                + "• **Messages:** " + session.getMessageCount() + "\n"
                + "• **AI exchanges:** " + session.getAiExchangeCount() + "\n"
                + "• **Commands:** " + session.getCommandCount() + "\n"
                + "• **History:** " + session.getHistory().size() + "/" + session.getMaxHistory() + "\n"
                + "• **AI:** " + (session.isAiEnabled() ? "enabled (" + session.getModel() + ")" : "disabled") + "\n"
                + "• **Active downloads:** " + activeDownloads;
    }
}
