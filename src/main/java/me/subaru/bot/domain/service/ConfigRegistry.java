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

import me.subaru.bot.domain.model.CommandTable;
import me.subaru.bot.domain.model.ConfigReloadedEvent;
import me.subaru.bot.infrastructure.config.BotProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active {@link CommandTable} and replaces it atomically on reload.
 *
 * <p>
 * Readers call {@link #snapshot()} and keep using that table for the rest of
 * their work; a concurrent reload never changes a table somebody already holds.
 * {@link #reload()} parses both files completely before the swap, so a broken
 * file leaves the previous table in place.
 *
 * <p>
 * A watcher compares file modification times every
 * {@code bot.config.watch-interval} and reloads on change.
 */
@Service
@Slf4j
public class ConfigRegistry {

    private static final String DEFAULTS_LOCATION = "/defaults/";

    private final BotProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final CommandTableParser parser;

    private final AtomicReference<CommandTable> current = new AtomicReference<>(CommandTable.empty());
    private final AtomicBoolean checking = new AtomicBoolean(false);
    private final Object reloadLock = new Object();

    private volatile FileTime commandsModified;
    private volatile FileTime usersModified;
    private ScheduledExecutorService watcher;

    public ConfigRegistry(BotProperties properties, ObjectMapper objectMapper,
            ApplicationEventPublisher eventPublisher, Clock clock) {
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.parser = new CommandTableParser(objectMapper, properties.getDispatcher().getCommandPrefix());
    }

    @PostConstruct
    public void init() {
        ensureDefaults();
        try {
            CommandTable table = reload();
            log.info("[Config] Loaded {} commands and {} user profiles", table.commands().size(),
                    table.users().size());
        } catch (ConfigParseException e) {
            log.error("[Config] Initial configuration is invalid, no commands available: {}", e.getMessage());
        }

        BotProperties.ConfigFilesProperties config = properties.getConfig();
        if (config.isWatchEnabled()) {
            watcher = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });
            long intervalMs = config.getWatchInterval().toMillis();
            watcher.scheduleWithFixedDelay(this::checkForChanges, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("[Config] Watching {} every {}ms", configDirectory(), intervalMs);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (watcher != null) {
            watcher.shutdownNow();
        }
    }

    /**
     * Current table. Never null.
     */
    public CommandTable snapshot() {
        return current.get();
    }

    public boolean isAllowed(String userId, String token) {
        return snapshot().find(token).map(definition -> definition.permits(userId)).orElse(false);
    }

    /**
     * Re-reads both configuration files and swaps the table in one step.
     *
     * @return the new table
     * @throws ConfigParseException
     *             if either file is unreadable or invalid; the previous table
     *             stays active
     */
    public CommandTable reload() throws ConfigParseException {
        synchronized (reloadLock) {
            Path commandsPath = commandsPath();
            Path usersPath = usersPath();
            FileTime commandsTime = modifiedTime(commandsPath);
            FileTime usersTime = modifiedTime(usersPath);
            commandsModified = commandsTime;
            usersModified = usersTime;

            String commandsJson = readFile(commandsPath);
            String usersJson = Files.exists(usersPath) ? readFile(usersPath) : null;
            CommandTable table = parser.parse(commandsJson, usersJson, clock.instant());

            CommandTable previous = current.getAndSet(table);
            log.info("[Config] Command table swapped: {} -> {} commands", previous.commands().size(),
                    table.commands().size());
            eventPublisher.publishEvent(new ConfigReloadedEvent(table));
            return table;
        }
    }

    void checkForChanges() {
        if (!checking.compareAndSet(false, true)) {
            return;
        }
        try {
            FileTime commandsTime = modifiedTime(commandsPath());
            FileTime usersTime = modifiedTime(usersPath());
            if (Objects.equals(commandsTime, commandsModified) && Objects.equals(usersTime, usersModified)) {
                return;
            }
            log.info("[Config] Change detected, reloading");
            reload();
        } catch (ConfigParseException e) {
            log.error("[Config] Reload after file change failed, keeping previous table: {}", e.getMessage());
        } catch (RuntimeException e) { // NOSONAR - keep the watcher alive
            log.error("[Config] Watcher tick failed: {}", e.getMessage(), e);
        } finally {
            checking.set(false);
        }
    }

    void ensureDefaults() {
        Path directory = configDirectory();
        try {
            Files.createDirectories(directory);
            copyDefault("commands.json", commandsPath());
            copyDefault("users.json", usersPath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to prepare config directory " + directory, e);
        }
    }

    private void copyDefault(String resource, Path target) throws IOException {
        if (Files.exists(target)) {
            return;
        }
        try (InputStream in = ConfigRegistry.class.getResourceAsStream(DEFAULTS_LOCATION + resource)) {
            if (in == null) {
                log.warn("[Config] Bundled default {} not found", resource);
                return;
            }
            Files.write(target, in.readAllBytes());
            log.info("[Config] Created default {}", target);
        }
    }

    private String readFile(Path path) throws ConfigParseException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigParseException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    private FileTime modifiedTime(Path path) {
        try {
            return Files.exists(path) ? Files.getLastModifiedTime(path) : null;
        } catch (IOException e) {
            log.debug("[Config] Cannot stat {}: {}", path, e.getMessage());
            return null;
        }
    }

    private Path configDirectory() {
        return Paths.get(properties.getConfig().getDirectory()).toAbsolutePath().normalize();
    }

    private Path commandsPath() {
        return configDirectory().resolve(properties.getConfig().getCommandsFile());
    }

    private Path usersPath() {
        return configDirectory().resolve(properties.getConfig().getUsersFile());
    }

    /**
     * Raised when a configuration file cannot be read or parsed.
     */
    public static class ConfigParseException extends Exception {

        private static final long serialVersionUID = 1L;

        public ConfigParseException(String message) {
            super(message);
        }

        public ConfigParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
