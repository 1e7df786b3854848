package me.subaru.bot.security;

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

import me.subaru.bot.domain.model.SecurityEvent;
import me.subaru.bot.domain.service.SecurityAuditService;
import me.subaru.bot.infrastructure.config.BotProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tails the system authentication log and raises security alerts for SSH
 * logins, failed SSH attempts, sudo commands and console sessions.
 *
 * <p>
 * Starts at the end of the file so history is not replayed. Rotation is
 * detected by a changed file key (inode) or a file shorter than the read
 * position; reading then restarts at offset 0. Disabled unless
 * {@code bot.security.auth-log.enabled=true}.
 */
@Component
@Slf4j
public class AuthLogMonitor {

    private static final Pattern SSH_SUCCESS = Pattern.compile(
            "sshd\\[\\d+]: Accepted .+ for (\\S+) from (\\S+) port (\\d+)");
    private static final Pattern SSH_FAILED = Pattern.compile(
            "sshd\\[\\d+]: Failed .+ for (?:invalid user )?(\\S+) from (\\S+) port (\\d+)");
    private static final Pattern SUDO_COMMAND = Pattern.compile(
            "sudo:\\s+(\\S+)\\s+:.*COMMAND=(.+)");
    private static final Pattern SESSION_OPENED = Pattern.compile(
            "systemd-logind\\[\\d+]: New session .+ of user (\\S+?)\\.?$");

    private final BotProperties properties;
    private final SecurityAuditService securityAudit;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private Object lastFileKey;
    private long position = -1;
    private final StringBuilder partialLine = new StringBuilder();

    public AuthLogMonitor(BotProperties properties, SecurityAuditService securityAudit, Clock clock) {
        this.properties = properties;
        this.securityAudit = securityAudit;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        BotProperties.AuthLogProperties config = properties.getSecurity().getAuthLog();
        if (!config.isEnabled()) {
            log.debug("[AuthLog] Monitor disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "auth-log-monitor");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = config.getPollInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::safePoll, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[AuthLog] Monitoring {} every {}ms", config.getPath(), intervalMs);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private void safePoll() {
        try {
            poll();
        } catch (Exception e) { // NOSONAR - keep the scheduled task alive
            log.error("[AuthLog] Poll failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Reads lines appended since the previous call and raises one alert per
     * matching line. The first call only records the end of the file.
     */
    synchronized void poll() throws IOException {
        Path path = Path.of(properties.getSecurity().getAuthLog().getPath());
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            log.warn("[AuthLog] {} not found", path);
            return;
        }

        Object fileKey = attributes.fileKey();
        long size = attributes.size();
        if (position < 0) {
            position = size;
            lastFileKey = fileKey;
            log.info("[AuthLog] Starting at offset {}", position);
            return;
        }
        boolean rotated = fileKey != null && !fileKey.equals(lastFileKey);
        if (rotated || size < position) {
            log.warn("[AuthLog] Log rotation detected, reading {} from the start", path);
            position = 0;
            partialLine.setLength(0);
        }
        lastFileKey = fileKey;
        if (size == position) {
            return;
        }

        for (String line : readAppendedLines(path)) {
            parse(line).ifPresent(alert -> securityAudit.alert(alert.title(), alert.message(), alert.severity(),
                    "auth-log"));
        }
    }

    private List<String> readAppendedLines(Path path) throws IOException {
        byte[] chunk;
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            file.seek(position);
            chunk = new byte[(int) Math.min(Integer.MAX_VALUE, file.length() - position)];
            file.readFully(chunk);
            position += chunk.length;
        }

        partialLine.append(new String(chunk, StandardCharsets.UTF_8));
        List<String> lines = new ArrayList<>();
        int newline;
        while ((newline = partialLine.indexOf("\n")) >= 0) {
            lines.add(partialLine.substring(0, newline));
            partialLine.delete(0, newline + 1);
        }
        return lines;
    }

    /**
     * Maps one auth log line to an alert, if it is one of the watched events.
     */
    Optional<Alert> parse(String line) {
        String time = extractTimestamp(line);

        Matcher m = SSH_SUCCESS.matcher(line);
        if (m.find()) {
            return Optional.of(new Alert("SSH Login Detected", sshDetails(m, "✅ Success", time),
                    SecurityEvent.Severity.WARNING));
        }
        m = SSH_FAILED.matcher(line);
        if (m.find()) {
            return Optional.of(new Alert("SSH Login Failed", sshDetails(m, "❌ Failed", time),
                    SecurityEvent.Severity.CRITICAL));
        }
        m = SUDO_COMMAND.matcher(line);
        if (m.find()) {
            String message = "• **User:** `" + m.group(1) + "`\n"
                    + "• **Command:** `" + m.group(2).trim() + "`\n"
                    + "• **Time:** `" + time + "`";
            return Optional.of(new Alert("Sudo Command Executed", message, SecurityEvent.Severity.INFO));
        }
        m = SESSION_OPENED.matcher(line);
        if (m.find()) {
            String user = m.group(1);
            if (properties.getSecurity().getAuthLog().getIgnoredSessionUsers().contains(user)) {
                return Optional.empty();
            }
            String message = "• **User:** `" + user + "`\n"
                    + "• **Time:** `" + time + "`";
            return Optional.of(new Alert("Console Login", message, SecurityEvent.Severity.INFO));
        }
        return Optional.empty();
    }

    private String sshDetails(Matcher m, String status, String time) {
        return "• **User:** `" + m.group(1) + "`\n"
                + "• **IP:** `" + m.group(2) + "`\n"
                + "• **Port:** `" + m.group(3) + "`\n"
                + "• **Status:** " + status + "\n"
                + "• **Time:** `" + time + "`";
    }

    // Syslog lines start with "Nov  7 17:00:00", journald exports with an ISO timestamp
    private String extractTimestamp(String line) {
        String[] parts = line.trim().split("\\s+");
        if (parts.length > 0 && !parts[0].isEmpty() && Character.isDigit(parts[0].charAt(0))
                && parts[0].contains("T")) {
            return parts[0];
        }
        if (parts.length >= 3 && parts[0].length() == 3 && Character.isLetter(parts[0].charAt(0))) {
            return Year.now(clock).getValue() + "-" + parts[0] + "-" + parts[1] + " " + parts[2];
        }
        return clock.instant().toString();
    }

    record Alert(String title, String message, SecurityEvent.Severity severity) {
    }
}
