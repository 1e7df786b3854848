package me.subaru.bot.security;

import me.subaru.bot.domain.model.SecurityEvent;
import me.subaru.bot.domain.service.SecurityAuditService;
import me.subaru.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AuthLogMonitorTest {

    private static final String SSH_ACCEPTED =
            "Mar  1 10:00:00 host sshd[123]: Accepted publickey for alice from 1.2.3.4 port 5555 ssh2";
    private static final String SSH_FAILED =
            "Mar  1 10:00:01 host sshd[124]: Failed password for invalid user admin from 5.6.7.8 port 2222 ssh2";
    private static final String SUDO =
            "Mar  1 10:00:02 host sudo:    alice : TTY=pts/0 ; PWD=/home/alice ; USER=root ; COMMAND=/bin/ls -la";
    private static final String CONSOLE =
            "Mar  1 10:00:03 host systemd-logind[77]: New session 3 of user bob.";

    @TempDir
    Path tempDir;

    private BotProperties properties;
    private SecurityAuditService securityAudit;
    private AuthLogMonitor monitor;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        securityAudit = mock(SecurityAuditService.class);
        monitor = new AuthLogMonitor(properties, securityAudit,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldReportSuccessfulSshLoginAsWarning() {
        AuthLogMonitor.Alert alert = monitor.parse(SSH_ACCEPTED).orElseThrow();

        assertEquals("SSH Login Detected", alert.title());
        assertEquals(SecurityEvent.Severity.WARNING, alert.severity());
        assertTrue(alert.message().contains("`alice`"));
        assertTrue(alert.message().contains("`1.2.3.4`"));
        assertTrue(alert.message().contains("`5555`"));
        assertTrue(alert.message().contains("2026-Mar-1 10:00:00"));
    }

    @Test
    void shouldReportFailedSshLoginAsCritical() {
        AuthLogMonitor.Alert alert = monitor.parse(SSH_FAILED).orElseThrow();

        assertEquals("SSH Login Failed", alert.title());
        assertEquals(SecurityEvent.Severity.CRITICAL, alert.severity());
        assertTrue(alert.message().contains("`admin`"));
    }

    @Test
    void shouldReportSudoCommand() {
        AuthLogMonitor.Alert alert = monitor.parse(SUDO).orElseThrow();

        assertEquals("Sudo Command Executed", alert.title());
        assertEquals(SecurityEvent.Severity.INFO, alert.severity());
        assertTrue(alert.message().contains("`/bin/ls -la`"));
    }

    @Test
    void shouldReportConsoleLoginExceptIgnoredUsers() {
        assertEquals("Console Login", monitor.parse(CONSOLE).orElseThrow().title());
        assertTrue(monitor.parse(CONSOLE.replace("bob", "root")).isEmpty());
    }

    @Test
    void shouldIgnoreUnrelatedLines() {
        Optional<AuthLogMonitor.Alert> alert = monitor.parse("Mar  1 10:00:04 host CRON[1]: pam_unix(cron:session)");

        assertTrue(alert.isEmpty());
    }

    @Test
    void shouldAlertOnlyForAppendedLines() throws IOException {
        Path authLog = tempDir.resolve("auth.log");
        Files.writeString(authLog, SSH_ACCEPTED + "\n", StandardCharsets.UTF_8);
        properties.getSecurity().getAuthLog().setPath(authLog.toString());

        monitor.poll();
        verifyNoInteractions(securityAudit);

        append(authLog, SSH_FAILED + "\n" + "noise\n");
        monitor.poll();

        verify(securityAudit).alert(eq("SSH Login Failed"), contains("admin"),
                eq(SecurityEvent.Severity.CRITICAL), eq("auth-log"));
        verifyNoMoreInteractions(securityAudit);
    }

    @Test
    void shouldWaitForCompleteLine() throws IOException {
        Path authLog = tempDir.resolve("auth.log");
        Files.writeString(authLog, "", StandardCharsets.UTF_8);
        properties.getSecurity().getAuthLog().setPath(authLog.toString());
        monitor.poll();

        append(authLog, SUDO.substring(0, 40));
        monitor.poll();
        verifyNoInteractions(securityAudit);

        append(authLog, SUDO.substring(40) + "\n");
        monitor.poll();
        verify(securityAudit).alert(eq("Sudo Command Executed"), anyString(), eq(SecurityEvent.Severity.INFO),
                eq("auth-log"));
    }

    @Test
    void shouldRestartFromBeginningAfterTruncation() throws IOException {
        Path authLog = tempDir.resolve("auth.log");
        Files.writeString(authLog, SSH_ACCEPTED + "\n" + SSH_FAILED + "\n", StandardCharsets.UTF_8);
        properties.getSecurity().getAuthLog().setPath(authLog.toString());
        monitor.poll();

        Files.writeString(authLog, CONSOLE + "\n", StandardCharsets.UTF_8, StandardOpenOption.TRUNCATE_EXISTING);
        monitor.poll();

        verify(securityAudit).alert(eq("Console Login"), contains("bob"), eq(SecurityEvent.Severity.INFO),
                eq("auth-log"));
    }

    @Test
    void shouldSkipMissingFile() {
        properties.getSecurity().getAuthLog().setPath(tempDir.resolve("missing.log").toString());

        assertDoesNotThrow(() -> monitor.poll());
        verifyNoInteractions(securityAudit);
    }

    private static void append(Path file, String text) throws IOException {
        Files.writeString(file, text, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    }
}
