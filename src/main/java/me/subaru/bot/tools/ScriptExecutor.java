package me.subaru.bot.tools;

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

import me.subaru.bot.infrastructure.config.BotProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external scripts for script-backed commands.
 *
 * <p>
 * Security and resource limits:
 * <ul>
 * <li>Hard timeout; on expiry the process and all its descendants are killed
 * and reaped</li>
 * <li>Arguments are passed as positional parameters ({@code "$@"}), never
 * spliced into the command string</li>
 * <li>Captured output is capped at {@value #MAX_CAPTURE_CHARS} characters per
 * stream</li>
 * </ul>
 */
@Component
@Slf4j
public class ScriptExecutor {

    static final int MAX_CAPTURE_CHARS = 100_000;
    private static final long REAP_TIMEOUT_SECONDS = 5;

    private final Path workingDirectory;
    private final ExecutorService executor;

    public ScriptExecutor(BotProperties properties) {
        this.workingDirectory = Paths.get(properties.getCommands().getWorkingDirectory()).toAbsolutePath()
                .normalize();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "script-output-reader");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Runs {@code script} through {@code /bin/sh -c} with {@code args} as
     * positional parameters.
     */
    public ScriptResult runScript(String script, List<String> args, Duration timeout) {
        List<String> command = new ArrayList<>(List.of("/bin/sh", "-c", script + " \"$@\"", "sh"));
        if (args != null) {
            command.addAll(args);
        }
        return run(command, timeout);
    }

    /**
     * Runs a program directly, without a shell.
     */
    public ScriptResult run(List<String> command, Duration timeout) {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDirectory.toFile());

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("[Script] Failed to start {}: {}", command, e.getMessage());
            return ScriptResult.startFailed(e.getMessage());
        }

        Future<String> stdoutFuture = executor.submit(() -> readStream(process.getInputStream()));
        Future<String> stderrFuture = executor.submit(() -> readStream(process.getErrorStream()));

        try {
            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long duration = System.currentTimeMillis() - startTime;

            if (!completed) {
                killTree(process);
                log.warn("[Script] Timed out after {}ms: {}", timeout.toMillis(), command);
                return ScriptResult.timedOut(duration, collect(stdoutFuture), collect(stderrFuture));
            }

            String stdout = collect(stdoutFuture);
            String stderr = collect(stderrFuture);
            log.debug("[Script] Exit {} in {}ms: {}", process.exitValue(), duration, command);
            return ScriptResult.completed(process.exitValue(), stdout, stderr, duration);
        } catch (InterruptedException e) {
            killTree(process);
            Thread.currentThread().interrupt();
            return ScriptResult.startFailed("Interrupted");
        }
    }

    private void killTree(Process process) {
        List<ProcessHandle> descendants = process.descendants().toList();
        descendants.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(REAP_TIMEOUT_SECONDS);
        try {
            if (!process.waitFor(REAP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.error("[Script] Process {} did not exit after kill", process.pid());
            }
            for (ProcessHandle child : descendants) {
                long remaining = Math.max(0, deadline - System.nanoTime());
                child.onExit().get(remaining, TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException e) {
            log.error("[Script] Descendants of {} still alive after kill", process.pid());
        } catch (ExecutionException e) {
            log.warn("[Script] Could not confirm exit of descendants of {}: {}", process.pid(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private String collect(Future<String> future) {
        try {
            return future.get(1, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return "";
        } catch (ExecutionException e) {
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        }
    }

    private String readStream(InputStream stream) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_CAPTURE_CHARS) {
                    output.append(line).append("\n");
                }
                line = reader.readLine();
            }
        }
        return output.toString();
    }

    public record ScriptResult(Outcome outcome, int exitCode, String stdout, String stderr, long durationMs,
            String error) {

        public enum Outcome {
            COMPLETED, TIMED_OUT, START_FAILED
        }

        static ScriptResult completed(int exitCode, String stdout, String stderr, long durationMs) {
            return new ScriptResult(Outcome.COMPLETED, exitCode, stdout, stderr, durationMs, null);
        }

        static ScriptResult timedOut(long durationMs, String stdout, String stderr) {
            return new ScriptResult(Outcome.TIMED_OUT, -1, stdout, stderr, durationMs, "timeout");
        }

        static ScriptResult startFailed(String error) {
            return new ScriptResult(Outcome.START_FAILED, -1, "", "", 0, error);
        }

        public boolean isSuccess() {
            return outcome == Outcome.COMPLETED && exitCode == 0;
        }
    }
}
