package me.subaru.bot.adapter.outbound.storage;

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
import me.subaru.bot.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * {@link StoragePort} on the local filesystem.
 *
 * <p>
 * Everything lives below {@code bot.storage.local.base-path}:
 * <ul>
 * <li>sessions/ - one JSON document per user</li>
 * <li>downloads/ - the tracked download jobs</li>
 * </ul>
 * Writes are atomic (temp file, fsync, rename), so a crash leaves either the
 * old or the new document, never a torn one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> KNOWN_DIRECTORIES = List.of("sessions", "downloads");

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final BotProperties properties;

    private Path root;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath()
                .replace("${user.home}", System.getProperty("user.home"));
        root = Path.of(configured).toAbsolutePath().normalize();
        try {
            for (String directory : KNOWN_DIRECTORIES) {
                Files.createDirectories(root.resolve(directory));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create data directory " + root, e);
        }
        log.info("[Storage] Data directory: {}", root);
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = locate(directory, path);
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            Path dir = locate(directory, "");
            if (!Files.isDirectory(dir)) {
                return List.of();
            }
            String namePrefix = prefix != null ? prefix : "";
            try (Stream<Path> entries = Files.list(dir)) {
                return entries
                        .filter(Files::isRegularFile)
                        .map(p -> p.getFileName().toString())
                        .filter(name -> name.startsWith(namePrefix))
                        .filter(name -> !name.endsWith(TEMP_SUFFIX) && !name.endsWith(BACKUP_SUFFIX))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot list " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = locate(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
            try {
                Files.createDirectories(target.getParent());
                Files.write(temp, content.getBytes(StandardCharsets.UTF_8),
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE, StandardOpenOption.SYNC);
                if (backup && Files.exists(target)) {
                    Files.copy(target, target.resolveSibling(target.getFileName() + BACKUP_SUFFIX),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                replace(temp, target);
                log.debug("[Storage] Saved {}/{}", directory, path);
            } catch (IOException e) {
                discard(temp);
                throw new UncheckedIOException("Cannot write " + directory + "/" + path, e);
            }
        });
    }

    private void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Filesystem has no atomic rename, falling back to plain move");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[Storage] Leftover temp file {}: {}", temp, e.getMessage());
        }
    }

    private Path locate(String directory, String path) {
        Path resolved = root.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the data directory: " + directory + "/" + path);
        }
        return resolved;
    }
}
