package me.subaru.bot.port.outbound;

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
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage inside the bot's data directory. Files are
 * organized by directory ({@code sessions}, {@code downloads}).
 */
public interface StoragePort {

    /**
     * Read text content from file. Completes with {@code null} when the file does
     * not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Names of the stored files in a directory whose name starts with
     * {@code prefix}. Temporary and backup files are not listed.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Crash-safe write: the content goes to a {@code .tmp} sibling, is synced,
     * and then renamed over the target. With {@code backup} the previous version
     * is kept as {@code .bak}.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
