package me.subaru.bot.domain.model;

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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of commands implemented inside the bot. A {@code builtin} entry of
 * {@code commands.json} must name one of these, otherwise the file is rejected.
 */
public enum BuiltinCommand {
    HELP("help"),
    PING("ping"),
    RELOAD("reload"),
    DISK_USAGE("disk-usage", "espacio", "df"),
    STATUS("status"),
    MAGNET("magnet"),
    MAGNET_CONFIG("magnet-config"),
    MAGNET_LIST("magnet-list"),
    MAGNET_INFO("magnet-info");

    private final List<String> names;

    BuiltinCommand(String... names) {
        this.names = List.of(names);
    }

    public String primaryName() {
        return names.get(0);
    }

    public static Optional<BuiltinCommand> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(command -> command.names.contains(normalized))
                .findFirst();
    }
}
