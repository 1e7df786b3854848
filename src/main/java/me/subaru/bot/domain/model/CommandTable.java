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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the runtime configuration: command definitions keyed
 * by lower-cased token, and user profiles keyed by user id.
 */
public record CommandTable(
        Map<String, CommandDefinition> commands,
        Map<String, UserProfile> users,
        Instant loadedAt) {

    public CommandTable {
        commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands != null ? commands : Map.of()));
        users = Collections.unmodifiableMap(new LinkedHashMap<>(users != null ? users : Map.of()));
    }

    public static CommandTable empty() {
        return new CommandTable(Map.of(), Map.of(), Instant.EPOCH);
    }

    public Optional<CommandDefinition> find(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(commands.get(token.toLowerCase(Locale.ROOT)));
    }

    public Optional<UserProfile> profile(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    public List<CommandDefinition> visibleTo(String userId) {
        return commands.values().stream()
                .filter(definition -> definition.permits(userId))
                .toList();
    }
}
