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

import java.util.List;
import java.util.Objects;

/**
 * One entry of the command table. Immutable; the whole table is replaced on
 * reload.
 */
public record CommandDefinition(
        String token,
        String description,
        List<String> allowedUsers,
        ExecutionKind kind,
        BuiltinCommand builtin,
        String script) {

    public CommandDefinition {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(kind, "kind");
        allowedUsers = allowedUsers != null ? List.copyOf(allowedUsers) : List.of();
        description = description != null ? description : "";
        if (kind == ExecutionKind.BUILTIN && builtin == null) {
            throw new IllegalArgumentException("Builtin command " + token + " has no handler");
        }
        if (kind == ExecutionKind.EXTERNAL_SCRIPT && (script == null || script.isBlank())) {
            throw new IllegalArgumentException("Script command " + token + " has no script");
        }
    }

    public static CommandDefinition builtin(String token, String description, BuiltinCommand builtin,
            List<String> allowedUsers) {
        return new CommandDefinition(token, description, allowedUsers, ExecutionKind.BUILTIN, builtin, null);
    }

    public static CommandDefinition script(String token, String description, String script,
            List<String> allowedUsers) {
        return new CommandDefinition(token, description, allowedUsers, ExecutionKind.EXTERNAL_SCRIPT, null, script);
    }

    public boolean isPublic() {
        return allowedUsers.isEmpty();
    }

    public boolean permits(String userId) {
        return isPublic() || allowedUsers.contains(userId);
    }
}
