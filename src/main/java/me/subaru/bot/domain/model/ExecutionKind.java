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

import java.util.Locale;
import java.util.Optional;

/**
 * How a command is executed.
 */
public enum ExecutionKind {
    BUILTIN,
    EXTERNAL_SCRIPT;

    /**
     * Maps the {@code type} field of {@code commands.json}; "shell" and
     * "script" both denote an external script.
     */
    public static Optional<ExecutionKind> fromConfigType(String type) {
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
        case "builtin" -> Optional.of(BUILTIN);
        case "shell", "script" -> Optional.of(EXTERNAL_SCRIPT);
        default -> Optional.empty();
        };
    }
}
