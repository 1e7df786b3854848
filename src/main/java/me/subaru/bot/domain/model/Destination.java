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

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Target of an outbound message: a room, or a user reached through a direct
 * message room. Outbound ordering is guaranteed per destination.
 */
public record Destination(Kind kind, String id) {

    private static final Pattern USER_ID = Pattern.compile("^@[^:\\s]+:[^\\s]+$");

    public enum Kind {
        ROOM, USER
    }

    public Destination {
        Objects.requireNonNull(kind, "kind");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Destination id must not be blank");
        }
    }

    public static Destination room(String roomId) {
        return new Destination(Kind.ROOM, roomId);
    }

    public static Destination user(String userId) {
        return new Destination(Kind.USER, userId);
    }

    /**
     * Returns whether the value looks like a fully qualified Matrix user id
     * ({@code @localpart:server}).
     */
    public static boolean isUserId(String value) {
        return value != null && USER_ID.matcher(value).matches();
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + id;
    }
}
