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
import java.util.List;

/**
 * Payload received on the Discord-compatible endpoint
 * {@code /api/webhooks/{id}/{token}}. The {@code pathId} is already URL-decoded;
 * when it is a Matrix user id the message becomes a direct message.
 */
public record DiscordWebhookEvent(
        String pathId,
        String username,
        String content,
        List<Embed> embeds,
        Instant arrivedAt) implements InboundEvent {

    public DiscordWebhookEvent {
        embeds = embeds != null ? List.copyOf(embeds) : List.of();
    }

    @Override
    public EventType type() {
        return EventType.WEBHOOK_DISCORD;
    }

    @Override
    public String source() {
        return "discord-webhook";
    }

    public record Embed(String title, String description, List<Field> fields) {
        public Embed {
            fields = fields != null ? List.copyOf(fields) : List.of();
        }
    }

    public record Field(String name, String value) {
    }
}
