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

/**
 * Structured notification pushed through {@code /webhook/notify} or
 * {@code /webhook/log}.
 *
 * <p>
 * For {@link Style#NOTIFY} the heading is the title and the severity is the
 * priority (high, medium, low). For {@link Style#LOG} the heading is the
 * reporting source and the severity is the log level.
 */
public record WebhookNotifyEvent(
        Style style,
        String roomId,
        String heading,
        String message,
        String severity,
        Instant arrivedAt) implements InboundEvent {

    public enum Style {
        NOTIFY, LOG
    }

    public static WebhookNotifyEvent notify(String roomId, String title, String message, String priority,
            Instant arrivedAt) {
        return new WebhookNotifyEvent(Style.NOTIFY, roomId, title, message, priority, arrivedAt);
    }

    public static WebhookNotifyEvent log(String roomId, String source, String message, String level,
            Instant arrivedAt) {
        return new WebhookNotifyEvent(Style.LOG, roomId, source, message, level, arrivedAt);
    }

    @Override
    public EventType type() {
        return EventType.WEBHOOK_NOTIFY;
    }

    @Override
    public String source() {
        return "webhook";
    }
}
