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
 * Security-relevant observation (denied command, rejected webhook token, login
 * seen in the auth log). Always delivered to the audit room.
 */
public record SecurityEvent(String title, String message, Severity severity, String origin, Instant arrivedAt)
        implements InboundEvent {

    public enum Severity {
        INFO("ℹ️"), WARNING("⚠️"), CRITICAL("🚨");

        private final String marker;

        Severity(String marker) {
            this.marker = marker;
        }

        public String marker() {
            return marker;
        }
    }

    @Override
    public EventType type() {
        return EventType.SECURITY_EVENT;
    }

    @Override
    public String source() {
        return origin != null ? origin : "security";
    }
}
