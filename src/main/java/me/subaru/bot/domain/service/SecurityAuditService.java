package me.subaru.bot.domain.service;

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

import me.subaru.bot.domain.model.SecurityEvent;
import me.subaru.bot.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Single entry point for security-relevant observations. Each observation is
 * logged and published as a {@link SecurityEvent}, which the dispatcher always
 * delivers to the audit room.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecurityAuditService {

    private final ApplicationEventPublisher eventPublisher;
    private final BotProperties properties;
    private final Clock clock;

    public void permissionDenied(String userId, String token, String roomId) {
        log.warn("[Security] Unauthorized: {} tried '{}' in {}", userId, token, roomId);
        alert("Unauthorized command attempt",
                "• **User:** `" + userId + "`\n• **Command:** `" + token + "`\n• **Room:** " + roomId,
                SecurityEvent.Severity.WARNING, "command-router");
    }

    public void webhookTokenRejected(String pathId) {
        log.warn("[Security] Discord webhook rejected: bad token for id {}", pathId);
        alert("Webhook token rejected",
                "A request to `/api/webhooks/" + pathId + "/…` carried an invalid token.",
                SecurityEvent.Severity.WARNING, "webhook");
    }

    public void commandExecuted(String userId, String token, String roomId) {
        log.info("[Security] Command: {} executed '{}' in {}", userId, token, roomId);
        if (properties.getSecurity().isAuditCommands()) {
            alert("Command executed",
                    "• **User:** `" + userId + "`\n• **Command:** `" + token + "`\n• **Room:** " + roomId,
                    SecurityEvent.Severity.INFO, "command-router");
        }
    }

    public void alert(String title, String message, SecurityEvent.Severity severity, String origin) {
        if (severity == SecurityEvent.Severity.CRITICAL) {
            log.error("[Security] Alert: {}", title);
        } else if (severity == SecurityEvent.Severity.WARNING) {
            log.warn("[Security] Alert: {}", title);
        } else {
            log.info("[Security] Alert: {}", title);
        }
        eventPublisher.publishEvent(new SecurityEvent(title, message, severity, origin, clock.instant()));
    }
}
