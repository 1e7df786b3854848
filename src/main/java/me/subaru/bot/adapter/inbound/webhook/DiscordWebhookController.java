package me.subaru.bot.adapter.inbound.webhook;

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

import me.subaru.bot.adapter.inbound.webhook.dto.DiscordWebhookRequest;
import me.subaru.bot.domain.loop.EventRejectedException;
import me.subaru.bot.domain.model.DiscordWebhookEvent;
import me.subaru.bot.domain.service.SecurityAuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

/**
 * Discord-compatible execute-webhook endpoint.
 *
 * <p>
 * {@code POST /api/webhooks/{id}/{token}} answers {@code 204} like Discord
 * does. When {@code id} decodes to a Matrix user id ({@code @alice:example.org})
 * the message is delivered as a direct message, otherwise it goes to the
 * default room.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class DiscordWebhookController {

    private final WebhookAuthenticator authenticator;
    private final SecurityAuditService securityAudit;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @PostMapping("/{id}/{token}")
    public Mono<ResponseEntity<Void>> execute(
            @PathVariable String id,
            @PathVariable String token,
            @RequestBody DiscordWebhookRequest request) {

        return Mono.fromCallable(() -> {
            String pathId = decode(id);
            if (!authenticator.authenticateDiscordToken(token)) {
                securityAudit.webhookTokenRejected(pathId);
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED).<Void>build();
            }
            if (request.isEmpty()) {
                return ResponseEntity.badRequest().<Void>build();
            }

            DiscordWebhookEvent event = new DiscordWebhookEvent(pathId, request.getUsername(),
                    request.getContent(), toEmbeds(request.getEmbeds()), clock.instant());
            try {
                eventPublisher.publishEvent(event);
            } catch (EventRejectedException e) {
                log.warn("[Webhook] Discord payload for {} rejected: {}", pathId, e.getMessage());
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<Void>build();
            }
            log.debug("[Webhook] Discord payload accepted for {}", pathId);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    // Path variables arrive decoded once; some senders encode the id twice.
    static String decode(String id) {
        if (id == null || !id.contains("%")) {
            return id;
        }
        try {
            return UriUtils.decode(id, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return id;
        }
    }

    private List<DiscordWebhookEvent.Embed> toEmbeds(List<DiscordWebhookRequest.Embed> embeds) {
        if (embeds == null) {
            return List.of();
        }
        return embeds.stream()
                .map(embed -> new DiscordWebhookEvent.Embed(embed.getTitle(), embed.getDescription(),
                        embed.getFields() == null ? List.of()
                                : embed.getFields().stream()
                                        .map(field -> new DiscordWebhookEvent.Field(field.getName(),
                                                field.getValue()))
                                        .toList()))
                .toList();
    }
}
