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

import me.subaru.bot.adapter.inbound.webhook.dto.LogRequest;
import me.subaru.bot.adapter.inbound.webhook.dto.MessageRequest;
import me.subaru.bot.adapter.inbound.webhook.dto.NotifyRequest;
import me.subaru.bot.adapter.inbound.webhook.dto.WebhookResponse;
import me.subaru.bot.domain.loop.EventRejectedException;
import me.subaru.bot.domain.model.InboundEvent;
import me.subaru.bot.domain.model.WebhookMessageEvent;
import me.subaru.bot.domain.model.WebhookNotifyEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Generic notification intake (WebFlux).
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>{@code GET /webhook/health} - liveness check</li>
 * <li>{@code POST /webhook/message} - plain text to a room</li>
 * <li>{@code POST /webhook/log} - log line with level and source</li>
 * <li>{@code POST /webhook/notify} - titled notification with a priority
 * marker</li>
 * </ul>
 *
 * <p>
 * Every accepted request becomes an {@link InboundEvent} published to the
 * dispatcher. A full dispatcher queue answers {@code 503}.
 */
@RestController
@RequestMapping("/webhook")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final WebhookAuthenticator authenticator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @GetMapping("/health")
    public Mono<ResponseEntity<WebhookResponse>> health() {
        return Mono.just(ResponseEntity.ok(WebhookResponse.ok()));
    }

    @PostMapping("/message")
    public Mono<ResponseEntity<WebhookResponse>> message(
            @RequestBody MessageRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            if (!authenticator.authenticateBearer(headers)) {
                return unauthorized();
            }
            if (request.getMessage() == null || request.getMessage().isBlank()) {
                return badRequest("Missing 'message' field");
            }
            return publish(new WebhookMessageEvent(request.getRoomId(), request.getMessage(), now()));
        });
    }

    @PostMapping("/log")
    public Mono<ResponseEntity<WebhookResponse>> logEntry(
            @RequestBody LogRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            if (!authenticator.authenticateBearer(headers)) {
                return unauthorized();
            }
            String message = request.getMessage() != null ? request.getMessage() : "";
            return publish(WebhookNotifyEvent.log(request.getRoomId(), request.getSource(), message,
                    request.getLevel(), now()));
        });
    }

    @PostMapping("/notify")
    public Mono<ResponseEntity<WebhookResponse>> notify(
            @RequestBody NotifyRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            if (!authenticator.authenticateBearer(headers)) {
                return unauthorized();
            }
            String message = request.getMessage() != null ? request.getMessage() : "";
            return publish(WebhookNotifyEvent.notify(request.getRoomId(), request.getTitle(), message,
                    request.getPriority(), now()));
        });
    }

    private ResponseEntity<WebhookResponse> publish(InboundEvent event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (EventRejectedException e) {
            log.warn("[Webhook] {} rejected: {}", event.type(), e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(WebhookResponse.error(e.getMessage()));
        }
        log.debug("[Webhook] {} accepted", event.type());
        return ResponseEntity.ok(WebhookResponse.ok());
    }

    private Instant now() {
        return clock.instant();
    }

    private ResponseEntity<WebhookResponse> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(WebhookResponse.error("Unauthorized"));
    }

    private ResponseEntity<WebhookResponse> badRequest(String message) {
        return ResponseEntity.badRequest()
                .body(WebhookResponse.error(message));
    }
}
