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

import me.subaru.bot.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Authenticates inbound webhook requests.
 *
 * <p>
 * {@code /webhook/*} accepts {@code Authorization: Bearer <token>} or the
 * {@code X-Subaru-Token} header when {@code bot.webhook.token} is set. The
 * Discord-compatible endpoint carries its secret in the URL path and is checked
 * against {@code bot.webhook.discord-token}. A blank secret leaves the
 * endpoint open, which matches deployments reachable only over a private
 * network.
 *
 * <p>
 * All comparisons are constant-time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String CUSTOM_HEADER = "X-Subaru-Token";

    private final BotProperties properties;

    /**
     * @return {@code true} if no token is configured or the request carries the
     *         configured token
     */
    public boolean authenticateBearer(HttpHeaders headers) {
        String expected = properties.getWebhook().getToken();
        if (expected == null || expected.isBlank()) {
            return true;
        }

        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            return constantTimeEquals(expected, authHeader.substring(BEARER_PREFIX.length()));
        }

        String customToken = headers.getFirst(CUSTOM_HEADER);
        if (customToken != null) {
            return constantTimeEquals(expected, customToken);
        }

        log.debug("[Webhook] No authentication token found in request headers");
        return false;
    }

    /**
     * Checks the token segment of {@code /api/webhooks/{id}/{token}}.
     */
    public boolean authenticateDiscordToken(String token) {
        String expected = properties.getWebhook().getDiscordToken();
        if (expected == null || expected.isBlank()) {
            return true;
        }
        return token != null && constantTimeEquals(expected, token);
    }

    private boolean constantTimeEquals(String expected, String provided) {
        byte[] expectedBytes = expected.getBytes(StandardCharsets.UTF_8);
        byte[] providedBytes = provided.getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expectedBytes, providedBytes);
    }
}
