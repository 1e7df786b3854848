package me.subaru.bot.ratelimit;

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

import me.subaru.bot.domain.model.RateLimitResult;
import me.subaru.bot.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user limit on chat-triggered work (AI requests and commands), default
 * 20 per minute. Webhook, job and security traffic is never limited here.
 *
 * <p>
 * Can be disabled via {@code bot.rate-limit.enabled=false}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserRateLimiter {

    private final BotProperties properties;

    private final Map<String, ConfiguredBucket> buckets = new ConcurrentHashMap<>();

    public RateLimitResult tryConsume(String userId) {
        BotProperties.RateLimitProperties config = properties.getRateLimit();
        if (!config.isEnabled()) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }

        TokenBucket bucket = resolveBucket(userId, config.getUserMessagesPerMinute(), Duration.ofMinutes(1));
        RateLimitResult result = bucket.tryConsume();
        if (!result.isAllowed()) {
            log.debug("[RateLimit] {} exceeded {} per minute", userId, config.getUserMessagesPerMinute());
        }
        return result;
    }

    private TokenBucket resolveBucket(String key, int capacity, Duration refillPeriod) {
        ConfiguredBucket configured = buckets.compute(key, (bucketKey, existing) -> {
            if (existing == null || existing.capacity() != capacity) {
                return new ConfiguredBucket(new TokenBucket(capacity, refillPeriod), capacity);
            }
            return existing;
        });
        return configured.bucket();
    }

    private record ConfiguredBucket(TokenBucket bucket, int capacity) {
    }
}
