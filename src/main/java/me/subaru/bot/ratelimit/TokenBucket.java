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

import java.time.Duration;

/**
 * Token bucket: starts full with {@code capacity} tokens, refills continuously
 * over {@code refillPeriod}, and denies when empty. Refill is computed lazily
 * on each call.
 */
public class TokenBucket {

    private final long capacity;
    private final Duration refillPeriod;
    private long tokens;
    private long lastRefillNanos;

    public TokenBucket(long capacity, Duration refillPeriod) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.refillPeriod = refillPeriod;
        this.tokens = capacity;
        this.lastRefillNanos = System.nanoTime();
    }

    public synchronized RateLimitResult tryConsume() {
        refill(System.nanoTime());

        if (tokens > 0) {
            tokens--;
            return RateLimitResult.allowed(tokens);
        }
        return RateLimitResult.denied(refillPeriod.toNanos() / capacity / 1_000_000);
    }

    public synchronized long availableTokens() {
        refill(System.nanoTime());
        return tokens;
    }

    /**
     * Moves the last refill instant into the past, as if {@code elapsed} had
     * passed. Test hook.
     */
    synchronized void rewind(Duration elapsed) {
        lastRefillNanos -= elapsed.toNanos();
    }

    private void refill(long now) {
        long elapsedNanos = now - lastRefillNanos;
        if (elapsedNanos <= 0) {
            return;
        }

        long tokensToAdd = (elapsedNanos * capacity) / refillPeriod.toNanos();
        if (tokensToAdd > 0) {
            tokens = Math.min(capacity, tokens + tokensToAdd);
            lastRefillNanos = now;
        }
    }
}
