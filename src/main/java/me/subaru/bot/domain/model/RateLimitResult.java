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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Outcome of a per-user rate limit check. A denied result carries the time
 * until the next token becomes available.
 */
@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private long remainingTokens;
    private Duration waitTime;

    public static RateLimitResult allowed(long remaining) {
        return RateLimitResult.builder()
                .allowed(true)
                .remainingTokens(remaining)
                .build();
    }

    public static RateLimitResult denied(long waitMs) {
        return RateLimitResult.builder()
                .allowed(false)
                .waitTime(Duration.ofMillis(waitMs))
                .build();
    }
}
