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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entry of {@code users.json}: which AI persona a user may trigger and the
 * credentials the bot uses on the user's behalf.
 *
 * <pre>
 * "@alice:example.org": {
 *   "ai_enabled": true,
 *   "triggers": { "subaru": { "api_key": "...", "model": "...", "system_prompt": "...", "max_history": 20 } },
 *   "realdebrid_api_key": "..."
 * }
 * </pre>
 */
public record UserProfile(
        @JsonProperty("ai_enabled") boolean aiEnabled,
        @JsonProperty("triggers") Map<String, TriggerProfile> triggers,
        @JsonProperty("realdebrid_api_key") String realdebridApiKey) {

    public UserProfile {
        triggers = triggers != null ? new LinkedHashMap<>(triggers) : new LinkedHashMap<>();
    }

    /**
     * The first configured trigger is the active one.
     */
    public Optional<Map.Entry<String, TriggerProfile>> primaryTrigger() {
        return triggers.entrySet().stream().findFirst();
    }

    public record TriggerProfile(
            @JsonProperty("api_key") String apiKey,
            @JsonProperty("model") String model,
            @JsonProperty("system_prompt") String systemPrompt,
            @JsonProperty("max_history") Integer maxHistory) {
    }
}
