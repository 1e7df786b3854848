package me.subaru.bot.adapter.inbound.webhook.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Subset of the Discord execute-webhook payload. Tools that only know how to
 * talk to Discord (backup scripts, Uptime Kuma, Grafana) send this shape.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscordWebhookRequest {

    private String content;

    private String username;

    @Builder.Default
    private List<Embed> embeds = new ArrayList<>();

    public boolean isEmpty() {
        boolean noContent = content == null || content.isBlank();
        boolean noEmbeds = embeds == null || embeds.isEmpty();
        return noContent && noEmbeds;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Embed {
        private String title;
        private String description;

        @Builder.Default
        private List<Field> fields = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Field {
        private String name;
        private String value;
    }
}
