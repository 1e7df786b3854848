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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for {@code POST /webhook/notify}. Priority is {@code high},
 * {@code medium} or {@code low}; anything else renders as low.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotifyRequest {

    @Builder.Default
    private String title = "Notification";

    private String message;

    @Builder.Default
    private String priority = "normal";

    @JsonProperty("room_id")
    private String roomId;
}
