package me.subaru.bot.port.outbound;

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

import me.subaru.bot.domain.model.ChatTurn;

import java.util.List;

/**
 * Port for the AI completion backend.
 */
public interface AiPort {

    /**
     * Produces a reply for the request. Blocks until the backend answers.
     *
     * @throws AiBackendException
     *             if the backend fails or rejects the request
     */
    String complete(AiRequest request);

    record AiRequest(
            String apiKey,
            String model,
            String systemPrompt,
            List<ChatTurn> history,
            String userMessage) {

        public AiRequest {
            history = history != null ? List.copyOf(history) : List.of();
        }
    }

    class AiBackendException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public AiBackendException(String message) {
            super(message);
        }

        public AiBackendException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
