package me.subaru.bot.adapter.outbound.llm;

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
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.outbound.AiPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AI backend on top of langchain4j.
 *
 * <p>
 * Each user brings their own API key and model, so chat models are built per
 * (provider, key, model) and cached. {@code bot.ai.provider=anthropic} uses the
 * Anthropic API; anything else goes through the OpenAI-compatible client
 * pointed at {@code bot.ai.base-url} (Gemini's OpenAI endpoint by default).
 *
 * <p>
 * Retries are disabled in the client; a failed exchange is reported to the user
 * and leaves the history untouched.
 */
@Component
@Slf4j
public class Langchain4jAiAdapter implements AiPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final int MAX_CACHED_MODELS = 64;

    private final BotProperties properties;
    private final Map<ModelKey, ChatModel> models = new ConcurrentHashMap<>();

    public Langchain4jAiAdapter(BotProperties properties) {
        this.properties = properties;
    }

    @Override
    public String complete(AiRequest request) {
        ChatModel model = resolveModel(request);
        List<ChatMessage> messages = buildMessages(request);
        try {
            ChatResponse response = model.chat(messages);
            AiMessage aiMessage = response.aiMessage();
            String text = aiMessage != null ? aiMessage.text() : null;
            if (text == null || text.isBlank()) {
                throw new AiBackendException("Empty response from model " + request.model());
            }
            return text.strip();
        } catch (AiBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[AI] {} call failed: {}", request.model(), e.getMessage());
            throw new AiBackendException(e.getMessage(), e);
        }
    }

    /**
     * System prompt, then the stored turns oldest first, then the new message.
     */
    static List<ChatMessage> buildMessages(AiRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }
        for (ChatTurn turn : request.history()) {
            switch (turn.role()) {
            case USER -> messages.add(UserMessage.from(turn.text()));
            case ASSISTANT -> messages.add(AiMessage.from(turn.text()));
            }
        }
        messages.add(UserMessage.from(request.userMessage()));
        return messages;
    }

    private ChatModel resolveModel(AiRequest request) {
        BotProperties.AiProperties ai = properties.getAi();
        ModelKey key = new ModelKey(ai.getProvider(), request.apiKey(), request.model());
        if (models.size() >= MAX_CACHED_MODELS && !models.containsKey(key)) {
            models.clear();
        }
        return models.computeIfAbsent(key, k -> createModel(k, ai));
    }

    private ChatModel createModel(ModelKey key, BotProperties.AiProperties ai) {
        log.debug("[AI] Creating {} model {}", key.provider(), key.model());
        if (PROVIDER_ANTHROPIC.equalsIgnoreCase(key.provider())) {
            // bot.ai.base-url targets the OpenAI-compatible client only
            return AnthropicChatModel.builder()
                    .apiKey(key.apiKey())
                    .modelName(key.model())
                    .maxRetries(0)
                    .maxTokens(4096)
                    .timeout(ai.getTimeout())
                    .build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(key.apiKey())
                .modelName(key.model())
                .maxRetries(0)
                .timeout(ai.getTimeout());
        if (ai.getBaseUrl() != null && !ai.getBaseUrl().isBlank()) {
            builder.baseUrl(ai.getBaseUrl());
        }
        return builder.build();
    }

    private record ModelKey(String provider, String apiKey, String model) {
        @Override
        public String toString() {
            return provider + "/" + model;
        }
    }
}
