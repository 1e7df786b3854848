package me.subaru.bot.domain.service;

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
import me.subaru.bot.domain.model.UserSession;
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.outbound.AiPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Answers chat messages that mention the user's trigger phrase.
 *
 * <p>
 * A message qualifies when the sender has AI enabled and the text contains the
 * trigger (case-insensitive). The request carries the user's system prompt,
 * the most recent history and the new message. History is appended only after
 * a successful answer; timeouts and backend errors produce a user-visible
 * error text and leave the session untouched.
 *
 * <p>
 * Callers must not invoke {@link #respond(String, String)} concurrently for the
 * same user; the dispatcher runs each user's messages on a serial runner.
 */
@Service
@Slf4j
public class AiTriggerHandler {

    static final String NOT_CONFIGURED = "⚠️ AI is not configured for your user. Ask an administrator to set an API key.";
    static final String TIMEOUT = "⏱️ The AI took too long to answer. Please try again later.";

    private final SessionService sessionService;
    private final AiPort aiPort;
    private final BotProperties properties;
    private final Clock clock;
    private final ExecutorService aiExecutor;

    public AiTriggerHandler(SessionService sessionService, AiPort aiPort, BotProperties properties, Clock clock) {
        this.sessionService = sessionService;
        this.aiPort = aiPort;
        this.properties = properties;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.aiExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ai-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        aiExecutor.shutdownNow();
    }

    public boolean isTriggered(String userId, String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        UserSession session = sessionService.getOrCreate(userId);
        if (!session.isAiEnabled()) {
            return false;
        }
        String trigger = session.getTrigger() != null && !session.getTrigger().isBlank()
                ? session.getTrigger()
                : properties.getAi().getDefaultTrigger();
        return text.toLowerCase(Locale.ROOT).contains(trigger.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the AI reply (or an error text) when the message triggers the AI,
     * otherwise empty.
     */
    public Optional<String> maybeRespond(String userId, String text) {
        if (!isTriggered(userId, text)) {
            return Optional.empty();
        }
        return Optional.of(respond(userId, text));
    }

    /**
     * Sends the message to the AI backend and records the exchange on success.
     */
    public String respond(String userId, String text) {
        UserSession session = sessionService.snapshot(userId);
        if (!hasUsableKey(session.getAiApiKey())) {
            log.warn("[AI] No API key configured for {}", userId);
            return NOT_CONFIGURED;
        }

        AiPort.AiRequest request = new AiPort.AiRequest(
                session.getAiApiKey(),
                session.getModel() != null ? session.getModel() : properties.getAi().getDefaultModel(),
                session.getSystemPrompt() != null ? session.getSystemPrompt()
                        : properties.getAi().getDefaultSystemPrompt(),
                session.recentHistory(session.getMaxHistory()),
                text);

        Instant askedAt = clock.instant();
        Duration timeout = properties.getAi().getTimeout();
        Future<String> call = aiExecutor.submit(() -> aiPort.complete(request));
        String reply;
        try {
            reply = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("[AI] Request for {} timed out after {}s", userId, timeout.toSeconds());
            return TIMEOUT;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[AI] Request for {} failed: {}", userId, cause.getMessage());
            return "❌ AI error: " + cause.getMessage();
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return TIMEOUT;
        }

        if (reply == null || reply.isBlank()) {
            log.warn("[AI] Empty reply for {}", userId);
            return "❌ AI error: empty response";
        }

        String answer = reply.strip();
        sessionService.update(userId, live -> {
            live.appendTurn(ChatTurn.user(text, askedAt));
            live.appendTurn(ChatTurn.assistant(answer, clock.instant()));
            live.recordAiExchange();
            return null;
        });
        log.info("[AI] Answered {} ({} chars)", userId, answer.length());
        return answer;
    }

    private boolean hasUsableKey(String apiKey) {
        return apiKey != null && !apiKey.isBlank() && !apiKey.startsWith("YOUR_");
    }
}
