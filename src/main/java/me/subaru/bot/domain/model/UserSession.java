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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-user state owned by the session store: AI conversation history, AI
 * settings, debrid credentials and usage counters.
 *
 * <p>
 * History is a bounded FIFO: {@link #appendTurn(ChatTurn)} evicts the oldest
 * entries so that it never holds more than {@code maxHistory} turns. There is
 * no other mutator for the history list.
 *
 * <p>
 * Instances are not thread-safe; callers mutate them only under the per-user
 * lock held by {@code SessionService}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserSession {

    public static final int DEFAULT_MAX_HISTORY = 20;

    private String userId;

    private boolean aiEnabled;
    private String trigger;
    private String aiApiKey;
    private String model;
    private String systemPrompt;

    @Builder.Default
    private int maxHistory = DEFAULT_MAX_HISTORY;

    private String debridApiKey;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private List<ChatTurn> history = new ArrayList<>();

    private long messageCount;
    private long aiExchangeCount;
    private long commandCount;

    private Instant createdAt;
    private Instant updatedAt;

    public List<ChatTurn> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Replaces the history (used when loading from storage) and trims it to the
     * configured maximum.
     */
    public void setHistory(List<ChatTurn> turns) {
        this.history = new ArrayList<>();
        if (turns != null) {
            turns.forEach(this::appendTurn);
        }
    }

    public void appendTurn(ChatTurn turn) {
        history.add(turn);
        trimHistory();
    }

    /**
     * Changes the maximum and evicts the oldest turns if the history is now too
     * long.
     */
    public void setMaxHistory(int maxHistory) {
        this.maxHistory = Math.max(0, maxHistory);
        if (history != null) {
            trimHistory();
        }
    }

    /**
     * Returns up to {@code limit} most recent turns, oldest first.
     */
    public List<ChatTurn> recentHistory(int limit) {
        int from = Math.max(0, history.size() - Math.max(0, limit));
        return List.copyOf(history.subList(from, history.size()));
    }

    public void recordInboundMessage() {
        messageCount++;
    }

    public void recordAiExchange() {
        aiExchangeCount++;
    }

    public void recordCommand() {
        commandCount++;
    }

    public boolean hasDebridKey() {
        return debridApiKey != null && !debridApiKey.isBlank();
    }

    /**
     * Detached deep copy for readers outside the session lock.
     */
    public UserSession copy() {
        UserSession copy = toBuilder().build();
        copy.history = new ArrayList<>(history);
        return copy;
    }

    private void trimHistory() {
        while (history.size() > maxHistory) {
            history.remove(0);
        }
    }
}
