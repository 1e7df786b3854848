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

import me.subaru.bot.domain.model.CommandTable;
import me.subaru.bot.domain.model.ConfigReloadedEvent;
import me.subaru.bot.domain.model.UserProfile;
import me.subaru.bot.domain.model.UserSession;
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Session store: per-user state cached in memory and persisted as one JSON
 * document per user under {@code sessions/}.
 *
 * <p>
 * Every mutation goes through {@link #update(String, Function)}, which holds the
 * user's lock while the mutation runs and the session is written back. Readers
 * that need a consistent view outside the lock use {@link #snapshot(String)}.
 *
 * <p>
 * New sessions are seeded from the user's profile in the current command table;
 * after every successful config reload the AI settings of cached sessions are
 * refreshed from their profiles.
 */
@Service
@Slf4j
public class SessionService {

    static final String SESSIONS_DIR = "sessions";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ConfigRegistry configRegistry;
    private final BotProperties properties;
    private final Clock clock;

    private final Map<String, UserSession> sessionCache = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public SessionService(StoragePort storagePort, ObjectMapper objectMapper, ConfigRegistry configRegistry,
            BotProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.configRegistry = configRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void loadPersistedSessions() {
        try {
            List<String> files = storagePort.listObjects(SESSIONS_DIR, "").join();
            int loaded = 0;
            for (String file : files) {
                if (!file.endsWith(JSON_EXTENSION)) {
                    continue;
                }
                Optional<UserSession> session = readFile(file);
                if (session.isPresent() && session.get().getUserId() != null) {
                    reconcile(session.get(), configRegistry.snapshot());
                    sessionCache.put(session.get().getUserId(), session.get());
                    loaded++;
                }
            }
            log.info("[Sessions] Loaded {} persisted sessions", loaded);
        } catch (Exception e) { // NOSONAR - startup must not fail on a corrupt data dir
            log.warn("[Sessions] Failed to load persisted sessions: {}", e.getMessage());
        }
    }

    /**
     * Returns the live session for a user, creating and persisting it on first
     * contact. Callers must not mutate the returned object directly.
     */
    public UserSession getOrCreate(String userId) {
        UserSession existing = sessionCache.get(userId);
        if (existing != null) {
            return existing;
        }
        synchronized (lockFor(userId)) {
            return sessionCache.computeIfAbsent(userId, this::createSession);
        }
    }

    /**
     * Applies a mutation under the user's lock and persists the result.
     */
    public <T> T update(String userId, Function<UserSession, T> mutation) {
        synchronized (lockFor(userId)) {
            UserSession session = getOrCreate(userId);
            T result = mutation.apply(session);
            session.setUpdatedAt(clock.instant());
            persist(session);
            return result;
        }
    }

    /**
     * Detached copy of the session, consistent as of the moment of the call.
     */
    public UserSession snapshot(String userId) {
        synchronized (lockFor(userId)) {
            return getOrCreate(userId).copy();
        }
    }

    public Optional<UserSession> find(String userId) {
        UserSession session = sessionCache.get(userId);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (lockFor(userId)) {
            return Optional.of(session.copy());
        }
    }

    public int size() {
        return sessionCache.size();
    }

    @EventListener
    public void onConfigReloaded(ConfigReloadedEvent event) {
        CommandTable table = event.table();
        int revoked = 0;
        for (String userId : sessionCache.keySet()) {
            boolean profiled = update(userId, session -> reconcile(session, table));
            if (!profiled) {
                revoked++;
            }
        }
        log.info("[Sessions] Refreshed AI settings of {} sessions after reload ({} without profile)",
                sessionCache.size(), revoked);
    }

    /**
     * Applies the user's profile, or turns AI off and forgets the AI key when
     * the user no longer has one.
     *
     * @return whether a profile was found
     */
    private boolean reconcile(UserSession session, CommandTable table) {
        Optional<UserProfile> profile = table.profile(session.getUserId());
        if (profile.isPresent()) {
            applyProfile(session, profile.get());
            return true;
        }
        if (session.isAiEnabled() || session.getAiApiKey() != null) {
            log.info("[Sessions] {} has no profile anymore, AI disabled", session.getUserId());
        }
        session.setAiEnabled(false);
        session.setAiApiKey(null);
        return false;
    }

    private UserSession createSession(String userId) {
        BotProperties.AiProperties ai = properties.getAi();
        UserSession session = UserSession.builder()
                .userId(userId)
                .trigger(ai.getDefaultTrigger())
                .model(ai.getDefaultModel())
                .systemPrompt(ai.getDefaultSystemPrompt())
                .maxHistory(ai.getDefaultMaxHistory())
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        configRegistry.snapshot().profile(userId).ifPresent(profile -> applyProfile(session, profile));
        persist(session);
        log.info("[Sessions] Created session for {}", userId);
        return session;
    }

    private void applyProfile(UserSession session, UserProfile profile) {
        BotProperties.AiProperties ai = properties.getAi();
        session.setAiEnabled(profile.aiEnabled());
        profile.primaryTrigger().ifPresent(entry -> {
            UserProfile.TriggerProfile trigger = entry.getValue();
            session.setTrigger(entry.getKey());
            if (trigger != null) {
                session.setAiApiKey(trigger.apiKey());
                session.setModel(trigger.model() != null ? trigger.model() : ai.getDefaultModel());
                session.setSystemPrompt(trigger.systemPrompt() != null
                        ? trigger.systemPrompt()
                        : ai.getDefaultSystemPrompt());
                session.setMaxHistory(trigger.maxHistory() != null
                        ? trigger.maxHistory()
                        : ai.getDefaultMaxHistory());
            }
        });
        if (profile.realdebridApiKey() != null && !profile.realdebridApiKey().isBlank()
                && !session.hasDebridKey()) {
            session.setDebridApiKey(profile.realdebridApiKey());
        }
    }

    private void persist(UserSession session) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(session);
            storagePort.putTextAtomic(SESSIONS_DIR, fileName(session.getUserId()), json, false).join();
        } catch (JsonProcessingException e) {
            log.error("[Sessions] Failed to serialize session {}", session.getUserId(), e);
        } catch (Exception e) { // NOSONAR - in-memory state stays authoritative
            log.error("[Sessions] Failed to persist session {}: {}", session.getUserId(), e.getMessage());
        }
    }

    private Optional<UserSession> readFile(String file) {
        try {
            String json = storagePort.getText(SESSIONS_DIR, file).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, UserSession.class));
        } catch (Exception e) { // NOSONAR - skip unreadable files
            log.warn("[Sessions] Skipping unreadable session file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Object lockFor(String userId) {
        return locks.computeIfAbsent(userId, id -> new Object());
    }

    static String fileName(String userId) {
        return userId.replaceAll("[^A-Za-z0-9._-]", "_") + JSON_EXTENSION;
    }
}
