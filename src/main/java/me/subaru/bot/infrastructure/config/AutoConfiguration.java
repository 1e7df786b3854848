package me.subaru.bot.infrastructure.config;

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

import me.subaru.bot.domain.loop.EventDispatcher;
import me.subaru.bot.port.inbound.ChatTransportPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration that wires shared infrastructure beans and starts the
 * chat transport once the dispatcher is running.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} and {@link ObjectMapper} used everywhere</li>
 * <li>Provides the worker pool of the per-user chat runners and a separate
 * one for the per-destination send runners, so slow AI calls or scripts never
 * hold up outbound messages</li>
 * <li>Logs startup information and starts enabled transports</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final List<ChatTransportPort> transports;
    private final EventDispatcher eventDispatcher;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService dispatchWorkerExecutor(BotProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(2, properties.getDispatcher().getWorkerThreads()), r -> {
            Thread t = new Thread(r, "dispatch-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService sendWorkerExecutor(BotProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getDispatcher().getSendThreads()), r -> {
            Thread t = new Thread(r, "send-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        log.info("Subaru Bot starting...");
        log.info("Homeserver: {}", properties.getMatrix().getHomeserver());
        log.info("AI Provider: {} ({})", properties.getAi().getProvider(), properties.getAi().getDefaultModel());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Config Directory: {}", properties.getConfig().getDirectory());
        log.info("Dispatcher running: {}", eventDispatcher.isRunning());

        if (properties.getMatrix().isEnabled()) {
            for (ChatTransportPort transport : transports) {
                log.info("Starting transport: {}", transport.getClass().getSimpleName());
                transport.start();
            }
        } else {
            log.info("Matrix transport disabled, webhooks only");
        }

        log.info("Subaru Bot started successfully");
    }
}
