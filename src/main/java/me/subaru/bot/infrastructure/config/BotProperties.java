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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code bot.*} prefix, grouped per subsystem:
 * <ul>
 * <li>{@link MatrixProperties} - chat network login and sync</li>
 * <li>{@link WebhookProperties} - HTTP intake rooms and tokens</li>
 * <li>{@link DispatcherProperties} - queue sizes, retries, shutdown grace</li>
 * <li>{@link AiProperties} - AI backend defaults</li>
 * <li>{@link CommandsProperties} - script execution limits</li>
 * <li>{@link DownloadsProperties} - debrid polling</li>
 * <li>{@link SecurityProperties} - audit room and auth log monitor</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private MatrixProperties matrix = new MatrixProperties();
    private WebhookProperties webhook = new WebhookProperties();
    private DispatcherProperties dispatcher = new DispatcherProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private AiProperties ai = new AiProperties();
    private CommandsProperties commands = new CommandsProperties();
    private ConfigFilesProperties config = new ConfigFilesProperties();
    private DownloadsProperties downloads = new DownloadsProperties();
    private SecurityProperties security = new SecurityProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class MatrixProperties {
        private boolean enabled = true;
        private String homeserver = "https://matrix.org";
        private String userId;
        private String password;
        private String accessToken;
        private String deviceName = "subaru-bot";
        private long syncTimeoutMs = 30000;
        private long retryDelayMs = 5000;
        private boolean autoJoinInvites = true;
    }

    @Data
    public static class WebhookProperties {
        private String defaultRoom;
        /** Bearer token for /webhook/*; blank leaves the endpoints open. */
        private String token;
        /** Shared secret matched against the {token} path segment; blank accepts any. */
        private String discordToken;
    }

    @Data
    public static class DispatcherProperties {
        private int queueCapacity = 1000;
        private Duration submitTimeout = Duration.ofSeconds(2);
        private int workerThreads = 8;
        private int sendThreads = 4;
        private int sendAttempts = 3;
        private Duration sendBackoff = Duration.ofMillis(500);
        private Duration shutdownGrace = Duration.ofSeconds(10);
        private String commandPrefix = "!";
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private int userMessagesPerMinute = 20;
    }

    @Data
    public static class AiProperties {
        /** openai (any OpenAI-compatible endpoint) or anthropic. */
        private String provider = "openai";
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai/";
        private String defaultModel = "gemini-2.0-flash";
        private String defaultTrigger = "subaru";
        private String defaultSystemPrompt = "You are Subaru, a helpful assistant living in a Matrix chat.";
        private int defaultMaxHistory = 20;
        private Duration timeout = Duration.ofSeconds(90);
    }

    @Data
    public static class CommandsProperties {
        private Duration scriptTimeout = Duration.ofSeconds(30);
        private Duration diskUsageTimeout = Duration.ofSeconds(5);
        private int maxOutputChars = 4000;
        private String workingDirectory = ".";
    }

    @Data
    public static class ConfigFilesProperties {
        private String directory = "config";
        private String commandsFile = "commands.json";
        private String usersFile = "users.json";
        private boolean watchEnabled = true;
        private Duration watchInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class DownloadsProperties {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(30);
        private Duration maxAge = Duration.ofHours(24);
        private int maxLinksInNotification = 5;
        private String debridBaseUrl = "https://api.real-debrid.com/rest/1.0";
        private long requestTimeoutMs = 30000;
    }

    @Data
    public static class SecurityProperties {
        /** Room receiving security events; falls back to the webhook default room. */
        private String auditRoom;
        private boolean auditCommands = false;
        private AuthLogProperties authLog = new AuthLogProperties();
    }

    @Data
    public static class AuthLogProperties {
        private boolean enabled = false;
        private String path = "/var/log/auth.log";
        private Duration pollInterval = Duration.ofSeconds(2);
        private List<String> ignoredSessionUsers = new ArrayList<>(List.of("root", "gdm", "lightdm"));
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.subaru/data";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
