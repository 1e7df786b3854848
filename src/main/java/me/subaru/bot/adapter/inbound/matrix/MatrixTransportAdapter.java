package me.subaru.bot.adapter.inbound.matrix;

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

import me.subaru.bot.domain.loop.EventRejectedException;
import me.subaru.bot.domain.model.ChatMessageEvent;
import me.subaru.bot.domain.model.Destination;
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.inbound.ChatTransportPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Matrix client-server API transport (unencrypted rooms only).
 *
 * <p>
 * Receiving: a {@code matrix-sync} thread logs in, then long-polls
 * {@code /sync}. The first sync only records the position so the backlog is
 * not replayed; afterwards every {@code m.text} message from someone else is
 * published as a {@link ChatMessageEvent}. Invites are joined automatically
 * when {@code bot.matrix.auto-join-invites} is set.
 *
 * <p>
 * Sending: {@link #sendMessage} runs on the calling thread (a dispatcher send
 * worker) and returns an already completed future. A
 * {@link Destination.Kind#USER} destination resolves to the known direct room
 * from {@code m.direct} account data, or a new room is created with
 * {@code is_direct} and the user invited.
 */
@Component
@Slf4j
public class MatrixTransportAdapter implements ChatTransportPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String API_PREFIX = "_matrix/client/v3";
    private static final String ROOM_MESSAGE = "m.room.message";
    private static final String DIRECT_ACCOUNT_DATA = "m.direct";

    private final BotProperties properties;
    private final OkHttpClient httpClient;
    private final OkHttpClient syncClient;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, String> directRooms = new ConcurrentHashMap<>();
    private final AtomicLong txnCounter = new AtomicLong();
    private final Object lifecycleLock = new Object();

    private volatile String accessToken;
    private volatile String selfUserId;
    private volatile String nextBatch;
    private volatile boolean running = false;
    private Thread syncThread;

    public MatrixTransportAdapter(BotProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper,
            ApplicationEventPublisher eventPublisher, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.httpClient = baseHttpClient;

        // Long-poll needs a read timeout above the server-side sync timeout
        long syncReadTimeout = properties.getMatrix().getSyncTimeoutMs() + 15_000;
        this.syncClient = baseHttpClient.newBuilder()
                .readTimeout(syncReadTimeout, TimeUnit.MILLISECONDS)
                .build();
        this.selfUserId = properties.getMatrix().getUserId();
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Matrix] Transport already running");
                return;
            }
            running = true;
            syncThread = new Thread(this::runSyncLoop, "matrix-sync");
            syncThread.setDaemon(true);
            syncThread.start();
            log.info("[Matrix] Transport started for {}", properties.getMatrix().getHomeserver());
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            if (syncThread != null) {
                syncThread.interrupt();
                syncThread = null;
            }
            log.info("[Matrix] Transport stopped");
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public String getSelfUserId() {
        return selfUserId;
    }

    // ==================== receive ====================

    private void runSyncLoop() {
        long retryDelay = properties.getMatrix().getRetryDelayMs();
        while (running) {
            try {
                if (accessToken == null) {
                    login();
                }
                syncOnce();
            } catch (IOException | RuntimeException e) { // NOSONAR - the sync thread must survive any failure
                if (!running) {
                    return;
                }
                log.warn("[Matrix] Sync failed: {}. Retrying in {}ms", e.getMessage(), retryDelay);
                if (e instanceof MatrixApiException apiException && apiException.getStatus() == 401) {
                    accessToken = null;
                }
                if (!pause(retryDelay)) {
                    return;
                }
            }
        }
    }

    /**
     * Authenticates with the configured access token (verified with
     * {@code whoami}) or with user id and password.
     */
    void login() throws IOException {
        BotProperties.MatrixProperties matrix = properties.getMatrix();
        if (matrix.getAccessToken() != null && !matrix.getAccessToken().isBlank()) {
            accessToken = matrix.getAccessToken();
            JsonNode whoami = execute(new Request.Builder().url(apiUrl("account", "whoami")).get(), httpClient);
            selfUserId = whoami.path("user_id").asText(matrix.getUserId());
            log.info("[Matrix] Using access token for {}", selfUserId);
            return;
        }

        if (matrix.getUserId() == null || matrix.getPassword() == null) {
            throw new MatrixApiException(0, "Neither access token nor user id and password configured");
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("type", "m.login.password");
        ObjectNode identifier = body.putObject("identifier");
        identifier.put("type", "m.id.user");
        identifier.put("user", matrix.getUserId());
        body.put("password", matrix.getPassword());
        body.put("initial_device_display_name", matrix.getDeviceName());

        Request.Builder request = new Request.Builder()
                .url(apiUrl("login"))
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON));
        JsonNode response = execute(request, httpClient, false);
        accessToken = response.path("access_token").asText(null);
        selfUserId = response.path("user_id").asText(matrix.getUserId());
        if (accessToken == null) {
            throw new MatrixApiException(0, "Login response without access_token");
        }
        log.info("[Matrix] Logged in as {} (device {})", selfUserId, response.path("device_id").asText("?"));
    }

    /**
     * One {@code /sync} round trip. Package-private for tests.
     */
    void syncOnce() throws IOException {
        boolean initial = nextBatch == null;
        HttpUrl.Builder url = apiUrl("sync").newBuilder()
                .addQueryParameter("timeout", initial ? "0" : String.valueOf(properties.getMatrix().getSyncTimeoutMs()));
        if (!initial) {
            url.addQueryParameter("since", nextBatch);
        }

        JsonNode sync = execute(new Request.Builder().url(url.build()).get(), syncClient);
        readDirectRooms(sync.path("account_data").path("events"));
        joinInvites(sync.path("rooms").path("invite"));
        if (!initial) {
            publishMessages(sync.path("rooms").path("join"));
        } else {
            log.info("[Matrix] Initial sync complete, {} joined rooms", sync.path("rooms").path("join").size());
        }
        nextBatch = sync.path("next_batch").asText(nextBatch);
    }

    private void publishMessages(JsonNode joinedRooms) {
        Iterator<Map.Entry<String, JsonNode>> rooms = joinedRooms.fields();
        while (rooms.hasNext()) {
            Map.Entry<String, JsonNode> room = rooms.next();
            for (JsonNode event : room.getValue().path("timeline").path("events")) {
                if (!ROOM_MESSAGE.equals(event.path("type").asText())
                        || !"m.text".equals(event.path("content").path("msgtype").asText())) {
                    continue;
                }
                String sender = event.path("sender").asText();
                if (sender.equals(selfUserId)) {
                    continue;
                }
                String body = event.path("content").path("body").asText("");
                publish(new ChatMessageEvent(event.path("event_id").asText(), room.getKey(), sender, body,
                        clock.instant()));
            }
        }
    }

    private void publish(ChatMessageEvent event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (EventRejectedException e) {
            log.warn("[Matrix] Dropping message {} from {}: {}", event.eventId(), event.senderId(), e.getMessage());
        }
    }

    private void joinInvites(JsonNode invites) {
        if (!properties.getMatrix().isAutoJoinInvites()) {
            return;
        }
        Iterator<String> roomIds = invites.fieldNames();
        while (roomIds.hasNext()) {
            String roomId = roomIds.next();
            try {
                Request.Builder request = new Request.Builder()
                        .url(apiUrl("join", roomId))
                        .post(RequestBody.create("{}", JSON));
                execute(request, httpClient);
                log.info("[Matrix] Joined room {}", roomId);
            } catch (IOException e) {
                log.error("[Matrix] Failed to join room {}: {}", roomId, e.getMessage());
            }
        }
    }

    private void readDirectRooms(JsonNode accountData) {
        for (JsonNode event : accountData) {
            if (!DIRECT_ACCOUNT_DATA.equals(event.path("type").asText())) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> users = event.path("content").fields();
            while (users.hasNext()) {
                Map.Entry<String, JsonNode> entry = users.next();
                JsonNode roomIds = entry.getValue();
                if (roomIds.isArray() && !roomIds.isEmpty()) {
                    directRooms.put(entry.getKey(), roomIds.get(roomIds.size() - 1).asText());
                }
            }
        }
    }

    // ==================== send ====================

    @Override
    public String newTransactionId() {
        return "subaru-" + clock.millis() + "-" + txnCounter.incrementAndGet();
    }

    /**
     * Sends under the given transaction id. The homeserver deduplicates a
     * repeated PUT with the same id, so a retry after a lost response is safe.
     */
    @Override
    public CompletableFuture<Void> sendMessage(Destination destination, String content, String transactionId) {
        try {
            String roomId = resolveRoom(destination);
            sendToRoom(roomId, content, transactionId);
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new TransportSendException("Failed to send to " + destination + ": " + e.getMessage(), e));
        } catch (TransportSendException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void sendToRoom(String roomId, String content, String txnId) throws IOException {
        if (accessToken == null) {
            throw new TransportSendException("Not logged in");
        }
        ObjectNode message = objectMapper.createObjectNode();
        message.put("msgtype", "m.text");
        message.put("body", content);
        String html = MatrixHtmlFormatter.format(content);
        if (!html.isEmpty()) {
            message.put("format", "org.matrix.custom.html");
            message.put("formatted_body", html);
        }

        Request.Builder request = new Request.Builder()
                .url(apiUrl("rooms", roomId, "send", ROOM_MESSAGE, txnId))
                .put(RequestBody.create(objectMapper.writeValueAsString(message), JSON));
        JsonNode response = execute(request, httpClient);
        log.debug("[Matrix] Sent {} to {}", response.path("event_id").asText("?"), roomId);
    }

    /**
     * Room for a destination. Direct rooms are created on first use and
     * remembered in {@code m.direct} account data.
     */
    String resolveRoom(Destination destination) throws IOException {
        if (destination.kind() == Destination.Kind.ROOM) {
            return destination.id();
        }
        String userId = destination.id();
        String known = directRooms.get(userId);
        if (known != null) {
            return known;
        }
        synchronized (directRooms) {
            known = directRooms.get(userId);
            if (known != null) {
                return known;
            }
            String roomId = createDirectRoom(userId);
            directRooms.put(userId, roomId);
            storeDirectRooms();
            return roomId;
        }
    }

    private String createDirectRoom(String userId) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("invite").add(userId);
        body.put("is_direct", true);
        body.put("preset", "trusted_private_chat");

        Request.Builder request = new Request.Builder()
                .url(apiUrl("createRoom"))
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON));
        JsonNode response = execute(request, httpClient);
        String roomId = response.path("room_id").asText(null);
        if (roomId == null) {
            throw new TransportSendException("Could not create direct room with " + userId);
        }
        log.info("[Matrix] Created direct room {} with {}", roomId, userId);
        return roomId;
    }

    private void storeDirectRooms() {
        Map<String, List<String>> content = new LinkedHashMap<>();
        directRooms.forEach((user, room) -> content.put(user, List.of(room)));
        try {
            Request.Builder request = new Request.Builder()
                    .url(apiUrl("user", selfUserId, "account_data", DIRECT_ACCOUNT_DATA))
                    .put(RequestBody.create(objectMapper.writeValueAsString(content), JSON));
            execute(request, httpClient);
        } catch (IOException e) {
            log.warn("[Matrix] Failed to store m.direct account data: {}", e.getMessage());
        }
    }

    // ==================== http ====================

    private HttpUrl apiUrl(String... segments) {
        HttpUrl base = HttpUrl.parse(properties.getMatrix().getHomeserver());
        if (base == null) {
            throw new IllegalStateException("Invalid homeserver URL: " + properties.getMatrix().getHomeserver());
        }
        HttpUrl.Builder builder = base.newBuilder().addPathSegments(API_PREFIX);
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private JsonNode execute(Request.Builder request, OkHttpClient client) throws IOException {
        return execute(request, client, true);
    }

    private JsonNode execute(Request.Builder request, OkHttpClient client, boolean authenticated)
            throws IOException {
        if (authenticated) {
            request.header("Authorization", "Bearer " + accessToken);
        }
        try (Response response = client.newCall(request.build()).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new MatrixApiException(response.code(), "HTTP " + response.code() + " " + describeError(text));
            }
            return text.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
        }
    }

    private String describeError(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            return node.path("errcode").asText("?") + ": " + node.path("error").asText(body);
        } catch (IOException e) {
            return body;
        }
    }

    private boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Non-2xx answer from the homeserver.
     */
    static class MatrixApiException extends IOException {

        private static final long serialVersionUID = 1L;

        private final int status;

        MatrixApiException(int status, String message) {
            super(message);
            this.status = status;
        }

        int getStatus() {
            return status;
        }
    }
}
