package me.subaru.bot.domain.loop;

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

import me.subaru.bot.domain.model.ChatMessageEvent;
import me.subaru.bot.domain.model.Destination;
import me.subaru.bot.domain.model.DiscordWebhookEvent;
import me.subaru.bot.domain.model.DownloadJob;
import me.subaru.bot.domain.model.InboundEvent;
import me.subaru.bot.domain.model.JobStatusChangeEvent;
import me.subaru.bot.domain.model.RateLimitResult;
import me.subaru.bot.domain.model.SecurityEvent;
import me.subaru.bot.domain.model.WebhookMessageEvent;
import me.subaru.bot.domain.model.WebhookNotifyEvent;
import me.subaru.bot.domain.service.AiTriggerHandler;
import me.subaru.bot.domain.service.DestinationSendCoordinator;
import me.subaru.bot.domain.service.DownloadTracker;
import me.subaru.bot.domain.service.MessageFormatter;
import me.subaru.bot.domain.service.SerialKeyedExecutor;
import me.subaru.bot.domain.service.SessionService;
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.inbound.ChatTransportPort;
import me.subaru.bot.port.inbound.CommandPort;
import me.subaru.bot.ratelimit.UserRateLimiter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Central event loop: every producer's {@link InboundEvent} lands in one
 * bounded queue and is routed from a single dispatcher thread.
 *
 * <p>
 * Routing by tag:
 * <ul>
 * <li>CHAT_MESSAGE - AI trigger first, then {@code !} commands, otherwise
 * dropped; handled on a per-user serial runner so a slow AI call never stalls
 * other users</li>
 * <li>WEBHOOK_MESSAGE / WEBHOOK_NOTIFY - formatted and sent to the given or
 * default room</li>
 * <li>WEBHOOK_DISCORD - direct message when the path id is a user id, default
 * room otherwise</li>
 * <li>JOB_STATUS_CHANGE - terminal jobs only, delivery reported back to the
 * tracker</li>
 * <li>SECURITY_EVENT - always to the audit room, never rate limited</li>
 * </ul>
 *
 * <p>
 * All output goes through {@link DestinationSendCoordinator}, which keeps
 * per-destination order. A failure while handling one event is logged and the
 * loop continues.
 */
@Service
@Slf4j
public class EventDispatcher {

    private static final long POLL_MS = 200;

    private final BotProperties properties;
    private final CommandPort commandPort;
    private final AiTriggerHandler aiTriggerHandler;
    private final SessionService sessionService;
    private final DestinationSendCoordinator sendCoordinator;
    private final MessageFormatter formatter;
    private final DownloadTracker downloadTracker;
    private final UserRateLimiter rateLimiter;
    private final ChatTransportPort transport;

    private final BlockingQueue<InboundEvent> queue;
    private final SerialKeyedExecutor<String> chatRunners;
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    private volatile boolean stopping;
    private Thread loopThread;

    public EventDispatcher(BotProperties properties, CommandPort commandPort, AiTriggerHandler aiTriggerHandler,
            SessionService sessionService, DestinationSendCoordinator sendCoordinator, MessageFormatter formatter,
            DownloadTracker downloadTracker, UserRateLimiter rateLimiter, ChatTransportPort transport,
            @Qualifier("dispatchWorkerExecutor") ExecutorService dispatchWorkerExecutor) {
        this.properties = properties;
        this.commandPort = commandPort;
        this.aiTriggerHandler = aiTriggerHandler;
        this.sessionService = sessionService;
        this.sendCoordinator = sendCoordinator;
        this.formatter = formatter;
        this.downloadTracker = downloadTracker;
        this.rateLimiter = rateLimiter;
        this.transport = transport;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, properties.getDispatcher().getQueueCapacity()));
        this.chatRunners = new SerialKeyedExecutor<>("Chat", dispatchWorkerExecutor);
    }

    @PostConstruct
    public synchronized void start() {
        if (loopThread != null) {
            return;
        }
        loopThread = new Thread(this::runLoop, "event-dispatcher");
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("[Dispatcher] Started (queue capacity: {})", properties.getDispatcher().getQueueCapacity());
    }

    public boolean isRunning() {
        return loopThread != null && loopThread.isAlive();
    }

    public int queuedEvents() {
        return queue.size();
    }

    /**
     * Accepts an event from a producer. Waits up to
     * {@code bot.dispatcher.submit-timeout} for queue space.
     *
     * @throws EventRejectedException
     *             if the queue stayed full or the dispatcher is shutting down
     */
    public void submit(InboundEvent event) {
        if (!accepting.get()) {
            throw new EventRejectedException("Dispatcher is shutting down");
        }
        Duration timeout = properties.getDispatcher().getSubmitTimeout();
        boolean offered;
        try {
            offered = queue.offer(event, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventRejectedException("Interrupted while waiting for queue space");
        }
        if (!offered) {
            log.warn("[Dispatcher] Queue full, rejecting {} from {}", event.type(), event.source());
            throw new EventRejectedException("Event queue is full");
        }
    }

    void runLoop() {
        while (true) {
            InboundEvent event;
            try {
                event = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("[Dispatcher] Loop interrupted");
                return;
            }
            if (event == null) {
                if (stopping) {
                    return;
                }
                continue;
            }
            try {
                dispatch(event);
            } catch (Exception e) { // NOSONAR - one bad event must not stop the loop
                log.error("[Dispatcher] Failed to handle {} from {}: {}", event.type(), event.source(),
                        e.getMessage(), e);
            }
        }
    }

    /**
     * Routes a single event. Runs on the dispatcher thread.
     */
    public void dispatch(InboundEvent event) {
        switch (event.type()) {
        case CHAT_MESSAGE -> routeChat((ChatMessageEvent) event);
        case WEBHOOK_MESSAGE -> routeWebhookMessage((WebhookMessageEvent) event);
        case WEBHOOK_NOTIFY -> routeNotification((WebhookNotifyEvent) event);
        case WEBHOOK_DISCORD -> routeDiscord((DiscordWebhookEvent) event);
        case JOB_STATUS_CHANGE -> routeJobStatus((JobStatusChangeEvent) event);
        case SECURITY_EVENT -> routeSecurity((SecurityEvent) event);
        }
    }

    private void routeChat(ChatMessageEvent event) {
        if (event.senderId().equals(transport.getSelfUserId())) {
            return;
        }
        chatRunners.submit(event.senderId(), () -> handleChat(event));
    }

    void handleChat(ChatMessageEvent event) {
        String userId = event.senderId();
        String text = event.text().trim();
        sessionService.update(userId, session -> {
            session.recordInboundMessage();
            return null;
        });

        boolean command = text.startsWith(properties.getDispatcher().getCommandPrefix());
        if (!command && !aiTriggerHandler.isTriggered(userId, text)) {
            return;
        }

        RateLimitResult limit = rateLimiter.tryConsume(userId);
        if (!limit.isAllowed()) {
            log.warn("[Dispatcher] Rate limit hit for {}, ignoring message", userId);
            return;
        }

        Optional<String> aiReply = aiTriggerHandler.maybeRespond(userId, text);
        if (aiReply.isPresent()) {
            reply(event.roomId(), aiReply.get());
            return;
        }
        if (!command) {
            return;
        }

        CommandPort.CommandResult result = commandPort.route(userId, event.roomId(), text);
        if (result.isSilent()) {
            return;
        }
        log.info("[Dispatcher] {} -> {} ({})", userId, text.split("\\s+", 2)[0], result.status());
        reply(event.roomId(), result.output());
    }

    private void routeWebhookMessage(WebhookMessageEvent event) {
        resolveRoom(event.roomId()).ifPresent(room -> sendCoordinator.enqueue(room, event.message()));
    }

    private void routeNotification(WebhookNotifyEvent event) {
        resolveRoom(event.roomId()).ifPresent(room -> sendCoordinator.enqueue(room,
                formatter.formatNotification(event)));
    }

    private void routeDiscord(DiscordWebhookEvent event) {
        String text = formatter.formatDiscord(event);
        if (text.isBlank()) {
            return;
        }
        if (Destination.isUserId(event.pathId())) {
            sendCoordinator.enqueue(Destination.user(event.pathId()), text);
            return;
        }
        resolveRoom(null).ifPresent(room -> sendCoordinator.enqueue(room, text));
    }

    private void routeJobStatus(JobStatusChangeEvent event) {
        DownloadJob job = event.job();
        if (!job.isTerminal()) {
            return;
        }
        Destination destination = job.getRoomId() != null && !job.getRoomId().isBlank()
                ? Destination.room(job.getRoomId())
                : Destination.user(job.getOwnerId());
        String text = formatter.formatJobNotification(job, properties.getDownloads().getMaxLinksInNotification());
        String key = DownloadTracker.keyOf(job);
        sendCoordinator.enqueue(destination, text)
                .whenComplete((delivered, error) -> downloadTracker.onNotificationResult(key,
                        error == null && Boolean.TRUE.equals(delivered)));
    }

    private void routeSecurity(SecurityEvent event) {
        String auditRoom = properties.getSecurity().getAuditRoom();
        Optional<Destination> destination = auditRoom != null && !auditRoom.isBlank()
                ? Optional.of(Destination.room(auditRoom))
                : resolveRoom(null);
        destination.ifPresentOrElse(room -> sendCoordinator.enqueue(room, formatter.formatSecurity(event)),
                () -> log.error("[Dispatcher] No audit room configured, security event lost: {}", event.title()));
    }

    private List<CompletableFuture<Boolean>> reply(String roomId, String text) {
        List<CompletableFuture<Boolean>> sends = new ArrayList<>();
        Destination room = Destination.room(roomId);
        for (String part : formatter.splitParagraphs(text)) {
            sends.add(sendCoordinator.enqueue(room, part));
        }
        return sends;
    }

    private Optional<Destination> resolveRoom(String roomId) {
        if (roomId != null && !roomId.isBlank()) {
            return Optional.of(Destination.room(roomId));
        }
        String defaultRoom = properties.getWebhook().getDefaultRoom();
        if (defaultRoom == null || defaultRoom.isBlank()) {
            log.warn("[Dispatcher] No room given and no default room configured, dropping message");
            return Optional.empty();
        }
        return Optional.of(Destination.room(defaultRoom));
    }

    /**
     * Waits until the queue is empty and all chat handlers and sends finished.
     */
    public boolean awaitQuiescence(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!queue.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        long remaining = Math.max(0, deadline - System.nanoTime());
        if (!chatRunners.awaitIdle(remaining, TimeUnit.NANOSECONDS)) {
            return false;
        }
        return sendCoordinator.awaitIdle(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
    }

    @PreDestroy
    public void shutdown() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        Duration grace = properties.getDispatcher().getShutdownGrace();
        long deadline = System.nanoTime() + grace.toNanos();
        log.info("[Dispatcher] Shutting down, draining {} queued events (grace {}s)", queue.size(),
                grace.toSeconds());

        stopping = true;
        int abandonedEvents = 0;
        if (loopThread != null) {
            try {
                loopThread.join(Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (loopThread.isAlive()) {
                loopThread.interrupt();
            }
        }
        abandonedEvents += queue.size();
        queue.clear();

        chatRunners.awaitIdle(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        int abandonedChats = chatRunners.abandonPending().size();
        sendCoordinator.awaitIdle(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
        int abandonedSends = sendCoordinator.abandonPending();

        if (abandonedEvents + abandonedChats + abandonedSends > 0) {
            log.warn("[Dispatcher] Abandoned at shutdown: {} events, {} chat messages, {} sends",
                    abandonedEvents, abandonedChats, abandonedSends);
        } else {
            log.info("[Dispatcher] Drained cleanly");
        }
    }
}
