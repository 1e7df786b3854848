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

import me.subaru.bot.domain.model.Destination;
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.inbound.ChatTransportPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Delivers outbound messages with per-destination ordering.
 *
 * <p>
 * Each destination has its own FIFO drained by one task at a time, so two
 * messages for the same room leave in the order they were enqueued while other
 * rooms proceed in parallel. A failed send is retried with exponential backoff
 * ({@code bot.dispatcher.send-attempts}, {@code send-backoff}); after the last
 * attempt the message is logged and dropped and the queue moves on.
 *
 * <p>
 * Every attempt for one message reuses the same transport transaction id, so
 * a retry after a lost acknowledgement is deduplicated by the server. Sends run
 * on their own pool, never on the chat handler pool.
 */
@Service
@Slf4j
public class DestinationSendCoordinator {

    private final ChatTransportPort transport;
    private final BotProperties properties;
    private final SerialKeyedExecutor<Destination> runners;

    public DestinationSendCoordinator(ChatTransportPort transport,
            @Qualifier("sendWorkerExecutor") ExecutorService sendWorkerExecutor, BotProperties properties) {
        this.transport = transport;
        this.properties = properties;
        this.runners = new SerialKeyedExecutor<>("Send", sendWorkerExecutor, DestinationSendCoordinator::dropped);
    }

    /**
     * Queues a message.
     *
     * @return future completed with {@code true} once delivered, {@code false} if
     *         it was dropped after retries or abandoned at shutdown
     */
    public CompletableFuture<Boolean> enqueue(Destination destination, String content) {
        PendingSend send = new PendingSend(destination, content, transport.newTransactionId());
        runners.submit(destination, send);
        return send.result;
    }

    public boolean awaitIdle(Duration timeout) {
        return runners.awaitIdle(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int pendingCount() {
        return runners.pendingCount();
    }

    /**
     * Drops every send that has not started; their futures complete with
     * {@code false}.
     */
    public int abandonPending() {
        List<Runnable> abandoned = runners.abandonPending();
        abandoned.forEach(DestinationSendCoordinator::dropped);
        return abandoned.size();
    }

    private static void dropped(Runnable task) {
        if (task instanceof PendingSend send) {
            send.result.complete(false);
        }
    }

    boolean deliver(Destination destination, String content, String transactionId) {
        BotProperties.DispatcherProperties config = properties.getDispatcher();
        int attempts = Math.max(1, config.getSendAttempts());
        long backoffMs = config.getSendBackoff().toMillis();

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                transport.sendMessage(destination, content, transactionId).join();
                return true;
            } catch (RuntimeException e) { // NOSONAR - any send failure is retried
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                if (attempt == attempts) {
                    log.error("[Send] Dropping message to {} after {} attempts: {}", destination, attempts,
                            cause.getMessage());
                    return false;
                }
                long delay = backoffMs * (1L << (attempt - 1));
                log.warn("[Send] Attempt {}/{} to {} failed ({}), retrying in {}ms", attempt, attempts, destination,
                        cause.getMessage(), delay);
                if (!sleep(delay)) {
                    return false;
                }
            }
        }
        return false;
    }

    private boolean sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private final class PendingSend implements Runnable {

        private final Destination destination;
        private final String content;
        private final String transactionId;
        private final CompletableFuture<Boolean> result = new CompletableFuture<>();

        private PendingSend(Destination destination, String content, String transactionId) {
            this.destination = destination;
            this.content = content;
            this.transactionId = transactionId;
        }

        @Override
        public void run() {
            boolean delivered = false;
            try {
                delivered = deliver(destination, content, transactionId);
            } finally {
                result.complete(delivered);
            }
        }
    }
}
