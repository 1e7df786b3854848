package me.subaru.bot.port.inbound;

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

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Bidirectional port for the chat network. Implementations receive messages
 * (publishing them as {@code ChatMessageEvent}) and deliver outbound text.
 */
public interface ChatTransportPort {

    void start();

    void stop();

    boolean isRunning();

    /**
     * User id the bot is logged in as. Messages from this id are ignored.
     */
    String getSelfUserId();

    /**
     * Sends a text message. For a {@link Destination.Kind#USER} destination the
     * transport resolves or creates the direct message room first.
     *
     * <p>
     * Repeating a call with the same {@code transactionId} must not produce a
     * second message, so a send whose acknowledgement was lost can be retried.
     *
     * @return future completed when the server acknowledged the message, or
     *         completed exceptionally with {@link TransportSendException}
     */
    CompletableFuture<Void> sendMessage(Destination destination, String content, String transactionId);

    default CompletableFuture<Void> sendMessage(Destination destination, String content) {
        return sendMessage(destination, content, newTransactionId());
    }

    /**
     * Fresh id for one logical outbound message, reused across its retries.
     */
    default String newTransactionId() {
        return UUID.randomUUID().toString();
    }

    class TransportSendException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public TransportSendException(String message) {
            super(message);
        }

        public TransportSendException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
