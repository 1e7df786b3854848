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

import java.time.Instant;

/**
 * Unit of work accepted by the event dispatcher.
 *
 * <p>
 * Every producer (chat transport, webhook controllers, download tracker,
 * security monitors) publishes one of the immutable implementations below as a
 * Spring application event. Events are never mutated after construction.
 */
public interface InboundEvent {

    EventType type();

    /**
     * Short identifier of the producer, used in logs (e.g. "matrix", "webhook").
     */
    String source();

    Instant arrivedAt();
}
