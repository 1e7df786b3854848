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

/**
 * Thrown to a producer when the dispatcher cannot accept an event: the inbound
 * queue stayed full for the whole submit timeout, or the dispatcher is shutting
 * down. HTTP producers answer 503.
 */
public class EventRejectedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EventRejectedException(String message) {
        super(message);
    }
}
