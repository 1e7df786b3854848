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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.subaru.bot.domain.model.InboundEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Bridges Spring application events to {@link EventDispatcher#submit}.
 *
 * <p>
 * Producers only know {@code ApplicationEventPublisher}; the listener runs on
 * the publishing thread, so an {@link EventRejectedException} propagates back
 * to the producer.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundEventListener {

    private final EventDispatcher dispatcher;

    @EventListener
    public void onInboundEvent(InboundEvent event) {
        log.debug("[Inbound] submit {} from {}", event.type(), event.source());
        dispatcher.submit(event);
    }
}
