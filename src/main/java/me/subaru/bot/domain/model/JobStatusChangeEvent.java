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
 * Emitted by the download tracker when a job reaches a terminal state. Carries
 * a detached copy of the job so later tracker updates never leak into the
 * notification.
 */
public record JobStatusChangeEvent(DownloadJob job, Instant arrivedAt) implements InboundEvent {

    public JobStatusChangeEvent {
        job = job.copy();
    }

    @Override
    public EventType type() {
        return EventType.JOB_STATUS_CHANGE;
    }

    @Override
    public String source() {
        return "download-tracker";
    }
}
