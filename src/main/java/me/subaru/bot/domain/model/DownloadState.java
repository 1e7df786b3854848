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

/**
 * Lifecycle of a tracked download. States only move forward; READY, FAILED and
 * EXPIRED are terminal.
 */
public enum DownloadState {
    SUBMITTED(0),
    IN_PROGRESS(1),
    READY(2),
    FAILED(2),
    EXPIRED(2);

    private final int rank;

    DownloadState(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 2;
    }

    public boolean canTransitionTo(DownloadState next) {
        return next != null && !isTerminal() && next.rank > rank;
    }
}
