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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A torrent submitted to the debrid service on behalf of a user.
 *
 * <p>
 * State changes go through {@link #transitionTo(DownloadState)} which refuses
 * backward moves and any move out of a terminal state.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DownloadJob {

    private String jobId;
    private String ownerId;
    private String roomId;
    private String filename;

    @JsonProperty
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private DownloadState state = DownloadState.SUBMITTED;

    private int progress;

    @Builder.Default
    private List<String> links = new ArrayList<>();

    private String failureReason;
    private Instant submittedAt;
    private Instant lastPolledAt;

    /**
     * Applies a state change.
     *
     * @return {@code true} if the state changed
     */
    public boolean transitionTo(DownloadState next) {
        if (!state.canTransitionTo(next)) {
            return false;
        }
        state = next;
        return true;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return submittedAt != null && submittedAt.plus(maxAge).isBefore(now);
    }

    public DownloadJob copy() {
        return toBuilder().links(links != null ? new ArrayList<>(links) : new ArrayList<>()).build();
    }
}
