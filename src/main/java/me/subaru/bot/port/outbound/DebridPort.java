package me.subaru.bot.port.outbound;

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

import java.util.List;

/**
 * Port for the torrent-debrid service (Real-Debrid REST API).
 *
 * <p>
 * All operations are blocking and throw {@link DebridException}; its
 * {@link DebridException.Kind} tells callers whether the failure is worth
 * retrying.
 */
public interface DebridPort {

    /**
     * Submits a magnet link and returns the torrent id.
     */
    String addMagnet(String apiKey, String magnet);

    void selectAllFiles(String apiKey, String torrentId);

    TorrentInfo getTorrentInfo(String apiKey, String torrentId);

    List<TorrentInfo> listTorrents(String apiKey, int limit);

    /**
     * Converts a hoster link into a direct download link.
     */
    String unrestrictLink(String apiKey, String link);

    record TorrentInfo(
            String id,
            String filename,
            String status,
            int progress,
            long bytes,
            List<String> links,
            String added) {

        public TorrentInfo {
            links = links != null ? List.copyOf(links) : List.of();
        }

        public boolean isDownloaded() {
            return "downloaded".equals(status);
        }

        public boolean isFailed() {
            return "error".equals(status) || "dead".equals(status) || "virus".equals(status)
                    || "magnet_error".equals(status);
        }
    }

    class DebridException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public enum Kind {
            /** Network error, timeout or 5xx; state must not change. */
            TRANSIENT,
            NOT_FOUND,
            UNAUTHORIZED,
            REJECTED
        }

        private final Kind kind;

        public DebridException(Kind kind, String message) {
            super(message);
            this.kind = kind;
        }

        public DebridException(Kind kind, String message, Throwable cause) {
            super(message, cause);
            this.kind = kind;
        }

        public Kind getKind() {
            return kind;
        }

        public boolean isTransient() {
            return kind == Kind.TRANSIENT;
        }
    }
}
