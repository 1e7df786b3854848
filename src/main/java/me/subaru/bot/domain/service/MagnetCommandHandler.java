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

import me.subaru.bot.domain.model.DownloadJob;
import me.subaru.bot.domain.model.UserSession;
import me.subaru.bot.port.inbound.CommandPort.CommandResult;
import me.subaru.bot.port.outbound.DebridPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Torrent commands backed by the debrid service: submit a magnet, store the
 * user's API key, list torrents and show one torrent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MagnetCommandHandler {

    private static final int LIST_LIMIT = 10;
    private static final int LINKS_PER_TORRENT = 3;
    private static final String NO_KEY = "❌ Real-Debrid API key not configured. Use `!magnet-config <your_api_key>` to set it up.";

    private final DebridPort debridPort;
    private final SessionService sessionService;
    private final DownloadTracker downloadTracker;

    public CommandResult addMagnet(String userId, String roomId, String magnet) {
        if (magnet == null || !magnet.startsWith("magnet:")) {
            return CommandResult.failure("Usage: `!magnet magnet:?xt=urn:btih:...`");
        }
        Optional<String> apiKey = apiKeyOf(userId);
        if (apiKey.isEmpty()) {
            return CommandResult.failure(NO_KEY);
        }

        String torrentId;
        String filename;
        try {
            torrentId = debridPort.addMagnet(apiKey.get(), magnet);
            filename = lookupFilename(apiKey.get(), torrentId);
        } catch (DebridPort.DebridException e) {
            return backendFailure("add the magnet", e);
        }

        StringBuilder text = new StringBuilder("✅ **Torrent added!**\n\n")
                .append("• **Torrent ID:** `").append(torrentId).append("`\n")
                .append("• **Filename:** ").append(filename).append("\n\n");
        try {
            debridPort.selectAllFiles(apiKey.get(), torrentId);
            DownloadJob job = downloadTracker.register(userId, roomId, torrentId, filename);
            log.info("[Magnet] {} submitted {}", userId, job.getJobId());
            text.append("_Download started, I will let you know when it is ready_ 📊");
        } catch (DebridPort.DebridException e) {
            log.warn("[Magnet] Auto-select failed for {}: {}", torrentId, e.getMessage());
            text.append("⚠️ **Auto-start failed**. Select the files at https://real-debrid.com/torrents to start it.");
        }
        return CommandResult.ok(text.toString());
    }

    public CommandResult configure(String userId, String apiKey) {
        if (apiKey == null || apiKey.isBlank() || apiKey.contains(" ")) {
            return CommandResult.failure("Usage: `!magnet-config <your_real_debrid_api_key>`");
        }
        sessionService.update(userId, session -> {
            session.setDebridApiKey(apiKey.trim());
            return null;
        });
        log.info("[Magnet] {} configured a Real-Debrid key", userId);
        return CommandResult.ok("✅ Real-Debrid API key configured successfully!");
    }

    public CommandResult list(String userId) {
        Optional<String> apiKey = apiKeyOf(userId);
        if (apiKey.isEmpty()) {
            return CommandResult.failure(NO_KEY);
        }
        List<DebridPort.TorrentInfo> torrents;
        try {
            torrents = debridPort.listTorrents(apiKey.get(), LIST_LIMIT + 1);
        } catch (DebridPort.DebridException e) {
            return backendFailure("list your torrents", e);
        }
        if (torrents.isEmpty()) {
            return CommandResult.ok("📭 No torrents found.");
        }

        StringBuilder text = new StringBuilder("📊 **Your Torrents**\n\n");
        torrents.stream().limit(LIST_LIMIT).forEach(torrent -> appendTorrentLine(text, apiKey.get(), torrent));
        if (torrents.size() > LIST_LIMIT) {
            text.append("… and more, see https://real-debrid.com/torrents\n");
        }
        return CommandResult.ok(text.toString().trim());
    }

    public CommandResult info(String userId, String torrentId) {
        if (torrentId == null || torrentId.isBlank()) {
            return CommandResult.failure("Usage: `!magnet-info <torrent_id>`");
        }
        Optional<String> apiKey = apiKeyOf(userId);
        if (apiKey.isEmpty()) {
            return CommandResult.failure(NO_KEY);
        }
        try {
            DebridPort.TorrentInfo info = debridPort.getTorrentInfo(apiKey.get(), torrentId.trim());
            return CommandResult.ok("📋 **Torrent Info (ID: " + info.id() + ")**\n\n"
                    + "• **Name:** " + info.filename() + "\n"
                    + "• **Status:** " + info.status() + "\n"
                    + "• **Progress:** " + info.progress() + "%\n"
                    + "• **Bytes:** " + info.bytes() + "\n"
                    + "• **Added:** " + info.added());
        } catch (DebridPort.DebridException e) {
            if (e.getKind() == DebridPort.DebridException.Kind.NOT_FOUND) {
                return CommandResult.failure("❌ **Torrent not found** (ID: `" + torrentId.trim()
                        + "`)\n\nUse `!magnet-list` to see your active torrents.");
            }
            return backendFailure("read the torrent", e);
        }
    }

    private void appendTorrentLine(StringBuilder text, String apiKey, DebridPort.TorrentInfo torrent) {
        if (torrent.isDownloaded()) {
            text.append("✅ **").append(torrent.filename()).append("**\n");
            torrent.links().stream().limit(LINKS_PER_TORRENT).forEach(link -> {
                String direct = link;
                try {
                    direct = debridPort.unrestrictLink(apiKey, link);
                } catch (DebridPort.DebridException e) {
                    log.debug("[Magnet] Could not unrestrict {}: {}", link, e.getMessage());
                }
                text.append("  📥 ").append(direct).append('\n');
            });
            if (torrent.links().size() > LINKS_PER_TORRENT) {
                text.append("  … and ").append(torrent.links().size() - LINKS_PER_TORRENT).append(" more files\n");
            }
        } else if (torrent.isFailed()) {
            text.append("❌ **").append(torrent.filename()).append("** - Status: `").append(torrent.status())
                    .append("`\n");
        } else {
            text.append("⏳ **").append(torrent.filename()).append("** - ").append(torrent.status()).append(" ")
                    .append(torrent.progress()).append("% (ID: `").append(torrent.id()).append("`)\n");
        }
    }

    private String lookupFilename(String apiKey, String torrentId) {
        try {
            String filename = debridPort.getTorrentInfo(apiKey, torrentId).filename();
            return filename != null && !filename.isBlank() ? filename : "Unknown";
        } catch (DebridPort.DebridException e) {
            log.debug("[Magnet] Could not read filename of {}: {}", torrentId, e.getMessage());
            return "Unknown";
        }
    }

    private Optional<String> apiKeyOf(String userId) {
        return Optional.of(sessionService.snapshot(userId))
                .filter(UserSession::hasDebridKey)
                .map(UserSession::getDebridApiKey);
    }

    private CommandResult backendFailure(String action, DebridPort.DebridException e) {
        log.warn("[Magnet] Could not {}: {}", action, e.getMessage());
        if (e.getKind() == DebridPort.DebridException.Kind.UNAUTHORIZED) {
            return CommandResult.backendUnavailable("❌ Invalid Real-Debrid API key. Use `!magnet-config` to update it.");
        }
        return CommandResult.backendUnavailable("❌ Could not " + action + ": " + e.getMessage());
    }
}
