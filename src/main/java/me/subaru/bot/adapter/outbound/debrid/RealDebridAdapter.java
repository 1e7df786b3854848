package me.subaru.bot.adapter.outbound.debrid;

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

import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.outbound.DebridPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Real-Debrid adapter - talks to the Real-Debrid REST API (v1.0) over HTTP.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /torrents/addMagnet - submit a magnet, answers 201 with the id
 * <li>POST /torrents/selectFiles/{id} - start the download of all files
 * <li>GET /torrents/info/{id} - status, progress and links
 * <li>GET /torrents - most recent torrents
 * <li>POST /unrestrict/link - hoster link to direct link
 * </ul>
 *
 * <p>
 * Every call authenticates with the per-user key as a Bearer token. HTTP 401
 * and 403 map to {@link DebridException.Kind#UNAUTHORIZED}, 404 to
 * {@link DebridException.Kind#NOT_FOUND}, 5xx, 429 and I/O errors to
 * {@link DebridException.Kind#TRANSIENT}, everything else to
 * {@link DebridException.Kind#REJECTED}.
 */
@Component
@Slf4j
public class RealDebridAdapter implements DebridPort {

    private final BotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RealDebridAdapter(BotProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        long timeoutMs = properties.getDownloads().getRequestTimeoutMs();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public String addMagnet(String apiKey, String magnet) {
        Request.Builder request = new Request.Builder()
                .url(url("torrents", "addMagnet"))
                .post(new FormBody.Builder().add("magnet", magnet).build());
        JsonNode response = execute(apiKey, request, "addMagnet");
        String id = response.path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw new DebridException(DebridException.Kind.REJECTED, "addMagnet returned no torrent id");
        }
        log.info("[RealDebrid] Magnet added as torrent {}", id);
        return id;
    }

    @Override
    public void selectAllFiles(String apiKey, String torrentId) {
        Request.Builder request = new Request.Builder()
                .url(url("torrents", "selectFiles", torrentId))
                .post(new FormBody.Builder().add("files", "all").build());
        execute(apiKey, request, "selectFiles");
        log.debug("[RealDebrid] Selected all files of {}", torrentId);
    }

    @Override
    public TorrentInfo getTorrentInfo(String apiKey, String torrentId) {
        Request.Builder request = new Request.Builder()
                .url(url("torrents", "info", torrentId))
                .get();
        return toTorrentInfo(execute(apiKey, request, "torrentInfo"));
    }

    @Override
    public List<TorrentInfo> listTorrents(String apiKey, int limit) {
        HttpUrl listUrl = url("torrents").newBuilder()
                .addQueryParameter("limit", String.valueOf(limit))
                .build();
        JsonNode response = execute(apiKey, new Request.Builder().url(listUrl).get(), "listTorrents");
        List<TorrentInfo> torrents = new ArrayList<>();
        for (JsonNode node : response) {
            torrents.add(toTorrentInfo(node));
        }
        return torrents;
    }

    @Override
    public String unrestrictLink(String apiKey, String link) {
        Request.Builder request = new Request.Builder()
                .url(url("unrestrict", "link"))
                .post(new FormBody.Builder().add("link", link).build());
        JsonNode response = execute(apiKey, request, "unrestrictLink");
        String download = response.path("download").asText(null);
        if (download == null || download.isBlank()) {
            throw new DebridException(DebridException.Kind.REJECTED, "unrestrict returned no download link");
        }
        return download;
    }

    private TorrentInfo toTorrentInfo(JsonNode node) {
        List<String> links = new ArrayList<>();
        for (JsonNode link : node.path("links")) {
            links.add(link.asText());
        }
        return new TorrentInfo(
                node.path("id").asText(),
                node.path("filename").asText(""),
                node.path("status").asText("unknown"),
                node.path("progress").asInt(0),
                node.path("bytes").asLong(0),
                links,
                node.path("added").asText(null));
    }

    private JsonNode execute(String apiKey, Request.Builder request, String operation) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new DebridException(DebridException.Kind.UNAUTHORIZED, "No Real-Debrid API key configured");
        }
        request.header("Authorization", "Bearer " + apiKey);

        try (Response response = httpClient.newCall(request.build()).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw failure(operation, response.code(), text);
            }
            return text.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
        } catch (IOException e) {
            log.warn("[RealDebrid] {} failed: {}", operation, e.getMessage());
            throw new DebridException(DebridException.Kind.TRANSIENT, operation + " failed: " + e.getMessage(), e);
        }
    }

    private DebridException failure(String operation, int code, String body) {
        String error = errorMessage(body);
        String message = operation + " failed (HTTP " + code + "): " + error;
        log.warn("[RealDebrid] {}", message);
        if (code == 401 || code == 403) {
            return new DebridException(DebridException.Kind.UNAUTHORIZED, message);
        }
        if (code == 404) {
            return new DebridException(DebridException.Kind.NOT_FOUND, message);
        }
        if (code == 429 || code >= 500) {
            return new DebridException(DebridException.Kind.TRANSIENT, message);
        }
        return new DebridException(DebridException.Kind.REJECTED, message);
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no details";
        }
        try {
            return objectMapper.readTree(body).path("error").asText(body);
        } catch (IOException e) {
            return body;
        }
    }

    private HttpUrl url(String... segments) {
        HttpUrl base = HttpUrl.parse(properties.getDownloads().getDebridBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid Real-Debrid URL: " + properties.getDownloads().getDebridBaseUrl());
        }
        HttpUrl.Builder builder = base.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }
}
