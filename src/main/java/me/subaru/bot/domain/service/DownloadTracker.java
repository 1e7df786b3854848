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
import me.subaru.bot.domain.model.DownloadState;
import me.subaru.bot.domain.model.JobStatusChangeEvent;
import me.subaru.bot.domain.model.UserSession;
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.outbound.DebridPort;
import me.subaru.bot.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks torrents submitted to the debrid service until they reach a terminal
 * state and the owner has been told.
 *
 * <p>
 * Every {@code bot.downloads.poll-interval} each non-terminal job is polled
 * once, each in its own task:
 * <ul>
 * <li>older than {@code max-age} - EXPIRED</li>
 * <li>service reports "downloaded" - READY, with unrestricted links</li>
 * <li>service reports an error status or 404 - FAILED</li>
 * <li>any other status - IN_PROGRESS</li>
 * <li>network error, timeout or 5xx - no change</li>
 * </ul>
 *
 * <p>
 * Terminal jobs are announced with a {@link JobStatusChangeEvent}. A job is
 * removed only after {@link #onNotificationResult(String, boolean)} confirms
 * delivery; otherwise it is announced again on the next cycle. Jobs are
 * persisted to {@code downloads/jobs.json} so unannounced results survive a
 * restart.
 */
@Service
@Slf4j
public class DownloadTracker {

    static final String DOWNLOADS_DIR = "downloads";
    static final String JOBS_FILE = "jobs.json";
    private static final int POLL_THREADS = 4;

    private final DebridPort debridPort;
    private final SessionService sessionService;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final BotProperties properties;
    private final Clock clock;

    private final Map<String, DownloadJob> jobs = new ConcurrentHashMap<>();
    private final Set<String> awaitingDelivery = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean polling = new AtomicBoolean(false);
    private final Object persistLock = new Object();
    private final ExecutorService pollExecutor;

    private ScheduledExecutorService scheduler;

    public DownloadTracker(DebridPort debridPort, SessionService sessionService, StoragePort storagePort,
            ObjectMapper objectMapper, ApplicationEventPublisher eventPublisher, BotProperties properties,
            Clock clock) {
        this.debridPort = debridPort;
        this.sessionService = sessionService;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.pollExecutor = Executors.newFixedThreadPool(POLL_THREADS, r -> {
            Thread t = new Thread(r, "download-poll-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void start() {
        loadPersisted();
        BotProperties.DownloadsProperties config = properties.getDownloads();
        if (!config.isEnabled()) {
            log.info("[Tracker] Download tracking disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "download-tracker");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = config.getPollInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::safePollCycle, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Tracker] Started (interval: {}ms, tracked jobs: {})", intervalMs, jobs.size());
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        pollExecutor.shutdownNow();
        persist();
    }

    /**
     * Starts tracking a torrent that was just submitted.
     */
    public DownloadJob register(String ownerId, String roomId, String torrentId, String filename) {
        Instant now = clock.instant();
        DownloadJob job = DownloadJob.builder()
                .jobId(torrentId)
                .ownerId(ownerId)
                .roomId(roomId)
                .filename(filename)
                .submittedAt(now)
                .build();
        jobs.put(keyOf(job), job);
        persist();
        log.info("[Tracker] Registered torrent {} for {}", torrentId, ownerId);
        return job.copy();
    }

    public List<DownloadJob> jobsOf(String ownerId) {
        return jobs.values().stream()
                .filter(job -> ownerId.equals(job.getOwnerId()))
                .map(this::copyOf)
                .sorted(Comparator.comparing(DownloadJob::getSubmittedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public Optional<DownloadJob> find(String ownerId, String jobId) {
        DownloadJob job = jobs.get(ownerId + "/" + jobId);
        return job != null ? Optional.of(copyOf(job)) : Optional.empty();
    }

    public int size() {
        return jobs.size();
    }

    /**
     * Runs one polling cycle and waits for it to finish. Overlapping calls are
     * skipped.
     */
    public void pollCycle() {
        if (!polling.compareAndSet(false, true)) {
            log.debug("[Tracker] Previous cycle still running, skipping");
            return;
        }
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (Map.Entry<String, DownloadJob> entry : jobs.entrySet()) {
                String key = entry.getKey();
                DownloadJob job = entry.getValue();
                if (isTerminal(job)) {
                    announce(key, job);
                } else {
                    tasks.add(pollExecutor.submit(() -> pollJob(key, job)));
                }
            }
            awaitAll(tasks);
            persist();
        } finally {
            polling.set(false);
        }
    }

    /**
     * Delivery report for a terminal job announced earlier.
     */
    public void onNotificationResult(String key, boolean delivered) {
        awaitingDelivery.remove(key);
        if (!delivered) {
            log.warn("[Tracker] Notification for {} was not delivered, will retry next cycle", key);
            return;
        }
        if (jobs.remove(key) != null) {
            log.info("[Tracker] Notified and removed {}", key);
            persist();
        }
    }

    public static String keyOf(DownloadJob job) {
        return job.getOwnerId() + "/" + job.getJobId();
    }

    void pollJob(String key, DownloadJob job) {
        Instant now = clock.instant();
        boolean becameTerminal;
        synchronized (job) {
            if (job.isTerminal()) {
                return;
            }
            becameTerminal = evaluate(job, now);
        }
        if (becameTerminal) {
            announce(key, job);
        }
    }

    private boolean evaluate(DownloadJob job, Instant now) {
        if (job.isOlderThan(properties.getDownloads().getMaxAge(), now)) {
            job.transitionTo(DownloadState.EXPIRED);
            log.info("[Tracker] {} expired", job.getJobId());
            return true;
        }

        Optional<String> apiKey = sessionService.find(job.getOwnerId())
                .filter(UserSession::hasDebridKey)
                .map(UserSession::getDebridApiKey);
        if (apiKey.isEmpty()) {
            return fail(job, "No Real-Debrid API key configured");
        }

        DebridPort.TorrentInfo info;
        try {
            info = debridPort.getTorrentInfo(apiKey.get(), job.getJobId());
        } catch (DebridPort.DebridException e) {
            if (e.getKind() == DebridPort.DebridException.Kind.NOT_FOUND) {
                return fail(job, "Torrent no longer exists");
            }
            if (e.getKind() == DebridPort.DebridException.Kind.UNAUTHORIZED) {
                return fail(job, "Invalid Real-Debrid API key");
            }
            log.debug("[Tracker] Transient failure polling {}: {}", job.getJobId(), e.getMessage());
            return false;
        } catch (RuntimeException e) { // NOSONAR - anything unexpected is treated as transient
            log.warn("[Tracker] Unexpected failure polling {}: {}", job.getJobId(), e.getMessage());
            return false;
        }

        job.setLastPolledAt(now);
        if (info.filename() != null && !info.filename().isBlank()) {
            job.setFilename(info.filename());
        }
        job.setProgress(info.progress());

        if (info.isDownloaded()) {
            job.setLinks(unrestrict(apiKey.get(), info.links()));
            job.transitionTo(DownloadState.READY);
            log.info("[Tracker] {} completed", job.getJobId());
            return true;
        }
        if (info.isFailed()) {
            return fail(job, "Real-Debrid status: " + info.status());
        }
        job.transitionTo(DownloadState.IN_PROGRESS);
        log.debug("[Tracker] {}: {} ({}%)", job.getJobId(), info.status(), info.progress());
        return false;
    }

    private boolean fail(DownloadJob job, String reason) {
        if (job.transitionTo(DownloadState.FAILED)) {
            job.setFailureReason(reason);
            log.info("[Tracker] {} failed: {}", job.getJobId(), reason);
            return true;
        }
        return false;
    }

    private List<String> unrestrict(String apiKey, List<String> links) {
        int limit = properties.getDownloads().getMaxLinksInNotification();
        List<String> result = new ArrayList<>();
        for (int i = 0; i < links.size(); i++) {
            String link = links.get(i);
            if (i >= limit) {
                result.add(link);
                continue;
            }
            try {
                result.add(debridPort.unrestrictLink(apiKey, link));
            } catch (DebridPort.DebridException e) {
                log.debug("[Tracker] Could not unrestrict {}: {}", link, e.getMessage());
                result.add(link);
            }
        }
        return result;
    }

    private void announce(String key, DownloadJob job) {
        if (!awaitingDelivery.add(key)) {
            return;
        }
        try {
            eventPublisher.publishEvent(new JobStatusChangeEvent(copyOf(job), clock.instant()));
        } catch (RuntimeException e) { // NOSONAR - retried next cycle
            awaitingDelivery.remove(key);
            log.warn("[Tracker] Could not announce {}: {}", key, e.getMessage());
        }
    }

    private void awaitAll(List<Future<?>> tasks) {
        long deadline = System.nanoTime() + properties.getDownloads().getPollInterval().toNanos();
        for (Future<?> task : tasks) {
            try {
                task.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                log.warn("[Tracker] Poll task still running at end of cycle");
            } catch (ExecutionException e) {
                log.error("[Tracker] Poll task failed: {}", e.getCause() != null ? e.getCause().getMessage() : e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void safePollCycle() {
        try {
            pollCycle();
        } catch (Exception e) { // NOSONAR - keep the schedule alive
            log.error("[Tracker] Poll cycle failed", e);
        }
    }

    private boolean isTerminal(DownloadJob job) {
        synchronized (job) {
            return job.isTerminal();
        }
    }

    private DownloadJob copyOf(DownloadJob job) {
        synchronized (job) {
            return job.copy();
        }
    }

    void loadPersisted() {
        try {
            String json = storagePort.getText(DOWNLOADS_DIR, JOBS_FILE).join();
            if (json == null || json.isBlank()) {
                return;
            }
            List<DownloadJob> loaded = objectMapper.readValue(json, new TypeReference<List<DownloadJob>>() {
            });
            for (DownloadJob job : loaded) {
                jobs.put(keyOf(job), job);
            }
            log.info("[Tracker] Restored {} jobs", loaded.size());
        } catch (Exception e) { // NOSONAR - start with an empty tracker
            log.error("[Tracker] Failed to restore jobs: {}", e.getMessage());
        }
    }

    private void persist() {
        synchronized (persistLock) {
            try {
                List<DownloadJob> snapshot = jobs.values().stream().map(this::copyOf).toList();
                String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
                storagePort.putTextAtomic(DOWNLOADS_DIR, JOBS_FILE, json, true).join();
            } catch (Exception e) { // NOSONAR - in-memory state stays authoritative
                log.error("[Tracker] Failed to persist jobs: {}", e.getMessage());
            }
        }
    }
}
