package me.subaru.bot.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.subaru.bot.domain.model.DownloadJob;
import me.subaru.bot.domain.model.DownloadState;
import me.subaru.bot.domain.model.JobStatusChangeEvent;
import me.subaru.bot.domain.model.UserSession;
import me.subaru.bot.infrastructure.config.AutoConfiguration;
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.outbound.DebridPort;
import me.subaru.bot.port.outbound.StoragePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DownloadTrackerTest {

    private static final String ALICE = "@alice:example.org";
    private static final String ROOM = "!room:example.org";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private DebridPort debridPort;
    private SessionService sessionService;
    private StoragePort storagePort;
    private ApplicationEventPublisher eventPublisher;
    private ObjectMapper objectMapper;
    private BotProperties properties;
    private DownloadTracker tracker;

    @BeforeEach
    void setUp() {
        debridPort = mock(DebridPort.class);
        sessionService = mock(SessionService.class);
        storagePort = mock(StoragePort.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        objectMapper = AutoConfiguration.objectMapper();
        properties = new BotProperties();
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(sessionService.find(ALICE))
                .thenReturn(Optional.of(UserSession.builder().userId(ALICE).debridApiKey("rd-key").build()));
        tracker = new DownloadTracker(debridPort, sessionService, storagePort, objectMapper, eventPublisher,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        tracker.shutdown();
    }

    @Test
    void downloadedTorrentBecomesReadyWithDirectLinks() {
        tracker.register(ALICE, ROOM, "T1", "movie.mkv");
        when(debridPort.getTorrentInfo("rd-key", "T1"))
                .thenReturn(info("downloaded", 100, List.of("https://hoster/1")));
        when(debridPort.unrestrictLink("rd-key", "https://hoster/1")).thenReturn("https://direct/1");

        tracker.pollCycle();

        JobStatusChangeEvent event = captureSingleEvent();
        assertEquals(DownloadState.READY, event.job().getState());
        assertEquals(List.of("https://direct/1"), event.job().getLinks());
        assertEquals(ROOM, event.job().getRoomId());
    }

    @Test
    void pendingTorrentMovesToInProgressWithoutEvent() {
        tracker.register(ALICE, ROOM, "T1", "movie.mkv");
        when(debridPort.getTorrentInfo("rd-key", "T1")).thenReturn(info("downloading", 42, List.of()));

        tracker.pollCycle();

        DownloadJob job = tracker.find(ALICE, "T1").orElseThrow();
        assertEquals(DownloadState.IN_PROGRESS, job.getState());
        assertEquals(42, job.getProgress());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void notFoundMarksJobFailed() {
        tracker.register(ALICE, ROOM, "T1", "movie.mkv");
        when(debridPort.getTorrentInfo("rd-key", "T1")).thenThrow(
                new DebridPort.DebridException(DebridPort.DebridException.Kind.NOT_FOUND, "gone"));

        tracker.pollCycle();

        JobStatusChangeEvent event = captureSingleEvent();
        assertEquals(DownloadState.FAILED, event.job().getState());
        assertEquals("Torrent no longer exists", event.job().getFailureReason());
    }

    @Test
    void errorStatusMarksJobFailed() {
        tracker.register(ALICE, ROOM, "T1", "movie.mkv");
        when(debridPort.getTorrentInfo("rd-key", "T1")).thenReturn(info("magnet_error", 0, List.of()));

        tracker.pollCycle();

        assertEquals(DownloadState.FAILED, captureSingleEvent().job().getState());
    }

    @Test
    void transientFailureLeavesStateUnchanged() {
        tracker.register(ALICE, ROOM, "T1", "movie.mkv");
        when(debridPort.getTorrentInfo("rd-key", "T1")).thenThrow(
                new DebridPort.DebridException(DebridPort.DebridException.Kind.TRANSIENT, "503"));

        tracker.pollCycle();

        assertEquals(DownloadState.SUBMITTED, tracker.find(ALICE, "T1").orElseThrow().getState());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void missingApiKeyFailsJob() {
        when(sessionService.find(ALICE)).thenReturn(Optional.of(UserSession.builder().userId(ALICE).build()));
        tracker.register(ALICE, ROOM, "T1", "movie.mkv");

        tracker.pollCycle();

        assertEquals(DownloadState.FAILED, captureSingleEvent().job().getState());
        verifyNoInteractions(debridPort);
    }

    @Test
    void oldJobExpiresWithoutPolling() {
        properties.getDownloads().setMaxAge(Duration.ofHours(1));
        DownloadTracker laterTracker = new DownloadTracker(debridPort, sessionService, storagePort, objectMapper,
                eventPublisher, properties, Clock.fixed(NOW.plus(Duration.ofHours(2)), ZoneOffset.UTC));
        DownloadJob job = DownloadJob.builder().jobId("T1").ownerId(ALICE).roomId(ROOM).submittedAt(NOW).build();
        try {
            laterTracker.pollJob(ALICE + "/T1", job);
        } finally {
            laterTracker.shutdown();
        }

        assertEquals(DownloadState.EXPIRED, job.getState());
        assertEquals(DownloadState.EXPIRED, captureSingleEvent().job().getState());
        verifyNoInteractions(debridPort);
    }

    @Test
    void terminalJobIsAnnouncedOnlyOnceWhileAwaitingDelivery() {
        tracker.register(ALICE, ROOM, "T1", "movie.mkv");
        when(debridPort.getTorrentInfo("rd-key", "T1")).thenReturn(info("downloaded", 100, List.of()));

        tracker.pollCycle();
        tracker.pollCycle();
        tracker.pollCycle();

        verify(eventPublisher, times(1)).publishEvent(any(JobStatusChangeEvent.class));
        verify(debridPort, times(1)).getTorrentInfo("rd-key", "T1");
    }

    @Test
    void deliveredNotificationRemovesJob() {
        tracker.register(ALICE, ROOM, "T1", "movie.mkv");
        when(debridPort.getTorrentInfo("rd-key", "T1")).thenReturn(info("downloaded", 100, List.of()));
        tracker.pollCycle();

        tracker.onNotificationResult(ALICE + "/T1", true);

        assertEquals(0, tracker.size());
        assertTrue(tracker.find(ALICE, "T1").isEmpty());
    }

    @Test
    void undeliveredNotificationIsAnnouncedAgain() {
        tracker.register(ALICE, ROOM, "T1", "movie.mkv");
        when(debridPort.getTorrentInfo("rd-key", "T1")).thenReturn(info("downloaded", 100, List.of()));
        tracker.pollCycle();

        tracker.onNotificationResult(ALICE + "/T1", false);
        tracker.pollCycle();

        verify(eventPublisher, times(2)).publishEvent(any(JobStatusChangeEvent.class));
        assertEquals(1, tracker.size());
    }

    @Test
    void jobsArePersistedAndRestored() throws Exception {
        tracker.register(ALICE, ROOM, "T1", "movie.mkv");
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort, atLeastOnce()).putTextAtomic(eq("downloads"), eq("jobs.json"), json.capture(),
                eq(true));

        DownloadTracker restored = new DownloadTracker(debridPort, sessionService, storagePort, objectMapper,
                eventPublisher, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        when(storagePort.getText("downloads", "jobs.json"))
                .thenReturn(CompletableFuture.completedFuture(json.getValue()));
        try {
            restored.loadPersisted();
            assertEquals("movie.mkv", restored.find(ALICE, "T1").orElseThrow().getFilename());
        } finally {
            restored.shutdown();
        }
    }

    @Test
    void jobsOfListsOnlyOwnersJobs() {
        tracker.register(ALICE, ROOM, "T1", "a");
        tracker.register("@bob:example.org", ROOM, "T2", "b");

        assertEquals(1, tracker.jobsOf(ALICE).size());
        assertEquals("T1", tracker.jobsOf(ALICE).get(0).getJobId());
    }

    private JobStatusChangeEvent captureSingleEvent() {
        ArgumentCaptor<JobStatusChangeEvent> captor = ArgumentCaptor.forClass(JobStatusChangeEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        return captor.getValue();
    }

    private DebridPort.TorrentInfo info(String status, int progress, List<String> links) {
        return new DebridPort.TorrentInfo("T1", "movie.mkv", status, progress, 1024L, links, null);
    }
}
