package me.subaru.bot.domain.service;

import me.subaru.bot.domain.model.DownloadJob;
import me.subaru.bot.domain.model.UserSession;
import me.subaru.bot.port.inbound.CommandPort.CommandResult;
import me.subaru.bot.port.outbound.DebridPort;
import me.subaru.bot.port.outbound.DebridPort.DebridException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MagnetCommandHandlerTest {

    private static final String ALICE = "@alice:example.org";
    private static final String ROOM = "!room:example.org";
    private static final String MAGNET = "magnet:?xt=urn:btih:abc";

    private DebridPort debridPort;
    private SessionService sessionService;
    private DownloadTracker downloadTracker;
    private MagnetCommandHandler handler;

    @BeforeEach
    void setUp() {
        debridPort = mock(DebridPort.class);
        sessionService = mock(SessionService.class);
        downloadTracker = mock(DownloadTracker.class);
        handler = new MagnetCommandHandler(debridPort, sessionService, downloadTracker);
        when(sessionService.snapshot(ALICE))
                .thenReturn(UserSession.builder().userId(ALICE).debridApiKey("rd-key").build());
    }

    @Test
    void addMagnetSubmitsSelectsAndTracks() {
        when(debridPort.addMagnet("rd-key", MAGNET)).thenReturn("T1");
        when(debridPort.getTorrentInfo("rd-key", "T1")).thenReturn(info("T1", "movie.mkv", "waiting_files_selection"));
        when(downloadTracker.register(ALICE, ROOM, "T1", "movie.mkv"))
                .thenReturn(DownloadJob.builder().jobId("T1").ownerId(ALICE).build());

        CommandResult result = handler.addMagnet(ALICE, ROOM, MAGNET);

        assertEquals(CommandResult.Status.OK, result.status());
        assertTrue(result.output().contains("`T1`"));
        verify(debridPort).selectAllFiles("rd-key", "T1");
        verify(downloadTracker).register(ALICE, ROOM, "T1", "movie.mkv");
    }

    @Test
    void addMagnetRejectsNonMagnetArgument() {
        CommandResult result = handler.addMagnet(ALICE, ROOM, "http://example.org/file.torrent");

        assertEquals(CommandResult.Status.FAILED, result.status());
        verifyNoInteractions(debridPort);
    }

    @Test
    void addMagnetWithoutKeyAsksForConfiguration() {
        when(sessionService.snapshot(ALICE)).thenReturn(UserSession.builder().userId(ALICE).build());

        CommandResult result = handler.addMagnet(ALICE, ROOM, MAGNET);

        assertTrue(result.output().contains("!magnet-config"));
        verifyNoInteractions(debridPort, downloadTracker);
    }

    @Test
    void addMagnetWithInvalidKeyIsBackendFailure() {
        when(debridPort.addMagnet("rd-key", MAGNET))
                .thenThrow(new DebridException(DebridException.Kind.UNAUTHORIZED, "bad token"));

        CommandResult result = handler.addMagnet(ALICE, ROOM, MAGNET);

        assertEquals(CommandResult.Status.BACKEND_UNAVAILABLE, result.status());
        assertTrue(result.output().contains("Invalid Real-Debrid API key"));
    }

    @Test
    void failedAutoSelectDoesNotTrackJob() {
        when(debridPort.addMagnet("rd-key", MAGNET)).thenReturn("T1");
        when(debridPort.getTorrentInfo("rd-key", "T1")).thenReturn(info("T1", "movie.mkv", "magnet_conversion"));
        doThrow(new DebridException(DebridException.Kind.TRANSIENT, "503"))
                .when(debridPort).selectAllFiles("rd-key", "T1");

        CommandResult result = handler.addMagnet(ALICE, ROOM, MAGNET);

        assertEquals(CommandResult.Status.OK, result.status());
        assertTrue(result.output().contains("Auto-start failed"));
        verifyNoInteractions(downloadTracker);
    }

    @Test
    @SuppressWarnings("unchecked")
    void configureStoresKeyInSession() {
        UserSession live = UserSession.builder().userId(ALICE).build();
        when(sessionService.update(eq(ALICE), any())).thenAnswer(invocation -> {
            Function<UserSession, Object> mutation = invocation.getArgument(1);
            return mutation.apply(live);
        });

        CommandResult result = handler.configure(ALICE, " new-key ");

        assertEquals(CommandResult.Status.OK, result.status());
        assertEquals("new-key", live.getDebridApiKey());
    }

    @Test
    void configureRejectsBlankKey() {
        assertEquals(CommandResult.Status.FAILED, handler.configure(ALICE, "").status());
        verify(sessionService, never()).update(anyString(), any());
    }

    @Test
    void listRendersEachTorrentState() {
        when(debridPort.listTorrents("rd-key", 11)).thenReturn(List.of(
                new DebridPort.TorrentInfo("T1", "done.mkv", "downloaded", 100, 1, List.of("https://h/1"), null),
                info("T2", "broken.iso", "error"),
                new DebridPort.TorrentInfo("T3", "big.tar", "downloading", 55, 1, List.of(), null)));
        when(debridPort.unrestrictLink("rd-key", "https://h/1")).thenReturn("https://direct/1");

        String text = handler.list(ALICE).output();

        assertTrue(text.contains("✅ **done.mkv**"));
        assertTrue(text.contains("📥 https://direct/1"));
        assertTrue(text.contains("❌ **broken.iso** - Status: `error`"));
        assertTrue(text.contains("⏳ **big.tar** - downloading 55%"));
    }

    @Test
    void listWithoutTorrentsSaysSo() {
        when(debridPort.listTorrents("rd-key", 11)).thenReturn(List.of());

        assertEquals("📭 No torrents found.", handler.list(ALICE).output());
    }

    @Test
    void infoForUnknownTorrentSuggestsList() {
        when(debridPort.getTorrentInfo("rd-key", "ZZZ"))
                .thenThrow(new DebridException(DebridException.Kind.NOT_FOUND, "unknown_ressource"));

        CommandResult result = handler.info(ALICE, "ZZZ");

        assertEquals(CommandResult.Status.FAILED, result.status());
        assertTrue(result.output().contains("Torrent not found"));
    }

    @Test
    void infoShowsTorrentDetails() {
        when(debridPort.getTorrentInfo("rd-key", "T1")).thenReturn(info("T1", "movie.mkv", "downloading"));

        String text = handler.info(ALICE, " T1 ").output();

        assertTrue(text.contains("(ID: T1)"));
        assertTrue(text.contains("• **Status:** downloading"));
    }

    private DebridPort.TorrentInfo info(String id, String filename, String status) {
        return new DebridPort.TorrentInfo(id, filename, status, 0, 0, List.of(), "2026-03-01T10:00:00.000Z");
    }
}
