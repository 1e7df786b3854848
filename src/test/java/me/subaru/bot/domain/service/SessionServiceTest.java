package me.subaru.bot.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.subaru.bot.domain.model.ChatTurn;
import me.subaru.bot.domain.model.CommandTable;
import me.subaru.bot.domain.model.ConfigReloadedEvent;
import me.subaru.bot.domain.model.UserProfile;
import me.subaru.bot.domain.model.UserSession;
import me.subaru.bot.infrastructure.config.AutoConfiguration;
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SessionServiceTest {

    private static final String ALICE = "@alice:example.org";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private StoragePort storagePort;
    private ConfigRegistry configRegistry;
    private ObjectMapper objectMapper;
    private BotProperties properties;
    private SessionService service;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        configRegistry = mock(ConfigRegistry.class);
        objectMapper = AutoConfiguration.objectMapper();
        properties = new BotProperties();
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(configRegistry.snapshot()).thenReturn(CommandTable.empty());
        service = new SessionService(storagePort, objectMapper, configRegistry, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void getOrCreateSeedsDefaultsAndPersists() {
        UserSession session = service.getOrCreate(ALICE);

        assertEquals(ALICE, session.getUserId());
        assertFalse(session.isAiEnabled());
        assertEquals("subaru", session.getTrigger());
        assertEquals(20, session.getMaxHistory());
        verify(storagePort).putTextAtomic(eq("sessions"), eq("_alice_example.org.json"), anyString(), eq(false));
    }

    @Test
    void getOrCreateAppliesProfile() {
        UserProfile profile = new UserProfile(true,
                Map.of("hey bot", new UserProfile.TriggerProfile("key", "gpt-4o", "Be brief", 5)), "rd-key");
        when(configRegistry.snapshot()).thenReturn(new CommandTable(Map.of(), Map.of(ALICE, profile), NOW));

        UserSession session = service.getOrCreate(ALICE);

        assertTrue(session.isAiEnabled());
        assertEquals("hey bot", session.getTrigger());
        assertEquals("key", session.getAiApiKey());
        assertEquals("gpt-4o", session.getModel());
        assertEquals("Be brief", session.getSystemPrompt());
        assertEquals(5, session.getMaxHistory());
        assertEquals("rd-key", session.getDebridApiKey());
    }

    @Test
    void getOrCreateReturnsSameInstance() {
        assertSame(service.getOrCreate(ALICE), service.getOrCreate(ALICE));
        assertEquals(1, service.size());
    }

    @Test
    void updateMutatesAndPersistsSession() throws Exception {
        service.getOrCreate(ALICE);
        clearInvocations(storagePort);

        long count = service.update(ALICE, session -> {
            session.recordInboundMessage();
            session.appendTurn(ChatTurn.user("hello", NOW));
            return session.getMessageCount();
        });

        assertEquals(1, count);
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort).putTextAtomic(eq("sessions"), anyString(), json.capture(), eq(false));
        UserSession persisted = objectMapper.readValue(json.getValue(), UserSession.class);
        assertEquals(1, persisted.getMessageCount());
        assertEquals("hello", persisted.getHistory().get(0).text());
    }

    @Test
    void snapshotIsDetachedFromLiveSession() {
        UserSession snapshot = service.snapshot(ALICE);

        service.update(ALICE, session -> {
            session.recordCommand();
            return null;
        });

        assertEquals(0, snapshot.getCommandCount());
        assertEquals(1, service.snapshot(ALICE).getCommandCount());
    }

    @Test
    void findDoesNotCreateSessions() {
        assertTrue(service.find(ALICE).isEmpty());
        assertEquals(0, service.size());
    }

    @Test
    void persistFailureKeepsInMemoryState() {
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        service.update(ALICE, session -> {
            session.recordCommand();
            return null;
        });

        assertEquals(1, service.snapshot(ALICE).getCommandCount());
    }

    @Test
    void onConfigReloadedRefreshesAiSettingsButKeepsHistory() {
        service.update(ALICE, session -> {
            session.appendTurn(ChatTurn.user("hello", NOW));
            return null;
        });
        UserProfile profile = new UserProfile(true,
                Map.of("subaru", new UserProfile.TriggerProfile("new-key", "gemini-2.5-pro", null, null)), null);

        service.onConfigReloaded(new ConfigReloadedEvent(new CommandTable(Map.of(), Map.of(ALICE, profile), NOW)));

        UserSession session = service.snapshot(ALICE);
        assertTrue(session.isAiEnabled());
        assertEquals("new-key", session.getAiApiKey());
        assertEquals("gemini-2.5-pro", session.getModel());
        assertEquals(1, session.getHistory().size());
    }

    @Test
    void onConfigReloadedRevokesAiForUserWithoutProfile() {
        UserProfile profile = new UserProfile(true,
                Map.of("subaru", new UserProfile.TriggerProfile("secret-key", null, null, null)), "rd-key");
        when(configRegistry.snapshot()).thenReturn(new CommandTable(Map.of(), Map.of(ALICE, profile), NOW));
        assertTrue(service.getOrCreate(ALICE).isAiEnabled());

        service.onConfigReloaded(new ConfigReloadedEvent(CommandTable.empty()));

        UserSession session = service.snapshot(ALICE);
        assertFalse(session.isAiEnabled());
        assertNull(session.getAiApiKey());
        assertEquals("rd-key", session.getDebridApiKey());
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort, atLeastOnce()).putTextAtomic(eq("sessions"), eq("_alice_example.org.json"),
                json.capture(), eq(false));
        assertFalse(json.getValue().contains("secret-key"));
    }

    @Test
    void loadPersistedSessionsRevokesAiOfRemovedUsers() throws Exception {
        UserSession stored = UserSession.builder().userId(ALICE).aiEnabled(true).aiApiKey("old-key").build();
        when(storagePort.listObjects("sessions", ""))
                .thenReturn(CompletableFuture.completedFuture(List.of("_alice_example.org.json")));
        when(storagePort.getText("sessions", "_alice_example.org.json"))
                .thenReturn(CompletableFuture.completedFuture(objectMapper.writeValueAsString(stored)));

        service.loadPersistedSessions();

        UserSession session = service.find(ALICE).orElseThrow();
        assertFalse(session.isAiEnabled());
        assertNull(session.getAiApiKey());
    }

    @Test
    void loadPersistedSessionsRestoresCache() throws Exception {
        UserSession stored = UserSession.builder().userId(ALICE).commandCount(7).build();
        when(storagePort.listObjects("sessions", ""))
                .thenReturn(CompletableFuture.completedFuture(List.of("_alice_example.org.json", "notes.txt")));
        when(storagePort.getText("sessions", "_alice_example.org.json"))
                .thenReturn(CompletableFuture.completedFuture(objectMapper.writeValueAsString(stored)));

        service.loadPersistedSessions();

        assertEquals(7, service.find(ALICE).orElseThrow().getCommandCount());
        verify(storagePort, never()).getText("sessions", "notes.txt");
    }

    @Test
    void loadPersistedSessionsSkipsCorruptFiles() {
        when(storagePort.listObjects("sessions", ""))
                .thenReturn(CompletableFuture.completedFuture(List.of("broken.json")));
        when(storagePort.getText("sessions", "broken.json"))
                .thenReturn(CompletableFuture.completedFuture("{not json"));

        service.loadPersistedSessions();

        assertEquals(0, service.size());
    }

    @Test
    void fileNameReplacesUnsafeCharacters() {
        assertEquals("_alice_example.org.json", SessionService.fileName(ALICE));
    }
}
