package me.subaru.bot.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UserSessionTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void appendTurnEvictsOldestBeyondMaxHistory() {
        UserSession session = UserSession.builder().userId("@alice:example.org").maxHistory(4).build();

        for (int i = 1; i <= 6; i++) {
            session.appendTurn(ChatTurn.user("msg-" + i, NOW));
        }

        assertEquals(4, session.getHistory().size());
        assertEquals("msg-3", session.getHistory().get(0).text());
        assertEquals("msg-6", session.getHistory().get(3).text());
    }

    @Test
    void lowerMaxHistoryTrimsExistingTurns() {
        UserSession session = UserSession.builder().userId("@alice:example.org").build();
        for (int i = 1; i <= 10; i++) {
            session.appendTurn(ChatTurn.user("msg-" + i, NOW));
        }

        session.setMaxHistory(2);

        assertEquals(List.of("msg-9", "msg-10"), session.getHistory().stream().map(ChatTurn::text).toList());
    }

    @Test
    void setHistoryAppliesBound() {
        UserSession session = UserSession.builder().maxHistory(2).build();
        List<ChatTurn> loaded = new ArrayList<>();
        loaded.add(ChatTurn.user("a", NOW));
        loaded.add(ChatTurn.assistant("b", NOW));
        loaded.add(ChatTurn.user("c", NOW));

        session.setHistory(loaded);

        assertEquals(2, session.getHistory().size());
        assertEquals("b", session.getHistory().get(0).text());
    }

    @Test
    void historyIsNotModifiableFromOutside() {
        UserSession session = UserSession.builder().build();
        session.appendTurn(ChatTurn.user("hi", NOW));

        List<ChatTurn> history = session.getHistory();

        assertThrows(UnsupportedOperationException.class, () -> history.add(ChatTurn.user("x", NOW)));
    }

    @Test
    void recentHistoryReturnsNewestTurnsOldestFirst() {
        UserSession session = UserSession.builder().build();
        session.appendTurn(ChatTurn.user("one", NOW));
        session.appendTurn(ChatTurn.assistant("two", NOW));
        session.appendTurn(ChatTurn.user("three", NOW));

        List<ChatTurn> recent = session.recentHistory(2);

        assertEquals(List.of("two", "three"), recent.stream().map(ChatTurn::text).toList());
    }

    @Test
    void copyIsDetached() {
        UserSession session = UserSession.builder().userId("@alice:example.org").build();
        session.appendTurn(ChatTurn.user("one", NOW));

        UserSession copy = session.copy();
        session.appendTurn(ChatTurn.user("two", NOW));
        session.recordCommand();

        assertEquals(1, copy.getHistory().size());
        assertEquals(0, copy.getCommandCount());
    }

    @Test
    void hasDebridKeyIgnoresBlank() {
        UserSession session = UserSession.builder().debridApiKey("  ").build();
        assertFalse(session.hasDebridKey());

        session.setDebridApiKey("abc");
        assertTrue(session.hasDebridKey());
    }
}
