package com.bistroAssist.queryDemo.context.store;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.context.model.ConversationSession;
import com.bistroAssist.queryDemo.context.model.ConversationTurn;
import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryConversationStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private InMemoryConversationStore store;

    @BeforeEach
    void setUp() {
        AssistantProperties properties = new AssistantProperties();
        properties.getSession().setMaxStoredTurns(3);
        store = new InMemoryConversationStore(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void missingSessionIdStartsNewSession() {
        ConversationSession session = store.getOrCreate("bella-vista", null, "cust123");

        assertNotNull(session.getSessionId());
        assertEquals(NOW.plus(Duration.ofMinutes(30)), session.getExpiresAt());
        assertEquals(0, session.getTurnCount());
    }

    @Test
    void sameIdReturnsSameSessionPerBusiness() {
        ConversationSession first = store.getOrCreate("bella-vista", "session-0001", null);
        ConversationSession again = store.getOrCreate("bella-vista", "session-0001", null);
        ConversationSession otherBusiness = store.getOrCreate("green-bowl", "session-0001", null);

        assertSame(first, again);
        assertNotSame(first, otherBusiness);
    }

    @Test
    void historyIsBoundedAndOldestFirst() {
        store.getOrCreate("bella-vista", "session-0002", null);
        for (int i = 1; i <= 5; i++) {
            store.appendTurn("bella-vista", "session-0002",
                    ConversationTurn.user("q" + i, QueryIntent.MENU_INQUIRY, NOW));
        }

        List<ConversationTurn> history = store.getHistory("bella-vista", "session-0002", 10);
        assertEquals(List.of("q3", "q4", "q5"), history.stream().map(ConversationTurn::content).toList());
        assertEquals(List.of("q5"), store.getHistory("bella-vista", "session-0002", 1).stream()
                .map(ConversationTurn::content).toList());
    }

    @Test
    void turnCountKeepsCountingPastStoredHistory() {
        // Given
        ConversationSession session = store.getOrCreate("bella-vista", "session-0003", null);

        // When
        for (int i = 1; i <= 5; i++) {
            store.appendTurn("bella-vista", "session-0003", ConversationTurn.assistant("a" + i, NOW));
        }

        // Then
        assertEquals(5, session.getTurnCount());
        assertEquals(3, session.getTurns().size());
    }

    @Test
    void turnsAreReturnedAsSnapshot() {
        ConversationSession session = store.getOrCreate("bella-vista", "session-0004", null);
        store.appendTurn("bella-vista", "session-0004", ConversationTurn.assistant("hello", NOW));

        List<ConversationTurn> snapshot = session.getTurns();
        store.appendTurn("bella-vista", "session-0004", ConversationTurn.assistant("again", NOW));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(ConversationTurn.assistant("x", NOW)));
    }

    @Test
    void unknownSessionHasNoHistoryAndIgnoresAppends() {
        store.appendTurn("bella-vista", "missing-session", ConversationTurn.assistant("hello", NOW));

        assertTrue(store.getHistory("bella-vista", "missing-session", 10).isEmpty());
        assertTrue(store.getHistory("bella-vista", null, 10).isEmpty());
    }
}
