package com.polcard.engine.event;

import com.polcard.engine.game.GameStateCodec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventStreamTest {

    private static final long NOW = 1_700_000_000_000L;

    @Test
    void testAppendAssignsIdsAndExpiry() {
        EventStream stream = new EventStream();

        GameEvent first = stream.append(EventType.TURN_SWITCH, EventData.of("playerId", "p1"), NOW);
        GameEvent second = stream.append(EventType.CARD_PLAYED, EventData.of("playerId", "p1", "cardId", null), NOW);

        assertEquals("event_" + NOW + "_1", first.id());
        assertEquals("event_" + NOW + "_2", second.id());
        assertEquals(NOW + EventStream.DEFAULT_TTL_MILLIS, first.expiresAt());
        assertFalse(first.frontendProcessed());
        assertFalse(second.data().containsKey("cardId"), "Null values are left out of the payload");
        assertEquals(second.id(), stream.lastEventId());
    }

    @Test
    void testEventDataNeedsPairs() {
        assertThrows(IllegalArgumentException.class, () -> EventData.of("playerId"));
    }

    @Test
    void testMarkAndCleanExpired() {
        EventStream stream = new EventStream(1000);
        GameEvent first = stream.append(EventType.TURN_SWITCH, EventData.of(), NOW);
        GameEvent second = stream.append(EventType.TURN_SWITCH, EventData.of(), NOW);

        assertEquals(0, stream.cleanExpired(NOW + 5000), "Unacknowledged events are kept");

        List<GameEvent> marked = stream.mark(List.of(first.id(), "event_missing"));
        assertEquals(1, marked.size());
        assertTrue(marked.get(0).frontendProcessed());

        assertEquals(0, stream.cleanExpired(NOW + 999), "Not expired yet");
        assertEquals(1, stream.cleanExpired(NOW + 1000));
        assertEquals(List.of(second), stream.getEvents());
    }

    @Test
    void testAfter() {
        EventStream stream = new EventStream();
        GameEvent first = stream.append(EventType.TURN_SWITCH, EventData.of(), NOW);
        GameEvent second = stream.append(EventType.CARD_PLAYED, EventData.of(), NOW + 1);

        assertEquals(List.of(second), stream.after(first.id()));
        assertTrue(stream.after(second.id()).isEmpty());
        assertEquals(2, stream.after("unknown").size());
        assertEquals(2, stream.after(null).size());
    }

    @Test
    void testOfType() {
        EventStream stream = new EventStream();
        stream.append(EventType.TURN_SWITCH, EventData.of(), NOW);
        stream.append(EventType.CARD_PLAYED, EventData.of(), NOW);
        stream.append(EventType.TURN_SWITCH, EventData.of(), NOW);

        assertEquals(2, stream.ofType(EventType.TURN_SWITCH).size());
        assertTrue(stream.ofType(EventType.GAME_END).isEmpty());
    }

    @Test
    void testJsonRoundTrip() throws Exception {
        EventStream stream = new EventStream();
        stream.append(EventType.CARD_PLAYED, EventData.of("playerId", "p1", "zone", "top"), NOW);

        String json = GameStateCodec.mapper().writeValueAsString(stream);
        EventStream copy = GameStateCodec.mapper().readValue(json, EventStream.class);

        assertEquals(stream.getEvents(), copy.getEvents());
        assertEquals(1, copy.getCounter());
        assertEquals("event_" + NOW + "_2", copy.append(EventType.TURN_SWITCH, EventData.of(), NOW).id(),
                "The counter survives serialization");
    }
}
