package com.polcard.engine.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-game ordered list of events for clients to consume. Entries are only removed
 * once they are both expired and acknowledged.
 */
public class EventStream {
    public static final long DEFAULT_TTL_MILLIS = 3000L;

    @JsonProperty("events")
    private List<GameEvent> events = new ArrayList<>();

    @JsonProperty("counter")
    private long counter;

    @JsonProperty("ttlMillis")
    private long ttlMillis = DEFAULT_TTL_MILLIS;

    public EventStream() {
    }

    public EventStream(long ttlMillis) {
        this.ttlMillis = ttlMillis;
    }

    public List<GameEvent> getEvents() {
        return List.copyOf(events);
    }

    public void setEvents(List<GameEvent> events) {
        this.events = events != null ? new ArrayList<>(events) : new ArrayList<>();
    }

    public long getCounter() {
        return counter;
    }

    public void setCounter(long counter) {
        this.counter = counter;
    }

    public long getTtlMillis() {
        return ttlMillis;
    }

    public void setTtlMillis(long ttlMillis) {
        this.ttlMillis = ttlMillis;
    }

    public GameEvent append(EventType type, Map<String, Object> data, long timestamp) {
        counter++;
        GameEvent event = new GameEvent("event_" + timestamp + "_" + counter, type, data,
                timestamp, timestamp + ttlMillis, false);
        events.add(event);
        return event;
    }

    /**
     * Mark the given events as processed.
     *
     * @return the events that were found and marked
     */
    public List<GameEvent> mark(Collection<String> eventIds) {
        Set<String> ids = new HashSet<>(eventIds);
        List<GameEvent> marked = new ArrayList<>();
        for (int i = 0; i < events.size(); i++) {
            GameEvent event = events.get(i);
            if (ids.contains(event.id())) {
                GameEvent processed = event.processed();
                events.set(i, processed);
                marked.add(processed);
            }
        }
        return marked;
    }

    /**
     * Drop events that are expired and already processed.
     *
     * @return number of events removed
     */
    public int cleanExpired(long now) {
        int before = events.size();
        events.removeIf(e -> e.frontendProcessed() && e.isExpired(now));
        return before - events.size();
    }

    /**
     * Events appended after the given event id, or all events when the id is unknown.
     */
    public List<GameEvent> after(String eventId) {
        if (eventId != null) {
            for (int i = 0; i < events.size(); i++) {
                if (events.get(i).id().equals(eventId)) {
                    return List.copyOf(events.subList(i + 1, events.size()));
                }
            }
        }
        return getEvents();
    }

    public List<GameEvent> ofType(EventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    public String lastEventId() {
        return events.isEmpty() ? null : events.get(events.size() - 1).id();
    }

    public int size() {
        return events.size();
    }
}
