package com.polcard.engine.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single entry of the event stream.
 *
 * @param id                {@code event_{timestamp}_{n}}
 * @param expiresAt         time after which a processed event may be dropped
 * @param frontendProcessed set once a client acknowledged the event
 */
public record GameEvent(
    @JsonProperty("id") String id,
    @JsonProperty("type") EventType type,
    @JsonProperty("data") Map<String, Object> data,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("expiresAt") long expiresAt,
    @JsonProperty("frontendProcessed") boolean frontendProcessed
) {
    public GameEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public GameEvent processed() {
        return new GameEvent(id, type, data, timestamp, expiresAt, true);
    }

    public boolean isExpired(long now) {
        return expiresAt <= now;
    }

    public Object get(String key) {
        return data.get(key);
    }
}
