package com.polcard.engine.event;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds ordered event payloads from alternating keys and values. Null values are skipped.
 */
public final class EventData {

    private EventData() {
        // Utility class - prevent instantiation
    }

    public static Map<String, Object> of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Event data needs key/value pairs");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            Object value = keysAndValues[i + 1];
            if (value != null) {
                data.put(String.valueOf(keysAndValues[i]), value);
            }
        }
        return data;
    }
}
