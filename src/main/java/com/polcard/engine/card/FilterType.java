package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Filters applied while enumerating rule targets.
 */
public enum FilterType {
    HAS_TRAIT("hasTrait"),
    HAS_GAME_TYPE("hasGameType"),
    GAME_TYPE_OR("gameTypeOr"),
    NAME_CONTAINS("nameContains");

    private final String jsonValue;

    FilterType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static FilterType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("FilterType cannot be null");
        }
        for (FilterType candidate : values()) {
            if (candidate.jsonValue.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown FilterType: " + value);
    }
}
