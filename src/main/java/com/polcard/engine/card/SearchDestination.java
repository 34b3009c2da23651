package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where cards chosen from a deck search are put.
 */
public enum SearchDestination {
    HAND("hand"),
    SP_ZONE("spZone"),
    HELP_ZONE("helpZone"),
    CONDITIONAL_HELP_ZONE("conditionalHelpZone");

    private final String jsonValue;

    SearchDestination(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static SearchDestination fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("SearchDestination cannot be null");
        }
        for (SearchDestination candidate : values()) {
            if (candidate.jsonValue.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown SearchDestination: " + value);
    }
}
