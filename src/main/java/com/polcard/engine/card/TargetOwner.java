package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whose cards a rule targets, relative to the rule's source player.
 */
public enum TargetOwner {
    SELF("self"),
    OPPONENT("opponent"),
    BOTH("both");

    private final String jsonValue;

    TargetOwner(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static TargetOwner fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("TargetOwner cannot be null");
        }
        for (TargetOwner candidate : values()) {
            if (candidate.jsonValue.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown TargetOwner: " + value);
    }
}
