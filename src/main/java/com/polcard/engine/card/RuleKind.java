package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a rule holds while its card is on the field or fires once on an event.
 */
public enum RuleKind {
    CONTINUOUS("continuous"),
    TRIGGERED("triggered");

    private final String jsonValue;

    RuleKind(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static RuleKind fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("RuleKind cannot be null");
        }
        for (RuleKind candidate : values()) {
            if (candidate.jsonValue.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown RuleKind: " + value);
    }
}
