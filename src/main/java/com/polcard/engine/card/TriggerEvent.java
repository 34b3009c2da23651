package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Events a rule can be bound to.
 */
public enum TriggerEvent {
    ALWAYS("always"),
    ON_SUMMON("onSummon"),
    ON_PLAY("onPlay"),
    SP_PHASE("spPhase"),
    FINAL_CALCULATION("finalCalculation");

    private final String jsonValue;

    TriggerEvent(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static TriggerEvent fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("TriggerEvent cannot be null");
        }
        for (TriggerEvent candidate : values()) {
            if (candidate.jsonValue.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown TriggerEvent: " + value);
    }
}
