package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Combo bonuses available to a field of face-up characters.
 */
public enum ComboType {
    ALL_SAME_TYPE("all_same_type"),
    ALL_DIFFERENT_TYPE("all_different_type"),
    HIGH_POWER_TRIO("high_power_trio"),
    TRAIT_SYNERGY("trait_synergy"),
    BALANCED_POWER("balanced_power");

    private final String jsonValue;

    ComboType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static ComboType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ComboType cannot be null");
        }
        for (ComboType candidate : values()) {
            if (candidate.jsonValue.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ComboType: " + value);
    }
}
