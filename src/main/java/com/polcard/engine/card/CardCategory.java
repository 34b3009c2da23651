package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card categories.
 */
public enum CardCategory {
    CHARACTER("character"),
    HELP("help"),
    SP("sp"),
    LEADER("leader");

    private final String jsonValue;

    CardCategory(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static CardCategory fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Card category cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "character" -> CHARACTER;
            case "help" -> HELP;
            case "sp" -> SP;
            case "leader" -> LEADER;
            default -> throw new IllegalArgumentException("Unknown card category: " + value);
        };
    }
}
