package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Condition types usable in a rule trigger.
 */
public enum ConditionType {
    SELF_HAS_CHARACTER_WITH_NAME("selfHasCharacterWithName"),
    SELF_HAS_LEADER("selfHasLeader"),
    OPPONENT_HAS_CHARACTER_WITH_NAME("opponentHasCharacterWithName"),
    OPPONENT_LEADER("opponentLeader"),
    OPPONENT_HAND_COUNT_MORE_THAN("opponentHandCountMoreThan"),
    OPPONENT_HAND_COUNT("opponentHandCount"),
    ZONE_EMPTY("zoneEmpty"),
    ALLY_FIELD_CONTAINS_NAME("allyFieldContainsName"),
    OPPONENT_FIELD_CONTAINS_NAME("opponentFieldContainsName"),
    OR("or");

    private final String jsonValue;

    ConditionType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static ConditionType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Condition type cannot be null");
        }
        return switch (value) {
            case "selfHasCharacterWithName" -> SELF_HAS_CHARACTER_WITH_NAME;
            case "selfHasLeader" -> SELF_HAS_LEADER;
            case "opponentHasCharacterWithName" -> OPPONENT_HAS_CHARACTER_WITH_NAME;
            case "opponentLeader", "opponentHasLeader" -> OPPONENT_LEADER;
            case "opponentHandCountMoreThan", "opponentHandCardCountMoreThan" -> OPPONENT_HAND_COUNT_MORE_THAN;
            case "opponentHandCount" -> OPPONENT_HAND_COUNT;
            case "zoneEmpty" -> ZONE_EMPTY;
            case "allyFieldContainsName" -> ALLY_FIELD_CONTAINS_NAME;
            case "opponentFieldContainsName" -> OPPONENT_FIELD_CONTAINS_NAME;
            case "or" -> OR;
            default -> throw new IllegalArgumentException("Unknown condition type: " + value);
        };
    }
}
