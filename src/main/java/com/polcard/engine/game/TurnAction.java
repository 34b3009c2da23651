package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Entry of a player's per-turn action history.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnAction(
    @JsonProperty("type") Type type,
    @JsonProperty("turn") double turn,
    @JsonProperty("cardId") String cardId,
    @JsonProperty("zone") ZoneName zone
) {
    public enum Type {
        PLAY_CARD("PlayCard"),
        PLAY_CARD_BACK("PlayCardBack"),
        PASS("Pass"),
        END_LEADER_BATTLE("EndLeaderBattle");

        private final String jsonValue;

        Type(String jsonValue) {
            this.jsonValue = jsonValue;
        }

        @JsonValue
        public String getJsonValue() {
            return jsonValue;
        }

        /**
         * Actions that use up the player's move for the turn.
         */
        public boolean countsAsMove() {
            return this == PLAY_CARD || this == PLAY_CARD_BACK || this == PASS;
        }

        @JsonCreator
        public static Type fromString(String value) {
            for (Type type : values()) {
                if (type.jsonValue.equals(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown turn action: " + value);
        }
    }
}
