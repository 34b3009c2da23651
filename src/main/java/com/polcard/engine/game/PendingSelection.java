package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.polcard.engine.card.EffectType;
import com.polcard.engine.card.SearchDestination;

import java.util.List;

/**
 * An interactive choice the game is waiting on.
 *
 * <p>Deck searches carry {@code searchedCards} (taken off the deck, in draw order) and a
 * {@code destination}. Field-target selections carry the {@code effectType}, its
 * {@code value} and the {@code targetPlayerId} whose cards are eligible.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PendingSelection(
    @JsonProperty("selectionId") String selectionId,
    @JsonProperty("playerId") String playerId,
    @JsonProperty("kind") Kind kind,
    @JsonProperty("sourceCardId") String sourceCardId,
    @JsonProperty("eligibleCards") List<String> eligibleCards,
    @JsonProperty("searchedCards") List<String> searchedCards,
    @JsonProperty("selectCount") int selectCount,
    @JsonProperty("destination") SearchDestination destination,
    @JsonProperty("effectType") EffectType effectType,
    @JsonProperty("value") int value,
    @JsonProperty("targetPlayerId") String targetPlayerId,
    @JsonProperty("timestamp") long timestamp
) {
    public PendingSelection {
        eligibleCards = eligibleCards == null ? List.of() : List.copyOf(eligibleCards);
        searchedCards = searchedCards == null ? List.of() : List.copyOf(searchedCards);
    }

    public enum Kind {
        DECK_SEARCH("deckSearch"),
        FIELD_TARGET("fieldTarget");

        private final String jsonValue;

        Kind(String jsonValue) {
            this.jsonValue = jsonValue;
        }

        @JsonValue
        public String getJsonValue() {
            return jsonValue;
        }

        @JsonCreator
        public static Kind fromString(String value) {
            return "fieldTarget".equals(value) ? FIELD_TARGET : DECK_SEARCH;
        }
    }
}
