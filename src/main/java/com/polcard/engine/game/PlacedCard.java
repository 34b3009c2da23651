package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A card on the field. Holds the card id only; definitions come from the catalog.
 * {@code valueOnField} is 0 while face-down, the base power once face-up.
 */
public record PlacedCard(
    @JsonProperty("cardId") String cardId,
    @JsonProperty("isFaceDown") boolean faceDown,
    @JsonProperty("valueOnField") int valueOnField
) {
    public static PlacedCard faceUp(String cardId, int power) {
        return new PlacedCard(cardId, false, power);
    }

    public static PlacedCard faceDown(String cardId) {
        return new PlacedCard(cardId, true, 0);
    }

    public PlacedCard revealed(int power) {
        return new PlacedCard(cardId, false, power);
    }
}
