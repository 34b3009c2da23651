package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Gate marker: while set, only the owning player's SelectCard is accepted.
 */
public record PendingPlayerAction(
    @JsonProperty("type") String type,
    @JsonProperty("selectionId") String selectionId,
    @JsonProperty("playerId") String playerId
) {
    public static final String CARD_SELECTION = "cardSelection";

    public static PendingPlayerAction cardSelection(String selectionId, String playerId) {
        return new PendingPlayerAction(CARD_SELECTION, selectionId, playerId);
    }
}
