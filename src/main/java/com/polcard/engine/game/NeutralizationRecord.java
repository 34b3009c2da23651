package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Audit entry for a neutralization chosen through a selection.
 */
public record NeutralizationRecord(
    @JsonProperty("sourceCardId") String sourceCardId,
    @JsonProperty("sourcePlayerId") String sourcePlayerId,
    @JsonProperty("targetCardId") String targetCardId,
    @JsonProperty("targetPlayerId") String targetPlayerId,
    @JsonProperty("turn") double turn,
    @JsonProperty("timestamp") long timestamp
) {
}
