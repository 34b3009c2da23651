package com.polcard.engine.sequence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.ZoneName;

/**
 * One entry of the play sequence.
 */
public record PlayRecord(
    @JsonProperty("sequenceId") int sequenceId,
    @JsonProperty("playerId") String playerId,
    @JsonProperty("cardId") String cardId,
    @JsonProperty("action") PlayAction action,
    @JsonProperty("zone") ZoneName zone,
    @JsonProperty("data") PlayData data,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("turnNumber") double turnNumber,
    @JsonProperty("phaseWhenPlayed") Phase phaseWhenPlayed
) {
    public PlayRecord {
        data = data == null ? PlayData.empty() : data;
    }

    PlayRecord withSequenceId(int newId) {
        return new PlayRecord(newId, playerId, cardId, action, zone, data, timestamp, turnNumber, phaseWhenPlayed);
    }

    boolean hasMissingFields() {
        return playerId == null || cardId == null || action == null;
    }
}
