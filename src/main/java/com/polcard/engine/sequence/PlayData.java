package com.polcard.engine.sequence;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Optional details of a play record. Unused fields stay null and are not serialized.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlayData(
    @JsonProperty("isFaceDown") Boolean faceDown,
    @JsonProperty("leaderIndex") Integer leaderIndex,
    @JsonProperty("isInitialPlacement") Boolean initialPlacement,
    @JsonProperty("isRoundTransition") Boolean roundTransition,
    @JsonProperty("carriedOver") Boolean carriedOver,
    @JsonProperty("selectionId") String selectionId,
    @JsonProperty("selectedCardIds") List<String> selectedCardIds,
    @JsonProperty("targetPlayerId") String targetPlayerId,
    @JsonProperty("value") Integer value
) {
    public static PlayData empty() {
        return new PlayData(null, null, null, null, null, null, null, null, null);
    }

    public static PlayData placement(boolean faceDown) {
        return new PlayData(faceDown, null, null, null, null, null, null, null, null);
    }

    public static PlayData carryOver() {
        return new PlayData(false, null, null, null, true, null, null, null, null);
    }

    public static PlayData leader(int leaderIndex, boolean initial, boolean roundTransition) {
        return new PlayData(null, leaderIndex, initial ? Boolean.TRUE : null,
                roundTransition ? Boolean.TRUE : null, null, null, null, null, null);
    }

    public static PlayData fromSearch(String selectionId, boolean faceDown) {
        return new PlayData(faceDown, null, null, null, null, selectionId, null, null, null);
    }

    public static PlayData appliedSelection(String selectionId, List<String> selectedCardIds,
                                            String targetPlayerId, int value) {
        return new PlayData(null, null, null, null, null, selectionId,
                List.copyOf(selectedCardIds), targetPlayerId, value);
    }

    @JsonIgnore
    public boolean isFaceDownPlay() {
        return Boolean.TRUE.equals(faceDown);
    }
}
