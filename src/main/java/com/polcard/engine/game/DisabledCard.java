package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DisabledCard(
    @JsonProperty("cardId") String cardId,
    @JsonProperty("zone") ZoneName zone,
    @JsonProperty("disabledBy") String disabledBy
) {
}
