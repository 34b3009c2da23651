package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of the combo table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComboRule(
    @JsonProperty("name") String name,
    @JsonProperty("bonus") int bonus,
    @JsonProperty("description") String description
) {
}
