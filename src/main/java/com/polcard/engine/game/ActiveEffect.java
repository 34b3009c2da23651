package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.polcard.engine.card.EffectType;

import java.util.List;

/**
 * An effect in force, recorded on its source player.
 * {@code disabledBy} names the neutralizing card when {@code enabled} is false.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActiveEffect(
    @JsonProperty("effectId") String effectId,
    @JsonProperty("source") String source,
    @JsonProperty("sourcePlayerId") String sourcePlayerId,
    @JsonProperty("type") EffectType type,
    @JsonProperty("value") int value,
    @JsonProperty("priority") int priority,
    @JsonProperty("unremovable") boolean unremovable,
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("targetPlayerIds") List<String> targetPlayerIds,
    @JsonProperty("targetCardIds") List<String> targetCardIds,
    @JsonProperty("disabledBy") String disabledBy
) {
    public ActiveEffect {
        targetPlayerIds = targetPlayerIds == null ? List.of() : List.copyOf(targetPlayerIds);
        targetCardIds = targetCardIds == null ? List.of() : List.copyOf(targetCardIds);
    }
}
