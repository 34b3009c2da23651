package com.polcard.engine.battle;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Score of one player in a leader battle.
 *
 * @param characterPower sum of the face-up characters' calculated powers
 * @param comboBonus     combo bonuses, 0 while combos are disabled
 * @param modifier       post-combo operand from total-power effects
 * @param total          {@code max(0, characterPower + comboBonus + modifier)}
 */
public record BattleResult(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("characterPower") int characterPower,
    @JsonProperty("comboBonus") int comboBonus,
    @JsonProperty("combos") List<String> combos,
    @JsonProperty("modifier") int modifier,
    @JsonProperty("total") int total
) {
    public BattleResult {
        combos = combos == null ? List.of() : List.copyOf(combos);
    }
}
