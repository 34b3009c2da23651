package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Derived flags of a player.
 *
 * @param zonePlacementFreedom the player ignores zone compatibility
 * @param forcedSpPlay         the player must fill the sp zone during SP_PHASE
 * @param disableComboBonus    combo bonuses do not count for the player
 * @param summonSilenced       the player's characters do not run onSummon rules
 * @param preventedZones       zones the player may not fill face-up
 */
public record SpecialStates(
    @JsonProperty("zonePlacementFreedom") boolean zonePlacementFreedom,
    @JsonProperty("forcedSpPlay") boolean forcedSpPlay,
    @JsonProperty("disableComboBonus") boolean disableComboBonus,
    @JsonProperty("summonSilenced") boolean summonSilenced,
    @JsonProperty("preventedZones") List<ZoneName> preventedZones
) {
    public SpecialStates {
        preventedZones = preventedZones == null ? List.of() : List.copyOf(preventedZones);
    }

    public static SpecialStates none() {
        return new SpecialStates(false, false, false, false, List.of());
    }

    public boolean isPrevented(ZoneName zone) {
        return preventedZones.contains(zone);
    }
}
