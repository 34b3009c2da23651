package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed enumeration of effect types a rule can carry.
 */
public enum EffectType {
    POWER_BOOST("powerBoost"),
    POWER_NERF("powerNerf"),
    SET_POWER("setPower"),
    MODIFY_POWER("modifyPower"),
    NEUTRALIZE_EFFECT("neutralizeEffect"),
    SILENCE_ON_SUMMON("silenceOnSummon"),
    ZONE_PLACEMENT_FREEDOM("zonePlacementFreedom"),
    DISABLE_COMBO_BONUS("disableComboBonus"),
    TOTAL_POWER_NERF("totalPowerNerf"),
    DRAW_CARD("drawCard"),
    DISCARD_RANDOM_CARD("discardRandomCard"),
    SEARCH_CARD("searchCard"),
    FORCE_PLAY_SP("forcePlaySP"),
    PREVENT_PLAY("preventPlay"),
    ZONE_RESTRICTION("zoneRestriction");

    private final String jsonValue;

    EffectType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * One-shot effects run when their trigger fires and leave no derived state behind.
     */
    public boolean isOneShot() {
        return this == DRAW_CARD || this == DISCARD_RANDOM_CARD || this == SEARCH_CARD;
    }

    /**
     * Effects that change the power of individual cards.
     */
    public boolean isPowerChange() {
        return this == POWER_BOOST || this == POWER_NERF || this == SET_POWER || this == MODIFY_POWER;
    }

    @JsonCreator
    public static EffectType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Effect type cannot be null");
        }
        return switch (value) {
            case "powerBoost" -> POWER_BOOST;
            case "powerNerf" -> POWER_NERF;
            case "setPower" -> SET_POWER;
            case "modifyPower" -> MODIFY_POWER;
            case "neutralizeEffect" -> NEUTRALIZE_EFFECT;
            case "silenceOnSummon" -> SILENCE_ON_SUMMON;
            case "zonePlacementFreedom" -> ZONE_PLACEMENT_FREEDOM;
            case "disableComboBonus" -> DISABLE_COMBO_BONUS;
            case "totalPowerNerf" -> TOTAL_POWER_NERF;
            case "drawCard", "drawCards" -> DRAW_CARD;
            case "discardRandomCard", "randomDiscard" -> DISCARD_RANDOM_CARD;
            case "searchCard" -> SEARCH_CARD;
            case "forcePlaySP", "forceSPPlay" -> FORCE_PLAY_SP;
            case "preventPlay" -> PREVENT_PLAY;
            case "zoneRestriction" -> ZONE_RESTRICTION;
            default -> throw new IllegalArgumentException("Unknown effect type: " + value);
        };
    }
}
