package com.polcard.engine.effect;

import com.polcard.engine.card.EffectType;

/**
 * Application priority of continuous effects. Higher values apply first.
 */
public enum EffectPriority {
    DISABLE_OPPONENT_CARDS(100),
    NULLIFICATION(90),
    MODIFICATION(80),
    ZONE_RESTRICTION(70),
    POWER_BOOST(60),
    DEFAULT(50);

    private final int value;

    EffectPriority(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static EffectPriority of(EffectType type) {
        if (type == null) {
            return DEFAULT;
        }
        return switch (type) {
            case SILENCE_ON_SUMMON -> DISABLE_OPPONENT_CARDS;
            case NEUTRALIZE_EFFECT -> NULLIFICATION;
            case SET_POWER, MODIFY_POWER -> MODIFICATION;
            case ZONE_RESTRICTION, ZONE_PLACEMENT_FREEDOM, PREVENT_PLAY -> ZONE_RESTRICTION;
            case POWER_BOOST, POWER_NERF -> POWER_BOOST;
            default -> DEFAULT;
        };
    }
}
