package com.polcard.engine.sequence;

import com.polcard.engine.card.EffectType;

/**
 * Kinds of play-sequence records. The APPLY_* records are written when a
 * field-target selection resolves, so replay reproduces the chosen targets.
 */
public enum PlayAction {
    PLAY_LEADER,
    PLAY_CARD,
    APPLY_SET_POWER,
    APPLY_NEUTRALIZATION,
    APPLY_POWER_BOOST,
    APPLY_POWER_NERF;

    public boolean isAppliedSelection() {
        return this != PLAY_LEADER && this != PLAY_CARD;
    }

    /**
     * Effect type replayed by an APPLY_* record.
     */
    public EffectType appliedEffectType() {
        return switch (this) {
            case APPLY_SET_POWER -> EffectType.SET_POWER;
            case APPLY_NEUTRALIZATION -> EffectType.NEUTRALIZE_EFFECT;
            case APPLY_POWER_BOOST -> EffectType.POWER_BOOST;
            case APPLY_POWER_NERF -> EffectType.POWER_NERF;
            default -> throw new IllegalStateException(this + " is not an applied selection");
        };
    }

    public static PlayAction forSelectionEffect(EffectType type) {
        return switch (type) {
            case SET_POWER -> APPLY_SET_POWER;
            case NEUTRALIZE_EFFECT -> APPLY_NEUTRALIZATION;
            case POWER_BOOST -> APPLY_POWER_BOOST;
            case POWER_NERF -> APPLY_POWER_NERF;
            default -> throw new IllegalArgumentException("No applied record for effect " + type);
        };
    }
}
