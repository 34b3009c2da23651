package com.polcard.engine.game;

/**
 * Game phases.
 */
public enum Phase {
    START_REDRAW,
    DRAW_PHASE,
    MAIN_PHASE,
    SP_PHASE,
    BATTLE_PHASE,
    GAME_END;

    /**
     * Check if cards can be placed from hand in this phase.
     */
    public boolean isPlacementPhase() {
        return this == MAIN_PHASE || this == SP_PHASE;
    }
}
