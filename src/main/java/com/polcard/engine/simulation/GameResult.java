package com.polcard.engine.simulation;

import com.polcard.engine.game.GameState;

import java.util.Map;

/**
 * Result of a single simulated game.
 *
 * @param winner        winning player id, {@link GameState#DRAW}, or null when the game did not finish
 * @param rounds        leader battles fought
 * @param finalTurn     turn counter when the game stopped
 * @param steps         engine calls made
 * @param rejected      actions the engine refused
 * @param victoryPoints final victory points per player
 */
public record GameResult(
    String winner,
    int rounds,
    double finalTurn,
    int steps,
    int rejected,
    Map<String, Integer> victoryPoints
) {
    public boolean isFinished() {
        return winner != null;
    }

    public boolean isDraw() {
        return GameState.DRAW.equals(winner);
    }
}
