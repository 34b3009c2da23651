package com.polcard.engine.engine;

import com.polcard.engine.game.GameState;

import java.util.Optional;

/**
 * Persistence collaborator for game state, keyed by game id.
 */
public interface GameStore {

    Optional<GameState> load(String gameId);

    void save(GameState state);

    boolean delete(String gameId);

    boolean exists(String gameId);
}
