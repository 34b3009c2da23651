package com.polcard.engine.engine;

import com.polcard.engine.game.GameState;
import com.polcard.engine.game.GameStateCodec;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps each game as its serialized JSON blob. Every load returns a fresh copy, so a
 * caller that never saves leaves the stored game untouched.
 */
public class InMemoryGameStore implements GameStore {
    private final Map<String, String> games = new ConcurrentHashMap<>();

    @Override
    public Optional<GameState> load(String gameId) {
        String json = gameId == null ? null : games.get(gameId);
        return json == null ? Optional.empty() : Optional.of(GameStateCodec.fromJson(json));
    }

    @Override
    public void save(GameState state) {
        games.put(state.getGameId(), GameStateCodec.toJson(state));
    }

    @Override
    public boolean delete(String gameId) {
        return games.remove(gameId) != null;
    }

    @Override
    public boolean exists(String gameId) {
        return games.containsKey(gameId);
    }

    public int size() {
        return games.size();
    }
}
