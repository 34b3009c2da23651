package com.polcard.engine.engine;

import com.polcard.engine.game.GameState;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.PlayerDeck;
import com.polcard.engine.game.PlayerState;
import com.polcard.engine.game.RoomStatus;

import java.util.List;
import java.util.Set;

/**
 * Canned game states for testing clients and the engine itself.
 */
public class ScenarioService {
    public static final String SIMPLE_TEST = "simple_test";

    static final String PLAYER_1 = "playerId_1";
    static final String PLAYER_2 = "playerId_2";

    private final GameOrchestrator orchestrator;

    public ScenarioService(GameOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public static Set<String> scenarioIds() {
        return Set.of(SIMPLE_TEST);
    }

    /**
     * Build the named scenario, store it and return the stored state.
     *
     * @throws IllegalArgumentException if the id is blank or names no scenario
     */
    public GameState load(String scenarioId) {
        if (scenarioId == null || scenarioId.isBlank()) {
            throw new IllegalArgumentException("scenarioPath query parameter is required");
        }
        if (!SIMPLE_TEST.equals(scenarioId)) {
            throw new IllegalArgumentException("Scenario not found: " + scenarioId);
        }
        return orchestrator.injectGameState("scenario_" + scenarioId, simpleTest());
    }

    /**
     * Trump against Biden, five cards each, player 1 to act in turn 1.
     */
    static GameState simpleTest() {
        GameState state = new GameState();
        state.addPlayer(seat(PLAYER_1, "Player 1",
                List.of("s-1", "s-3", "s-5"),
                List.of("c-5", "c-6", "c-7", "c-8", "c-9", "c-10", "c-11", "c-12", "c-13", "c-14",
                        "h-2", "h-5", "h-7", "sp-2", "sp-3"),
                List.of("c-1", "h-1", "c-2", "c-3", "c-4")));
        state.addPlayer(seat(PLAYER_2, "Player 2",
                List.of("s-2", "s-4", "s-5"),
                List.of("c-16", "c-21", "c-22", "c-23", "c-24", "c-10", "c-11", "c-12", "c-13", "c-14",
                        "h-3", "h-4", "h-8", "sp-1", "sp-4"),
                List.of("h-2", "c-17", "c-18", "c-19", "c-20")));
        state.zonesOf(PLAYER_1).setLeader("s-1");
        state.zonesOf(PLAYER_2).setLeader("s-2");

        state.setFirstPlayer(0);
        state.setRoomStatus(RoomStatus.IN_GAME);
        state.setGameStarted(true);
        state.setPhase(Phase.MAIN_PHASE);
        state.setCurrentTurn(1);
        state.setCurrentPlayer(PLAYER_1);
        state.setRngState(20240101L);
        return state;
    }

    private static PlayerState seat(String playerId, String name, List<String> leaders, List<String> mainDeck,
                                    List<String> hand) {
        PlayerState player = new PlayerState(playerId, name);
        player.setDeck(new PlayerDeck(leaders, mainDeck, hand));
        player.setReady(true);
        return player;
    }
}
