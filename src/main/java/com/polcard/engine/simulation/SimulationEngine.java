package com.polcard.engine.simulation;

import com.polcard.engine.action.GameAction;
import com.polcard.engine.card.Catalog;
import com.polcard.engine.config.EngineConfig;
import com.polcard.engine.deck.DeckRepository;
import com.polcard.engine.engine.ActionResult;
import com.polcard.engine.engine.GameOrchestrator;
import com.polcard.engine.engine.InMemoryGameStore;
import com.polcard.engine.event.GameEvent;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.PendingPlayerAction;
import com.polcard.engine.game.PendingSelection;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.PlayerState;
import com.polcard.engine.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plays complete games between two random players through the public engine calls.
 */
public final class SimulationEngine {
    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    public static final String PLAYER_1 = "playerId_1";
    public static final String PLAYER_2 = "playerId_2";

    // Engine calls allowed before a game is abandoned
    static final int MAX_STEPS = 5000;

    // Chance of passing when a placement is available, in percent
    private static final int PASS_PERCENT = 10;

    private static final long STEP_MILLIS = 1000L;

    private SimulationEngine() {
        // Utility class - prevent instantiation
    }

    /**
     * Run one game to completion.
     *
     * @param seed seeds both the engine and the random players
     */
    public static GameResult runGame(Catalog catalog, DeckRepository decks, EngineConfig config, long seed) {
        SteppingClock clock = new SteppingClock(1_700_000_000_000L);
        GameOrchestrator orchestrator = new GameOrchestrator(catalog, decks, config, new InMemoryGameStore(),
                clock, new GameRng(seed));
        GameRng players = new GameRng(seed ^ 0x5DEECE66DL);

        String gameId = orchestrator.createGame(PLAYER_1).gameState().getGameId();
        Driver driver = new Driver(orchestrator, gameId, players);
        driver.step(orchestrator.joinRoom(gameId, PLAYER_2));
        driver.step(orchestrator.startReady(gameId, PLAYER_1, false));
        driver.step(orchestrator.startReady(gameId, PLAYER_2, false));

        while (driver.steps < MAX_STEPS) {
            clock.advance(STEP_MILLIS);
            GameState state = orchestrator.getGameState(gameId).orElseThrow();
            if (state.getPhase() == Phase.GAME_END) {
                return result(state, driver);
            }
            if (!driver.act(state)) {
                log.warn("Game {} (seed {}) is stuck in {}", gameId, seed, state.getPhase());
                break;
            }
        }
        GameState last = orchestrator.getGameState(gameId).orElseThrow();
        orchestrator.evictGame(gameId);
        if (last.getPhase() == Phase.GAME_END) {
            return result(last, driver);
        }
        log.warn("Game {} (seed {}) abandoned after {} steps", gameId, seed, driver.steps);
        return new GameResult(null, last.getRound(), last.getCurrentTurn(), driver.steps, driver.rejected,
                victoryPoints(last));
    }

    private static GameResult result(GameState state, Driver driver) {
        return new GameResult(state.getWinner(), state.getRound(), state.getCurrentTurn(), driver.steps,
                driver.rejected, victoryPoints(state));
    }

    private static Map<String, Integer> victoryPoints(GameState state) {
        Map<String, Integer> points = new LinkedHashMap<>();
        for (PlayerState player : state.getPlayers().values()) {
            points.put(player.getPlayerId(), player.getVictoryPoints());
        }
        return points;
    }

    /**
     * Both random players plus the client side of the event protocol.
     */
    private static final class Driver {
        private final GameOrchestrator orchestrator;
        private final String gameId;
        private final GameRng rng;
        private int steps;
        private int rejected;

        Driver(GameOrchestrator orchestrator, String gameId, GameRng rng) {
            this.orchestrator = orchestrator;
            this.gameId = gameId;
            this.rng = rng;
        }

        void step(ActionResult result) {
            steps++;
            if (!result.isSuccess()) {
                rejected++;
                log.debug("Rejected: {} {}", result.errorType(), result.error());
            }
        }

        /**
         * Make the next move of whichever player the game is waiting on.
         *
         * @return false when nobody can move
         */
        boolean act(GameState state) {
            PendingPlayerAction pending = state.getPendingPlayerAction();
            if (pending != null) {
                PendingSelection selection = state.getPendingCardSelections().get(pending.selectionId());
                List<String> chosen = selection == null ? List.of()
                        : pick(selection.eligibleCards(), selection.selectCount());
                step(orchestrator.handleAction(gameId, pending.playerId(),
                        new GameAction.SelectCard(pending.selectionId(), chosen)));
                return true;
            }
            if (state.getPhase() == Phase.DRAW_PHASE) {
                List<String> unprocessed = state.getEvents().getEvents().stream()
                        .filter(e -> !e.frontendProcessed())
                        .map(GameEvent::id)
                        .toList();
                step(orchestrator.acknowledgeEvents(gameId, state.getCurrentPlayer(), unprocessed));
                return true;
            }
            List<String> candidates = state.getPhase() == Phase.SP_PHASE
                    ? state.playersInTurnOrder()
                    : List.of(state.getCurrentPlayer());
            for (String playerId : candidates) {
                List<GameAction> actions = orchestrator.legalActions(state, playerId);
                if (!actions.isEmpty()) {
                    step(orchestrator.handleAction(gameId, playerId, choose(actions)));
                    return true;
                }
            }
            return false;
        }

        private GameAction choose(List<GameAction> actions) {
            List<GameAction> placements = new ArrayList<>();
            GameAction pass = null;
            for (GameAction action : actions) {
                if (action instanceof GameAction.Pass) {
                    pass = action;
                } else {
                    placements.add(action);
                }
            }
            if (placements.isEmpty() || (pass != null && rng.nextInt(100) < PASS_PERCENT)) {
                return pass;
            }
            return placements.get(rng.nextInt(placements.size()));
        }

        private List<String> pick(List<String> eligible, int count) {
            List<String> pool = new ArrayList<>(eligible);
            rng.shuffle(pool);
            return new ArrayList<>(pool.subList(0, Math.min(count, pool.size())));
        }
    }
}
