package com.polcard.engine.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.polcard.engine.GameFixtures;
import com.polcard.engine.action.GameAction;
import com.polcard.engine.config.EngineConfig;
import com.polcard.engine.deck.DeckException;
import com.polcard.engine.deck.DeckRepository;
import com.polcard.engine.event.EventType;
import com.polcard.engine.event.GameEvent;
import com.polcard.engine.game.ErrorType;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.PlacedCard;
import com.polcard.engine.game.RoomStatus;
import com.polcard.engine.game.ZoneName;
import com.polcard.engine.rng.GameRng;
import com.polcard.engine.sequence.PlayAction;
import com.polcard.engine.sequence.PlayData;
import com.polcard.engine.sequence.PlayRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.polcard.engine.engine.ScenarioService.PLAYER_1;
import static com.polcard.engine.engine.ScenarioService.PLAYER_2;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameOrchestrator, driving whole games through the public calls.
 */
class GameOrchestratorTest {

    private InMemoryGameStore store;
    private GameFixtures.MutableClock clock;
    private GameOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws DeckException {
        store = new InMemoryGameStore();
        clock = new GameFixtures.MutableClock(GameFixtures.START_MILLIS);
        orchestrator = new GameOrchestrator(GameFixtures.catalog(), DeckRepository.fromResources(),
                EngineConfig.defaults(), store, clock, new GameRng(7));
    }

    private String scenario() {
        return new ScenarioService(orchestrator).load(ScenarioService.SIMPLE_TEST).getGameId();
    }

    private GameState stored(String gameId) {
        return orchestrator.getGameState(gameId).orElseThrow();
    }

    private static String eventId(ActionResult result, EventType type) {
        return result.events().stream().filter(e -> e.type() == type).map(GameEvent::id).findFirst().orElseThrow();
    }

    private static void assertFailure(ActionResult result, ErrorType expected) {
        assertFalse(result.isSuccess(), "Expected " + expected);
        assertEquals(expected, result.errorType(), result.error());
        assertNull(result.gameState());
    }

    // ---- Room lifecycle ----

    @Test
    void testCreateGame() {
        ActionResult result = orchestrator.createGame(PLAYER_1);

        assertTrue(result.isSuccess());
        GameState state = result.gameState();
        assertEquals("game_" + GameFixtures.START_MILLIS + "_1", state.getGameId());
        assertEquals(RoomStatus.WAITING_FOR_PLAYERS, state.getRoomStatus());
        assertEquals(List.of(PLAYER_1), state.playerIds());
        assertEquals(EventType.ROOM_CREATED, result.events().get(0).type());
        assertTrue(store.exists(state.getGameId()));
    }

    @Test
    void testJoinRoomDealsAndRevealsLeaders() {
        String gameId = orchestrator.createGame(PLAYER_1).gameState().getGameId();

        ActionResult result = orchestrator.joinRoom(gameId, PLAYER_2);

        assertTrue(result.isSuccess(), result.error());
        GameState state = result.gameState();
        assertEquals(RoomStatus.READY_PHASE, state.getRoomStatus());
        assertEquals(Phase.START_REDRAW, state.getPhase());
        assertEquals("s-1", state.zonesOf(PLAYER_1).getLeader());
        assertEquals("s-2", state.zonesOf(PLAYER_2).getLeader());
        assertEquals(PLAYER_1, state.firstPlayerId(), "Higher leader initialPoint goes first");
        for (String playerId : List.of(PLAYER_1, PLAYER_2)) {
            assertEquals(7, state.player(playerId).getDeck().getHand().size());
        }
        assertEquals(18, state.player(PLAYER_1).getDeck().getMainDeck().size());

        List<PlayRecord> plays = state.getPlaySequence().all();
        assertEquals(2, plays.size());
        assertEquals(PLAYER_1, plays.get(0).playerId(), "First player's leader is recorded first");
        assertEquals(PlayAction.PLAY_LEADER, plays.get(1).action());

        List<EventType> types = result.events().stream().map(GameEvent::type).toList();
        assertTrue(types.contains(EventType.GAME_STARTED));
        assertEquals(2, types.stream().filter(t -> t == EventType.INITIAL_HAND_DEALT).count());
        assertTrue(types.contains(EventType.PLAYER_JOINED));
    }

    @Test
    void testJoinRoomNotAvailable() {
        String gameId = orchestrator.createGame(PLAYER_1).gameState().getGameId();
        assertFailure(orchestrator.joinRoom(gameId, PLAYER_1), ErrorType.ROOM_NOT_AVAILABLE);

        orchestrator.joinRoom(gameId, PLAYER_2);
        assertFailure(orchestrator.joinRoom(gameId, "playerId_3"), ErrorType.ROOM_NOT_AVAILABLE);
        assertFailure(orchestrator.joinRoom("game_missing", PLAYER_2), ErrorType.GAME_NOT_FOUND);
    }

    @Test
    void testReadyStartsGame() {
        String gameId = orchestrator.createGame(PLAYER_1).gameState().getGameId();
        orchestrator.joinRoom(gameId, PLAYER_2);

        ActionResult first = orchestrator.startReady(gameId, PLAYER_1, false);
        assertTrue(first.isSuccess());
        assertEquals(RoomStatus.READY_PHASE, first.gameState().getRoomStatus(), "Still waiting for player 2");

        ActionResult second = orchestrator.startReady(gameId, PLAYER_2, true);
        assertTrue(second.isSuccess(), second.error());
        GameState state = second.gameState();
        assertEquals(1, state.player(PLAYER_2).getRedraw());
        assertEquals(7, state.player(PLAYER_2).getDeck().getHand().size());
        assertEquals(RoomStatus.IN_GAME, state.getRoomStatus());
        assertTrue(state.isGameStarted());
        assertEquals(Phase.MAIN_PHASE, state.getPhase());
        assertEquals(PLAYER_1, state.getCurrentPlayer());
        assertEquals(1.0, state.getCurrentTurn());
        assertEquals(1, second.events().stream().filter(e -> e.type() == EventType.HAND_REDRAWN).count());

        assertFailure(orchestrator.startReady(gameId, PLAYER_1, false), ErrorType.INVALID_PHASE);
    }

    @Test
    void testReadyTwice() {
        String gameId = orchestrator.createGame(PLAYER_1).gameState().getGameId();
        assertFailure(orchestrator.startReady(gameId, PLAYER_1, false), ErrorType.INVALID_PHASE);

        orchestrator.joinRoom(gameId, PLAYER_2);
        orchestrator.startReady(gameId, PLAYER_1, false);
        assertFailure(orchestrator.startReady(gameId, PLAYER_1, false), ErrorType.INVALID_PHASE);
    }

    // ---- Actions ----

    @Test
    void testPlayCardSwitchesTurn() {
        String gameId = scenario();

        ActionResult result = orchestrator.handleAction(gameId, PLAYER_1,
                "{\"type\": \"PlayCard\", \"field_idx\": 0, \"card_idx\": 0}");

        assertTrue(result.isSuccess(), result.error());
        GameState state = result.gameState();
        assertEquals("c-1", state.zonesOf(PLAYER_1).getTop().get(0).cardId());
        assertEquals(145, state.player(PLAYER_1).getFieldEffects().powerOf("c-1"));
        assertEquals(1.5, state.getCurrentTurn());
        assertEquals(PLAYER_2, state.getCurrentPlayer());
        assertEquals(Phase.DRAW_PHASE, state.getPhase());
        assertEquals(3, state.getPlaySequence().size());

        List<EventType> types = result.events().stream().map(GameEvent::type).toList();
        assertTrue(types.contains(EventType.CARD_PLAYED));
        assertTrue(types.contains(EventType.TURN_SWITCH));
        assertFalse(types.contains(EventType.ROOM_CREATED), "Only the events of this call are returned");

        assertEquals(state.getPlaySequence().size(), stored(gameId).getPlaySequence().size());
    }

    @Test
    void testAcknowledgeDrawOpensMainPhase() {
        String gameId = scenario();
        ActionResult played = orchestrator.handleAction(gameId, PLAYER_1, new GameAction.PlayCard(0, 0));

        assertFailure(orchestrator.handleAction(gameId, PLAYER_2, new GameAction.PlayCard(0, 1)),
                ErrorType.INVALID_PHASE);

        ActionResult ack = orchestrator.acknowledgeEvents(gameId, PLAYER_2,
                List.of(eventId(played, EventType.DRAW_PHASE_COMPLETE)));

        assertTrue(ack.isSuccess());
        assertEquals(Phase.MAIN_PHASE, ack.gameState().getPhase());
        assertEquals(PLAYER_2, ack.gameState().getCurrentPlayer());
    }

    @Test
    void testRejectedActionLeavesStateUnchanged() {
        String gameId = scenario();
        GameState before = stored(gameId);

        ActionResult result = orchestrator.handleAction(gameId, PLAYER_2, new GameAction.PlayCard(0, 1));

        assertFailure(result, ErrorType.NOT_YOUR_TURN);
        GameState after = stored(gameId);
        assertEquals(before.getPlaySequence().size(), after.getPlaySequence().size());
        assertEquals(before.player(PLAYER_2).getDeck().getHand().getCards(),
                after.player(PLAYER_2).getDeck().getHand().getCards());
        assertEquals(before.getCurrentTurn(), after.getCurrentTurn());
        List<GameEvent> errors = after.getEvents().ofType(EventType.ERROR_OCCURRED);
        assertEquals(1, errors.size(), "The rejection itself is recorded");
        assertEquals(ErrorType.NOT_YOUR_TURN.name(), errors.get(0).get("errorType"));
    }

    @Test
    void testMalformedActionIsRecorded() {
        String gameId = scenario();

        assertFailure(orchestrator.handleAction(gameId, PLAYER_1, "{\"type\": \"Surrender\"}"),
                ErrorType.INVALID_ACTION_TYPE);
        assertEquals(1, stored(gameId).getEvents().ofType(EventType.ERROR_OCCURRED).size());
        assertFailure(orchestrator.handleAction("game_missing", PLAYER_1, "{\"type\": \"Pass\"}"),
                ErrorType.GAME_NOT_FOUND);
    }

    @Test
    void testSelectionFlow() {
        String gameId = scenario();
        ActionResult played = orchestrator.handleAction(gameId, PLAYER_1, new GameAction.PlayCard(0, 0));
        orchestrator.acknowledgeEvents(gameId, PLAYER_2, List.of(eventId(played, EventType.DRAW_PHASE_COMPLETE)));

        ActionResult help = orchestrator.handleAction(gameId, PLAYER_2, new GameAction.PlayCard(3, 0));
        assertTrue(help.isSuccess(), help.error());
        GameState state = help.gameState();
        assertNotNull(state.getPendingPlayerAction());
        assertEquals(PLAYER_2, state.getCurrentPlayer(), "The turn waits for the selection");
        String selectionId = state.getPendingPlayerAction().selectionId();

        assertFailure(orchestrator.handleAction(gameId, PLAYER_1, new GameAction.Pass()),
                ErrorType.WAITING_FOR_PLAYER);
        assertFailure(orchestrator.handleAction(gameId, PLAYER_2, new GameAction.Pass()),
                ErrorType.CARD_SELECTION_PENDING);

        ActionResult selected = orchestrator.handleAction(gameId, PLAYER_2,
                new GameAction.SelectCard(selectionId, List.of("c-1")));

        assertTrue(selected.isSuccess(), selected.error());
        state = selected.gameState();
        assertNull(state.getPendingPlayerAction());
        assertEquals(0, state.player(PLAYER_1).getFieldEffects().powerOf("c-1"));
        assertEquals(5, state.getPlaySequence().size(), "Leaders, c-1, h-2 and the applied setPower");
        assertEquals(PlayAction.APPLY_SET_POWER, state.getPlaySequence().lastPlayByPlayer(PLAYER_2).orElseThrow().action());
        assertEquals(2.0, state.getCurrentTurn());
        assertEquals(PLAYER_1, state.getCurrentPlayer());
    }

    @Test
    void testSelectionTimeout() {
        String gameId = scenario();
        ActionResult played = orchestrator.handleAction(gameId, PLAYER_1, new GameAction.PlayCard(0, 0));
        orchestrator.acknowledgeEvents(gameId, PLAYER_2, List.of(eventId(played, EventType.DRAW_PHASE_COMPLETE)));
        orchestrator.handleAction(gameId, PLAYER_2, new GameAction.PlayCard(3, 0));

        assertEquals(0, orchestrator.expireSelections(gameId));
        clock.advance(EngineConfig.defaults().selectionTimeoutMillis());
        assertEquals(1, orchestrator.expireSelections(gameId));

        GameState state = stored(gameId);
        assertNull(state.getPendingPlayerAction());
        assertEquals(145, state.player(PLAYER_1).getFieldEffects().powerOf("c-1"), "Nothing was applied");
        assertEquals(PLAYER_1, state.getCurrentPlayer(), "The turn moves on");
    }

    @Test
    void testExpiryOnCorruptedSequenceMarksGame() {
        String gameId = scenario();
        ActionResult played = orchestrator.handleAction(gameId, PLAYER_1, new GameAction.PlayCard(0, 0));
        orchestrator.acknowledgeEvents(gameId, PLAYER_2, List.of(eventId(played, EventType.DRAW_PHASE_COMPLETE)));
        orchestrator.handleAction(gameId, PLAYER_2, new GameAction.PlayCard(3, 0));
        assertNotNull(stored(gameId).getPendingPlayerAction());

        GameState state = stored(gameId);
        List<PlayRecord> plays = new ArrayList<>(state.getPlaySequence().all());
        PlayRecord moved = plays.remove(1);
        plays.add(new PlayRecord(9, moved.playerId(), moved.cardId(), moved.action(), moved.zone(), moved.data(),
                moved.timestamp(), moved.turnNumber(), moved.phaseWhenPlayed()));
        state.getPlaySequence().setPlays(plays);
        store.save(state);
        clock.advance(EngineConfig.defaults().selectionTimeoutMillis());

        assertFailure(orchestrator.handleAction(gameId, PLAYER_1, new GameAction.Pass()),
                ErrorType.SEQUENCE_CORRUPTED);
        assertTrue(stored(gameId).isCorrupted());
        assertEquals(0, orchestrator.expireSelections(gameId), "A corrupted game is left alone");
    }

    @Test
    void testEvictGame() {
        String gameId = orchestrator.createGame(PLAYER_1).gameState().getGameId();
        orchestrator.joinRoom(gameId, PLAYER_2);

        assertTrue(orchestrator.evictGame(gameId));
        assertFalse(store.exists(gameId));
        assertTrue(orchestrator.getGameState(gameId).isEmpty());
        assertEquals(0, orchestrator.lockCount(), "The game's lock goes with it");

        assertFalse(orchestrator.evictGame(gameId));
        assertFailure(orchestrator.startReady(gameId, PLAYER_1, false), ErrorType.GAME_NOT_FOUND);
        assertEquals(0, orchestrator.lockCount(), "Calls on a missing game leave no lock behind");
    }

    @Test
    void testEndedGameRejectsActions() {
        GameState state = ScenarioService.simpleTest();
        state.setPhase(Phase.GAME_END);
        state.setWinner(PLAYER_1);
        orchestrator.injectGameState("ended", state);

        ActionResult result = orchestrator.handleAction("ended", PLAYER_1, new GameAction.Pass());

        assertFailure(result, ErrorType.GAME_ENDED);
        assertTrue(result.error().contains(PLAYER_1));
    }

    @Test
    void testCorruptedSequenceBlocksGame() {
        String gameId = scenario();
        GameState state = stored(gameId);
        List<PlayRecord> plays = new ArrayList<>(state.getPlaySequence().all());
        PlayRecord last = plays.remove(1);
        plays.add(new PlayRecord(5, last.playerId(), last.cardId(), last.action(), last.zone(), last.data(),
                last.timestamp(), last.turnNumber(), last.phaseWhenPlayed()));
        state.getPlaySequence().setPlays(plays);
        store.save(state);

        assertFailure(orchestrator.handleAction(gameId, PLAYER_1, new GameAction.PlayCard(0, 0)),
                ErrorType.SEQUENCE_CORRUPTED);
        assertTrue(stored(gameId).isCorrupted());
        assertTrue(stored(gameId).getZones().get(PLAYER_1).getTop().isEmpty());

        assertFailure(orchestrator.handleAction(gameId, PLAYER_1, new GameAction.Pass()),
                ErrorType.SEQUENCE_CORRUPTED);
    }

    // ---- Views and legal moves ----

    @Test
    void testPlayerViewHidesOpponentCards() {
        GameState state = ScenarioService.simpleTest();
        state.zonesOf(PLAYER_1).getHelp().add(PlacedCard.faceDown("h-5"));
        state.getPlaySequence().append(PLAYER_1, "h-5", PlayAction.PLAY_CARD, ZoneName.HELP,
                PlayData.placement(true), GameFixtures.START_MILLIS, 1, Phase.MAIN_PHASE);
        orchestrator.injectGameState("view", state);

        JsonNode view = orchestrator.getPlayerView("view", PLAYER_2).orElseThrow();

        JsonNode own = view.path("players").path(PLAYER_2).path("deck");
        assertEquals(5, own.path("hand").size());
        assertEquals(15, own.path("mainDeckCount").asInt());
        assertTrue(own.path("mainDeck").isMissingNode());

        JsonNode opponent = view.path("players").path(PLAYER_1).path("deck");
        assertTrue(opponent.path("hand").isMissingNode());
        assertEquals(5, opponent.path("handCount").asInt());
        assertTrue(view.path("zones").path(PLAYER_1).path("help").get(0).path("cardId").isNull());

        JsonNode ownerView = orchestrator.getPlayerView("view", PLAYER_1).orElseThrow();
        assertEquals("h-5", ownerView.path("zones").path(PLAYER_1).path("help").get(0).path("cardId").asText());
        assertTrue(orchestrator.getPlayerView("missing", PLAYER_1).isEmpty());
    }

    @Test
    void testLegalActions() {
        GameState state = stored(scenario());

        List<GameAction> actions = orchestrator.legalActions(state, PLAYER_1);
        assertTrue(actions.contains(new GameAction.PlayCard(0, 0)), "c-1 may go to the top zone");
        assertTrue(actions.contains(new GameAction.PlayCardBack(3, 0)), "Any card may go face-down to help");
        assertFalse(actions.contains(new GameAction.PlayCard(3, 0)), "Characters never go face-up to help");
        assertFalse(actions.contains(new GameAction.PlayCardBack(4, 0)), "SP waits for SP_PHASE");
        assertTrue(actions.contains(new GameAction.Pass()));

        assertTrue(orchestrator.legalActions(state, PLAYER_2).isEmpty(), "Not player 2's turn");
    }
}
