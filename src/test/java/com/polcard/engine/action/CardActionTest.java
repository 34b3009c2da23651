package com.polcard.engine.action;

import com.polcard.engine.GameFixtures;
import com.polcard.engine.event.EventType;
import com.polcard.engine.game.ErrorType;
import com.polcard.engine.game.GameRuleException;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.GameStateCodec;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.PlacedCard;
import com.polcard.engine.game.PlayerDeck;
import com.polcard.engine.game.ZoneName;
import com.polcard.engine.sequence.PlayAction;
import com.polcard.engine.sequence.PlayRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.polcard.engine.GameFixtures.PLAYER_A;
import static com.polcard.engine.GameFixtures.PLAYER_B;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CardAction placement rules.
 */
class CardActionTest {

    private final GameFixtures.Engine engine = GameFixtures.engine();

    private GameState game(String leaderA, List<String> handA, List<String> handB) {
        GameState state = GameFixtures.game(leaderA, "s-2", handA, handB);
        engine.simulator.apply(state);
        return state;
    }

    private ErrorType rejection(GameState state, String playerId, int fieldIdx, int cardIdx, boolean faceDown) {
        GameRuleException e = assertThrows(GameRuleException.class,
                () -> engine.cardAction.play(state, playerId, fieldIdx, cardIdx, faceDown));
        return e.getErrorType();
    }

    @Test
    void testPlayCharacterFaceUp() throws GameRuleException {
        GameState state = game("s-1", List.of("c-1", "c-4"), List.of());

        PlacementResult result = engine.cardAction.play(state, PLAYER_A, 0, 0, false);

        assertEquals("c-1", result.cardId());
        assertEquals(ZoneName.TOP, result.zone());
        assertFalse(result.selectionOpened());
        assertEquals(List.of("c-4"), state.player(PLAYER_A).getDeck().getHand().getCards());
        assertEquals(PlacedCard.faceUp("c-1", 100), state.zonesOf(PLAYER_A).getTop().get(0));

        PlayRecord last = state.getPlaySequence().lastPlayByPlayer(PLAYER_A).orElseThrow();
        assertEquals(3, last.sequenceId());
        assertEquals(PlayAction.PLAY_CARD, last.action());
        assertEquals(ZoneName.TOP, last.zone());
        assertFalse(last.data().isFaceDownPlay());

        assertEquals(145, state.player(PLAYER_A).getFieldEffects().powerOf("c-1"), "Effects are replayed after the play");
        assertEquals(1, state.getEvents().ofType(EventType.CARD_PLAYED).size());
        assertEquals(1, state.getEvents().ofType(EventType.ZONE_FILLED).size());
        assertTrue(state.player(PLAYER_A).hasMovedInTurn(1));
    }

    @Test
    void testFaceDownPlayHidesCardInEvent() throws GameRuleException {
        GameState state = game("s-1", List.of("c-17"), List.of());

        engine.cardAction.play(state, PLAYER_A, 0, 0, true);

        assertEquals(PlacedCard.faceDown("c-17"), state.zonesOf(PLAYER_A).getTop().get(0));
        assertNull(state.getEvents().ofType(EventType.CARD_PLAYED).get(0).get("cardId"));
        assertTrue(state.player(PLAYER_A).getFieldEffects().calculatedPowers().isEmpty());
    }

    @Test
    void testOccupiedHelpZoneLeavesStateUntouched() {
        GameState state = game("s-1", List.of("h-7"), List.of());
        GameFixtures.place(state, PLAYER_A, "h-14", ZoneName.HELP);
        String before = GameStateCodec.toJson(state);

        assertEquals(ErrorType.ZONE_OCCUPIED_ERROR, rejection(state, PLAYER_A, 3, 0, false));
        assertEquals(ErrorType.ZONE_OCCUPIED_ERROR, rejection(state, PLAYER_A, 3, 0, true));
        assertEquals(before, GameStateCodec.toJson(state), "A rejected play must not change the state");
    }

    @Test
    void testOccupiedCharacterZone() {
        GameState state = game("s-1", List.of("c-5"), List.of());
        GameFixtures.place(state, PLAYER_A, "c-1", ZoneName.TOP);

        assertEquals(ErrorType.ZONE_OCCUPIED_ERROR, rejection(state, PLAYER_A, 0, 0, false));
    }

    @Test
    void testIndexesAndUnknownCards() {
        GameState state = game("s-1", List.of("c-1", "x-404"), List.of());

        assertEquals(ErrorType.INVALID_POSITION, rejection(state, PLAYER_A, 5, 0, false));
        assertEquals(ErrorType.INVALID_POSITION, rejection(state, PLAYER_A, -1, 0, false));
        assertEquals(ErrorType.INVALID_CARD_INDEX, rejection(state, PLAYER_A, 0, 2, false));
        assertEquals(ErrorType.CARD_NOT_FOUND, rejection(state, PLAYER_A, 0, 1, false));
    }

    @Test
    void testSpZonePhaseRules() throws GameRuleException {
        GameState state = game("s-1", List.of("sp-1", "c-1"), List.of());

        assertEquals(ErrorType.PHASE_RESTRICTION_ERROR, rejection(state, PLAYER_A, 4, 0, true),
                "Face-down SP plays wait for SP_PHASE");
        assertEquals(ErrorType.PHASE_RESTRICTION_ERROR, rejection(state, PLAYER_A, 3, 0, false),
                "SP cards never go face-up from hand");

        state.setPhase(Phase.SP_PHASE);
        assertEquals(ErrorType.SP_PHASE_RESTRICTION, rejection(state, PLAYER_A, 4, 0, false));
        assertEquals(ErrorType.PHASE_RESTRICTION_ERROR, rejection(state, PLAYER_A, 0, 1, true),
                "Only the SP zone is open during SP_PHASE");

        engine.cardAction.play(state, PLAYER_A, 4, 0, true);
        assertEquals(PlacedCard.faceDown("sp-1"), state.zonesOf(PLAYER_A).getSp().get(0));
    }

    @Test
    void testCardTypeMustMatchZone() {
        GameState state = game("s-1", List.of("c-1", "h-7"), List.of());

        assertEquals(ErrorType.CARD_TYPE_ZONE_ERROR, rejection(state, PLAYER_A, 3, 0, false));
        assertEquals(ErrorType.CARD_TYPE_ZONE_ERROR, rejection(state, PLAYER_A, 0, 1, false));
    }

    @Test
    void testLeaderCompatibility() throws GameRuleException {
        GameState state = game("s-1", List.of("c-17", "c-1"), List.of());

        assertEquals(ErrorType.ZONE_COMPATIBILITY_ERROR, rejection(state, PLAYER_A, 0, 0, false));
        engine.cardAction.play(state, PLAYER_A, 0, 1, false);
        assertEquals("c-1", state.zonesOf(PLAYER_A).getTop().get(0).cardId());
    }

    @Test
    void testUniversalTraitFitsAnyZone() throws GameRuleException {
        GameState state = game("s-4", List.of("c-24"), List.of());

        engine.cardAction.play(state, PLAYER_A, 0, 0, false);
        assertEquals("c-24", state.zonesOf(PLAYER_A).getTop().get(0).cardId());
    }

    @Test
    void testFieldEffectRestriction() {
        GameState state = game("s-1", List.of("c-4"), List.of());
        GameFixtures.place(state, PLAYER_B, "h-6", ZoneName.HELP);
        engine.simulator.apply(state);

        assertEquals(ErrorType.FIELD_EFFECT_RESTRICTION, rejection(state, PLAYER_A, 0, 0, false),
                "The leader allows freedom cards on top but the border wall does not");
    }

    @Test
    void testPreventedZoneStillAcceptsFaceDown() throws GameRuleException {
        GameState state = game("s-1", List.of("c-1", "c-5"), List.of());
        GameFixtures.place(state, PLAYER_B, "h-9", ZoneName.HELP);
        engine.simulator.apply(state);

        assertEquals(ErrorType.PLAY_PREVENTED, rejection(state, PLAYER_A, 1, 0, false));
        engine.cardAction.play(state, PLAYER_A, 1, 0, true);
        assertTrue(state.zonesOf(PLAYER_A).getLeft().get(0).faceDown());
    }

    @Test
    void testPlacementFreedomSkipsCompatibility() throws GameRuleException {
        GameState state = game("s-1", List.of("c-17"), List.of());
        GameFixtures.place(state, PLAYER_A, "h-5", ZoneName.HELP);
        engine.simulator.apply(state);

        engine.cardAction.play(state, PLAYER_A, 0, 0, false);
        assertEquals("c-17", state.zonesOf(PLAYER_A).getTop().get(0).cardId());
    }

    @Test
    void testOnSummonDraw() throws GameRuleException {
        GameState state = game("s-1", List.of("c-7"), List.of());

        engine.cardAction.play(state, PLAYER_A, 1, 0, false);

        PlayerDeck deck = state.player(PLAYER_A).getDeck();
        assertEquals(List.of("c-8"), deck.getHand().getCards(), "The top card of the deck is drawn");
        assertEquals(4, deck.getMainDeck().size());
        assertEquals(1, state.getEvents().ofType(EventType.CARDS_DRAWN).size());
        assertEquals(1, state.getEvents().ofType(EventType.CARD_EFFECT_TRIGGERED).size());
    }

    @Test
    void testSilencedSummonDoesNotDraw() throws GameRuleException {
        GameState state = game("s-1", List.of("c-7"), List.of());
        GameFixtures.place(state, PLAYER_B, "h-4", ZoneName.HELP);
        engine.simulator.apply(state);

        engine.cardAction.play(state, PLAYER_A, 1, 0, false);

        assertTrue(state.player(PLAYER_A).getDeck().getHand().isEmpty());
        assertTrue(state.getEvents().ofType(EventType.CARDS_DRAWN).isEmpty());
    }

    @Test
    void testSelectionRuleOpensSelection() throws GameRuleException {
        GameState state = game("s-1", List.of(), List.of("h-2"));
        GameFixtures.place(state, PLAYER_A, "c-1", ZoneName.TOP);
        engine.simulator.apply(state);

        PlacementResult result = engine.cardAction.play(state, PLAYER_B, 3, 0, false);

        assertTrue(result.selectionOpened());
        assertEquals(PLAYER_B, state.getPendingPlayerAction().playerId());
        String selectionId = state.getPendingPlayerAction().selectionId();
        assertEquals(List.of("c-1"), state.getPendingCardSelections().get(selectionId).eligibleCards());
        assertEquals(1, state.getEvents().ofType(EventType.CARD_SELECTION_REQUIRED).size());
    }

    @Test
    void testSelectionRuleWithoutTargetsOpensNothing() throws GameRuleException {
        GameState state = game("s-1", List.of(), List.of("h-2"));

        PlacementResult result = engine.cardAction.play(state, PLAYER_B, 3, 0, false);

        assertFalse(result.selectionOpened());
        assertNull(state.getPendingPlayerAction());
    }

    @Test
    void testNeutralizeOnlyOffersCardsWithEffects() throws GameRuleException {
        GameState state = game("s-1", List.of(), List.of("h-1"));
        GameFixtures.place(state, PLAYER_A, "h-5", ZoneName.HELP);
        GameFixtures.place(state, PLAYER_A, "sp-2", ZoneName.SP);
        engine.simulator.apply(state);

        engine.cardAction.play(state, PLAYER_B, 3, 0, false);

        String selectionId = state.getPendingPlayerAction().selectionId();
        assertEquals(List.of("sp-2"), state.getPendingCardSelections().get(selectionId).eligibleCards(),
                "Immune cards cannot be chosen");
    }

    @Test
    void testPendingSelectionGate() throws GameRuleException {
        GameState state = game("s-1", List.of("c-1"), List.of("h-2"));
        GameFixtures.place(state, PLAYER_A, "c-5", ZoneName.LEFT);
        engine.simulator.apply(state);
        engine.cardAction.play(state, PLAYER_B, 3, 0, false);

        assertEquals(ErrorType.WAITING_FOR_PLAYER, rejection(state, PLAYER_A, 0, 0, false));
    }
}
