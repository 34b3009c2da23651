package com.polcard.engine.battle;

import com.polcard.engine.GameFixtures;
import com.polcard.engine.card.CatalogException;
import com.polcard.engine.event.EventType;
import com.polcard.engine.event.GameEvent;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.PlacedCard;
import com.polcard.engine.game.RoomStatus;
import com.polcard.engine.game.ZoneName;
import com.polcard.engine.sequence.PlayAction;
import com.polcard.engine.sequence.PlayData;
import com.polcard.engine.sequence.PlayRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.polcard.engine.GameFixtures.PLAYER_A;
import static com.polcard.engine.GameFixtures.PLAYER_B;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BattleResolver.
 */
class BattleResolverTest {

    private final GameFixtures.Engine engine = GameFixtures.engine();
    private final BattleResolver resolver = engine.battleResolver;

    /**
     * A: Trump leader, Kennedy (70) on top. B: Powell leader, Ocasio-Cortez (65) on the right.
     */
    private GameState battle(List<String> leadersA, List<String> leadersB) {
        GameState state = GameFixtures.game(leadersA, leadersB, List.of("c-10"), List.of("c-20", "c-22"));
        GameFixtures.place(state, PLAYER_A, "c-4", ZoneName.TOP);
        GameFixtures.place(state, PLAYER_B, "c-19", ZoneName.RIGHT);
        engine.simulator.apply(state);
        state.setPhase(Phase.BATTLE_PHASE);
        return state;
    }

    private GameState battle() {
        return battle(List.of("s-1", "s-3"), List.of("s-5", "s-3"));
    }

    private static void placeSpFaceDown(GameState state, String playerId, String cardId) {
        state.zonesOf(playerId).getSp().add(PlacedCard.faceDown(cardId));
        state.getPlaySequence().append(playerId, cardId, PlayAction.PLAY_CARD, ZoneName.SP,
                PlayData.placement(true), GameFixtures.START_MILLIS, state.getCurrentTurn(), Phase.SP_PHASE);
    }

    @Test
    void testScore() {
        GameState state = battle();
        BattleResult a = resolver.score(state, PLAYER_A);
        assertEquals(70, a.characterPower());
        assertEquals(0, a.comboBonus());
        assertEquals(70, a.total());
        assertEquals(65, resolver.score(state, PLAYER_B).total());
    }

    @Test
    void testVictoryThresholdEndsGame() {
        GameState state = battle();
        state.player(PLAYER_A).setVictoryPoints(48);

        List<BattleResult> results = resolver.resolve(state);

        assertEquals(2, results.size());
        assertEquals(53, state.player(PLAYER_A).getVictoryPoints(), "The winner gains the difference");
        assertEquals(0, state.player(PLAYER_B).getVictoryPoints());
        assertEquals(Phase.GAME_END, state.getPhase());
        assertEquals(PLAYER_A, state.getWinner());
        assertEquals(RoomStatus.GAME_OVER, state.getRoomStatus());
        assertEquals("victoryThreshold", state.getEvents().ofType(EventType.GAME_END).get(0).get("reason"));
        assertEquals(70, state.player(PLAYER_A).getPlayerPoint());
    }

    @Test
    void testRoundTransition() {
        GameState state = battle();

        resolver.resolve(state);

        assertEquals(5, state.player(PLAYER_A).getVictoryPoints());
        assertEquals(2, state.getRound());
        assertNull(state.getWinner());
        for (String playerId : List.of(PLAYER_A, PLAYER_B)) {
            assertEquals("s-3", state.zonesOf(playerId).getLeader(), "Every player moves to their next leader");
            assertEquals(1, state.player(playerId).getDeck().getCurrentLeaderIdx());
            for (ZoneName zone : ZoneName.CHARACTER_ZONES) {
                assertTrue(state.zonesOf(playerId).isEmpty(zone));
            }
        }

        List<PlayRecord> plays = state.getPlaySequence().all();
        assertEquals(2, plays.size(), "Only the new leaders remain in the sequence");
        assertTrue(plays.stream().allMatch(p -> p.action() == PlayAction.PLAY_LEADER));
        assertEquals(Boolean.TRUE, plays.get(0).data().roundTransition());
        assertTrue(state.getPlaySequence().validate().isValid());

        assertEquals(Phase.DRAW_PHASE, state.getPhase());
        assertEquals(1.5, state.getCurrentTurn());
        assertEquals(PLAYER_B, state.getCurrentPlayer());
        assertEquals(1, state.getEvents().ofType(EventType.ROUND_END).size());
        assertEquals(2, state.getEvents().ofType(EventType.LEADER_CHANGED).size());
        assertEquals(List.of("自由", "經濟"),
                state.player(PLAYER_A).getFieldEffects().restrictionFor(ZoneName.TOP), "New leader's compatibility");
    }

    @Test
    void testHelpCardsCarryOver() {
        GameState state = battle();
        GameFixtures.place(state, PLAYER_A, "h-14", ZoneName.HELP);
        engine.simulator.apply(state);

        resolver.resolve(state);

        assertEquals("h-14", state.zonesOf(PLAYER_A).getHelp().get(0).cardId(), "Help cards stay on the field");
        PlayRecord carried = state.getPlaySequence().lastPlayByPlayer(PLAYER_A).orElseThrow();
        assertEquals("h-14", carried.cardId());
        assertEquals(Boolean.TRUE, carried.data().carriedOver());
    }

    @Test
    void testLastLeaderEndsOnPoints() {
        GameState state = battle(List.of("s-1"), List.of("s-5"));

        resolver.resolve(state);

        assertEquals(Phase.GAME_END, state.getPhase());
        assertEquals(PLAYER_A, state.getWinner());
        assertEquals("leadersExhausted", state.getEvents().ofType(EventType.GAME_END).get(0).get("reason"));
    }

    @Test
    void testTiedGameIsADraw() {
        GameState state = GameFixtures.game(List.of("s-2"), List.of("s-2"), List.of(), List.of());
        GameFixtures.place(state, PLAYER_A, "c-17", ZoneName.TOP);
        GameFixtures.place(state, PLAYER_B, "c-17", ZoneName.TOP);
        engine.simulator.apply(state);
        state.setPhase(Phase.BATTLE_PHASE);

        resolver.resolve(state);

        assertEquals(GameState.DRAW, state.getWinner());
        assertEquals(0, state.player(PLAYER_A).getVictoryPoints());
        assertNull(state.getEvents().ofType(EventType.BATTLE_RESULT).get(0).get("roundWinner"));
    }

    @Test
    void testSpCardsRevealedAndApplied() {
        GameState state = battle();
        placeSpFaceDown(state, PLAYER_A, "sp-6");

        List<BattleResult> results = resolver.resolve(state);

        assertEquals(-30, results.get(1).modifier());
        assertEquals(35, results.get(1).total());
        assertEquals(35, state.player(PLAYER_A).getVictoryPoints());
        assertEquals(1, state.getEvents().ofType(EventType.SP_CARDS_REVEALED).size());
    }

    @Test
    void testOneShotSpRuleRunsAtReveal() {
        GameState state = battle();
        placeSpFaceDown(state, PLAYER_A, "sp-5");

        resolver.resolve(state);

        List<GameEvent> discards = state.getEvents().ofType(EventType.CARDS_DISCARDED);
        assertEquals(1, discards.size());
        assertEquals(PLAYER_B, discards.get(0).get("playerId"));
        assertEquals(1, ((List<?>) discards.get(0).get("cardIds")).size(), "One random card from B's hand");
    }

    @Test
    void testRevealedSpRuleRunsOnce() {
        GameState state = battle();
        placeSpFaceDown(state, PLAYER_A, "sp-4");

        resolver.resolve(state);
        assertEquals(1, drawsFrom(state, "sp-4"));
        assertFalse(state.zonesOf(PLAYER_A).getSp().get(0).faceDown(), "sp-4 stays face-up into round two");

        state.setPhase(Phase.BATTLE_PHASE);
        resolver.resolve(state);
        assertEquals(1, drawsFrom(state, "sp-4"), "Cards revealed in an earlier round do not fire again");
    }

    private static long drawsFrom(GameState state, String cardId) {
        return state.getEvents().ofType(EventType.CARDS_DRAWN).stream()
                .filter(e -> cardId.equals(e.get("sourceCardId")))
                .count();
    }

    @Test
    void testTotalPowerNerfStopsAtZero() {
        GameState state = GameFixtures.game(List.of("s-1", "s-3"), List.of("s-5", "s-3"), List.of(), List.of());
        GameFixtures.place(state, PLAYER_A, "c-4", ZoneName.TOP);
        engine.simulator.apply(state);
        state.setPhase(Phase.BATTLE_PHASE);
        placeSpFaceDown(state, PLAYER_A, "sp-6");

        List<BattleResult> results = resolver.resolve(state);

        assertEquals(0, results.get(1).characterPower());
        assertEquals(-30, results.get(1).modifier());
        assertEquals(0, results.get(1).total(), "Total power is never negative");
        assertEquals(70, state.player(PLAYER_A).getVictoryPoints());
    }

    @Test
    void testDisabledCombos() {
        GameState state = GameFixtures.game("s-2", "s-2", List.of(), List.of());
        GameFixtures.place(state, PLAYER_A, "c-17", ZoneName.TOP);
        GameFixtures.place(state, PLAYER_A, "c-18", ZoneName.LEFT);
        engine.simulator.apply(state);
        assertEquals(70, resolver.score(state, PLAYER_A).comboBonus());

        GameFixtures.place(state, PLAYER_B, "sp-8", ZoneName.SP);
        engine.simulator.apply(state);
        BattleResult result = resolver.score(state, PLAYER_A);
        assertEquals(0, result.comboBonus());
        assertTrue(result.combos().isEmpty());
    }

    @Test
    void testAfterComboDetection() throws CatalogException {
        assertTrue(BattleResolver.isAfterCombo(GameFixtures.catalog().getCard("sp-6").getEffects().getRules().get(0)));
        assertFalse(BattleResolver.isAfterCombo(GameFixtures.catalog().getCard("sp-5").getEffects().getRules().get(0)));
    }
}
