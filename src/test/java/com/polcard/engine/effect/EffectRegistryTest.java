package com.polcard.engine.effect;

import com.polcard.engine.GameFixtures;
import com.polcard.engine.card.CatalogException;
import com.polcard.engine.card.EffectRule;
import com.polcard.engine.card.EffectType;
import com.polcard.engine.card.TargetOwner;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.PlacedCard;
import com.polcard.engine.game.ZoneName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.polcard.engine.GameFixtures.PLAYER_A;
import static com.polcard.engine.GameFixtures.PLAYER_B;
import static org.junit.jupiter.api.Assertions.*;

class EffectRegistryTest {

    private final EffectRegistry registry = new EffectRegistry(GameFixtures.catalog());

    private EffectRule rule(String cardId, int index) throws CatalogException {
        return GameFixtures.catalog().getCard(cardId).getEffects().getRules().get(index);
    }

    @Test
    void testOpponentLeaderCondition() throws CatalogException {
        EffectRule powellNerf = rule("s-1", 1);

        GameState vsPowell = GameFixtures.game("s-1", "s-5", List.of(), List.of());
        assertTrue(registry.conditionsMet(powellNerf, vsPowell, PLAYER_A));

        GameState vsBiden = GameFixtures.game("s-1", "s-2", List.of(), List.of());
        assertFalse(registry.conditionsMet(powellNerf, vsBiden, PLAYER_A));
    }

    @Test
    void testRulesWithoutConditionsAlwaysHold() throws CatalogException {
        GameState state = GameFixtures.game("s-1", "s-2", List.of(), List.of());
        assertTrue(registry.conditionsMet(rule("s-1", 0), state, PLAYER_A));
    }

    @Test
    void testAllyFieldContainsNameMatchesLeader() throws CatalogException {
        EffectRule synergy = rule("c-11", 0);
        assertTrue(registry.conditionsMet(synergy, GameFixtures.game("s-3", "s-2", List.of(), List.of()), PLAYER_A),
                "Musk as leader should satisfy the condition");
        assertFalse(registry.conditionsMet(synergy, GameFixtures.game("s-1", "s-2", List.of(), List.of()), PLAYER_A));
    }

    @Test
    void testOpponentHandCountMoreThan() throws CatalogException {
        EffectRule grassroots = rule("sp-9", 0);
        GameState bigHand = GameFixtures.game("s-1", "s-2", List.of(), List.of("c-16", "c-17", "c-18", "c-19"));
        assertTrue(registry.conditionsMet(grassroots, bigHand, PLAYER_A));

        GameState smallHand = GameFixtures.game("s-1", "s-2", List.of(), List.of("c-16", "c-17", "c-18"));
        assertFalse(registry.conditionsMet(grassroots, smallHand, PLAYER_A));
    }

    @Test
    void testCompareOperators() {
        assertTrue(EffectRegistry.compare(4, ">=", 4));
        assertTrue(EffectRegistry.compare(3, "<", 4));
        assertFalse(EffectRegistry.compare(3, ">", 4));
        assertTrue(EffectRegistry.compare(2, null, 2));
        assertFalse(EffectRegistry.compare(2, "~", 2), "Unknown operators never match");
    }

    @Test
    void testTargetPlayers() {
        GameState state = GameFixtures.game("s-1", "s-2", List.of(), List.of());
        assertEquals(List.of(PLAYER_A), registry.targetPlayers(TargetOwner.SELF, state, PLAYER_A));
        assertEquals(List.of(PLAYER_B), registry.targetPlayers(TargetOwner.OPPONENT, state, PLAYER_A));
        assertEquals(List.of(PLAYER_A, PLAYER_B), registry.targetPlayers(TargetOwner.BOTH, state, PLAYER_B));
    }

    @Test
    void testTargetsApplyZonesAndFilters() throws CatalogException {
        GameState state = GameFixtures.game("s-1", "s-2", List.of(), List.of());
        GameFixtures.place(state, PLAYER_A, "c-1", ZoneName.TOP);
        GameFixtures.place(state, PLAYER_A, "c-4", ZoneName.LEFT);
        GameFixtures.place(state, PLAYER_A, "c-2", ZoneName.RIGHT);

        List<TargetRef> targets = registry.targets(rule("s-1", 0), state, PLAYER_A);
        assertEquals(List.of(new TargetRef(PLAYER_A, "c-1", ZoneName.TOP), new TargetRef(PLAYER_A, "c-2", ZoneName.RIGHT)),
                targets, "Only right-wing and patriot characters are boosted");
    }

    @Test
    void testFaceDownCardsAreNotTargets() throws CatalogException {
        GameState state = GameFixtures.game("s-1", "s-2", List.of(), List.of());
        state.zonesOf(PLAYER_B).cardsIn(ZoneName.TOP).add(PlacedCard.faceDown("c-16"));

        assertTrue(registry.targets(rule("h-2", 0), state, PLAYER_A).isEmpty());
    }

    @Test
    void testNameContainsFilter() throws CatalogException {
        EffectRule doge = rule("s-3", 1);
        assertTrue(registry.matchesFilters(GameFixtures.catalog().getCard("c-15"), doge.getTarget().getFilters()));
        assertFalse(registry.matchesFilters(GameFixtures.catalog().getCard("c-14"), doge.getTarget().getFilters()));
    }

    @Test
    void testImmunityAndPriority() {
        assertTrue(registry.isImmune("h-5"));
        assertFalse(registry.isImmune("h-14"));
        assertFalse(registry.isImmune("c-999"));

        assertTrue(registry.priority(EffectType.NEUTRALIZE_EFFECT) > registry.priority(EffectType.SET_POWER));
        assertTrue(registry.priority(EffectType.SET_POWER) > registry.priority(EffectType.POWER_BOOST));
        assertEquals(registry.priority(EffectType.POWER_BOOST), registry.priority(EffectType.POWER_NERF));
    }
}
