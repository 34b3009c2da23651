package com.polcard.engine.battle;

import com.polcard.engine.GameFixtures;
import com.polcard.engine.card.Card;
import com.polcard.engine.card.ComboType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComboCalculatorTest {

    private final ComboCalculator calculator = new ComboCalculator(GameFixtures.catalog());

    private static List<Card> cards(String... ids) {
        return Arrays.stream(ids)
                .map(id -> GameFixtures.catalog().findCard(id).orElseThrow())
                .toList();
    }

    private List<ComboType> types(String... ids) {
        return calculator.matches(cards(ids)).stream().map(ComboCalculator.ComboMatch::type).toList();
    }

    @Test
    void testSameFaction() {
        assertEquals(List.of(ComboType.ALL_SAME_TYPE, ComboType.TRAIT_SYNERGY, ComboType.BALANCED_POWER),
                types("c-1", "c-5", "c-6"));
        assertEquals(90, calculator.bonus(cards("c-1", "c-5", "c-6")));
    }

    @Test
    void testAllDifferentAndBalanced() {
        assertEquals(List.of(ComboType.ALL_DIFFERENT_TYPE, ComboType.BALANCED_POWER), types("c-1", "c-4", "c-17"));
        assertEquals(50, calculator.bonus(cards("c-1", "c-4", "c-17")));
    }

    @Test
    void testHighPowerTrio() {
        assertEquals(List.of(ComboType.ALL_DIFFERENT_TYPE, ComboType.HIGH_POWER_TRIO,
                ComboType.TRAIT_SYNERGY, ComboType.BALANCED_POWER), types("c-1", "c-3", "c-2"));
        assertEquals(130, calculator.bonus(cards("c-1", "c-3", "c-2")));
    }

    @Test
    void testPairsOnlyCountTwoCardCombos() {
        assertEquals(List.of(ComboType.ALL_SAME_TYPE, ComboType.TRAIT_SYNERGY), types("c-17", "c-18"));
        assertFalse(ComboCalculator.applies(ComboType.HIGH_POWER_TRIO, cards("c-1", "c-7")));
    }

    @Test
    void testNoCombosForSingleOrNoCharacter() {
        assertTrue(calculator.matches(cards("c-1")).isEmpty());
        assertTrue(calculator.matches(List.of()).isEmpty());
        assertEquals(0, calculator.bonus(List.of()));
    }
}
