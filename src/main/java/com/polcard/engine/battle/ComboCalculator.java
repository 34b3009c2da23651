package com.polcard.engine.battle;

import com.polcard.engine.card.Card;
import com.polcard.engine.card.Catalog;
import com.polcard.engine.card.ComboRule;
import com.polcard.engine.card.ComboType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combo bonuses of a set of face-up characters, read from the catalog's combo table.
 * Conditions look at base power and gameType; matching bonuses add up.
 */
public class ComboCalculator {
    static final int HIGH_POWER_THRESHOLD = 80;
    static final int BALANCED_SPREAD = 30;

    private final Catalog catalog;

    public ComboCalculator(Catalog catalog) {
        this.catalog = catalog;
    }

    public record ComboMatch(ComboType type, String name, int bonus) {
    }

    public List<ComboMatch> matches(List<Card> characters) {
        List<ComboMatch> result = new ArrayList<>();
        for (ComboType type : ComboType.values()) {
            ComboRule rule = catalog.getCombos().get(type);
            if (rule != null && applies(type, characters)) {
                result.add(new ComboMatch(type, rule.name(), rule.bonus()));
            }
        }
        return result;
    }

    public int bonus(List<Card> characters) {
        return matches(characters).stream().mapToInt(ComboMatch::bonus).sum();
    }

    static boolean applies(ComboType type, List<Card> characters) {
        int n = characters.size();
        return switch (type) {
            case ALL_SAME_TYPE -> n >= 2
                    && characters.stream().map(Card::getGameType).distinct().count() == 1;
            case ALL_DIFFERENT_TYPE -> n >= 2
                    && characters.stream().map(Card::getGameType).distinct().count() == n;
            case HIGH_POWER_TRIO -> n >= 3
                    && characters.stream().allMatch(c -> c.getPower() >= HIGH_POWER_THRESHOLD);
            case TRAIT_SYNERGY -> n >= 2 && hasSharedTrait(characters);
            case BALANCED_POWER -> n >= 3 && spread(characters) <= BALANCED_SPREAD;
        };
    }

    private static boolean hasSharedTrait(List<Card> characters) {
        Map<String, Integer> counts = new HashMap<>();
        for (Card card : characters) {
            Set<String> distinct = new HashSet<>(card.getTraits());
            for (String trait : distinct) {
                if (counts.merge(trait, 1, Integer::sum) >= 2) {
                    return true;
                }
            }
        }
        return false;
    }

    private static int spread(List<Card> characters) {
        int max = characters.stream().mapToInt(Card::getPower).max().orElse(0);
        int min = characters.stream().mapToInt(Card::getPower).min().orElse(0);
        return max - min;
    }
}
