package com.polcard.engine.effect;

import com.polcard.engine.card.Card;
import com.polcard.engine.card.Catalog;
import com.polcard.engine.card.Condition;
import com.polcard.engine.card.EffectRule;
import com.polcard.engine.card.EffectType;
import com.polcard.engine.card.TargetFilter;
import com.polcard.engine.card.TargetOwner;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.PlacedCard;
import com.polcard.engine.game.PlayerZones;
import com.polcard.engine.game.ZoneName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over card rules: condition checks, target enumeration and
 * effect priorities. Every query is evaluated against the given game state and
 * never changes it.
 */
public class EffectRegistry {
    private static final Logger log = LoggerFactory.getLogger(EffectRegistry.class);

    private final Catalog catalog;

    public EffectRegistry(Catalog catalog) {
        this.catalog = catalog;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public List<EffectRule> effectsOf(String cardId) {
        return catalog.effectsOf(cardId);
    }

    public int priority(EffectType type) {
        return EffectPriority.of(type).getValue();
    }

    public boolean isImmune(String cardId) {
        return catalog.findCard(cardId)
                .map(card -> card.getEffects().isImmuneToNeutralization())
                .orElse(false);
    }

    // ---- Conditions ----

    /**
     * All trigger conditions of the rule hold for the source player.
     */
    public boolean conditionsMet(EffectRule rule, GameState state, String sourcePlayerId) {
        for (Condition condition : rule.getTrigger().getConditions()) {
            if (!conditionMet(condition, state, sourcePlayerId)) {
                return false;
            }
        }
        return true;
    }

    public boolean conditionMet(Condition condition, GameState state, String sourcePlayerId) {
        if (condition.getType() == null) {
            return true;
        }
        String opponentId = state.opponentOf(sourcePlayerId);
        String text = condition.textValue();
        return switch (condition.getType()) {
            case SELF_HAS_CHARACTER_WITH_NAME -> hasCharacterNamed(state, sourcePlayerId, text);
            case OPPONENT_HAS_CHARACTER_WITH_NAME -> hasCharacterNamed(state, opponentId, text);
            case SELF_HAS_LEADER -> leaderNameContains(state, sourcePlayerId, text);
            case OPPONENT_LEADER -> leaderNameContains(state, opponentId, text);
            case OPPONENT_HAND_COUNT_MORE_THAN ->
                    opponentId != null && handSize(state, opponentId) > condition.intValue();
            case OPPONENT_HAND_COUNT ->
                    opponentId != null && compare(handSize(state, opponentId), condition.getOperator(), condition.intValue());
            case ZONE_EMPTY -> zoneEmpty(state, sourcePlayerId, condition.getZone());
            case ALLY_FIELD_CONTAINS_NAME -> fieldContainsName(state, sourcePlayerId, text);
            case OPPONENT_FIELD_CONTAINS_NAME -> fieldContainsName(state, opponentId, text);
            case OR -> condition.getConditions().stream()
                    .anyMatch(c -> conditionMet(c, state, sourcePlayerId));
        };
    }

    private boolean hasCharacterNamed(GameState state, String playerId, String name) {
        if (playerId == null || name.isEmpty()) {
            return false;
        }
        PlayerZones zones = state.zonesOf(playerId);
        for (ZoneName zone : ZoneName.CHARACTER_ZONES) {
            for (PlacedCard placed : zones.cardsIn(zone)) {
                if (!placed.faceDown() && nameOf(placed.cardId()).contains(name)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean leaderNameContains(GameState state, String playerId, String name) {
        if (playerId == null || name.isEmpty()) {
            return false;
        }
        String leaderId = state.zonesOf(playerId).getLeader();
        return leaderId != null && nameOf(leaderId).contains(name);
    }

    private boolean fieldContainsName(GameState state, String playerId, String name) {
        if (playerId == null || name.isEmpty()) {
            return false;
        }
        if (leaderNameContains(state, playerId, name)) {
            return true;
        }
        PlayerZones zones = state.zonesOf(playerId);
        for (ZoneName zone : ZoneName.FIELD_ZONES) {
            for (PlacedCard placed : zones.cardsIn(zone)) {
                if (!placed.faceDown() && nameOf(placed.cardId()).contains(name)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean zoneEmpty(GameState state, String playerId, String zoneName) {
        if (zoneName == null) {
            return false;
        }
        ZoneName zone;
        try {
            zone = ZoneName.fromString(zoneName);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring zoneEmpty condition on unknown zone '{}'", zoneName);
            return false;
        }
        if (zone == ZoneName.LEADER) {
            return state.zonesOf(playerId).getLeader() == null;
        }
        return state.zonesOf(playerId).isEmpty(zone);
    }

    private static int handSize(GameState state, String playerId) {
        return state.player(playerId).getDeck().getHand().size();
    }

    static boolean compare(int actual, String operator, int expected) {
        if (operator == null) {
            return actual == expected;
        }
        return switch (operator) {
            case ">=" -> actual >= expected;
            case "<=" -> actual <= expected;
            case ">" -> actual > expected;
            case "<" -> actual < expected;
            case "=", "==" -> actual == expected;
            default -> {
                log.warn("Unknown comparison operator '{}'", operator);
                yield false;
            }
        };
    }

    private String nameOf(String cardId) {
        return catalog.findCard(cardId).map(Card::getName).orElse("");
    }

    // ---- Targets ----

    /**
     * Players addressed by a target owner, relative to the source player, in join order.
     */
    public List<String> targetPlayers(TargetOwner owner, GameState state, String sourcePlayerId) {
        List<String> result = new ArrayList<>();
        for (String playerId : state.playerIds()) {
            boolean self = playerId.equals(sourcePlayerId);
            boolean wanted = switch (owner == null ? TargetOwner.SELF : owner) {
                case SELF -> self;
                case OPPONENT -> !self;
                case BOTH -> true;
            };
            if (wanted) {
                result.add(playerId);
            }
        }
        return result;
    }

    /**
     * Face-up cards the rule addresses: owner, then zones, then filters, then limit.
     */
    public List<TargetRef> targets(EffectRule rule, GameState state, String sourcePlayerId) {
        return targets(rule, state, targetPlayers(rule.getTarget().getOwner(), state, sourcePlayerId));
    }

    /**
     * Enumerate the rule's targets among the given players only.
     */
    public List<TargetRef> targets(EffectRule rule, GameState state, List<String> playerIds) {
        List<TargetRef> result = new ArrayList<>();
        Integer limit = rule.getTarget().getLimit();
        for (String playerId : playerIds) {
            PlayerZones zones = state.zonesOf(playerId);
            for (ZoneName zone : rule.getTarget().effectiveZones()) {
                if (zone == ZoneName.LEADER) {
                    continue;
                }
                for (PlacedCard placed : zones.cardsIn(zone)) {
                    if (placed.faceDown()) {
                        continue;
                    }
                    Optional<Card> card = catalog.findCard(placed.cardId());
                    if (card.isPresent() && matchesFilters(card.get(), rule.getTarget().getFilters())) {
                        result.add(new TargetRef(playerId, placed.cardId(), zone));
                        if (limit != null && result.size() >= limit) {
                            return result;
                        }
                    }
                }
            }
        }
        return result;
    }

    public boolean matchesFilters(Card card, List<TargetFilter> filters) {
        for (TargetFilter filter : filters) {
            if (!matchesFilter(card, filter)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesFilter(Card card, TargetFilter filter) {
        if (filter.getType() == null) {
            return true;
        }
        List<String> accepted = filter.acceptedValues();
        return switch (filter.getType()) {
            case HAS_TRAIT -> accepted.stream().anyMatch(card::hasTrait);
            case HAS_GAME_TYPE, GAME_TYPE_OR -> accepted.contains(card.getGameType());
            case NAME_CONTAINS -> card.getName() != null
                    && accepted.stream().anyMatch(v -> card.getName().contains(v));
        };
    }
}
