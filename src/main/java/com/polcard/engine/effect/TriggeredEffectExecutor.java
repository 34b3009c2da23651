package com.polcard.engine.effect;

import com.polcard.engine.card.Card;
import com.polcard.engine.card.Catalog;
import com.polcard.engine.card.EffectRule;
import com.polcard.engine.card.EffectType;
import com.polcard.engine.card.TargetOwner;
import com.polcard.engine.card.TriggerEvent;
import com.polcard.engine.event.EventData;
import com.polcard.engine.event.EventType;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.PlayerDeck;
import com.polcard.engine.game.zones.Hand;
import com.polcard.engine.selection.SelectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the one-shot part of triggered rules when their event fires: draws, random
 * discards, deck searches and target selections. Persistent rules are left to the
 * simulator.
 */
public class TriggeredEffectExecutor {
    private static final Logger log = LoggerFactory.getLogger(TriggeredEffectExecutor.class);

    private final Catalog catalog;
    private final EffectRegistry registry;
    private final SelectionManager selectionManager;
    private final Clock clock;

    public TriggeredEffectExecutor(Catalog catalog, EffectRegistry registry, SelectionManager selectionManager,
                                   Clock clock) {
        this.catalog = catalog;
        this.registry = registry;
        this.selectionManager = selectionManager;
        this.clock = clock;
    }

    /**
     * Rules of a card that act once when the event fires.
     */
    public List<EffectRule> oneShotRules(String cardId, TriggerEvent event) {
        List<EffectRule> rules = new ArrayList<>();
        for (EffectRule rule : catalog.effectsOf(cardId)) {
            if (rule.getEvent() == event && isOneShot(rule)) {
                rules.add(rule);
            }
        }
        return rules;
    }

    public static boolean isOneShot(EffectRule rule) {
        EffectType type = rule.getEffectType();
        return type != null && (type.isOneShot() || rule.getTarget().isRequiresSelection());
    }

    /**
     * Fire every one-shot rule of the card bound to the event.
     *
     * @return true if a selection was opened; later selection rules are then skipped
     */
    public boolean fire(GameState state, String playerId, String cardId, TriggerEvent event, boolean allowSelection) {
        boolean opened = false;
        for (EffectRule rule : oneShotRules(cardId, event)) {
            if (opened && needsSelection(rule)) {
                log.warn("Skipping {} of {}: a selection is already open for this card", rule.getId(), cardId);
                continue;
            }
            opened |= execute(state, playerId, cardId, rule, allowSelection);
        }
        return opened;
    }

    private static boolean needsSelection(EffectRule rule) {
        return rule.getEffectType() == EffectType.SEARCH_CARD || rule.getTarget().isRequiresSelection();
    }

    /**
     * Execute a single one-shot rule if its conditions hold.
     *
     * @return true if the rule opened a selection
     */
    public boolean execute(GameState state, String playerId, String cardId, EffectRule rule, boolean allowSelection) {
        if (!registry.conditionsMet(rule, state, playerId)) {
            log.debug("Conditions of {} on {} not met", rule.getId(), cardId);
            return false;
        }
        if (needsSelection(rule) && !allowSelection) {
            log.info("Rule {} of {} needs a selection and cannot run now", rule.getId(), cardId);
            return false;
        }
        EffectType type = rule.getEffectType();
        if (type == EffectType.DRAW_CARD) {
            draw(state, rule, playerId, cardId);
            return false;
        }
        if (type == EffectType.DISCARD_RANDOM_CARD) {
            discard(state, rule, playerId, cardId);
            return false;
        }
        if (type == EffectType.SEARCH_CARD) {
            return selectionManager.openDeckSearch(state, playerId, cardId, rule.getEffect());
        }
        if (rule.getTarget().isRequiresSelection()) {
            return openFieldTarget(state, rule, playerId, cardId);
        }
        return false;
    }

    private void draw(GameState state, EffectRule rule, String playerId, String cardId) {
        int count = Math.max(1, rule.getEffect().intValue());
        for (String target : registry.targetPlayers(rule.getTarget().getOwner(), state, playerId)) {
            PlayerDeck deck = state.player(target).getDeck();
            List<String> drawn = deck.getMainDeck().drawN(count);
            deck.getHand().addAll(drawn);
            state.emit(EventType.CARDS_DRAWN, EventData.of(
                    "playerId", target,
                    "count", drawn.size(),
                    "sourceCardId", cardId), clock.millis());
        }
    }

    private void discard(GameState state, EffectRule rule, String playerId, String cardId) {
        int count = Math.max(1, rule.getEffect().intValue());
        for (String target : registry.targetPlayers(rule.getTarget().getOwner(), state, playerId)) {
            Hand hand = state.player(target).getDeck().getHand();
            List<String> discarded = new ArrayList<>();
            for (int i = 0; i < count && !hand.isEmpty(); i++) {
                discarded.add(hand.remove(state.rng().nextInt(hand.size())));
            }
            state.emit(EventType.CARDS_DISCARDED, EventData.of(
                    "playerId", target,
                    "cardIds", discarded,
                    "sourceCardId", cardId), clock.millis());
        }
    }

    private boolean openFieldTarget(GameState state, EffectRule rule, String playerId, String cardId) {
        EffectType type = rule.getEffectType();
        if (type != EffectType.NEUTRALIZE_EFFECT && !type.isPowerChange()) {
            log.warn("Rule {} of {} asks for a selection with unsupported effect {}", rule.getId(), cardId, type);
            return false;
        }
        String targetPlayerId = rule.getTarget().getOwner() == TargetOwner.SELF ? playerId : state.opponentOf(playerId);
        if (targetPlayerId == null) {
            return false;
        }
        List<String> eligible = new ArrayList<>();
        for (TargetRef target : registry.targets(rule, state, List.of(targetPlayerId))) {
            if (type != EffectType.NEUTRALIZE_EFFECT || canBeNeutralized(target.cardId())) {
                eligible.add(target.cardId());
            }
        }
        return selectionManager.openFieldTarget(state, playerId, cardId, type, rule.getEffect().intValue(),
                targetPlayerId, eligible);
    }

    private boolean canBeNeutralized(String cardId) {
        Optional<Card> card = catalog.findCard(cardId);
        return card.isPresent() && card.get().hasEffectRules() && !card.get().getEffects().isImmuneToNeutralization();
    }
}
