package com.polcard.engine.action;

import com.polcard.engine.card.Card;
import com.polcard.engine.card.CardCategory;
import com.polcard.engine.card.Catalog;
import com.polcard.engine.card.TriggerEvent;
import com.polcard.engine.card.ZoneCompatibility;
import com.polcard.engine.effect.EffectSimulator;
import com.polcard.engine.effect.TriggeredEffectExecutor;
import com.polcard.engine.event.EventData;
import com.polcard.engine.event.EventType;
import com.polcard.engine.game.ErrorType;
import com.polcard.engine.game.FieldEffects;
import com.polcard.engine.game.GameRuleException;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.PlacedCard;
import com.polcard.engine.game.PlayerState;
import com.polcard.engine.game.PlayerZones;
import com.polcard.engine.game.TurnAction;
import com.polcard.engine.game.ZoneName;
import com.polcard.engine.selection.SelectionManager;
import com.polcard.engine.sequence.PlayAction;
import com.polcard.engine.sequence.PlayData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Validates and commits a card placement from hand.
 *
 * <p>Validation stops at the first failure and leaves the state untouched. A committed
 * placement is recorded in the play sequence, replayed through the simulator, and then
 * runs the card's onSummon (characters) or onPlay (help) one-shot rules.
 */
public class CardAction {
    private static final Logger log = LoggerFactory.getLogger(CardAction.class);

    private final Catalog catalog;
    private final EffectSimulator simulator;
    private final TriggeredEffectExecutor executor;
    private final SelectionManager selectionManager;
    private final Clock clock;

    public CardAction(Catalog catalog, EffectSimulator simulator, TriggeredEffectExecutor executor,
                      SelectionManager selectionManager, Clock clock) {
        this.catalog = catalog;
        this.simulator = simulator;
        this.executor = executor;
        this.selectionManager = selectionManager;
        this.clock = clock;
    }

    /**
     * Place the hand card at {@code cardIdx} into field zone {@code fieldIdx}.
     *
     * @throws GameRuleException if any placement rule rejects the play
     */
    public PlacementResult play(GameState state, String playerId, int fieldIdx, int cardIdx, boolean faceDown)
            throws GameRuleException {
        Card card = validate(state, playerId, fieldIdx, cardIdx, faceDown);
        return commit(state, playerId, card, ZoneName.fromFieldIndex(fieldIdx), cardIdx, faceDown);
    }

    // ---- Validation ----

    /**
     * Run every placement check without changing the state.
     *
     * @return the card that would be placed
     */
    public Card validate(GameState state, String playerId, int fieldIdx, int cardIdx, boolean faceDown)
            throws GameRuleException {
        selectionManager.requireNoPendingSelection(state, playerId);

        ZoneName zone = ZoneName.fromFieldIndex(fieldIdx);
        if (zone == null) {
            throw new GameRuleException(ErrorType.INVALID_POSITION, "Invalid field position: " + fieldIdx);
        }
        PlayerState player = state.player(playerId);
        String cardId = player.getDeck().getHand().get(cardIdx);
        if (cardId == null) {
            throw new GameRuleException(ErrorType.INVALID_CARD_INDEX, "Invalid card index: " + cardIdx);
        }
        Card card = catalog.findCard(cardId)
                .orElseThrow(() -> new GameRuleException(ErrorType.CARD_NOT_FOUND, "Card not found: " + cardId));

        checkPhase(state.getPhase(), zone, card, faceDown);

        PlayerZones zones = state.zonesOf(playerId);
        if (faceDown) {
            checkFaceDownOccupancy(zones, zone);
            return card;
        }
        checkCardType(zones, zone, card);

        FieldEffects effects = player.getFieldEffects();
        if (effects.specialStates().isPrevented(zone)) {
            throw new GameRuleException(ErrorType.PLAY_PREVENTED,
                    "Playing face-up cards into " + zone.getJsonValue() + " is prevented by a field effect");
        }
        if (!effects.specialStates().zonePlacementFreedom()) {
            checkCompatibility(state, player, zone, card);
        }
        return card;
    }

    private static void checkPhase(Phase phase, ZoneName zone, Card card, boolean faceDown) throws GameRuleException {
        if (zone == ZoneName.SP) {
            if (faceDown && phase != Phase.SP_PHASE) {
                throw new GameRuleException(ErrorType.PHASE_RESTRICTION_ERROR,
                        "Cannot play face-down cards in SP zone during " + phase);
            }
            if (!faceDown && phase == Phase.SP_PHASE) {
                throw new GameRuleException(ErrorType.SP_PHASE_RESTRICTION,
                        "Cards in SP zone must be played face-down during SP_PHASE");
            }
        } else if (phase == Phase.SP_PHASE) {
            throw new GameRuleException(ErrorType.PHASE_RESTRICTION_ERROR,
                    "Only the SP zone can be filled during SP_PHASE");
        }
        if (!faceDown && card.getCardType() == CardCategory.SP) {
            throw new GameRuleException(ErrorType.PHASE_RESTRICTION_ERROR,
                    "SP cards can only be played face-down in the SP zone during SP_PHASE");
        }
    }

    private static void checkFaceDownOccupancy(PlayerZones zones, ZoneName zone) throws GameRuleException {
        if ((zone == ZoneName.HELP || zone == ZoneName.SP) && !zones.isEmpty(zone)) {
            throw new GameRuleException(ErrorType.ZONE_OCCUPIED_ERROR,
                    (zone == ZoneName.HELP ? "Help" : "SP") + " zone already occupied");
        }
    }

    private static void checkCardType(PlayerZones zones, ZoneName zone, Card card) throws GameRuleException {
        switch (card.getCardType()) {
            case CHARACTER -> {
                if (!zone.isCharacterZone()) {
                    throw new GameRuleException(ErrorType.CARD_TYPE_ZONE_ERROR,
                            "Character cards can only be placed in top, left or right zones");
                }
                if (zones.faceUpIn(zone).isPresent()) {
                    throw new GameRuleException(ErrorType.ZONE_OCCUPIED_ERROR, "Character already in this position");
                }
            }
            case HELP -> {
                if (zone != ZoneName.HELP) {
                    throw new GameRuleException(ErrorType.CARD_TYPE_ZONE_ERROR,
                            "Help cards can only be placed in the help zone");
                }
                if (!zones.isEmpty(ZoneName.HELP)) {
                    throw new GameRuleException(ErrorType.ZONE_OCCUPIED_ERROR, "Help zone already occupied");
                }
            }
            case LEADER -> throw new GameRuleException(ErrorType.CARD_TYPE_ZONE_ERROR,
                    "Leader cards cannot be played from hand");
            case SP -> throw new GameRuleException(ErrorType.CARD_TYPE_ZONE_ERROR,
                    "SP cards can only be placed in the SP zone");
        }
    }

    private void checkCompatibility(GameState state, PlayerState player, ZoneName zone, Card card)
            throws GameRuleException {
        List<String> restriction = player.getFieldEffects().restrictionFor(zone);
        if (!zone.isCharacterZone()) {
            if (!restriction.contains(ZoneCompatibility.ALL)
                    && !restriction.contains(card.getCardType().getJsonValue())) {
                throw new GameRuleException(ErrorType.FIELD_EFFECT_RESTRICTION,
                        "Card type '" + card.getCardType().getJsonValue()
                                + "' not allowed in zone. Allowed types: " + String.join(", ", restriction));
            }
            return;
        }
        List<String> leaderAllowed = catalog.currentLeader(player.getDeck())
                .map(Card.Leader::getZoneCompatibility)
                .map(compatibility -> compatibility.allowedFor(zone))
                .orElse(List.of(ZoneCompatibility.ALL));
        if (!accepts(leaderAllowed, card)) {
            throw new GameRuleException(ErrorType.ZONE_COMPATIBILITY_ERROR,
                    "Card type '" + card.getGameType() + "' not compatible with leader in "
                            + zone.getJsonValue() + " zone. Allowed types: " + String.join(", ", leaderAllowed));
        }
        if (!accepts(restriction, card)) {
            throw new GameRuleException(ErrorType.FIELD_EFFECT_RESTRICTION,
                    "Card type '" + card.getGameType() + "' not allowed in zone. Allowed types: "
                            + String.join(", ", restriction));
        }
    }

    /**
     * A faction list accepts a card when it is open, names the card's gameType, or
     * shares a trait with it. A card with trait "all" fits any list.
     */
    static boolean accepts(List<String> allowed, Card card) {
        if (allowed.contains(ZoneCompatibility.ALL) || allowed.contains(card.getGameType())) {
            return true;
        }
        for (String faction : allowed) {
            if (card.hasTrait(faction)) {
                return true;
            }
        }
        return false;
    }

    // ---- Commit ----

    private PlacementResult commit(GameState state, String playerId, Card card, ZoneName zone, int cardIdx,
                                   boolean faceDown) {
        long now = clock.millis();
        PlayerState player = state.player(playerId);
        PlayerZones zones = state.zonesOf(playerId);

        player.getDeck().getHand().remove(cardIdx);
        zones.cardsIn(zone).add(faceDown ? PlacedCard.faceDown(card.getId()) : PlacedCard.faceUp(card.getId(), card.getPower()));
        player.recordTurnAction(new TurnAction(faceDown ? TurnAction.Type.PLAY_CARD_BACK : TurnAction.Type.PLAY_CARD,
                state.getCurrentTurn(), card.getId(), zone));
        state.getPlaySequence().append(playerId, card.getId(), PlayAction.PLAY_CARD, zone,
                PlayData.placement(faceDown), now, state.getCurrentTurn(), state.getPhase());

        state.emit(EventType.CARD_PLAYED, EventData.of(
                "playerId", playerId,
                "cardId", faceDown ? null : card.getId(),
                "zone", zone.getJsonValue(),
                "isFaceDown", faceDown), now);
        state.emit(EventType.ZONE_FILLED, EventData.of("playerId", playerId, "zone", zone.getJsonValue()), now);
        log.info("{} played {} {} to {}", playerId, card.getId(), faceDown ? "face-down" : "face-up", zone.getJsonValue());

        simulator.apply(state);

        boolean selectionOpened = false;
        if (!faceDown && zone != ZoneName.SP) {
            TriggerEvent event = card.getCardType() == CardCategory.CHARACTER ? TriggerEvent.ON_SUMMON : TriggerEvent.ON_PLAY;
            boolean silenced = event == TriggerEvent.ON_SUMMON
                    && player.getFieldEffects().specialStates().summonSilenced();
            if (silenced) {
                log.info("onSummon of {} silenced", card.getId());
            } else if (!executor.oneShotRules(card.getId(), event).isEmpty()) {
                selectionOpened = executor.fire(state, playerId, card.getId(), event, true);
                state.emit(EventType.CARD_EFFECT_TRIGGERED, EventData.of(
                        "playerId", playerId,
                        "cardId", card.getId(),
                        "trigger", event.getJsonValue(),
                        "requiresSelection", selectionOpened), clock.millis());
                simulator.apply(state);
            }
        }
        return new PlacementResult(card.getId(), zone, faceDown, selectionOpened);
    }
}
