package com.polcard.engine.selection;

import com.polcard.engine.card.Card;
import com.polcard.engine.card.CardCategory;
import com.polcard.engine.card.Catalog;
import com.polcard.engine.card.EffectSpec;
import com.polcard.engine.card.EffectType;
import com.polcard.engine.card.SearchDestination;
import com.polcard.engine.config.EngineConfig;
import com.polcard.engine.event.EventData;
import com.polcard.engine.event.EventType;
import com.polcard.engine.game.ErrorType;
import com.polcard.engine.game.GameRuleException;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.NeutralizationRecord;
import com.polcard.engine.game.PendingPlayerAction;
import com.polcard.engine.game.PendingSelection;
import com.polcard.engine.game.PlacedCard;
import com.polcard.engine.game.PlayerDeck;
import com.polcard.engine.game.PlayerZones;
import com.polcard.engine.game.ZoneName;
import com.polcard.engine.sequence.PlayAction;
import com.polcard.engine.sequence.PlayData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Opens and resolves the interactive choices card effects ask for.
 *
 * <p>While a selection is open, {@code pendingPlayerAction} is set and the game only
 * accepts the owning player's SelectCard for it.
 */
public class SelectionManager {
    private static final Logger log = LoggerFactory.getLogger(SelectionManager.class);

    private final Catalog catalog;
    private final EngineConfig config;
    private final Clock clock;

    public SelectionManager(Catalog catalog, EngineConfig config, Clock clock) {
        this.catalog = catalog;
        this.config = config;
        this.clock = clock;
    }

    // ---- Gate ----

    /**
     * Reject any action other than resolving the open selection.
     *
     * @throws GameRuleException CARD_SELECTION_PENDING for the selecting player,
     *                           WAITING_FOR_PLAYER for the other one
     */
    public void requireNoPendingSelection(GameState state, String playerId) throws GameRuleException {
        PendingPlayerAction pending = state.getPendingPlayerAction();
        if (pending == null) {
            return;
        }
        PendingSelection selection = state.getPendingCardSelections().get(pending.selectionId());
        if (pending.playerId().equals(playerId)) {
            int count = selection != null ? selection.selectCount() : 1;
            throw new GameRuleException(ErrorType.CARD_SELECTION_PENDING,
                    "You must complete your card selection first. Select " + count + " card(s).");
        }
        String name = state.hasPlayer(pending.playerId()) && state.player(pending.playerId()).getName() != null
                ? state.player(pending.playerId()).getName() : pending.playerId();
        throw new GameRuleException(ErrorType.WAITING_FOR_PLAYER,
                "Waiting for " + name + " to complete card selection. Please wait.");
    }

    // ---- Opening ----

    /**
     * Take the top cards of the player's deck and let them choose among those that pass
     * the category filter. When none pass, the cards go back to the bottom and nothing opens.
     *
     * @return true if a selection was opened
     */
    public boolean openDeckSearch(GameState state, String playerId, String sourceCardId, EffectSpec spec) {
        PlayerDeck deck = state.player(playerId).getDeck();
        int wanted = spec.getSelectCount() != null ? spec.getSelectCount() : config.defaultSearchSelectCount();
        int searchCount = spec.getSearchCount() != null ? spec.getSearchCount() : wanted;

        List<String> searched = deck.getMainDeck().drawN(searchCount);
        if (searched.isEmpty()) {
            log.info("{} searched an empty deck with {}", playerId, sourceCardId);
            return false;
        }
        List<String> eligible = new ArrayList<>();
        for (String cardId : searched) {
            if (matchesCategory(cardId, spec.getCardTypeFilter())) {
                eligible.add(cardId);
            }
        }
        if (eligible.isEmpty()) {
            deck.getMainDeck().putOnBottom(searched);
            log.info("{} found no eligible card with {}", playerId, sourceCardId);
            return false;
        }

        SearchDestination destination = spec.getDestination() != null ? spec.getDestination() : SearchDestination.HAND;
        long now = clock.millis();
        PendingSelection selection = new PendingSelection(newSelectionId(state, playerId, now), playerId,
                PendingSelection.Kind.DECK_SEARCH, sourceCardId, eligible, searched,
                Math.min(wanted, eligible.size()), destination, EffectType.SEARCH_CARD, 0, null, now);
        open(state, selection, now);
        return true;
    }

    /**
     * Ask the player to pick target cards for a neutralize or power effect.
     *
     * @return true if a selection was opened, false when no card is eligible
     */
    public boolean openFieldTarget(GameState state, String playerId, String sourceCardId, EffectType effectType,
                                   int value, String targetPlayerId, List<String> eligibleCards) {
        if (eligibleCards.isEmpty()) {
            log.info("No eligible target for {} of {}", effectType, sourceCardId);
            return false;
        }
        long now = clock.millis();
        PendingSelection selection = new PendingSelection(newSelectionId(state, playerId, now), playerId,
                PendingSelection.Kind.FIELD_TARGET, sourceCardId, eligibleCards, List.of(), 1, null,
                effectType, value, targetPlayerId, now);
        open(state, selection, now);
        return true;
    }

    private void open(GameState state, PendingSelection selection, long now) {
        state.getPendingCardSelections().put(selection.selectionId(), selection);
        state.setPendingPlayerAction(PendingPlayerAction.cardSelection(selection.selectionId(), selection.playerId()));
        state.emit(EventType.CARD_SELECTION_REQUIRED, EventData.of(
                "selectionId", selection.selectionId(),
                "playerId", selection.playerId(),
                "sourceCardId", selection.sourceCardId(),
                "selectionType", selection.kind().getJsonValue(),
                "eligibleCards", selection.eligibleCards(),
                "selectCount", selection.selectCount(),
                "effectType", selection.effectType().getJsonValue(),
                "targetPlayerId", selection.targetPlayerId()), now);
        log.info("Selection {} opened for {} ({})", selection.selectionId(), selection.playerId(), selection.kind());
    }

    private static String newSelectionId(GameState state, String playerId, long now) {
        String base = playerId + "_" + now;
        String id = base;
        int suffix = 1;
        while (state.getPendingCardSelections().containsKey(id)) {
            id = base + "_" + suffix++;
        }
        return id;
    }

    private boolean matchesCategory(String cardId, CardCategory filter) {
        if (filter == null) {
            return true;
        }
        return catalog.findCard(cardId).map(c -> c.getCardType() == filter).orElse(false);
    }

    // ---- Resolution ----

    /**
     * Resolve an open selection with the player's choice.
     *
     * @throws GameRuleException if the selection is unknown, belongs to another player,
     *                           or the choice has the wrong size or an ineligible card
     */
    public SelectionResolution complete(GameState state, String playerId, String selectionId,
                                        List<String> selectedCardIds) throws GameRuleException {
        PendingSelection selection = selectionId == null ? null : state.getPendingCardSelections().get(selectionId);
        if (selection == null) {
            throw new GameRuleException(ErrorType.INVALID_SELECTION, "Invalid or expired card selection");
        }
        if (!selection.playerId().equals(playerId)) {
            throw new GameRuleException(ErrorType.UNAUTHORIZED_SELECTION,
                    "Selection " + selectionId + " belongs to another player");
        }
        List<String> chosen = selectedCardIds == null ? List.of() : selectedCardIds;
        if (chosen.size() != selection.selectCount()) {
            throw new GameRuleException(ErrorType.INVALID_SELECTION_COUNT,
                    "Must select exactly " + selection.selectCount() + " card(s)");
        }
        Set<String> distinct = new HashSet<>();
        for (String cardId : chosen) {
            if (!selection.eligibleCards().contains(cardId) || !distinct.add(cardId)) {
                throw new GameRuleException(ErrorType.INVALID_CARD_SELECTION, "Invalid card selection: " + cardId);
            }
        }

        long now = clock.millis();
        String helpCardPlaced = switch (selection.kind()) {
            case DECK_SEARCH -> resolveDeckSearch(state, selection, chosen, now);
            case FIELD_TARGET -> {
                resolveFieldTarget(state, selection, chosen, now);
                yield null;
            }
        };

        state.getPendingCardSelections().remove(selectionId);
        clearGateFor(state, selectionId);
        state.emit(EventType.CARD_SELECTION_COMPLETED, EventData.of(
                "selectionId", selectionId,
                "playerId", playerId,
                "selectedCardIds", chosen), now);
        log.info("Selection {} completed by {} with {}", selectionId, playerId, chosen);
        return new SelectionResolution(selectionId, playerId, selection.kind(), chosen, helpCardPlaced);
    }

    private String resolveDeckSearch(GameState state, PendingSelection selection, List<String> chosen, long now) {
        String playerId = selection.playerId();
        PlayerDeck deck = state.player(playerId).getDeck();
        PlayerZones zones = state.zonesOf(playerId);
        String helpCardPlaced = null;

        for (String cardId : chosen) {
            switch (selection.destination()) {
                case SP_ZONE -> {
                    if (zones.isEmpty(ZoneName.SP)) {
                        zones.cardsIn(ZoneName.SP).add(PlacedCard.faceDown(cardId));
                        recordSearchPlacement(state, playerId, cardId, ZoneName.SP, selection, true, now);
                        state.emit(EventType.CARD_MOVED_TO_SP_ZONE, EventData.of(
                                "playerId", playerId, "cardId", cardId, "isFaceDown", true), now);
                    } else {
                        moveToHand(state, deck, playerId, cardId, now);
                    }
                }
                case HELP_ZONE, CONDITIONAL_HELP_ZONE -> {
                    if (zones.isEmpty(ZoneName.HELP) && helpCardPlaced == null) {
                        int power = catalog.findCard(cardId).map(Card::getPower).orElse(0);
                        zones.cardsIn(ZoneName.HELP).add(PlacedCard.faceUp(cardId, power));
                        recordSearchPlacement(state, playerId, cardId, ZoneName.HELP, selection, false, now);
                        state.emit(EventType.CARD_MOVED_TO_HELP_ZONE, EventData.of(
                                "playerId", playerId, "cardId", cardId, "isFaceDown", false), now);
                        helpCardPlaced = cardId;
                    } else {
                        moveToHand(state, deck, playerId, cardId, now);
                    }
                }
                default -> moveToHand(state, deck, playerId, cardId, now);
            }
        }

        List<String> unselected = new ArrayList<>(selection.searchedCards());
        unselected.removeAll(chosen);
        deck.getMainDeck().putOnBottom(unselected);
        return helpCardPlaced;
    }

    private static void moveToHand(GameState state, PlayerDeck deck, String playerId, String cardId, long now) {
        deck.getHand().add(cardId);
        state.emit(EventType.CARD_MOVED_TO_HAND, EventData.of("playerId", playerId, "cardId", cardId), now);
    }

    private static void recordSearchPlacement(GameState state, String playerId, String cardId, ZoneName zone,
                                              PendingSelection selection, boolean faceDown, long now) {
        state.getPlaySequence().append(playerId, cardId, PlayAction.PLAY_CARD, zone,
                PlayData.fromSearch(selection.selectionId(), faceDown), now, state.getCurrentTurn(), state.getPhase());
    }

    private void resolveFieldTarget(GameState state, PendingSelection selection, List<String> chosen, long now) {
        String targetPlayerId = selection.targetPlayerId();
        PlayerZones targetZones = state.zonesOf(targetPlayerId);
        ZoneName zone = targetZones.zoneOf(chosen.get(0)).orElse(null);

        state.getPlaySequence().append(selection.playerId(), selection.sourceCardId(),
                PlayAction.forSelectionEffect(selection.effectType()), zone,
                PlayData.appliedSelection(selection.selectionId(), chosen, targetPlayerId, selection.value()),
                now, state.getCurrentTurn(), state.getPhase());

        if (selection.effectType() == EffectType.NEUTRALIZE_EFFECT) {
            for (String cardId : chosen) {
                state.getNeutralizationHistory().add(new NeutralizationRecord(selection.sourceCardId(),
                        selection.playerId(), cardId, targetPlayerId, state.getCurrentTurn(), now));
                state.emit(EventType.CARD_NEUTRALIZED, EventData.of(
                        "sourceCardId", selection.sourceCardId(),
                        "playerId", selection.playerId(),
                        "targetCardId", cardId,
                        "targetPlayerId", targetPlayerId), now);
            }
        }
    }

    // ---- Timeout ----

    /**
     * Cancel selections older than the configured timeout. Searched cards return to
     * the bottom of the deck and the gate is cleared.
     *
     * @return the cancelled selections
     */
    public List<PendingSelection> expire(GameState state, long now) {
        List<PendingSelection> expired = new ArrayList<>();
        for (PendingSelection selection : new ArrayList<>(state.getPendingCardSelections().values())) {
            if (now - selection.timestamp() < config.selectionTimeoutMillis()) {
                continue;
            }
            if (!selection.searchedCards().isEmpty() && state.hasPlayer(selection.playerId())) {
                state.player(selection.playerId()).getDeck().getMainDeck().putOnBottom(selection.searchedCards());
            }
            state.getPendingCardSelections().remove(selection.selectionId());
            clearGateFor(state, selection.selectionId());
            state.emit(EventType.ERROR_OCCURRED, EventData.of(
                    "errorType", ErrorType.CARD_SELECTION_TIMEOUT.name(),
                    "message", "Card selection " + selection.selectionId() + " timed out",
                    "playerId", selection.playerId()), now);
            log.warn("Selection {} of {} timed out", selection.selectionId(), selection.playerId());
            expired.add(selection);
        }
        return expired;
    }

    private static void clearGateFor(GameState state, String selectionId) {
        PendingPlayerAction pending = state.getPendingPlayerAction();
        if (pending != null && selectionId.equals(pending.selectionId())) {
            state.setPendingPlayerAction(null);
        }
    }
}
