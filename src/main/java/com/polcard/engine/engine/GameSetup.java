package com.polcard.engine.engine;

import com.polcard.engine.card.Card;
import com.polcard.engine.card.Catalog;
import com.polcard.engine.config.EngineConfig;
import com.polcard.engine.deck.Deck;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.PlayerDeck;
import com.polcard.engine.game.PlayerState;
import com.polcard.engine.game.PlayerZones;
import com.polcard.engine.game.ZoneName;
import com.polcard.engine.sequence.PlayAction;
import com.polcard.engine.sequence.PlayData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Pre-game preparation: dealing decks, choosing the first player and recording the
 * opening leaders into the play sequence.
 */
public class GameSetup {
    private static final Logger log = LoggerFactory.getLogger(GameSetup.class);

    private final Catalog catalog;
    private final EngineConfig config;
    private final Clock clock;

    public GameSetup(Catalog catalog, EngineConfig config, Clock clock) {
        this.catalog = catalog;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Shuffle the deck with the game generator, deal the opening hand and reveal the first leader.
     */
    public void seatPlayer(GameState state, String playerId, Deck deck) {
        List<String> cards = new ArrayList<>(deck.getCards());
        state.rng().shuffle(cards);
        int handSize = Math.min(config.initialHandSize(), cards.size());
        List<String> hand = new ArrayList<>(cards.subList(0, handSize));
        List<String> main = new ArrayList<>(cards.subList(handSize, cards.size()));

        PlayerState player = state.player(playerId);
        player.setDeck(new PlayerDeck(deck.getLeader(), main, hand));
        state.zonesOf(playerId).setLeader(player.getDeck().currentLeaderId());
        log.debug("Seated {} with deck {} ({} cards)", playerId, deck.getId(), cards.size());
    }

    /**
     * Return the hand to the deck, reshuffle and deal a new hand of the same size.
     */
    public void redraw(GameState state, String playerId) {
        PlayerDeck deck = state.player(playerId).getDeck();
        int handSize = deck.getHand().size();
        List<String> cards = new ArrayList<>(deck.getMainDeck().toList());
        cards.addAll(deck.getHand().getCards());
        deck.getHand().clear();
        deck.getMainDeck().clear();
        deck.getMainDeck().putOnBottom(cards);
        deck.getMainDeck().shuffle(state.rng());
        deck.getHand().addAll(deck.getMainDeck().drawN(handSize));
    }

    /**
     * The player whose leader has the higher initialPoint goes first; ties are settled by the generator.
     */
    public void chooseFirstPlayer(GameState state) {
        List<String> ids = state.playerIds();
        if (ids.size() < 2) {
            state.setFirstPlayer(0);
            return;
        }
        int first = leaderPoint(state, ids.get(0));
        int second = leaderPoint(state, ids.get(1));
        int chosen;
        if (first != second) {
            chosen = first > second ? 0 : 1;
        } else {
            chosen = state.rng().nextInt(2);
        }
        state.setFirstPlayer(chosen);
        log.info("First player of {} is {}", state.getGameId(), ids.get(chosen));
    }

    private int leaderPoint(GameState state, String playerId) {
        return catalog.currentLeader(state.player(playerId).getDeck())
                .map(Card.Leader::getInitialPoint)
                .orElse(0);
    }

    /**
     * Record a PLAY_LEADER for every player whose current leader has none, first player first.
     *
     * @return number of records added
     */
    public int recordMissingLeaders(GameState state, boolean initial) {
        int added = 0;
        for (String playerId : state.playersInTurnOrder()) {
            PlayerDeck deck = state.player(playerId).getDeck();
            PlayerZones zones = state.zonesOf(playerId);
            String leaderId = zones.getLeader() != null ? zones.getLeader() : deck.currentLeaderId();
            if (leaderId == null) {
                log.warn("Player {} has no leader to record", playerId);
                continue;
            }
            zones.setLeader(leaderId);
            if (!state.getPlaySequence().hasLeaderPlay(playerId, leaderId)) {
                state.getPlaySequence().append(playerId, leaderId, PlayAction.PLAY_LEADER, ZoneName.LEADER,
                        PlayData.leader(deck.getCurrentLeaderIdx(), initial, false), clock.millis(),
                        state.getCurrentTurn(), state.getPhase());
                added++;
            }
        }
        return added;
    }
}
