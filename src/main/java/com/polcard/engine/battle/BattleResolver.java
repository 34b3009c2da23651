package com.polcard.engine.battle;

import com.polcard.engine.card.Card;
import com.polcard.engine.card.Catalog;
import com.polcard.engine.card.EffectRule;
import com.polcard.engine.card.TriggerEvent;
import com.polcard.engine.config.EngineConfig;
import com.polcard.engine.effect.EffectSimulator;
import com.polcard.engine.effect.TriggeredEffectExecutor;
import com.polcard.engine.event.EventData;
import com.polcard.engine.event.EventType;
import com.polcard.engine.game.FieldEffects;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.PlacedCard;
import com.polcard.engine.game.PlayerDeck;
import com.polcard.engine.game.PlayerState;
import com.polcard.engine.game.PlayerZones;
import com.polcard.engine.game.RoomStatus;
import com.polcard.engine.game.TurnAction;
import com.polcard.engine.game.ZoneName;
import com.polcard.engine.sequence.PlayAction;
import com.polcard.engine.sequence.PlayData;
import com.polcard.engine.turn.TurnManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves a leader battle: reveals SP cards, runs their one-shot rules around the
 * combo calculation, scores both players, awards victory points and either ends the
 * game or moves every player on to their next leader.
 */
public class BattleResolver {
    private static final Logger log = LoggerFactory.getLogger(BattleResolver.class);

    private static final List<String> AFTER_COMBO_MARKERS =
            List.of("combo", "組合", "總能力", "total power", "特殊組合", "總能力結算");

    private final Catalog catalog;
    private final EffectSimulator simulator;
    private final TriggeredEffectExecutor executor;
    private final ComboCalculator comboCalculator;
    private final TurnManager turnManager;
    private final EngineConfig config;
    private final Clock clock;

    public BattleResolver(Catalog catalog, EffectSimulator simulator, TriggeredEffectExecutor executor,
                          TurnManager turnManager, EngineConfig config, Clock clock) {
        this.catalog = catalog;
        this.simulator = simulator;
        this.executor = executor;
        this.comboCalculator = new ComboCalculator(catalog);
        this.turnManager = turnManager;
        this.config = config;
        this.clock = clock;
    }

    public ComboCalculator getComboCalculator() {
        return comboCalculator;
    }

    /**
     * Run the battle of the current round. Expects the game in BATTLE_PHASE.
     *
     * @return the per-player results in join order
     */
    public List<BattleResult> resolve(GameState state) {
        List<SpCard> spCards = orderedSpCards(state, revealSpCards(state));
        simulator.apply(state);

        runSpRules(state, spCards, false);
        simulator.apply(state);
        runSpRules(state, spCards, true);
        simulator.apply(state);

        List<BattleResult> results = new ArrayList<>();
        for (String playerId : state.playerIds()) {
            BattleResult result = score(state, playerId);
            state.player(playerId).setPlayerPoint(result.total());
            results.add(result);
        }
        awardVictoryPoints(state, results);
        return results;
    }

    // ---- Reveal and SP rules ----

    private record SpCard(String playerId, String cardId) {
    }

    /**
     * Flip every face-down SP card. Cards revealed in earlier rounds stay face-up and are not returned.
     */
    private List<SpCard> revealSpCards(GameState state) {
        List<SpCard> flipped = new ArrayList<>();
        List<Map<String, Object>> revealed = new ArrayList<>();
        for (String playerId : state.playerIds()) {
            List<PlacedCard> sp = state.zonesOf(playerId).cardsIn(ZoneName.SP);
            for (int i = 0; i < sp.size(); i++) {
                PlacedCard placed = sp.get(i);
                if (placed.faceDown()) {
                    int power = catalog.findCard(placed.cardId()).map(Card::getPower).orElse(0);
                    sp.set(i, placed.revealed(power));
                    revealed.add(EventData.of("playerId", playerId, "cardId", placed.cardId()));
                    flipped.add(new SpCard(playerId, placed.cardId()));
                }
            }
        }
        state.emit(EventType.SP_CARDS_REVEALED, EventData.of("cards", revealed), clock.millis());
        return flipped;
    }

    /**
     * SP cards revealed this battle, higher leader initialPoint first, the first player winning ties.
     */
    private List<SpCard> orderedSpCards(GameState state, List<SpCard> revealed) {
        List<SpCard> cards = new ArrayList<>();
        for (String playerId : state.playersInTurnOrder()) {
            for (SpCard sp : revealed) {
                if (sp.playerId().equals(playerId)) {
                    cards.add(sp);
                }
            }
        }
        cards.sort(Comparator.comparingInt((SpCard c) -> leaderInitialPoint(state, c.playerId())).reversed()
                .thenComparingInt(c -> state.isFirstPlayer(c.playerId()) ? 0 : 1));
        return cards;
    }

    private int leaderInitialPoint(GameState state, String playerId) {
        return catalog.currentLeader(state.player(playerId).getDeck())
                .map(Card.Leader::getInitialPoint).orElse(0);
    }

    private void runSpRules(GameState state, List<SpCard> spCards, boolean afterCombo) {
        for (SpCard sp : spCards) {
            if (state.player(sp.playerId()).getFieldEffects().isDisabled(sp.cardId())) {
                log.info("SP card {} of {} is neutralized", sp.cardId(), sp.playerId());
                continue;
            }
            for (EffectRule rule : catalog.effectsOf(sp.cardId())) {
                if (TriggeredEffectExecutor.isOneShot(rule) && isAfterCombo(rule) == afterCombo) {
                    executor.execute(state, sp.playerId(), sp.cardId(), rule, false);
                }
            }
        }
    }

    static boolean isAfterCombo(EffectRule rule) {
        if (rule.getEvent() == TriggerEvent.FINAL_CALCULATION) {
            return true;
        }
        String description = rule.getDescription() == null ? "" : rule.getDescription().toLowerCase(Locale.ROOT);
        return AFTER_COMBO_MARKERS.stream().anyMatch(description::contains);
    }

    // ---- Scoring ----

    /**
     * Score a player from the current field effects.
     */
    public BattleResult score(GameState state, String playerId) {
        FieldEffects effects = state.player(playerId).getFieldEffects();
        PlayerZones zones = state.zonesOf(playerId);

        int characterPower = 0;
        List<Card> characters = new ArrayList<>();
        for (ZoneName zone : ZoneName.CHARACTER_ZONES) {
            for (PlacedCard placed : zones.cardsIn(zone)) {
                if (!placed.faceDown()) {
                    characterPower += effects.powerOf(placed.cardId());
                    catalog.findCard(placed.cardId()).ifPresent(characters::add);
                }
            }
        }

        List<String> comboNames = new ArrayList<>();
        int comboBonus = 0;
        if (!effects.specialStates().disableComboBonus()) {
            for (ComboCalculator.ComboMatch match : comboCalculator.matches(characters)) {
                comboNames.add(match.type().getJsonValue());
                comboBonus += match.bonus();
            }
        }
        int modifier = effects.victoryPointModifiers();
        int total = Math.max(0, characterPower + comboBonus + modifier);
        return new BattleResult(playerId, characterPower, comboBonus, comboNames, modifier, total);
    }

    // ---- Victory points and round end ----

    private void awardVictoryPoints(GameState state, List<BattleResult> results) {
        long now = clock.millis();
        String roundWinner = null;
        int awarded = 0;
        if (results.size() == 2 && results.get(0).total() != results.get(1).total()) {
            BattleResult high = results.get(0).total() > results.get(1).total() ? results.get(0) : results.get(1);
            BattleResult low = high == results.get(0) ? results.get(1) : results.get(0);
            roundWinner = high.playerId();
            awarded = high.total() - low.total();
            PlayerState winner = state.player(roundWinner);
            winner.setVictoryPoints(winner.getVictoryPoints() + awarded);
        }

        List<Map<String, Object>> scoreData = new ArrayList<>();
        for (BattleResult result : results) {
            scoreData.add(EventData.of(
                    "playerId", result.playerId(),
                    "characterPower", result.characterPower(),
                    "comboBonus", result.comboBonus(),
                    "combos", result.combos(),
                    "modifier", result.modifier(),
                    "total", result.total()));
            state.player(result.playerId()).recordTurnAction(
                    new TurnAction(TurnAction.Type.END_LEADER_BATTLE, state.getCurrentTurn(), null, null));
        }
        state.emit(EventType.BATTLE_RESULT, EventData.of(
                "round", state.getRound(),
                "results", scoreData,
                "roundWinner", roundWinner,
                "pointsAwarded", awarded,
                "victoryPoints", victoryPoints(state)), now);
        log.info("Round {} battle: winner={} awarded={} vp={}", state.getRound(), roundWinner, awarded,
                victoryPoints(state));

        for (String playerId : state.playerIds()) {
            if (state.player(playerId).getVictoryPoints() >= config.victoryPointThreshold()) {
                endGame(state, playerId, "victoryThreshold");
                return;
            }
        }
        boolean lastLeader = state.playerIds().stream()
                .anyMatch(id -> state.player(id).getDeck().isOnLastLeader());
        if (lastLeader) {
            endGame(state, leaderOnPoints(state), "leadersExhausted");
            return;
        }
        startNextRound(state);
    }

    private static String leaderOnPoints(GameState state) {
        String best = GameState.DRAW;
        int bestPoints = Integer.MIN_VALUE;
        boolean tie = false;
        for (String playerId : state.playerIds()) {
            int points = state.player(playerId).getVictoryPoints();
            if (points > bestPoints) {
                best = playerId;
                bestPoints = points;
                tie = false;
            } else if (points == bestPoints) {
                tie = true;
            }
        }
        return tie ? GameState.DRAW : best;
    }

    private void endGame(GameState state, String winner, String reason) {
        Phase previous = state.getPhase();
        state.setPhase(Phase.GAME_END);
        state.setWinner(winner);
        state.setRoomStatus(RoomStatus.GAME_OVER);
        long now = clock.millis();
        state.emit(EventType.PHASE_CHANGE, EventData.of("from", previous.name(), "to", Phase.GAME_END.name()), now);
        state.emit(EventType.GAME_END, EventData.of(
                "winner", winner,
                "reason", reason,
                "victoryPoints", victoryPoints(state)), now);
        log.info("Game {} over: winner={} ({})", state.getGameId(), winner, reason);
    }

    private void startNextRound(GameState state) {
        long now = clock.millis();
        int finishedRound = state.getRound();
        for (String playerId : state.playerIds()) {
            PlayerState player = state.player(playerId);
            PlayerZones zones = state.zonesOf(playerId);
            zones.clearCharacterZones();
            player.setPlayerPoint(0);
            player.setSpPassed(false);
            PlayerDeck deck = player.getDeck();
            deck.setCurrentLeaderIdx(deck.getCurrentLeaderIdx() + 1);
            zones.setLeader(deck.currentLeaderId());
        }
        state.setRound(finishedRound + 1);

        state.getPlaySequence().clear(false);
        for (String playerId : state.playersInTurnOrder()) {
            PlayerDeck deck = state.player(playerId).getDeck();
            state.getPlaySequence().append(playerId, deck.currentLeaderId(), PlayAction.PLAY_LEADER, ZoneName.LEADER,
                    PlayData.leader(deck.getCurrentLeaderIdx(), false, true), now, state.getCurrentTurn(),
                    state.getPhase());
        }
        for (String playerId : state.playersInTurnOrder()) {
            PlayerZones zones = state.zonesOf(playerId);
            for (ZoneName zone : List.of(ZoneName.HELP, ZoneName.SP)) {
                for (PlacedCard placed : zones.cardsIn(zone)) {
                    if (!placed.faceDown()) {
                        state.getPlaySequence().append(playerId, placed.cardId(), PlayAction.PLAY_CARD, zone,
                                PlayData.carryOver(), now, state.getCurrentTurn(), state.getPhase());
                    }
                }
            }
        }
        simulator.apply(state);

        state.emit(EventType.ROUND_END, EventData.of(
                "round", finishedRound,
                "victoryPoints", victoryPoints(state)), now);
        for (String playerId : state.playerIds()) {
            PlayerDeck deck = state.player(playerId).getDeck();
            state.emit(EventType.LEADER_CHANGED, EventData.of(
                    "playerId", playerId,
                    "leaderId", deck.currentLeaderId(),
                    "leaderIndex", deck.getCurrentLeaderIdx()), now);
        }
        log.info("Round {} begins", state.getRound());
        turnManager.startNewTurn(state);
    }

    private static Map<String, Object> victoryPoints(GameState state) {
        Map<String, Object> points = new LinkedHashMap<>();
        for (String playerId : state.playerIds()) {
            points.put(playerId, state.player(playerId).getVictoryPoints());
        }
        return points;
    }
}
