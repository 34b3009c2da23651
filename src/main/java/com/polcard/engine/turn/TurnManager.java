package com.polcard.engine.turn;

import com.polcard.engine.event.EventData;
import com.polcard.engine.event.EventType;
import com.polcard.engine.game.ErrorType;
import com.polcard.engine.game.GameRuleException;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.PlayerDeck;
import com.polcard.engine.game.PlayerState;
import com.polcard.engine.game.PlayerZones;
import com.polcard.engine.game.TurnAction;
import com.polcard.engine.game.ZoneName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Turn structure and phase progression.
 *
 * <p>Turns advance in steps of 0.5: whole turns belong to the first player, halves to
 * the other one. Each new turn starts with a one-card draw that the player acknowledges
 * before the main phase resumes. Once every character and help zone is filled the game
 * moves to the SP phase, or straight to battle when nobody has an SP play to make.
 */
public class TurnManager {
    private static final Logger log = LoggerFactory.getLogger(TurnManager.class);

    private final Clock clock;

    public TurnManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * First turn of a round or game: the first player acts in MAIN_PHASE without drawing.
     */
    public void beginFirstTurn(GameState state) {
        state.setCurrentTurn(1);
        state.setCurrentPlayer(state.firstPlayerId());
        setPhase(state, Phase.MAIN_PHASE);
        state.emit(EventType.GAME_PHASE_START, EventData.of(
                "phase", Phase.MAIN_PHASE.name(),
                "currentPlayer", state.getCurrentPlayer(),
                "turn", state.getCurrentTurn(),
                "round", state.getRound()), clock.millis());
    }

    /**
     * Hand the turn to the next player and run their draw phase.
     */
    public void startNewTurn(GameState state) {
        double turn = state.getCurrentTurn() + 0.5;
        state.setCurrentTurn(turn);
        String next = turn == Math.floor(turn) ? state.firstPlayerId() : state.opponentOf(state.firstPlayerId());
        state.setCurrentPlayer(next);
        setPhase(state, Phase.DRAW_PHASE);

        PlayerDeck deck = state.player(next).getDeck();
        Optional<String> drawn = deck.getMainDeck().draw();
        drawn.ifPresent(deck.getHand()::add);

        long now = clock.millis();
        state.emit(EventType.TURN_SWITCH, EventData.of("currentPlayer", next, "turn", turn), now);
        state.emit(EventType.DRAW_PHASE_COMPLETE, EventData.of(
                "playerId", next,
                "cardDrawn", drawn.isPresent(),
                "handSize", deck.getHand().size(),
                "requiresAcknowledgment", true), now);
        log.info("Turn {} begins for {}", turn, next);
    }

    /**
     * The current player acknowledged their draw: resume the main phase, skipping the
     * turn or the phase when there is nothing left to place.
     */
    public void acknowledgeDraw(GameState state) {
        if (state.getPhase() != Phase.DRAW_PHASE) {
            return;
        }
        setPhase(state, Phase.MAIN_PHASE);

        if (isMainPhaseComplete(state)) {
            completeMainPhase(state);
            return;
        }
        String current = state.getCurrentPlayer();
        if (shouldSkip(state, current)) {
            String opponent = state.opponentOf(current);
            if (opponent == null || shouldSkip(state, opponent)) {
                log.info("Neither player can place a card, leaving the main phase");
                advanceToSpPhaseOrBattle(state);
            } else {
                log.info("{} has no placement, skipping turn {}", current, state.getCurrentTurn());
                startNewTurn(state);
            }
        }
    }

    /**
     * Turn and phase checks after a successful placement or resolved selection.
     */
    public void afterPlacement(GameState state, String playerId) {
        if (state.getPhase() == Phase.SP_PHASE) {
            checkSpPhaseComplete(state);
            return;
        }
        if (state.getPhase() != Phase.MAIN_PHASE) {
            return;
        }
        if (isMainPhaseComplete(state)) {
            completeMainPhase(state);
            return;
        }
        if (state.hasPendingSelection()) {
            log.debug("Turn switch waits for a pending selection");
            return;
        }
        PlayerState player = state.player(playerId);
        if (player.hasMovedInTurn(state.getCurrentTurn()) || shouldSkip(state, playerId)) {
            startNewTurn(state);
        }
    }

    /**
     * Pass: ends the turn in the main phase, or skips the SP zone in the SP phase.
     *
     * @throws GameRuleException if the phase does not allow passing, or the player must fill the SP zone
     */
    public void pass(GameState state, String playerId) throws GameRuleException {
        long now = clock.millis();
        PlayerState player = state.player(playerId);
        switch (state.getPhase()) {
            case MAIN_PHASE -> {
                player.recordTurnAction(new TurnAction(TurnAction.Type.PASS, state.getCurrentTurn(), null, null));
                state.emit(EventType.PLAYER_PASSED, EventData.of(
                        "playerId", playerId, "phase", Phase.MAIN_PHASE.name()), now);
                startNewTurn(state);
            }
            case SP_PHASE -> {
                boolean mustFill = player.getFieldEffects().specialStates().forcedSpPlay()
                        && !player.getDeck().getHand().isEmpty()
                        && state.zonesOf(playerId).isEmpty(ZoneName.SP);
                if (mustFill) {
                    throw new GameRuleException(ErrorType.PHASE_RESTRICTION_ERROR,
                            "A field effect forces you to place a card in the SP zone");
                }
                player.setSpPassed(true);
                state.emit(EventType.PLAYER_PASSED, EventData.of(
                        "playerId", playerId, "phase", Phase.SP_PHASE.name()), now);
                checkSpPhaseComplete(state);
            }
            default -> throw new GameRuleException(ErrorType.INVALID_PHASE,
                    "Cannot pass during " + state.getPhase());
        }
    }

    /**
     * Leave the main phase: open the SP phase if anyone can still fill an SP zone,
     * otherwise go straight to battle.
     */
    public void advanceToSpPhaseOrBattle(GameState state) {
        boolean anyNeedsSp = false;
        boolean spOnField = false;
        for (String playerId : state.playerIds()) {
            anyNeedsSp |= needsSpPlay(state, playerId);
            spOnField |= !state.zonesOf(playerId).isEmpty(ZoneName.SP);
        }
        if (!anyNeedsSp && !spOnField) {
            log.info("No SP plays possible, moving to battle");
            setPhase(state, Phase.BATTLE_PHASE);
            return;
        }
        setPhase(state, Phase.SP_PHASE);
        checkSpPhaseComplete(state);
    }

    private void completeMainPhase(GameState state) {
        state.emit(EventType.ALL_MAIN_ZONES_FILLED, EventData.of("turn", state.getCurrentTurn()), clock.millis());
        log.info("All main zones filled at turn {}", state.getCurrentTurn());
        advanceToSpPhaseOrBattle(state);
    }

    private void checkSpPhaseComplete(GameState state) {
        if (isSpPhaseComplete(state)) {
            state.emit(EventType.ALL_SP_ZONES_FILLED, EventData.of("round", state.getRound()), clock.millis());
            setPhase(state, Phase.BATTLE_PHASE);
        }
    }

    // ---- Queries ----

    /**
     * Every character zone and the help zone of both players hold a card.
     */
    public boolean isMainPhaseComplete(GameState state) {
        for (String playerId : state.playerIds()) {
            PlayerZones zones = state.zonesOf(playerId);
            if (!zones.allCharacterZonesOccupied() || zones.isEmpty(ZoneName.HELP)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Every player has filled their SP zone, has nothing left to place, or passed.
     */
    public boolean isSpPhaseComplete(GameState state) {
        for (String playerId : state.playerIds()) {
            PlayerState player = state.player(playerId);
            boolean done = !state.zonesOf(playerId).isEmpty(ZoneName.SP)
                    || player.getDeck().getHand().isEmpty()
                    || player.isSpPassed();
            if (!done) {
                return false;
            }
        }
        return true;
    }

    /**
     * The player has no placement available in the main phase: an empty hand, or every
     * character zone and the help zone filled.
     */
    public boolean shouldSkip(GameState state, String playerId) {
        if (state.player(playerId).getDeck().getHand().isEmpty()) {
            return true;
        }
        PlayerZones zones = state.zonesOf(playerId);
        return zones.allCharacterZonesOccupied() && !zones.isEmpty(ZoneName.HELP);
    }

    private static boolean needsSpPlay(GameState state, String playerId) {
        return !state.player(playerId).getDeck().getHand().isEmpty()
                && state.zonesOf(playerId).isEmpty(ZoneName.SP);
    }

    private void setPhase(GameState state, Phase phase) {
        Phase previous = state.getPhase();
        state.setPhase(phase);
        if (previous != phase) {
            state.emit(EventType.PHASE_CHANGE, EventData.of(
                    "from", previous == null ? null : previous.name(),
                    "to", phase.name()), clock.millis());
            log.info("Phase {} -> {}", previous, phase);
        }
    }
}
