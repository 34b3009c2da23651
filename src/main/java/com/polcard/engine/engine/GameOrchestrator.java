package com.polcard.engine.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.polcard.engine.action.CardAction;
import com.polcard.engine.action.GameAction;
import com.polcard.engine.action.PlacementResult;
import com.polcard.engine.battle.BattleResolver;
import com.polcard.engine.card.Card;
import com.polcard.engine.card.Catalog;
import com.polcard.engine.card.TriggerEvent;
import com.polcard.engine.config.EngineConfig;
import com.polcard.engine.deck.Deck;
import com.polcard.engine.deck.DeckException;
import com.polcard.engine.deck.DeckRepository;
import com.polcard.engine.effect.EffectRegistry;
import com.polcard.engine.effect.EffectSimulator;
import com.polcard.engine.effect.TriggeredEffectExecutor;
import com.polcard.engine.event.EventData;
import com.polcard.engine.event.EventType;
import com.polcard.engine.event.GameEvent;
import com.polcard.engine.game.ErrorType;
import com.polcard.engine.game.GameRuleException;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.GameStateCodec;
import com.polcard.engine.game.PendingSelection;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.PlayerState;
import com.polcard.engine.game.RoomStatus;
import com.polcard.engine.game.ZoneName;
import com.polcard.engine.rng.GameRng;
import com.polcard.engine.selection.SelectionManager;
import com.polcard.engine.selection.SelectionResolution;
import com.polcard.engine.sequence.SequenceCorruptedException;
import com.polcard.engine.turn.TurnManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point of the engine. Runs room lifecycle calls and player actions against the
 * stored game, one call at a time per game.
 *
 * <p>Every call loads a fresh copy of the game from the {@link GameStore}, mutates it
 * and saves it only when the call succeeds. A rejected action leaves the stored game as
 * it was, apart from the ERROR_OCCURRED event recording the rejection.
 */
public class GameOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(GameOrchestrator.class);

    private static final int PLAYERS_PER_GAME = 2;

    private final Catalog catalog;
    private final DeckRepository decks;
    private final EngineConfig config;
    private final GameStore store;
    private final Clock clock;
    private final GameRng seeds;

    private final EffectSimulator simulator;
    private final SelectionManager selectionManager;
    private final TriggeredEffectExecutor executor;
    private final CardAction cardAction;
    private final TurnManager turnManager;
    private final BattleResolver battleResolver;
    private final GameSetup setup;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong gameCounter = new AtomicLong();

    public GameOrchestrator(Catalog catalog, DeckRepository decks, EngineConfig config, GameStore store,
                            Clock clock, GameRng seeds) {
        this.catalog = catalog;
        this.decks = decks;
        this.config = config;
        this.store = store;
        this.clock = clock;
        this.seeds = seeds;

        EffectRegistry registry = new EffectRegistry(catalog);
        this.simulator = new EffectSimulator(catalog, registry);
        this.selectionManager = new SelectionManager(catalog, config, clock);
        this.executor = new TriggeredEffectExecutor(catalog, registry, selectionManager, clock);
        this.cardAction = new CardAction(catalog, simulator, executor, selectionManager, clock);
        this.turnManager = new TurnManager(clock);
        this.battleResolver = new BattleResolver(catalog, simulator, executor, turnManager, config, clock);
        this.setup = new GameSetup(catalog, config, clock);
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public EffectSimulator getSimulator() {
        return simulator;
    }

    public CardAction getCardAction() {
        return cardAction;
    }

    public GameSetup getSetup() {
        return setup;
    }

    // ---- Room lifecycle ----

    /**
     * Open a room with its creator as the only player.
     */
    public ActionResult createGame(String playerId) {
        long now = clock.millis();
        String gameId = "game_" + now + "_" + gameCounter.incrementAndGet();
        GameState state = new GameState(gameId);
        synchronized (seeds) {
            state.setRngState(seeds.nextInt(Integer.MAX_VALUE));
        }
        state.getEvents().setTtlMillis(config.eventTtlMillis());
        state.addPlayer(new PlayerState(playerId, playerId));
        GameEvent created = state.emit(EventType.ROOM_CREATED,
                EventData.of("gameId", gameId, "playerId", playerId), now);
        store.save(state);
        log.info("Room {} created by {}", gameId, playerId);
        return ActionResult.success(state, List.of(created));
    }

    /**
     * Second player joins: both decks are dealt, leaders revealed and the first player chosen.
     */
    public ActionResult joinRoom(String gameId, String playerId) {
        return withGame(gameId, playerId, state -> {
            if (state.getRoomStatus() != RoomStatus.WAITING_FOR_PLAYERS || state.hasPlayer(playerId)
                    || state.getPlayers().size() >= PLAYERS_PER_GAME) {
                throw new GameRuleException(ErrorType.ROOM_NOT_AVAILABLE, "Room " + gameId + " is not available");
            }
            state.addPlayer(new PlayerState(playerId, playerId));
            state.setRoomStatus(RoomStatus.BOTH_JOINED);
            for (String id : state.playerIds()) {
                setup.seatPlayer(state, id, deckFor(id));
            }
            setup.chooseFirstPlayer(state);
            setup.recordMissingLeaders(state, true);
            simulator.apply(state);
            state.setPhase(Phase.START_REDRAW);
            state.setRoomStatus(RoomStatus.READY_PHASE);

            long now = clock.millis();
            Map<String, Object> leaders = new LinkedHashMap<>();
            for (String id : state.playerIds()) {
                leaders.put(id, state.zonesOf(id).getLeader());
            }
            state.emit(EventType.GAME_STARTED, EventData.of(
                    "players", state.playerIds(),
                    "firstPlayer", state.firstPlayerId(),
                    "leaderRevealed", leaders), now);
            for (String id : state.playerIds()) {
                state.emit(EventType.INITIAL_HAND_DEALT, EventData.of(
                        "playerId", id,
                        "handSize", state.player(id).getDeck().getHand().size()), now);
            }
            state.emit(EventType.PLAYER_JOINED, EventData.of("gameId", gameId, "playerId", playerId), now);
            log.info("{} joined {}", playerId, gameId);
        });
    }

    private Deck deckFor(String playerId) throws GameRuleException {
        try {
            return decks.activeDeck(playerId);
        } catch (DeckException e) {
            throw new GameRuleException(ErrorType.ROOM_NOT_AVAILABLE,
                    "Deck not available for " + playerId + ": " + e.getMessage(), e);
        }
    }

    /**
     * A player confirms their opening hand, optionally redrawing it once first.
     * The game starts when both players are ready.
     */
    public ActionResult startReady(String gameId, String playerId, boolean redraw) {
        return withGame(gameId, playerId, state -> {
            if (state.getRoomStatus() != RoomStatus.READY_PHASE) {
                throw new GameRuleException(ErrorType.INVALID_PHASE,
                        "Cannot get ready while the room is " + state.getRoomStatus());
            }
            PlayerState player = requirePlayer(state, playerId);
            if (player.isReady()) {
                throw new GameRuleException(ErrorType.INVALID_PHASE, "Player " + playerId + " is already ready");
            }
            long now = clock.millis();
            if (redraw) {
                if (player.getRedraw() >= config.maxRedraws()) {
                    throw new GameRuleException(ErrorType.INVALID_PHASE,
                            "Hand can be redrawn at most " + config.maxRedraws() + " time(s)");
                }
                setup.redraw(state, playerId);
                player.setRedraw(player.getRedraw() + 1);
                state.emit(EventType.HAND_REDRAWN, EventData.of(
                        "playerId", playerId,
                        "handSize", player.getDeck().getHand().size()), now);
            }
            player.setReady(true);
            state.emit(EventType.PLAYER_READY, EventData.of("playerId", playerId, "redraw", redraw), now);

            boolean allReady = state.getPlayers().size() == PLAYERS_PER_GAME
                    && state.getPlayers().values().stream().allMatch(PlayerState::isReady);
            if (allReady) {
                state.setRoomStatus(RoomStatus.IN_GAME);
                state.setGameStarted(true);
                turnManager.beginFirstTurn(state);
                log.info("Game {} started, {} goes first", gameId, state.firstPlayerId());
            }
        });
    }

    /**
     * Mark events as processed by a client. Acknowledging the player's own draw ends the
     * draw phase.
     */
    public ActionResult acknowledgeEvents(String gameId, String playerId, Collection<String> eventIds) {
        return withGame(gameId, playerId, state -> {
            requirePlayer(state, playerId);
            List<GameEvent> marked = state.getEvents().mark(eventIds);
            boolean ownDraw = marked.stream().anyMatch(e -> e.type() == EventType.DRAW_PHASE_COMPLETE
                    && playerId.equals(e.get("playerId")));
            if (ownDraw && state.getPhase() == Phase.DRAW_PHASE && playerId.equals(state.getCurrentPlayer())) {
                turnManager.acknowledgeDraw(state);
                settle(state);
            }
            int removed = state.getEvents().cleanExpired(clock.millis());
            log.debug("{} acknowledged {} events, {} expired events removed", playerId, marked.size(), removed);
        });
    }

    public Optional<GameState> getGameState(String gameId) {
        return store.load(gameId);
    }

    /**
     * Drop a game and its lock, typically once it has ended and every client has read the result.
     *
     * @return true if the game existed
     */
    public boolean evictGame(String gameId) {
        ReentrantLock lock = lockFor(gameId);
        lock.lock();
        try {
            boolean removed = store.delete(gameId);
            if (removed) {
                log.info("Game {} evicted", gameId);
            }
            return removed;
        } finally {
            forgetLock(gameId, lock);
            lock.unlock();
        }
    }

    int lockCount() {
        return locks.size();
    }

    /**
     * The game as one player may see it: the opponent's hand and face-down cards and both
     * decks are reduced to counts or hidden ids.
     */
    public Optional<JsonNode> getPlayerView(String gameId, String playerId) {
        return store.load(gameId).map(state -> {
            ObjectNode view = GameStateCodec.mapper().valueToTree(state);
            ObjectNode players = (ObjectNode) view.path("players");
            players.fields().forEachRemaining(entry -> {
                ObjectNode deck = (ObjectNode) entry.getValue().path("deck");
                deck.put("mainDeckCount", deck.path("mainDeck").size());
                deck.remove("mainDeck");
                if (!entry.getKey().equals(playerId)) {
                    deck.put("handCount", deck.path("hand").size());
                    deck.remove("hand");
                }
            });
            ObjectNode zones = (ObjectNode) view.path("zones");
            zones.fields().forEachRemaining(entry -> {
                if (entry.getKey().equals(playerId)) {
                    return;
                }
                for (ZoneName zone : ZoneName.FIELD_ZONES) {
                    JsonNode cards = entry.getValue().path(zone.getJsonValue());
                    if (cards instanceof ArrayNode array) {
                        array.forEach(card -> {
                            if (card.path("isFaceDown").asBoolean()) {
                                ((ObjectNode) card).putNull("cardId");
                            }
                        });
                    }
                }
            });
            return view;
        });
    }

    // ---- Actions ----

    /**
     * Parse an action envelope and run it.
     */
    public ActionResult handleAction(String gameId, String playerId, String actionJson) {
        GameAction action;
        try {
            action = GameAction.fromJson(actionJson);
        } catch (GameRuleException e) {
            return reject(gameId, playerId, e);
        }
        return handleAction(gameId, playerId, action);
    }

    public ActionResult handleAction(String gameId, String playerId, GameAction action) {
        return withGame(gameId, playerId, state -> {
            if (state.getPhase() == Phase.GAME_END) {
                throw new GameRuleException(ErrorType.GAME_ENDED, "Game has ended. Winner: " + state.getWinner());
            }
            requirePlayer(state, playerId);
            if (!state.isGameStarted()) {
                throw new GameRuleException(ErrorType.INVALID_PHASE, "Game has not started yet");
            }
            dispatch(state, playerId, action);
            settle(state);
        });
    }

    private void dispatch(GameState state, String playerId, GameAction action) throws GameRuleException {
        if (action instanceof GameAction.SelectCard select) {
            completeSelection(state, playerId, select);
            return;
        }
        selectionManager.requireNoPendingSelection(state, playerId);
        checkTurn(state, playerId);
        if (action instanceof GameAction.PlayCard play) {
            cardAction.play(state, playerId, play.fieldIdx(), play.cardIdx(), false);
            turnManager.afterPlacement(state, playerId);
        } else if (action instanceof GameAction.PlayCardBack play) {
            cardAction.play(state, playerId, play.fieldIdx(), play.cardIdx(), true);
            turnManager.afterPlacement(state, playerId);
        } else if (action instanceof GameAction.Pass) {
            turnManager.pass(state, playerId);
        } else {
            throw new GameRuleException(ErrorType.INVALID_ACTION_TYPE, "Invalid action type: " + action.typeName());
        }
    }

    private static void checkTurn(GameState state, String playerId) throws GameRuleException {
        Phase phase = state.getPhase();
        if (phase == Phase.DRAW_PHASE) {
            throw new GameRuleException(ErrorType.INVALID_PHASE, "Acknowledge the draw before acting");
        }
        if (!phase.isPlacementPhase()) {
            throw new GameRuleException(ErrorType.INVALID_PHASE, "Cannot act during " + phase);
        }
        if (phase == Phase.MAIN_PHASE && !playerId.equals(state.getCurrentPlayer())) {
            throw new GameRuleException(ErrorType.NOT_YOUR_TURN, "Not your turn");
        }
    }

    private void completeSelection(GameState state, String playerId, GameAction.SelectCard select)
            throws GameRuleException {
        SelectionResolution resolution = selectionManager.complete(state, playerId, select.selectionId(),
                select.selectedCardIds());
        simulator.apply(state);
        if (resolution.placedHelpCard()) {
            String helpCard = resolution.helpCardPlaced();
            boolean opened = executor.fire(state, playerId, helpCard, TriggerEvent.ON_PLAY, true);
            state.emit(EventType.CARD_EFFECT_TRIGGERED, EventData.of(
                    "playerId", playerId,
                    "cardId", helpCard,
                    "trigger", TriggerEvent.ON_PLAY.getJsonValue(),
                    "requiresSelection", opened), clock.millis());
            simulator.apply(state);
        }
        turnManager.afterPlacement(state, playerId);
    }

    /**
     * Reconcile derived state and run the battle once both SP zones are settled.
     */
    private void settle(GameState state) {
        simulator.apply(state);
        if (state.getPhase() == Phase.BATTLE_PHASE) {
            battleResolver.resolve(state);
        }
    }

    /**
     * Cancel selections that have been open longer than the configured timeout.
     *
     * @return the number of selections cancelled
     */
    public int expireSelections(String gameId) {
        ReentrantLock lock = lockFor(gameId);
        lock.lock();
        try {
            Optional<GameState> loaded = store.load(gameId);
            if (loaded.isEmpty()) {
                forgetLock(gameId, lock);
                return 0;
            }
            GameState state = loaded.get();
            if (state.isCorrupted()) {
                return 0;
            }
            try {
                int expired = expireSelections(state);
                if (expired > 0) {
                    store.save(state);
                }
                return expired;
            } catch (SequenceCorruptedException e) {
                markCorrupted(gameId, null, e);
                return 0;
            }
        } finally {
            lock.unlock();
        }
    }

    private int expireSelections(GameState state) {
        List<PendingSelection> expired = selectionManager.expire(state, clock.millis());
        for (PendingSelection selection : expired) {
            if (state.hasPlayer(selection.playerId())) {
                turnManager.afterPlacement(state, selection.playerId());
            }
        }
        if (!expired.isEmpty()) {
            settle(state);
        }
        return expired.size();
    }

    // ---- Legal moves ----

    /**
     * Actions the player could take right now, other than SelectCard. Every returned
     * action passes validation; the state is not changed.
     */
    public List<GameAction> legalActions(GameState state, String playerId) {
        List<GameAction> actions = new ArrayList<>();
        if (state.hasPendingSelection() || !state.hasPlayer(playerId)) {
            return actions;
        }
        try {
            checkTurn(state, playerId);
        } catch (GameRuleException e) {
            return actions;
        }
        int handSize = state.player(playerId).getDeck().getHand().size();
        List<ZoneName> zones = state.getPhase() == Phase.SP_PHASE ? List.of(ZoneName.SP) : ZoneName.FIELD_ZONES;
        for (int cardIdx = 0; cardIdx < handSize; cardIdx++) {
            for (ZoneName zone : zones) {
                for (boolean faceDown : new boolean[] {false, true}) {
                    if (isLegal(state, playerId, zone.getFieldIndex(), cardIdx, faceDown)) {
                        actions.add(faceDown
                                ? new GameAction.PlayCardBack(zone.getFieldIndex(), cardIdx)
                                : new GameAction.PlayCard(zone.getFieldIndex(), cardIdx));
                    }
                }
            }
        }
        boolean forced = state.getPhase() == Phase.SP_PHASE
                && state.player(playerId).getFieldEffects().specialStates().forcedSpPlay()
                && handSize > 0 && state.zonesOf(playerId).isEmpty(ZoneName.SP);
        boolean spDone = state.getPhase() == Phase.SP_PHASE
                && (state.player(playerId).isSpPassed() || !state.zonesOf(playerId).isEmpty(ZoneName.SP));
        if (!forced && !spDone) {
            actions.add(new GameAction.Pass());
        }
        return actions;
    }

    private boolean isLegal(GameState state, String playerId, int fieldIdx, int cardIdx, boolean faceDown) {
        try {
            Card card = cardAction.validate(state, playerId, fieldIdx, cardIdx, faceDown);
            return card != null;
        } catch (GameRuleException e) {
            return false;
        }
    }

    // ---- Test injection ----

    /**
     * Store a complete game state, recording any missing leader plays and reconciling
     * derived state first.
     *
     * @param gameId id to store under; the state's own id, or a new one, when null
     */
    public GameState injectGameState(String gameId, GameState state) {
        String id = gameId != null ? gameId : state.getGameId();
        if (id == null) {
            id = "game_" + clock.millis() + "_" + gameCounter.incrementAndGet();
        }
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            state.setGameId(id);
            int recorded = setup.recordMissingLeaders(state, true);
            simulator.apply(state);
            store.save(state);
            log.info("Injected game {} ({} leader plays recorded)", id, recorded);
            return state;
        } finally {
            lock.unlock();
        }
    }

    // ---- Plumbing ----

    @FunctionalInterface
    private interface GameMutation {
        void apply(GameState state) throws GameRuleException;
    }

    /**
     * Run a mutation against a fresh copy of the stored game under the game's lock.
     */
    private ActionResult withGame(String gameId, String playerId, GameMutation mutation) {
        ReentrantLock lock = lockFor(gameId);
        lock.lock();
        try {
            Optional<GameState> loaded = store.load(gameId);
            if (loaded.isEmpty()) {
                forgetLock(gameId, lock);
                return ActionResult.failure(ErrorType.GAME_NOT_FOUND, "Game not found: " + gameId);
            }
            GameState stored = loaded.get();
            if (stored.isCorrupted()) {
                return ActionResult.failure(ErrorType.SEQUENCE_CORRUPTED,
                        "Game " + gameId + " has a corrupted play sequence");
            }
            try {
                if (expireSelections(stored) > 0) {
                    store.save(stored);
                }
                GameState working = GameStateCodec.copy(stored);
                String lastEventId = working.getEvents().lastEventId();
                mutation.apply(working);
                store.save(working);
                return ActionResult.success(working, working.getEvents().after(lastEventId));
            } catch (GameRuleException e) {
                recordError(stored, playerId, e);
                return ActionResult.failure(e);
            } catch (SequenceCorruptedException e) {
                markCorrupted(gameId, playerId, e);
                return ActionResult.failure(ErrorType.SEQUENCE_CORRUPTED, e.getMessage());
            }
        } finally {
            lock.unlock();
        }
    }

    private ActionResult reject(String gameId, String playerId, GameRuleException e) {
        ReentrantLock lock = lockFor(gameId);
        lock.lock();
        try {
            Optional<GameState> loaded = store.load(gameId);
            if (loaded.isEmpty()) {
                forgetLock(gameId, lock);
                return ActionResult.failure(ErrorType.GAME_NOT_FOUND, "Game not found: " + gameId);
            }
            recordError(loaded.get(), playerId, e);
            return ActionResult.failure(e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flag the stored game, as last saved, so every later call is refused.
     */
    private void markCorrupted(String gameId, String playerId, SequenceCorruptedException e) {
        log.error("Game {} has a corrupted play sequence: {}", gameId, e.getMessage());
        store.load(gameId).ifPresent(stored -> {
            stored.setCorrupted(true);
            recordError(stored, playerId,
                    new GameRuleException(ErrorType.SEQUENCE_CORRUPTED, e.getMessage(), e));
        });
    }

    private void recordError(GameState stored, String playerId, GameRuleException e) {
        log.warn("Action by {} on {} rejected: {} {}", playerId, stored.getGameId(), e.getErrorType(), e.getMessage());
        stored.emit(EventType.ERROR_OCCURRED, EventData.of(
                "errorType", e.getErrorType().name(),
                "message", e.getMessage(),
                "playerId", playerId), clock.millis());
        store.save(stored);
    }

    private static PlayerState requirePlayer(GameState state, String playerId) throws GameRuleException {
        if (!state.hasPlayer(playerId)) {
            throw new GameRuleException(ErrorType.NOT_YOUR_TURN,
                    "Player " + playerId + " is not part of game " + state.getGameId());
        }
        return state.player(playerId);
    }

    private ReentrantLock lockFor(String gameId) {
        return locks.computeIfAbsent(lockKey(gameId), id -> new ReentrantLock());
    }

    // Only called while holding the lock; later callers get a fresh lock and find no game.
    private void forgetLock(String gameId, ReentrantLock lock) {
        locks.remove(lockKey(gameId), lock);
    }

    private static String lockKey(String gameId) {
        return gameId == null ? "" : gameId;
    }
}
