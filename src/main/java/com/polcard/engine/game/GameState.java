package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.polcard.engine.event.EventStream;
import com.polcard.engine.event.EventType;
import com.polcard.engine.event.GameEvent;
import com.polcard.engine.rng.GameRng;
import com.polcard.engine.sequence.PlaySequence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete state of one game. Players and their zones are keyed by player id in
 * join order; {@code firstPlayer} indexes into that order.
 */
public class GameState {
    public static final String DRAW = "draw";

    @JsonProperty("gameId")
    private String gameId;

    @JsonProperty("roomStatus")
    private RoomStatus roomStatus = RoomStatus.WAITING_FOR_PLAYERS;

    @JsonProperty("gameStarted")
    private boolean gameStarted;

    @JsonProperty("phase")
    private Phase phase = Phase.START_REDRAW;

    @JsonProperty("currentTurn")
    private double currentTurn;

    @JsonProperty("currentPlayer")
    private String currentPlayer;

    @JsonProperty("firstPlayer")
    private int firstPlayer;

    @JsonProperty("round")
    private int round = 1;

    @JsonProperty("players")
    private Map<String, PlayerState> players = new LinkedHashMap<>();

    @JsonProperty("zones")
    private Map<String, PlayerZones> zones = new LinkedHashMap<>();

    @JsonProperty("playSequence")
    private PlaySequence playSequence = new PlaySequence();

    @JsonProperty("pendingPlayerAction")
    private PendingPlayerAction pendingPlayerAction;

    @JsonProperty("pendingCardSelections")
    private Map<String, PendingSelection> pendingCardSelections = new LinkedHashMap<>();

    @JsonProperty("events")
    private EventStream events = new EventStream();

    @JsonProperty("winner")
    private String winner;

    @JsonProperty("neutralizationHistory")
    private List<NeutralizationRecord> neutralizationHistory = new ArrayList<>();

    @JsonProperty("rngState")
    private long rngState;

    @JsonProperty("corrupted")
    private boolean corrupted;

    @JsonProperty("lastUpdate")
    private long lastUpdate;

    @JsonIgnore
    private GameRng rng;

    public GameState() {
    }

    public GameState(String gameId) {
        this.gameId = gameId;
    }

    // ---- Room and phase ----
    public String getGameId() {
        return gameId;
    }

    public void setGameId(String gameId) {
        this.gameId = gameId;
    }

    public RoomStatus getRoomStatus() {
        return roomStatus;
    }

    public void setRoomStatus(RoomStatus roomStatus) {
        this.roomStatus = roomStatus;
    }

    public boolean isGameStarted() {
        return gameStarted;
    }

    public void setGameStarted(boolean gameStarted) {
        this.gameStarted = gameStarted;
    }

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }

    public double getCurrentTurn() {
        return currentTurn;
    }

    public void setCurrentTurn(double currentTurn) {
        this.currentTurn = currentTurn;
    }

    public String getCurrentPlayer() {
        return currentPlayer;
    }

    public void setCurrentPlayer(String currentPlayer) {
        this.currentPlayer = currentPlayer;
    }

    public int getFirstPlayer() {
        return firstPlayer;
    }

    public void setFirstPlayer(int firstPlayer) {
        this.firstPlayer = firstPlayer;
    }

    public int getRound() {
        return round;
    }

    public void setRound(int round) {
        this.round = round;
    }

    public String getWinner() {
        return winner;
    }

    public void setWinner(String winner) {
        this.winner = winner;
    }

    public boolean isCorrupted() {
        return corrupted;
    }

    public void setCorrupted(boolean corrupted) {
        this.corrupted = corrupted;
    }

    public long getLastUpdate() {
        return lastUpdate;
    }

    public void setLastUpdate(long lastUpdate) {
        this.lastUpdate = lastUpdate;
    }

    // ---- Players ----
    public Map<String, PlayerState> getPlayers() {
        return players;
    }

    public void setPlayers(Map<String, PlayerState> players) {
        this.players = players != null ? new LinkedHashMap<>(players) : new LinkedHashMap<>();
    }

    public Map<String, PlayerZones> getZones() {
        return zones;
    }

    public void setZones(Map<String, PlayerZones> zones) {
        this.zones = zones != null ? new LinkedHashMap<>(zones) : new LinkedHashMap<>();
    }

    /**
     * Add a player with empty zones, keeping join order.
     */
    public void addPlayer(PlayerState player) {
        players.put(player.getPlayerId(), player);
        zones.putIfAbsent(player.getPlayerId(), new PlayerZones());
    }

    public List<String> playerIds() {
        return new ArrayList<>(players.keySet());
    }

    public PlayerState player(String playerId) {
        PlayerState player = players.get(playerId);
        if (player == null) {
            throw new IllegalArgumentException("Unknown player: " + playerId);
        }
        return player;
    }

    public PlayerZones zonesOf(String playerId) {
        return zones.computeIfAbsent(playerId, id -> new PlayerZones());
    }

    public boolean hasPlayer(String playerId) {
        return playerId != null && players.containsKey(playerId);
    }

    /**
     * The other player, or null while the room holds a single player.
     */
    public String opponentOf(String playerId) {
        for (String id : players.keySet()) {
            if (!id.equals(playerId)) {
                return id;
            }
        }
        return null;
    }

    public String firstPlayerId() {
        List<String> ids = playerIds();
        return ids.isEmpty() ? null : ids.get(Math.min(firstPlayer, ids.size() - 1));
    }

    public boolean isFirstPlayer(String playerId) {
        return playerId != null && playerId.equals(firstPlayerId());
    }

    /**
     * Player ids with the first player leading.
     */
    public List<String> playersInTurnOrder() {
        List<String> ordered = new ArrayList<>();
        String first = firstPlayerId();
        if (first != null) {
            ordered.add(first);
        }
        for (String id : players.keySet()) {
            if (!id.equals(first)) {
                ordered.add(id);
            }
        }
        return ordered;
    }

    // ---- Play sequence and selections ----
    public PlaySequence getPlaySequence() {
        return playSequence;
    }

    public void setPlaySequence(PlaySequence playSequence) {
        this.playSequence = playSequence != null ? playSequence : new PlaySequence();
    }

    public PendingPlayerAction getPendingPlayerAction() {
        return pendingPlayerAction;
    }

    public void setPendingPlayerAction(PendingPlayerAction pendingPlayerAction) {
        this.pendingPlayerAction = pendingPlayerAction;
    }

    public boolean hasPendingSelection() {
        return pendingPlayerAction != null;
    }

    public Map<String, PendingSelection> getPendingCardSelections() {
        return pendingCardSelections;
    }

    public void setPendingCardSelections(Map<String, PendingSelection> pendingCardSelections) {
        this.pendingCardSelections = pendingCardSelections != null
                ? new LinkedHashMap<>(pendingCardSelections) : new LinkedHashMap<>();
    }

    public List<NeutralizationRecord> getNeutralizationHistory() {
        return neutralizationHistory;
    }

    public void setNeutralizationHistory(List<NeutralizationRecord> neutralizationHistory) {
        this.neutralizationHistory = neutralizationHistory != null
                ? new ArrayList<>(neutralizationHistory) : new ArrayList<>();
    }

    // ---- Events ----
    public EventStream getEvents() {
        return events;
    }

    public void setEvents(EventStream events) {
        this.events = events != null ? events : new EventStream();
    }

    public GameEvent emit(EventType type, Map<String, Object> data, long timestamp) {
        lastUpdate = timestamp;
        return events.append(type, data, timestamp);
    }

    // ---- RNG ----

    /**
     * The game's generator, resumed from the persisted state on first use.
     */
    public GameRng rng() {
        if (rng == null) {
            rng = GameRng.fromState(rngState);
        }
        return rng;
    }

    public long getRngState() {
        return rng != null ? rng.getState() : rngState;
    }

    public void setRngState(long rngState) {
        this.rngState = rngState;
        this.rng = null;
    }
}
