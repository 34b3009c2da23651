package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-player game data. Field placement lives in {@link PlayerZones}.
 */
public class PlayerState {
    @JsonProperty("id")
    private String playerId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("deck")
    private PlayerDeck deck = new PlayerDeck();

    @JsonProperty("fieldEffects")
    private FieldEffects fieldEffects = FieldEffects.defaults();

    @JsonProperty("turnAction")
    private List<TurnAction> turnActions = new ArrayList<>();

    @JsonProperty("redraw")
    private int redraw;

    @JsonProperty("ready")
    private boolean ready;

    @JsonProperty("spPassed")
    private boolean spPassed;

    @JsonProperty("playerPoint")
    private int playerPoint;

    @JsonProperty("victoryPoints")
    private int victoryPoints;

    public PlayerState() {
    }

    public PlayerState(String playerId, String name) {
        this.playerId = playerId;
        this.name = name;
    }

    public String getPlayerId() {
        return playerId;
    }

    public void setPlayerId(String playerId) {
        this.playerId = playerId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public PlayerDeck getDeck() {
        return deck;
    }

    public void setDeck(PlayerDeck deck) {
        this.deck = deck != null ? deck : new PlayerDeck();
    }

    public FieldEffects getFieldEffects() {
        return fieldEffects;
    }

    public void setFieldEffects(FieldEffects fieldEffects) {
        this.fieldEffects = fieldEffects != null ? fieldEffects : FieldEffects.defaults();
    }

    public List<TurnAction> getTurnActions() {
        return turnActions;
    }

    public void setTurnActions(List<TurnAction> turnActions) {
        this.turnActions = turnActions != null ? new ArrayList<>(turnActions) : new ArrayList<>();
    }

    public void recordTurnAction(TurnAction action) {
        turnActions.add(action);
    }

    /**
     * Check whether the player has already made a move in the given turn.
     */
    public boolean hasMovedInTurn(double turn) {
        return turnActions.stream()
                .anyMatch(a -> a.turn() == turn && a.type().countsAsMove());
    }

    public int getRedraw() {
        return redraw;
    }

    public void setRedraw(int redraw) {
        this.redraw = redraw;
    }

    public boolean isReady() {
        return ready;
    }

    public void setReady(boolean ready) {
        this.ready = ready;
    }

    public boolean isSpPassed() {
        return spPassed;
    }

    public void setSpPassed(boolean spPassed) {
        this.spPassed = spPassed;
    }

    public int getPlayerPoint() {
        return playerPoint;
    }

    public void setPlayerPoint(int playerPoint) {
        this.playerPoint = playerPoint;
    }

    public int getVictoryPoints() {
        return victoryPoints;
    }

    public void setVictoryPoints(int victoryPoints) {
        this.victoryPoints = victoryPoints;
    }
}
