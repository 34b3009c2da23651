package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.polcard.engine.game.zones.Hand;
import com.polcard.engine.game.zones.Library;

import java.util.ArrayList;
import java.util.List;

/**
 * A player's cards outside the field: leader list, main deck and hand.
 */
public class PlayerDeck {
    @JsonProperty("leader")
    private List<String> leaders = new ArrayList<>();

    @JsonProperty("currentLeaderIdx")
    private int currentLeaderIdx;

    @JsonProperty("mainDeck")
    private Library mainDeck = new Library();

    @JsonProperty("hand")
    private Hand hand = new Hand();

    public PlayerDeck() {
    }

    public PlayerDeck(List<String> leaders, List<String> mainDeck, List<String> hand) {
        this.leaders = new ArrayList<>(leaders);
        this.mainDeck = new Library(mainDeck);
        this.hand = new Hand(hand);
    }

    public List<String> getLeaders() {
        return leaders;
    }

    public void setLeaders(List<String> leaders) {
        this.leaders = leaders != null ? leaders : new ArrayList<>();
    }

    public int getCurrentLeaderIdx() {
        return currentLeaderIdx;
    }

    public void setCurrentLeaderIdx(int currentLeaderIdx) {
        this.currentLeaderIdx = currentLeaderIdx;
    }

    public Library getMainDeck() {
        return mainDeck;
    }

    public void setMainDeck(Library mainDeck) {
        this.mainDeck = mainDeck != null ? mainDeck : new Library();
    }

    public Hand getHand() {
        return hand;
    }

    public void setHand(Hand hand) {
        this.hand = hand != null ? hand : new Hand();
    }

    /**
     * @return the active leader id, or null if the index is past the list
     */
    public String currentLeaderId() {
        if (currentLeaderIdx >= 0 && currentLeaderIdx < leaders.size()) {
            return leaders.get(currentLeaderIdx);
        }
        return null;
    }

    @JsonIgnore
    public boolean isOnLastLeader() {
        return currentLeaderIdx >= leaders.size() - 1;
    }
}
