package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A player's field: the active leader id and the five placement zones.
 */
public class PlayerZones {
    @JsonProperty("leader")
    private String leader;

    @JsonProperty("top")
    private List<PlacedCard> top = new ArrayList<>();

    @JsonProperty("left")
    private List<PlacedCard> left = new ArrayList<>();

    @JsonProperty("right")
    private List<PlacedCard> right = new ArrayList<>();

    @JsonProperty("help")
    private List<PlacedCard> help = new ArrayList<>();

    @JsonProperty("sp")
    private List<PlacedCard> sp = new ArrayList<>();

    public String getLeader() {
        return leader;
    }

    public void setLeader(String leader) {
        this.leader = leader;
    }

    public List<PlacedCard> getTop() {
        return top;
    }

    public List<PlacedCard> getLeft() {
        return left;
    }

    public List<PlacedCard> getRight() {
        return right;
    }

    public List<PlacedCard> getHelp() {
        return help;
    }

    public List<PlacedCard> getSp() {
        return sp;
    }

    public void setTop(List<PlacedCard> top) {
        this.top = top != null ? new ArrayList<>(top) : new ArrayList<>();
    }

    public void setLeft(List<PlacedCard> left) {
        this.left = left != null ? new ArrayList<>(left) : new ArrayList<>();
    }

    public void setRight(List<PlacedCard> right) {
        this.right = right != null ? new ArrayList<>(right) : new ArrayList<>();
    }

    public void setHelp(List<PlacedCard> help) {
        this.help = help != null ? new ArrayList<>(help) : new ArrayList<>();
    }

    public void setSp(List<PlacedCard> sp) {
        this.sp = sp != null ? new ArrayList<>(sp) : new ArrayList<>();
    }

    /**
     * Mutable card list of a placement zone.
     */
    public List<PlacedCard> cardsIn(ZoneName zone) {
        return switch (zone) {
            case TOP -> top;
            case LEFT -> left;
            case RIGHT -> right;
            case HELP -> help;
            case SP -> sp;
            case LEADER -> throw new IllegalArgumentException("Leader zone holds no placed cards");
        };
    }

    public boolean isEmpty(ZoneName zone) {
        return cardsIn(zone).isEmpty();
    }

    /**
     * The face-up character in a character zone, if any.
     */
    public Optional<PlacedCard> faceUpIn(ZoneName zone) {
        return cardsIn(zone).stream().filter(c -> !c.faceDown()).findFirst();
    }

    /**
     * Locate a placed card by id across the five zones.
     */
    public Optional<ZoneName> zoneOf(String cardId) {
        for (ZoneName zone : ZoneName.FIELD_ZONES) {
            for (PlacedCard card : cardsIn(zone)) {
                if (card.cardId().equals(cardId)) {
                    return Optional.of(zone);
                }
            }
        }
        return Optional.empty();
    }

    public boolean allCharacterZonesOccupied() {
        return !top.isEmpty() && !left.isEmpty() && !right.isEmpty();
    }

    public void clearCharacterZones() {
        top.clear();
        left.clear();
        right.clear();
    }
}
