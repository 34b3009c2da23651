package com.polcard.engine.deck;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A deck as stored in the deck file: main-deck card ids plus the ordered leader list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Deck {
    public static final int DEFAULT_MIN_CARDS = 20;
    public static final int DEFAULT_MAX_CARDS = 30;

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name = "";

    @JsonProperty("cards")
    private List<String> cards = new ArrayList<>();

    @JsonProperty("leader")
    private List<String> leader = new ArrayList<>();

    @JsonProperty("maxCards")
    private int maxCards = DEFAULT_MAX_CARDS;

    @JsonProperty("minCards")
    private int minCards = DEFAULT_MIN_CARDS;

    public Deck() {
    }

    public Deck(String id, String name, List<String> cards, List<String> leader) {
        this.id = id;
        this.name = name;
        setCards(cards);
        setLeader(leader);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null ? name : "";
    }

    public List<String> getCards() {
        return cards;
    }

    public void setCards(List<String> cards) {
        this.cards = cards != null ? new ArrayList<>(cards) : new ArrayList<>();
    }

    public List<String> getLeader() {
        return leader;
    }

    public void setLeader(List<String> leader) {
        this.leader = leader != null ? new ArrayList<>(leader) : new ArrayList<>();
    }

    public int getMaxCards() {
        return maxCards;
    }

    public void setMaxCards(int maxCards) {
        this.maxCards = maxCards > 0 ? maxCards : DEFAULT_MAX_CARDS;
    }

    public int getMinCards() {
        return minCards;
    }

    public void setMinCards(int minCards) {
        this.minCards = minCards > 0 ? minCards : DEFAULT_MIN_CARDS;
    }

    /**
     * Check the deck's structure.
     *
     * @return every problem found, empty when the deck is valid
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (id == null || id.isEmpty()) {
            errors.add("Deck ID is required");
        }
        if (name == null || name.isEmpty()) {
            errors.add("Deck name is required");
        }
        if (cards.size() < minCards) {
            errors.add("Deck must have at least " + minCards + " cards, has " + cards.size());
        }
        if (cards.size() > maxCards) {
            errors.add("Deck cannot have more than " + maxCards + " cards, has " + cards.size());
        }
        if (leader.isEmpty()) {
            errors.add("Deck must have at least one leader card");
        }
        Set<String> duplicateCards = duplicates(cards);
        if (!duplicateCards.isEmpty()) {
            errors.add("Duplicate cards found: " + String.join(", ", duplicateCards));
        }
        Set<String> duplicateLeaders = duplicates(leader);
        if (!duplicateLeaders.isEmpty()) {
            errors.add("Duplicate leaders found: " + String.join(", ", duplicateLeaders));
        }
        return errors;
    }

    @JsonIgnore
    public boolean isValid() {
        return validate().isEmpty();
    }

    private static Set<String> duplicates(List<String> items) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String item : items) {
            if (!seen.add(item)) {
                duplicates.add(item);
            }
        }
        return duplicates;
    }

    /**
     * Card counts by id prefix: c- characters, h- help, sp- special.
     */
    public DeckStats stats() {
        Map<String, Integer> types = new LinkedHashMap<>();
        types.put("character", 0);
        types.put("help", 0);
        types.put("special", 0);
        for (String cardId : cards) {
            if (cardId.startsWith("c-")) {
                types.merge("character", 1, Integer::sum);
            } else if (cardId.startsWith("h-")) {
                types.merge("help", 1, Integer::sum);
            } else if (cardId.startsWith("sp-")) {
                types.merge("special", 1, Integer::sum);
            }
        }
        return new DeckStats(id, name, cards.size(), leader.size(), types);
    }

    /**
     * Deep copy; the card and leader lists are not shared with this deck.
     */
    public Deck copy() {
        Deck copy = new Deck(id, name, cards, leader);
        copy.setMaxCards(maxCards);
        copy.setMinCards(minCards);
        return copy;
    }

    public record DeckStats(String id, String name, int totalCards, int totalLeaders, Map<String, Integer> cardTypes) {
    }
}
