package com.polcard.engine.deck;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A player's deck collection and the id of the deck they play with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlayerDecks {
    @JsonProperty("activeDeck")
    private String activeDeck;

    @JsonProperty("decks")
    private Map<String, Deck> decks = new LinkedHashMap<>();

    public String getActiveDeck() {
        return activeDeck;
    }

    public void setActiveDeck(String activeDeck) {
        this.activeDeck = activeDeck;
    }

    public Map<String, Deck> getDecks() {
        return decks;
    }

    public void setDecks(Map<String, Deck> decks) {
        this.decks = decks != null ? new LinkedHashMap<>(decks) : new LinkedHashMap<>();
    }

    public Optional<Deck> activeDeck() {
        return activeDeck == null ? Optional.empty() : Optional.ofNullable(decks.get(activeDeck));
    }

    /**
     * Switch the active deck.
     * @return false if the collection has no deck with that id
     */
    public boolean activate(String deckId) {
        if (!decks.containsKey(deckId)) {
            return false;
        }
        activeDeck = deckId;
        return true;
    }

    /**
     * Add a deck, making it active if it is the first one.
     */
    public void addDeck(Deck deck) {
        if (deck.getId() == null) {
            throw new IllegalArgumentException("Deck must have an ID to be added to collection");
        }
        decks.put(deck.getId(), deck);
        if (activeDeck == null) {
            activeDeck = deck.getId();
        }
    }
}
