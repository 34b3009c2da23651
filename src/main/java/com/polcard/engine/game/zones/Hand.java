package com.polcard.engine.game.zones;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand - card ids in hand, in the order they were received.
 * Actions address hand cards by index.
 */
public class Hand {
    private final List<String> cards;

    public Hand() {
        this.cards = new ArrayList<>();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Hand(List<String> cardIds) {
        this.cards = new ArrayList<>(cardIds != null ? cardIds : List.of());
    }

    public void clear() {
        cards.clear();
    }

    public void add(String cardId) {
        cards.add(cardId);
    }

    public void addAll(List<String> cardIds) {
        cards.addAll(cardIds);
    }

    /**
     * Get the card id at an index.
     * @return The card id, or null if index is out of bounds
     */
    public String get(int index) {
        if (index >= 0 && index < cards.size()) {
            return cards.get(index);
        }
        return null;
    }

    /**
     * Remove a card by index.
     * @param index The index of the card to remove
     * @return The removed card id, or null if index is out of bounds
     */
    public String remove(int index) {
        if (index >= 0 && index < cards.size()) {
            return cards.remove(index);
        }
        return null;
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public boolean contains(String cardId) {
        return cards.contains(cardId);
    }

    /**
     * Get an unmodifiable copy of the card ids.
     */
    @JsonValue
    public List<String> getCards() {
        return List.copyOf(cards);
    }
}
