package com.polcard.engine.game.zones;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.polcard.engine.rng.GameRng;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Main deck - ordered stack of card ids. Top of the deck is at index 0.
 * Serialized as a plain JSON array.
 *
 * Uses ArrayDeque internally for O(1) operations at both ends:
 * - draw() / removeFirst() is O(1)
 * - putOnBottom() / addLast() is O(1)
 */
public class Library {
    private final Deque<String> cards;

    public Library() {
        this.cards = new ArrayDeque<>();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Library(List<String> cardIds) {
        this.cards = new ArrayDeque<>(cardIds != null ? cardIds : List.of());
    }

    public void clear() {
        cards.clear();
    }

    public void addCard(String cardId) {
        cards.addLast(cardId);
    }

    public Optional<String> peekTop() {
        return Optional.ofNullable(cards.peekFirst());
    }

    /**
     * Draw a card from the top of the deck.
     * @return The drawn card id, or empty if the deck is empty
     */
    public Optional<String> draw() {
        return Optional.ofNullable(cards.pollFirst());
    }

    /**
     * Draw multiple cards from the deck.
     * @param n Number of cards to draw
     * @return Drawn card ids (fewer if the deck runs out)
     */
    public List<String> drawN(int n) {
        List<String> drawn = new ArrayList<>(Math.max(n, 0));
        for (int i = 0; i < n && !cards.isEmpty(); i++) {
            drawn.add(cards.removeFirst());
        }
        return drawn;
    }

    /**
     * Put cards on the bottom of the deck, keeping their order.
     */
    public void putOnBottom(Collection<String> cardIds) {
        cards.addAll(cardIds);
    }

    /**
     * Remove the first occurrence of a card id.
     * @return true if it was in the deck
     */
    public boolean remove(String cardId) {
        return cards.removeFirstOccurrence(cardId);
    }

    public void shuffle(GameRng rng) {
        List<String> list = new ArrayList<>(cards);
        rng.shuffle(list);
        cards.clear();
        cards.addAll(list);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    @JsonValue
    public List<String> toList() {
        return new ArrayList<>(cards);
    }
}
