package com.polcard.engine.deck;

/**
 * Exception thrown when a deck file cannot be read or a deck cannot be resolved.
 */
public class DeckException extends Exception {
    public DeckException(String message) {
        super(message);
    }

    public DeckException(String message, Throwable cause) {
        super(message, cause);
    }
}
