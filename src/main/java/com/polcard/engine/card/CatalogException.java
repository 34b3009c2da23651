package com.polcard.engine.card;

/**
 * Exception thrown by Catalog operations.
 */
public class CatalogException extends Exception {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
