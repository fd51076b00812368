package com.tcg.pocket.card;

/**
 * Exception thrown by CardDatabase loading and lookups.
 */
public class CardDatabaseException extends Exception {
    public CardDatabaseException(String message) {
        super(message);
    }

    public CardDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
