package com.tcg.pocket.card;

/**
 * A card id that is not in the database.
 */
public class UnknownCardException extends CardDatabaseException {
    private final String cardId;

    public UnknownCardException(String cardId) {
        super("Unknown card: " + cardId);
        this.cardId = cardId;
    }

    public String getCardId() {
        return cardId;
    }
}
