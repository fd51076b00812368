package com.tcg.pocket.simulation;

/**
 * Thrown when a deck list cannot be used for a match. The caller can fix
 * the deck and try again.
 */
public class InvalidDeckException extends Exception {

    public enum Reason {
        MALFORMED,
        UNKNOWN_CARD,
        WRONG_SIZE,
        TOO_MANY_COPIES,
        NO_BASIC,
        BROKEN_EVOLUTION
    }

    private final Reason reason;

    public InvalidDeckException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidDeckException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
