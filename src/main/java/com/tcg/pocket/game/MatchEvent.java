package com.tcg.pocket.game;

/**
 * Entry of the per-match event log.
 *
 * @param type   what happened
 * @param turn   turn number at the time
 * @param player player the event concerns (owner of the knocked-out Pokémon, scorer of points,
 *               controller of the fizzled effect)
 * @param amount points for prize events, otherwise zero
 * @param detail human-readable detail for logs
 */
public record MatchEvent(Type type, int turn, int player, int amount, String detail) {

    public enum Type {
        KNOCKOUT,
        PRIZE_AWARDED,
        EFFECT_FIZZLED,
        DECK_OUT,
        MATCH_ENDED
    }
}
