package com.tcg.pocket.effect;

/**
 * How {@link Effect.MoveCards} picks among matching cards.
 */
public enum Selection {
    /** First matching cards in zone order (top of deck, oldest in hand, most recent discard). */
    FIRST,
    /** Uniformly random among matches, one rng draw per card taken. */
    RANDOM,
    /** The controller picks a card of their own hand. */
    CHOSEN
}
