package com.tcg.pocket.effect;

/**
 * Card zones reachable by {@link Effect.MoveCards}. {@link #BENCH} is only a
 * destination: basic Pokémon moved there are put into empty bench slots.
 */
public enum Zone {
    DECK,
    HAND,
    DISCARD,
    BENCH
}
