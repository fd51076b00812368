package com.tcg.pocket.effect;

/**
 * Quantities a {@link Effect.Scaled} effect can repeat by.
 */
public enum CounterKind {
    /** Heads among {@code flips} coins. */
    COIN_HEADS,
    /** Heads before the first tails. */
    HEADS_UNTIL_TAILS,
    /** Energy attached to the target, optionally of one type. */
    ENERGY_ATTACHED,
    /** Occupied bench slots on a side. */
    BENCH_SIZE,
    /** Damage counters (10 damage each) on the target. */
    DAMAGE_COUNTERS,
    /** Cards in a side's hand. */
    HAND_SIZE
}
