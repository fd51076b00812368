package com.tcg.pocket.effect;

/**
 * Board predicates for {@link Effect.Conditional}.
 */
public enum ConditionKind {
    /** The target has damage on it. */
    DAMAGED,
    /** The target has {@code status}. */
    HAS_STATUS,
    /** The target is a Pokémon ex. */
    IS_EX,
    /** The target has a tool attached. */
    HAS_TOOL,
    /** The target has at least {@code amount} energy (of {@code energy}, if set). */
    ENERGY_AT_LEAST,
    /** The side has at least {@code amount} benched Pokémon. */
    BENCH_AT_LEAST
}
