package com.tcg.pocket.game;

/**
 * Match phases. A step only ever stops in {@link #SETUP}, {@link #MAIN},
 * {@link #TERMINAL}, or in another phase while a pending choice waits for input.
 */
public enum Phase {
    SETUP,
    START_OF_TURN,
    ENERGY_GENERATION,
    MAIN,
    ATTACK,
    EFFECT_RESOLUTION,
    KNOCKOUT_CHECK,
    END_OF_TURN,
    TERMINAL;
}
