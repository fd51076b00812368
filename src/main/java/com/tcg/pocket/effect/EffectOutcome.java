package com.tcg.pocket.effect;

/**
 * Result of resolving one effect frame.
 */
public enum EffectOutcome {
    /** The effect changed the state or scheduled its children. */
    APPLIED,
    /** Preconditions were not met; nothing changed. Not an error. */
    FIZZLED,
    /** Resolution waits for a player choice recorded in the match's pending choice. */
    SUSPENDED
}
