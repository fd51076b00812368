package com.tcg.pocket.effect;

/**
 * When a temporary modifier stops applying, relative to the controller of the
 * effect that created it. Converted to an absolute turn number on creation.
 */
public enum Expiry {
    THIS_TURN,
    OPPONENT_NEXT_TURN,
    OWN_NEXT_TURN
}
