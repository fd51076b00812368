package com.tcg.pocket.effect;

/**
 * Which player an effect reaches, relative to the player who controls it.
 */
public enum Side {
    OWN,
    OPPONENT;

    public int resolve(int controller) {
        return this == OWN ? controller : 1 - controller;
    }
}
