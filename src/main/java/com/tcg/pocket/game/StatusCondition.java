package com.tcg.pocket.game;

/**
 * Special conditions a Pokémon can have while in the active spot.
 * Benching a Pokémon (retreat, switch) removes all of them.
 */
public enum StatusCondition {
    POISONED,
    BURNED,
    ASLEEP,
    PARALYZED,
    CONFUSED;

    /**
     * Asleep and paralyzed block attacking and retreating.
     */
    public boolean blocksAction() {
        return this == ASLEEP || this == PARALYZED;
    }
}
