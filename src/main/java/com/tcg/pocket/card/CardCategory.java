package com.tcg.pocket.card;

/**
 * Rules category of a card definition.
 */
public enum CardCategory {
    BASIC,
    EVOLUTION,
    ITEM,
    SUPPORTER,
    TOOL;

    public boolean isPokemon() {
        return this == BASIC || this == EVOLUTION;
    }

    public boolean isTrainer() {
        return !isPokemon();
    }
}
