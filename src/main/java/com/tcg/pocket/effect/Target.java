package com.tcg.pocket.effect;

/**
 * Target selector of an effect, relative to the controlling player.
 * The {@code CHOOSE_*} selectors suspend resolution until the controller picks
 * one of the valid board slots.
 */
public enum Target {
    /** The Pokémon whose attack, ability or tool is resolving (own active for trainers). */
    SELF(Side.OWN, false),
    OWN_ACTIVE(Side.OWN, false),
    OPPONENT_ACTIVE(Side.OPPONENT, false),
    OWN_BENCH(Side.OWN, false),
    OPPONENT_BENCH(Side.OPPONENT, false),
    ALL_OWN(Side.OWN, false),
    ALL_OPPONENT(Side.OPPONENT, false),
    CHOOSE_OWN(Side.OWN, true),
    CHOOSE_OWN_BENCH(Side.OWN, true),
    CHOOSE_OPPONENT(Side.OPPONENT, true),
    CHOOSE_OPPONENT_BENCH(Side.OPPONENT, true);

    private final Side side;
    private final boolean chosen;

    Target(Side side, boolean chosen) {
        this.side = side;
        this.chosen = chosen;
    }

    public Side getSide() {
        return side;
    }

    public boolean isChosen() {
        return chosen;
    }

    /**
     * Whether the selector can name exactly one Pokémon.
     */
    public boolean isSingle() {
        return this == SELF || this == OWN_ACTIVE || this == OPPONENT_ACTIVE || chosen;
    }

    public boolean benchOnly() {
        return this == OWN_BENCH || this == OPPONENT_BENCH
            || this == CHOOSE_OWN_BENCH || this == CHOOSE_OPPONENT_BENCH;
    }
}
