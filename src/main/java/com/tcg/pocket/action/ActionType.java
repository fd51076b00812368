package com.tcg.pocket.action;

/**
 * Action families of the fixed action space. Each family owns a contiguous
 * block of indices starting at {@link #getBase()}.
 */
public enum ActionType {
    PLACE_ACTIVE(0, 10),
    PLACE_BENCH(10, 10),
    CONFIRM_SETUP(20, 1),
    PLAY_BASIC(21, 10),
    EVOLVE(31, 40),
    ATTACH_ENERGY(71, 4),
    RETREAT(75, 3),
    USE_ABILITY(78, 4),
    PLAY_TRAINER(82, 10),
    ATTACK(92, 3),
    END_TURN(95, 1),
    CHOOSE_OWN_TARGET(96, 4),
    CHOOSE_OPPONENT_TARGET(100, 4),
    PROMOTE(104, 3),
    CHOOSE_HAND_CARD(107, 10),
    ATTACH_TOOL(117, 40);

    private final int base;
    private final int size;

    ActionType(int base, int size) {
        this.base = base;
        this.size = size;
    }

    public int getBase() {
        return base;
    }

    public int getSize() {
        return size;
    }

    /**
     * First index after this family.
     */
    public int getEnd() {
        return base + size;
    }

    public boolean contains(int index) {
        return index >= base && index < base + size;
    }

    /**
     * Check if this family answers a pending choice.
     */
    public boolean isChoice() {
        return this == CHOOSE_OWN_TARGET || this == CHOOSE_OPPONENT_TARGET
            || this == PROMOTE || this == CHOOSE_HAND_CARD;
    }

    public boolean isSetup() {
        return this == PLACE_ACTIVE || this == PLACE_BENCH || this == CONFIRM_SETUP;
    }
}
