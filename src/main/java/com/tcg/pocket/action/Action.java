package com.tcg.pocket.action;

/**
 * A decoded action.
 *
 * @param type   action family
 * @param first  hand index, board slot, bench position or attack index, depending on the family;
 *               -1 for families without a parameter
 * @param second board slot for the two-parameter families (evolve, attach tool), otherwise -1
 */
public record Action(ActionType type, int first, int second) {
    public static final int NONE = -1;

    public static Action of(ActionType type) {
        return new Action(type, NONE, NONE);
    }

    public static Action of(ActionType type, int first) {
        return new Action(type, first, NONE);
    }

    public static Action of(ActionType type, int first, int second) {
        return new Action(type, first, second);
    }

    @Override
    public String toString() {
        if (first == NONE) {
            return type.name();
        }
        if (second == NONE) {
            return type.name() + "(" + first + ")";
        }
        return type.name() + "(" + first + ", " + second + ")";
    }
}
