package com.tcg.pocket.action;

/**
 * Fixed mapping between action indices and decoded actions.
 *
 * <pre>
 *   0-9    place active (hand index)
 *  10-19   place on bench during setup (hand index)
 *  20      confirm setup
 *  21-30   play basic to bench (hand index)
 *  31-70   evolve (hand index * 4 + board slot)
 *  71-74   attach zone energy (board slot)
 *  75-77   retreat (bench position)
 *  78-81   use ability (board slot)
 *  82-91   play item or supporter (hand index)
 *  92-94   attack (attack index)
 *  95      end turn
 *  96-99   choose own target (board slot)
 * 100-103  choose opponent target (board slot)
 * 104-106  promote (bench position)
 * 107-116  choose hand card (hand index)
 * 117-156  attach tool (hand index * 4 + board slot)
 * 157-511  reserved, never legal
 * </pre>
 */
public final class ActionSpace {
    public static final int SIZE = 512;
    public static final int MAX_HAND = 10;
    public static final int BOARD_SLOTS = 4;
    public static final int BENCH_POSITIONS = 3;
    public static final int MAX_ATTACKS = 3;

    private ActionSpace() {
        // Utility class - prevent instantiation
    }

    public static int encode(Action action) {
        ActionType type = action.type();
        int offset = switch (type) {
            case CONFIRM_SETUP, END_TURN -> 0;
            case EVOLVE, ATTACH_TOOL -> {
                checkRange(action.first(), MAX_HAND, action);
                checkRange(action.second(), BOARD_SLOTS, action);
                yield action.first() * BOARD_SLOTS + action.second();
            }
            default -> {
                checkRange(action.first(), type.getSize(), action);
                yield action.first();
            }
        };
        return type.getBase() + offset;
    }

    public static int encode(ActionType type) {
        return encode(Action.of(type));
    }

    public static int encode(ActionType type, int first) {
        return encode(Action.of(type, first));
    }

    public static int encode(ActionType type, int first, int second) {
        return encode(Action.of(type, first, second));
    }

    /**
     * Decode an index.
     * @throws IllegalActionException for indices outside the space or in the reserved range
     */
    public static Action decode(int index) {
        if (index < 0 || index >= SIZE) {
            throw new IllegalActionException(index, "outside the action space");
        }
        for (ActionType type : ActionType.values()) {
            if (!type.contains(index)) {
                continue;
            }
            int offset = index - type.getBase();
            return switch (type) {
                case CONFIRM_SETUP, END_TURN -> Action.of(type);
                case EVOLVE, ATTACH_TOOL -> Action.of(type, offset / BOARD_SLOTS, offset % BOARD_SLOTS);
                default -> Action.of(type, offset);
            };
        }
        throw new IllegalActionException(index, "reserved index");
    }

    /**
     * Check if an index falls in the reserved tail.
     */
    public static boolean isReserved(int index) {
        return index >= ActionType.ATTACH_TOOL.getEnd() && index < SIZE;
    }

    private static void checkRange(int value, int bound, Action action) {
        if (value < 0 || value >= bound) {
            throw new IllegalArgumentException("Parameter out of range for " + action);
        }
    }
}
