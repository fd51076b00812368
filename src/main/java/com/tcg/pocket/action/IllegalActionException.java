package com.tcg.pocket.action;

/**
 * Thrown when an action index is outside the action space or not legal in
 * the current state. The state is left untouched.
 */
public class IllegalActionException extends RuntimeException {
    private final int actionIndex;

    public IllegalActionException(int actionIndex, String message) {
        super("Illegal action " + actionIndex + ": " + message);
        this.actionIndex = actionIndex;
    }

    public int getActionIndex() {
        return actionIndex;
    }
}
