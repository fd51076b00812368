package com.tcg.pocket.game;

/**
 * Terminal-result flag of a match.
 */
public enum MatchResult {
    ONGOING,
    PLAYER_A,
    PLAYER_B,
    DRAW;

    public static MatchResult winner(int player) {
        return player == MatchState.PLAYER_A ? PLAYER_A : PLAYER_B;
    }

    public boolean isTerminal() {
        return this != ONGOING;
    }
}
