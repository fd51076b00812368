package com.tcg.pocket.simulation;

import com.tcg.pocket.game.MatchResult;
import com.tcg.pocket.game.MatchState;

/**
 * Outcome of one step.
 *
 * @param state        the match after the action, the same instance that was stepped
 * @param observationA observation for player A
 * @param observationB observation for player B
 * @param terminal     whether the match is over
 * @param winner       result flag, {@link MatchResult#ONGOING} until the match ends
 * @param turn         turn number after the action
 */
public record StepResult(MatchState state, float[] observationA, float[] observationB,
                         boolean terminal, MatchResult winner, int turn) {
}
