package com.tcg.pocket.simulation;

import com.tcg.pocket.game.MatchState;

/**
 * A freshly dealt match with the first observation of each player.
 */
public record ResetResult(MatchState state, float[] observationA, float[] observationB) {
}
