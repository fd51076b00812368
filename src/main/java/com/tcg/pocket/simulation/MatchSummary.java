package com.tcg.pocket.simulation;

import com.tcg.pocket.game.MatchResult;

/**
 * Result of a single played-out match.
 *
 * @param result    final result flag
 * @param turns     turn number the match ended on
 * @param steps     actions applied, setup included
 * @param knockouts knockouts over the whole match
 */
public record MatchSummary(MatchResult result, int turns, int steps, int knockouts) {

    public boolean isDraw() {
        return result == MatchResult.DRAW;
    }
}
