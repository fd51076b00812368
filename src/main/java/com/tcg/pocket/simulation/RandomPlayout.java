package com.tcg.pocket.simulation;

import com.tcg.pocket.action.ActionApplier;
import com.tcg.pocket.action.LegalActions;
import com.tcg.pocket.game.MatchEvent;
import com.tcg.pocket.game.MatchState;
import com.tcg.pocket.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Plays matches by picking uniformly among the legal actions. The picking
 * rng is separate from the match rng, so the match itself stays a pure
 * function of its seed and the chosen actions.
 */
public final class RandomPlayout {
    private static final Logger log = LoggerFactory.getLogger(RandomPlayout.class);

    private RandomPlayout() {
        // Utility class - prevent instantiation
    }

    /**
     * Reset a match and play it to the end.
     */
    public static MatchSummary run(GameEngine engine, long seed, List<String> deckA, List<String> deckB)
            throws InvalidDeckException {
        MatchState state = engine.reset(seed, deckA, deckB).state();
        return playOut(state, new GameRng(seed ^ 0x5DEECE66DL));
    }

    /**
     * Play an existing match to the end with random legal actions. Skips
     * observation encoding, which only a learning policy needs.
     * @throws IllegalStateException if a live match offers no legal action
     */
    public static MatchSummary playOut(MatchState state, GameRng picker) {
        int steps = 0;
        while (!state.isTerminal()) {
            List<Integer> legal = LegalActions.legalIndices(state);
            if (legal.isEmpty()) {
                throw new IllegalStateException("No legal action in " + state.getPhase()
                    + " on turn " + state.getTurnNumber());
            }
            ActionApplier.apply(state, legal.get(picker.nextInt(legal.size())));
            steps++;
        }
        int knockouts = (int) state.countEvents(MatchEvent.Type.KNOCKOUT);
        log.debug("Playout finished: {} on turn {} after {} steps", state.getResult(), state.getTurnNumber(), steps);
        return new MatchSummary(state.getResult(), state.getTurnNumber(), steps, knockouts);
    }
}
