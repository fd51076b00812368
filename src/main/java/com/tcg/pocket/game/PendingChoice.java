package com.tcg.pocket.game;

import java.util.List;

/**
 * A suspended resolution waiting for a player decision.
 *
 * @param kind       what is being chosen
 * @param chooser    player who must act
 * @param candidates valid answers: board slots for targets, bench positions for
 *                   promotion, hand indices for hand cards; never empty
 * @param resume     frame to re-push with the answer, or null for promotion
 */
public record PendingChoice(Kind kind, int chooser, List<Integer> candidates, Frame.EffectFrame resume) {

    public enum Kind {
        /** A slot on the chooser's own board. */
        OWN_TARGET,
        /** A slot on the chooser's opponent's board. */
        OPPONENT_TARGET,
        /** A bench position to move into the empty active spot. */
        PROMOTE,
        /** A card of the chooser's hand. */
        HAND_CARD
    }

    public PendingChoice {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("A pending choice needs at least one candidate");
        }
        candidates = List.copyOf(candidates);
    }

    public boolean accepts(int answer) {
        return candidates.contains(answer);
    }
}
