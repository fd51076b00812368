package com.tcg.pocket.game;

import com.tcg.pocket.effect.Effect;

/**
 * Entry of the resolution stack. Frames are immutable; the stack is drained
 * last-in first-out, one frame at a time.
 */
public sealed interface Frame permits Frame.EffectFrame, Frame.StepFrame {

    /**
     * An effect descriptor waiting to resolve.
     *
     * @param effect           the descriptor
     * @param controller       player controlling the effect
     * @param sourceInstanceId Pokémon the effect comes from, or {@link #NO_SOURCE} for trainers
     * @param chosen           answer to this frame's pending choice (board slot or hand index),
     *                         or {@link #NOT_CHOSEN}
     */
    record EffectFrame(Effect effect, int controller, int sourceInstanceId, int chosen) implements Frame {
        public static final int NO_SOURCE = -1;
        public static final int NOT_CHOSEN = -1;

        public EffectFrame(Effect effect, int controller, int sourceInstanceId) {
            this(effect, controller, sourceInstanceId, NOT_CHOSEN);
        }

        public boolean hasChoice() {
            return chosen != NOT_CHOSEN;
        }

        public EffectFrame withChoice(int choice) {
            return new EffectFrame(effect, controller, sourceInstanceId, choice);
        }

        /**
         * Same controller and source, different descriptor, no choice yet.
         */
        public EffectFrame child(Effect childEffect) {
            return new EffectFrame(childEffect, controller, sourceInstanceId, NOT_CHOSEN);
        }
    }

    /**
     * A fixed rules step scheduled between effects.
     */
    record StepFrame(Step step, int player) implements Frame {
    }

    enum Step {
        /** Apply the resolving attack's damage to the defending active. */
        DEAL_ATTACK_DAMAGE,
        /** Triggers of the defending Pokémon that reacts to being damaged. */
        DEFENDER_REACTIONS,
        /** Board-wide triggers listening for any attack damage. */
        DAMAGE_DEALT_TRIGGERS,
        /** Remove knocked-out Pokémon, award points, schedule promotions. */
        KNOCKOUT_CHECK,
        /** Ask {@code player} to promote a benched Pokémon to the empty active spot. */
        PROMOTE,
        /** Between-turns triggers of the Pokémon still in play for {@code player}. */
        BETWEEN_TURNS_TRIGGERS,
        /** Finish the attack and run the end-of-turn checkup. */
        END_TURN,
        /** Hand the turn to the other player. */
        NEXT_TURN
    }
}
