package com.tcg.pocket.effect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.pocket.card.EnergyType;

/**
 * A counted quantity. Unused fields are ignored for a given kind.
 */
public record Counter(
    @JsonProperty("of") CounterKind kind,
    @JsonProperty("flips") int flips,
    @JsonProperty("energy") EnergyType energy,
    @JsonProperty("side") Side side,
    @JsonProperty("target") Target target
) {
    /** Safety cap for flip-until-tails counters. */
    public static final int MAX_FLIPS = 20;

    public Counter {
        if (kind == null) {
            throw new IllegalArgumentException("counter needs 'of'");
        }
        if (kind == CounterKind.COIN_HEADS && flips <= 0) {
            flips = 1;
        }
        if (side == null) {
            side = Side.OWN;
        }
        if (target == null) {
            target = Target.SELF;
        }
        if (target.isChosen()) {
            throw new IllegalArgumentException("counter target must be fixed: " + target);
        }
    }
}
