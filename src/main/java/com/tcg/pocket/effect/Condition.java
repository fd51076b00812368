package com.tcg.pocket.effect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.pocket.card.EnergyType;
import com.tcg.pocket.game.StatusCondition;

/**
 * A board predicate evaluated against the state at resolution time.
 */
public record Condition(
    @JsonProperty("if") ConditionKind kind,
    @JsonProperty("target") Target target,
    @JsonProperty("side") Side side,
    @JsonProperty("status") StatusCondition status,
    @JsonProperty("energy") EnergyType energy,
    @JsonProperty("amount") int amount
) {
    public Condition {
        if (kind == null) {
            throw new IllegalArgumentException("condition needs 'if'");
        }
        if (target == null) {
            target = Target.OPPONENT_ACTIVE;
        }
        if (!target.isSingle() || target.isChosen()) {
            throw new IllegalArgumentException("condition target must name one fixed Pokémon: " + target);
        }
        if (side == null) {
            side = Side.OWN;
        }
        if (kind == ConditionKind.HAS_STATUS && status == null) {
            throw new IllegalArgumentException("has_status condition needs 'status'");
        }
    }
}
