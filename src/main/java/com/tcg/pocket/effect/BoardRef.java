package com.tcg.pocket.effect;

/**
 * A board slot of a player: slot 0 is the active spot, 1.. the bench.
 */
public record BoardRef(int player, int slot) {
}
