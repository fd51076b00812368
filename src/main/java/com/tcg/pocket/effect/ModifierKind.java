package com.tcg.pocket.effect;

/**
 * Temporary modifiers placed on a Pokémon instance.
 */
public enum ModifierKind {
    /** Damage from attacks reduced by the amount. */
    DAMAGE_REDUCTION,
    /** Attacks of this Pokémon do the amount more damage. */
    DAMAGE_BOOST,
    /** All damage from attacks prevented. */
    INVULNERABLE,
    CANT_RETREAT,
    CANT_ATTACK,
    /** Retreat cost reduced by the amount. */
    RETREAT_REDUCTION
}
