package com.tcg.pocket.game.zones;

import com.tcg.pocket.effect.ModifierKind;

/**
 * A temporary modifier on a Pokémon instance. It applies through the end of
 * turn {@code expiresAfterTurn} and is removed during that turn's checkup.
 */
public record TurnModifier(ModifierKind kind, int amount, int expiresAfterTurn) {
}
