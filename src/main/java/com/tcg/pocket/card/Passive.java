package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A static modifier, e.g. "+20 HP" or "takes 10 less damage from attacks".
 */
public record Passive(
    @JsonProperty("passive") PassiveKind kind,
    @JsonProperty("amount") int amount
) {
    public Passive {
        if (kind == null) {
            throw new IllegalArgumentException("passive kind is required");
        }
    }
}
