package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Always-on modifiers granted by abilities and tools while in play.
 */
public enum PassiveKind {
    /** Extra maximum HP. */
    HP_BONUS("hp_bonus"),
    /** Less damage taken from attacks. */
    DAMAGE_REDUCTION("damage_reduction"),
    /** More damage dealt by this Pokémon's attacks. */
    DAMAGE_BONUS("damage_bonus"),
    /** Cheaper retreat. */
    RETREAT_REDUCTION("retreat_reduction");

    private final String jsonValue;

    PassiveKind(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static PassiveKind fromString(String value) {
        for (PassiveKind kind : values()) {
            if (kind.jsonValue.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown passive kind: " + value);
    }
}
