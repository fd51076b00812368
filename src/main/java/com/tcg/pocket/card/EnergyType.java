package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Energy types. {@link #COLORLESS} appears in attack costs as a wildcard
 * and is generated only by decks without any typed Pokémon.
 */
public enum EnergyType {
    GRASS("grass"),
    FIRE("fire"),
    WATER("water"),
    LIGHTNING("lightning"),
    PSYCHIC("psychic"),
    FIGHTING("fighting"),
    DARKNESS("darkness"),
    METAL("metal"),
    DRAGON("dragon"),
    COLORLESS("colorless");

    private final String jsonValue;

    EnergyType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Parse an energy type, accepting the aliases used by card data dumps.
     */
    @JsonCreator
    public static EnergyType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Energy type cannot be null");
        }
        return switch (value.trim().toLowerCase()) {
            case "grass" -> GRASS;
            case "fire" -> FIRE;
            case "water" -> WATER;
            case "lightning", "electric" -> LIGHTNING;
            case "psychic" -> PSYCHIC;
            case "fighting" -> FIGHTING;
            case "darkness", "dark" -> DARKNESS;
            case "metal", "steel" -> METAL;
            case "dragon" -> DRAGON;
            case "colorless", "normal" -> COLORLESS;
            default -> throw new IllegalArgumentException("Unknown energy type: " + value);
        };
    }
}
