package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Evolution stage of a Pokémon card.
 */
public enum Stage {
    BASIC("basic"),
    STAGE_1("stage1"),
    STAGE_2("stage2");

    private final String jsonValue;

    Stage(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * The stage a card of this stage evolves from, or null for basics.
     */
    public Stage previous() {
        return switch (this) {
            case BASIC -> null;
            case STAGE_1 -> BASIC;
            case STAGE_2 -> STAGE_1;
        };
    }

    @JsonCreator
    public static Stage fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Stage cannot be null");
        }
        return switch (value.trim().toLowerCase()) {
            case "basic" -> BASIC;
            case "stage1", "stage-1", "stage 1" -> STAGE_1;
            case "stage2", "stage-2", "stage 2" -> STAGE_2;
            default -> throw new IllegalArgumentException("Unknown stage: " + value);
        };
    }
}
