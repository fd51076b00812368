package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Board events that fire triggered effects of abilities and tools.
 */
public enum TriggerEvent {
    /** This Pokémon was damaged by an opponent's attack while active. */
    ON_DAMAGED("on_damaged"),
    /** This Pokémon was knocked out by an opponent's attack. */
    ON_KNOCKED_OUT("on_knocked_out"),
    /** Any attack dealt damage; fires for every Pokémon in play of the listening player. */
    ON_DAMAGE_DEALT("on_damage_dealt"),
    /** During the checkup between turns, for the player whose turn is ending. */
    BETWEEN_TURNS("between_turns");

    private final String jsonValue;

    TriggerEvent(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static TriggerEvent fromString(String value) {
        for (TriggerEvent event : values()) {
            if (event.jsonValue.equalsIgnoreCase(value)) {
                return event;
            }
        }
        throw new IllegalArgumentException("Unknown trigger event: " + value);
    }
}
