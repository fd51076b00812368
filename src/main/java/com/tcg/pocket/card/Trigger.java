package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.pocket.effect.Effect;

/**
 * An effect pushed onto the resolution stack when its event fires.
 */
public record Trigger(
    @JsonProperty("on") TriggerEvent event,
    @JsonProperty("effect") Effect effect
) {
    public Trigger {
        if (event == null || effect == null) {
            throw new IllegalArgumentException("trigger needs both 'on' and 'effect'");
        }
    }
}
