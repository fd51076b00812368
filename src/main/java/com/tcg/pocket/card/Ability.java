package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.pocket.effect.Effect;

import java.util.List;

/**
 * A Pokémon ability. May carry an activated effect (usable once per turn
 * per instance), passive modifiers and triggered effects.
 */
public class Ability {
    @JsonProperty("name")
    private String name;

    @JsonProperty("effect")
    private Effect effect;

    @JsonProperty("active_only")
    private boolean activeOnly;

    @JsonProperty("passives")
    private List<Passive> passives = List.of();

    @JsonProperty("triggers")
    private List<Trigger> triggers = List.of();

    public String getName() {
        return name;
    }

    public Effect getEffect() {
        return effect;
    }

    public boolean isActivated() {
        return effect != null;
    }

    /**
     * Whether the activated effect can only be used from the active spot.
     */
    public boolean isActiveOnly() {
        return activeOnly;
    }

    public List<Passive> getPassives() {
        return passives;
    }

    public List<Trigger> getTriggers() {
        return triggers;
    }

    public void setName(String name) { this.name = name; }
    public void setEffect(Effect effect) { this.effect = effect; }
    public void setActiveOnly(boolean activeOnly) { this.activeOnly = activeOnly; }
    public void setPassives(List<Passive> passives) { this.passives = passives != null ? List.copyOf(passives) : List.of(); }
    public void setTriggers(List<Trigger> triggers) { this.triggers = triggers != null ? List.copyOf(triggers) : List.of(); }
}
