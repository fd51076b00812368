package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.pocket.effect.Effect;

import java.util.List;

/**
 * Trainer card definition shared by items, supporters and tools.
 * Items and supporters resolve {@link #getEffect()} when played; tools stay
 * attached and contribute passives and triggers instead.
 */
public class TrainerCard extends BaseCard {
    @JsonProperty("effect")
    private Effect effect;

    @JsonProperty("passives")
    private List<Passive> passives = List.of();

    @JsonProperty("triggers")
    private List<Trigger> triggers = List.of();

    public Effect getEffect() {
        return effect;
    }

    public List<Passive> getPassives() {
        return passives;
    }

    public List<Trigger> getTriggers() {
        return triggers;
    }

    public void setEffect(Effect effect) { this.effect = effect; }
    public void setPassives(List<Passive> passives) { this.passives = passives != null ? List.copyOf(passives) : List.of(); }
    public void setTriggers(List<Trigger> triggers) { this.triggers = triggers != null ? List.copyOf(triggers) : List.of(); }
}
