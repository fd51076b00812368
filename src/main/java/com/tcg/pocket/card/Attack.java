package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.pocket.effect.Effect;

import java.util.List;

/**
 * An attack printed on a Pokémon card.
 */
public class Attack {
    @JsonProperty("name")
    private String name;

    @JsonProperty("cost")
    private List<EnergyType> cost = List.of();

    @JsonProperty("damage")
    private int damage;

    @JsonProperty("effect")
    private Effect effect;

    public Attack() {
    }

    public Attack(String name, List<EnergyType> cost, int damage, Effect effect) {
        this.name = name;
        this.cost = List.copyOf(cost);
        this.damage = damage;
        this.effect = effect;
    }

    public String getName() {
        return name;
    }

    public List<EnergyType> getCost() {
        return cost;
    }

    public int getDamage() {
        return damage;
    }

    public Effect getEffect() {
        return effect;
    }

    public boolean hasEffect() {
        return effect != null;
    }

    public void setName(String name) { this.name = name; }
    public void setCost(List<EnergyType> cost) { this.cost = cost != null ? List.copyOf(cost) : List.of(); }
    public void setDamage(int damage) { this.damage = damage; }
    public void setEffect(Effect effect) { this.effect = effect; }
}
