package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Pokémon card definition.
 */
public class PokemonCard extends BaseCard {
    @JsonProperty("hp")
    private int hp;

    @JsonProperty("stage")
    private Stage stage;

    @JsonProperty("energy_type")
    private EnergyType energyType;

    @JsonProperty("weakness")
    private EnergyType weakness;

    @JsonProperty("retreat_cost")
    private int retreatCost;

    @JsonProperty("evolves_from")
    private String evolvesFrom;

    @JsonProperty("is_ex")
    private boolean isEx;

    @JsonProperty("attacks")
    private List<Attack> attacks = List.of();

    @JsonProperty("ability")
    private Ability ability;

    public int getHp() {
        return hp;
    }

    public Stage getStage() {
        return stage;
    }

    public EnergyType getEnergyType() {
        return energyType;
    }

    public EnergyType getWeakness() {
        return weakness;
    }

    public int getRetreatCost() {
        return retreatCost;
    }

    public String getEvolvesFrom() {
        return evolvesFrom;
    }

    public boolean isEx() {
        return isEx;
    }

    public List<Attack> getAttacks() {
        return attacks;
    }

    public Ability getAbility() {
        return ability;
    }

    public boolean hasAbility() {
        return ability != null;
    }

    /**
     * Points the opponent scores when this Pokémon is knocked out.
     */
    public int getPrizeValue() {
        return isEx ? 2 : 1;
    }

    // Setters for Jackson
    public void setHp(int hp) { this.hp = hp; }
    public void setStage(Stage stage) { this.stage = stage; }
    public void setEnergyType(EnergyType energyType) { this.energyType = energyType; }
    public void setWeakness(EnergyType weakness) { this.weakness = weakness; }
    public void setRetreatCost(int retreatCost) { this.retreatCost = retreatCost; }
    public void setEvolvesFrom(String evolvesFrom) { this.evolvesFrom = evolvesFrom != null ? evolvesFrom.intern() : null; }
    public void setEx(boolean ex) { isEx = ex; }
    public void setAttacks(List<Attack> attacks) { this.attacks = attacks != null ? List.copyOf(attacks) : List.of(); }
    public void setAbility(Ability ability) { this.ability = ability; }
}
