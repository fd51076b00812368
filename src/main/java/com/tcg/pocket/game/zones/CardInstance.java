package com.tcg.pocket.game.zones;

import com.tcg.pocket.card.Ability;
import com.tcg.pocket.card.Card;
import com.tcg.pocket.card.EnergyType;
import com.tcg.pocket.card.Passive;
import com.tcg.pocket.card.PassiveKind;
import com.tcg.pocket.card.Trigger;
import com.tcg.pocket.card.TriggerEvent;
import com.tcg.pocket.effect.ModifierKind;
import com.tcg.pocket.game.StatusCondition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A Pokémon in play with its runtime state.
 * The instance owns the cards underneath it (evolution chain) and its tool.
 */
public class CardInstance {
    private final int instanceId;
    private Card.Pokemon card;
    private int damage;
    private final EnumMap<EnergyType, Integer> energy;
    private final EnumSet<StatusCondition> statuses;
    private int turnPlaced;
    private final List<Card> evolutionChain;
    private Card.Tool tool;
    private boolean abilityUsed;
    private final List<TurnModifier> modifiers;

    public CardInstance(int instanceId, Card.Pokemon card, int turnPlaced) {
        this.instanceId = instanceId;
        this.card = card;
        this.damage = 0;
        this.energy = new EnumMap<>(EnergyType.class);
        this.statuses = EnumSet.noneOf(StatusCondition.class);
        this.turnPlaced = turnPlaced;
        this.evolutionChain = new ArrayList<>(2);
        this.tool = null;
        this.abilityUsed = false;
        this.modifiers = new ArrayList<>(2);
    }

    private CardInstance(CardInstance other) {
        this.instanceId = other.instanceId;
        this.card = other.card;
        this.damage = other.damage;
        this.energy = new EnumMap<>(other.energy);
        this.statuses = EnumSet.copyOf(other.statuses);
        this.turnPlaced = other.turnPlaced;
        this.evolutionChain = new ArrayList<>(other.evolutionChain);
        this.tool = other.tool;
        this.abilityUsed = other.abilityUsed;
        this.modifiers = new ArrayList<>(other.modifiers);
    }

    public CardInstance copy() {
        return new CardInstance(this);
    }

    public int getInstanceId() {
        return instanceId;
    }

    public Card.Pokemon getCard() {
        return card;
    }

    public String getName() {
        return card.getName();
    }

    public int getTurnPlaced() {
        return turnPlaced;
    }

    // ---- HP and damage ----

    public int getDamage() {
        return damage;
    }

    public int getMaxHp() {
        return card.getHp() + passiveTotal(PassiveKind.HP_BONUS);
    }

    /**
     * Remaining HP, never below zero.
     */
    public int getRemainingHp() {
        return Math.max(0, getMaxHp() - damage);
    }

    public boolean isDamaged() {
        return damage > 0;
    }

    public boolean isKnockedOut() {
        return damage >= getMaxHp();
    }

    public void addDamage(int amount) {
        if (amount > 0) {
            damage += amount;
        }
    }

    /**
     * Heal up to {@code amount} damage.
     * @return the damage actually removed
     */
    public int heal(int amount) {
        int healed = Math.min(amount, damage);
        damage -= healed;
        return healed;
    }

    // ---- Energy ----

    public int getEnergy(EnergyType type) {
        return energy.getOrDefault(type, 0);
    }

    public int getTotalEnergy() {
        int total = 0;
        for (int count : energy.values()) {
            total += count;
        }
        return total;
    }

    public Map<EnergyType, Integer> getAttachedEnergy() {
        return Collections.unmodifiableMap(energy);
    }

    public void attachEnergy(EnergyType type, int count) {
        if (count > 0) {
            energy.merge(type, count, Integer::sum);
        }
    }

    /**
     * Remove up to {@code count} energy of a type.
     * @return the number removed
     */
    public int removeEnergy(EnergyType type, int count) {
        int current = getEnergy(type);
        int removed = Math.min(current, count);
        if (removed == current) {
            energy.remove(type);
        } else {
            energy.put(type, current - removed);
        }
        return removed;
    }

    /**
     * Remove up to {@code count} energy of any type, highest ordinal type first.
     * @return the removed energy, in removal order
     */
    public List<EnergyType> removeAnyEnergy(int count) {
        List<EnergyType> removed = new ArrayList<>(count);
        EnergyType[] types = EnergyType.values();
        for (int i = types.length - 1; i >= 0 && removed.size() < count; i--) {
            int taken = removeEnergy(types[i], count - removed.size());
            for (int j = 0; j < taken; j++) {
                removed.add(types[i]);
            }
        }
        return removed;
    }

    /**
     * Whether the attached energy covers a cost. Typed requirements are
     * matched first; colorless requirements take whatever remains.
     */
    public boolean canPay(List<EnergyType> cost) {
        EnumMap<EnergyType, Integer> remaining = new EnumMap<>(energy);
        int colorless = 0;
        for (EnergyType required : cost) {
            if (required == EnergyType.COLORLESS) {
                colorless++;
                continue;
            }
            int available = remaining.getOrDefault(required, 0);
            if (available == 0) {
                return false;
            }
            remaining.put(required, available - 1);
        }
        int left = 0;
        for (int count : remaining.values()) {
            left += count;
        }
        return left >= colorless;
    }

    // ---- Status conditions ----

    public boolean hasStatus(StatusCondition status) {
        return statuses.contains(status);
    }

    public Set<StatusCondition> getStatuses() {
        return Collections.unmodifiableSet(statuses);
    }

    /**
     * Add a status. Asleep, paralyzed and confused replace each other.
     */
    public void addStatus(StatusCondition status) {
        if (status == StatusCondition.ASLEEP || status == StatusCondition.PARALYZED
                || status == StatusCondition.CONFUSED) {
            statuses.remove(StatusCondition.ASLEEP);
            statuses.remove(StatusCondition.PARALYZED);
            statuses.remove(StatusCondition.CONFUSED);
        }
        statuses.add(status);
    }

    public void removeStatus(StatusCondition status) {
        statuses.remove(status);
    }

    public void clearStatuses() {
        statuses.clear();
    }

    // ---- Evolution ----

    /**
     * Evolve into {@code evolution}, keeping damage, energy and tool.
     * Status conditions are removed and the new stage counts as placed this turn.
     */
    public void evolve(Card.Pokemon evolution, int turn) {
        evolutionChain.add(card);
        card = evolution;
        turnPlaced = turn;
        abilityUsed = false;
        statuses.clear();
    }

    /**
     * Cards underneath this Pokémon, oldest first.
     */
    public List<Card> getEvolutionChain() {
        return List.copyOf(evolutionChain);
    }

    /**
     * Every card this instance holds: the chain, the current card and the tool.
     */
    public List<Card> allCards() {
        List<Card> all = new ArrayList<>(evolutionChain.size() + 2);
        all.addAll(evolutionChain);
        all.add(card);
        if (tool != null) {
            all.add(tool);
        }
        return all;
    }

    // ---- Tool and ability ----

    public Card.Tool getTool() {
        return tool;
    }

    public boolean hasTool() {
        return tool != null;
    }

    public void setTool(Card.Tool tool) {
        this.tool = tool;
    }

    public boolean isAbilityUsed() {
        return abilityUsed;
    }

    public void setAbilityUsed(boolean abilityUsed) {
        this.abilityUsed = abilityUsed;
    }

    /**
     * Sum of always-on passives from the ability and the attached tool.
     */
    public int passiveTotal(PassiveKind kind) {
        int total = 0;
        Ability ability = card.getAbility();
        if (ability != null) {
            for (Passive passive : ability.getPassives()) {
                if (passive.kind() == kind) {
                    total += passive.amount();
                }
            }
        }
        if (tool != null) {
            for (Passive passive : tool.getPassives()) {
                if (passive.kind() == kind) {
                    total += passive.amount();
                }
            }
        }
        return total;
    }

    /**
     * Triggered effects listening for {@code event}: ability first, then tool.
     */
    public List<Trigger> getTriggers(TriggerEvent event) {
        List<Trigger> result = new ArrayList<>(1);
        Ability ability = card.getAbility();
        if (ability != null) {
            for (Trigger trigger : ability.getTriggers()) {
                if (trigger.event() == event) {
                    result.add(trigger);
                }
            }
        }
        if (tool != null) {
            for (Trigger trigger : tool.getTriggers()) {
                if (trigger.event() == event) {
                    result.add(trigger);
                }
            }
        }
        return result;
    }

    // ---- Temporary modifiers ----

    public void addModifier(TurnModifier modifier) {
        modifiers.add(modifier);
    }

    public List<TurnModifier> getModifiers() {
        return List.copyOf(modifiers);
    }

    public boolean hasModifier(ModifierKind kind) {
        for (TurnModifier modifier : modifiers) {
            if (modifier.kind() == kind) {
                return true;
            }
        }
        return false;
    }

    public int modifierTotal(ModifierKind kind) {
        int total = 0;
        for (TurnModifier modifier : modifiers) {
            if (modifier.kind() == kind) {
                total += modifier.amount();
            }
        }
        return total;
    }

    /**
     * Drop modifiers whose last turn is {@code turn} or earlier.
     */
    public void expireModifiers(int turn) {
        modifiers.removeIf(m -> m.expiresAfterTurn() <= turn);
    }

    /**
     * Leaving the active spot removes status conditions.
     */
    public void onBenched() {
        statuses.clear();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CardInstance other)) {
            return false;
        }
        return instanceId == other.instanceId
            && card == other.card
            && damage == other.damage
            && turnPlaced == other.turnPlaced
            && abilityUsed == other.abilityUsed
            && tool == other.tool
            && energy.equals(other.energy)
            && statuses.equals(other.statuses)
            && evolutionChain.equals(other.evolutionChain)
            && modifiers.equals(other.modifiers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instanceId, card.getId(), damage, turnPlaced, energy, statuses);
    }

    @Override
    public String toString() {
        return card.getName() + "#" + instanceId + " " + getRemainingHp() + "/" + getMaxHp();
    }
}
