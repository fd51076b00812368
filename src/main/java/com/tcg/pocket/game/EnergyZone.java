package com.tcg.pocket.game;

import com.tcg.pocket.card.EnergyType;
import com.tcg.pocket.rng.GameRng;

import java.util.List;
import java.util.Objects;

/**
 * Energy-zone generator of one player. Each turn the previewed energy becomes
 * the current one and a new preview is rolled from the deck's energy types.
 * Unattached current energy is lost at the end of the turn.
 */
public class EnergyZone {
    private final List<EnergyType> types;
    private EnergyType current;
    private EnergyType next;

    public EnergyZone(List<EnergyType> types) {
        if (types.isEmpty()) {
            throw new IllegalArgumentException("Energy zone needs at least one type");
        }
        this.types = List.copyOf(types);
    }

    private EnergyZone(EnergyZone other) {
        this.types = other.types;
        this.current = other.current;
        this.next = other.next;
    }

    public EnergyZone copy() {
        return new EnergyZone(this);
    }

    /**
     * Roll the first preview. A single-type zone consumes no rng draw.
     */
    public void prime(GameRng rng) {
        next = roll(rng);
    }

    /**
     * Advance the zone: preview becomes current, a new preview is rolled.
     */
    public void generate(GameRng rng) {
        current = next;
        next = roll(rng);
    }

    private EnergyType roll(GameRng rng) {
        if (types.size() == 1) {
            return types.get(0);
        }
        return types.get(rng.nextInt(types.size()));
    }

    /**
     * Take the current energy for attaching.
     * @return the energy, or null if none is available
     */
    public EnergyType take() {
        EnergyType taken = current;
        current = null;
        return taken;
    }

    public void discardCurrent() {
        current = null;
    }

    public EnergyType getCurrent() {
        return current;
    }

    public EnergyType getNext() {
        return next;
    }

    public List<EnergyType> getTypes() {
        return types;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EnergyZone other
            && types.equals(other.types)
            && current == other.current
            && next == other.next;
    }

    @Override
    public int hashCode() {
        return Objects.hash(types, current, next);
    }
}
