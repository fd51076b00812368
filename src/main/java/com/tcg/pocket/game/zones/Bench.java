package com.tcg.pocket.game.zones;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Bench - fixed-capacity, position-addressed slots. Removing a Pokémon
 * leaves a hole; the remaining Pokémon keep their positions.
 */
public class Bench {
    private final CardInstance[] slots;

    public Bench(int capacity) {
        this.slots = new CardInstance[capacity];
    }

    public int capacity() {
        return slots.length;
    }

    /**
     * Get the Pokémon at a position, or null if the slot is empty.
     */
    public CardInstance get(int index) {
        return slots[index];
    }

    public void set(int index, CardInstance instance) {
        slots[index] = instance;
    }

    /**
     * Remove a Pokémon by position.
     * @return The removed instance, or null if the slot was empty
     */
    public CardInstance remove(int index) {
        CardInstance removed = slots[index];
        slots[index] = null;
        return removed;
    }

    /**
     * First empty position, or -1 when full.
     */
    public int firstEmpty() {
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                return i;
            }
        }
        return -1;
    }

    public int count() {
        int count = 0;
        for (CardInstance slot : slots) {
            if (slot != null) {
                count++;
            }
        }
        return count;
    }

    public boolean isEmpty() {
        return count() == 0;
    }

    public boolean isFull() {
        return firstEmpty() < 0;
    }

    /**
     * Occupied positions in ascending order.
     */
    public List<Integer> occupiedPositions() {
        List<Integer> positions = new ArrayList<>(slots.length);
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] != null) {
                positions.add(i);
            }
        }
        return positions;
    }

    public Bench copy() {
        Bench copy = new Bench(slots.length);
        for (int i = 0; i < slots.length; i++) {
            copy.slots[i] = slots[i] != null ? slots[i].copy() : null;
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Bench other && Arrays.equals(other.slots, slots);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(slots);
    }
}
