package com.tcg.pocket.rng;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;

/**
 * Seeded random number generator owned by a single match.
 * Uses the Mulberry32 PRNG so that a seed fully determines every coin flip,
 * shuffle and random pick of an episode. All chance events of the engine go
 * through one instance; there is no global random state.
 */
public class GameRng {
    private long state;

    /**
     * Create a new GameRng with the specified seed.
     * Only the lower 32 bits of the seed are used.
     */
    public GameRng(long seed) {
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Create a new GameRng with a random seed from SecureRandom.
     */
    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    private GameRng(GameRng other) {
        this.state = other.state;
    }

    /**
     * Generate next random number in [0, 1).
     */
    public double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;

        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;
        return result / 4294967296.0;
    }

    /**
     * Generate a random integer in range [0, bound).
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) (next() * bound);
    }

    /**
     * Flip a coin. Consumes exactly one draw.
     * @return true for heads
     */
    public boolean coinFlip() {
        return next() < 0.5;
    }

    /**
     * Flip {@code count} coins and return the number of heads.
     * Consumes exactly {@code count} draws.
     */
    public int coinFlips(int count) {
        int heads = 0;
        for (int i = 0; i < count; i++) {
            if (coinFlip()) {
                heads++;
            }
        }
        return heads;
    }

    /**
     * Flip coins until tails and return the number of heads.
     * Capped so a pathological seed cannot spin forever.
     */
    public int flipsUntilTails(int cap) {
        int heads = 0;
        while (heads < cap && coinFlip()) {
            heads++;
        }
        return heads;
    }

    /**
     * Fisher-Yates shuffle for a list, walking from the last index down.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = (int) Math.floor(next() * (i + 1));
            Collections.swap(list, i, j);
        }
    }

    /**
     * Independent copy with the same internal state.
     */
    public GameRng copy() {
        return new GameRng(this);
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GameRng other && other.state == state;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(state);
    }
}
