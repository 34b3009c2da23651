package com.polcard.engine.rng;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;

/**
 * Seeded random number generator for reproducible games.
 * Uses the Mulberry32 PRNG. The 32-bit state is persisted with the game so that
 * shuffles, random discards and first-player tiebreaks replay identically.
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

    /**
     * Resume a generator from a previously saved state.
     */
    public static GameRng fromState(long state) {
        return new GameRng(state);
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
        return (int) Math.floor(next() * bound);
    }

    /**
     * Fisher-Yates shuffle for a list.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = (int) Math.floor(next() * (i + 1));
            Collections.swap(list, i, j);
        }
    }

    /**
     * Get the current state, to be stored alongside the game.
     */
    public long getState() {
        return state;
    }
}
