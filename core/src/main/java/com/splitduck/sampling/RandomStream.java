package com.splitduck.sampling;

import java.util.SplittableRandom;

/**
 * A single pseudorandom stream owned by one command.
 *
 * <p>Not thread-safe. Draws are counted so that callers (and tests) can
 * check how much of the stream an algorithm consumed.
 *
 * @see SeedSource
 */
public final class RandomStream {

    private final SplittableRandom random;
    private final boolean seeded;
    private long draws = 0;

    RandomStream(SplittableRandom random, boolean seeded) {
        this.random = random;
        this.seeded = seeded;
    }

    /**
     * Returns a uniformly distributed int in {@code [0, bound)}.
     *
     * @param bound exclusive upper bound, must be positive
     * @return the next value
     */
    public int nextInt(int bound) {
        draws++;
        return random.nextInt(bound);
    }

    /**
     * Returns the next 64 pseudorandom bits.
     *
     * @return the next value
     */
    public long nextLong() {
        draws++;
        return random.nextLong();
    }

    /**
     * Returns whether the stream was created from an explicit seed and is
     * therefore reproducible.
     *
     * @return true for seeded streams
     */
    public boolean isSeeded() {
        return seeded;
    }

    public long draws() {
        return draws;
    }
}
