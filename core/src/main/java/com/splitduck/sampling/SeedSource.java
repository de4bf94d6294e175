package com.splitduck.sampling;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.SplittableRandom;

/**
 * Turns an optional 64-bit seed into a pseudorandom stream.
 *
 * <p>With a seed, the stream is a {@link SplittableRandom} initialized from
 * it: the same seed consumed in the same order always yields the same
 * values, on every JVM and platform. Without a seed, the stream is seeded
 * from system entropy and nothing about it is reproducible.
 *
 * <p>Seeds are treated as unsigned 64-bit values; the command line accepts
 * the full range {@code 0..2^64-1}.
 */
public final class SeedSource {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private SeedSource() {}

    /**
     * Creates a stream from an optional seed.
     *
     * @param seed the seed, or empty for an entropy-seeded stream
     * @return a new stream
     */
    public static RandomStream stream(OptionalLong seed) {
        Objects.requireNonNull(seed, "seed must not be null");
        return seed.isPresent() ? seeded(seed.getAsLong()) : entropy();
    }

    public static RandomStream seeded(long seed) {
        return new RandomStream(new SplittableRandom(seed), true);
    }

    public static RandomStream entropy() {
        return new RandomStream(new SplittableRandom(), false);
    }

    /**
     * Derives a per-category seed from a command seed and a category key.
     *
     * <p>Different keys give unrelated seeds, so categories never share a
     * sub-ordering. The result depends only on the two inputs.
     *
     * @param seed the command seed
     * @param categoryKey the category key
     * @return the derived seed
     */
    public static long derive(long seed, String categoryKey) {
        Objects.requireNonNull(categoryKey, "categoryKey must not be null");
        long hash = FNV_OFFSET_BASIS;
        for (byte b : categoryKey.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return mix64(seed ^ hash);
    }

    /**
     * Derives an optional per-category seed; empty stays empty.
     *
     * @param seed the command seed
     * @param categoryKey the category key
     * @return the derived seed, or empty
     */
    public static OptionalLong derive(OptionalLong seed, String categoryKey) {
        return seed.isPresent() ? OptionalLong.of(derive(seed.getAsLong(), categoryKey)) : OptionalLong.empty();
    }

    // SplitMix64 finalizer
    private static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
