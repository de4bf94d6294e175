package com.splitduck.sampling;

import java.util.Objects;

/**
 * Execution technique for a seeded shuffle, chosen from the row count.
 */
public enum ShuffleTier {

    /** Full permutation, joined inline as a VALUES list in a single query */
    DIRECT_JOIN(true),

    /** Full permutation, stored in a temporary mapping table in batches */
    MAPPING_TABLE(true),

    /** Order by a hash of row position and seed; deterministic but not uniform */
    HASH_ORDER(false);

    private final boolean uniform;

    ShuffleTier(boolean uniform) {
        this.uniform = uniform;
    }

    /**
     * Returns whether this tier yields a uniformly random permutation.
     *
     * @return false only for the hash-order approximation
     */
    public boolean isUniform() {
        return uniform;
    }

    /**
     * Selects the tier for a row count.
     *
     * @param n number of rows to shuffle
     * @param config tier thresholds
     * @return {@link #HASH_ORDER} at or above the hash-order threshold,
     *         {@link #DIRECT_JOIN} up to the direct-join limit,
     *         {@link #MAPPING_TABLE} in between
     */
    public static ShuffleTier select(long n, ShuffleConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        if (n >= config.hashOrderThreshold()) {
            return HASH_ORDER;
        }
        if (n <= config.directJoinMaxRows()) {
            return DIRECT_JOIN;
        }
        return MAPPING_TABLE;
    }
}
