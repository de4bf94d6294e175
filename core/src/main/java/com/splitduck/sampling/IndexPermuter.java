package com.splitduck.sampling;

import java.util.Objects;

/**
 * Produces permutations of {@code [0, n)} with the Fisher-Yates shuffle.
 *
 * <p>Exactly {@code n - 1} values are drawn from the stream (none for
 * {@code n <= 1}); every one of the {@code n!} orderings is reachable, and
 * a seeded stream always yields the same permutation.
 */
public final class IndexPermuter {

    private IndexPermuter() {}

    /**
     * Permutes {@code [0, n)}.
     *
     * @param n number of positions
     * @param stream the pseudorandom stream to draw from
     * @return the permutation
     * @throws IllegalArgumentException if n is negative
     */
    public static Permutation permute(int n, RandomStream stream) {
        Objects.requireNonNull(stream, "stream must not be null");
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative, got: " + n);
        }

        int[] positions = new int[n];
        for (int i = 0; i < n; i++) {
            positions[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            int j = stream.nextInt(i + 1);
            int tmp = positions[i];
            positions[i] = positions[j];
            positions[j] = tmp;
        }
        return Permutation.trusted(positions);
    }
}
