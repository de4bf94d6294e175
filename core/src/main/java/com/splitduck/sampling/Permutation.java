package com.splitduck.sampling;

import java.util.Arrays;

/**
 * A bijection on {@code [0, n)} describing a reordering of row positions.
 *
 * <p>{@code sourceOf(newPosition)} gives the position, in the input order,
 * of the row that ends up at {@code newPosition} in the output order.
 */
public final class Permutation {

    private final int[] sourcePositions;

    private Permutation(int[] sourcePositions) {
        this.sourcePositions = sourcePositions;
    }

    /**
     * Wraps an array of source positions, validating that it is a bijection.
     *
     * @param sourcePositions element {@code i} is the input position of output row {@code i}
     * @return the permutation
     * @throws IllegalArgumentException if the array is not a permutation of {@code [0, n)}
     */
    public static Permutation of(int[] sourcePositions) {
        int[] copy = sourcePositions.clone();
        boolean[] seen = new boolean[copy.length];
        for (int position : copy) {
            if (position < 0 || position >= copy.length || seen[position]) {
                throw new IllegalArgumentException(
                    "Not a permutation of [0, " + copy.length + "): " + position);
            }
            seen[position] = true;
        }
        return new Permutation(copy);
    }

    /** Wraps an array the caller guarantees to be a bijection, without copying. */
    static Permutation trusted(int[] sourcePositions) {
        return new Permutation(sourcePositions);
    }

    public static Permutation identity(int n) {
        int[] positions = new int[n];
        for (int i = 0; i < n; i++) {
            positions[i] = i;
        }
        return new Permutation(positions);
    }

    public int size() {
        return sourcePositions.length;
    }

    /**
     * Returns the input position of the row placed at {@code newPosition}.
     *
     * @param newPosition output position
     * @return input position
     */
    public int sourceOf(int newPosition) {
        return sourcePositions[newPosition];
    }

    public int[] toArray() {
        return sourcePositions.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Permutation)) return false;
        return Arrays.equals(sourcePositions, ((Permutation) o).sourcePositions);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(sourcePositions);
    }

    @Override
    public String toString() {
        if (sourcePositions.length <= 16) {
            return "Permutation" + Arrays.toString(sourcePositions);
        }
        return "Permutation(size=" + sourcePositions.length + ")";
    }
}
