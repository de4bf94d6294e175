package com.splitduck.sampling;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable per-category sample sizes for a stratified sample.
 *
 * <p>Invariants: every count is at most its category's population, and the
 * counts sum to at most the requested size. The difference between the
 * requested size and the sum is the {@linkplain #remainder() remainder}
 * the caller draws from the whole dataset.
 */
public final class AllocationPlan {

    private final long requested;
    private final SortedMap<String, Long> populations;
    private final SortedMap<String, Long> counts;
    private final long allocated;

    AllocationPlan(long requested, Map<String, Long> populations, Map<String, Long> counts) {
        this.requested = requested;
        this.populations = Collections.unmodifiableSortedMap(new TreeMap<>(populations));
        this.counts = Collections.unmodifiableSortedMap(new TreeMap<>(counts));

        long sum = 0;
        for (Map.Entry<String, Long> entry : this.counts.entrySet()) {
            long population = this.populations.getOrDefault(entry.getKey(), 0L);
            if (entry.getValue() < 0 || entry.getValue() > population) {
                throw new IllegalArgumentException(String.format(
                    "Allocation for category '%s' (%d) exceeds its population (%d)",
                    entry.getKey(), entry.getValue(), population));
            }
            sum += entry.getValue();
        }
        if (sum > requested) {
            throw new IllegalArgumentException(
                "Allocated " + sum + " rows, more than the requested " + requested);
        }
        this.allocated = sum;
    }

    public long requested() {
        return requested;
    }

    /**
     * Returns the allocation per category, sorted by key.
     *
     * @return category counts
     */
    public SortedMap<String, Long> counts() {
        return counts;
    }

    public SortedMap<String, Long> populations() {
        return populations;
    }

    public long countFor(String categoryKey) {
        Objects.requireNonNull(categoryKey, "categoryKey must not be null");
        return counts.getOrDefault(categoryKey, 0L);
    }

    /** Sum of all category counts. */
    public long allocated() {
        return allocated;
    }

    /**
     * Returns how many rows are still missing from the requested size.
     *
     * @return {@code requested - allocated}, never negative
     */
    public long remainder() {
        return requested - allocated;
    }

    @Override
    public String toString() {
        return "AllocationPlan(requested=" + requested + ", allocated=" + allocated + ", counts=" + counts + ")";
    }
}
