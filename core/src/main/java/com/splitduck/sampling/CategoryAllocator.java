package com.splitduck.sampling;

import com.splitduck.exception.NoCategoriesFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Proportional allocation of a sample size across categories.
 *
 * <p>For each category {@code c}: {@code raw = n * population[c] / total},
 * {@code count = round(raw)} (half away from zero) capped at
 * {@code population[c]}. Rounding up in several categories can overshoot
 * {@code n}; the overshoot is removed one row at a time from the category
 * whose count exceeds its raw share the most, ties going to the first key
 * in sort order. Any shortfall is left to the caller as the plan's
 * remainder.
 */
public final class CategoryAllocator {

    private static final Logger logger = LoggerFactory.getLogger(CategoryAllocator.class);

    private CategoryAllocator() {}

    /**
     * Allocates {@code requested} rows across categories.
     *
     * @param column the stratification column, for error messages
     * @param populations rows per category key; zero populations are ignored
     * @param requested the requested sample size
     * @return the allocation plan
     * @throws NoCategoriesFoundException if there are no non-empty categories
     * @throws IllegalArgumentException if requested or a population is negative
     */
    public static AllocationPlan allocate(String column, Map<String, Long> populations, long requested) {
        Objects.requireNonNull(populations, "populations must not be null");
        if (requested < 0) {
            throw new IllegalArgumentException("requested must be non-negative, got: " + requested);
        }

        TreeMap<String, Long> nonEmpty = new TreeMap<>();
        long total = 0;
        for (Map.Entry<String, Long> entry : populations.entrySet()) {
            long population = entry.getValue();
            if (population < 0) {
                throw new IllegalArgumentException(
                    "Negative population for category '" + entry.getKey() + "': " + population);
            }
            if (population > 0) {
                nonEmpty.put(entry.getKey(), population);
                total += population;
            }
        }
        if (nonEmpty.isEmpty()) {
            throw new NoCategoriesFoundException(column);
        }

        TreeMap<String, Long> counts = new TreeMap<>();
        TreeMap<String, Double> raw = new TreeMap<>();
        long sum = 0;
        for (Map.Entry<String, Long> entry : nonEmpty.entrySet()) {
            long population = entry.getValue();
            double share = (double) requested * population / total;
            long count = Math.min(Math.round(share), population);
            raw.put(entry.getKey(), share);
            counts.put(entry.getKey(), count);
            sum += count;
        }

        if (sum > requested) {
            logger.debug("Rounding overshoot of {} rows, trimming", sum - requested);
        }
        while (sum > requested) {
            String trim = null;
            double worst = Double.NEGATIVE_INFINITY;
            for (Map.Entry<String, Long> entry : counts.entrySet()) {
                if (entry.getValue() == 0) {
                    continue;
                }
                double excess = entry.getValue() - raw.get(entry.getKey());
                if (excess > worst) {
                    worst = excess;
                    trim = entry.getKey();
                }
            }
            counts.merge(trim, -1L, Long::sum);
            sum--;
        }

        AllocationPlan plan = new AllocationPlan(requested, nonEmpty, counts);
        logger.debug("Allocated {} of {} rows over {} categories", plan.allocated(), requested, counts.size());
        return plan;
    }
}
