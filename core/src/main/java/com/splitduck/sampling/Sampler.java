package com.splitduck.sampling;

import com.splitduck.exception.NoCategoriesFoundException;
import com.splitduck.logical.Filter;
import com.splitduck.logical.Limit;
import com.splitduck.logical.LogicalPlan;
import com.splitduck.logical.Union;
import com.splitduck.rowstore.RowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.SortedMap;

/**
 * Draws samples of a view.
 *
 * <p>Methods:
 * <ul>
 *   <li>{@code random}: shuffle the whole view, keep the first {@code n} rows</li>
 *   <li>{@code first} / {@code last}: leading or trailing {@code n} rows in
 *       source order; no randomness involved</li>
 *   <li>{@code stratified}: allocate {@code n} across the categories of a
 *       column, take the first allocated rows of each category in source
 *       order, then fill any remainder with a random sample of the whole
 *       view</li>
 * </ul>
 *
 * <p>Asking for at least as many rows as the view holds returns the view
 * unchanged, for every method.
 *
 * <p>The stratified remainder is drawn from every row of the view, including
 * rows already taken for a category, so a row can appear twice in the
 * result. Rows inside a category are not shuffled, even with a seed.
 */
public class Sampler {

    private static final Logger logger = LoggerFactory.getLogger(Sampler.class);

    private final RowStore rowStore;
    private final TieredShuffleStrategy shuffler;

    public Sampler(RowStore rowStore, TieredShuffleStrategy shuffler) {
        this.rowStore = Objects.requireNonNull(rowStore, "rowStore must not be null");
        this.shuffler = Objects.requireNonNull(shuffler, "shuffler must not be null");
    }

    /**
     * Samples {@code n} rows of a view.
     *
     * @param view the view to sample
     * @param n the requested number of rows
     * @param method the sampling method
     * @param seed the seed for every random decision, or empty
     * @return a view of the sample
     * @throws com.splitduck.exception.ColumnNotFoundException if the
     *         stratification column does not exist
     * @throws NoCategoriesFoundException if the stratification column has
     *         no non-null values
     */
    public LogicalPlan sample(LogicalPlan view, long n, SampleMethod method, OptionalLong seed) {
        Objects.requireNonNull(view, "view must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(seed, "seed must not be null");
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative, got: " + n);
        }

        long total = rowStore.count(view);
        if (n >= total) {
            logger.debug("Requested {} rows of {}, returning all rows", n, total);
            return view;
        }

        if (method instanceof SampleMethod.First) {
            return new Limit(view, 0, n);
        }
        if (method instanceof SampleMethod.Last) {
            return new Limit(view, Math.max(0, total - n), n);
        }
        if (method instanceof SampleMethod.Random) {
            return new Limit(shuffler.shuffle(view, total, seed), 0, n);
        }
        if (method instanceof SampleMethod.Stratified) {
            return stratified(view, total, n, ((SampleMethod.Stratified) method).column(), seed);
        }
        throw new IllegalArgumentException("Unknown sample method: " + method);
    }

    private LogicalPlan stratified(LogicalPlan view, long total, long n, String requestedColumn, OptionalLong seed) {
        String column = rowStore.resolveColumn(view, requestedColumn);
        SortedMap<String, Long> populations = rowStore.categoryCounts(view, column);
        if (populations.isEmpty()) {
            throw new NoCategoriesFoundException(column);
        }

        AllocationPlan plan = CategoryAllocator.allocate(column, populations, n);
        logger.debug("Stratified sample of {} rows by '{}': {}", n, column, plan);

        List<LogicalPlan> parts = new ArrayList<>();
        for (Map.Entry<String, Long> entry : plan.counts().entrySet()) {
            if (entry.getValue() > 0) {
                parts.add(new Limit(Filter.categoryEquals(view, column, entry.getKey()), 0, entry.getValue()));
            }
        }

        long remainder = plan.remainder();
        if (remainder > 0) {
            logger.warn("Filling {} remaining rows with a random sample of the whole dataset; "
                + "rows already selected for a category may be selected again", remainder);
            parts.add(new Limit(shuffler.shuffle(view, total, seed), 0, remainder));
        }

        if (parts.isEmpty()) {
            return new Limit(view, 0, 0);
        }
        return Union.of(parts);
    }
}
