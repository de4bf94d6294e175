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
 * Splits a view into K parts by ratio.
 *
 * <p>Plain split: the view is shuffled once and cut into consecutive
 * windows sized by {@link SplitSpec#sizesFor(long)}.
 *
 * <p>Stratified split: every category of the column is shuffled on its own,
 * with a seed derived from the command seed and the category key, and cut
 * into windows the same way; windows with the same index are then unioned
 * across categories. Rows whose category is null belong to no category and
 * are left out of every part.
 *
 * <p>Every shuffled order is materialized before it is cut, so all windows
 * read the same order. Parts that end up with no rows are still returned,
 * as empty views with the source schema.
 */
public class Partitioner {

    private static final Logger logger = LoggerFactory.getLogger(Partitioner.class);

    private final RowStore rowStore;
    private final TieredShuffleStrategy shuffler;

    public Partitioner(RowStore rowStore, TieredShuffleStrategy shuffler) {
        this.rowStore = Objects.requireNonNull(rowStore, "rowStore must not be null");
        this.shuffler = Objects.requireNonNull(shuffler, "shuffler must not be null");
    }

    /**
     * Splits a view.
     *
     * @param view the view to split
     * @param spec the ratios and destinations
     * @param stratifyBy the stratification column, or null for a plain split
     * @param seed the seed for every random decision, or empty
     * @return one part per spec entry, in spec order
     * @throws com.splitduck.exception.ColumnNotFoundException if the
     *         stratification column does not exist
     * @throws NoCategoriesFoundException if the stratification column has
     *         no non-null values
     */
    public List<SplitPart> split(LogicalPlan view, SplitSpec spec, String stratifyBy, OptionalLong seed) {
        Objects.requireNonNull(view, "view must not be null");
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(seed, "seed must not be null");

        List<List<LogicalPlan>> pieces = new ArrayList<>(spec.size());
        long[] rowCounts = new long[spec.size()];
        for (int i = 0; i < spec.size(); i++) {
            pieces.add(new ArrayList<>());
        }

        long total = rowStore.count(view);
        if (stratifyBy == null) {
            logger.debug("Splitting {} rows into {} parts", total, spec.size());
            cut(view, total, spec, seed, pieces, rowCounts);
        } else {
            String column = rowStore.resolveColumn(view, stratifyBy);
            SortedMap<String, Long> populations = rowStore.categoryCounts(view, column);
            if (populations.isEmpty()) {
                throw new NoCategoriesFoundException(column);
            }

            long categorized = 0;
            for (long population : populations.values()) {
                categorized += population;
            }
            if (categorized < total) {
                logger.warn("{} rows with a null '{}' are excluded from the stratified split",
                    total - categorized, column);
            }
            logger.debug("Stratified split by '{}' over {} categories", column, populations.size());

            for (Map.Entry<String, Long> category : populations.entrySet()) {
                LogicalPlan rows = Filter.categoryEquals(view, column, category.getKey());
                cut(rows, category.getValue(), spec, SeedSource.derive(seed, category.getKey()), pieces, rowCounts);
            }
        }

        List<SplitPart> parts = new ArrayList<>(spec.size());
        for (int i = 0; i < spec.size(); i++) {
            SplitSpec.Entry entry = spec.entries().get(i);
            LogicalPlan partView;
            if (pieces.get(i).isEmpty()) {
                logger.warn("Split {} is empty -> {}", i + 1, entry.destination());
                partView = new Limit(view, 0, 0);
            } else {
                partView = Union.of(pieces.get(i));
            }
            parts.add(new SplitPart(i, entry.destination(), partView, rowCounts[i]));
        }
        return parts;
    }

    /**
     * Shuffles one group of rows and appends its windows to the pieces of
     * each part.
     */
    private void cut(LogicalPlan rows, long count, SplitSpec spec, OptionalLong seed,
                     List<List<LogicalPlan>> pieces, long[] rowCounts) {
        if (count == 0) {
            return;
        }
        LogicalPlan shuffled = shuffler.shuffle(rows, count, seed);
        if (shuffled != rows) {
            shuffled = rowStore.materialize(shuffled);
        }

        long[] sizes = spec.sizesFor(count);
        long offset = 0;
        for (int i = 0; i < sizes.length; i++) {
            if (sizes[i] > 0) {
                pieces.get(i).add(new Limit(shuffled, offset, sizes[i]));
                rowCounts[i] += sizes[i];
            }
            offset += sizes[i];
        }
    }
}
