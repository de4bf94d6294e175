package com.splitduck.sampling;

import com.splitduck.logical.HashOrder;
import com.splitduck.logical.LogicalPlan;
import com.splitduck.logical.MappingTableJoin;
import com.splitduck.logical.PermutationJoin;
import com.splitduck.logical.RandomOrder;
import com.splitduck.rowstore.RowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Shuffles a view, choosing the technique from the row count.
 *
 * <p>Seeded shuffles go through one of three tiers (see {@link ShuffleTier}):
 * <ul>
 *   <li>A, direct join: the permutation is built in memory and joined
 *       inline as a VALUES list</li>
 *   <li>B, mapping table: the same permutation is stored in a temporary
 *       table in bounded batches, then joined</li>
 *   <li>C, hash order: no permutation is built; rows are ordered by a hash
 *       of their position and the seed. Reproducible, but not a uniformly
 *       random permutation.</li>
 * </ul>
 * Unseeded shuffles bypass the tiers and use the engine's own
 * {@code random()} ordering.
 *
 * <p>Only tier B touches the row store during planning; the mapping table
 * it creates lives until the row store is closed.
 */
public class TieredShuffleStrategy {

    private static final Logger logger = LoggerFactory.getLogger(TieredShuffleStrategy.class);

    private final RowStore rowStore;
    private final ShuffleConfig config;

    public TieredShuffleStrategy(RowStore rowStore, ShuffleConfig config) {
        this.rowStore = Objects.requireNonNull(rowStore, "rowStore must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Returns a view holding the rows of {@code view} in shuffled order.
     *
     * @param view the view to shuffle
     * @param n number of rows in the view
     * @param seed the seed, or empty for a nondeterministic shuffle
     * @return the shuffled view; {@code view} itself when {@code n <= 1}
     */
    public LogicalPlan shuffle(LogicalPlan view, long n, OptionalLong seed) {
        Objects.requireNonNull(view, "view must not be null");
        Objects.requireNonNull(seed, "seed must not be null");
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative, got: " + n);
        }
        if (n <= 1) {
            return view;
        }
        if (seed.isEmpty()) {
            logger.debug("Unseeded shuffle of {} rows", n);
            return new RandomOrder(view);
        }

        long s = seed.getAsLong();
        ShuffleTier tier = ShuffleTier.select(n, config);
        logger.debug("Shuffling {} rows with tier {} (seed={})", n, tier, Long.toUnsignedString(s));

        switch (tier) {
            case DIRECT_JOIN:
                return new PermutationJoin(view, IndexPermuter.permute((int) n, SeedSource.seeded(s)));
            case MAPPING_TABLE: {
                Permutation permutation = IndexPermuter.permute((int) n, SeedSource.seeded(s));
                String table = rowStore.createMappingTable(permutation, config.mappingBatchSize());
                return new MappingTableJoin(view, table, n);
            }
            case HASH_ORDER:
                logger.info("Shuffling {} rows by hash order: reproducible, not uniformly random", n);
                return new HashOrder(view, s);
            default:
                throw new IllegalStateException("Unknown shuffle tier: " + tier);
        }
    }
}
