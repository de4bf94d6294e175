package com.splitduck.logical;

import com.splitduck.generator.SQLGenerator;

import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteIdentifier;
import static com.splitduck.generator.SQLQuoting.quoteLiteral;

/**
 * View reordering its child by a deterministic hash of each row's position
 * and the seed.
 *
 * <p>This is an approximation of a shuffle for row counts too large to
 * hold a permutation in memory: the same seed always yields the same
 * order, but the order is not a uniformly random permutation. Hash
 * collisions are broken by the original position.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT * EXCLUDE ("__sd_ord"),
 *          row_number() OVER (ORDER BY hash(CAST("__sd_ord" AS VARCHAR) || ':' || 'seed'), "__sd_ord") - 1
 *            AS "__sd_ord"
 *   FROM (child) AS s
 * </pre>
 */
public final class HashOrder extends LogicalPlan {

    private final long seed;

    public HashOrder(LogicalPlan child, long seed) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.seed = seed;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public long seed() {
        return seed;
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        String ord = quoteIdentifier(ORDER_COLUMN);
        String hashKey = String.format("hash(CAST(%s AS VARCHAR) || ':' || %s)",
            ord, quoteLiteral(Long.toUnsignedString(seed)));
        return String.format(
            "SELECT * EXCLUDE (%s), row_number() OVER (ORDER BY %s, %s) - 1 AS %s FROM (%s) AS %s",
            ord, hashKey, ord, ord, generator.generate(child()), generator.generateSubqueryAlias());
    }

    @Override
    protected String describe() {
        return "HashOrder(seed=" + Long.toUnsignedString(seed) + ")";
    }
}
