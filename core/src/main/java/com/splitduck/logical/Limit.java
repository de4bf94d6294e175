package com.splitduck.logical;

import com.splitduck.generator.SQLGenerator;

import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteIdentifier;

/**
 * View selecting a window of consecutive rows of its child, in the child's
 * row order.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT * FROM (child) AS s ORDER BY "__sd_ord" LIMIT count OFFSET offset
 * </pre>
 */
public final class Limit extends LogicalPlan {

    private final long offset;
    private final long count;

    /**
     * Creates a limit node.
     *
     * @param child the child view
     * @param offset number of leading rows to skip
     * @param count maximum number of rows to keep
     * @throws IllegalArgumentException if offset or count is negative
     */
    public Limit(LogicalPlan child, long offset, long count) {
        super(Objects.requireNonNull(child, "child must not be null"));
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative, got: " + offset);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got: " + count);
        }
        this.offset = offset;
        this.count = count;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public long offset() {
        return offset;
    }

    public long count() {
        return count;
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        String childSQL = generator.generate(child());
        return String.format("SELECT * FROM (%s) AS %s ORDER BY %s LIMIT %d OFFSET %d",
            childSQL, generator.generateSubqueryAlias(), quoteIdentifier(ORDER_COLUMN), count, offset);
    }

    @Override
    protected String describe() {
        return String.format("Limit(offset=%d, count=%d)", offset, count);
    }
}
