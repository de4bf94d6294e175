package com.splitduck.logical;

import com.splitduck.generator.SQLGenerator;

import java.util.List;
import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteIdentifier;

/**
 * View concatenating several views with the same schema (UNION ALL).
 *
 * <p>The result is ordered segment by segment: all rows of the first input
 * in its order, then all rows of the second, and so on. Row positions are
 * renumbered from 0 to reflect that order. Duplicated rows are kept.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT * EXCLUDE ("__sd_seg", "__sd_ord"),
 *          row_number() OVER (ORDER BY "__sd_seg", "__sd_ord") - 1 AS "__sd_ord"
 *   FROM (SELECT *, 0 AS "__sd_seg" FROM (c0) AS s0
 *         UNION ALL BY NAME
 *         SELECT *, 1 AS "__sd_seg" FROM (c1) AS s1) AS u
 * </pre>
 */
public final class Union extends LogicalPlan {

    static final String SEGMENT_COLUMN = "__sd_seg";

    private Union(List<LogicalPlan> inputs) {
        super(inputs);
    }

    /**
     * Combines a list of views once, in list order.
     *
     * @param inputs the views to concatenate, at least one
     * @return the single input itself when there is only one, otherwise a union
     * @throws IllegalArgumentException if inputs is empty
     */
    public static LogicalPlan of(List<LogicalPlan> inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("Union requires at least one input");
        }
        if (inputs.size() == 1) {
            return inputs.get(0);
        }
        return new Union(inputs);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        String ord = quoteIdentifier(ORDER_COLUMN);
        String seg = quoteIdentifier(SEGMENT_COLUMN);

        StringBuilder body = new StringBuilder();
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                body.append(" UNION ALL BY NAME ");
            }
            body.append(String.format("SELECT *, %d AS %s FROM (%s) AS %s",
                i, seg, generator.generate(children.get(i)), generator.generateSubqueryAlias()));
        }

        return String.format(
            "SELECT * EXCLUDE (%s, %s), row_number() OVER (ORDER BY %s, %s) - 1 AS %s FROM (%s) AS %s",
            seg, ord, seg, ord, ord, body, generator.generateSubqueryAlias());
    }

    @Override
    protected String describe() {
        return "Union(inputs=" + children.size() + ")";
    }
}
