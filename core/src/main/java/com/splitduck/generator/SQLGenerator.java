package com.splitduck.generator;

import com.splitduck.logical.LogicalPlan;

import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteIdentifier;

/**
 * Renders logical plan trees into DuckDB SQL.
 *
 * <p>Each node renders itself through {@link LogicalPlan#toSQL(SQLGenerator)};
 * the generator supplies unique subquery aliases and the statements that
 * wrap a plan for counting and for output. A generator instance is cheap
 * and single-use per statement.
 *
 * <p>Every plan carries the hidden {@link LogicalPlan#ORDER_COLUMN}. Output
 * queries project it away and order by it, which makes the written row
 * order independent of the engine's thread count.
 */
public class SQLGenerator {

    private int aliasCounter = 0;

    /**
     * Generates the SQL for a plan.
     *
     * @param plan the plan to render
     * @return the SQL query text
     */
    public String generate(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        return plan.toSQL(this);
    }

    /**
     * Returns a fresh subquery alias.
     *
     * @return alias unique within this generator
     */
    public String generateSubqueryAlias() {
        return "subquery_" + (aliasCounter++);
    }

    /**
     * Generates a row count query for a plan.
     *
     * @param plan the plan to count
     * @return {@code SELECT COUNT(*)} over the plan
     */
    public String generateCount(LogicalPlan plan) {
        String childSQL = generate(plan);
        return String.format("SELECT COUNT(*) FROM (%s) AS %s", childSQL, generateSubqueryAlias());
    }

    /**
     * Generates the user-visible query for a plan: every data column, in
     * the plan's row order, without the hidden ordering column.
     *
     * @param plan the plan to output
     * @return the output query
     */
    public String generateOutput(LogicalPlan plan) {
        String childSQL = generate(plan);
        String ord = quoteIdentifier(LogicalPlan.ORDER_COLUMN);
        return String.format("SELECT * EXCLUDE (%s) FROM (%s) AS %s ORDER BY %s",
            ord, childSQL, generateSubqueryAlias(), ord);
    }
}
