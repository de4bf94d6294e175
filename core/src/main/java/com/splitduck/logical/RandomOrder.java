package com.splitduck.logical;

import com.splitduck.generator.SQLGenerator;

import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteIdentifier;

/**
 * View reordering its child with the engine's own nondeterministic
 * {@code random()}. Used for unseeded shuffles only; nothing about the
 * order is reproducible.
 *
 * <p>The order is fixed once per execution of the query. Rendering the
 * same node twice inside one statement yields two independent orders, so
 * callers that need several windows over one shuffled order must
 * materialize it first.
 */
public final class RandomOrder extends LogicalPlan {

    public RandomOrder(LogicalPlan child) {
        super(Objects.requireNonNull(child, "child must not be null"));
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        String ord = quoteIdentifier(ORDER_COLUMN);
        return String.format(
            "SELECT * EXCLUDE (%s), row_number() OVER (ORDER BY random()) - 1 AS %s FROM (%s) AS %s",
            ord, ord, generator.generate(child()), generator.generateSubqueryAlias());
    }

    @Override
    protected String describe() {
        return "RandomOrder";
    }
}
