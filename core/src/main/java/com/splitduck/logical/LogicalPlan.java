package com.splitduck.logical;

import com.splitduck.generator.SQLGenerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for row store views.
 *
 * <p>A view is an immutable tree of plan nodes rendered to DuckDB SQL by
 * {@link #toSQL(SQLGenerator)}. Views never hold data; the row store
 * executes them on demand.
 *
 * <p>Every view exposes the source's data columns plus the hidden
 * {@link #ORDER_COLUMN}: a BIGINT giving each row's position in the view's
 * current order. Row positions are explicit rather than implied by engine
 * scan order, because the engine only guarantees ordering for rows that
 * were numbered and sorted by an explicit key.
 *
 * @see SQLGenerator
 */
public abstract class LogicalPlan {

    /** Hidden per-row position column carried by every view. */
    public static final String ORDER_COLUMN = "__sd_ord";

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(child);
    }

    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    /**
     * Translates this plan node to DuckDB SQL.
     *
     * @param generator the SQL generator to use
     * @return the generated SQL string
     */
    public abstract String toSQL(SQLGenerator generator);

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return children;
    }

    /**
     * Returns a one-line description of the node, without its children.
     *
     * @return node description
     */
    protected abstract String describe();

    /**
     * Returns an indented tree rendering of the plan.
     *
     * @return multi-line plan description
     */
    public String explain() {
        StringBuilder sb = new StringBuilder();
        explain(sb, 0);
        return sb.toString();
    }

    private void explain(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth)).append(describe()).append('\n');
        for (LogicalPlan child : children) {
            child.explain(sb, depth + 1);
        }
    }

    @Override
    public String toString() {
        return describe();
    }
}
