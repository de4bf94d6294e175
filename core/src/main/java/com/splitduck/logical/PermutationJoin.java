package com.splitduck.logical;

import com.splitduck.generator.SQLGenerator;
import com.splitduck.sampling.Permutation;

import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteIdentifier;

/**
 * View reordering its child by an explicit permutation carried inline in
 * the query as a VALUES list of {@code (old_pos, new_pos)} pairs.
 *
 * <p>The child's rows are numbered 0..n-1 in the child's order and joined
 * against the pairs; each row's new position becomes its order key. Only
 * suitable for row counts small enough that the whole mapping fits in one
 * statement.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT s.* EXCLUDE ("__sd_idx", "__sd_ord"), m.new_pos AS "__sd_ord"
 *   FROM (SELECT *, row_number() OVER (ORDER BY "__sd_ord") - 1 AS "__sd_idx"
 *         FROM (child) AS c) AS s
 *   JOIN (VALUES (3, 0), (0, 1), ...) AS m(old_pos, new_pos)
 *     ON s."__sd_idx" = m.old_pos
 * </pre>
 *
 * @see MappingTableJoin
 */
public final class PermutationJoin extends LogicalPlan {

    static final String INDEX_COLUMN = "__sd_idx";

    private final Permutation permutation;

    public PermutationJoin(LogicalPlan child, Permutation permutation) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.permutation = Objects.requireNonNull(permutation, "permutation must not be null");
        if (permutation.size() == 0) {
            throw new IllegalArgumentException("permutation must not be empty");
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public Permutation permutation() {
        return permutation;
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        StringBuilder values = new StringBuilder(permutation.size() * 12);
        for (int newPos = 0; newPos < permutation.size(); newPos++) {
            if (newPos > 0) {
                values.append(", ");
            }
            values.append('(').append(permutation.sourceOf(newPos)).append(", ").append(newPos).append(')');
        }
        return renderJoin(generator, child(), "(VALUES " + values + ")");
    }

    /**
     * Renders the numbered-child join shared by the inline and table-backed
     * permutation nodes.
     */
    static String renderJoin(SQLGenerator generator, LogicalPlan child, String mappingRelation) {
        String ord = quoteIdentifier(ORDER_COLUMN);
        String idx = quoteIdentifier(INDEX_COLUMN);
        String numbered = String.format(
            "SELECT *, row_number() OVER (ORDER BY %s) - 1 AS %s FROM (%s) AS %s",
            ord, idx, generator.generate(child), generator.generateSubqueryAlias());
        return String.format(
            "SELECT s.* EXCLUDE (%s, %s), m.new_pos AS %s FROM (%s) AS s JOIN %s AS m(old_pos, new_pos) ON s.%s = m.old_pos",
            idx, ord, ord, numbered, mappingRelation, idx);
    }

    @Override
    protected String describe() {
        return "PermutationJoin(rows=" + permutation.size() + ")";
    }
}
