package com.splitduck.logical;

import com.splitduck.generator.SQLGenerator;

import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteIdentifier;
import static com.splitduck.generator.SQLQuoting.validateIdentifier;

/**
 * View reordering its child through a permutation stored in a temporary
 * mapping table with columns {@code (old_pos BIGINT, new_pos BIGINT)}.
 *
 * <p>The table is created and filled by the row store in bounded batches
 * and dropped when the row store closes. Apart from where the pairs live,
 * the rendered query is the same as {@link PermutationJoin}'s.
 */
public final class MappingTableJoin extends LogicalPlan {

    private final String mappingTable;
    private final long rowCount;

    /**
     * Creates a mapping table join.
     *
     * @param child the view to reorder
     * @param mappingTable name of the temporary mapping table
     * @param rowCount number of rows of the child, and of pairs in the table
     */
    public MappingTableJoin(LogicalPlan child, String mappingTable, long rowCount) {
        super(Objects.requireNonNull(child, "child must not be null"));
        validateIdentifier(mappingTable);
        this.mappingTable = mappingTable;
        this.rowCount = rowCount;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public String mappingTable() {
        return mappingTable;
    }

    public long rowCount() {
        return rowCount;
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        String relation = String.format("(SELECT old_pos, new_pos FROM %s)", quoteIdentifier(mappingTable));
        return PermutationJoin.renderJoin(generator, child(), relation);
    }

    @Override
    protected String describe() {
        return "MappingTableJoin(table=" + mappingTable + ", rows=" + rowCount + ")";
    }
}
