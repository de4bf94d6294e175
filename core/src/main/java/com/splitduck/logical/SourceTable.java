package com.splitduck.logical;

import com.splitduck.generator.SQLGenerator;

import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteIdentifier;

/**
 * Leaf view over a table registered in the row store.
 *
 * <p>The row store numbers rows into the order column when it loads the
 * table, so row identity is the 0-based ordinal in load order and does not
 * depend on the engine's {@code rowid}, which a data column of that name
 * would hide.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT * FROM "table"
 * </pre>
 */
public final class SourceTable extends LogicalPlan {

    private final String tableName;

    public SourceTable(String tableName) {
        super();
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
    }

    public String tableName() {
        return tableName;
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        return "SELECT * FROM " + quoteIdentifier(tableName);
    }

    @Override
    protected String describe() {
        return "SourceTable(" + tableName + ")";
    }
}
