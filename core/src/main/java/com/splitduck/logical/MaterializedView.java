package com.splitduck.logical;

import com.splitduck.generator.SQLGenerator;

import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteIdentifier;
import static com.splitduck.generator.SQLQuoting.validateIdentifier;

/**
 * Leaf view over a temporary table holding an already evaluated view,
 * including its order column. Reading it again always yields the same rows
 * in the same order, which a view containing {@link RandomOrder} does not.
 */
public final class MaterializedView extends LogicalPlan {

    private final String tableName;

    public MaterializedView(String tableName) {
        super();
        validateIdentifier(tableName);
        this.tableName = Objects.requireNonNull(tableName);
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
        return "MaterializedView(" + tableName + ")";
    }
}
