package com.splitduck.logical;

import com.splitduck.generator.SQLGenerator;

import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteIdentifier;
import static com.splitduck.generator.SQLQuoting.quoteLiteral;

/**
 * View keeping the rows of its child that satisfy a condition. Row
 * positions are inherited from the child unchanged.
 *
 * <p>Category comparison is done on the column's string form, the same
 * form in which category keys are reported by the row store, so numeric,
 * boolean and string columns are all matched the same way.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT * FROM (child) AS s WHERE CAST("col" AS VARCHAR) = 'key'
 *   SELECT * FROM (child) AS s WHERE "col" IS NOT NULL
 * </pre>
 */
public final class Filter extends LogicalPlan {

    /**
     * Condition applied by a filter.
     */
    public sealed interface Condition permits CategoryEquals, IsNotNull {
        String toSQL();
    }

    /** Matches rows whose column, as a string, equals the category key. */
    public record CategoryEquals(String column, String key) implements Condition {
        public CategoryEquals {
            Objects.requireNonNull(column, "column must not be null");
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public String toSQL() {
            return String.format("CAST(%s AS VARCHAR) = %s", quoteIdentifier(column), quoteLiteral(key));
        }
    }

    /** Matches rows whose column is not null. */
    public record IsNotNull(String column) implements Condition {
        public IsNotNull {
            Objects.requireNonNull(column, "column must not be null");
        }

        @Override
        public String toSQL() {
            return quoteIdentifier(column) + " IS NOT NULL";
        }
    }

    private final Condition condition;

    public Filter(LogicalPlan child, Condition condition) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public static Filter categoryEquals(LogicalPlan child, String column, String key) {
        return new Filter(child, new CategoryEquals(column, key));
    }

    public static Filter isNotNull(LogicalPlan child, String column) {
        return new Filter(child, new IsNotNull(column));
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public Condition condition() {
        return condition;
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        String childSQL = generator.generate(child());
        return String.format("SELECT * FROM (%s) AS %s WHERE %s",
            childSQL, generator.generateSubqueryAlias(), condition.toSQL());
    }

    @Override
    protected String describe() {
        return "Filter(" + condition.toSQL() + ")";
    }
}
