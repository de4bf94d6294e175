package com.splitduck.exception;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when a column cannot be resolved against a dataset schema.
 *
 * <p>The message always enumerates the columns that are available so the
 * user can correct the name.
 */
public class ColumnNotFoundException extends SplitDuckException {

    private final String column;
    private final List<String> availableColumns;

    /**
     * Creates a column-not-found exception.
     *
     * @param column the name that failed to resolve
     * @param availableColumns the columns of the dataset
     */
    public ColumnNotFoundException(String column, List<String> availableColumns) {
        super(String.format("Column '%s' not found. Available columns: %s",
            column, availableColumns));
        this.column = column;
        this.availableColumns = List.copyOf(Objects.requireNonNull(availableColumns,
            "availableColumns must not be null"));
    }

    public String getColumn() {
        return column;
    }

    public List<String> getAvailableColumns() {
        return availableColumns;
    }

    @Override
    public String kind() {
        return "Column not found";
    }
}
