package com.splitduck.exception;

/**
 * Thrown when a stratification column holds no non-null values, so there
 * is nothing to allocate samples or splits over.
 */
public class NoCategoriesFoundException extends SplitDuckException {

    private final String column;

    public NoCategoriesFoundException(String column) {
        super("No categories found for stratification column '" + column + "'");
        this.column = column;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public String kind() {
        return "No categories found";
    }
}
