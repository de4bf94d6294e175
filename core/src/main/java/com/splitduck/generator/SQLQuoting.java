package com.splitduck.generator;

/**
 * Utilities for safely quoting SQL identifiers and literals.
 *
 * <p>Column names, category values and file paths all come from user input
 * or user data, so every one of them goes through this class before being
 * placed in generated SQL.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("species");      // "species"
 *   SQLQuoting.quoteLiteral("O'Reilly");        // 'O''Reilly'
 *   SQLQuoting.quoteFilePath("/data/x.parquet") // '/data/x.parquet'
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    private SQLQuoting() {}

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * <p>Uses double quotes and escapes internal quotes according to SQL standard.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        String escaped = identifier.replace("\"", "\"\"");
        return "\"" + escaped + "\"";
    }

    /**
     * Quotes a string literal value.
     *
     * <p>Returns NULL (without quotes) if the value is null.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL, or NULL if value is null
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }

        String escaped = value.replace("'", "''");
        return "'" + escaped + "'";
    }

    /**
     * Quotes a file path for COPY and read_* statements.
     *
     * <p>Rejects paths containing statement separators or comment markers.
     *
     * @param path the file path to quote
     * @return quoted path safe for SQL
     * @throws IllegalArgumentException if path is null, empty, or contains
     *         suspicious characters
     */
    public static String quoteFilePath(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("File path cannot be null or empty");
        }

        if (path.contains(";") || path.contains("--") ||
            path.contains("/*") || path.contains("*/")) {
            throw new IllegalArgumentException(
                "Invalid characters in file path (possible SQL injection): " + path);
        }

        String escaped = path.replace("'", "''");
        return "'" + escaped + "'";
    }

    /**
     * Validates that a generated name (temporary table, internal column) is
     * a plain identifier.
     *
     * @param identifier the identifier to validate
     * @throws IllegalArgumentException if identifier is null, empty, or
     *         contains characters other than letters, digits and underscores
     */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        if (!identifier.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
            throw new IllegalArgumentException(
                "Invalid identifier (must start with letter/underscore, " +
                "contain only alphanumeric/underscore): " + identifier);
        }
    }
}
