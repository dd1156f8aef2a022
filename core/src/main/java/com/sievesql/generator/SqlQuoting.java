package com.sievesql.generator;

/**
 * Utilities for quoting SQL identifiers and string literals.
 *
 * <p>Every name and string value in the generated SQL goes through this
 * class. A value containing a NUL character cannot be represented by any
 * supported backend and is rejected.
 *
 * <p>Example usage:
 * <pre>
 *   String name = SqlQuoting.quoteName("school");
 *   // Result: "school"
 *
 *   String value = SqlQuoting.quoteLiteral("O'Reilly");
 *   // Result: 'O''Reilly'
 * </pre>
 *
 * @see Serializer
 */
public final class SqlQuoting {

    private SqlQuoting() {
    }

    /**
     * Quotes an identifier (schema, table, column or alias name).
     *
     * <p>Uses double quotes and escapes internal quotes by doubling them.
     *
     * @param name the identifier to quote
     * @return the quoted identifier
     * @throws IllegalArgumentException if the name is null, empty or
     *         contains a NUL character
     */
    public static String quoteName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        checkNul(name);
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes a string literal.
     *
     * <p>Uses single quotes and escapes internal quotes by doubling them.
     *
     * @param value the string value to quote
     * @return the quoted literal
     * @throws IllegalArgumentException if the value is null or contains a
     *         NUL character
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Literal cannot be null");
        }
        checkNul(value);
        return "'" + value.replace("'", "''") + "'";
    }

    private static void checkNul(String value) {
        if (value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("NUL character is not allowed in SQL text");
        }
    }
}
