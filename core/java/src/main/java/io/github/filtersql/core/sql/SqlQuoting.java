package io.github.filtersql.core.sql;

import io.github.filtersql.core.exception.FilterValidationException;

/**
 * Identifier and literal quoting for generated SQL.
 * <p>
 * Literals use SQL standard quote doubling. Identifiers are always double-quoted; an identifier
 * that itself contains a double quote, a NUL character or a statement terminator is rejected
 * instead of being escaped, since no legitimate column name from table metadata carries one.
 * </p>
 */
public final class SqlQuoting {

    private SqlQuoting() {
    }

    /**
     * Quotes an identifier for use in SQL.
     *
     * @param identifier column or alias name
     * @return the double-quoted identifier
     * @throws FilterValidationException if the identifier is blank or carries forbidden characters
     */
    public static String quoteIdentifier(String identifier) {
        validateIdentifier(identifier);
        return "\"" + identifier + "\"";
    }

    /**
     * Quotes a string literal, doubling embedded single quotes. {@code null} renders as {@code NULL}.
     *
     * @param value raw value
     * @return the quoted literal
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Escapes the LIKE wildcards {@code %} and {@code _} and the escape character itself, so that
     * user input is matched literally inside a pattern.
     *
     * @param value raw user input
     * @return the escaped value (not quoted)
     */
    public static String escapeLikePattern(String value) {
        return value
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    /**
     * Validates that an identifier can be safely double-quoted.
     *
     * @param identifier the identifier to check
     * @throws FilterValidationException if invalid
     */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new FilterValidationException("Identifier cannot be null or empty");
        }
        if (identifier.indexOf('"') >= 0 || identifier.indexOf('\0') >= 0 || identifier.indexOf(';') >= 0) {
            throw new FilterValidationException("Invalid characters in identifier: " + identifier);
        }
    }
}
