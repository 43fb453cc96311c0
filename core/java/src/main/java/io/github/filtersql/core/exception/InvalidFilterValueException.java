package io.github.filtersql.core.exception;

/**
 * Thrown when a filter value cannot be interpreted for the column it targets: a non numeric
 * string on a numeric column, an unparseable date literal, an unknown relative date option.
 *
 * @since 1.0.0
 */
public class InvalidFilterValueException extends FilterValidationException {

    public InvalidFilterValueException(String message) {
        super(message);
    }

    public InvalidFilterValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
