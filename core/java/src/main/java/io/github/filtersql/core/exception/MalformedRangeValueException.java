package io.github.filtersql.core.exception;

/**
 * Thrown when a range operator ({@code between}, {@code notBetween}, {@code during}) receives a
 * value that cannot be split into exactly two non-blank parts.
 *
 * @since 1.0.0
 */
public class MalformedRangeValueException extends FilterValidationException {

    public MalformedRangeValueException(String message) {
        super(message);
    }
}
