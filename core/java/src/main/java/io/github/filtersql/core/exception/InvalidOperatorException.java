package io.github.filtersql.core.exception;

/**
 * Thrown when an operator is not recognized, or is not supported for the semantic type the
 * column resolved to (for example {@code contains} on a numeric column).
 *
 * @since 1.0.0
 */
public class InvalidOperatorException extends FilterValidationException {

    private final String operator;

    public InvalidOperatorException(String operator, String message) {
        super(message);
        this.operator = operator;
    }

    /**
     * Creates the exception for an operator string that maps to no known operator.
     *
     * @param operator the raw operator string
     * @return the exception
     */
    public static InvalidOperatorException unknown(String operator) {
        return new InvalidOperatorException(operator, "Unknown operator '" + operator + "'");
    }

    public String getOperator() {
        return operator;
    }
}
