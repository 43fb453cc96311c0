package io.github.filtersql.core.exception;

/**
 * Exception thrown when a filter descriptor or a compilation context is structurally invalid.
 * <p>
 * Raised eagerly at construction time, before any SQL is produced: a blank column name, a missing
 * operator, a {@code FilterContext} built without a reference instant, and similar mistakes made
 * by the caller assembling the inputs.
 * </p>
 *
 * <p><strong>Typical causes:</strong></p>
 * <ul>
 *   <li>{@code new FilterCondition(" ", Operator.EQ, "x", null)}: column cannot be blank</li>
 *   <li>{@code new FilterCondition("status", null, "x", null)}: operator is required</li>
 *   <li>{@code FilterContext.builder().build()}: reference instant is required</li>
 * </ul>
 *
 * @see FilterValidationException
 * @since 1.0.0
 */
public class FilterDefinitionException extends RuntimeException {

    /**
     * Creates a new FilterDefinitionException with detailed message.
     *
     * @param message explanation of the construction error
     */
    public FilterDefinitionException(String message) {
        super(message);
    }

    /**
     * Creates a new FilterDefinitionException with detailed message and cause.
     *
     * @param message explanation of the failure
     * @param cause underlying exception causing this failure
     */
    public FilterDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
