package io.github.filtersql.core.exception;

/**
 * Base exception for every fatal error raised while compiling filter conditions into SQL.
 * <p>
 * Compilation is all-or-nothing: when one of these is thrown out of
 * {@code FilterConditionCompiler#buildWhere}, no clause is returned and no condition has been
 * silently dropped. Callers that only care about "the filter was rejected" can catch this type;
 * callers that want to tailor the user-facing message can catch a subclass:
 * </p>
 * <ul>
 *   <li>{@link ColumnNotFoundException}: the column is absent from the table metadata</li>
 *   <li>{@link InvalidOperatorException}: the operator is unknown or unsupported for the column type</li>
 *   <li>{@link MalformedRangeValueException}: a range operator did not receive exactly two parts</li>
 *   <li>{@link InvalidFilterValueException}: the value cannot be interpreted for the column type</li>
 * </ul>
 *
 * <p><strong>Handling example:</strong></p>
 * <pre>{@code
 * try {
 *     String where = compiler.buildWhere(conditions);
 * } catch (ColumnNotFoundException e) {
 *     return ResponseEntity.badRequest().body("Unknown column: " + e.getColumn());
 * } catch (FilterValidationException e) {
 *     return ResponseEntity.badRequest().body("Invalid filter: " + e.getMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class FilterValidationException extends RuntimeException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the cause of the exception, should be specific and actionable
     */
    public FilterValidationException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and an underlying cause.
     * <p>
     * Used when validation fails because of a lower level parsing error, such as a
     * {@link java.time.format.DateTimeParseException} or a {@link NumberFormatException}.
     * </p>
     *
     * @param message the description of the cause of the exception
     * @param cause   the original cause of the exception
     */
    public FilterValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
