package io.github.filtersql.core.exception;

/**
 * Signals a defect in a filter handler: it claimed a condition through
 * {@code canHandle} and then produced an empty fragment from {@code process}.
 * <p>
 * This is not a user input error and does not extend
 * {@link FilterValidationException}. Emitting the empty fragment would yield broken SQL
 * ({@code WHERE  AND ...}), so compilation is aborted instead.
 * </p>
 *
 * @since 1.0.0
 */
public class HandlerContractViolationException extends RuntimeException {

    private final String handlerName;

    public HandlerContractViolationException(String handlerName, String message) {
        super(message);
        this.handlerName = handlerName;
    }

    /**
     * @return the simple name of the offending handler
     */
    public String getHandlerName() {
        return handlerName;
    }
}
