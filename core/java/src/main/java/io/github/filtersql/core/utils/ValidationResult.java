package io.github.filtersql.core.utils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Result of a non-throwing validation: either valid, or invalid with one or more messages.
 * <p>
 * Instances are immutable and created via {@link #success()} and {@link #failure(String...)}.
 * </p>
 *
 * <pre>{@code
 * ValidationResult result = compiler.validateFilter(condition);
 * if (!result.isValid()) {
 *     log.warning("Rejected filter: " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(List.of());

    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = Collections.unmodifiableList(errors);
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * @param errors at least one message explaining the failure
     * @return an invalid result
     * @throws IllegalArgumentException if no message is given
     */
    public static ValidationResult failure(String... errors) {
        return failure(Arrays.asList(errors));
    }

    public static ValidationResult failure(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("A failed validation needs at least one error message");
        }
        return new ValidationResult(List.copyOf(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * @return all messages joined with {@code "; "}, or {@code null} if valid
     */
    public String getErrorMessage() {
        return isValid() ? null : String.join("; ", errors);
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, errors=" + errors + "]";
    }
}
