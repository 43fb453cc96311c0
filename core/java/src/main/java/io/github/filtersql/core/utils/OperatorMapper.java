package io.github.filtersql.core.utils;

import io.github.filtersql.core.api.Operator;
import io.github.filtersql.core.api.SemanticType;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps semantic operators to their canonical comparison and classifies range operators.
 * <p>
 * The date picker offers human friendly operators ({@code before}, {@code afterOrOn},
 * {@code during}); the compiler reduces them to plain comparisons before emitting SQL:
 * </p>
 * <table border="1">
 * <caption>Date operator mapping</caption>
 * <tr><th>Semantic</th><th>Canonical</th></tr>
 * <tr><td>before</td><td>lt</td></tr>
 * <tr><td>beforeOrOn</td><td>lte</td></tr>
 * <tr><td>after</td><td>gt</td></tr>
 * <tr><td>afterOrOn</td><td>gte</td></tr>
 * <tr><td>during</td><td>eq (range-expanded)</td></tr>
 * </table>
 * <p>Every other operator maps to itself.</p>
 *
 * @since 1.0.0
 */
public final class OperatorMapper {

    /** Operators whose value denotes an inclusive two-bound range. */
    public static final Set<Operator> RANGE_OPERATORS =
            Set.copyOf(EnumSet.of(Operator.BETWEEN, Operator.NOT_BETWEEN, Operator.DURING));

    /** Operators whose semantics only exist for date columns. */
    public static final Set<Operator> DATE_OPERATORS = Set.copyOf(EnumSet.of(
            Operator.BEFORE, Operator.BEFORE_OR_ON, Operator.AFTER, Operator.AFTER_OR_ON, Operator.DURING));

    private OperatorMapper() {
    }

    /**
     * @param operator any operator
     * @return the canonical comparison for date operators, the operator itself otherwise
     */
    public static Operator mapDateOperator(Operator operator) {
        return switch (operator) {
            case BEFORE -> Operator.LT;
            case BEFORE_OR_ON -> Operator.LTE;
            case AFTER -> Operator.GT;
            case AFTER_OR_ON -> Operator.GTE;
            case DURING -> Operator.EQ;
            default -> operator;
        };
    }

    /**
     * String form of {@link #mapDateOperator(Operator)} working on wire codes.
     * Unrecognized codes pass through unchanged.
     *
     * @param code operator code, e.g. {@code "afterOrOn"}
     * @return the canonical code, e.g. {@code "gte"}
     */
    public static String mapDateOperator(String code) {
        return Operator.find(code)
                .filter(DATE_OPERATORS::contains)
                .map(op -> mapDateOperator(op).getCode())
                .orElse(code);
    }

    public static boolean isRangeOperator(Operator operator) {
        return RANGE_OPERATORS.contains(operator);
    }

    /**
     * @param code operator code
     * @return {@code true} exactly for {@code between}, {@code notBetween} and {@code during}
     */
    public static boolean isRangeOperator(String code) {
        return Operator.find(code).map(RANGE_OPERATORS::contains).orElse(false);
    }

    public static boolean isDateOperator(Operator operator) {
        return DATE_OPERATORS.contains(operator);
    }

    /**
     * Lists the operators applicable to a semantic type, in declaration order.
     *
     * @param type semantic type
     * @return operator codes
     */
    public static Set<String> operatorsFor(SemanticType type) {
        return Arrays.stream(Operator.values())
                .filter(op -> op.supports(type))
                .map(Operator::getCode)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
