package io.github.filtersql.core.api;

import io.github.filtersql.core.exception.FilterDefinitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable structural descriptor of one predicate: a column, an operator and an optional value.
 * <p>
 * Conditions are created by callers (filter forms, saved views, widget configurations), passed
 * by value and never mutated. The compiler turns each one into a SQL fragment.
 * </p>
 *
 * <h2>Value shapes</h2>
 * <ul>
 *   <li>{@code null} for unary operators ({@link Operator#IS_NULL}, {@link Operator#NOT_NULL})</li>
 *   <li>a {@code String}: a literal, a relative date token ({@code "__rel_date:today"}) or a
 *       comma separated {@code "start,end"} pair for range operators</li>
 *   <li>a {@code List}: a two-part range pair, or the members of an {@code in} list</li>
 * </ul>
 *
 * <h2>Validation Strategy</h2>
 * <p>
 * The canonical constructor validates structure only (column non-blank, operator present).
 * Column existence, operator/type compatibility and range-value shape are checked when the
 * condition is compiled, against the metadata of the {@link FilterContext}.
 * </p>
 *
 * <pre>{@code
 * var status = FilterCondition.of("status", Operator.EQ, "active");
 * var price  = FilterCondition.of("price", Operator.BETWEEN, List.of("10", "20"));
 * var today  = FilterCondition.of("created_at", Operator.EQ, "__rel_date:today");
 * var noMail = FilterCondition.of("email", Operator.IS_NULL, null);
 * }</pre>
 *
 * @param column   the column, aggregate expression or metric alias the predicate applies to
 * @param operator the operator
 * @param value    the operand; {@code null}, a {@code String} or a {@code List}
 * @param type     optional semantic type overriding the one inferred from column metadata
 * @since 1.0.0
 */
public record FilterCondition(
        String column,
        Operator operator,
        Object value,
        SemanticType type
) {

    public FilterCondition {
        if (column == null || column.isBlank())
            throw new FilterDefinitionException("column cannot be null nor blank");
        if (operator == null)
            throw new FilterDefinitionException("operator is required for column '" + column + "'");
        if (value instanceof List<?> list)
            value = Collections.unmodifiableList(new ArrayList<>(list));
    }

    /**
     * Creates a condition without an explicit semantic type.
     *
     * @param column   column name
     * @param operator operator
     * @param value    operand
     * @return the condition
     */
    public static FilterCondition of(String column, Operator operator, Object value) {
        return new FilterCondition(column, operator, value, null);
    }

    /**
     * Creates a condition from a raw operator string, resolving codes and aliases.
     *
     * @param column   column name
     * @param operator operator code or alias, e.g. {@code "afterOrOn"} or {@code "greaterThan"}
     * @param value    operand
     * @return the condition
     * @throws io.github.filtersql.core.exception.InvalidOperatorException if the operator is unknown
     */
    public static FilterCondition of(String column, String operator, Object value) {
        return new FilterCondition(column, Operator.fromString(operator), value, null);
    }

    /**
     * @return the value as a string, or {@code null} when the value is absent
     */
    public String valueAsString() {
        return value == null ? null : String.valueOf(value);
    }
}
