package io.github.filtersql.core.handler;

import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.api.SemanticType;
import io.github.filtersql.core.exception.InvalidFilterValueException;
import io.github.filtersql.core.sql.SqlFragment;

import java.math.BigDecimal;
import java.util.List;

/**
 * Default logic for numeric columns. Every operand is parsed into a {@link BigDecimal} before
 * it reaches the SQL, so a non-numeric value never becomes part of the statement.
 */
public class NumericFilterHandler extends TypedFilterHandler {

    // PostgreSQL numeric limits
    static final int MAX_INTEGER_DIGITS = 131072;
    static final int MAX_FRACTION_DIGITS = 16383;

    public NumericFilterHandler() {
        super(SemanticType.NUMERIC);
    }

    @Override
    protected SqlFragment compile(SqlFragment lhs, FilterCondition condition, FilterContext context) {
        return switch (condition.operator()) {
            case EQ, NEQ, GT, GTE, LT, LTE -> builder(lhs, context)
                    .sql(" " + condition.operator().getSymbol() + " ")
                    .value(toNumber(condition.value(), condition.column()))
                    .build();
            case BETWEEN, NOT_BETWEEN -> {
                List<String> bounds = rangeBounds(condition);
                yield builder(lhs, context)
                        .sql(" " + condition.operator().getSymbol() + " ")
                        .value(toNumber(bounds.get(0), condition.column()))
                        .sql(" AND ")
                        .value(toNumber(bounds.get(1), condition.column()))
                        .build();
            }
            case IN, NOT_IN -> builder(lhs, context)
                    .sql(" " + condition.operator().getSymbol() + " (")
                    .values(listValues(condition).stream().map(v -> toNumber(v, condition.column())).toList())
                    .sql(")")
                    .build();
            default -> throw unsupported(condition, getType());
        };
    }

    /**
     * Converts an operand into a {@link BigDecimal}.
     *
     * @param value  a {@link Number} or its string form
     * @param column column name, for the error message
     * @return the number
     * @throws InvalidFilterValueException if the value is not numeric or exceeds the digits a SQL
     *                                     {@code numeric} can hold
     */
    public static BigDecimal toNumber(Object value, String column) {
        BigDecimal number;
        if (value instanceof BigDecimal decimal) {
            number = decimal;
        } else {
            try {
                number = new BigDecimal(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                throw new InvalidFilterValueException(
                        "Invalid numeric value '" + value + "' for column '" + column + "'", e);
            }
        }
        if ((long) number.precision() - number.scale() > MAX_INTEGER_DIGITS || number.scale() > MAX_FRACTION_DIGITS) {
            throw new InvalidFilterValueException(
                    "Numeric value '" + value + "' for column '" + column + "' is out of range");
        }
        return number;
    }
}
