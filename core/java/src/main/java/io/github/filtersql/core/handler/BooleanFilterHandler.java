package io.github.filtersql.core.handler;

import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.api.SemanticType;
import io.github.filtersql.core.exception.InvalidFilterValueException;
import io.github.filtersql.core.sql.SqlFragment;

/**
 * Default logic for boolean columns: {@code eq}/{@code neq} against {@code TRUE} or {@code FALSE}.
 * Only {@code true} and {@code false} (any case) are accepted.
 */
public class BooleanFilterHandler extends TypedFilterHandler {

    public BooleanFilterHandler() {
        super(SemanticType.BOOLEAN);
    }

    @Override
    protected SqlFragment compile(SqlFragment lhs, FilterCondition condition, FilterContext context) {
        return switch (condition.operator()) {
            case EQ, NEQ -> builder(lhs, context)
                    .sql(" " + condition.operator().getSymbol() + " ")
                    .value(toBoolean(condition))
                    .build();
            default -> throw unsupported(condition, getType());
        };
    }

    private static Boolean toBoolean(FilterCondition condition) {
        if (condition.value() instanceof Boolean bool) {
            return bool;
        }
        String text = condition.valueAsString().trim();
        if ("true".equalsIgnoreCase(text)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(text)) return Boolean.FALSE;
        throw new InvalidFilterValueException(
                "Invalid boolean value '" + text + "' for column '" + condition.column() + "'");
    }
}
