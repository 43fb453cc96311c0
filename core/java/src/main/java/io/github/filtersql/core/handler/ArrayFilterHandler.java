package io.github.filtersql.core.handler;

import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.api.SemanticType;
import io.github.filtersql.core.exception.InvalidOperatorException;
import io.github.filtersql.core.sql.SqlFragment;

/**
 * Default logic for array columns, which only covers {@code isNull} and {@code notNull}.
 * The array operators are rendered by
 * {@link io.github.filtersql.core.handler.custom.ArrayOperatorHandler} once it is registered.
 */
public class ArrayFilterHandler extends TypedFilterHandler {

    public ArrayFilterHandler() {
        super(SemanticType.ARRAY);
    }

    @Override
    protected SqlFragment compile(SqlFragment lhs, FilterCondition condition, FilterContext context) {
        throw new InvalidOperatorException(condition.operator().getCode(),
                "No handler supports operator '" + condition.operator().getCode() + "' on ARRAY column '"
                        + condition.column() + "'; register ArrayOperatorHandler");
    }
}
