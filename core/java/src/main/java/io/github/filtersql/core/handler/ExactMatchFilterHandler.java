package io.github.filtersql.core.handler;

import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.api.SemanticType;
import io.github.filtersql.core.sql.SqlFragment;

/**
 * Default logic for identifier (uuid) and enum columns: exact equality and membership only.
 */
public class ExactMatchFilterHandler extends TypedFilterHandler {

    public ExactMatchFilterHandler(SemanticType type) {
        super(type);
    }

    @Override
    protected SqlFragment compile(SqlFragment lhs, FilterCondition condition, FilterContext context) {
        return switch (condition.operator()) {
            case EQ, NEQ -> builder(lhs, context)
                    .sql(" " + condition.operator().getSymbol() + " ").value(condition.valueAsString().trim())
                    .build();
            case IN, NOT_IN -> builder(lhs, context)
                    .sql(" " + condition.operator().getSymbol() + " (").values(listValues(condition)).sql(")")
                    .build();
            default -> throw unsupported(condition, getType());
        };
    }
}
