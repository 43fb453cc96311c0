package io.github.filtersql.core.handler;

import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.api.SemanticType;
import io.github.filtersql.core.sql.SqlFragment;
import io.github.filtersql.core.sql.SqlQuoting;

/**
 * Default logic for text columns: exact match, case-insensitive pattern match and membership.
 * <p>
 * Pattern operators escape {@code %}, {@code _} and {@code \} in the user value before adding
 * their own wildcards, so {@code contains "50%"} matches the literal text {@code 50%}.
 * </p>
 */
public class TextFilterHandler extends TypedFilterHandler {

    public TextFilterHandler() {
        super(SemanticType.TEXT);
    }

    @Override
    protected SqlFragment compile(SqlFragment lhs, FilterCondition condition, FilterContext context) {
        String value = condition.valueAsString();
        return switch (condition.operator()) {
            case EQ, NEQ -> builder(lhs, context)
                    .sql(" " + condition.operator().getSymbol() + " ").value(value)
                    .build();
            case CONTAINS -> like(lhs, "%" + SqlQuoting.escapeLikePattern(value) + "%", context);
            case STARTS_WITH -> like(lhs, SqlQuoting.escapeLikePattern(value) + "%", context);
            case ENDS_WITH -> like(lhs, "%" + SqlQuoting.escapeLikePattern(value), context);
            case IN, NOT_IN -> builder(lhs, context)
                    .sql(" " + condition.operator().getSymbol() + " (").values(listValues(condition)).sql(")")
                    .build();
            default -> throw unsupported(condition, getType());
        };
    }

    private static SqlFragment like(SqlFragment lhs, String pattern, FilterContext context) {
        return builder(lhs, context).sql(" ILIKE ").value(pattern).build();
    }
}
