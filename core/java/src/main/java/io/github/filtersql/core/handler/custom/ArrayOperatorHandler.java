package io.github.filtersql.core.handler.custom;

import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.api.Operator;
import io.github.filtersql.core.exception.InvalidFilterValueException;
import io.github.filtersql.core.handler.FilterHandler;
import io.github.filtersql.core.sql.SqlFragment;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Custom handler for PostgreSQL array operators.
 *
 * <pre>{@code
 * "tags" @> ARRAY['a', 'b']   -- arrayContains
 * "tags" <@ ARRAY['a', 'b']   -- arrayContainedBy
 * "tags" && ARRAY['a', 'b']   -- overlaps
 * }</pre>
 *
 * The value is a list or a comma separated string. Register it to enable array filtering:
 * <pre>{@code
 * FilterHandlerRegistry.builder().register(new ArrayOperatorHandler()).build();
 * }</pre>
 */
public class ArrayOperatorHandler implements FilterHandler {

    private static final Set<Operator> ARRAY_OPERATORS =
            EnumSet.of(Operator.ARRAY_CONTAINS, Operator.ARRAY_CONTAINED_BY, Operator.OVERLAPS);

    @Override
    public boolean canHandle(FilterCondition condition, FilterContext context) {
        return ARRAY_OPERATORS.contains(condition.operator());
    }

    @Override
    public SqlFragment process(FilterCondition condition, FilterContext context) {
        List<String> elements = elements(condition);
        return SqlFragment.builder(context.getEscapeStrategy())
                .identifier(condition.column())
                .sql(" " + condition.operator().getSymbol() + " ARRAY[")
                .values(elements)
                .sql("]")
                .build();
    }

    private static List<String> elements(FilterCondition condition) {
        List<String> elements = new ArrayList<>();
        if (condition.value() instanceof List<?> list) {
            list.stream().filter(item -> item != null).forEach(item -> elements.add(String.valueOf(item).trim()));
        } else if (condition.value() != null) {
            for (String part : condition.valueAsString().split(",")) {
                if (!part.isBlank()) elements.add(part.trim());
            }
        }
        if (elements.isEmpty()) {
            throw new InvalidFilterValueException(
                    "Operator '" + condition.operator().getCode() + "' on column '" + condition.column()
                            + "' requires at least one element");
        }
        return elements;
    }
}
