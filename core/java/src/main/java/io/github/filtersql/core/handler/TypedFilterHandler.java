package io.github.filtersql.core.handler;

import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.api.Operator;
import io.github.filtersql.core.api.SemanticType;
import io.github.filtersql.core.exception.InvalidFilterValueException;
import io.github.filtersql.core.exception.InvalidOperatorException;
import io.github.filtersql.core.exception.MalformedRangeValueException;
import io.github.filtersql.core.sql.SqlFragment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class of the built-in handlers, each bound to one {@link SemanticType}.
 * <p>
 * The shared steps live here: operator/type compatibility, the null-check operators and the
 * presence of a value. Subclasses only render the operators that remain. The left-hand side is
 * passed in as a fragment so the same rendering serves plain columns in a WHERE clause and
 * aggregate expressions in a HAVING clause.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class TypedFilterHandler implements FilterHandler {

    private final SemanticType type;

    protected TypedFilterHandler(SemanticType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public SemanticType getType() {
        return type;
    }

    /**
     * Resolves the semantic type of a condition: its explicit type when set, otherwise the type
     * inferred from the column metadata, {@link SemanticType#TEXT} for unknown columns.
     *
     * @param condition the condition
     * @param context   the compilation context
     * @return the resolved type
     */
    public static SemanticType resolveType(FilterCondition condition, FilterContext context) {
        if (condition.type() != null) {
            return condition.type();
        }
        return context.findColumn(condition.column())
                .map(column -> column.semanticType())
                .orElse(SemanticType.TEXT);
    }

    @Override
    public boolean canHandle(FilterCondition condition, FilterContext context) {
        return resolveType(condition, context) == type;
    }

    @Override
    public final SqlFragment process(FilterCondition condition, FilterContext context) {
        SqlFragment column = SqlFragment.builder(context.getEscapeStrategy())
                .identifier(condition.column())
                .build();
        return processExpression(column, condition, context);
    }

    /**
     * Compiles the condition against an arbitrary left-hand side expression.
     *
     * @param lhs       the already rendered left-hand side, e.g. {@code "price"} or {@code SUM("revenue")}
     * @param condition the condition
     * @param context   the compilation context
     * @return the predicate fragment
     * @throws InvalidOperatorException    if the operator is not valid for this handler's type
     * @throws InvalidFilterValueException if a value is required but missing
     */
    public SqlFragment processExpression(SqlFragment lhs, FilterCondition condition, FilterContext context) {
        Operator operator = condition.operator();
        if (!operator.supports(type)) {
            throw unsupported(condition, type);
        }
        if (operator == Operator.IS_NULL || operator == Operator.NOT_NULL) {
            return builder(lhs, context).sql(" " + operator.getSymbol()).build();
        }
        if (condition.value() == null) {
            throw new InvalidFilterValueException(
                    "Operator '" + operator.getCode() + "' on column '" + condition.column() + "' requires a value");
        }
        return compile(lhs, condition, context);
    }

    /**
     * Renders an operator that requires a value. The operator is supported by this type and the
     * value is non-null.
     */
    protected abstract SqlFragment compile(SqlFragment lhs, FilterCondition condition, FilterContext context);

    protected static SqlFragment.Builder builder(SqlFragment lhs, FilterContext context) {
        return SqlFragment.builder(context.getEscapeStrategy()).fragment(lhs);
    }

    /**
     * Splits a range value into its two bounds.
     *
     * @param condition a condition carrying a two-element list or a {@code "start,end"} string
     * @return the two trimmed bounds
     * @throws MalformedRangeValueException if the value is not exactly two non-blank parts
     */
    protected static List<String> rangeBounds(FilterCondition condition) {
        List<String> parts = new ArrayList<>();
        if (condition.value() instanceof List<?> list) {
            list.forEach(item -> parts.add(item == null ? "" : String.valueOf(item).trim()));
        } else {
            for (String part : condition.valueAsString().split(",", -1)) {
                parts.add(part.trim());
            }
        }
        if (parts.size() != 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
            throw new MalformedRangeValueException("Operator '" + condition.operator().getCode()
                    + "' on column '" + condition.column() + "' requires exactly two values, got " + condition.value());
        }
        return parts;
    }

    /**
     * Reads the members of an {@code in}/{@code notIn} value: a list, or a comma separated string.
     *
     * @param condition the condition
     * @return the non-empty member list
     * @throws InvalidFilterValueException if there are no members
     */
    protected static List<String> listValues(FilterCondition condition) {
        List<String> members = new ArrayList<>();
        if (condition.value() instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) members.add(String.valueOf(item).trim());
            }
        } else {
            for (String part : condition.valueAsString().split(",")) {
                if (!part.isBlank()) members.add(part.trim());
            }
        }
        if (members.isEmpty()) {
            throw new InvalidFilterValueException(
                    "Operator '" + condition.operator().getCode() + "' on column '" + condition.column()
                            + "' requires at least one value");
        }
        return members;
    }

    protected static InvalidOperatorException unsupported(FilterCondition condition, SemanticType type) {
        return new InvalidOperatorException(condition.operator().getCode(),
                "Operator '" + condition.operator().getCode() + "' is not supported for " + type
                        + " column '" + condition.column() + "'");
    }
}
