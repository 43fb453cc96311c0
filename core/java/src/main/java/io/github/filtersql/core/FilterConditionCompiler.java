package io.github.filtersql.core;

import io.github.filtersql.core.api.ColumnMetadata;
import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.api.SemanticType;
import io.github.filtersql.core.exception.ColumnNotFoundException;
import io.github.filtersql.core.exception.FilterValidationException;
import io.github.filtersql.core.exception.HandlerContractViolationException;
import io.github.filtersql.core.exception.InvalidOperatorException;
import io.github.filtersql.core.handler.DefaultFilterHandlers;
import io.github.filtersql.core.handler.FilterHandler;
import io.github.filtersql.core.handler.TypedFilterHandler;
import io.github.filtersql.core.sql.SqlFragment;
import io.github.filtersql.core.sql.SqlQuoting;
import io.github.filtersql.core.utils.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles {@link FilterCondition}s into SQL predicates for one {@link FilterContext}.
 * <p>
 * Each condition is dispatched to the first custom handler of the context that claims it, and
 * otherwise to the built-in handler of its semantic type. Compilation is all-or-nothing: the
 * first invalid condition aborts the whole call with an exception, and no condition is ever
 * silently dropped.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * FilterContext context = FilterContext.builder()
 *         .columns(List.of(ColumnMetadata.of("status", "text"),
 *                          ColumnMetadata.of("created_at", "timestamptz")))
 *         .referenceInstant(clock.instant())
 *         .build();
 *
 * FilterConditionCompiler compiler = new FilterConditionCompiler(context);
 * SqlFragment where = compiler.compileWhere(List.of(
 *         FilterCondition.of("status", Operator.EQ, "active"),
 *         FilterCondition.of("created_at", Operator.EQ, "__rel_date:today")));
 *
 * // WHERE "status" = ? AND "created_at" BETWEEN ? AND ?
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link ColumnNotFoundException} - the column is not part of the context metadata</li>
 *   <li>{@link InvalidOperatorException} - the operator is not valid for the column type</li>
 *   <li>{@link io.github.filtersql.core.exception.MalformedRangeValueException} - a range value is not a pair</li>
 *   <li>{@link io.github.filtersql.core.exception.InvalidFilterValueException} - a value cannot be interpreted</li>
 *   <li>{@link HandlerContractViolationException} - a custom handler claimed a condition and produced nothing</li>
 * </ul>
 *
 * Instances are immutable and thread-safe as long as the registered handlers are stateless.
 *
 * @since 1.0.0
 */
public class FilterConditionCompiler {

    private static final Logger logger = Logger.getLogger(FilterConditionCompiler.class.getName());

    private static final Pattern AGGREGATE = Pattern.compile(
            "^\\s*(COUNT|SUM|AVG|MIN|MAX)\\s*\\(\\s*(DISTINCT\\s+)?(\\*|[A-Za-z_][A-Za-z0-9_]*)\\s*\\)\\s*$",
            Pattern.CASE_INSENSITIVE);

    private final FilterContext context;

    public FilterConditionCompiler(FilterContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public FilterContext getContext() {
        return context;
    }

    /**
     * Compiles a single condition into a predicate fragment.
     *
     * @param condition the condition
     * @return the non-empty predicate
     * @throws ColumnNotFoundException            if the column is unknown
     * @throws InvalidOperatorException           if no handler supports the operator for the column type
     * @throws HandlerContractViolationException  if a claiming custom handler returns an empty fragment
     */
    public SqlFragment buildCondition(FilterCondition condition) {
        Objects.requireNonNull(condition, "condition");
        requireColumn(condition.column());

        Optional<FilterHandler> custom = context.getCustomHandlers().findHandler(condition, context);
        if (custom.isPresent()) {
            return checkContract(custom.get(), condition, custom.get().process(condition, context));
        }

        SemanticType type = TypedFilterHandler.resolveType(condition, context);
        TypedFilterHandler handler = DefaultFilterHandlers.forType(type)
                .orElseThrow(() -> new InvalidOperatorException(condition.operator().getCode(),
                        "No handler supports operator '" + condition.operator().getCode() + "' on " + type
                                + " column '" + condition.column() + "'"));
        return handler.process(condition, context);
    }

    /**
     * Compiles conditions into a WHERE clause joined with {@code AND}, in input order.
     *
     * @param conditions the conditions
     * @return the clause with its bound values, or {@link SqlFragment#empty()} for an empty list
     */
    public SqlFragment compileWhere(List<FilterCondition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return SqlFragment.empty();
        }
        List<SqlFragment> predicates = new ArrayList<>(conditions.size());
        for (FilterCondition condition : conditions) {
            predicates.add(buildCondition(condition));
        }
        SqlFragment where = SqlFragment.join(" AND ", predicates).prefixedWith("WHERE");
        logger.fine(() -> "Compiled " + conditions.size() + " condition(s): " + where.sql());
        return where;
    }

    /**
     * SQL text of {@link #compileWhere(List)}.
     *
     * @param conditions the conditions
     * @return {@code ""} for an empty list, otherwise {@code "WHERE c1 AND c2 ..."}
     */
    public String buildWhere(List<FilterCondition> conditions) {
        return compileWhere(conditions).sql();
    }

    /**
     * Compiles post-aggregation conditions into a HAVING clause.
     * <p>
     * A column is either an aggregate expression ({@code COUNT(*)}, {@code SUM(revenue)},
     * {@code COUNT(DISTINCT user_id)} with {@code COUNT/SUM/AVG/MIN/MAX} over a known column, or
     * {@code *} for {@code COUNT} alone) or a metric alias such as {@code value}, rendered as a
     * quoted identifier. Values are compared numerically unless the condition carries an
     * explicit type.
     * </p>
     *
     * @param conditions post-aggregation conditions
     * @return the clause, or an empty fragment for an empty list
     */
    public SqlFragment buildHaving(List<FilterCondition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return SqlFragment.empty();
        }
        List<SqlFragment> predicates = new ArrayList<>(conditions.size());
        for (FilterCondition condition : conditions) {
            SemanticType type = condition.type() != null ? condition.type() : SemanticType.NUMERIC;
            TypedFilterHandler handler = DefaultFilterHandlers.forType(type)
                    .orElseThrow(() -> new InvalidOperatorException(condition.operator().getCode(),
                            "Unsupported HAVING type " + type + " for '" + condition.column() + "'"));
            predicates.add(handler.processExpression(havingExpression(condition.column()), condition, context));
        }
        SqlFragment having = SqlFragment.join(" AND ", predicates).prefixedWith("HAVING");
        logger.fine(() -> "Compiled HAVING: " + having.sql());
        return having;
    }

    /**
     * Checks a condition without throwing, collecting every problem found.
     *
     * @param condition the condition
     * @return success, or a failure listing the problems
     */
    public ValidationResult validateFilter(FilterCondition condition) {
        List<String> errors = new ArrayList<>();
        Optional<ColumnMetadata> column = context.findColumn(condition.column());
        if (column.isEmpty()) {
            errors.add("Column '" + condition.column() + "' does not exist");
        } else if (context.getCustomHandlers().findHandler(condition, context).isEmpty()) {
            SemanticType type = TypedFilterHandler.resolveType(condition, context);
            if (!condition.operator().supports(type) || DefaultFilterHandlers.forType(type).isEmpty()) {
                errors.add("Operator '" + condition.operator().getCode() + "' is not supported for " + type
                        + " column '" + condition.column() + "'");
            }
        }
        if (condition.operator().requiresValue() && condition.value() == null) {
            errors.add("Operator '" + condition.operator().getCode() + "' requires a value");
        }

        if (errors.isEmpty()) {
            try {
                buildCondition(condition);
            } catch (FilterValidationException e) {
                errors.add(e.getMessage());
            }
        }
        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    private void requireColumn(String column) {
        if (context.findColumn(column).isEmpty()) {
            throw new ColumnNotFoundException(column);
        }
    }

    private SqlFragment havingExpression(String column) {
        Matcher matcher = AGGREGATE.matcher(column);
        if (!matcher.matches()) {
            if (column.indexOf('(') >= 0) {
                throw new FilterValidationException("Unsupported aggregate expression '" + column + "'");
            }
            return SqlFragment.of(SqlQuoting.quoteIdentifier(column.trim()));
        }
        String function = matcher.group(1).toUpperCase(Locale.ROOT);
        String distinct = matcher.group(2) != null ? "DISTINCT " : "";
        String argument = matcher.group(3);
        if ("*".equals(argument) && (!"COUNT".equals(function) || !distinct.isEmpty())) {
            throw new FilterValidationException("Unsupported aggregate expression '" + column
                    + "': '*' is only valid in COUNT(*)");
        }
        if (!"*".equals(argument)) {
            requireColumn(argument);
            argument = SqlQuoting.quoteIdentifier(argument);
        }
        return SqlFragment.of(function + "(" + distinct + argument + ")");
    }

    private static SqlFragment checkContract(FilterHandler handler, FilterCondition condition, SqlFragment fragment) {
        if (fragment == null || fragment.isEmpty()) {
            String message = "Handler claimed condition on column '" + condition.column() + "' with operator '"
                    + condition.operator().getCode() + "' but returned an empty fragment";
            logger.log(Level.SEVERE, "{0}: {1}", new Object[]{handler.name(), message});
            throw new HandlerContractViolationException(handler.name(), message);
        }
        return fragment;
    }
}
