package io.github.filtersql.core.handler;

import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.api.Operator;
import io.github.filtersql.core.api.SemanticType;
import io.github.filtersql.core.date.DateRange;
import io.github.filtersql.core.date.RelativeDateResolver;
import io.github.filtersql.core.exception.InvalidFilterValueException;
import io.github.filtersql.core.exception.MalformedRangeValueException;
import io.github.filtersql.core.sql.SqlFragment;
import io.github.filtersql.core.utils.OperatorMapper;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Default logic for date and timestamp columns.
 *
 * <ul>
 *   <li>{@code between}, {@code notBetween}, {@code during}: the value (a relative token, a
 *       {@code "start,end"} string or a two-element list) is expanded into an explicit inclusive
 *       {@code BETWEEN start AND end}</li>
 *   <li>{@code eq}/{@code neq}: the calendar day of the value (or the range of a relative token)
 *       becomes {@code BETWEEN}/{@code NOT BETWEEN}</li>
 *   <li>comparisons and their date aliases ({@code before}, {@code afterOrOn}, ...): compared
 *       against the start instant of the value</li>
 * </ul>
 * All relative tokens resolve against the context's reference instant and time zone.
 */
public class DateFilterHandler extends TypedFilterHandler {

    // "2024" or "12" are years or noise, not dates
    private static final Pattern SHORT_NUMBER = Pattern.compile("^\\d{1,4}$");

    public DateFilterHandler() {
        super(SemanticType.DATE);
    }

    @Override
    protected SqlFragment compile(SqlFragment lhs, FilterCondition condition, FilterContext context) {
        Operator operator = condition.operator();
        if (OperatorMapper.isRangeOperator(operator)) {
            return between(lhs, range(condition, context), operator == Operator.NOT_BETWEEN, context);
        }

        String value = condition.valueAsString().trim();
        if (SHORT_NUMBER.matcher(value).matches()) {
            throw new InvalidFilterValueException(
                    "Invalid date value '" + value + "' for column '" + condition.column() + "'");
        }

        Operator mapped = OperatorMapper.mapDateOperator(operator);
        return switch (mapped) {
            case EQ, NEQ -> between(lhs, dayRange(value, context), mapped == Operator.NEQ, context);
            case GT, GTE, LT, LTE -> builder(lhs, context)
                    .sql(" " + mapped.getSymbol() + " ")
                    .value(startInstant(value, context))
                    .build();
            default -> throw unsupported(condition, getType());
        };
    }

    private static DateRange range(FilterCondition condition, FilterContext context) {
        if (condition.value() instanceof List<?>) {
            List<String> bounds = rangeBounds(condition);
            return RelativeDateResolver.literalRange(bounds.get(0), bounds.get(1), context.getTimeZone());
        }
        return RelativeDateResolver.rangeForOperator(condition.valueAsString().trim(), condition.operator(),
                        context.getReferenceInstant(), context.getTimeZone())
                .orElseThrow(() -> new MalformedRangeValueException(
                        "Operator '" + condition.operator().getCode() + "' is not a range operator"));
    }

    private static DateRange dayRange(String value, FilterContext context) {
        if (RelativeDateResolver.isRelative(value)) {
            return RelativeDateResolver.resolveRange(RelativeDateResolver.requireOption(value),
                    context.getReferenceInstant(), context.getTimeZone());
        }
        return RelativeDateResolver.dayRange(value, context.getTimeZone());
    }

    private static Instant startInstant(String value, FilterContext context) {
        if (RelativeDateResolver.isRelative(value)) {
            return RelativeDateResolver.resolveStart(RelativeDateResolver.requireOption(value),
                    context.getReferenceInstant(), context.getTimeZone());
        }
        return RelativeDateResolver.parseDateTime(value, context.getTimeZone()).toInstant();
    }

    private static SqlFragment between(SqlFragment lhs, DateRange range, boolean negated, FilterContext context) {
        return builder(lhs, context)
                .sql(negated ? " NOT BETWEEN " : " BETWEEN ")
                .value(range.start())
                .sql(" AND ")
                .value(range.end())
                .build();
    }
}
