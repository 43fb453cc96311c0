package io.github.filtersql.core.handler;

import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.sql.SqlFragment;

/**
 * Strategy compiling the filter conditions it recognizes into SQL fragments.
 * <p>
 * Custom handlers are consulted in registration order before the built-in, type based handlers;
 * the first one whose {@link #canHandle} returns {@code true} wins.
 * </p>
 * <p>
 * <strong>Contract:</strong> when {@code canHandle} returns {@code true}, {@link #process} must
 * return a non-empty fragment or throw. An empty fragment is a defect and aborts the compilation
 * with a {@link io.github.filtersql.core.exception.HandlerContractViolationException}; it is
 * never treated as "no-op". Handlers must be stateless: one instance serves every request.
 * </p>
 *
 * <h3>Example Implementation:</h3>
 * <pre>{@code
 * public class SoundexHandler implements FilterHandler {
 *     @Override
 *     public boolean canHandle(FilterCondition condition, FilterContext context) {
 *         return condition.column().equals("last_name") && condition.operator() == Operator.EQ;
 *     }
 *
 *     @Override
 *     public SqlFragment process(FilterCondition condition, FilterContext context) {
 *         return SqlFragment.builder(context.getEscapeStrategy())
 *                 .sql("soundex(").identifier(condition.column()).sql(") = soundex(")
 *                 .value(condition.valueAsString()).sql(")")
 *                 .build();
 *     }
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public interface FilterHandler {

    /**
     * Decides whether this handler takes responsibility for the condition.
     *
     * @param condition the condition being compiled; its column is known to exist in {@code context}
     * @param context   the compilation context
     * @return {@code true} to claim the condition
     */
    boolean canHandle(FilterCondition condition, FilterContext context);

    /**
     * Compiles a claimed condition.
     *
     * @param condition the claimed condition
     * @param context   the compilation context
     * @return a non-empty fragment
     */
    SqlFragment process(FilterCondition condition, FilterContext context);

    /**
     * @return a name for diagnostics, the simple class name by default
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
