package io.github.filtersql.spring.support;

import io.github.filtersql.core.FilterConditionCompiler;
import io.github.filtersql.core.api.ColumnMetadata;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.handler.FilterHandlerRegistry;
import io.github.filtersql.spring.autoconfigure.FilterSqlProperties;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Creates one {@link FilterConditionCompiler} per logical compilation.
 * <p>
 * The reference instant is read from the clock once, when the compiler is created, so every
 * relative date token compiled by that compiler resolves against the same "now". Create a new
 * compiler for every request rather than sharing one.
 * </p>
 *
 * <pre>{@code
 * FilterConditionCompiler compiler = factory.newCompiler(columns);
 * SqlFragment where = compiler.compileWhere(filters);
 * jdbcTemplate.query("SELECT * FROM orders " + where.sql(), rowMapper, where.parameters().toArray());
 * }</pre>
 */
public class FilterCompilerFactory {

    private final FilterHandlerRegistry registry;
    private final FilterSqlProperties properties;
    private final ZoneId zone;
    private final Clock clock;

    public FilterCompilerFactory(FilterHandlerRegistry registry, FilterSqlProperties properties, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = properties.getZoneId();
    }

    /**
     * @param columns columns of the filtered table
     * @return a compiler for the configured service type
     */
    public FilterConditionCompiler newCompiler(List<ColumnMetadata> columns) {
        return newCompiler(properties.getServiceType(), columns);
    }

    /**
     * @param serviceType service type of the context
     * @param columns     columns of the filtered table
     * @return a compiler bound to the current instant of the clock
     */
    public FilterConditionCompiler newCompiler(String serviceType, List<ColumnMetadata> columns) {
        return new FilterConditionCompiler(newContext(serviceType, columns));
    }

    /**
     * @param serviceType service type of the context
     * @param columns     columns of the filtered table
     * @return a context bound to the current instant of the clock
     */
    public FilterContext newContext(String serviceType, List<ColumnMetadata> columns) {
        return FilterContext.builder()
                .serviceType(serviceType)
                .columns(columns)
                .customHandlers(registry)
                .escapeStrategy(properties.getEscapeStrategy())
                .timeZone(zone)
                .referenceInstant(clock.instant())
                .build();
    }

    public FilterHandlerRegistry getRegistry() {
        return registry;
    }
}
