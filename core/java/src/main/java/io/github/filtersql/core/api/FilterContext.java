package io.github.filtersql.core.api;

import io.github.filtersql.core.config.EscapeStrategy;
import io.github.filtersql.core.exception.FilterDefinitionException;
import io.github.filtersql.core.handler.FilterHandlerRegistry;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable inputs of one compilation: table metadata, custom handlers, escaping and time.
 * <p>
 * The handler registry is shared between contexts and never mutated once built; everything else
 * is specific to the request. The {@link #getReferenceInstant() reference instant} is the one
 * moment every relative date token of the compilation resolves against, so resolving
 * {@code "__rel_date:today"} twice inside one compilation always yields the same range.
 * </p>
 *
 * <pre>{@code
 * FilterContext context = FilterContext.builder()
 *         .serviceType("data-explorer")
 *         .columns(columns)
 *         .customHandlers(registry)
 *         .escapeStrategy(EscapeStrategy.PARAMETERIZED)
 *         .timeZone(ZoneId.of("Europe/Paris"))
 *         .referenceInstant(clock.instant())
 *         .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class FilterContext {

    private final String serviceType;
    private final Map<String, ColumnMetadata> columns;
    private final FilterHandlerRegistry customHandlers;
    private final EscapeStrategy escapeStrategy;
    private final ZoneId timeZone;
    private final Instant referenceInstant;

    private FilterContext(Builder builder) {
        this.serviceType = builder.serviceType;
        this.customHandlers = builder.customHandlers;
        this.escapeStrategy = builder.escapeStrategy;
        this.timeZone = builder.timeZone;
        this.referenceInstant = builder.referenceInstant;

        Map<String, ColumnMetadata> byName = new LinkedHashMap<>();
        for (ColumnMetadata column : builder.columns) {
            if (byName.putIfAbsent(column.name(), column) != null) {
                throw new FilterDefinitionException("Duplicate column metadata for '" + column.name() + "'");
            }
        }
        this.columns = Collections.unmodifiableMap(byName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getServiceType() { return serviceType; }
    public List<ColumnMetadata> getColumns() { return List.copyOf(columns.values()); }
    public FilterHandlerRegistry getCustomHandlers() { return customHandlers; }
    public EscapeStrategy getEscapeStrategy() { return escapeStrategy; }
    public ZoneId getTimeZone() { return timeZone; }
    public Instant getReferenceInstant() { return referenceInstant; }

    /**
     * Looks a column up by exact name.
     *
     * @param name column name
     * @return the metadata, or empty when the table does not declare the column
     */
    public Optional<ColumnMetadata> findColumn(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    /**
     * Returns a copy of this context bound to another reference instant.
     *
     * @param instant the new reference instant
     * @return a new context, this one is left untouched
     */
    public FilterContext withReferenceInstant(Instant instant) {
        return toBuilder().referenceInstant(instant).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .serviceType(serviceType)
                .columns(List.copyOf(columns.values()))
                .customHandlers(customHandlers)
                .escapeStrategy(escapeStrategy)
                .timeZone(timeZone)
                .referenceInstant(referenceInstant);
    }

    /**
     * Builder for {@link FilterContext}. Only the reference instant is mandatory.
     */
    public static final class Builder {
        private String serviceType = "default";
        private List<ColumnMetadata> columns = List.of();
        private FilterHandlerRegistry customHandlers = FilterHandlerRegistry.empty();
        private EscapeStrategy escapeStrategy = EscapeStrategy.PARAMETERIZED; // default
        private ZoneId timeZone = ZoneOffset.UTC; // default
        private Instant referenceInstant;

        public Builder serviceType(String serviceType) {
            this.serviceType = Objects.requireNonNull(serviceType, "serviceType");
            return this;
        }

        public Builder columns(List<ColumnMetadata> columns) {
            this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
            return this;
        }

        public Builder customHandlers(FilterHandlerRegistry customHandlers) {
            this.customHandlers = Objects.requireNonNull(customHandlers, "customHandlers");
            return this;
        }

        public Builder escapeStrategy(EscapeStrategy escapeStrategy) {
            this.escapeStrategy = Objects.requireNonNull(escapeStrategy, "escapeStrategy");
            return this;
        }

        public Builder timeZone(ZoneId timeZone) {
            this.timeZone = Objects.requireNonNull(timeZone, "timeZone");
            return this;
        }

        public Builder referenceInstant(Instant referenceInstant) {
            this.referenceInstant = Objects.requireNonNull(referenceInstant, "referenceInstant");
            return this;
        }

        /**
         * @return the immutable context
         * @throws FilterDefinitionException if no reference instant was supplied or column names repeat
         */
        public FilterContext build() {
            if (referenceInstant == null) {
                throw new FilterDefinitionException("referenceInstant is required");
            }
            return new FilterContext(this);
        }
    }
}
