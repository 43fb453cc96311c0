package io.github.filtersql.core.handler;

import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Ordered, immutable list of custom {@link FilterHandler}s.
 * <p>
 * The registry is assembled once at process startup through its {@link Builder} and is read-only
 * afterwards, so it can be shared by every concurrent compilation without synchronization.
 * Handlers cannot be added or removed after {@link Builder#build()}.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * FilterHandlerRegistry registry = FilterHandlerRegistry.builder()
 *         .register(new ArrayOperatorHandler())
 *         .register(new SoundexHandler())
 *         .build();
 *
 * registry.findHandler(condition, context)
 *         .ifPresent(handler -> handler.process(condition, context));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class FilterHandlerRegistry {

    private static final Logger logger = Logger.getLogger(FilterHandlerRegistry.class.getName());
    private static final FilterHandlerRegistry EMPTY = new FilterHandlerRegistry(List.of());

    private final List<FilterHandler> handlers;

    private FilterHandlerRegistry(List<FilterHandler> handlers) {
        this.handlers = Collections.unmodifiableList(new ArrayList<>(handlers));
    }

    public static FilterHandlerRegistry empty() {
        return EMPTY;
    }

    /**
     * Builds a registry from handlers in the given order.
     *
     * @param handlers handlers, first has highest precedence
     * @return the registry
     * @throws IllegalArgumentException if the same handler instance appears twice
     */
    public static FilterHandlerRegistry of(List<? extends FilterHandler> handlers) {
        Builder builder = builder();
        handlers.forEach(builder::register);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the first handler, in registration order, that claims the condition.
     *
     * @param condition condition being compiled
     * @param context   compilation context
     * @return the claiming handler, or empty when default logic applies
     */
    public Optional<FilterHandler> findHandler(FilterCondition condition, FilterContext context) {
        for (FilterHandler handler : handlers) {
            if (handler.canHandle(condition, context)) {
                return Optional.of(handler);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the handlers in registration order (unmodifiable)
     */
    public List<FilterHandler> getHandlers() {
        return handlers;
    }

    public int size() {
        return handlers.size();
    }

    /**
     * Collects handlers before the registry is frozen.
     */
    public static final class Builder {
        private final List<FilterHandler> handlers = new ArrayList<>();
        private final Set<FilterHandler> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        private Builder() {
        }

        /**
         * Appends a handler after those already registered.
         *
         * @param handler the handler
         * @return this builder
         * @throws IllegalArgumentException if this instance is already registered
         */
        public Builder register(FilterHandler handler) {
            Objects.requireNonNull(handler, "handler");
            if (!seen.add(handler)) {
                throw new IllegalArgumentException("Handler [" + handler.name() + "] is already registered.");
            }
            handlers.add(handler);
            logger.config(() -> "Registered filter handler " + handler.name() + " at position " + handlers.size());
            return this;
        }

        public FilterHandlerRegistry build() {
            return handlers.isEmpty() ? EMPTY : new FilterHandlerRegistry(handlers);
        }
    }
}
