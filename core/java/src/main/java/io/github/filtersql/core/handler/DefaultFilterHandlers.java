package io.github.filtersql.core.handler;

import io.github.filtersql.core.api.SemanticType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The built-in handlers, one per semantic type, applied when no custom handler claims a
 * condition. Array columns only get null checks by default, their operators are served by
 * {@link io.github.filtersql.core.handler.custom.ArrayOperatorHandler} when it is registered.
 */
public final class DefaultFilterHandlers {

    private static final Map<SemanticType, TypedFilterHandler> HANDLERS = new EnumMap<>(SemanticType.class);

    static {
        HANDLERS.put(SemanticType.TEXT, new TextFilterHandler());
        HANDLERS.put(SemanticType.NUMERIC, new NumericFilterHandler());
        HANDLERS.put(SemanticType.BOOLEAN, new BooleanFilterHandler());
        HANDLERS.put(SemanticType.DATE, new DateFilterHandler());
        HANDLERS.put(SemanticType.IDENTIFIER, new ExactMatchFilterHandler(SemanticType.IDENTIFIER));
        HANDLERS.put(SemanticType.ENUM, new ExactMatchFilterHandler(SemanticType.ENUM));
        HANDLERS.put(SemanticType.JSON, new JsonFilterHandler());
        HANDLERS.put(SemanticType.ARRAY, new ArrayFilterHandler());
    }

    private DefaultFilterHandlers() {
    }

    /**
     * @param type a semantic type
     * @return the built-in handler for the type
     */
    public static Optional<TypedFilterHandler> forType(SemanticType type) {
        return Optional.ofNullable(HANDLERS.get(type));
    }
}
