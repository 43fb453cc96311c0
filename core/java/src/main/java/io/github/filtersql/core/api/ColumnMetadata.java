package io.github.filtersql.core.api;

import io.github.filtersql.core.exception.FilterDefinitionException;

/**
 * Column description supplied by the schema introspection service.
 *
 * @param name       column name as it appears in the table
 * @param dataType   declared SQL data type, e.g. {@code "timestamp with time zone"}
 * @param filterable whether the UI exposes the column for filtering
 * @since 1.0.0
 */
public record ColumnMetadata(String name, String dataType, boolean filterable) {

    public ColumnMetadata {
        if (name == null || name.isBlank())
            throw new FilterDefinitionException("column name cannot be null nor blank");
    }

    /**
     * Shorthand for a filterable column.
     */
    public static ColumnMetadata of(String name, String dataType) {
        return new ColumnMetadata(name, dataType, true);
    }

    public SemanticType semanticType() {
        return SemanticType.fromDataType(dataType);
    }
}
