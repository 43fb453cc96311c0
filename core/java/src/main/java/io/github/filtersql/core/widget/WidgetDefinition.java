package io.github.filtersql.core.widget;

import java.util.Objects;

/**
 * The table a widget reads from and its type code.
 *
 * @param schemaName schema of the source table
 * @param tableName  source table
 * @param widgetType widget type code ({@code chart}, {@code metric} or {@code table})
 */
public record WidgetDefinition(String schemaName, String tableName, String widgetType) {

    public WidgetDefinition {
        Objects.requireNonNull(schemaName, "schemaName");
        Objects.requireNonNull(tableName, "tableName");
        Objects.requireNonNull(widgetType, "widgetType");
    }
}
