package io.github.filtersql.core.widget;

import io.github.filtersql.core.api.FilterCondition;

import java.util.List;

/**
 * Stored configuration of a widget. Every field is optional.
 *
 * @param filters         filters on the source table, raw columns and aggregates mixed
 * @param columns         columns shown by table widgets
 * @param xAxis           chart category column
 * @param yAxis           chart value column
 * @param aggregation     aggregate function name, any case
 * @param groupBy         chart series column
 * @param timeAggregation time bucket of the x axis, e.g. {@code day}
 * @param metric          column aggregated by metric widgets
 */
public record WidgetConfig(
        List<FilterCondition> filters,
        List<String> columns,
        String xAxis,
        String yAxis,
        String aggregation,
        String groupBy,
        String timeAggregation,
        String metric
) {

    private static final WidgetConfig EMPTY = new WidgetConfig(null, null, null, null, null, null, null, null);

    public WidgetConfig {
        filters = filters == null ? List.of() : List.copyOf(filters);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static WidgetConfig empty() {
        return EMPTY;
    }

    /**
     * Default configuration of a new widget.
     *
     * @param type widget type
     * @return {@code count(*)} for charts and metrics, all columns for tables
     */
    public static WidgetConfig defaults(WidgetType type) {
        return switch (type) {
            case CHART -> new WidgetConfig(null, null, null, "*", "count", null, null, null);
            case METRIC -> new WidgetConfig(null, null, null, null, "count", null, null, "*");
            case TABLE -> EMPTY;
        };
    }

    public WidgetConfig withFilters(List<FilterCondition> filters) {
        return new WidgetConfig(filters, columns, xAxis, yAxis, aggregation, groupBy, timeAggregation, metric);
    }
}
