package io.github.filtersql.core.widget;

import io.github.filtersql.core.api.FilterCondition;

import java.util.List;

/**
 * Parameters of the query backing a widget, handed to the query execution layer.
 * Fields that do not apply to the widget type are {@code null} (or empty lists).
 *
 * @param schemaName        source schema
 * @param tableName         source table
 * @param page              1-based page
 * @param pageSize          rows per page
 * @param whereFilters      pre-aggregation filters
 * @param havingFilters     post-aggregation filters
 * @param xAxis             chart category column
 * @param yAxis             chart value column, {@code *} when unset
 * @param aggregation       upper-case aggregate function
 * @param groupBy           grouping columns
 * @param timeAggregation   time bucket of the x axis
 * @param aggregationColumn column aggregated by a metric, {@code *} when unset
 * @param columns           projected columns of a table widget
 */
public record WidgetQueryParams(
        String schemaName,
        String tableName,
        int page,
        int pageSize,
        List<FilterCondition> whereFilters,
        List<FilterCondition> havingFilters,
        String xAxis,
        String yAxis,
        String aggregation,
        List<String> groupBy,
        String timeAggregation,
        String aggregationColumn,
        List<String> columns
) {

    public WidgetQueryParams {
        whereFilters = whereFilters == null ? List.of() : List.copyOf(whereFilters);
        havingFilters = havingFilters == null ? List.of() : List.copyOf(havingFilters);
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
