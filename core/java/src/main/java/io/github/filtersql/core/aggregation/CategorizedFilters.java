package io.github.filtersql.core.aggregation;

import io.github.filtersql.core.api.FilterCondition;

import java.util.List;

/**
 * Filters split into pre-aggregation (WHERE) and post-aggregation (HAVING) groups, each in
 * input order.
 *
 * @param whereFilters  filters on raw columns
 * @param havingFilters filters on aggregate expressions or metric aliases
 */
public record CategorizedFilters(List<FilterCondition> whereFilters, List<FilterCondition> havingFilters) {

    public CategorizedFilters {
        whereFilters = whereFilters == null ? List.of() : List.copyOf(whereFilters);
        havingFilters = havingFilters == null ? List.of() : List.copyOf(havingFilters);
    }

    public int size() {
        return whereFilters.size() + havingFilters.size();
    }
}
