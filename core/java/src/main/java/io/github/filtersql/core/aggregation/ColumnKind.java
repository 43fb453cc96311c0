package io.github.filtersql.core.aggregation;

/**
 * What the column of a filter refers to in an aggregated query.
 */
public enum ColumnKind {
    /** A raw source column, filtered before grouping (WHERE). */
    COLUMN,
    /** An aggregate expression such as {@code COUNT(*)} or {@code SUM(revenue)} (HAVING). */
    AGGREGATE_EXPRESSION,
    /** The alias of an aggregated metric, such as {@code value} (HAVING). */
    METRIC_ALIAS;

    public boolean isPostAggregation() {
        return this != COLUMN;
    }
}
