package io.github.filtersql.core.aggregation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregation settings of a query, as configured on a dashboard widget.
 *
 * <pre>{@code
 * AggregationContext context = AggregationContext.builder()
 *         .aggregated(true)
 *         .aggregation("SUM")
 *         .yAxis("revenue")
 *         .groupBy(List.of("region"))
 *         .build();
 * }</pre>
 *
 * When {@link #getAggregationAliases()} is empty the categorizer falls back to its own defaults.
 */
public final class AggregationContext {

    private static final AggregationContext NON_AGGREGATED = builder().build();

    private final boolean aggregated;
    private final String aggregation;
    private final List<String> groupBy;
    private final String timeAggregation;
    private final String yAxis;
    private final Set<String> aggregationAliases;

    private AggregationContext(Builder builder) {
        this.aggregated = builder.aggregated;
        this.aggregation = builder.aggregation;
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(builder.groupBy));
        this.timeAggregation = builder.timeAggregation;
        this.yAxis = builder.yAxis;
        this.aggregationAliases = Collections.unmodifiableSet(new LinkedHashSet<>(builder.aggregationAliases));
    }

    public static AggregationContext nonAggregated() {
        return NON_AGGREGATED;
    }

    public static AggregationContext aggregated() {
        return builder().aggregated(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isAggregated() { return aggregated; }
    public String getAggregation() { return aggregation; }
    public List<String> getGroupBy() { return groupBy; }
    public String getTimeAggregation() { return timeAggregation; }
    public String getYAxis() { return yAxis; }
    public Set<String> getAggregationAliases() { return aggregationAliases; }

    @Override
    public String toString() {
        return "AggregationContext[aggregated=" + aggregated + ", aggregation=" + aggregation
                + ", groupBy=" + groupBy + ", timeAggregation=" + timeAggregation + ", yAxis=" + yAxis + "]";
    }

    public static final class Builder {
        private boolean aggregated;
        private String aggregation;
        private List<String> groupBy = List.of();
        private String timeAggregation;
        private String yAxis;
        private Set<String> aggregationAliases = Set.of();

        private Builder() {
        }

        public Builder aggregated(boolean aggregated) {
            this.aggregated = aggregated;
            return this;
        }

        public Builder aggregation(String aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        public Builder groupBy(List<String> groupBy) {
            this.groupBy = groupBy == null ? List.of() : groupBy;
            return this;
        }

        public Builder timeAggregation(String timeAggregation) {
            this.timeAggregation = timeAggregation;
            return this;
        }

        public Builder yAxis(String yAxis) {
            this.yAxis = yAxis;
            return this;
        }

        public Builder aggregationAliases(Set<String> aggregationAliases) {
            this.aggregationAliases = Objects.requireNonNull(aggregationAliases, "aggregationAliases");
            return this;
        }

        public AggregationContext build() {
            return new AggregationContext(this);
        }
    }
}
