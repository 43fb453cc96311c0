package io.github.filtersql.core.aggregation;

import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.Operator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AggregationCategorizer Tests")
class AggregationCategorizerTest {

    private final AggregationCategorizer categorizer = new AggregationCategorizer();

    private static FilterCondition filter(String column) {
        return FilterCondition.of(column, Operator.GT, "1");
    }

    private static List<String> columns(List<FilterCondition> filters) {
        return filters.stream().map(FilterCondition::column).toList();
    }

    @Nested
    @DisplayName("categorizeFilters")
    class Categorize {

        @Test
        @DisplayName("Non-aggregated queries keep every filter in WHERE")
        void nonAggregated() {
            // Given
            List<FilterCondition> filters = List.of(FilterCondition.of("status", Operator.EQ, "active"));

            // When
            CategorizedFilters result = categorizer.categorizeFilters(filters, AggregationContext.nonAggregated());

            // Then
            assertEquals(List.of("status"), columns(result.whereFilters()));
            assertTrue(result.havingFilters().isEmpty());
        }

        @Test
        @DisplayName("Non-aggregated queries keep even aggregate expressions in WHERE")
        void nonAggregatedIgnoresShape() {
            CategorizedFilters result = categorizer.categorizeFilters(
                    List.of(filter("COUNT(*)"), filter("value")), AggregationContext.nonAggregated());

            assertEquals(2, result.whereFilters().size());
            assertTrue(result.havingFilters().isEmpty());
        }

        @Test
        @DisplayName("Aggregate expressions move to HAVING")
        void aggregated() {
            // Given
            List<FilterCondition> filters = List.of(
                    FilterCondition.of("region", Operator.EQ, "US"),
                    FilterCondition.of("SUM(revenue)", Operator.GT, "10000"));

            // When
            CategorizedFilters result = categorizer.categorizeFilters(filters, AggregationContext.aggregated());

            // Then
            assertEquals(List.of("region"), columns(result.whereFilters()));
            assertEquals(List.of("SUM(revenue)"), columns(result.havingFilters()));
        }

        @Test
        @DisplayName("Every filter lands in exactly one group, in input order")
        void completeAndOrdered() {
            List<FilterCondition> filters = List.of(
                    filter("a"), filter("COUNT(*)"), filter("b"), filter("VALUE"), filter("c"), filter("avg(x)"));

            CategorizedFilters result = categorizer.categorizeFilters(filters, AggregationContext.aggregated());

            assertEquals(filters.size(), result.size());
            assertEquals(List.of("a", "b", "c"), columns(result.whereFilters()));
            assertEquals(List.of("COUNT(*)", "VALUE", "avg(x)"), columns(result.havingFilters()));
        }

        @Test
        @DisplayName("Aliases declared by the context replace the defaults")
        void contextAliases() {
            AggregationContext context = AggregationContext.builder()
                    .aggregated(true)
                    .aggregation("SUM")
                    .yAxis("revenue")
                    .aggregationAliases(Set.of("Total"))
                    .build();

            CategorizedFilters result = categorizer.categorizeFilters(
                    List.of(filter("total"), filter("value")), context);

            assertEquals(List.of("value"), columns(result.whereFilters()));
            assertEquals(List.of("total"), columns(result.havingFilters()));
        }

        @Test
        @DisplayName("Scalar function calls stay in WHERE")
        void scalarFunctions() {
            CategorizedFilters result = categorizer.categorizeFilters(
                    List.of(FilterCondition.of("lower(name)", Operator.EQ, "x")), AggregationContext.aggregated());

            assertEquals(List.of("lower(name)"), columns(result.whereFilters()));
            assertTrue(result.havingFilters().isEmpty());
        }

        @Test
        @DisplayName("The configured aggregation over the y axis moves to HAVING")
        void configuredAggregation() {
            AggregationContext context = AggregationContext.builder()
                    .aggregated(true)
                    .aggregation("stddev")
                    .yAxis("price")
                    .build();

            CategorizedFilters result = categorizer.categorizeFilters(
                    List.of(filter("STDDEV(price)"), filter("stddev(cost)"), filter("region")), context);

            assertEquals(List.of("stddev(cost)", "region"), columns(result.whereFilters()));
            assertEquals(List.of("STDDEV(price)"), columns(result.havingFilters()));
            assertEquals(ColumnKind.AGGREGATE_EXPRESSION,
                    AggregationCategorizer.classify("stddev( price )", Set.of(), context));
        }

        @Test
        @DisplayName("Empty or missing input yields empty groups")
        void emptyInput() {
            assertEquals(0, categorizer.categorizeFilters(List.of(), AggregationContext.aggregated()).size());
            assertEquals(0, categorizer.categorizeFilters(null, AggregationContext.aggregated()).size());
        }

        @Test
        @DisplayName("Should require a context")
        void requiresContext() {
            assertThrows(NullPointerException.class, () -> categorizer.categorizeFilters(List.of(), null));
        }
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "COUNT(*),              AGGREGATE_EXPRESSION",
                "SUM(revenue),          AGGREGATE_EXPRESSION",
                "count(DISTINCT id),    AGGREGATE_EXPRESSION",
                "value,                 METRIC_ALIAS",
                "Value,                 METRIC_ALIAS",
                "region,                COLUMN",
                "values,                COLUMN",
                "revenue_sum,           COLUMN",
                "lower(name),           COLUMN",
                "coalesce(x),           COLUMN",
                "summary,               COLUMN"
        })
        @DisplayName("Should classify by column shape")
        void byShape(String column, ColumnKind expected) {
            assertEquals(expected, categorizer.classify(column));
        }

        @Test
        @DisplayName("A categorizer built with custom aliases uses them")
        void customDefaults() {
            AggregationCategorizer custom = new AggregationCategorizer(Set.of("metric", " Amount "));

            assertEquals(ColumnKind.METRIC_ALIAS, custom.classify("amount"));
            assertEquals(ColumnKind.COLUMN, custom.classify("value"));
        }

        @Test
        @DisplayName("Only aggregate expressions and aliases are post-aggregation")
        void postAggregation() {
            assertFalse(ColumnKind.COLUMN.isPostAggregation());
            assertTrue(ColumnKind.AGGREGATE_EXPRESSION.isPostAggregation());
            assertTrue(ColumnKind.METRIC_ALIAS.isPostAggregation());
            assertEquals(ColumnKind.COLUMN, AggregationCategorizer.classify(null, Set.of()));
        }
    }

    @Test
    @DisplayName("AggregationContext defaults")
    void contextDefaults() {
        AggregationContext context = AggregationContext.nonAggregated();

        assertFalse(context.isAggregated());
        assertTrue(context.getGroupBy().isEmpty());
        assertTrue(context.getAggregationAliases().isEmpty());
        assertNull(context.getYAxis());
    }
}
