package io.github.filtersql.core.aggregation;

import io.github.filtersql.core.api.FilterCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits the filters of an aggregated query into WHERE and HAVING groups.
 * <p>
 * SQL evaluates HAVING after GROUP BY, so predicates on aggregate expressions must be placed
 * there, while predicates on raw columns stay in WHERE where they also reduce the rows scanned.
 * A column is post-aggregation when it
 * </p>
 * <ul>
 *   <li>calls {@code COUNT}, {@code SUM}, {@code AVG}, {@code MIN} or {@code MAX}, e.g.
 *       {@code COUNT(*)} or {@code SUM(revenue)}</li>
 *   <li>is the {@code <aggregation>(...<yAxis>...)} expression of the aggregation context</li>
 *   <li>equals a metric alias ({@code value} by default, compared case-insensitively)</li>
 * </ul>
 * <p>
 * A raw column literally named like an alias cannot be told apart from the alias; such tables
 * should configure other aliases.
 * </p>
 *
 * <pre>{@code
 * CategorizedFilters split = categorizer.categorizeFilters(List.of(
 *         FilterCondition.of("region", Operator.EQ, "US"),
 *         FilterCondition.of("SUM(revenue)", Operator.GT, "10000")),
 *     AggregationContext.aggregated());
 * // where = [region], having = [SUM(revenue)]
 * }</pre>
 */
public class AggregationCategorizer {

    private static final Logger logger = Logger.getLogger(AggregationCategorizer.class.getName());

    /** Metric alias used when neither the categorizer nor the context configure one. */
    public static final String DEFAULT_ALIAS = "value";

    private static final Pattern AGGREGATE_CALL =
            Pattern.compile("^\\s*(COUNT|SUM|AVG|MIN|MAX)\\s*\\(", Pattern.CASE_INSENSITIVE);

    private final Set<String> defaultAliases;

    public AggregationCategorizer() {
        this(Set.of(DEFAULT_ALIAS));
    }

    /**
     * @param defaultAliases metric aliases used when the aggregation context declares none
     */
    public AggregationCategorizer(Set<String> defaultAliases) {
        Objects.requireNonNull(defaultAliases, "defaultAliases");
        this.defaultAliases = normalize(defaultAliases);
    }

    /**
     * Categorizes filters, preserving their relative order in each group.
     *
     * @param filters the filters
     * @param context aggregation settings; when not aggregated every filter goes to WHERE
     * @return the two groups, whose sizes add up to {@code filters.size()}
     */
    public CategorizedFilters categorizeFilters(List<FilterCondition> filters, AggregationContext context) {
        Objects.requireNonNull(context, "context");
        if (filters == null || filters.isEmpty()) {
            return new CategorizedFilters(List.of(), List.of());
        }
        if (!context.isAggregated()) {
            return new CategorizedFilters(filters, List.of());
        }

        Set<String> aliases = context.getAggregationAliases().isEmpty()
                ? defaultAliases
                : normalize(context.getAggregationAliases());

        List<FilterCondition> where = new ArrayList<>();
        List<FilterCondition> having = new ArrayList<>();
        for (FilterCondition filter : filters) {
            if (classify(filter.column(), aliases, context).isPostAggregation()) {
                having.add(filter);
            } else {
                where.add(filter);
            }
        }

        logger.fine(() -> "Categorized " + filters.size() + " filter(s): "
                + where.size() + " WHERE, " + having.size() + " HAVING");
        return new CategorizedFilters(where, having);
    }

    /**
     * Classifies a filter column against this categorizer's default aliases.
     *
     * @param column the column
     * @return its kind
     */
    public ColumnKind classify(String column) {
        return classify(column, defaultAliases);
    }

    /**
     * Classifies a filter column.
     *
     * @param column  the column
     * @param aliases metric aliases, lower case
     * @return its kind
     */
    public static ColumnKind classify(String column, Set<String> aliases) {
        if (column == null) {
            return ColumnKind.COLUMN;
        }
        if (AGGREGATE_CALL.matcher(column).find()) {
            return ColumnKind.AGGREGATE_EXPRESSION;
        }
        if (aliases.contains(column.trim().toLowerCase(Locale.ROOT))) {
            return ColumnKind.METRIC_ALIAS;
        }
        return ColumnKind.COLUMN;
    }

    /**
     * Classifies a filter column, also recognizing the {@code <aggregation>(...<yAxis>...)}
     * expression configured on the context.
     *
     * @param column  the column
     * @param aliases metric aliases, lower case
     * @param context aggregation settings
     * @return its kind
     */
    public static ColumnKind classify(String column, Set<String> aliases, AggregationContext context) {
        ColumnKind kind = classify(column, aliases);
        if (kind == ColumnKind.COLUMN && column != null && isConfiguredAggregate(column, context)) {
            return ColumnKind.AGGREGATE_EXPRESSION;
        }
        return kind;
    }

    private static boolean isConfiguredAggregate(String column, AggregationContext context) {
        String aggregation = context.getAggregation();
        String yAxis = context.getYAxis();
        if (aggregation == null || aggregation.isBlank() || yAxis == null || yAxis.isBlank()) {
            return false;
        }
        Pattern expression = Pattern.compile("^\\s*" + Pattern.quote(aggregation.trim())
                + "\\s*\\(.*" + Pattern.quote(yAxis.trim()) + ".*\\)\\s*$",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
        return expression.matcher(column).matches();
    }

    private static Set<String> normalize(Set<String> aliases) {
        return aliases.stream()
                .map(alias -> alias.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
