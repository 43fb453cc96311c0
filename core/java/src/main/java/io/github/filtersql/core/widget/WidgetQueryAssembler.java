package io.github.filtersql.core.widget;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.filtersql.core.aggregation.AggregationCategorizer;
import io.github.filtersql.core.aggregation.AggregationContext;
import io.github.filtersql.core.aggregation.CategorizedFilters;
import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.Operator;
import io.github.filtersql.core.api.SemanticType;
import io.github.filtersql.core.exception.InvalidFilterValueException;
import io.github.filtersql.core.utils.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the query parameters of a dashboard widget from its stored configuration.
 * <p>
 * Filters are categorized into WHERE and HAVING groups according to the widget's aggregation:
 * charts aggregate when they set an aggregation, a group-by or a time aggregation, metrics always
 * aggregate and tables never do.
 * </p>
 *
 * <pre>{@code
 * WidgetQueryAssembler assembler = new WidgetQueryAssembler(new AggregationCategorizer());
 * WidgetConfig config = assembler.parseWidgetConfig(storedJson);
 *
 * WidgetQueryParams params = assembler.buildQueryParams(
 *         new WidgetDefinition("public", "orders", "chart"), config, 1, 100);
 *
 * compiler.compileWhere(params.whereFilters());
 * compiler.buildHaving(params.havingFilters());
 * }</pre>
 */
public class WidgetQueryAssembler {

    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final String DEFAULT_AGGREGATION = "COUNT";

    private final AggregationCategorizer categorizer;
    private final ObjectMapper objectMapper;

    public WidgetQueryAssembler(AggregationCategorizer categorizer) {
        this(categorizer, new ObjectMapper());
    }

    public WidgetQueryAssembler(AggregationCategorizer categorizer, ObjectMapper objectMapper) {
        this.categorizer = Objects.requireNonNull(categorizer, "categorizer");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Builds the query parameters of a widget.
     *
     * @param widget   the widget's table and type
     * @param config   the widget configuration
     * @param page     1-based page, values below 1 mean 1
     * @param pageSize rows per page, values below 1 mean {@value #DEFAULT_PAGE_SIZE}
     * @return the parameters
     * @throws IllegalArgumentException if the widget type is not supported
     */
    public WidgetQueryParams buildQueryParams(WidgetDefinition widget, WidgetConfig config, int page, int pageSize) {
        WidgetType type = WidgetType.fromCode(widget.widgetType());
        WidgetConfig cfg = config == null ? WidgetConfig.empty() : config;

        AggregationContext aggregation = AggregationContext.builder()
                .aggregated(isAggregated(type, cfg))
                .aggregation(cfg.aggregation())
                .yAxis(cfg.yAxis())
                .groupBy(cfg.groupBy() == null ? List.of() : List.of(cfg.groupBy()))
                .timeAggregation(cfg.timeAggregation())
                .build();
        CategorizedFilters filters = categorizer.categorizeFilters(cfg.filters(), aggregation);

        int effectivePage = page < 1 ? 1 : page;
        int effectivePageSize = pageSize < 1 ? DEFAULT_PAGE_SIZE : pageSize;

        return switch (type) {
            case CHART -> new WidgetQueryParams(widget.schemaName(), widget.tableName(), effectivePage, effectivePageSize,
                    filters.whereFilters(), filters.havingFilters(),
                    cfg.xAxis(), isBlank(cfg.yAxis()) ? "*" : cfg.yAxis(), normalizeAggregation(cfg.aggregation()),
                    aggregation.getGroupBy(), cfg.timeAggregation(), null, null);
            case METRIC -> new WidgetQueryParams(widget.schemaName(), widget.tableName(), effectivePage, effectivePageSize,
                    filters.whereFilters(), filters.havingFilters(),
                    null, null, normalizeAggregation(cfg.aggregation()),
                    null, null, isBlank(cfg.metric()) ? "*" : cfg.metric(), null);
            case TABLE -> new WidgetQueryParams(widget.schemaName(), widget.tableName(), effectivePage, effectivePageSize,
                    filters.whereFilters(), filters.havingFilters(),
                    null, null, null, null, null, null, cfg.columns());
        };
    }

    /**
     * Checks that a configuration is usable for a widget type.
     *
     * @param widgetType widget type code
     * @param config     the configuration
     * @return success, or the list of problems
     */
    public ValidationResult validateWidgetConfig(String widgetType, WidgetConfig config) {
        List<String> errors = new ArrayList<>();
        WidgetType type = WidgetType.find(widgetType).orElse(null);
        if (type == null) {
            errors.add("Unsupported widget type: " + widgetType);
        } else if (type == WidgetType.CHART && (config == null || isBlank(config.xAxis()))) {
            errors.add("Chart widgets require xAxis configuration");
        }
        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    /**
     * Reads a stored JSON configuration.
     * <p>
     * Filters are objects {@code {"column", "operator", "value", "type"}}; {@code value} may be a
     * string, a number, a boolean, an array or absent, and {@code type} a semantic type name.
     * </p>
     *
     * @param json the JSON document, {@code null} or blank for an empty configuration
     * @return the configuration
     * @throws IllegalArgumentException if the document is not a JSON object
     * @throws io.github.filtersql.core.exception.InvalidOperatorException if a filter names an unknown operator
     */
    public WidgetConfig parseWidgetConfig(String json) {
        if (json == null || json.isBlank()) {
            return WidgetConfig.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON configuration", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Invalid JSON configuration: expected an object");
        }

        List<FilterCondition> filters = new ArrayList<>();
        for (JsonNode filter : root.path("filters")) {
            filters.add(toCondition(filter));
        }
        List<String> columns = new ArrayList<>();
        root.path("columns").forEach(column -> columns.add(column.asText()));

        return new WidgetConfig(filters, columns,
                text(root, "xAxis"), text(root, "yAxis"), text(root, "aggregation"),
                text(root, "groupBy"), text(root, "timeAggregation"), text(root, "metric"));
    }

    /**
     * @param aggregation aggregate function name, any case
     * @return the upper-cased name, {@value #DEFAULT_AGGREGATION} when unset
     */
    public static String normalizeAggregation(String aggregation) {
        return isBlank(aggregation) ? DEFAULT_AGGREGATION : aggregation.trim().toUpperCase(Locale.ROOT);
    }

    static boolean isAggregated(WidgetType type, WidgetConfig config) {
        return switch (type) {
            case CHART -> !isBlank(config.aggregation()) || !isBlank(config.groupBy())
                    || !isBlank(config.timeAggregation());
            case METRIC -> true;
            case TABLE -> false;
        };
    }

    private FilterCondition toCondition(JsonNode node) {
        Operator operator = Operator.fromString(node.path("operator").asText(Operator.EQ.getCode()));
        SemanticType type = null;
        if (node.hasNonNull("type")) {
            String tag = node.get("type").asText();
            try {
                type = SemanticType.valueOf(tag.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new InvalidFilterValueException("Unknown filter type '" + tag + "'", e);
            }
        }
        return new FilterCondition(node.path("column").asText(null), operator, value(node.get("value")), type);
    }

    private static Object value(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<Object> items = new ArrayList<>();
            node.forEach(item -> items.add(item.isNull() ? null : item.asText()));
            return items;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
