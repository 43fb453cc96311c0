package io.github.filtersql.core.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.filtersql.core.api.ColumnMetadata;
import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.Operator;
import io.github.filtersql.core.exception.ColumnNotFoundException;
import io.github.filtersql.core.exception.InvalidFilterValueException;
import io.github.filtersql.core.utils.OperatorMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns URL style filter properties into {@link FilterCondition}s.
 * <p>
 * Keys have the form {@code column.operator}; the operator part is optional and defaults to
 * {@code eq}. Operator names are matched case-insensitively against codes and aliases
 * ({@code equals}, {@code greaterThan}, {@code like}, {@code isNotNull}, ...).
 * </p>
 *
 * <pre>{@code
 * Map<String, Object> properties = Map.of(
 *         "status", "active",
 *         "price.between", "10,20",
 *         "region.in", "[\"US\",\"EU\"]",
 *         "deleted_at.isNull", "true");
 *
 * List<FilterCondition> filters = parser.parse(properties, columns);
 * }</pre>
 *
 * <p><strong>Value handling:</strong></p>
 * <ul>
 *   <li>{@code between}, {@code notBetween}, {@code during}: {@code "a,b"} becomes a two-element list;
 *       relative date tokens are kept as is</li>
 *   <li>{@code in}, {@code notIn}: JSON array strings, comma lists and single values become lists</li>
 *   <li>{@code isNull}, {@code notNull}: the value is ignored</li>
 *   <li>the {@code columns} key and {@code null} values are skipped</li>
 * </ul>
 */
public class FilterPropertiesParser {

    private static final String COLUMNS_KEY = "columns";
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public FilterPropertiesParser() {
        this(new ObjectMapper());
    }

    public FilterPropertiesParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Parses properties into conditions, in map iteration order.
     *
     * @param properties {@code column.operator -> value} entries
     * @param columns    the columns of the table
     * @return the conditions
     * @throws ColumnNotFoundException                                       if a key names an unknown column
     * @throws io.github.filtersql.core.exception.InvalidOperatorException   if a key names an unknown operator
     * @throws InvalidFilterValueException                                   if a JSON array value is malformed
     */
    public List<FilterCondition> parse(Map<String, ?> properties, List<ColumnMetadata> columns) {
        if (properties == null || properties.isEmpty()) {
            return List.of();
        }
        Set<String> known = columns.stream().map(ColumnMetadata::name).collect(Collectors.toSet());

        List<FilterCondition> filters = new ArrayList<>();
        for (Map.Entry<String, ?> entry : properties.entrySet()) {
            String key = entry.getKey();
            if (key == null || COLUMNS_KEY.equals(key) || entry.getValue() == null) {
                continue;
            }

            int dot = key.indexOf('.');
            String column = (dot < 0 ? key : key.substring(0, dot)).trim();
            String operatorName = dot < 0 ? Operator.EQ.getCode() : key.substring(dot + 1);
            if (column.isEmpty()) {
                continue;
            }
            if (!known.contains(column)) {
                throw new ColumnNotFoundException(column);
            }

            Operator operator = Operator.fromString(operatorName);
            filters.add(FilterCondition.of(column, operator, value(entry.getValue(), operator)));
        }
        return filters;
    }

    private Object value(Object raw, Operator operator) {
        if (!operator.requiresValue()) {
            return null;
        }
        if (OperatorMapper.isRangeOperator(operator)) {
            if (raw instanceof String text && text.contains(",")) {
                return Arrays.stream(text.split(",", -1)).map(String::trim).toList();
            }
            return raw instanceof Collection<?> collection ? new ArrayList<>(collection) : raw;
        }
        if (operator == Operator.IN || operator == Operator.NOT_IN) {
            return members(raw);
        }
        return raw;
    }

    private List<Object> members(Object raw) {
        if (raw instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (raw instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                try {
                    return objectMapper.readValue(trimmed, LIST_TYPE);
                } catch (JsonProcessingException e) {
                    throw new InvalidFilterValueException("Invalid JSON array '" + text + "'", e);
                }
            }
            if (trimmed.contains(",")) {
                return Arrays.stream(trimmed.split(",")).map(String::trim).collect(Collectors.toList());
            }
        }
        List<Object> single = new ArrayList<>();
        single.add(raw);
        return single;
    }
}
