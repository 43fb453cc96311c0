package io.github.filtersql.core.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.api.SemanticType;
import io.github.filtersql.core.config.EscapeStrategy;
import io.github.filtersql.core.exception.InvalidFilterValueException;
import io.github.filtersql.core.sql.SqlFragment;
import io.github.filtersql.core.sql.SqlQuoting;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Default logic for {@code json}/{@code jsonb} columns (PostgreSQL operators).
 *
 * <table border="1">
 * <caption>JSON operators</caption>
 * <tr><th>Operator</th><th>Value</th><th>SQL</th></tr>
 * <tr><td>hasKey</td><td>{@code status}</td><td>{@code "meta" ? 'status'}</td></tr>
 * <tr><td>keyEquals</td><td>{@code status:active}</td><td>{@code "meta" @> '{"status":"active"}'::jsonb}</td></tr>
 * <tr><td>pathExists</td><td>{@code $.a.b}</td><td>{@code "meta" #> '{a,b}'::text[] IS NOT NULL}</td></tr>
 * <tr><td>containsText</td><td>{@code foo}</td><td>{@code "meta"::text ILIKE '%foo%'}</td></tr>
 * </table>
 * <p>
 * In parameterized mode {@code hasKey} is rendered as {@code jsonb_exists(column, ?)} since the
 * {@code ?} operator would be taken for a JDBC placeholder.
 * </p>
 * <p>
 * For {@code keyEquals}, {@code true}/{@code false} match both the JSON string and the JSON
 * boolean, and integers or decimals become JSON numbers. A value that is already a JSON object
 * is used as the containment document unchanged.
 * </p>
 */
public class JsonFilterHandler extends TypedFilterHandler {

    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    private final ObjectMapper objectMapper;

    public JsonFilterHandler() {
        this(new ObjectMapper());
    }

    public JsonFilterHandler(ObjectMapper objectMapper) {
        super(SemanticType.JSON);
        this.objectMapper = objectMapper;
    }

    @Override
    protected SqlFragment compile(SqlFragment lhs, FilterCondition condition, FilterContext context) {
        String value = condition.valueAsString().trim();
        return switch (condition.operator()) {
            case HAS_KEY -> context.getEscapeStrategy() == EscapeStrategy.PARAMETERIZED
                    ? SqlFragment.builder(context.getEscapeStrategy())
                            .sql("jsonb_exists(").fragment(lhs).sql(", ").value(value).sql(")")
                            .build()
                    : builder(lhs, context).sql(" ? ").value(value).build();
            case KEY_EQUALS -> keyEquals(lhs, condition, value, context);
            case PATH_EXISTS -> builder(lhs, context)
                    .sql(" #> ").value(toPathArray(value)).sql("::text[] IS NOT NULL")
                    .build();
            case CONTAINS_TEXT -> builder(lhs, context)
                    .sql("::text ILIKE ").value("%" + SqlQuoting.escapeLikePattern(value) + "%")
                    .build();
            default -> throw unsupported(condition, getType());
        };
    }

    private SqlFragment keyEquals(SqlFragment lhs, FilterCondition condition, String value, FilterContext context) {
        if (value.startsWith("{")) {
            return contains(lhs, readObject(value, condition.column()), context);
        }

        int separator = value.indexOf(':');
        String key = separator > 0 ? value.substring(0, separator).trim() : "";
        String raw = separator > 0 ? value.substring(separator + 1).trim() : "";
        if (key.isEmpty() || raw.isEmpty()) {
            throw new InvalidFilterValueException(
                    "keyEquals on column '" + condition.column() + "' expects 'key:value', got '" + value + "'");
        }

        ObjectNode document = objectMapper.createObjectNode();
        if ("true".equals(raw) || "false".equals(raw)) {
            ObjectNode asBoolean = objectMapper.createObjectNode().put(key, Boolean.parseBoolean(raw));
            document.put(key, raw);
            return SqlFragment.builder(context.getEscapeStrategy())
                    .sql("(").fragment(contains(lhs, document, context))
                    .sql(" OR ").fragment(contains(lhs, asBoolean, context)).sql(")")
                    .build();
        }
        if ("null".equals(raw)) {
            document.putNull(key);
        } else if (NUMBER.matcher(raw).matches()) {
            document.put(key, new BigDecimal(raw));
        } else {
            document.put(key, raw);
        }
        return contains(lhs, document, context);
    }

    private SqlFragment contains(SqlFragment lhs, JsonNode document, FilterContext context) {
        return builder(lhs, context).sql(" @> ").value(writeJson(document)).sql("::jsonb").build();
    }

    private JsonNode readObject(String json, String column) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new InvalidFilterValueException("keyEquals on column '" + column + "' expects a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new InvalidFilterValueException("Invalid JSON value for column '" + column + "'", e);
        }
    }

    private String writeJson(JsonNode document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new InvalidFilterValueException("Unable to serialize JSON filter value", e);
        }
    }

    /**
     * Converts a path into the PostgreSQL text array literal expected by {@code #>}.
     * Accepts JSONPath ({@code $.a.b}), dotted ({@code a.b}) and comma ({@code a,b}) forms.
     *
     * @param path the path
     * @return e.g. {@code {a,b}}
     */
    static String toPathArray(String path) {
        String trimmed = path.trim();
        if ("$".equals(trimmed)) {
            return "{}";
        }
        if (trimmed.startsWith("$.")) {
            trimmed = trimmed.substring(2);
        }
        String[] segments = trimmed.split("[.,]");
        return "{" + String.join(",", Arrays.stream(segments).map(String::trim).toList()) + "}";
    }
}
