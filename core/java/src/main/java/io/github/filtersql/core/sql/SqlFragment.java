package io.github.filtersql.core.sql;

import io.github.filtersql.core.config.EscapeStrategy;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A piece of compiled SQL together with the values bound to its {@code ?} placeholders.
 * <p>
 * With {@link EscapeStrategy#RAW_SQL} values are inlined and {@link #parameters()} is always
 * empty. With {@link EscapeStrategy#PARAMETERIZED} each value is a placeholder and appears in
 * {@code parameters} in placeholder order, ready to be handed to a prepared statement.
 * </p>
 *
 * <pre>{@code
 * SqlFragment f = SqlFragment.builder(EscapeStrategy.PARAMETERIZED)
 *         .identifier("price").sql(" > ").value(new BigDecimal("10"))
 *         .build();
 * f.sql();        // "price" > ?
 * f.parameters(); // [10]
 * }</pre>
 *
 * @param sql        the SQL text
 * @param parameters bound values, in placeholder order
 * @since 1.0.0
 */
public record SqlFragment(String sql, List<Object> parameters) {

    /**
     * Boundary literal format: UTC, microsecond precision, e.g. {@code 2024-01-15T23:59:59.999999Z}.
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSX").withZone(ZoneOffset.UTC);

    private static final SqlFragment EMPTY = new SqlFragment("", List.of());

    public SqlFragment {
        Objects.requireNonNull(sql, "sql");
        parameters = parameters == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static SqlFragment empty() {
        return EMPTY;
    }

    public static SqlFragment of(String sql) {
        return new SqlFragment(sql, List.of());
    }

    public boolean isEmpty() {
        return sql.isBlank();
    }

    /**
     * Prefixes the fragment with a keyword, keeping the parameters.
     *
     * @param keyword e.g. {@code "WHERE"}
     * @return the prefixed fragment, or this fragment unchanged if empty
     */
    public SqlFragment prefixedWith(String keyword) {
        return isEmpty() ? this : new SqlFragment(keyword + " " + sql, parameters);
    }

    /**
     * Joins fragments with a separator, concatenating their parameters in order.
     *
     * @param separator e.g. {@code " AND "}
     * @param fragments fragments to join
     * @return the joined fragment
     */
    public static SqlFragment join(String separator, Collection<SqlFragment> fragments) {
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();
        for (SqlFragment fragment : fragments) {
            if (sql.length() > 0) sql.append(separator);
            sql.append(fragment.sql());
            params.addAll(fragment.parameters());
        }
        return new SqlFragment(sql.toString(), params);
    }

    public static Builder builder(EscapeStrategy strategy) {
        return new Builder(strategy);
    }

    /**
     * Appends SQL text, identifiers and values, rendering values according to an
     * {@link EscapeStrategy}.
     */
    public static final class Builder {
        private final EscapeStrategy strategy;
        private final StringBuilder sql = new StringBuilder();
        private final List<Object> parameters = new ArrayList<>();

        private Builder(EscapeStrategy strategy) {
            this.strategy = Objects.requireNonNull(strategy, "strategy");
        }

        /** Appends raw SQL text. Never pass user input here. */
        public Builder sql(String text) {
            sql.append(text);
            return this;
        }

        /** Appends a double-quoted, validated identifier. */
        public Builder identifier(String name) {
            sql.append(SqlQuoting.quoteIdentifier(name));
            return this;
        }

        /**
         * Appends a value: a placeholder in parameterized mode, a literal otherwise.
         * <p>
         * {@link Number} and {@link Boolean} literals are inlined unquoted; {@link Instant}s are
         * rendered with {@link #TIMESTAMP_FORMAT} and bound as UTC {@link OffsetDateTime}s.
         * </p>
         */
        public Builder value(Object value) {
            if (strategy == EscapeStrategy.PARAMETERIZED) {
                sql.append('?');
                parameters.add(value instanceof Instant instant ? instant.atOffset(ZoneOffset.UTC) : value);
                return this;
            }
            sql.append(literal(value));
            return this;
        }

        /** Appends a comma separated list of values. */
        public Builder values(Collection<?> values) {
            boolean first = true;
            for (Object value : values) {
                if (!first) sql.append(", ");
                value(value);
                first = false;
            }
            return this;
        }

        /** Appends another fragment, keeping its parameters. */
        public Builder fragment(SqlFragment fragment) {
            sql.append(fragment.sql());
            parameters.addAll(fragment.parameters());
            return this;
        }

        public SqlFragment build() {
            return new SqlFragment(sql.toString(), parameters);
        }

        private static String literal(Object value) {
            if (value == null) return "NULL";
            if (value instanceof BigDecimal decimal) return decimal.toPlainString();
            if (value instanceof Boolean bool) return bool ? "TRUE" : "FALSE";
            if (value instanceof Number) return String.valueOf(value);
            if (value instanceof Instant instant) return SqlQuoting.quoteLiteral(TIMESTAMP_FORMAT.format(instant));
            return SqlQuoting.quoteLiteral(String.valueOf(value));
        }
    }
}
