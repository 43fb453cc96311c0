package io.github.filtersql.core;

import io.github.filtersql.core.api.ColumnMetadata;
import io.github.filtersql.core.api.FilterCondition;
import io.github.filtersql.core.api.FilterContext;
import io.github.filtersql.core.api.Operator;
import io.github.filtersql.core.api.SemanticType;
import io.github.filtersql.core.config.EscapeStrategy;
import io.github.filtersql.core.exception.ColumnNotFoundException;
import io.github.filtersql.core.exception.FilterValidationException;
import io.github.filtersql.core.exception.HandlerContractViolationException;
import io.github.filtersql.core.exception.InvalidFilterValueException;
import io.github.filtersql.core.exception.InvalidOperatorException;
import io.github.filtersql.core.exception.MalformedRangeValueException;
import io.github.filtersql.core.handler.FilterHandler;
import io.github.filtersql.core.handler.FilterHandlerRegistry;
import io.github.filtersql.core.handler.custom.ArrayOperatorHandler;
import io.github.filtersql.core.sql.SqlFragment;
import io.github.filtersql.core.utils.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("FilterConditionCompiler Tests")
class FilterConditionCompilerTest {

    // Wednesday
    private static final Instant NOW = Instant.parse("2024-01-17T15:30:00Z");

    private static final List<ColumnMetadata> COLUMNS = List.of(
            ColumnMetadata.of("status", "text"),
            ColumnMetadata.of("price", "numeric"),
            ColumnMetadata.of("active", "boolean"),
            ColumnMetadata.of("created_at", "timestamp with time zone"),
            ColumnMetadata.of("id", "uuid"),
            ColumnMetadata.of("priority", "USER-DEFINED"),
            ColumnMetadata.of("meta", "jsonb"),
            ColumnMetadata.of("tags", "text[]"));

    private FilterConditionCompiler raw;
    private FilterConditionCompiler parameterized;

    @BeforeEach
    void setUp() {
        raw = compiler(EscapeStrategy.RAW_SQL, FilterHandlerRegistry.empty());
        parameterized = compiler(EscapeStrategy.PARAMETERIZED, FilterHandlerRegistry.empty());
    }

    private static FilterConditionCompiler compiler(EscapeStrategy strategy, FilterHandlerRegistry handlers) {
        return new FilterConditionCompiler(FilterContext.builder()
                .serviceType("data-explorer")
                .columns(COLUMNS)
                .customHandlers(handlers)
                .escapeStrategy(strategy)
                .referenceInstant(NOW)
                .build());
    }

    private static FilterCondition cond(String column, Operator operator, Object value) {
        return FilterCondition.of(column, operator, value);
    }

    private String rawSql(String column, Operator operator, Object value) {
        return raw.buildCondition(cond(column, operator, value)).sql();
    }

    @Nested
    @DisplayName("WHERE clause")
    class WhereClause {

        @Test
        @DisplayName("Should return an empty string for no conditions")
        void emptyConditions() {
            assertEquals("", raw.buildWhere(List.of()));
            assertTrue(parameterized.compileWhere(List.of()).isEmpty());
        }

        @Test
        @DisplayName("Should join conditions with AND in input order")
        void joinsInOrder() {
            String where = raw.buildWhere(List.of(
                    cond("status", Operator.EQ, "active"),
                    cond("price", Operator.GT, "100")));

            assertEquals("WHERE \"status\" = 'active' AND \"price\" > 100", where);
        }

        @Test
        @DisplayName("Should bind values in parameterized mode")
        void parameterizedWhere() {
            SqlFragment where = parameterized.compileWhere(List.of(
                    cond("status", Operator.EQ, "active"),
                    cond("price", Operator.BETWEEN, List.of("10", "20"))));

            assertEquals("WHERE \"status\" = ? AND \"price\" BETWEEN ? AND ?", where.sql());
            assertEquals(List.of("active", new BigDecimal("10"), new BigDecimal("20")), where.parameters());
        }

        @Test
        @DisplayName("Relative 'today' bounds exactly one calendar day")
        void todayBoundsOneDay() {
            // Given
            List<FilterCondition> conditions = List.of(cond("created_at", Operator.EQ, "__rel_date:today"));

            // When
            String where = raw.buildWhere(conditions);
            SqlFragment bound = parameterized.compileWhere(conditions);

            // Then
            assertEquals("WHERE \"created_at\" BETWEEN '2024-01-17T00:00:00.000000Z' AND '2024-01-17T23:59:59.999999Z'",
                    where);
            OffsetDateTime start = (OffsetDateTime) bound.parameters().get(0);
            OffsetDateTime end = (OffsetDateTime) bound.parameters().get(1);
            assertEquals(start.toLocalDate(), end.toLocalDate());
            assertEquals(Duration.ofDays(1).minusNanos(1000), Duration.between(start, end));
        }

        @Test
        @DisplayName("Unknown columns abort the whole clause")
        void unknownColumnAborts() {
            List<FilterCondition> conditions = List.of(
                    cond("status", Operator.EQ, "active"),
                    cond("ghost_column", Operator.EQ, "boo"));

            ColumnNotFoundException ex = assertThrows(ColumnNotFoundException.class, () -> raw.buildWhere(conditions));
            assertEquals("ghost_column", ex.getColumn());
        }

        @Test
        @DisplayName("Should expose its context")
        void exposesContext() {
            assertEquals("data-explorer", raw.getContext().getServiceType());
            assertEquals(NOW, raw.getContext().getReferenceInstant());
        }
    }

    @Nested
    @DisplayName("Text columns")
    class Text {

        @Test
        @DisplayName("Should escape quotes in raw mode")
        void escapesQuotes() {
            assertEquals("\"status\" = 'O''Brien'", rawSql("status", Operator.EQ, "O'Brien"));
            assertEquals("\"status\" != 'x'", rawSql("status", Operator.NEQ, "x"));
        }

        @Test
        @DisplayName("Should escape wildcards in pattern operators")
        void escapesWildcards() {
            assertEquals("\"status\" ILIKE '%50\\%%'", rawSql("status", Operator.CONTAINS, "50%"));
            assertEquals("\"status\" ILIKE 'a\\_b%'", rawSql("status", Operator.STARTS_WITH, "a_b"));
            assertEquals("\"status\" ILIKE '%end'", rawSql("status", Operator.ENDS_WITH, "end"));
        }

        @Test
        @DisplayName("Should render membership lists")
        void membership() {
            SqlFragment fragment = parameterized.buildCondition(cond("status", Operator.NOT_IN, "a, b"));

            assertEquals("\"status\" NOT IN (?, ?)", fragment.sql());
            assertEquals(List.of("a", "b"), fragment.parameters());
        }

        @Test
        @DisplayName("Should reject empty membership lists")
        void emptyMembership() {
            assertThrows(InvalidFilterValueException.class, () -> rawSql("status", Operator.IN, List.of()));
        }

        @Test
        @DisplayName("Comparison operators are not valid on text")
        void comparisonOnText() {
            assertThrows(InvalidOperatorException.class, () -> rawSql("status", Operator.GT, "a"));
        }
    }

    @Nested
    @DisplayName("Numeric and boolean columns")
    class NumericAndBoolean {

        @Test
        @DisplayName("Should compare numbers directly")
        void compares() {
            assertEquals("\"price\" >= 9.99", rawSql("price", Operator.GTE, "9.99"));
            assertEquals("\"price\" NOT BETWEEN 1 AND 5", rawSql("price", Operator.NOT_BETWEEN, "1,5"));
            assertEquals("\"price\" IN (1, 2, 3)", rawSql("price", Operator.IN, List.of(1, 2, 3)));
        }

        @ParameterizedTest
        @ValueSource(strings = {"10", "10,20,30", "10,", ",20"})
        @DisplayName("Range values must be exactly two parts")
        void malformedRange(String value) {
            assertThrows(MalformedRangeValueException.class, () -> rawSql("price", Operator.BETWEEN, value));
        }

        @Test
        @DisplayName("Should reject non-numeric values")
        void nonNumeric() {
            assertThrows(InvalidFilterValueException.class, () -> rawSql("price", Operator.EQ, "1; DROP TABLE x"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"1e300000000", "-1E+200000", "1e-300000000"})
        @DisplayName("Should reject numbers beyond the range of a SQL numeric")
        void outOfRange(String value) {
            assertThrows(InvalidFilterValueException.class, () -> rawSql("price", Operator.GT, value));
            assertThrows(InvalidFilterValueException.class,
                    () -> raw.buildHaving(List.of(cond("COUNT(*)", Operator.GT, value))));
        }

        @Test
        @DisplayName("Exponent notation within range is expanded")
        void exponentInRange() {
            assertEquals("\"price\" < 1500", rawSql("price", Operator.LT, "1.5e3"));
        }

        @Test
        @DisplayName("Pattern operators are not valid on numbers")
        void containsOnNumber() {
            InvalidOperatorException ex = assertThrows(InvalidOperatorException.class,
                    () -> rawSql("price", Operator.CONTAINS, "1"));
            assertEquals("contains", ex.getOperator());
        }

        @Test
        @DisplayName("Should match booleans exactly")
        void booleans() {
            assertEquals("\"active\" = TRUE", rawSql("active", Operator.EQ, "TRUE"));
            assertEquals("\"active\" != FALSE", rawSql("active", Operator.NEQ, false));
            assertThrows(InvalidFilterValueException.class, () -> rawSql("active", Operator.EQ, "yes"));
        }

        @Test
        @DisplayName("An explicit type overrides the column metadata")
        void explicitType() {
            FilterCondition condition = new FilterCondition("status", Operator.GT, "5", SemanticType.NUMERIC);

            assertEquals("\"status\" > 5", raw.buildCondition(condition).sql());
        }
    }

    @Nested
    @DisplayName("Null checks")
    class NullChecks {

        @Test
        @DisplayName("Should render null checks for every type")
        void nullChecks() {
            assertEquals("\"price\" IS NULL", rawSql("price", Operator.IS_NULL, null));
            assertEquals("\"meta\" IS NOT NULL", rawSql("meta", Operator.NOT_NULL, null));
            assertEquals("\"tags\" IS NULL", rawSql("tags", Operator.IS_NULL, null));
        }

        @Test
        @DisplayName("Value operators require a value")
        void missingValue() {
            assertThrows(InvalidFilterValueException.class, () -> rawSql("status", Operator.EQ, null));
        }
    }

    @Nested
    @DisplayName("Date columns")
    class Dates {

        @Test
        @DisplayName("Comparisons use the start of the day")
        void comparisons() {
            assertEquals("\"created_at\" > '2024-01-15T00:00:00.000000Z'",
                    rawSql("created_at", Operator.AFTER, "2024-01-15"));
            assertEquals("\"created_at\" <= '2024-01-16T00:00:00.000000Z'",
                    rawSql("created_at", Operator.BEFORE_OR_ON, "__rel_date:yesterday"));
            assertEquals("\"created_at\" < '2024-01-15T10:00:00.000000Z'",
                    rawSql("created_at", Operator.LT, "2024-01-15T10:00:00Z"));
        }

        @Test
        @DisplayName("Should expand literal ranges")
        void literalRanges() {
            assertEquals("\"created_at\" BETWEEN '2024-01-01T00:00:00.000000Z' AND '2024-01-31T23:59:59.999999Z'",
                    rawSql("created_at", Operator.BETWEEN, "2024-01-01,2024-01-31"));
            assertEquals("\"created_at\" NOT BETWEEN '2024-01-01T00:00:00.000000Z' AND '2024-01-31T23:59:59.999999Z'",
                    rawSql("created_at", Operator.NOT_BETWEEN, List.of("2024-01-01", "2024-01-31")));
        }

        @Test
        @DisplayName("Should expand relative ranges")
        void relativeRanges() {
            assertEquals("\"created_at\" BETWEEN '2024-01-15T00:00:00.000000Z' AND '2024-01-21T23:59:59.999999Z'",
                    rawSql("created_at", Operator.DURING, "__rel_date:thisWeek"));
            assertEquals("\"created_at\" NOT BETWEEN '2024-01-17T00:00:00.000000Z' AND '2024-01-17T23:59:59.999999Z'",
                    rawSql("created_at", Operator.NEQ, "__rel_date:today"));
        }

        @Test
        @DisplayName("Equality on an absolute date covers that day")
        void absoluteEquality() {
            assertEquals("\"created_at\" BETWEEN '2024-03-05T00:00:00.000000Z' AND '2024-03-05T23:59:59.999999Z'",
                    rawSql("created_at", Operator.EQ, "2024-03-05"));
        }

        @Test
        @DisplayName("Day boundaries follow the context time zone")
        void timeZone() {
            FilterConditionCompiler paris = new FilterConditionCompiler(raw.getContext().toBuilder()
                    .timeZone(ZoneId.of("Europe/Paris"))
                    .build());

            assertEquals("\"created_at\" BETWEEN '2024-01-16T23:00:00.000000Z' AND '2024-01-17T22:59:59.999999Z'",
                    paris.buildCondition(cond("created_at", Operator.EQ, "__rel_date:today")).sql());
        }

        @ParameterizedTest
        @ValueSource(strings = {"2024", "7", "not a date", "__rel_date:someday"})
        @DisplayName("Should reject values that are not dates")
        void invalidDates(String value) {
            assertThrows(InvalidFilterValueException.class, () -> rawSql("created_at", Operator.EQ, value));
        }

        @Test
        @DisplayName("Malformed date ranges are rejected")
        void malformedDateRange() {
            assertThrows(MalformedRangeValueException.class,
                    () -> rawSql("created_at", Operator.BETWEEN, "2024-01-01"));
        }

        @Test
        @DisplayName("Two resolutions within one compilation are identical")
        void sameInstantWithinCompilation() {
            SqlFragment where = parameterized.compileWhere(List.of(
                    cond("created_at", Operator.EQ, "__rel_date:today"),
                    cond("created_at", Operator.DURING, "__rel_date:today")));

            assertEquals(where.parameters().subList(0, 2), where.parameters().subList(2, 4));
        }
    }

    @Nested
    @DisplayName("Identifier, enum and JSON columns")
    class Structured {

        @Test
        @DisplayName("Should match identifiers and enums exactly")
        void exactMatch() {
            assertEquals("\"id\" = '4f1c'", rawSql("id", Operator.EQ, "4f1c"));
            assertEquals("\"priority\" IN ('high', 'low')", rawSql("priority", Operator.IN, List.of("high", "low")));
            assertThrows(InvalidOperatorException.class, () -> rawSql("priority", Operator.CONTAINS, "h"));
        }

        @Test
        @DisplayName("hasKey avoids the ? operator when parameterized")
        void hasKey() {
            assertEquals("\"meta\" ? 'status'", rawSql("meta", Operator.HAS_KEY, "status"));

            SqlFragment fragment = parameterized.buildCondition(cond("meta", Operator.HAS_KEY, "status"));
            assertEquals("jsonb_exists(\"meta\", ?)", fragment.sql());
            assertEquals(List.of("status"), fragment.parameters());
        }

        @Test
        @DisplayName("keyEquals builds a containment document")
        void keyEquals() {
            assertEquals("\"meta\" @> '{\"status\":\"active\"}'::jsonb",
                    rawSql("meta", Operator.KEY_EQUALS, "status:active"));
            assertEquals("\"meta\" @> '{\"count\":5}'::jsonb",
                    rawSql("meta", Operator.KEY_EQUALS, "count:5"));
            assertEquals("\"meta\" @> '{\"a\":{\"b\":1}}'::jsonb",
                    rawSql("meta", Operator.KEY_EQUALS, "{\"a\":{\"b\":1}}"));
        }

        @Test
        @DisplayName("Boolean-like keyEquals values match strings and booleans")
        void keyEqualsBoolean() {
            assertEquals("(\"meta\" @> '{\"enabled\":\"true\"}'::jsonb OR \"meta\" @> '{\"enabled\":true}'::jsonb)",
                    rawSql("meta", Operator.KEY_EQUALS, "enabled:true"));
        }

        @Test
        @DisplayName("keyEquals requires key:value")
        void keyEqualsMalformed() {
            assertThrows(InvalidFilterValueException.class, () -> rawSql("meta", Operator.KEY_EQUALS, "status"));
            assertThrows(InvalidFilterValueException.class, () -> rawSql("meta", Operator.KEY_EQUALS, "{broken"));
        }

        @Test
        @DisplayName("Should render path and text searches")
        void pathAndText() {
            assertEquals("\"meta\" #> '{a,b}'::text[] IS NOT NULL", rawSql("meta", Operator.PATH_EXISTS, "$.a.b"));
            assertEquals("\"meta\"::text ILIKE '%foo%'", rawSql("meta", Operator.CONTAINS_TEXT, "foo"));
        }

        @Test
        @DisplayName("Array operators need the array handler")
        void arraysWithoutHandler() {
            assertThrows(InvalidOperatorException.class, () -> rawSql("tags", Operator.ARRAY_CONTAINS, "a"));
        }

        @Test
        @DisplayName("Array operators compile once the array handler is registered")
        void arraysWithHandler() {
            FilterConditionCompiler withArrays = compiler(EscapeStrategy.RAW_SQL,
                    FilterHandlerRegistry.builder().register(new ArrayOperatorHandler()).build());

            assertEquals("\"tags\" && ARRAY['a', 'b']",
                    withArrays.buildCondition(cond("tags", Operator.OVERLAPS, "a,b")).sql());
        }
    }

    @Nested
    @DisplayName("Custom handlers")
    class CustomHandlers {

        @Test
        @DisplayName("A claiming handler takes precedence over default logic")
        void precedence() {
            // Given
            FilterHandler soundex = mock(FilterHandler.class);
            when(soundex.canHandle(any(), any())).thenReturn(true);
            when(soundex.process(any(), any())).thenReturn(SqlFragment.of("soundex(\"status\") = soundex('x')"));
            FilterConditionCompiler compiler = compiler(EscapeStrategy.RAW_SQL,
                    FilterHandlerRegistry.builder().register(soundex).build());

            // When
            String where = compiler.buildWhere(List.of(cond("status", Operator.EQ, "x")));

            // Then
            assertEquals("WHERE soundex(\"status\") = soundex('x')", where);
        }

        @Test
        @DisplayName("Custom handlers still require a known column")
        void unknownColumnBeforeDispatch() {
            FilterHandler greedy = mock(FilterHandler.class);
            FilterConditionCompiler compiler = compiler(EscapeStrategy.RAW_SQL,
                    FilterHandlerRegistry.builder().register(greedy).build());

            assertThrows(ColumnNotFoundException.class,
                    () -> compiler.buildCondition(cond("ghost_column", Operator.EQ, "x")));
        }

        @Test
        @DisplayName("An empty fragment from a claiming handler is a contract violation")
        void emptyFragment() {
            FilterHandler broken = new EmptyFragmentHandler();
            FilterConditionCompiler compiler = compiler(EscapeStrategy.RAW_SQL,
                    FilterHandlerRegistry.builder().register(broken).build());

            HandlerContractViolationException ex = assertThrows(HandlerContractViolationException.class,
                    () -> compiler.buildWhere(List.of(cond("status", Operator.EQ, "x"))));
            assertEquals("EmptyFragmentHandler", ex.getHandlerName());
        }

        @Test
        @DisplayName("A null fragment from a claiming handler is a contract violation")
        void nullFragment() {
            FilterHandler broken = mock(FilterHandler.class);
            when(broken.canHandle(any(), any())).thenReturn(true);
            FilterConditionCompiler compiler = compiler(EscapeStrategy.RAW_SQL,
                    FilterHandlerRegistry.builder().register(broken).build());

            assertThrows(HandlerContractViolationException.class,
                    () -> compiler.buildCondition(cond("status", Operator.EQ, "x")));
        }
    }

    @Nested
    @DisplayName("HAVING clause")
    class Having {

        @Test
        @DisplayName("Should render aggregate expressions and metric aliases")
        void rendersAggregates() {
            SqlFragment having = raw.buildHaving(List.of(
                    cond("COUNT(*)", Operator.GT, "5"),
                    cond("sum(price)", Operator.LTE, "1000"),
                    cond("COUNT(DISTINCT id)", Operator.GTE, "2"),
                    cond("value", Operator.BETWEEN, "1,10")));

            assertEquals("HAVING COUNT(*) > 5 AND SUM(\"price\") <= 1000 AND COUNT(DISTINCT \"id\") >= 2"
                    + " AND \"value\" BETWEEN 1 AND 10", having.sql());
        }

        @Test
        @DisplayName("Should bind HAVING values")
        void parameterizedHaving() {
            SqlFragment having = parameterized.buildHaving(List.of(cond("SUM(price)", Operator.GT, "10000")));

            assertEquals("HAVING SUM(\"price\") > ?", having.sql());
            assertEquals(List.of(new BigDecimal("10000")), having.parameters());
        }

        @Test
        @DisplayName("Should return an empty fragment for no conditions")
        void emptyHaving() {
            assertTrue(raw.buildHaving(List.of()).isEmpty());
        }

        @Test
        @DisplayName("Aggregated columns must exist")
        void unknownAggregatedColumn() {
            assertThrows(ColumnNotFoundException.class,
                    () -> raw.buildHaving(List.of(cond("SUM(ghost)", Operator.GT, "1"))));
        }

        @Test
        @DisplayName("Should reject unsupported aggregate expressions")
        void unsupportedExpression() {
            assertThrows(FilterValidationException.class,
                    () -> raw.buildHaving(List.of(cond("SUM(price * 2)", Operator.GT, "1"))));
            assertThrows(FilterValidationException.class,
                    () -> raw.buildHaving(List.of(cond("pg_sleep(10)", Operator.GT, "1"))));
        }

        @ParameterizedTest
        @ValueSource(strings = {"SUM(*)", "avg( * )", "MAX(*)", "COUNT(DISTINCT *)"})
        @DisplayName("Only COUNT accepts a bare star")
        void starOutsideCount(String column) {
            assertThrows(FilterValidationException.class,
                    () -> raw.buildHaving(List.of(cond(column, Operator.GT, "1"))));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Valid conditions pass")
        void valid() {
            assertTrue(raw.validateFilter(cond("status", Operator.CONTAINS, "a")).isValid());
            assertTrue(raw.validateFilter(cond("created_at", Operator.DURING, "__rel_date:last7Days")).isValid());
        }

        @Test
        @DisplayName("Should report unknown columns")
        void unknownColumn() {
            ValidationResult result = raw.validateFilter(cond("ghost_column", Operator.EQ, "x"));

            assertFalse(result.isValid());
            assertTrue(result.getErrorMessage().contains("ghost_column"));
        }

        @Test
        @DisplayName("Should collect several problems")
        void collectsErrors() {
            ValidationResult result = raw.validateFilter(cond("price", Operator.CONTAINS, null));

            assertEquals(2, result.getErrors().size());
        }

        @Test
        @DisplayName("Should report unprocessable values")
        void badValue() {
            ValidationResult result = raw.validateFilter(cond("price", Operator.BETWEEN, "10"));

            assertFalse(result.isValid());
            assertEquals(1, result.getErrors().size());
        }
    }

    @Test
    @DisplayName("Raw mode never binds parameters")
    void rawHasNoParameters() {
        SqlFragment where = raw.compileWhere(List.of(
                cond("status", Operator.IN, List.of("a", "b")),
                cond("created_at", Operator.EQ, "__rel_date:today"),
                cond("meta", Operator.KEY_EQUALS, "enabled:false")));

        assertTrue(where.parameters().isEmpty());
        assertFalse(where.sql().contains("?"));
        assertEquals(ZoneOffset.UTC, raw.getContext().getTimeZone());
    }

    private static final class EmptyFragmentHandler implements FilterHandler {
        @Override
        public boolean canHandle(FilterCondition condition, FilterContext context) {
            return true;
        }

        @Override
        public SqlFragment process(FilterCondition condition, FilterContext context) {
            return SqlFragment.empty();
        }
    }
}
