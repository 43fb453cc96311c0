package io.github.filtersql.core.api;

import io.github.filtersql.core.exception.InvalidOperatorException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static io.github.filtersql.core.api.SemanticType.*;

/**
 * Closed set of filter operators understood by the compiler.
 * <p>
 * Each operator defines its wire code (the camelCase identifier used by forms, saved views and
 * widget configurations), the SQL symbol it compiles to, and the semantic column types it is
 * valid for. Codes are matched case-insensitively, and the human-readable aliases accepted in
 * URL properties ({@code equals}, {@code greaterThan}, {@code like}, {@code isNotNull}, ...) resolve to
 * the same constants.
 * </p>
 *
 * <p><strong>Operator Categories:</strong></p>
 * <pre>{@code
 * // Comparison
 * "price" > 100                 -> Operator.GT
 * "status" != 'archived'        -> Operator.NEQ
 *
 * // Range (two-part value)
 * "price" BETWEEN 10 AND 20     -> Operator.BETWEEN
 * "created_at" during thisWeek  -> Operator.DURING
 *
 * // Text matching
 * "name" ILIKE '%ann%'          -> Operator.CONTAINS
 *
 * // Date-specific aliases, mapped to comparisons
 * before -> lt, beforeOrOn -> lte, after -> gt, afterOrOn -> gte, during -> eq (range)
 *
 * // JSON
 * "meta" ? 'key'                -> Operator.HAS_KEY
 * "meta" @> '{"a":1}'           -> Operator.KEY_EQUALS
 * }</pre>
 *
 * @see io.github.filtersql.core.utils.OperatorMapper
 * @since 1.0.0
 */
public enum Operator {

    EQ("eq", "=", EnumSet.of(TEXT, NUMERIC, BOOLEAN, DATE, IDENTIFIER, ENUM), "equals"),
    NEQ("neq", "!=", EnumSet.of(TEXT, NUMERIC, BOOLEAN, DATE, IDENTIFIER, ENUM), "ne", "notequals"),

    GT("gt", ">", EnumSet.of(NUMERIC, DATE), "greaterthan"),
    GTE("gte", ">=", EnumSet.of(NUMERIC, DATE), "greaterthanorequal"),
    LT("lt", "<", EnumSet.of(NUMERIC, DATE), "lessthan"),
    LTE("lte", "<=", EnumSet.of(NUMERIC, DATE), "lessthanorequal"),

    BETWEEN("between", "BETWEEN", EnumSet.of(NUMERIC, DATE)),
    NOT_BETWEEN("notBetween", "NOT BETWEEN", EnumSet.of(NUMERIC, DATE)),

    CONTAINS("contains", "ILIKE", EnumSet.of(TEXT), "like", "ilike"),
    STARTS_WITH("startsWith", "ILIKE", EnumSet.of(TEXT)),
    ENDS_WITH("endsWith", "ILIKE", EnumSet.of(TEXT)),

    IN("in", "IN", EnumSet.of(TEXT, NUMERIC, IDENTIFIER, ENUM)),
    NOT_IN("notIn", "NOT IN", EnumSet.of(TEXT, NUMERIC, IDENTIFIER, ENUM)),

    IS_NULL("isNull", "IS NULL", EnumSet.allOf(SemanticType.class)),
    NOT_NULL("notNull", "IS NOT NULL", EnumSet.allOf(SemanticType.class), "isnotnull"),

    BEFORE("before", "<", EnumSet.of(DATE)),
    BEFORE_OR_ON("beforeOrOn", "<=", EnumSet.of(DATE)),
    AFTER("after", ">", EnumSet.of(DATE)),
    AFTER_OR_ON("afterOrOn", ">=", EnumSet.of(DATE)),
    DURING("during", "BETWEEN", EnumSet.of(DATE)),

    HAS_KEY("hasKey", "?", EnumSet.of(JSON)),
    KEY_EQUALS("keyEquals", "@>", EnumSet.of(JSON)),
    PATH_EXISTS("pathExists", "#>", EnumSet.of(JSON)),
    CONTAINS_TEXT("containsText", "ILIKE", EnumSet.of(JSON)),

    ARRAY_CONTAINS("arrayContains", "@>", EnumSet.of(ARRAY)),
    ARRAY_CONTAINED_BY("arrayContainedBy", "<@", EnumSet.of(ARRAY)),
    OVERLAPS("overlaps", "&&", EnumSet.of(ARRAY));

    private static final Map<String, Operator> LOOKUP = new HashMap<>();

    static {
        for (Operator op : values()) {
            LOOKUP.put(op.code.toLowerCase(Locale.ROOT), op);
            for (String alias : op.aliases) {
                LOOKUP.put(alias, op);
            }
        }
    }

    private final String code;
    private final String symbol;
    private final Set<SemanticType> supportedTypes;
    private final Set<String> aliases;

    Operator(String code, String symbol, EnumSet<SemanticType> supportedTypes, String... aliases) {
        this.code = code;
        this.symbol = symbol;
        this.supportedTypes = Collections.unmodifiableSet(supportedTypes);
        this.aliases = Set.copyOf(Arrays.asList(aliases));
    }

    /**
     * Returns the wire code of the operator, e.g. {@code "afterOrOn"}.
     *
     * @return the operator code
     */
    public String getCode() {
        return code;
    }

    /**
     * Returns the SQL symbol the operator compiles to, e.g. {@code ">="} or {@code "ILIKE"}.
     *
     * @return the SQL symbol
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return the immutable set of semantic types this operator is valid for
     */
    public Set<SemanticType> getSupportedTypes() {
        return supportedTypes;
    }

    /**
     * Checks whether the operator can be applied to a column of the given semantic type.
     *
     * @param type the resolved semantic type of the column
     * @return {@code true} if supported
     */
    public boolean supports(SemanticType type) {
        return supportedTypes.contains(type);
    }

    /**
     * Indicates whether this operator requires a filter value.
     *
     * @return {@code false} for {@link #IS_NULL} and {@link #NOT_NULL}, {@code true} otherwise
     */
    public boolean requiresValue() {
        return this != IS_NULL && this != NOT_NULL;
    }

    /**
     * Looks an operator up by its code or one of its aliases, ignoring case.
     *
     * @param value code or alias
     * @return the matching operator, or empty if none matches
     */
    public static Optional<Operator> find(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        return Optional.ofNullable(LOOKUP.get(value.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Finds an {@code Operator} by its code or one of its aliases, ignoring case.
     *
     * @param value code or alias string to search for
     * @return matching operator, never {@code null}
     * @throws InvalidOperatorException if nothing matches
     */
    public static Operator fromString(String value) {
        return find(value).orElseThrow(() -> InvalidOperatorException.unknown(value));
    }

    @Override
    public String toString() {
        return code;
    }
}
